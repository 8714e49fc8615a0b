package msawindows;

import org.jdom2.Document;
import org.jdom2.Element;

/**
 * Smith-Waterman local alignment with Gotoh affine gap penalties.
 *
 * <p>Only match coordinates are reported, so no traceback matrix is kept. A forward pass over two
 * score rows finds where the best match ends, then the same pass run backwards from that cell over the
 * reversed prefixes finds where it starts. Memory is linear in the reference length.
 */
class SmithWatermanGotoh extends Aligner{

  private static final int NEGATIVE_INFINITY = Integer.MIN_VALUE/2;

  SmithWatermanGotoh(int match, int mismatch, int gop, int gep){
    this.match = match;
    this.mismatch = mismatch;
    this.gop = gop;
    this.gep = gep;
  }

  SmithWatermanGotoh(Document document) throws ConfigurationException{
    Element element = Parameters.getSection(document, "Aligner");
    match = Parameters.getInt(element, "Match");
    mismatch = Parameters.getInt(element, "Mismatch");
    gop = Parameters.getInt(element, "GapOpenPenalty");
    gep = Parameters.getInt(element, "GapExtensionPenalty");
  }

  /**
   * Cell of the score matrix, row and col count aligned symbols of s1 and s2
   */
  private static class Cell{
    int row;
    int col;
    int score;
  }

  @Override
  public Alignment align(byte[] s1, byte[] s2){
    Cell end = fill(s1, s1.length, s2, s2.length, false, Integer.MAX_VALUE);
    Alignment alignment = new Alignment();
    alignment.score = end.score;
    alignment.end1 = end.row;
    alignment.end2 = end.col;
    if(end.score == 0){
      alignment.start1 = end.row;
      alignment.start2 = end.col;
      return alignment;
    }
    // every match reaching the best score inside the prefixes ends exactly at the end cell
    Cell start = fill(s1, end.row, s2, end.col, true, end.score);
    alignment.start1 = end.row - start.row;
    alignment.start2 = end.col - start.col;
    return alignment;
  }

  /**
   * Local alignment scores of s1[0, len1) against s2[0, len2), read backwards when reversed is set.
   *
   * @param target stop at the first cell scoring at least this much
   * @return first cell in row order holding the best score
   */
  private Cell fill(byte[] s1, int len1, byte[] s2, int len2, boolean reversed, int target){
    int[] v = new int[len2 + 1]; // best score of alignment ending at (i, j)
    int[] g = new int[len2 + 1]; // best score ending with s1[i - 1] against a gap
    for(int j = 0; j <= len2; j++){
      g[j] = NEGATIVE_INFINITY;
    }
    Cell best = new Cell();
    for(int i = 1; i <= len1; i++){
      byte a = reversed ? s1[len1 - i] : s1[i - 1];
      int h = NEGATIVE_INFINITY; // best score ending with s2[j - 1] against a gap
      int vDiagonal = 0;
      for(int j = 1; j <= len2; j++){
        byte b = reversed ? s2[len2 - j] : s2[j - 1];
        int f = vDiagonal + (a == b ? match : mismatch);
        g[j] = Math.max(g[j] - gep, v[j] - gop);
        h = Math.max(h - gep, v[j - 1] - gop);
        vDiagonal = v[j];
        int score = Math.max(Math.max(f, 0), Math.max(g[j], h));
        v[j] = score;
        if(score > best.score){
          best.row = i;
          best.col = j;
          best.score = score;
          if(score >= target){
            return best;
          }
        }
      }
    }
    return best;
  }

}
