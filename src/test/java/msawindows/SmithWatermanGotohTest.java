package msawindows;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class SmithWatermanGotohTest{

  private final SmithWatermanGotoh aligner = new SmithWatermanGotoh(2, -2, 3, 1);

  private static byte[] repeat(char c, int times){
    byte[] res = new byte[times];
    Arrays.fill(res, (byte)c);
    return res;
  }

  private static byte[] concat(byte[]... parts){
    int len = 0;
    for(byte[] part: parts){
      len += part.length;
    }
    byte[] res = new byte[len];
    int pos = 0;
    for(byte[] part: parts){
      System.arraycopy(part, 0, res, pos, part.length);
      pos += part.length;
    }
    return res;
  }

  @Test
  public void findsExactSubstring(){
    Alignment aln = aligner.align("GGTT".getBytes(), "AACCGGTTAA".getBytes());
    Assert.assertEquals(8, aln.score);
    Assert.assertEquals(0, aln.start1);
    Assert.assertEquals(4, aln.end1);
    Assert.assertEquals(4, aln.start2);
    Assert.assertEquals(8, aln.end2);
  }

  @Test
  public void toleratesMismatchInsideMatch(){
    Alignment aln = aligner.align("CCGATTAA".getBytes(), "TTTCCGGTTAATTT".getBytes());
    Assert.assertEquals(12, aln.score);
    Assert.assertEquals(0, aln.start1);
    Assert.assertEquals(8, aln.end1);
    Assert.assertEquals(3, aln.start2);
    Assert.assertEquals(11, aln.end2);
  }

  @Test
  public void bridgesGapInQuery(){
    // the reference has six extra bases in the middle
    String left = "ACGTTGCA";
    String right = "TGCATGCC";
    Alignment aln = aligner.align((left + right).getBytes(), ("GG" + left + "AAAAAA" + right + "GG").getBytes());
    Assert.assertEquals(24, aln.score);
    Assert.assertEquals(0, aln.start1);
    Assert.assertEquals(16, aln.end1);
    Assert.assertEquals(2, aln.start2);
    Assert.assertEquals(24, aln.end2);
  }

  @Test
  public void bridgesGapLongerThanShortRange(){
    SmithWatermanGotoh highMatch = new SmithWatermanGotoh(500, -2, 3, 1);
    byte[] left = new byte[100];
    byte[] right = new byte[100];
    for(int i = 0; i < 100; i++){
      left[i] = (byte)"ACGG".charAt(i % 4);
      right[i] = (byte)"GGCA".charAt(i % 4);
    }
    Alignment aln = highMatch.align(concat(left, right), concat(left, repeat('T', 40000), right));
    Assert.assertEquals(200*500 - 3 - 39999, aln.score);
    Assert.assertEquals(0, aln.start1);
    Assert.assertEquals(200, aln.end1);
    Assert.assertEquals(0, aln.start2);
    Assert.assertEquals(40200, aln.end2);
  }

  @Test
  public void alignsQueryAndReferenceBeyondIntMatrixSize(){
    // 46341 * 46346 cells would not fit into one int indexed matrix
    byte[] query = repeat('A', 46341);
    byte[] reference = concat(repeat('C', 5), repeat('A', 46341));
    Alignment aln = aligner.align(query, reference);
    Assert.assertEquals(2*46341, aln.score);
    Assert.assertEquals(0, aln.start1);
    Assert.assertEquals(46341, aln.end1);
    Assert.assertEquals(5, aln.start2);
    Assert.assertEquals(46346, aln.end2);
  }

  @Test
  public void nothingInCommonGivesEmptyMatch(){
    Alignment aln = aligner.align("AAAA".getBytes(), "CCCCCC".getBytes());
    Assert.assertEquals(0, aln.score);
    Assert.assertEquals(aln.start1, aln.end1);
    Assert.assertEquals(aln.start2, aln.end2);
  }

}
