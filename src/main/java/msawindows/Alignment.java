package msawindows;

/**
 * Best local alignment of two sequences. Coordinates are 0-based, ends exclusive.
 */
public class Alignment{

  /**
   * Alignment score
   */
  public int score;

  /**
   * Alignment location in sequence #1 (the query)
   */
  public int start1;
  public int end1;

  /**
   * Alignment location in sequence #2 (the reference)
   */
  public int start2;
  public int end2;

  public Alignment(){
  }

  public Alignment(int start1, int end1, int start2, int end2){
    this.start1 = start1;
    this.end1 = end1;
    this.start2 = start2;
    this.end2 = end2;
  }

}
