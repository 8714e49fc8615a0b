package msawindows;

/**
 * Counts of the distinct sequences in one window of a diversity scan.
 */
public class WindowDiversity{

  /**
   * 0-based window start
   */
  public final int start;
  public final int[] counts;

  WindowDiversity(int start, int[] counts){
    this.start = start;
    this.counts = counts;
  }

  /**
   * Number of distinct sequences in the window
   */
  public int getUniqueNumber(){
    return counts.length;
  }

}
