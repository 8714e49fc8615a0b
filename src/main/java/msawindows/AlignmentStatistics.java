package msawindows;

/**
 * Coordinates of a query match on the consensus. Starts are 0-based.
 */
public class AlignmentStatistics{

  public final int referenceStart;
  public final int referenceLength;
  public final int queryStart;
  public final int queryLength;

  AlignmentStatistics(int referenceStart, int referenceLength, int queryStart, int queryLength){
    this.referenceStart = referenceStart;
    this.referenceLength = referenceLength;
    this.queryStart = queryStart;
    this.queryLength = queryLength;
  }

  @Override
  public String toString(){
    return String.format("reference start = %d length = %d, query start = %d length = %d",
        referenceStart, referenceLength, queryStart, queryLength);
  }

}
