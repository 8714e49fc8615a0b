package msawindows;

/**
 * Local aligner used to place a query sequence on the alignment consensus.
 */
public abstract class Aligner{

  int match;
  int mismatch;
  int gop;//gap open penalty
  int gep; //gap extension penalty

  /**
   * @param s1 query
   * @param s2 reference
   */
  public abstract Alignment align(byte[] s1, byte[] s2);

}
