package msawindows;

/**
 * A window sequence and the number of alignment records carrying it.
 */
public class UniqueSequence implements Comparable<UniqueSequence>{

  public final String seq;
  public final int count;

  UniqueSequence(String seq, int count){
    this.seq = seq;
    this.count = count;
  }

  /**
   * Larger counts first
   */
  @Override
  public int compareTo(UniqueSequence o){
    return Integer.compare(o.count, count);
  }

  @Override
  public String toString(){
    return seq + "\t" + count;
  }

}
