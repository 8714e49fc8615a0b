package msawindows;

/**
 * Replaces missing or ambiguous nucleotides (N, Y, S and so on) with the consensus symbol of their column.
 */
public class MissingDataImputer extends Constants{

  private final FastaAlignment alignment;

  public MissingDataImputer(FastaAlignment alignment){
    this.alignment = alignment;
  }

  /**
   * Rewrites the alignment records in place. The consensus itself is left as it was built
   * from the original data.
   *
   * @return number of replaced symbols
   */
  public int imputeMissing(){
    byte[] consensus = alignment.getConsensusBytes();
    int replaced = 0;
    for(AlignmentRecord record: alignment.getRecords()){
      byte[] seq = record.seq;
      for(int i = 0; i < seq.length; i++){
        if(!isObservedSymbol(seq[i]) && seq[i] != consensus[i]){
          seq[i] = consensus[i];
          replaced++;
        }
      }
    }
    return replaced;
  }

}
