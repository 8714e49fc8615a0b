package msawindows;

/**
 * Nucleotide alphabets shared by the alignment analysis classes.
 */
public class Constants{

  static final byte MISSING = (byte)'N';

  /**
   * Symbols counted when voting for a consensus column
   */
  static boolean[] consensusSymbols;
  static{
    consensusSymbols = new boolean[128];
    for(byte b: "AaCcTtGgNn-".getBytes()){
      consensusSymbols[b] = true;
    }
  }

  /**
   * Symbols kept as is by missing data imputation, N/n are not among them
   */
  static boolean[] observedSymbols;
  static{
    observedSymbols = new boolean[128];
    for(byte b: "AaCcTtGg-".getBytes()){
      observedSymbols[b] = true;
    }
  }

  static boolean isConsensusSymbol(byte b){
    return b >= 0 && consensusSymbols[b];
  }

  static boolean isObservedSymbol(byte b){
    return b >= 0 && observedSymbols[b];
  }

}
