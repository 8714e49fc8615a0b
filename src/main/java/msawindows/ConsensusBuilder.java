package msawindows;

import java.util.List;

/**
 * Majority vote consensus of an alignment.
 */
class ConsensusBuilder extends Constants{

  /**
   * For every column counts the standard symbols (A, C, G, T, N in either case and gap) and
   * takes the most frequent one. Ties go to the symbol with the lowest character code, so
   * gap wins over upper case letters and upper case over lower case. A column with no
   * standard symbol gets N.
   */
  static byte[] buildConsensus(List<AlignmentRecord> records){
    int length = records.get(0).length();
    byte[] consensus = new byte[length];
    int[] counts = new int[128];
    for(int i = 0; i < length; i++){
      for(AlignmentRecord record: records){
        byte b = record.seq[i];
        if(isConsensusSymbol(b)){
          counts[b]++;
        }
      }
      int maxCount = 0;
      byte maxSymbol = MISSING;
      for(int c = 0; c < counts.length; c++){
        if(counts[c] > maxCount){
          maxCount = counts[c];
          maxSymbol = (byte)c;
        }
        counts[c] = 0;
      }
      consensus[i] = maxSymbol;
    }
    return consensus;
  }

}
