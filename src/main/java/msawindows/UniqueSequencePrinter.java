package msawindows;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * Writes the distinct sequences of a window, most frequent first, as a TAB table or as FASTA records.
 */
class UniqueSequencePrinter{

  static final String TAB = "tab";
  static final String FASTA = "fasta";

  private final String format;

  UniqueSequencePrinter(String format) throws ConfigurationException{
    this.format = format.toLowerCase(Locale.ROOT);
    if(!this.format.equals(TAB) && !this.format.equals(FASTA)){
      throw new ConfigurationException("Unknown output format '" + format + "', should be TAB or FASTA");
    }
  }

  void print(List<UniqueSequence> sequences, String consensusWindow, Writer writer) throws IOException{
    print(sequences, consensusWindow, null, null, writer);
  }

  /**
   * @param query matched part of the query or null
   * @param stats match coordinates, used with FASTA output when query is not null
   */
  void print(List<UniqueSequence> sequences, String consensusWindow, String query, AlignmentStatistics stats,
             Writer writer) throws IOException{
    if(format.equals(TAB)){
      if(query != null){
        writer.write(query + "\tquery\n");
      }
      for(UniqueSequence seq: sequences){
        writer.write(maskMatches(seq.seq, consensusWindow) + "\t" + seq.count + "\n");
      }
    }else{
      if(query != null){
        writer.write(String.format(">query ref_start=%d ref_length=%d query_start=%d query_length=%d\n",
            stats.referenceStart + 1, stats.referenceLength, stats.queryStart + 1, stats.queryLength));
        writer.write(query + "\n");
      }
      int k = 1;
      for(UniqueSequence seq: sequences){
        writer.write(">variant" + k + " count=" + seq.count + "\n");
        writer.write(seq.seq + "\n");
        k++;
      }
    }
  }

  /**
   * Positions equal to the consensus become '.', the rest keep their symbols
   */
  static String maskMatches(String seq, String consensus){
    char[] res = seq.toCharArray();
    int len = Math.min(res.length, consensus.length());
    for(int i = 0; i < len; i++){
      if(res[i] == consensus.charAt(i)){
        res[i] = '.';
      }
    }
    return new String(res);
  }

}
