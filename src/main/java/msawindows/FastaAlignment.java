package msawindows;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multiple sequence alignment held in memory, records in file order.
 * All sequences have the same length, and there are at least two of them.
 * The consensus is built once, right after the records are validated, and
 * is not rebuilt when {@link MissingDataImputer} rewrites the records.
 */
public class FastaAlignment{

  private final ArrayList<AlignmentRecord> records;
  private final byte[] consensus;

  FastaAlignment(ArrayList<AlignmentRecord> records, String source) throws AlignmentFormatException{
    if(records.size() < 2){
      throw new AlignmentFormatException("Alignment file " + source + " must have at least two sequence records");
    }
    int length = records.get(0).length();
    for(AlignmentRecord record: records){
      if(record.length() != length){
        throw new AlignmentFormatException("All sequences in file " + source + " must be the same length, " +
            record.header + " has " + record.length() + " instead of " + length);
      }
    }
    this.records = records;
    consensus = ConsensusBuilder.buildConsensus(records);
  }

  public static FastaAlignment read(String path) throws IOException{
    return new FastaAlignment(FastaReader.read(path), path);
  }

  public static FastaAlignment parse(BufferedReader reader, String source) throws IOException{
    return new FastaAlignment(FastaReader.read(reader, source), source);
  }

  public int sequenceNumber(){
    return records.size();
  }

  public int alignmentLength(){
    return records.get(0).length();
  }

  List<AlignmentRecord> getRecords(){
    return Collections.unmodifiableList(records);
  }

  byte[] getConsensusBytes(){
    return consensus;
  }

  public String getConsensus(){
    return new String(consensus, StandardCharsets.US_ASCII);
  }

}
