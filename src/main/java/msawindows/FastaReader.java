package msawindows;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;

/**
 * Reads FASTA records. Sequence lines are concatenated without separators, blank lines are skipped.
 */
class FastaReader{

  private static final char MARKER = '>';

  static ArrayList<AlignmentRecord> read(BufferedReader reader, String source) throws IOException{
    ArrayList<AlignmentRecord> res = new ArrayList<>();
    String line = reader.readLine();
    while(line != null && isBlank(line)){
      line = reader.readLine();
    }
    if(line == null){
      throw new AlignmentFormatException("All lines in " + source + " are empty");
    }
    if(line.charAt(0) != MARKER){
      throw new AlignmentFormatException("File " + source +
          " does not appear to be a FASTA file (no > on the first line)");
    }
    String header = parseHeader(line, source);
    StringBuilder builder = new StringBuilder();
    for(line = reader.readLine(); line != null; line = reader.readLine()){
      if(isBlank(line)){
        continue;
      }
      if(line.charAt(0) == MARKER){
        res.add(new AlignmentRecord(header, builder.toString()));
        header = parseHeader(line, source);
        builder = new StringBuilder();
      }else{
        builder.append(line);
      }
    }
    res.add(new AlignmentRecord(header, builder.toString()));
    return res;
  }

  static ArrayList<AlignmentRecord> read(String path) throws IOException{
    try(BufferedReader reader = new BufferedReader(new FileReader(path))){
      return read(reader, path);
    }
  }

  /**
   * Sequence of the first record in the file
   */
  static String readQuery(String path) throws IOException{
    return read(path).get(0).getSequence();
  }

  private static String parseHeader(String line, String source) throws AlignmentFormatException{
    int i = 1;
    while(i < line.length() && line.charAt(i) == ' '){
      i++;
    }
    if(i == line.length()){
      throw new AlignmentFormatException("Some non-space characters required in a FASTA header in " + source);
    }
    return line.substring(i);
  }

  private static boolean isBlank(String line){
    return line.trim().isEmpty();
  }

}
