package msawindows;

import java.io.IOException;

/**
 * Thrown when an alignment or query file is not a well formed FASTA alignment.
 */
public class AlignmentFormatException extends IOException{

  public AlignmentFormatException(String message){
    super(message);
  }

}
