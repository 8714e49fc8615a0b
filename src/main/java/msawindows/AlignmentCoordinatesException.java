package msawindows;

/**
 * Thrown when the local aligner reports coordinates that do not form a valid match.
 */
public class AlignmentCoordinatesException extends Exception{

  public AlignmentCoordinatesException(String message){
    super(message);
  }

}
