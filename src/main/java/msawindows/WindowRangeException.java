package msawindows;

/**
 * Thrown when a window addresses positions outside of the alignment.
 */
public class WindowRangeException extends IndexOutOfBoundsException{

  public WindowRangeException(String message){
    super(message);
  }

}
