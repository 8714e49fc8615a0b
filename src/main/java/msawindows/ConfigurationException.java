package msawindows;

/**
 * Thrown when a required parameter is missing from both the command line and the config file,
 * or has a value of the wrong kind.
 */
public class ConfigurationException extends Exception{

  public ConfigurationException(String message){
    super(message);
  }

  public ConfigurationException(String message, Throwable cause){
    super(message, cause);
  }

}
