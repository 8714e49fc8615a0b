package msawindows;

import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Lookups in the XML config file and the parsed command line.
 * Values given on the command line win over the ones in the config file.
 */
class Parameters{

  static final String DEFAULT_CONFIG = "/config.xml";

  /**
   * Reads the config from the given path, or the bundled default config when path is null
   */
  static Document loadConfig(String path) throws ConfigurationException{
    SAXBuilder jdomBuilder = new SAXBuilder();
    try{
      if(path != null){
        return jdomBuilder.build(new File(path));
      }
      try(InputStream in = Parameters.class.getResourceAsStream(DEFAULT_CONFIG)){
        if(in == null){
          throw new ConfigurationException("Default config " + DEFAULT_CONFIG + " not found on the classpath");
        }
        return jdomBuilder.build(in);
      }
    }catch(JDOMException | IOException e){
      throw new ConfigurationException("Can't read config file " + (path == null ? DEFAULT_CONFIG : path) +
          ": " + e.getMessage(), e);
    }
  }

  static Element getSection(Document document, String name) throws ConfigurationException{
    Element element = document.getRootElement().getChild(name);
    if(element == null){
      throw new ConfigurationException("Section <" + name + "> is missing in config file");
    }
    return element;
  }

  static String getString(Element element, String name) throws ConfigurationException{
    String value = element == null ? null : element.getChildTextTrim(name);
    if(value == null){
      throw new ConfigurationException("Parameter <" + name + "> is missing in config file");
    }
    return value;
  }

  static int getInt(Element element, String name) throws ConfigurationException{
    return parseInt(name, getString(element, name));
  }

  static String getString(Namespace parsedArgs, String dest, Element element, String name)
      throws ConfigurationException{
    String value = parsedArgs.getString(dest);
    if(value == null){
      value = element == null ? null : element.getChildTextTrim(name);
    }
    if(value == null || value.isEmpty()){
      throw new ConfigurationException("Parameter " + dest + " is required");
    }
    return value;
  }

  static int getInt(Namespace parsedArgs, String dest, Element element, String name) throws ConfigurationException{
    return parseInt(dest, getString(parsedArgs, dest, element, name));
  }

  /**
   * A flag set on the command line, otherwise the boolean value from the config file, false if absent
   */
  static boolean getFlag(Namespace parsedArgs, String dest, Element element, String name){
    Boolean flag = parsedArgs.getBoolean(dest);
    if(flag != null && flag){
      return true;
    }
    return element != null && Boolean.parseBoolean(element.getChildTextTrim(name));
  }

  private static int parseInt(String name, String value) throws ConfigurationException{
    try{
      return Integer.parseInt(value);
    }catch(NumberFormatException e){
      throw new ConfigurationException("Parameter " + name + " must be an integer, got '" + value + "'", e);
    }
  }

}
