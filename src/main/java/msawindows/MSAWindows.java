package msawindows;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;

import java.io.IOException;
import java.io.PrintWriter;

public class MSAWindows{

  public static void main(String[] args){
    System.exit(run(args));
  }

  static int run(String[] args){
    ArgumentParser parser = ArgumentParsers.newFor("java -jar msawindows.jar").build();
    Subparsers subparsers = parser.addSubparsers().title("subcommands").help("description:").dest("command").metavar("COMMAND");

    Subparser parserWindow = subparsers.addParser("window").help("reports unique sequences in an alignment window " +
        "given by position or by a query sequence");
    WindowReporter.addParameters(parserWindow);
    Subparser parserScan = subparsers.addParser("scan").help("counts unique sequences in windows sliding along " +
        "the alignment");
    HomozygosityRunFinder.addParameters(parserScan);
    if(args.length == 0){
      parser.printUsage();
      return 1;
    }
    Namespace parsedArgs;
    try{
      parsedArgs = parser.parseArgs(args);
    }catch(HelpScreenException e){
      return 0;
    }catch(ArgumentParserException e){
      parser.handleError(e);
      return 1;
    }
    String command = parsedArgs.getString("command");
    if(command == null){
      parser.printUsage();
      return 1;
    }
    ArgumentParser commandParser = command.equals("window") ? parserWindow : parserScan;
    try{
      if(command.equals("window")){
        WindowReporter.run(parsedArgs);
      }else{
        HomozygosityRunFinder.run(parsedArgs);
      }
    }catch(ConfigurationException | IOException | AlignmentCoordinatesException | RuntimeException e){
      PrintWriter err = new PrintWriter(System.err, true);
      err.println("ERROR: " + e.getMessage());
      commandParser.printHelp(err);
      return 1;
    }
    return 0;
  }

}
