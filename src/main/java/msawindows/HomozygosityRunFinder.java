package msawindows;

import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.List;

/**
 * Scans the alignment with a sliding window and writes the counts of distinct sequences in every window.
 */
public class HomozygosityRunFinder{

  private String inputPath;
  private int windowSize;
  private int stepSize;
  private boolean imputeMissing;
  private String outPath;
  Logger logger;

  HomozygosityRunFinder(Document document, Namespace parsedArgs) throws ConfigurationException, IOException{
    Element element = document.getRootElement().getChild("Scan");
    inputPath = Parameters.getString(parsedArgs, "input_file", null, null);
    outPath = Parameters.getString(parsedArgs, "out_file", null, null);
    windowSize = Parameters.getInt(parsedArgs, "window_size", element, "WindowSize");
    if(windowSize <= 0){
      throw new ConfigurationException("Window size must be > 0");
    }
    stepSize = Parameters.getInt(parsedArgs, "step_size", element, "StepSize");
    if(stepSize <= 0){
      throw new ConfigurationException("Step size must be > 0");
    }
    imputeMissing = Parameters.getFlag(parsedArgs, "impute_missing", document.getRootElement(), "ImputeMissing");
    logger = Logger.getInstance(document);
  }

  void scan() throws IOException{
    long time = System.currentTimeMillis();
    FastaAlignment alignment = FastaAlignment.read(inputPath);
    logger.printAlignmentSummary(inputPath, alignment);
    if(imputeMissing){
      int replaced = new MissingDataImputer(alignment).imputeMissing();
      logger.printf("Imputed missing symbols: %d\n", replaced);
    }
    logger.printf("Window size %d, step size %d\n", windowSize, stepSize);
    List<WindowDiversity> windows = new DiversityScanner(alignment).diversityInWindows(windowSize, stepSize);
    logger.printScanSummary(windows);
    try(BufferedWriter writer = new BufferedWriter(new FileWriter(outPath))){
      new DiversityPrinter().print(windows, writer);
    }
    logger.printf("Time: %d, ms\n", System.currentTimeMillis() - time);
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Slides a window along the alignment and counts how many times each unique sequence " +
        "occurs in every window position. Windows with few unique sequences mark low diversity regions. " +
        "Parameters not given on the command line are taken from the config file.");
    parser.addArgument("-c").dest("config_file").help("Path to config file, the bundled default is used if absent");
    parser.addArgument("-i").dest("input_file").help("Path to the alignment in FASTA format").required(true);
    parser.addArgument("-w").dest("window_size").help("Window size");
    parser.addArgument("-s").dest("step_size").help("Step size");
    parser.addArgument("--impute-missing").dest("impute_missing").action(Arguments.storeTrue())
        .help("Replace missing nucleotides with the consensus ones.");
    parser.addArgument("-o").dest("out_file").help("Path to output file").required(true);
  }

  static void run(Namespace parsedArgs) throws ConfigurationException, IOException{
    Document document = Parameters.loadConfig(parsedArgs.getString("config_file"));
    HomozygosityRunFinder finder = new HomozygosityRunFinder(document, parsedArgs);
    finder.scan();
  }

}
