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
 * Reports the distinct sequences of one alignment window, given either by its position or by a query
 * sequence whose best match on the consensus defines the window.
 */
public class WindowReporter{

  private String inputPath;
  private String queryPath;
  private int startPosition;
  private int windowSize;
  private boolean imputeMissing;
  private String outPath;
  private UniqueSequencePrinter printer;
  private Aligner aligner;
  Logger logger;

  WindowReporter(Document document, Namespace parsedArgs) throws ConfigurationException, IOException{
    Element element = document.getRootElement().getChild("Window");
    inputPath = Parameters.getString(parsedArgs, "input_file", null, null);
    outPath = Parameters.getString(parsedArgs, "out_file", null, null);
    queryPath = parsedArgs.getString("query_sequence");
    imputeMissing = Parameters.getFlag(parsedArgs, "impute_missing", document.getRootElement(), "ImputeMissing");
    printer = new UniqueSequencePrinter(Parameters.getString(parsedArgs, "out_format", element, "OutFormat"));
    if(queryPath == null){
      windowSize = Parameters.getInt(parsedArgs, "window_size", element, "WindowSize");
      if(windowSize <= 0){
        throw new ConfigurationException("Window size must be > 0");
      }
      startPosition = Parameters.getInt(parsedArgs, "start_position", element, "StartPosition");
      if(startPosition < 1){
        throw new ConfigurationException("Start position must be 1 or greater");
      }
    }else{
      aligner = new SmithWatermanGotoh(document);
    }
    logger = Logger.getInstance(document);
  }

  void report() throws IOException, AlignmentCoordinatesException{
    long time = System.currentTimeMillis();
    FastaAlignment alignment = FastaAlignment.read(inputPath);
    logger.printAlignmentSummary(inputPath, alignment);
    if(imputeMissing){
      int replaced = new MissingDataImputer(alignment).imputeMissing();
      logger.printf("Imputed missing symbols: %d\n", replaced);
    }
    WindowExtractor extractor = new WindowExtractor(alignment);
    String query = null;
    AlignmentStatistics stats = null;
    int start = startPosition - 1;
    int size = windowSize;
    if(queryPath != null){
      String querySequence = FastaReader.readQuery(queryPath);
      stats = new QueryLocalizer(alignment, aligner).localize(querySequence);
      logger.printf("Query %s of length %d matched: %s\n", queryPath, querySequence.length(), stats);
      start = stats.referenceStart;
      size = stats.referenceLength;
      query = QueryLocalizer.matchedQuery(querySequence, stats);
    }
    String consensusWindow = extractor.extractConsensusWindow(start, size);
    UniqueSequenceTable table = extractor.extractWindow(start, size);
    logger.printWindowSummary(start, size, table);
    List<UniqueSequence> sorted = table.sorted();
    try(BufferedWriter writer = new BufferedWriter(new FileWriter(outPath))){
      printer.print(sorted, consensusWindow, query, stats, writer);
    }
    logger.printf("Time: %d, ms\n", System.currentTimeMillis() - time);
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Extracts a window of the alignment and reports the unique sequences found in it " +
        "along with the number of times each of them occurs. The window is given by its start and size or " +
        "found as the best local match of a query sequence to the alignment consensus. Parameters not given " +
        "on the command line are taken from the config file.");
    parser.addArgument("-c").dest("config_file").help("Path to config file, the bundled default is used if absent");
    parser.addArgument("-i").dest("input_file").help("Path to the alignment in FASTA format").required(true);
    parser.addArgument("-s").dest("start_position").help("Window start position, 1-based");
    parser.addArgument("-w").dest("window_size").help("Window size");
    parser.addArgument("-q").dest("query_sequence").help("FASTA file with a query sequence. The window " +
        "containing its best match is extracted, start position and window size are ignored.");
    parser.addArgument("--impute-missing").dest("impute_missing").action(Arguments.storeTrue())
        .help("Replace missing nucleotides with the consensus ones.");
    parser.addArgument("-f").dest("out_format").help("Output format: FASTA or TAB, case-insensitive");
    parser.addArgument("-o").dest("out_file").help("Path to output file").required(true);
  }

  static void run(Namespace parsedArgs) throws ConfigurationException, IOException, AlignmentCoordinatesException{
    Document document = Parameters.loadConfig(parsedArgs.getString("config_file"));
    WindowReporter reporter = new WindowReporter(document, parsedArgs);
    reporter.report();
  }

}
