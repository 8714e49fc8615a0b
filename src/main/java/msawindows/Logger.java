package msawindows;

import org.jdom2.Document;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Run log written to log.txt in the output folder from the config file.
 */
class Logger{

  String outPath;
  private PrintStream writer;

  private static Logger instance;

  private Logger(String outPath) throws IOException{
    this.outPath = outPath;
    String folder = outPath.isEmpty() ? System.getProperty("user.dir") : outPath;
    File outFolder = new File(folder);
    if(!outFolder.exists() && !outFolder.mkdirs()){
      throw new IOException("Can't create output folder " + folder);
    }
    writer = new PrintStream(new FileOutputStream(new File(outFolder, "log.txt")), true);
  }

  static Logger getInstance(Document document) throws IOException{
    String outPath = document.getRootElement().getChildTextTrim("OutPath");
    if(outPath == null){
      outPath = "";
    }
    if(instance == null){
      instance = new Logger(outPath);
    }else if(!instance.outPath.equals(outPath)){
      instance.close();
      instance = new Logger(outPath);
    }
    return instance;
  }

  void printf(String s, Object... args){
    writer.printf(s, args);
  }

  void println(String s){
    writer.println(s);
  }

  void close(){
    writer.close();
  }

  void printAlignmentSummary(String path, FastaAlignment alignment){
    printf("Alignment %s: %d sequences of length %d\n", path, alignment.sequenceNumber(),
        alignment.alignmentLength());
  }

  void printWindowSummary(int start, int size, UniqueSequenceTable table){
    printf("Window start %d size %d: %d unique sequences in %d records\n", start + 1, size, table.size(),
        table.totalCount());
  }

  void printScanSummary(List<WindowDiversity> windows){
    int minUnique = Integer.MAX_VALUE;
    int maxUnique = 0;
    for(WindowDiversity window: windows){
      minUnique = Math.min(minUnique, window.getUniqueNumber());
      maxUnique = Math.max(maxUnique, window.getUniqueNumber());
    }
    if(windows.isEmpty()){
      println("No windows fit into the alignment");
    }else{
      printf("Windows scanned: %d, unique sequences per window from %d to %d\n", windows.size(), minUnique,
          maxUnique);
    }
  }

}
