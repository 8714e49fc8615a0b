package msawindows;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a diversity scan as two columns: 1-based window start and the count of each distinct sequence in it.
 */
class DiversityPrinter{

  void print(List<WindowDiversity> windows, Writer writer) throws IOException{
    for(WindowDiversity window: windows){
      for(int count: window.counts){
        writer.write((window.start + 1) + "\t" + count + "\n");
      }
    }
  }

}
