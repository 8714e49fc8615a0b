package msawindows;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;

class TestAlignments{

  /**
   * Three records of length 10, the last one differs in the two final columns
   */
  static final String SMALL = ">seq1\nAACCGGTTAA\n>seq2\nAACCGGTTAA\n>seq3\nAACCGGTTGG\n";

  static FastaAlignment parse(String fasta) throws IOException{
    return FastaAlignment.parse(new BufferedReader(new StringReader(fasta)), "test");
  }

  static FastaAlignment small() throws IOException{
    return parse(SMALL);
  }

  static String resourcePath(String name){
    try{
      return new File(TestAlignments.class.getResource("/" + name).toURI()).getPath();
    }catch(URISyntaxException e){
      throw new IllegalStateException("Bad resource location for " + name, e);
    }
  }

}
