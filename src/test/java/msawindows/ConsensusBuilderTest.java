package msawindows;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;

public class ConsensusBuilderTest{

  private static String consensus(String... seqs){
    AlignmentRecord[] records = new AlignmentRecord[seqs.length];
    for(int i = 0; i < seqs.length; i++){
      records[i] = new AlignmentRecord("seq" + i, seqs[i]);
    }
    return new String(ConsensusBuilder.buildConsensus(Arrays.asList(records)));
  }

  @Test
  public void takesMajoritySymbol(){
    Assert.assertEquals("AACCGGTTAA", consensus("AACCGGTTAA", "AACCGGTTAA", "AACCGGTTGG"));
  }

  @Test
  public void countsGapsAndMissingAsSymbols(){
    Assert.assertEquals("-N", consensus("-N", "-N", "AC"));
  }

  @Test
  public void ignoresNonStandardSymbols(){
    Assert.assertEquals("G", consensus("Y", "Y", "G"));
  }

  @Test
  public void columnWithoutStandardSymbolsIsMissing(){
    Assert.assertEquals("NA", consensus("YA", "SA", "RA"));
  }

  @Test
  public void tiesGoToLowestCharacterCode(){
    Assert.assertEquals("A", consensus("C", "A"));
    Assert.assertEquals("A", consensus("a", "A"));
    Assert.assertEquals("-", consensus("T", "-"));
    Assert.assertEquals("C", consensus("T", "c", "C", "T", "C", "c"));
  }

  @Test
  public void tieBreakDoesNotDependOnRecordOrder(){
    Assert.assertEquals(consensus("GT", "TG"), consensus("TG", "GT"));
  }

  @Test
  public void consensusLengthMatchesAlignment() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(">s1\nACGTRYN-acgt\n>s2\nAYGTRYNNacgk\n");
    String consensus = alignment.getConsensus();
    Assert.assertEquals(alignment.alignmentLength(), consensus.length());
    for(int i = 0; i < consensus.length(); i++){
      Assert.assertTrue(Constants.isConsensusSymbol((byte)consensus.charAt(i)));
    }
  }

}
