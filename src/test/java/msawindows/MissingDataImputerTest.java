package msawindows;

import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

public class MissingDataImputerTest{

  private static final String WITH_MISSING = ">s1\nACGTAC\n>s2\nACGTAC\n>s3\nNYGT-k\n";

  @Test
  public void replacesMissingWithConsensus() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(WITH_MISSING);
    int replaced = new MissingDataImputer(alignment).imputeMissing();
    List<AlignmentRecord> records = alignment.getRecords();
    Assert.assertEquals("ACGT-C", records.get(2).getSequence());
    Assert.assertEquals(3, replaced);
  }

  @Test
  public void leavesStandardSymbols() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(">s1\nAaCc\n>s2\nTtGg\n>s3\n-tGg\n");
    Assert.assertEquals(0, new MissingDataImputer(alignment).imputeMissing());
    Assert.assertEquals("AaCc", alignment.getRecords().get(0).getSequence());
    Assert.assertEquals("-tGg", alignment.getRecords().get(2).getSequence());
  }

  @Test
  public void missingColumnStaysMissing() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(">s1\nAY\n>s2\nAS\n");
    new MissingDataImputer(alignment).imputeMissing();
    Assert.assertEquals("AN", alignment.getRecords().get(0).getSequence());
    Assert.assertEquals("AN", alignment.getRecords().get(1).getSequence());
  }

  @Test
  public void secondPassChangesNothing() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(">s1\nAYNn\n>s2\nARNn\n>s3\nCRNK\n");
    MissingDataImputer imputer = new MissingDataImputer(alignment);
    imputer.imputeMissing();
    String[] first = new String[3];
    for(int i = 0; i < 3; i++){
      first[i] = alignment.getRecords().get(i).getSequence();
    }
    Assert.assertEquals(0, imputer.imputeMissing());
    for(int i = 0; i < 3; i++){
      Assert.assertEquals(first[i], alignment.getRecords().get(i).getSequence());
    }
  }

  @Test
  public void consensusUnchangedByImputation() throws IOException{
    FastaAlignment alignment = TestAlignments.parse(">s1\nY\n>s2\nY\n>s3\nC\n");
    String before = alignment.getConsensus();
    new MissingDataImputer(alignment).imputeMissing();
    Assert.assertEquals(before, alignment.getConsensus());
    Assert.assertEquals("C", alignment.getRecords().get(0).getSequence());
  }

}
