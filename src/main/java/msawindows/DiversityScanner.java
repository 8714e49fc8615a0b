package msawindows;

import java.util.ArrayList;
import java.util.List;

/**
 * Slides a window along the alignment and counts distinct sequences in each position.
 * Windows with few distinct sequences mark runs of homozygosity.
 */
public class DiversityScanner{

  private final FastaAlignment alignment;
  private final WindowExtractor extractor;

  public DiversityScanner(FastaAlignment alignment){
    this.alignment = alignment;
    extractor = new WindowExtractor(alignment);
  }

  /**
   * Windows start at 0, stepSize, 2*stepSize and so on while the window end stays strictly
   * inside the alignment, so no window is ever truncated.
   *
   * @return windows in order of their start positions, empty if windowSize is not less than the alignment length
   */
  public List<WindowDiversity> diversityInWindows(int windowSize, int stepSize){
    if(windowSize <= 0){
      throw new IllegalArgumentException("Window size must be > 0, got " + windowSize);
    }
    if(stepSize <= 0){
      throw new IllegalArgumentException("Step size must be > 0, got " + stepSize);
    }
    int length = alignment.alignmentLength();
    ArrayList<WindowDiversity> res = new ArrayList<>();
    for(long windowStart = 0; windowStart + windowSize < length; windowStart += stepSize){
      UniqueSequenceTable table = extractor.extractWindow((int)windowStart, windowSize);
      res.add(new WindowDiversity((int)windowStart, table.getCounts()));
    }
    return res;
  }

}
