package msawindows;

import java.util.List;

/**
 * Counts the distinct sequences found in one window of the alignment.
 *
 * <p>Window extraction over records follows substring semantics: a start past the end of the
 * sequences is an error, while a window running past the end is cut at the last column.
 * Consensus windows are strict and never cut.
 */
public class WindowExtractor{

  private final FastaAlignment alignment;

  public WindowExtractor(FastaAlignment alignment){
    this.alignment = alignment;
  }

  /**
   * @param start 0-based window start
   * @param size window length, shortened if the window runs past the alignment end
   * @return table of sequences found in the window, in first seen order
   */
  public UniqueSequenceTable extractWindow(int start, int size){
    if(start < 0 || size < 0){
      throw new WindowRangeException("Window start " + start + " and size " + size + " must not be negative");
    }
    UniqueSequenceTable table = new UniqueSequenceTable();
    for(AlignmentRecord record: alignment.getRecords()){
      int length = record.length();
      if(start > length){
        throw new WindowRangeException("Window start " + start + " is past the end of sequence " +
            record.header + " of length " + length);
      }
      int end = (int)Math.min((long)start + size, length);
      table.add(record.subsequence(start, end));
    }
    return table;
  }

  public List<UniqueSequence> extractWindowSorted(int start, int size){
    return extractWindow(start, size).sorted();
  }

  public String extractConsensusWindow(int start, int size){
    int length = alignment.alignmentLength();
    if(start < 0 || size < 0 || (long)start + size > length){
      throw new WindowRangeException("Consensus window [" + start + ", " + ((long)start + size) +
          ") is outside of the alignment of length " + length);
    }
    return alignment.getConsensus().substring(start, start + size);
  }

}
