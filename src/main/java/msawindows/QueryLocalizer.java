package msawindows;

import java.nio.charset.StandardCharsets;

/**
 * Finds the alignment window that best matches a query sequence by aligning the query to the consensus.
 */
public class QueryLocalizer{

  private final FastaAlignment alignment;
  private final Aligner aligner;

  public QueryLocalizer(FastaAlignment alignment, Aligner aligner){
    this.alignment = alignment;
    this.aligner = aligner;
  }

  public AlignmentStatistics localize(String query) throws AlignmentCoordinatesException{
    if(query.isEmpty()){
      throw new IllegalArgumentException("Query sequence is empty");
    }
    Alignment aln = aligner.align(query.getBytes(StandardCharsets.US_ASCII), alignment.getConsensusBytes());
    if(aln == null){
      throw new AlignmentCoordinatesException("Aligner returned no result for the query");
    }
    if(aln.start2 < 0){
      throw new AlignmentCoordinatesException("Matching reference start value cannot be negative: " + aln.start2);
    }
    if(aln.end2 < aln.start2){
      throw new AlignmentCoordinatesException("Matching reference end " + aln.end2 +
          " must not be less than start " + aln.start2);
    }
    if(aln.start1 < 0){
      throw new AlignmentCoordinatesException("Query start value cannot be negative: " + aln.start1);
    }
    if(aln.end1 < aln.start1){
      throw new AlignmentCoordinatesException("Query end " + aln.end1 + " must not be less than start " + aln.start1);
    }
    return new AlignmentStatistics(aln.start2, aln.end2 - aln.start2, aln.start1, aln.end1 - aln.start1);
  }

  /**
   * Part of the query covered by the match
   */
  public static String matchedQuery(String query, AlignmentStatistics stats){
    int end = (int)Math.min((long)stats.queryStart + stats.queryLength, query.length());
    if(stats.queryStart > end){
      throw new WindowRangeException("Query start " + stats.queryStart + " is past the end of the query of length " +
          query.length());
    }
    return query.substring(stats.queryStart, end);
  }

}
