package msawindows;

import java.nio.charset.StandardCharsets;

/**
 * One sequence of the alignment with its FASTA header.
 */
class AlignmentRecord{

  final String header;
  byte[] seq;

  AlignmentRecord(String header, String seq){
    this.header = header;
    this.seq = seq.getBytes(StandardCharsets.US_ASCII);
  }

  int length(){
    return seq.length;
  }

  String subsequence(int start, int end){
    return new String(seq, start, end - start, StandardCharsets.US_ASCII);
  }

  String getSequence(){
    return new String(seq, StandardCharsets.US_ASCII);
  }

}
