package msawindows;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Occurrence counts of distinct window sequences. Sequences are kept in the order they were first seen.
 */
public class UniqueSequenceTable{

  private final TObjectIntHashMap<String> index;
  private final ArrayList<String> sequences;
  private final TIntArrayList counts;

  UniqueSequenceTable(){
    index = new TObjectIntHashMap<>(16, 0.5f, -1);
    sequences = new ArrayList<>();
    counts = new TIntArrayList();
  }

  void add(String seq){
    int i = index.get(seq);
    if(i == -1){
      index.put(seq, sequences.size());
      sequences.add(seq);
      counts.add(1);
    }else{
      counts.setQuick(i, counts.getQuick(i) + 1);
    }
  }

  /**
   * Number of distinct sequences
   */
  public int size(){
    return sequences.size();
  }

  public String getSequence(int i){
    return sequences.get(i);
  }

  public int getCount(int i){
    return counts.get(i);
  }

  /**
   * @return occurrence count of the given sequence, 0 if it is absent
   */
  public int getCount(String seq){
    int i = index.get(seq);
    return i == -1 ? 0 : counts.getQuick(i);
  }

  public boolean contains(String seq){
    return index.containsKey(seq);
  }

  public int totalCount(){
    return counts.sum();
  }

  public int[] getCounts(){
    return counts.toArray();
  }

  /**
   * Sequences by count descending, equal counts stay in first seen order.
   */
  public List<UniqueSequence> sorted(){
    ArrayList<UniqueSequence> res = new ArrayList<>(sequences.size());
    for(int i = 0; i < sequences.size(); i++){
      res.add(new UniqueSequence(sequences.get(i), counts.getQuick(i)));
    }
    Collections.sort(res);
    return res;
  }

}
