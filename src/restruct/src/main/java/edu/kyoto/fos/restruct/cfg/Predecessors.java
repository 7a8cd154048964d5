package edu.kyoto.fos.restruct.cfg;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/*
  Reverse edges of a block map. Only labels that appear as a branch target have an entry;
  every other label has no predecessors.
 */
public final class Predecessors {
  private final SortedMap<Integer, SortedSet<Integer>> preds;

  private Predecessors(final SortedMap<Integer, SortedSet<Integer>> preds) {
    this.preds = preds;
  }

  public static <S, C> Predecessors of(final Map<Integer, BasicBlock<S, C>> blocks) {
    SortedMap<Integer, SortedSet<Integer>> preds = new TreeMap<>();
    blocks.forEach((from, bb) -> {
      for(int to : bb.term.targets()) {
        preds.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
      }
    });
    return new Predecessors(preds);
  }

  public SortedSet<Integer> get(final int label) {
    SortedSet<Integer> p = preds.get(label);
    if(p == null) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(p);
  }

  public boolean hasEdge(final int from, final int to) {
    return get(to).contains(from);
  }

  /* Every branch target, mapped to the labels branching to it. */
  public SortedMap<Integer, SortedSet<Integer>> asMap() {
    return Collections.unmodifiableSortedMap(preds);
  }

  @Override public String toString() {
    return preds.toString();
  }
}
