package edu.kyoto.fos.restruct.cfg;

import fj.F;
import fj.data.Option;
import soot.toolkits.graph.DirectedGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/*
  An entry label plus the blocks keyed by label. Targets are not checked against the block map here;
  a dangling label surfaces when a later stage looks it up.

  Viewed as a soot DirectedGraph the nodes are the labels of the block map.
 */
public final class ControlFlowGraph<S, C> implements DirectedGraph<Integer> {
  private final int entry;
  private final SortedMap<Integer, BasicBlock<S, C>> blocks;
  private final Predecessors preds;

  public ControlFlowGraph(final int entry, final Map<Integer, BasicBlock<S, C>> blocks) {
    this.entry = entry;
    this.blocks = Collections.unmodifiableSortedMap(new TreeMap<>(blocks));
    this.preds = Predecessors.of(this.blocks);
  }

  public int getEntry() {
    return entry;
  }

  public SortedMap<Integer, BasicBlock<S, C>> getBlocks() {
    return blocks;
  }

  public Option<BasicBlock<S, C>> lookup(final int label) {
    return Option.fromNull(blocks.get(label));
  }

  public Predecessors predecessors() {
    return preds;
  }

  /* Distinct successors of a block in branch order; empty when the label has no block. */
  public List<Integer> successors(final int label) {
    BasicBlock<S, C> bb = blocks.get(label);
    if(bb == null) {
      return Collections.emptyList();
    }
    List<Integer> toRet = new ArrayList<>();
    for(int t : bb.term.targets()) {
      if(!toRet.contains(t)) {
        toRet.add(t);
      }
    }
    return toRet;
  }

  public String dump(final F<S, String> fmtS, final F<C, String> fmtC) {
    return new CFGPrinter<>(fmtS, fmtC).print(this);
  }

  @Override public List<Integer> getHeads() {
    return Collections.singletonList(entry);
  }

  @Override public List<Integer> getTails() {
    List<Integer> tails = new ArrayList<>();
    blocks.forEach((l, bb) -> {
      if(bb.term.targets().isEmpty()) {
        tails.add(l);
      }
    });
    return tails;
  }

  @Override public List<Integer> getPredsOf(final Integer s) {
    return new ArrayList<>(preds.get(s));
  }

  @Override public List<Integer> getSuccsOf(final Integer s) {
    return successors(s);
  }

  @Override public int size() {
    return blocks.size();
  }

  @Override public Iterator<Integer> iterator() {
    return blocks.keySet().iterator();
  }

  @Override public String toString() {
    return "start @" + entry + " " + blocks;
  }
}
