package edu.kyoto.fos.restruct.cfg;

import fj.P;
import fj.P2;
import fj.data.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import soot.toolkits.graph.DirectedGraph;
import soot.toolkits.graph.DominatorsFinder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/*
  Dominator sets computed in a single pass over the blocks in reverse post-order, followed by a
  check that the recurrence

    dom(entry) = {entry}
    dom(b)     = {b} ∪ ⋂ { dom(p) | p a predecessor of b with a computed value }

  holds for every block of the graph. There is no iteration to a fixpoint: if the check fails
  (including for blocks the traversal never reached) there is no result, and the graph is
  treated as one that cannot be structured.
 */
public final class Dominators implements DominatorsFinder<Integer> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Dominators.class);

  private final ControlFlowGraph<?, ?> graph;
  /* Indexed by label; labels handed out by CFGBuilder are never negative. */
  private final Map<Integer, BitSet> doms;

  private Dominators(final ControlFlowGraph<?, ?> graph, final Map<Integer, BitSet> doms) {
    this.graph = graph;
    this.doms = doms;
  }

  public static <S, C> Option<Dominators> compute(final ControlFlowGraph<S, C> cfg) {
    Map<Integer, BitSet> seen = new HashMap<>();
    for(int label : reversePostOrder(cfg)) {
      seen.put(label, update(cfg, seen, label));
    }
    for(int label : cfg.getBlocks().keySet()) {
      BitSet stored = seen.get(label);
      if(!update(cfg, seen, label).equals(stored)) {
        LOGGER.debug("Dominators of {} do not settle in one pass (stored {})", label, stored);
        return Option.none();
      }
    }
    return Option.some(new Dominators(cfg, seen));
  }

  private static <S, C> BitSet update(final ControlFlowGraph<S, C> cfg, final Map<Integer, BitSet> seen, final int label) {
    BitSet self = new BitSet();
    if(label != cfg.getEntry()) {
      boolean first = true;
      for(int p : cfg.predecessors().get(label)) {
        BitSet pd = seen.get(p);
        if(pd == null) {
          continue;
        }
        if(first) {
          self.or(pd);
          first = false;
        } else {
          self.and(pd);
        }
      }
    }
    self.set(label);
    return self;
  }

  /*
    Depth first from the entry, successors in branch order. A label is prepended once all of its
    successors are explored, so the entry comes first. Labels without a block are visited
    (and ordered) but have no successors.
   */
  static <S, C> List<Integer> reversePostOrder(final ControlFlowGraph<S, C> cfg) {
    LinkedList<Integer> order = new LinkedList<>();
    Set<Integer> visited = new HashSet<>();
    Deque<P2<Integer, Iterator<Integer>>> stack = new ArrayDeque<>();
    visited.add(cfg.getEntry());
    stack.push(P.p(cfg.getEntry(), targetsOf(cfg, cfg.getEntry())));
    while(!stack.isEmpty()) {
      P2<Integer, Iterator<Integer>> top = stack.peek();
      if(top._2().hasNext()) {
        int s = top._2().next();
        if(visited.add(s)) {
          stack.push(P.p(s, targetsOf(cfg, s)));
        }
      } else {
        stack.pop();
        order.addFirst(top._1());
      }
    }
    return order;
  }

  private static <S, C> Iterator<Integer> targetsOf(final ControlFlowGraph<S, C> cfg, final int label) {
    return cfg.lookup(label).map(bb -> bb.term.targets()).orSome(Collections.emptyList()).iterator();
  }

  private static SortedSet<Integer> toSet(final BitSet b) {
    SortedSet<Integer> toRet = new TreeSet<>();
    b.stream().forEach(toRet::add);
    return toRet;
  }

  /* Dominator set of every reached label, the label itself included. Built on each call. */
  public SortedMap<Integer, SortedSet<Integer>> asMap() {
    SortedMap<Integer, SortedSet<Integer>> toRet = new TreeMap<>();
    doms.forEach((l, b) -> toRet.put(l, toSet(b)));
    return toRet;
  }

  public SortedSet<Integer> of(final int label) {
    BitSet d = doms.get(label);
    return d == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(toSet(d));
  }

  public boolean dominates(final int dominator, final int node) {
    BitSet d = doms.get(node);
    return d != null && dominator >= 0 && d.get(dominator);
  }

  @Override public DirectedGraph<Integer> getGraph() {
    return graph;
  }

  @Override public List<Integer> getDominators(final Integer node) {
    return new ArrayList<>(of(node));
  }

  @Override public Integer getImmediateDominator(final Integer node) {
    BitSet d = doms.get(node);
    if(d == null) {
      return null;
    }
    Integer idom = null;
    int best = 0;
    for(int c = d.nextSetBit(0); c >= 0; c = d.nextSetBit(c + 1)) {
      if(c == node) {
        continue;
      }
      int size = doms.get(c).cardinality();
      if(idom == null || size > best) {
        idom = c;
        best = size;
      }
    }
    return idom;
  }

  @Override public boolean isDominatedBy(final Integer node, final Integer dominator) {
    return dominates(dominator, node);
  }

  @Override public boolean isDominatedByAll(final Integer node, final Collection<Integer> dominators) {
    for(int d : dominators) {
      if(!dominates(d, node)) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return asMap().toString();
  }
}
