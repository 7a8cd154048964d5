package edu.kyoto.fos.restruct.cfg;

import fj.data.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

public final class LoopFinder {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoopFinder.class);

  private LoopFinder() {
  }

  /* Loop header to the sources of the back edges entering it. */
  public static <S, C> SortedMap<Integer, SortedSet<Integer>> backEdges(final ControlFlowGraph<S, C> cfg, final Dominators dom) {
    SortedMap<Integer, SortedSet<Integer>> toRet = new TreeMap<>();
    for(int from : cfg.getBlocks().keySet()) {
      for(int to : cfg.successors(from)) {
        if(dom.dominates(to, from)) {
          toRet.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
        }
      }
    }
    return toRet;
  }

  public static <S, C> Option<SortedMap<Integer, SortedSet<Integer>>> backEdges(final ControlFlowGraph<S, C> cfg) {
    return Dominators.compute(cfg).map(dom -> backEdges(cfg, dom));
  }

  /* Loop header to the members of its natural loop, header included. */
  public static <S, C> SortedMap<Integer, SortedSet<Integer>> naturalLoops(final ControlFlowGraph<S, C> cfg, final Dominators dom) {
    SortedMap<Integer, SortedSet<Integer>> loops = new TreeMap<>();
    backEdges(cfg, dom).forEach((header, sources) -> {
      SortedSet<Integer> body = bodyFor(cfg.predecessors(), header, sources);
      LOGGER.debug("Loop at {}: back edges from {}, members {}", header, sources, body);
      loops.put(header, body);
    });
    return loops;
  }

  public static <S, C> Option<SortedMap<Integer, SortedSet<Integer>>> naturalLoops(final ControlFlowGraph<S, C> cfg) {
    return Dominators.compute(cfg).map(dom -> naturalLoops(cfg, dom));
  }

  /*
    Starts from the header and keeps adding predecessors of newly added members. The header is in
    the set from the start, so the walk never leaves the loop through it.
   */
  private static SortedSet<Integer> bodyFor(final Predecessors preds, final int header, final SortedSet<Integer> sources) {
    SortedSet<Integer> inLoop = new TreeSet<>(Collections.singleton(header));
    SortedSet<Integer> toAdd = new TreeSet<>(sources);
    while(true) {
      SortedSet<Integer> fresh = new TreeSet<>(toAdd);
      fresh.removeAll(inLoop);
      if(fresh.isEmpty()) {
        return inLoop;
      }
      inLoop.addAll(fresh);
      toAdd = new TreeSet<>();
      for(int l : fresh) {
        toAdd.addAll(preds.get(l));
      }
    }
  }
}
