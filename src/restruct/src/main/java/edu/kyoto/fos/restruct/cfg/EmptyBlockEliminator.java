package edu.kyoto.fos.restruct.cfg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/*
  Removes blocks that only redirect: no statements and an unconditional branch. Every surviving
  target, and the entry, is rewritten to the end of its redirect chain.

  A redirect that resolves to itself (a self-loop, or the block where a redirect-only cycle was
  entered) is kept so that nothing points at a discarded label.
 */
public final class EmptyBlockEliminator {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmptyBlockEliminator.class);

  private EmptyBlockEliminator() {
  }

  public static <S extends Collection<?>, C> ControlFlowGraph<S, C> eliminate(final ControlFlowGraph<S, C> cfg) {
    return eliminate(cfg, Collection::isEmpty);
  }

  public static <S, C> ControlFlowGraph<S, C> eliminate(final ControlFlowGraph<S, C> cfg, final Predicate<? super S> isEmpty) {
    Map<Integer, Integer> rewrites = resolve(redirects(cfg, isEmpty));
    SortedMap<Integer, BasicBlock<S, C>> blocks = new TreeMap<>();
    cfg.getBlocks().forEach((label, bb) -> {
      int to = rewrites.getOrDefault(label, label);
      if(to != label) {
        LOGGER.debug("Dropping redirect block {} (resolved to {})", label, to);
        return;
      }
      blocks.put(label, bb.withTerminator(bb.term.relabel(l -> rewrites.getOrDefault(l, l))));
    });
    int entry = rewrites.getOrDefault(cfg.getEntry(), cfg.getEntry());
    return new ControlFlowGraph<>(entry, blocks);
  }

  private static <S, C> SortedMap<Integer, Integer> redirects(final ControlFlowGraph<S, C> cfg, final Predicate<? super S> isEmpty) {
    SortedMap<Integer, Integer> empties = new TreeMap<>();
    cfg.getBlocks().forEach((label, bb) -> {
      if(bb.term instanceof Branch && isEmpty.test(bb.stmts)) {
        empties.put(label, ((Branch<C>) bb.term).target);
      }
    });
    return empties;
  }

  /*
    Pending redirects are consumed lowest label first. A label is removed from the pending set
    before its chain is followed, so a chain that loops back finds the label already settled
    (or not yet settled, in which case it maps to itself) and stops. Every label on a chain
    resolves to wherever its last link resolves.
   */
  private static Map<Integer, Integer> resolve(final SortedMap<Integer, Integer> empties) {
    Map<Integer, Integer> done = new HashMap<>();
    while(!empties.isEmpty()) {
      int from = empties.firstKey();
      int to = empties.remove(from);
      List<Integer> chain = new ArrayList<>();
      chain.add(from);
      for(Integer next = empties.remove(to); next != null; next = empties.remove(to)) {
        chain.add(to);
        to = next;
      }
      int target = done.getOrDefault(to, to);
      for(int l : chain) {
        done.put(l, target);
      }
    }
    return done;
  }
}
