package edu.kyoto.fos.restruct.cfg;

import fj.P;
import fj.P2;
import fj.data.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/*
  Every edge leaving a loop body, keyed by (source, target). An edge back to the header is a
  continue; an edge to a non-member is a break. When an edge exits several nested loops at once
  it is attributed to the outermost of them.
 */
public final class ExitEdges {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExitEdges.class);

  public static final Comparator<P2<Integer, Integer>> EDGE_ORDER = Comparator
      .comparing((Function<P2<Integer, Integer>, Integer>) P2::_1)
      .thenComparing(P2::_2);

  private final SortedMap<P2<Integer, Integer>, Exit> exits;

  private ExitEdges(final SortedMap<P2<Integer, Integer>, Exit> exits) {
    this.exits = Collections.unmodifiableSortedMap(exits);
  }

  public static <S, C> ExitEdges classify(final ControlFlowGraph<S, C> cfg, final LoopForest forest) {
    SortedMap<P2<Integer, Integer>, Exit> exits = new TreeMap<>(EDGE_ORDER);
    collect(cfg, forest, exits);
    LOGGER.debug("Exit edges: {}", exits);
    return new ExitEdges(exits);
  }

  private static <S, C> void collect(final ControlFlowGraph<S, C> cfg, final LoopForest forest, final SortedMap<P2<Integer, Integer>, Exit> exits) {
    for(Loop loop : forest.roots().values()) {
      int header = loop.getHeader();
      for(int from : loop.all()) {
        for(int to : cfg.successors(from)) {
          if(to == header) {
            exits.putIfAbsent(P.p(from, to), Exit.continueTo(header));
          } else if(!loop.contains(to)) {
            exits.putIfAbsent(P.p(from, to), Exit.breakFrom(header));
          }
        }
      }
      // outer classifications are already in place, so inner loops only fill gaps
      collect(cfg, loop.nested(), exits);
    }
  }

  public Option<Exit> get(final int from, final int to) {
    return Option.fromNull(exits.get(P.p(from, to)));
  }

  public boolean isExit(final int from, final int to) {
    return exits.containsKey(P.p(from, to));
  }

  public SortedMap<P2<Integer, Integer>, Exit> asMap() {
    return exits;
  }

  @Override public String toString() {
    return exits.toString();
  }
}
