package edu.kyoto.fos.restruct.cfg;

import fj.data.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;

/*
  Loops arranged by containment. Each level maps a header to its loop; a loop's own nested
  forest holds the loops inside it.
 */
public final class LoopForest {
  private static final LoopForest EMPTY = new LoopForest(Collections.emptySortedMap());

  private final SortedMap<Integer, Loop> loops;

  private LoopForest(final SortedMap<Integer, Loop> loops) {
    this.loops = Collections.unmodifiableSortedMap(loops);
  }

  public static LoopForest empty() {
    return EMPTY;
  }

  /*
    Inserts loops smallest first (ties by header). A new loop adopts every loop at the top level
    whose header it contains.
   */
  public static LoopForest nest(final Map<Integer, SortedSet<Integer>> naturalLoops) {
    List<Map.Entry<Integer, SortedSet<Integer>>> order = new ArrayList<>(naturalLoops.entrySet());
    order.sort(Comparator.<Map.Entry<Integer, SortedSet<Integer>>>comparingInt(e -> e.getValue().size())
        .thenComparingInt(Map.Entry::getKey));
    SortedMap<Integer, Loop> top = new TreeMap<>();
    for(Map.Entry<Integer, SortedSet<Integer>> e : order) {
      SortedSet<Integer> inside = e.getValue();
      SortedMap<Integer, Loop> nested = new TreeMap<>();
      top.entrySet().removeIf(t -> {
        if(inside.contains(t.getKey())) {
          nested.put(t.getKey(), t.getValue());
          return true;
        }
        return false;
      });
      top.put(e.getKey(), new Loop(e.getKey(), inside, new LoopForest(nested)));
    }
    return new LoopForest(top);
  }

  public static <S, C> LoopForest of(final ControlFlowGraph<S, C> cfg, final Dominators dom) {
    return nest(LoopFinder.naturalLoops(cfg, dom));
  }

  /* The loops at this level, by header. */
  public SortedMap<Integer, Loop> roots() {
    return loops;
  }

  public Option<Loop> get(final int header) {
    return Option.fromNull(loops.get(header));
  }

  public boolean isEmpty() {
    return loops.isEmpty();
  }

  /* Finds a loop by header at any depth. */
  public Option<Loop> loopOf(final int header) {
    Loop l = loops.get(header);
    if(l != null) {
      return Option.some(l);
    }
    for(Loop c : loops.values()) {
      Option<Loop> found = c.nested().loopOf(header);
      if(found.isSome()) {
        return found;
      }
    }
    return Option.none();
  }

  /* Loops containing the label, outermost first. */
  public List<Loop> containingLoops(final int label) {
    List<Loop> toRet = new ArrayList<>();
    for(Loop l : loops.values()) {
      if(l.contains(label)) {
        toRet.add(l);
        toRet.addAll(l.nested().containingLoops(label));
      }
    }
    return toRet;
  }

  public List<Loop> allLoops() {
    List<Loop> toRet = new ArrayList<>();
    for(Loop l : loops.values()) {
      toRet.add(l);
      toRet.addAll(l.nested().allLoops());
    }
    return toRet;
  }

  public int depth() {
    int d = 0;
    for(Loop l : loops.values()) {
      d = Math.max(d, 1 + l.nested().depth());
    }
    return d;
  }

  /* True when any two loops are either disjoint or one contains the other. */
  public boolean isProperlyNested() {
    List<Loop> all = allLoops();
    for(int i = 0; i < all.size(); i++) {
      for(int j = i + 1; j < all.size(); j++) {
        SortedSet<Integer> a = all.get(i).all(), b = all.get(j).all();
        if(a.containsAll(b) || b.containsAll(a) || Collections.disjoint(a, b)) {
          continue;
        }
        return false;
      }
    }
    return true;
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    return Objects.equals(loops, ((LoopForest) o).loops);
  }

  @Override public int hashCode() {
    return loops.hashCode();
  }

  @Override public String toString() {
    return loops.values().toString();
  }
}
