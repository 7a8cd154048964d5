package edu.kyoto.fos.restruct.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import edu.kyoto.fos.restruct.Fixtures;
import edu.kyoto.fos.restruct.ir.Stmt;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link LoopForest}. */
@RunWith(JUnit4.class)
public final class LoopForestTest {

  private static SortedSet<Integer> set(Integer... ls) {
    return new TreeSet<>(Arrays.asList(ls));
  }

  private static LoopForest forest(String fixture) {
    ControlFlowGraph<Stmt, String> cfg = Fixtures.load(fixture).cfg;
    return LoopForest.of(cfg, Dominators.compute(cfg).some());
  }

  private static List<Integer> headers(List<Loop> loops) {
    List<Integer> toRet = new ArrayList<>();
    loops.forEach(l -> toRet.add(l.getHeader()));
    return toRet;
  }

  @Test
  public void nestedLoopsNest() {
    LoopForest f = forest("nested");
    assertEquals(set(1), f.roots().keySet());
    Loop outer = f.get(1).some();
    assertEquals(set(1, 2, 3, 4), outer.all());
    assertEquals(set(2), outer.nested().roots().keySet());
    assertEquals(2, f.depth());
    assertTrue(f.get(2).isNone());
    assertEquals(set(2, 3), f.loopOf(2).some().all());
    assertEquals(Arrays.asList(1, 2), headers(f.containingLoops(3)));
    assertEquals(Arrays.asList(1), headers(f.containingLoops(4)));
    assertTrue(f.containingLoops(5).isEmpty());
    assertTrue(f.isProperlyNested());
  }

  @Test
  public void acyclicGraphHasEmptyForest() {
    LoopForest f = forest("diamond");
    assertTrue(f.isEmpty());
    assertEquals(0, f.depth());
    assertEquals(LoopForest.empty(), f);
  }

  @Test
  public void disjointLoopsAreSiblings() {
    TreeMap<Integer, SortedSet<Integer>> loops = new TreeMap<>();
    loops.put(3, set(3, 4));
    loops.put(1, set(1, 2));
    LoopForest f = LoopForest.nest(loops);
    assertEquals(set(1, 3), f.roots().keySet());
    assertEquals(1, f.depth());
    assertTrue(f.isProperlyNested());
  }

  @Test
  public void largerLoopAdoptsTheLoopsWhoseHeadersItContains() {
    TreeMap<Integer, SortedSet<Integer>> loops = new TreeMap<>();
    loops.put(0, set(0, 1, 2, 3, 4));
    loops.put(1, set(1, 2));
    loops.put(3, set(3));
    LoopForest f = LoopForest.nest(loops);
    assertEquals(set(0), f.roots().keySet());
    assertEquals(set(1, 3), f.get(0).some().nested().roots().keySet());
    assertEquals(Arrays.asList(0, 1, 3), headers(f.allLoops()));
  }

  @Test
  public void overlappingLoopsAreNotProperlyNested() {
    TreeMap<Integer, SortedSet<Integer>> loops = new TreeMap<>();
    loops.put(1, set(1, 2, 3));
    loops.put(2, set(2, 3, 4));
    LoopForest f = LoopForest.nest(loops);
    assertFalse(f.isProperlyNested());
  }

  @Test
  public void forestsFromRealGraphsAreProperlyNested() {
    for(String name : Arrays.asList("while", "nested", "skip-loop", "sum", "two-exits")) {
      assertTrue(name, forest(name).isProperlyNested());
    }
  }
}
