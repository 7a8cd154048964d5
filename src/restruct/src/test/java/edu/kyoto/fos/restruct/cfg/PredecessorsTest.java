package edu.kyoto.fos.restruct.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import edu.kyoto.fos.restruct.Fixtures;
import edu.kyoto.fos.restruct.ir.Stmt;
import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link Predecessors}. */
@RunWith(JUnit4.class)
public final class PredecessorsTest {

  @Test
  public void diamond() {
    Predecessors preds = Fixtures.load("diamond").cfg.predecessors();
    assertEquals(new TreeSet<>(Arrays.asList(1, 2)), preds.get(3));
    assertEquals(Collections.singleton(0), preds.get(1));
    assertTrue(preds.get(0).isEmpty());
    assertTrue(preds.hasEdge(2, 3));
    assertFalse(preds.hasEdge(3, 2));
    assertEquals(Arrays.asList(1, 2, 3), Arrays.asList(preds.asMap().keySet().toArray(new Integer[0])));
  }

  @Test
  public void backEdgeCountsAsPredecessor() {
    Predecessors preds = Fixtures.load("while").cfg.predecessors();
    assertEquals(Collections.singleton(1), preds.get(0));
  }

  @Test
  public void unknownLabelHasNone() {
    ControlFlowGraph<Stmt, String> cfg = Fixtures.load("diamond").cfg;
    assertTrue(cfg.predecessors().get(42).isEmpty());
    assertTrue(cfg.getPredsOf(42).isEmpty());
  }

  @Test
  public void parallelEdgesCollapse() {
    ControlFlowGraph<Stmt, String> cfg = CFGBuilder.build(b -> {
      int h = b.newLabel();
      int t = b.newLabel();
      b.addBlock(h, Stmt.of("a"), Terminator.condBranch("c", t, t));
      b.addBlock(t, Stmt.of("b"), Terminator.unreachable());
      return h;
    });
    assertEquals(Collections.singleton(0), cfg.predecessors().get(1));
    assertEquals(Collections.singletonList(1), cfg.successors(0));
  }
}
