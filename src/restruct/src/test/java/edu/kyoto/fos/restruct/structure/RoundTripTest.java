package edu.kyoto.fos.restruct.structure;

import static org.junit.Assert.assertEquals;

import edu.kyoto.fos.restruct.Fixtures;
import edu.kyoto.fos.restruct.cfg.CFGBuilder;
import edu.kyoto.fos.restruct.cfg.ControlFlowGraph;
import edu.kyoto.fos.restruct.cfg.EmptyBlockEliminator;
import edu.kyoto.fos.restruct.cfg.Terminator;
import edu.kyoto.fos.restruct.ir.Sequence;
import edu.kyoto.fos.restruct.ir.Stmt;
import edu.kyoto.fos.restruct.ir.StmtBuilder;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs each graph and its structured form under the same branch decisions and compares the traces. */
@RunWith(JUnit4.class)
public final class RoundTripTest {
  private static final int SEEDS = 50;
  private static final int LIMIT = 200;

  private static void check(String name, ControlFlowGraph<Stmt, String> cfg) throws StructuringException {
    Stmt program = Structurer.structure(StmtBuilder.strings(), Sequence.MONOID, cfg);
    for(long seed = 0; seed < SEEDS; seed++) {
      assertEquals(name + " seed " + seed, TraceInterpreter.run(cfg, seed, LIMIT), TraceInterpreter.run(program, seed, LIMIT));
    }
  }

  private static void check(String fixture) throws StructuringException {
    check(fixture, Fixtures.load(fixture).cfg);
  }

  @Test
  public void diamond() throws StructuringException {
    check("diamond");
  }

  @Test
  public void whileLoop() throws StructuringException {
    check("while");
  }

  @Test
  public void nestedLoops() throws StructuringException {
    check("nested");
  }

  @Test
  public void skipLoop() throws StructuringException {
    check("skip-loop");
  }

  @Test
  public void sum() throws StructuringException {
    check("sum");
  }

  @Test
  public void redirectsAfterElimination() throws StructuringException {
    check("redirects", EmptyBlockEliminator.eliminate(Fixtures.load("redirects").cfg, Stmt::isEmpty));
  }

  @Test
  public void selfLoopWithExit() throws StructuringException {
    ControlFlowGraph<Stmt, String> cfg = CFGBuilder.build(b -> {
      int a = b.newLabel();
      int spin = b.newLabel();
      int out = b.newLabel();
      b.addBlock(a, Stmt.of("a"), Terminator.branch(spin));
      b.addBlock(spin, Stmt.of("s"), Terminator.condBranch("c", spin, out));
      b.addBlock(out, Stmt.of("o"), Terminator.unreachable());
      return a;
    });
    check("self-loop", cfg);
  }
}
