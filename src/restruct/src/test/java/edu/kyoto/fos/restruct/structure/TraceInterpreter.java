package edu.kyoto.fos.restruct.structure;

import edu.kyoto.fos.restruct.cfg.BasicBlock;
import edu.kyoto.fos.restruct.cfg.Branch;
import edu.kyoto.fos.restruct.cfg.CondBranch;
import edu.kyoto.fos.restruct.cfg.ControlFlowGraph;
import edu.kyoto.fos.restruct.ir.Effect;
import edu.kyoto.fos.restruct.ir.IfStmt;
import edu.kyoto.fos.restruct.ir.Jump;
import edu.kyoto.fos.restruct.ir.LoopStmt;
import edu.kyoto.fos.restruct.ir.Sequence;
import edu.kyoto.fos.restruct.ir.Stmt;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/*
  Runs a graph or a structured tree, recording every effect and every condition outcome. Conditions
  are decided by a seeded Random, so two runs with the same seed follow the same decisions as long
  as they evaluate the same conditions in the same order. A run stops after a fixed number of
  events.
 */
final class TraceInterpreter {
  private static final class Halt extends RuntimeException {
    Halt() {
      super(null, null, false, false);
    }
  }

  private static final class JumpSignal extends RuntimeException {
    final Jump jump;

    JumpSignal(final Jump jump) {
      super(null, null, false, false);
      this.jump = jump;
    }
  }

  private final Random oracle;
  private final int limit;
  private final List<String> trace = new ArrayList<>();

  private TraceInterpreter(final long seed, final int limit) {
    this.oracle = new Random(seed);
    this.limit = limit;
  }

  static List<String> run(final ControlFlowGraph<Stmt, String> cfg, final long seed, final int limit) {
    TraceInterpreter t = new TraceInterpreter(seed, limit);
    try {
      int label = cfg.getEntry();
      while(true) {
        BasicBlock<Stmt, String> bb = cfg.lookup(label).some();
        bb.stmts.effects().forEach(t::emit);
        if(bb.term instanceof Branch) {
          label = ((Branch<String>) bb.term).target;
        } else if(bb.term instanceof CondBranch) {
          CondBranch<String> cb = (CondBranch<String>) bb.term;
          label = t.decide(cb.cond) ? cb.trueTarget : cb.falseTarget;
        } else {
          break;
        }
      }
    } catch (Halt h) {
      // trace is long enough
    }
    return t.trace;
  }

  static List<String> run(final Stmt program, final long seed, final int limit) {
    TraceInterpreter t = new TraceInterpreter(seed, limit);
    try {
      t.exec(program);
    } catch (Halt h) {
      // trace is long enough
    }
    return t.trace;
  }

  private void emit(final String event) {
    if(trace.size() >= limit) {
      throw new Halt();
    }
    trace.add(event);
  }

  private boolean decide(final String cond) {
    boolean b = oracle.nextBoolean();
    emit("?" + cond + "=" + b);
    return b;
  }

  private void exec(final Stmt s) {
    if(s instanceof Effect) {
      emit(((Effect) s).text);
    } else if(s instanceof Sequence) {
      for(Stmt c : ((Sequence) s).stmts) {
        exec(c);
      }
    } else if(s instanceof IfStmt) {
      IfStmt i = (IfStmt) s;
      exec(decide(i.cond) ? i.tBranch : i.fBranch);
    } else if(s instanceof LoopStmt) {
      LoopStmt l = (LoopStmt) s;
      while(true) {
        try {
          exec(l.body);
          throw new IllegalStateException("loop body of " + l.header + " fell through");
        } catch (JumpSignal sig) {
          if(sig.jump.header != l.header) {
            throw sig;
          }
          if(sig.jump.isBreak) {
            break;
          }
        }
      }
    } else if(s instanceof Jump) {
      throw new JumpSignal((Jump) s);
    } else {
      throw new IllegalArgumentException("Unknown statement " + s);
    }
  }
}
