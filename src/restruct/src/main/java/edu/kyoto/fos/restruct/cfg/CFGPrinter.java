package edu.kyoto.fos.restruct.cfg;

import edu.kyoto.fos.restruct.Printable;
import fj.F;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/*
  Diagnostic listing of an unstructured graph, highest label first:

    start @0
    1:
        <stmts>
        goto 2;

  Structuring never reads this output.
 */
public class CFGPrinter<S, C> {
  private final F<S, String> fmtS;
  private final F<C, String> fmtC;

  public CFGPrinter(final F<S, String> fmtS, final F<C, String> fmtC) {
    this.fmtS = fmtS;
    this.fmtC = fmtC;
  }

  public String print(final ControlFlowGraph<S, C> cfg) {
    StringBuilder sb = new StringBuilder();
    sb.append("start @").append(cfg.getEntry()).append("\n");
    List<Map.Entry<Integer, BasicBlock<S, C>>> entries = new ArrayList<>(cfg.getBlocks().entrySet());
    Collections.reverse(entries);
    for(Map.Entry<Integer, BasicBlock<S, C>> e : entries) {
      new BlockListing(e.getKey(), e.getValue()).printAt(0, sb);
    }
    return sb.toString();
  }

  private String terminatorText(final Terminator<C> term) {
    if(term instanceof Branch) {
      return "goto " + ((Branch<C>) term).target + ";";
    } else if(term instanceof CondBranch) {
      CondBranch<C> cb = (CondBranch<C>) term;
      return "if(" + fmtC.f(cb.cond) + ") goto " + cb.trueTarget + "; else goto " + cb.falseTarget + ";";
    } else {
      return "// unreachable";
    }
  }

  private class BlockListing implements Printable {
    private final int label;
    private final BasicBlock<S, C> bb;

    BlockListing(final int label, final BasicBlock<S, C> bb) {
      this.label = label;
      this.bb = bb;
    }

    @Override public void printAt(final int level, final StringBuilder sb) {
      indent(level, sb).append(label).append(":\n");
      String body = fmtS.f(bb.stmts);
      if(!body.isEmpty()) {
        for(String line : body.split("\n")) {
          indent(level + 2, sb).append(line).append("\n");
        }
      }
      indent(level + 2, sb).append(terminatorText(bb.term)).append("\n");
      sb.append("\n");
    }
  }
}
