package edu.kyoto.fos.restruct.ir;

import java.util.List;
import java.util.Objects;

public class IfStmt extends Stmt {
  public final String cond;
  public final Stmt tBranch, fBranch;

  public IfStmt(final String cond, final Stmt tBranch, final Stmt fBranch) {
    this.cond = cond;
    this.tBranch = tBranch;
    this.fBranch = fBranch;
  }

  @Override protected void collectEffects(final List<String> out) {
    tBranch.collectEffects(out);
    fBranch.collectEffects(out);
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    indent(level, b).append("if (").append(cond).append(") {\n");
    tBranch.printAt(level + 1, b);
    if(!fBranch.isEmpty()) {
      indent(level, b).append("} else {\n");
      fBranch.printAt(level + 1, b);
    }
    indent(level, b).append("}\n");
  }

  @Override public boolean equals(final Object o) {
    if(!(o instanceof IfStmt))
      return false;
    IfStmt that = (IfStmt) o;
    return cond.equals(that.cond) && tBranch.equals(that.tBranch) && fBranch.equals(that.fBranch);
  }

  @Override public int hashCode() {
    return Objects.hash(cond, tBranch, fBranch);
  }
}
