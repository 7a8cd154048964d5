package edu.kyoto.fos.restruct.ir;

import java.util.List;
import java.util.Objects;

public class LoopStmt extends Stmt {
  public final int header;
  public final Stmt body;

  public LoopStmt(final int header, final Stmt body) {
    this.header = header;
    this.body = body;
  }

  public static String name(final int header) {
    return "loop_" + header;
  }

  @Override protected void collectEffects(final List<String> out) {
    body.collectEffects(out);
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    indent(level, b).append(name(header)).append(": loop {\n");
    body.printAt(level + 1, b);
    indent(level, b).append("}\n");
  }

  @Override public boolean equals(final Object o) {
    if(!(o instanceof LoopStmt))
      return false;
    LoopStmt that = (LoopStmt) o;
    return header == that.header && body.equals(that.body);
  }

  @Override public int hashCode() {
    return Objects.hash(header, body);
  }
}
