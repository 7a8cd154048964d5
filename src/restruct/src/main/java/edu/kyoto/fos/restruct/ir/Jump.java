package edu.kyoto.fos.restruct.ir;

import java.util.List;
import java.util.Objects;

/* break or continue, naming the loop by its header. */
public class Jump extends Stmt {
  public final boolean isBreak;
  public final int header;

  private Jump(final boolean isBreak, final int header) {
    this.isBreak = isBreak;
    this.header = header;
  }

  public static Jump breakFrom(final int header) {
    return new Jump(true, header);
  }

  public static Jump continueTo(final int header) {
    return new Jump(false, header);
  }

  @Override protected void collectEffects(final List<String> out) {
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    indent(level, b).append(isBreak ? "break " : "continue ").append(LoopStmt.name(header)).append(";\n");
  }

  @Override public boolean equals(final Object o) {
    if(!(o instanceof Jump))
      return false;
    Jump that = (Jump) o;
    return isBreak == that.isBreak && header == that.header;
  }

  @Override public int hashCode() {
    return Objects.hash(isBreak, header);
  }
}
