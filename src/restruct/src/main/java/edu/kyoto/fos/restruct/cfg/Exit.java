package edu.kyoto.fos.restruct.cfg;

import java.util.Objects;

/* Classification of an edge that leaves a loop body, identified by the loop's header. */
public final class Exit {
  public enum Kind {
    BREAK,
    CONTINUE
  }

  public final Kind kind;
  public final int header;

  private Exit(final Kind kind, final int header) {
    this.kind = kind;
    this.header = header;
  }

  public static Exit breakFrom(final int header) {
    return new Exit(Kind.BREAK, header);
  }

  public static Exit continueTo(final int header) {
    return new Exit(Kind.CONTINUE, header);
  }

  public boolean isBreak() {
    return kind == Kind.BREAK;
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final Exit exit = (Exit) o;
    return header == exit.header && kind == exit.kind;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, header);
  }

  @Override public String toString() {
    return (isBreak() ? "BreakFrom " : "ContinueTo ") + header;
  }
}
