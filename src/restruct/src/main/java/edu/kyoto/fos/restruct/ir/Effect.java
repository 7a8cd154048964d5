package edu.kyoto.fos.restruct.ir;

import java.util.List;
import java.util.Objects;

public class Effect extends Stmt {
  public final String text;

  public Effect(final String text) {
    this.text = text;
  }

  @Override protected void collectEffects(final List<String> out) {
    out.add(text);
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    indent(level, b).append(text).append("\n");
  }

  @Override public boolean equals(final Object o) {
    return o instanceof Effect && Objects.equals(text, ((Effect) o).text);
  }

  @Override public int hashCode() {
    return Objects.hashCode(text);
  }
}
