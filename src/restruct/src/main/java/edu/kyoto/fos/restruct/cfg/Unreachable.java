package edu.kyoto.fos.restruct.cfg;

import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

public final class Unreachable<C> extends Terminator<C> {
  @Override public List<Integer> targets() {
    return Collections.emptyList();
  }

  @Override public Terminator<C> relabel(final IntUnaryOperator f) {
    return this;
  }

  @Override public boolean equals(final Object o) {
    return o instanceof Unreachable;
  }

  @Override public int hashCode() {
    return 0;
  }

  @Override public String toString() {
    return "// unreachable";
  }
}
