package edu.kyoto.fos.restruct.cfg;

import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

public final class Branch<C> extends Terminator<C> {
  public final int target;

  public Branch(final int target) {
    this.target = target;
  }

  @Override public List<Integer> targets() {
    return Collections.singletonList(target);
  }

  @Override public Terminator<C> relabel(final IntUnaryOperator f) {
    return new Branch<>(f.applyAsInt(target));
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(!(o instanceof Branch))
      return false;
    return target == ((Branch<?>) o).target;
  }

  @Override public int hashCode() {
    return 31 + target;
  }

  @Override public String toString() {
    return "goto " + target + ";";
  }
}
