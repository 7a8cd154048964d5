package edu.kyoto.fos.restruct.cfg;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

public final class CondBranch<C> extends Terminator<C> {
  public final C cond;
  public final int trueTarget, falseTarget;

  public CondBranch(final C cond, final int trueTarget, final int falseTarget) {
    this.cond = cond;
    this.trueTarget = trueTarget;
    this.falseTarget = falseTarget;
  }

  @Override public List<Integer> targets() {
    return Arrays.asList(trueTarget, falseTarget);
  }

  @Override public Terminator<C> relabel(final IntUnaryOperator f) {
    return new CondBranch<>(cond, f.applyAsInt(trueTarget), f.applyAsInt(falseTarget));
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(!(o instanceof CondBranch))
      return false;
    final CondBranch<?> that = (CondBranch<?>) o;
    return trueTarget == that.trueTarget && falseTarget == that.falseTarget && Objects.equals(cond, that.cond);
  }

  @Override public int hashCode() {
    return Objects.hash(cond, trueTarget, falseTarget);
  }

  @Override public String toString() {
    return "if(" + cond + ") goto " + trueTarget + "; else goto " + falseTarget + ";";
  }
}
