package edu.kyoto.fos.restruct.cfg;

import java.util.List;
import java.util.function.IntUnaryOperator;

/*
  How control leaves a basic block. Labels are the dense integers handed out by CFGBuilder;
  the condition payload C is never inspected here.
 */
public abstract class Terminator<C> {
  Terminator() {
  }

  /* The successor labels in branch order: the true target comes before the false target. */
  public abstract List<Integer> targets();

  /* Rewrites every target label, keeping the shape (and condition) of the terminator. */
  public abstract Terminator<C> relabel(IntUnaryOperator f);

  public static <C> Terminator<C> unreachable() {
    return new Unreachable<>();
  }

  public static <C> Terminator<C> branch(int target) {
    return new Branch<>(target);
  }

  public static <C> Terminator<C> condBranch(C cond, int trueTarget, int falseTarget) {
    return new CondBranch<>(cond, trueTarget, falseTarget);
  }
}
