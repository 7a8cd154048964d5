package edu.kyoto.fos.restruct.ir;

import edu.kyoto.fos.restruct.Printable;

import java.util.ArrayList;
import java.util.List;

/*
  A small structured statement tree. Every statement prints as whole lines.
 */
public abstract class Stmt implements Printable {
  public boolean isEmpty() {
    return false;
  }

  /* The effect texts in program order, descending into every branch and loop body. */
  public List<String> effects() {
    List<String> toRet = new ArrayList<>();
    collectEffects(toRet);
    return toRet;
  }

  protected abstract void collectEffects(List<String> out);

  public static Stmt of(final String... effects) {
    List<Stmt> l = new ArrayList<>();
    for(String e : effects) {
      l.add(new Effect(e));
    }
    return Sequence.of(l);
  }

  public static Stmt fromEffects(final List<String> effects) {
    return of(effects.toArray(new String[0]));
  }

  @Override public String toString() {
    return dump();
  }
}
