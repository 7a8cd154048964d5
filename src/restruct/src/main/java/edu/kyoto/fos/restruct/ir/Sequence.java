package edu.kyoto.fos.restruct.ir;

import fj.Monoid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/* Statements in order. Never nested: concatenation splices sequences together. */
public class Sequence extends Stmt {
  public static final Sequence EMPTY = new Sequence(Collections.emptyList());
  public static final Monoid<Stmt> MONOID = Monoid.monoid(Sequence::concat, EMPTY);

  public final List<Stmt> stmts;

  private Sequence(final List<Stmt> stmts) {
    this.stmts = Collections.unmodifiableList(stmts);
  }

  public static Stmt of(final List<Stmt> stmts) {
    List<Stmt> flat = new ArrayList<>();
    for(Stmt s : stmts) {
      if(s instanceof Sequence) {
        flat.addAll(((Sequence) s).stmts);
      } else {
        flat.add(s);
      }
    }
    if(flat.size() == 1) {
      return flat.get(0);
    }
    return flat.isEmpty() ? EMPTY : new Sequence(flat);
  }

  public static Stmt concat(final Stmt a, final Stmt b) {
    if(a.isEmpty()) {
      return b;
    }
    if(b.isEmpty()) {
      return a;
    }
    List<Stmt> l = new ArrayList<>();
    l.add(a);
    l.add(b);
    return of(l);
  }

  @Override public boolean isEmpty() {
    return stmts.isEmpty();
  }

  @Override protected void collectEffects(final List<String> out) {
    stmts.forEach(s -> s.collectEffects(out));
  }

  @Override public void printAt(final int level, final StringBuilder b) {
    stmts.forEach(s -> s.printAt(level, b));
  }

  @Override public boolean equals(final Object o) {
    return o instanceof Sequence && stmts.equals(((Sequence) o).stmts);
  }

  @Override public int hashCode() {
    return stmts.hashCode();
  }
}
