package edu.kyoto.fos.restruct.cfg;

import java.util.Objects;

public final class BasicBlock<S, C> {
  public final S stmts;
  public final Terminator<C> term;

  public BasicBlock(final S stmts, final Terminator<C> term) {
    this.stmts = stmts;
    this.term = term;
  }

  public BasicBlock<S, C> withTerminator(final Terminator<C> t) {
    return new BasicBlock<>(stmts, t);
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final BasicBlock<?, ?> that = (BasicBlock<?, ?>) o;
    return Objects.equals(stmts, that.stmts) && Objects.equals(term, that.term);
  }

  @Override public int hashCode() {
    return Objects.hash(stmts, term);
  }

  @Override public String toString() {
    return "{" + stmts + " " + term + "}";
  }
}
