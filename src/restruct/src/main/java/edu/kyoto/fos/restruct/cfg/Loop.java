package edu.kyoto.fos.restruct.cfg;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public final class Loop {
  private final int header;
  private final SortedSet<Integer> all;
  private final LoopForest nested;

  public Loop(final int header, final SortedSet<Integer> all, final LoopForest nested) {
    assert all.contains(header) : header + " " + all;
    this.header = header;
    this.all = Collections.unmodifiableSortedSet(new TreeSet<>(all));
    this.nested = nested;
  }

  public int getHeader() {
    return header;
  }

  /* Every member, header included. */
  public SortedSet<Integer> all() {
    return all;
  }

  public boolean contains(final int label) {
    return all.contains(label);
  }

  public LoopForest nested() {
    return nested;
  }

  @Override public boolean equals(final Object o) {
    if(this == o)
      return true;
    if(o == null || getClass() != o.getClass())
      return false;
    final Loop loop = (Loop) o;
    return header == loop.header && Objects.equals(all, loop.all) && Objects.equals(nested, loop.nested);
  }

  @Override public int hashCode() {
    return Objects.hash(header, all, nested);
  }

  @Override public String toString() {
    return header + ":" + all + (nested.isEmpty() ? "" : " " + nested);
  }
}
