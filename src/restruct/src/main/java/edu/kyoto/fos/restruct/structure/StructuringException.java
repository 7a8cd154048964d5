package edu.kyoto.fos.restruct.structure;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/*
  The graph cannot be expressed as nested loops and conditionals without duplicating a block.
  Nothing is emitted for a graph that fails; the caller chooses a fallback.
 */
public class StructuringException extends Exception {
  public enum Kind {
    IRREDUCIBLE,
    MISSING_BLOCK,
    MULTIPLE_BREAK_TARGETS,
    UNSUPPORTED_CONDITIONAL,
    UNEXPECTED_EDGE
  }

  private final Kind kind;
  private final List<Integer> labels;

  public StructuringException(final Kind kind, final String message, final Integer... labels) {
    super(message);
    this.kind = kind;
    this.labels = Collections.unmodifiableList(Arrays.asList(labels));
  }

  public Kind getKind() {
    return kind;
  }

  /* The offending labels, most specific first. */
  public List<Integer> getLabels() {
    return labels;
  }

  static StructuringException irreducible(final int entry) {
    return new StructuringException(Kind.IRREDUCIBLE, "irreducible control flow reachable from " + entry, entry);
  }

  static StructuringException missingBlock(final int label) {
    return new StructuringException(Kind.MISSING_BLOCK, "missing block " + label, label);
  }

  static StructuringException multipleBreakTargets(final int header, final int first, final int second) {
    return new StructuringException(Kind.MULTIPLE_BREAK_TARGETS, "multiple break targets from " + header, header, first, second);
  }

  static StructuringException unexpectedEdge(final int label, final int target) {
    return new StructuringException(Kind.UNEXPECTED_EDGE, "unexpected edge from " + label + " to " + target, label, target);
  }
}
