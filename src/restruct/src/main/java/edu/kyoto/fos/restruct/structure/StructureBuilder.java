package edu.kyoto.fos.restruct.structure;

import fj.F;
import fj.F2;
import fj.F3;

/*
  Constructors for the target language's structured statements. A loop is identified by its
  header label; break and continue name the loop they leave or restart.
 */
public interface StructureBuilder<S, C> {
  S breakFrom(int header);

  S continueTo(int header);

  /* An unconditional loop around body. */
  S loop(int header, S body);

  S ifThenElse(C cond, S thenBranch, S elseBranch);

  static <S, C> StructureBuilder<S, C> of(final F<Integer, S> mkBreak, final F<Integer, S> mkContinue, final F2<Integer, S, S> mkLoop, final F3<C, S, S, S> mkIf) {
    return new StructureBuilder<S, C>() {
      @Override public S breakFrom(final int header) {
        return mkBreak.f(header);
      }

      @Override public S continueTo(final int header) {
        return mkContinue.f(header);
      }

      @Override public S loop(final int header, final S body) {
        return mkLoop.f(header, body);
      }

      @Override public S ifThenElse(final C cond, final S thenBranch, final S elseBranch) {
        return mkIf.f(cond, thenBranch, elseBranch);
      }
    };
  }
}
