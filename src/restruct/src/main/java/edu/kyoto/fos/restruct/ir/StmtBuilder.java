package edu.kyoto.fos.restruct.ir;

import edu.kyoto.fos.restruct.structure.StructureBuilder;
import fj.F;

public class StmtBuilder<C> implements StructureBuilder<Stmt, C> {
  private final F<C, String> fmtC;

  public StmtBuilder(final F<C, String> fmtC) {
    this.fmtC = fmtC;
  }

  public static StmtBuilder<String> strings() {
    return new StmtBuilder<>(c -> c);
  }

  @Override public Stmt breakFrom(final int header) {
    return Jump.breakFrom(header);
  }

  @Override public Stmt continueTo(final int header) {
    return Jump.continueTo(header);
  }

  @Override public Stmt loop(final int header, final Stmt body) {
    return new LoopStmt(header, body);
  }

  @Override public Stmt ifThenElse(final C cond, final Stmt thenBranch, final Stmt elseBranch) {
    return new IfStmt(fmtC.f(cond), thenBranch, elseBranch);
  }
}
