package edu.kyoto.fos.restruct.structure;

import edu.kyoto.fos.restruct.cfg.BasicBlock;
import edu.kyoto.fos.restruct.cfg.Branch;
import edu.kyoto.fos.restruct.cfg.CondBranch;
import edu.kyoto.fos.restruct.cfg.ControlFlowGraph;
import edu.kyoto.fos.restruct.cfg.Dominators;
import edu.kyoto.fos.restruct.cfg.Exit;
import edu.kyoto.fos.restruct.cfg.ExitEdges;
import edu.kyoto.fos.restruct.cfg.Loop;
import edu.kyoto.fos.restruct.cfg.LoopForest;
import edu.kyoto.fos.restruct.structure.StructuringException.Kind;
import fj.F;
import fj.F2;
import fj.F3;
import fj.Monoid;
import fj.P;
import fj.P2;
import fj.data.Either;
import fj.data.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/*
  Turns a graph into nested loops, conditionals, breaks and continues, emitting every reachable
  block exactly once.

  A block is emitted in place once every arrival into it has been followed: each edge that is not
  a loop exit, plus one for every loop whose breaks all land on it. Until then it is handed back
  up as a pending label together with the number of branches that reached it, so that the
  conditional which split control can emit the join after both arms.
 */
public final class Structurer<S, C> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Structurer.class);

  private final StructureBuilder<S, C> mk;
  private final Monoid<S> seq;
  private final ControlFlowGraph<S, C> cfg;
  private final ExitEdges exits;
  private final Map<Integer, Integer> arrivals = new HashMap<>();
  private final Map<Integer, Either<StructuringException, Integer>> breakTargets = new HashMap<>();

  private Structurer(final StructureBuilder<S, C> mk, final Monoid<S> seq, final ControlFlowGraph<S, C> cfg, final ExitEdges exits) {
    this.mk = mk;
    this.seq = seq;
    this.cfg = cfg;
    this.exits = exits;
    exits.asMap().forEach((edge, exit) -> {
      if(exit.isBreak()) {
        breakTargets.merge(exit.header, Either.right(edge._2()), (old, up) -> sameTarget(exit.header, old, up));
      }
    });
    cfg.getBlocks().forEach((from, bb) -> {
      for(int to : bb.term.targets()) {
        if(!exits.isExit(from, to)) {
          arrivals.merge(to, 1, Integer::sum);
        }
      }
    });
    breakTargets.values().forEach(t -> {
      if(t.isRight()) {
        arrivals.merge(t.right().value(), 1, Integer::sum);
      }
    });
  }

  private static Either<StructuringException, Integer> sameTarget(final int header, final Either<StructuringException, Integer> old, final Either<StructuringException, Integer> up) {
    if(old.isLeft() || old.right().value().equals(up.right().value())) {
      return old;
    }
    return Either.left(StructuringException.multipleBreakTargets(header, old.right().value(), up.right().value()));
  }

  public static <S, C> S structure(final StructureBuilder<S, C> mk, final Monoid<S> seq, final ControlFlowGraph<S, C> cfg) throws StructuringException {
    Option<Dominators> dom = Dominators.compute(cfg);
    if(dom.isNone()) {
      LOGGER.debug("No single-pass dominator solution for graph at {}", cfg.getEntry());
      throw StructuringException.irreducible(cfg.getEntry());
    }
    LoopForest forest = LoopForest.of(cfg, dom.some());
    LOGGER.debug("Loop forest: {}", forest);
    Structurer<S, C> s = new Structurer<>(mk, seq, cfg, ExitEdges.classify(cfg, forest));
    return s.closed(forest, cfg.getEntry());
  }

  public static <S, C> S structure(final F<Integer, S> mkBreak, final F<Integer, S> mkContinue, final F2<Integer, S, S> mkLoop, final F3<C, S, S, S> mkIf,
      final Monoid<S> seq, final ControlFlowGraph<S, C> cfg) throws StructuringException {
    return structure(StructureBuilder.of(mkBreak, mkContinue, mkLoop, mkIf), seq, cfg);
  }

  /* Like structure, with the failure as a value. */
  public static <S, C> Either<StructuringException, S> attempt(final StructureBuilder<S, C> mk, final Monoid<S> seq, final ControlFlowGraph<S, C> cfg) {
    try {
      return Either.right(structure(mk, seq, cfg));
    } catch (StructuringException e) {
      LOGGER.debug("Structuring failed: {}", e.getMessage());
      return Either.left(e);
    }
  }

  /* Structured code starting at label, plus the label it is still waiting on, if any. */
  private static final class Fragment<S> {
    final S body;
    final Option<P2<Integer, Integer>> pending;

    Fragment(final S body, final Option<P2<Integer, Integer>> pending) {
      this.body = body;
      this.pending = pending;
    }
  }

  /*
    Where control goes after one step: a jump statement (or nothing), then either a label to
    structure in place, a label still waiting on other branches, or neither.
   */
  private static final class Link<S> {
    final S jump;
    final Option<Integer> inPlace;
    final Option<P2<Integer, Integer>> pending;

    Link(final S jump, final Option<Integer> inPlace, final Option<P2<Integer, Integer>> pending) {
      this.jump = jump;
      this.inPlace = inPlace;
      this.pending = pending;
    }
  }

  private S closed(final LoopForest scope, final int label) throws StructuringException {
    Fragment<S> f = go(scope, label);
    if(f.pending.isSome()) {
      throw StructuringException.unexpectedEdge(label, f.pending.some()._1());
    }
    return f.body;
  }

  /*
    Follows control from label for as long as the next block is structured in place, so a
    straight run of blocks costs no stack. Only loop bodies and conditional arms recurse.
   */
  private Fragment<S> go(final LoopForest scope, final int start) throws StructuringException {
    List<S> pieces = new ArrayList<>();
    int label = start;
    while(true) {
      Link<S> link;
      Option<Loop> loop = scope.get(label);
      if(loop.isSome()) {
        pieces.add(mk.loop(label, closed(loop.some().nested(), label)));
        Either<StructuringException, Integer> after = breakTargets.get(label);
        if(after == null) {
          return new Fragment<>(concat(pieces), Option.none());
        }
        if(after.isLeft()) {
          throw after.left().value();
        }
        link = arrive(1, after.right().value());
      } else {
        Option<BasicBlock<S, C>> block = cfg.lookup(label);
        if(block.isNone()) {
          throw StructuringException.missingBlock(label);
        }
        BasicBlock<S, C> bb = block.some();
        pieces.add(bb.stmts);
        if(bb.term instanceof Branch) {
          link = next(label, 1, ((Branch<C>) bb.term).target);
        } else if(bb.term instanceof CondBranch) {
          CondBranch<C> cb = (CondBranch<C>) bb.term;
          Fragment<S> t = follow(scope, next(label, 1, cb.trueTarget));
          Fragment<S> f = follow(scope, next(label, 1, cb.falseTarget));
          if(t.pending.isSome() && f.pending.isSome() && t.pending.some()._1().equals(f.pending.some()._1())) {
            int join = t.pending.some()._1();
            int branches = t.pending.some()._2() + f.pending.some()._2();
            pieces.add(mk.ifThenElse(cb.cond, t.body, f.body));
            link = next(label, branches, join);
          } else if(t.pending.isNone() && f.pending.isNone()) {
            // the true arm never falls through, so the false arm simply follows the if
            pieces.add(mk.ifThenElse(cb.cond, t.body, seq.zero()));
            pieces.add(f.body);
            return new Fragment<>(concat(pieces), Option.none());
          } else {
            throw new StructuringException(Kind.UNSUPPORTED_CONDITIONAL,
                "unsupported conditional branch from " + label + " to " + describe(t.pending) + " and " + describe(f.pending),
                label, cb.trueTarget, cb.falseTarget);
          }
        } else {
          return new Fragment<>(concat(pieces), Option.none());
        }
      }
      pieces.add(link.jump);
      if(link.inPlace.isNone()) {
        return new Fragment<>(concat(pieces), link.pending);
      }
      label = link.inPlace.some();
    }
  }

  private Fragment<S> follow(final LoopForest scope, final Link<S> link) throws StructuringException {
    if(link.inPlace.isSome()) {
      return go(scope, link.inPlace.some());
    }
    return new Fragment<>(link.jump, link.pending);
  }

  private Link<S> next(final int label, final int branches, final int to) {
    Option<Exit> exit = exits.get(label, to);
    if(exit.isSome()) {
      Exit e = exit.some();
      return new Link<>(e.isBreak() ? mk.breakFrom(e.header) : mk.continueTo(e.header), Option.none(), Option.none());
    }
    return arrive(branches, to);
  }

  private Link<S> arrive(final int branches, final int to) {
    if(arrivals.getOrDefault(to, 0) == branches) {
      return new Link<>(seq.zero(), Option.some(to), Option.none());
    }
    return new Link<>(seq.zero(), Option.none(), Option.some(P.p(to, branches)));
  }

  /* Balanced sum of the pieces, relying on the monoid being associative. */
  private S concat(final List<S> pieces) {
    return concat(pieces, 0, pieces.size());
  }

  private S concat(final List<S> pieces, final int from, final int to) {
    if(to - from == 0) {
      return seq.zero();
    }
    if(to - from == 1) {
      return pieces.get(from);
    }
    int mid = (from + to) >>> 1;
    return seq.sum(concat(pieces, from, mid), concat(pieces, mid, to));
  }

  private static String describe(final Option<P2<Integer, Integer>> pending) {
    return pending.map(p -> p._1() + " (" + p._2() + " of its branches)").orSome("nothing");
  }
}
