package edu.kyoto.fos.restruct.cfg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.SortedMap;
import java.util.TreeMap;

/*
  The build context: a label counter plus the blocks added so far. Each build gets its own
  instance, so independent graphs can be built concurrently.
 */
public final class CFGBuilder<S, C> {
  private static final Logger LOGGER = LoggerFactory.getLogger(CFGBuilder.class);

  @FunctionalInterface
  public interface BuildAction<S, C, X extends Exception> {
    /* Adds the blocks of the graph and returns the entry label. */
    int run(CFGBuilder<S, C> b) throws X;
  }

  private int nextLabel = 0;
  private final SortedMap<Integer, BasicBlock<S, C>> blocks = new TreeMap<>();

  private CFGBuilder() {
  }

  public int newLabel() {
    return nextLabel++;
  }

  public int currentLabel() {
    return nextLabel;
  }

  /* Last write for a label wins. */
  public void addBlock(final int label, final S stmts, final Terminator<C> term) {
    if(blocks.put(label, new BasicBlock<>(stmts, term)) != null) {
      LOGGER.debug("Overwriting block {}", label);
    }
  }

  private ControlFlowGraph<S, C> finish(final int entry) {
    LOGGER.debug("Built graph with {} blocks, entry {}", blocks.size(), entry);
    return new ControlFlowGraph<>(entry, blocks);
  }

  public static <S, C, X extends Exception> ControlFlowGraph<S, C> build(final BuildAction<S, C, X> root) throws X {
    CFGBuilder<S, C> b = new CFGBuilder<>();
    int entry = root.run(b);
    return b.finish(entry);
  }
}
