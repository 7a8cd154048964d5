package edu.kyoto.fos.restruct;

import edu.kyoto.fos.restruct.cfg.ControlFlowGraph;
import edu.kyoto.fos.restruct.cfg.EmptyBlockEliminator;
import edu.kyoto.fos.restruct.config.CfgReader;
import edu.kyoto.fos.restruct.config.RestructOptions;
import edu.kyoto.fos.restruct.ir.Sequence;
import edu.kyoto.fos.restruct.ir.Stmt;
import edu.kyoto.fos.restruct.ir.StmtBuilder;
import edu.kyoto.fos.restruct.structure.Structurer;
import edu.kyoto.fos.restruct.structure.StructuringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;

/*
  restruct <cfg.yml> [options.yml]

  Prints the structured form of the graph, or exits with status 1 when it cannot be structured.
 */
public class Restruct {
  private static final Logger LOGGER = LoggerFactory.getLogger(Restruct.class);

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  public static int run(final String[] args, final PrintStream out) {
    if(args.length < 1 || args.length > 2) {
      System.err.println("usage: restruct <cfg.yml> [options.yml]");
      return 2;
    }
    try {
      RestructOptions opts = args.length == 2 ? RestructOptions.load(Paths.get(args[1])) : RestructOptions.defaults();
      LOGGER.debug("Options: {}", opts);
      return run(CfgReader.read(Paths.get(args[0])).cfg, opts, out);
    } catch (IOException | IllegalArgumentException | YAMLException e) {
      LOGGER.error("Could not read input: {}", e.getMessage());
      return 2;
    }
  }

  public static int run(final ControlFlowGraph<Stmt, String> input, final RestructOptions opts, final PrintStream out) {
    ControlFlowGraph<Stmt, String> cfg = input;
    if(opts.eliminateEmptyBlocks) {
      cfg = EmptyBlockEliminator.eliminate(cfg, Stmt::isEmpty);
    }
    if(opts.dumpCfg) {
      out.print(cfg.dump(Stmt::dump, c -> c));
    }
    try {
      Stmt s = Structurer.structure(StmtBuilder.strings(), Sequence.MONOID, cfg);
      out.print(s.dump());
      return 0;
    } catch (StructuringException e) {
      LOGGER.warn("Cannot structure graph at {}: {}", cfg.getEntry(), e.getMessage());
      return 1;
    }
  }
}
