package edu.kyoto.fos.restruct.config;

import edu.kyoto.fos.restruct.cfg.CFGBuilder;
import edu.kyoto.fos.restruct.cfg.ControlFlowGraph;
import edu.kyoto.fos.restruct.cfg.Terminator;
import edu.kyoto.fos.restruct.ir.Stmt;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
  Reads a graph description:

    entry: start
    blocks:
      start: { stmts: [a], if: c, then: body, else: done }
      body:  { stmts: [b], goto: start }
      done:  { stmts: [d] }

  Block names are arbitrary; each is given a label by the builder in order of first mention, so a
  target with no block of its own still gets a label (and fails later as a missing block).
 */
public class CfgReader {
  public static final String ENTRY = "entry";
  public static final String BLOCKS = "blocks";

  public static class Parsed {
    public final ControlFlowGraph<Stmt, String> cfg;
    public final Map<String, Integer> labels;

    Parsed(final ControlFlowGraph<Stmt, String> cfg, final Map<String, Integer> labels) {
      this.cfg = cfg;
      this.labels = Collections.unmodifiableMap(labels);
    }

    public int label(final String name) {
      Integer l = labels.get(name);
      if(l == null) {
        throw new IllegalArgumentException("No block named " + name);
      }
      return l;
    }
  }

  public static Parsed read(final Path p) throws IOException {
    try(Reader r = Files.newBufferedReader(p)) {
      return read(r);
    }
  }

  public static Parsed read(final InputStream is) {
    return parse(new Yaml().load(is));
  }

  public static Parsed read(final Reader r) {
    return parse(new Yaml().load(r));
  }

  public static Parsed read(final String yaml) {
    return read(new StringReader(yaml));
  }

  private static Parsed parse(final Object doc) {
    Map<?, ?> top = asMap(doc, "document");
    if(!top.containsKey(ENTRY)) {
      throw new IllegalArgumentException("Missing " + ENTRY);
    }
    Map<?, ?> blocks = asMap(top.get(BLOCKS), BLOCKS);
    Map<String, Integer> labels = new LinkedHashMap<>();
    ControlFlowGraph<Stmt, String> cfg = CFGBuilder.<Stmt, String, RuntimeException>build(b -> {
      for(Object k : blocks.keySet()) {
        labelFor(b, labels, k);
      }
      for(Map.Entry<?, ?> e : blocks.entrySet()) {
        String name = String.valueOf(e.getKey());
        Map<?, ?> desc = e.getValue() == null ? Collections.emptyMap() : asMap(e.getValue(), name);
        b.addBlock(labels.get(name), stmts(desc, name), terminator(b, labels, desc, name));
      }
      return labelFor(b, labels, top.get(ENTRY));
    });
    return new Parsed(cfg, labels);
  }

  private static int labelFor(final CFGBuilder<Stmt, String> b, final Map<String, Integer> labels, final Object name) {
    return labels.computeIfAbsent(String.valueOf(name), k -> b.newLabel());
  }

  private static Stmt stmts(final Map<?, ?> desc, final String name) {
    Object s = desc.get("stmts");
    if(s == null) {
      return Stmt.of();
    }
    if(!(s instanceof List)) {
      throw new IllegalArgumentException("stmts of " + name + " must be a list");
    }
    List<String> effects = new ArrayList<>();
    for(Object o : (List<?>) s) {
      effects.add(String.valueOf(o));
    }
    return Stmt.fromEffects(effects);
  }

  private static Terminator<String> terminator(final CFGBuilder<Stmt, String> b, final Map<String, Integer> labels, final Map<?, ?> desc, final String name) {
    if(desc.containsKey("goto")) {
      if(desc.containsKey("if")) {
        throw new IllegalArgumentException("Block " + name + " has both goto and if");
      }
      return Terminator.branch(labelFor(b, labels, desc.get("goto")));
    }
    if(desc.containsKey("if")) {
      if(!desc.containsKey("then") || !desc.containsKey("else")) {
        throw new IllegalArgumentException("Conditional block " + name + " needs then and else");
      }
      return Terminator.condBranch(String.valueOf(desc.get("if")), labelFor(b, labels, desc.get("then")), labelFor(b, labels, desc.get("else")));
    }
    return Terminator.unreachable();
  }

  private static Map<?, ?> asMap(final Object o, final String what) {
    if(!(o instanceof Map)) {
      throw new IllegalArgumentException("Expected a mapping for " + what + ", got " + o);
    }
    return (Map<?, ?>) o;
  }
}
