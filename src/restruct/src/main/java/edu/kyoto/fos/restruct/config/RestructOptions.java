package edu.kyoto.fos.restruct.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

public class RestructOptions {
  public static final String ELIMINATE_EMPTY = "eliminateEmptyBlocks";
  public static final String DUMP_CFG = "dumpCfg";

  public final boolean eliminateEmptyBlocks;
  public final boolean dumpCfg;

  public RestructOptions(final boolean eliminateEmptyBlocks, final boolean dumpCfg) {
    this.eliminateEmptyBlocks = eliminateEmptyBlocks;
    this.dumpCfg = dumpCfg;
  }

  public static RestructOptions defaults() {
    return fromMap(Collections.emptyMap());
  }

  public static RestructOptions load(final Path p) throws IOException {
    try(Reader r = Files.newBufferedReader(p)) {
      Object doc = new Yaml().load(r);
      if(doc == null) {
        return defaults();
      }
      if(!(doc instanceof Map)) {
        throw new IllegalArgumentException("Options must be a mapping: " + p);
      }
      return fromMap((Map<?, ?>) doc);
    }
  }

  public static RestructOptions fromMap(final Map<?, ?> options) {
    return new RestructOptions(flag(options, ELIMINATE_EMPTY, true), flag(options, DUMP_CFG, false));
  }

  private static boolean flag(final Map<?, ?> options, final String key, final boolean def) {
    Object v = options.get(key);
    if(v == null) {
      return def;
    }
    if(!(v instanceof Boolean)) {
      throw new IllegalArgumentException("Option " + key + " must be true or false, got " + v);
    }
    return (Boolean) v;
  }

  @Override public String toString() {
    return "{" + ELIMINATE_EMPTY + "=" + eliminateEmptyBlocks + ", " + DUMP_CFG + "=" + dumpCfg + "}";
  }
}
