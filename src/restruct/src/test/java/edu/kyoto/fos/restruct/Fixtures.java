package edu.kyoto.fos.restruct;

import edu.kyoto.fos.restruct.config.CfgReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Graph descriptions under src/test/resources/cfgs. */
public final class Fixtures {
  private Fixtures() {
  }

  public static CfgReader.Parsed load(String name) {
    try(InputStream is = Fixtures.class.getResourceAsStream("/cfgs/" + name + ".yml")) {
      if(is == null) {
        throw new IllegalArgumentException("No fixture " + name);
      }
      return CfgReader.read(is);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Path path(String name) {
    try {
      return Paths.get(Fixtures.class.getResource("/cfgs/" + name + ".yml").toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }
}
