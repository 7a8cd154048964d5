package edu.kyoto.fos.restruct.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import edu.kyoto.fos.restruct.Fixtures;
import edu.kyoto.fos.restruct.ir.Stmt;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link CFGPrinter}. */
@RunWith(JUnit4.class)
public final class CFGPrinterTest {

  @Test
  public void diamond() {
    String expected = ""
        + "start @0\n"
        + "3:\n"
        + "    z\n"
        + "    // unreachable\n"
        + "\n"
        + "2:\n"
        + "    y\n"
        + "    goto 3;\n"
        + "\n"
        + "1:\n"
        + "    x\n"
        + "    goto 3;\n"
        + "\n"
        + "0:\n"
        + "    a\n"
        + "    if(c) goto 1; else goto 2;\n"
        + "\n";
    assertEquals(expected, Fixtures.load("diamond").cfg.dump(Stmt::dump, c -> c));
  }

  @Test
  public void emptyBlocksPrintOnlyTheirTerminator() {
    String expected = ""
        + "start @0\n"
        + "5:\n"
        + "    z\n"
        + "    // unreachable\n"
        + "\n"
        + "4:\n"
        + "    goto 5;\n"
        + "\n"
        + "3:\n"
        + "    b\n"
        + "    goto 4;\n"
        + "\n"
        + "2:\n"
        + "    goto 4;\n"
        + "\n"
        + "1:\n"
        + "    a\n"
        + "    if(c) goto 2; else goto 3;\n"
        + "\n"
        + "0:\n"
        + "    goto 1;\n"
        + "\n";
    assertEquals(expected, Fixtures.load("redirects").cfg.dump(Stmt::dump, c -> c));
  }

  @Test
  public void everyStatementGetsItsOwnLine() {
    String dump = new CFGPrinter<Stmt, String>(Stmt::dump, c -> "(" + c + ")").print(Fixtures.load("sum").cfg);
    assertTrue(dump.contains("0:\n    i = 0\n    s = 0\n    goto 1;\n"));
    assertTrue(dump.contains("1:\n    if((i < n)) goto 2; else goto 5;\n"));
  }
}
