package exm.sfc.pybackend;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sfc.ast.Module;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.parser.Parser;
import exm.sfc.common.exceptions.SFCRuntimeError;

public class PythonWriterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Stmt parseStmt(String stmt) throws Exception {
    Module m = Parser.parse("test.py", "def f():\n    " + stmt + "\n");
    return m.functions.get(0).body.get(0);
  }

  /**
   * Round trip a statement through parser and writer
   */
  private static String rewrite(String stmt, String... envVars)
                                                  throws Exception {
    Set<String> vars = new HashSet<String>(Arrays.asList(envVars));
    return new PythonWriter(vars).stmt(parseStmt(stmt));
  }

  @Test
  public void testMinimalParentheses() throws Exception {
    assertEquals("y = (a + b) * c", rewrite("y = (a + b) * c"));
    assertEquals("y = a + b * c", rewrite("y = a + (b * c)"));
    assertEquals("y = a - b - c", rewrite("y = a - b - c"));
    assertEquals("y = a - (b - c)", rewrite("y = a - (b - c)"));
    assertEquals("y = not (a and b)", rewrite("y = not (a and b)"));
    assertEquals("y = (a or b) and c", rewrite("y = (a or b) and c"));
    assertEquals("y = a < b == c", rewrite("y = a < b == c"));
  }

  @Test
  public void testPower() throws Exception {
    assertEquals("y = -x ** 2", rewrite("y = -x ** 2"));
    assertEquals("y = (-x) ** 2", rewrite("y = (-x) ** 2"));
    assertEquals("y = 2 ** -x", rewrite("y = 2 ** -x"));
  }

  @Test
  public void testLiteralsKeepSourceText() throws Exception {
    assertEquals("y = 'it\\'s'", rewrite("y = 'it\\'s'"));
    assertEquals("y = 0x1F + 1.50", rewrite("y = 0x1F + 1.50"));
    assertEquals("y = (1,)", rewrite("y = (1,)"));
    assertEquals("y = {'a': [1, 2], 'b': None}",
                 rewrite("y = {'a': [1, 2], 'b': None}"));
  }

  @Test
  public void testEnvironmentReferences() throws Exception {
    assertEquals("env['y'] = len(env['x']) + z",
                 rewrite("y = len(x) + z", "x", "y"));
    assertEquals("env['d']['k'] += env['x'].count",
                 rewrite("d['k'] += x.count", "d", "x"));
    assertEquals("print(env['x'], sep=env['s'])",
                 rewrite("print(x, sep=s)", "x", "s"));
  }

  @Test
  public void testControlFlowRejected() throws Exception {
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("can't appear in a function unit");
    new PythonWriter().stmt(parseStmt("return x"));
  }
}
