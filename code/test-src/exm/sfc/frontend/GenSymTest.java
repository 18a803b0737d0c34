package exm.sfc.frontend;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import exm.sfc.ast.parser.Parser;

public class GenSymTest {

  @Test
  public void testCountsPerPrefix() {
    GenSym gensym = new GenSym(new HashSet<String>());
    assertEquals("a_1", gensym.sym("a"));
    assertEquals("b_1", gensym.sym("b"));
    assertEquals("a_2", gensym.sym("a"));
  }

  @Test
  public void testSkipsReserved() {
    GenSym gensym = new GenSym(new HashSet<String>(
                                  Arrays.asList("test_1", "test_3")));
    assertEquals("test_2", gensym.sym("test"));
    assertEquals("test_4", gensym.sym("test"));
  }

  @Test
  public void testSkipsSourceNames() throws Exception {
    GenSym gensym = new GenSym(Parser.parse("test.py", lines(
        "def f(call_1):",
        "    ret_1 = call_1",
        "    return ret_1")));
    assertEquals("call_2", gensym.sym("call"));
    assertEquals("ret_2", gensym.sym("ret"));
  }
}
