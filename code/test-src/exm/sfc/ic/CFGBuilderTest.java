package exm.sfc.ic;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sfc.PipelineFixture;
import exm.sfc.common.Logging;
import exm.sfc.common.exceptions.InvalidConstructException;
import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.ic.tree.Terminator;
import exm.sfc.ic.tree.Terminator.BranchKind;
import exm.sfc.ic.tree.Terminator.TerminatorType;

public class CFGBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static ControlFlowGraph cfg(String... src) throws Exception {
    return new PipelineFixture(lines(src)).cfg("f");
  }

  @Test
  public void testStraightLine() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    y = x + 1",
        "    z = y * 2",
        "    return z");
    Block entry = g.entry();
    assertEquals(2, entry.stmts().size());
    assertEquals(TerminatorType.FALLTHROUGH, entry.getTerminator().type());
    assertSame(g.exit(), entry.successors().get(0));
    assertEquals(TerminatorType.EXIT, g.exit().getTerminator().type());
    assertEquals(2, g.reachableBlocks().size());
  }

  @Test
  public void testCallSplitsBlock() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    y = x + 1",
        "    z = cohesion.Lambda.g(y)",
        "    w = z + 1",
        "    return w");
    Block entry = g.entry();
    assertEquals(1, entry.stmts().size());
    Terminator.Call call = (Terminator.Call)entry.getTerminator();
    assertEquals("g", call.call.target);
    assertTrue(call.handlers.isEmpty());
    assertEquals(1, call.next.stmts().size());
    assertSame(g.exit(), call.next.successors().get(0));
  }

  @Test
  public void testIfChainBranches() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x, y):",
        "    if x:",
        "        cohesion.Lambda.a()",
        "    elif y:",
        "        cohesion.Lambda.b()",
        "    return x");
    Terminator.Branch first = (Terminator.Branch)g.entry().getTerminator();
    assertEquals(BranchKind.IF, first.kind);
    assertEquals("test_1", first.testVar);

    Block link = first.ifFalse;
    assertTrue(link.isEmpty());
    Terminator.Branch second = (Terminator.Branch)link.getTerminator();
    assertEquals(BranchKind.ELIF, second.kind);
    assertEquals("test_2", second.testVar);

    // No else: false edge of last test goes to the merge
    Block merge = second.ifFalse;
    assertEquals(TerminatorType.FALLTHROUGH, merge.getTerminator().type());
    assertSame(g.exit(), merge.successors().get(0));
  }

  @Test
  public void testWhileLoop() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    while x:",
        "        x = cohesion.Lambda.dec(x)",
        "        if x:",
        "            continue",
        "    return x");
    Block header = g.entry().successors().get(0);
    assertTrue(header.isLoopHeader());
    assertEquals(1, header.stmts().size());
    Terminator.Branch test = (Terminator.Branch)header.getTerminator();
    assertEquals(BranchKind.WHILE, test.kind);

    Block post = test.ifFalse;
    assertSame(g.exit(), post.successors().get(0));

    Terminator.Call call = (Terminator.Call)test.ifTrue.getTerminator();
    Terminator.Branch inner = (Terminator.Branch)call.next.getTerminator();
    Terminator loopBack = inner.ifTrue.getTerminator();
    assertEquals(TerminatorType.LOOP_BACK, loopBack.type());
    assertSame(header, loopBack.successors().get(0));
    assertEquals(TerminatorType.LOOP_BACK,
                 inner.ifFalse.getTerminator().type());
  }

  @Test
  public void testBreakTargetsPost() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    while True:",
        "        x = cohesion.Lambda.dec(x)",
        "        if x:",
        "            break",
        "    return x");
    Block header = g.entry().successors().get(0);
    Block body = header.successors().get(0);
    Terminator.Call call = (Terminator.Call)body.getTerminator();
    Terminator.Branch test = (Terminator.Branch)call.next.getTerminator();
    Terminator.Break br = (Terminator.Break)test.ifTrue.getTerminator();
    assertSame(g.exit(), br.post.successors().get(0));
  }

  @Test
  public void testTryHandlers() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    try:",
        "        x = cohesion.Lambda.a(x)",
        "        cohesion.sleep(1)",
        "    except E as err:",
        "        x = err",
        "    x = cohesion.Lambda.b(x)",
        "    return x");
    Terminator.Call a = (Terminator.Call)g.entry().getTerminator();
    assertEquals(1, a.handlers.entries().size());
    assertEquals("err", a.handlers.entries().get(0).errorVar);
    Block handler = a.handlers.entries().get(0).target;
    assertEquals(1, handler.stmts().size());
    assertEquals(1, g.entry().exceptionSuccessors().size());

    Terminator.Call sleep = (Terminator.Call)a.next.getTerminator();
    assertTrue(sleep.handlers.isEmpty());

    // Call after the try is outside its scope
    Block post = sleep.next.successors().get(0);
    Terminator.Call b = (Terminator.Call)post.getTerminator();
    assertEquals("b", b.call.target);
    assertTrue(b.handlers.isEmpty());
    assertSame(post, handler.successors().get(0));
  }

  @Test
  public void testUnreachableDropped() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    return x",
        "    x = cohesion.Lambda.never(x)");
    List<Block> reachable = g.reachableBlocks();
    assertEquals(2, reachable.size());
    for (Block b: reachable) {
      assertFalse(b.getTerminator().type() == TerminatorType.CALL);
    }
  }

  @Test
  public void testBreakOutsideLoop() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("'break' outside loop");
    cfg("def f(x):",
        "    if x:",
        "        break",
        "    return x");
  }

  @Test
  public void testContinueOutsideLoop() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("'continue' outside loop");
    cfg("def f(x):",
        "    continue");
  }

  @Test
  public void testLoopWithoutExit() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("function f can never complete");
    cfg("def f(x):",
        "    while True:",
        "        x = x + 1",
        "    return x");
  }

  @Test
  public void testReturnInsideInfiniteLoop() throws Exception {
    ControlFlowGraph g = cfg(
        "def f(x):",
        "    while True:",
        "        x = cohesion.Lambda.dec(x)",
        "        if x:",
        "            return x");
    assertTrue(g.reachableBlocks().contains(g.exit()));
  }
}
