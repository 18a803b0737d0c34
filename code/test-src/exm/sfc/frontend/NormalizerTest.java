package exm.sfc.frontend;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sfc.PipelineFixture;
import exm.sfc.ast.RemoteCall;
import exm.sfc.ast.RemoteCall.CallKind;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.Stmt.StmtType;
import exm.sfc.common.Logging;
import exm.sfc.common.exceptions.InvalidConstructException;
import exm.sfc.pybackend.PythonWriter;

public class NormalizerTest {

  private static final PythonWriter WRITER = new PythonWriter();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static NormalizedFunction normalize(String... src)
                                                throws Exception {
    return new PipelineFixture(lines(src)).normalize("f");
  }

  private static RemoteCall call(Stmt stmt) {
    assertEquals(StmtType.CALL, stmt.type());
    return ((Stmt.CallStmt)stmt).call;
  }

  @Test
  public void testArgumentHoisted() throws Exception {
    NormalizedFunction f = normalize(
        "def f(x):",
        "    y = cohesion.Lambda.g(x + 1)",
        "    return y");
    List<Stmt> body = f.def.body;

    assertEquals(3, body.size());
    assertEquals("a_1 = x + 1", WRITER.stmt(body.get(0)));
    RemoteCall g = call(body.get(1));
    assertEquals(CallKind.LAMBDA, g.kind);
    assertEquals("g", g.target);
    assertEquals("a_1", g.args.get(0).var);
    assertEquals("y", g.binding);
    assertEquals(StmtType.RETURN, body.get(2).type());

    assertEquals("y", f.resultKey);
    assertTrue(f.initResult);
    assertTrue(f.variables.contains("a_1"));
  }

  @Test
  public void testNestedCallLifted() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    y = len(cohesion.Lambda.g(x)) + 1",
        "    return y").def.body;

    RemoteCall g = call(body.get(0));
    assertEquals("call_1", g.binding);
    assertEquals("x", g.args.get(0).var);
    assertEquals("y = len(call_1) + 1", WRITER.stmt(body.get(1)));
  }

  @Test
  public void testResultKeyForExpression() throws Exception {
    NormalizedFunction f = normalize(
        "def f(x):",
        "    return x + 1");
    assertEquals("ret_1", f.resultKey);
    assertEquals("ret_1 = x + 1", WRITER.stmt(f.def.body.get(0)));
  }

  @Test
  public void testResultKeyWhenControlFallsOff() throws Exception {
    NormalizedFunction f = normalize(
        "def f(x):",
        "    if x:",
        "        return x",
        "    x = 1");
    assertEquals("ret_1", f.resultKey);
    assertTrue(f.initResult);
  }

  @Test
  public void testResultKeyIsParameter() throws Exception {
    NormalizedFunction f = normalize(
        "def f(x):",
        "    if x:",
        "        return x",
        "    return x");
    assertEquals("x", f.resultKey);
    assertFalse(f.initResult);
  }

  @Test
  public void testReturnRemoteCall() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    return cohesion.Lambda.g(x)").def.body;
    assertEquals("ret_1", call(body.get(0)).binding);
    assertEquals(StmtType.RETURN, body.get(1).type());
  }

  @Test
  public void testIfChainTests() throws Exception {
    List<Stmt> body = normalize(
        "def f(x, y):",
        "    if x:",
        "        z = 1",
        "    elif y:",
        "        z = 2",
        "    else:",
        "        z = 3",
        "    return z").def.body;

    assertEquals("test_1 = bool(x)", WRITER.stmt(body.get(0)));
    assertEquals("test_2 = not test_1 and bool(y)",
                 WRITER.stmt(body.get(1)));
    Stmt.If ifStmt = (Stmt.If)body.get(2);
    assertEquals(2, ifStmt.branches.size());
    assertEquals("test_1", WRITER.expr(ifStmt.branches.get(0).cond));
    assertEquals("test_2", WRITER.expr(ifStmt.branches.get(1).cond));
    assertEquals(1, ifStmt.orelse.size());
  }

  @Test
  public void testElifWithRemoteCallNested() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    if x:",
        "        a = 1",
        "    elif cohesion.Lambda.check(x):",
        "        a = 2",
        "    else:",
        "        a = 3",
        "    return a").def.body;

    assertEquals("test_1 = bool(x)", WRITER.stmt(body.get(0)));
    Stmt.If outer = (Stmt.If)body.get(1);
    assertEquals(1, outer.branches.size());

    List<Stmt> orelse = outer.orelse;
    assertEquals(3, orelse.size());
    assertEquals("check", call(orelse.get(0)).target);
    assertEquals("call_1", call(orelse.get(0)).binding);
    assertEquals("test_2 = bool(call_1)", WRITER.stmt(orelse.get(1)));
    Stmt.If inner = (Stmt.If)orelse.get(2);
    assertEquals(1, inner.branches.size());
    assertEquals(1, inner.orelse.size());
  }

  @Test
  public void testWhileHeader() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    while x < cohesion.Lambda.limit():",
        "        x += 1",
        "    return x").def.body;

    Stmt.While loop = (Stmt.While)body.get(0);
    assertEquals(2, loop.header.size());
    assertEquals("limit", call(loop.header.get(0)).target);
    assertEquals(0, call(loop.header.get(0)).keywords.size());
    assertEquals("test_1 = bool(x < call_1)",
                 WRITER.stmt(loop.header.get(1)));
    assertEquals("test_1", WRITER.expr(loop.cond));
    assertEquals("x += 1", WRITER.stmt(loop.body.get(0)));
  }

  @Test
  public void testInfiniteLoopKept() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    while True:",
        "        break",
        "    return x").def.body;
    Stmt.While loop = (Stmt.While)body.get(0);
    assertTrue(loop.header.isEmpty());
    assertEquals("True", WRITER.expr(loop.cond));
  }

  @Test
  public void testDocstringAndPassDropped() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    \"\"\"Does nothing\"\"\"",
        "    pass",
        "    return x").def.body;
    assertEquals(1, body.size());
  }

  @Test
  public void testConditionalOperandRejected() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("conditionally evaluated operand of 'or'");
    normalize(
        "def f(x):",
        "    y = x or cohesion.Lambda.g(x)",
        "    return y");
  }

  @Test
  public void testChainedComparisonRejected() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("chained comparison");
    normalize(
        "def f(x):",
        "    y = 0 < x < cohesion.Lambda.g(x)",
        "    return y");
  }

  @Test
  public void testFirstOperandHoisted() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    y = cohesion.Lambda.g(x) and x",
        "    return y").def.body;
    assertEquals("call_1", call(body.get(0)).binding);
    assertEquals("y = call_1 and x", WRITER.stmt(body.get(1)));
  }

  @Test
  public void testLambdaKeywords() throws Exception {
    RemoteCall g = call(normalize(
        "def f(x):",
        "    y = cohesion.Lambda.g(a=x, b=-2, c='s', d=x * 2)",
        "    return y").def.body.get(1));
    assertEquals(Arrays.asList("a", "b", "c", "d"),
                 g.keywords.keySet().asList());
    assertEquals("x", g.keywords.get("a").var);
    assertEquals(Long.valueOf(-2), g.keywords.get("b").constant.value);
    assertEquals("s", g.keywords.get("c").constant.value);
    assertEquals("a_1", g.keywords.get("d").var);
    assertTrue(g.args.isEmpty());
  }

  @Test
  public void testLambdaTooManyPositional() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("at most one positional argument");
    normalize(
        "def f(x):",
        "    cohesion.Lambda.g(x, x)",
        "    return x");
  }

  @Test
  public void testLambdaMixedArguments() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("can't mix positional and keyword");
    normalize(
        "def f(x):",
        "    cohesion.activity.g(x, y=x)",
        "    return x");
  }

  @Test
  public void testUnknownService() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("unknown remote service cohesion.S3.put");
    normalize(
        "def f(x):",
        "    cohesion.S3.put(x)",
        "    return x");
  }

  @Test
  public void testOptions() throws Exception {
    RemoteCall g = call(normalize(
        "def f(x):",
        "    x = cohesion.Lambda.g(x, timeoutSeconds=5, retry=[",
        "        {'IntervalSeconds': 3, 'BackoffRate': 1.5},",
        "        {'ErrorEquals': ['A', 'B']}])",
        "    return x").def.body.get(0));
    assertEquals(Long.valueOf(5), g.timeoutSeconds);
    assertNull(g.heartbeatSeconds);
    assertEquals(2, g.retries.size());
    assertEquals(Arrays.asList("States.ALL"), g.retries.get(0).errors);
    assertEquals(Long.valueOf(3), g.retries.get(0).intervalSeconds);
    assertEquals(Double.valueOf(1.5), g.retries.get(0).backoffRate);
    assertEquals(Arrays.asList("A", "B"), g.retries.get(1).errors);
    assertTrue(g.keywords.isEmpty());
  }

  @Test
  public void testBadTimeout() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("timeout must be a positive integer literal");
    normalize(
        "def f(x):",
        "    cohesion.Lambda.g(x, timeout=0)",
        "    return x");
  }

  @Test
  public void testSleep() throws Exception {
    List<Stmt> body = normalize(
        "def f(x):",
        "    cohesion.sleep(10)",
        "    cohesion.sleep(x)",
        "    return x").def.body;
    RemoteCall first = call(body.get(0));
    assertEquals(CallKind.SLEEP, first.kind);
    assertEquals(Long.valueOf(10), first.args.get(0).constant.value);
    assertEquals("x", call(body.get(1)).args.get(0).var);
  }

  @Test
  public void testSleepNegative() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("non-negative integer");
    normalize(
        "def f(x):",
        "    cohesion.sleep(-1)",
        "    return x");
  }

  @Test
  public void testSleepHasNoResult() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("does not return a value");
    normalize(
        "def f(x):",
        "    y = cohesion.sleep(1)",
        "    return y");
  }

  @Test
  public void testWorkflowArguments() throws Exception {
    RemoteCall c = call(new PipelineFixture(lines(
        "def child(a, b):",
        "    return a",
        "",
        "def f(x):",
        "    r = child(b=x, a=1)",
        "    return r")).normalize("f").def.body.get(0));
    assertEquals(CallKind.WORKFLOW, c.kind);
    assertEquals(Arrays.asList("a", "b"), c.keywords.keySet().asList());
    assertEquals(Long.valueOf(1), c.keywords.get("a").constant.value);
    assertEquals("x", c.keywords.get("b").var);
  }

  private void workflowCall(String call) throws Exception {
    new PipelineFixture(lines(
        "def child(a, b):",
        "    return a",
        "",
        "def f(x):",
        "    r = " + call,
        "    return r")).normalize("f");
  }

  @Test
  public void testWorkflowTooManyArguments() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("child takes 2 arguments but 3 were given");
    workflowCall("child(1, 2, 3)");
  }

  @Test
  public void testWorkflowUnknownKeyword() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("child has no parameter named c");
    workflowCall("child(1, c=2)");
  }

  @Test
  public void testWorkflowDuplicateArgument() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("multiple values for argument a");
    workflowCall("child(1, a=2)");
  }

  @Test
  public void testWorkflowMissingArgument() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("child missing argument b");
    workflowCall("child(1)");
  }

  @Test
  public void testVariableShadowsWorkflow() throws Exception {
    List<Stmt> body = new PipelineFixture(lines(
        "def child(a):",
        "    return a",
        "",
        "def f(child):",
        "    r = child(1)",
        "    return r")).normalize("f").def.body;
    assertEquals("r = child(1)", WRITER.stmt(body.get(0)));
  }
}
