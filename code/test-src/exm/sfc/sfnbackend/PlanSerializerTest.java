package exm.sfc.sfnbackend;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sfc.PipelineFixture;
import exm.sfc.ast.SourceLocation;
import exm.sfc.common.Logging;
import exm.sfc.common.exceptions.SFCRuntimeError;
import exm.sfc.sfnbackend.tree.Catcher;
import exm.sfc.sfnbackend.tree.ChoiceState;
import exm.sfc.sfnbackend.tree.ChoiceState.ChoiceRule;
import exm.sfc.sfnbackend.tree.PassState;
import exm.sfc.sfnbackend.tree.Retrier;
import exm.sfc.sfnbackend.tree.StateMachine;
import exm.sfc.sfnbackend.tree.TaskState;

public class PlanSerializerTest {

  private static final SourceLocation LOC = SourceLocation.UNKNOWN;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static PassState pass(String name, String next) {
    return PassState.transfer(name, LOC, next);
  }

  private static PassState end(String name) {
    return new PassState(name, LOC, "$", null, "$.env.r", null, true);
  }

  @Test
  public void testIdentityPlanText() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def f(x):",
        "    return x")).lower("f");
    String expected = lines(
        "{",
        "  \"StartAt\": \"env_init\",",
        "  \"States\": {",
        "    \"env_init\": {",
        "      \"Type\": \"Pass\",",
        "      \"InputPath\": \"$\",",
        "      \"Parameters\": {",
        "        \"env\": {",
        "          \"x.$\": \"$.x\"",
        "        }",
        "      },",
        "      \"Next\": \"exit_pass\"",
        "    },",
        "    \"exit_pass\": {",
        "      \"Type\": \"Pass\",",
        "      \"InputPath\": \"$\",",
        "      \"OutputPath\": \"$.env.x\",",
        "      \"End\": true",
        "    }",
        "  }",
        "}");
    assertEquals(expected, PlanSerializer.serialize(f.plan));
  }

  @Test
  public void testTaskFieldOrder() throws Exception {
    StateMachine plan = new StateMachine("main", "t");
    plan.define(new TaskState("t", LOC, "arn:fn", "$", null, "$",
        "$.env.r", 30L, null,
        Arrays.asList(new Retrier(Arrays.asList("States.ALL"), 1L, 3L, 2.0)),
        Arrays.asList(new Catcher(Arrays.asList("E"), "$.discard_1", "x")),
        "x"));
    plan.define(end("x"));

    String text = PlanSerializer.serialize(plan);
    String task = text.substring(text.indexOf("\"t\": {"),
                                 text.indexOf("\"x\": {"));
    int prev = -1;
    for (String field: Arrays.asList("Type", "Resource", "InputPath",
             "OutputPath", "ResultPath", "TimeoutSeconds", "Retry", "Catch",
             "Next")) {
      int pos = task.indexOf("\"" + field + "\"");
      assertEquals(field + " present", true, pos >= 0);
      assertEquals(field + " in order", true, pos > prev);
      prev = pos;
    }
  }

  @Test
  public void testEmptyParameters() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def f():",
        "    cohesion.Lambda.ping()")).lower("f");
    String text = PlanSerializer.serialize(f.plan);
    assertEquals(true, text.contains("\"Parameters\": {},"));
  }

  @Test
  public void testSerializationDeterministic() throws Exception {
    String src = lines(
        "def main(x):",
        "    try:",
        "        y = cohesion.Lambda.work(x)",
        "    except K1 as e:",
        "        y = e",
        "    while y:",
        "        y = cohesion.Lambda.work(y)",
        "    return y");
    String first = PlanSerializer.serialize(
                        new PipelineFixture(src).lower("main").plan);
    String second = PlanSerializer.serialize(
                        new PipelineFixture(src).lower("main").plan);
    assertEquals(first, second);
  }

  @Test
  public void testRejectsMissingTarget() {
    StateMachine plan = new StateMachine("main", "a");
    plan.define(pass("a", "nowhere"));
    plan.define(end("b"));
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("missing state nowhere");
    PlanSerializer.validate(plan);
  }

  @Test
  public void testRejectsUndefinedReservation() {
    StateMachine plan = new StateMachine("main", "a");
    plan.define(pass("a", "b"));
    plan.reserve("c");
    plan.define(end("b"));
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("reserved but never defined");
    PlanSerializer.validate(plan);
  }

  @Test
  public void testRejectsTwoEnds() {
    StateMachine plan = new StateMachine("main", "a");
    plan.define(new ChoiceState("a", LOC,
        Arrays.asList(new ChoiceRule("$.env.t", "b")), "c"));
    plan.define(end("b"));
    plan.define(end("c"));
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("exactly one end state");
    PlanSerializer.validate(plan);
  }

  @Test
  public void testRejectsUnreachable() {
    StateMachine plan = new StateMachine("main", "a");
    plan.define(pass("a", "b"));
    plan.define(end("b"));
    plan.define(pass("orphan", "b"));
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("orphan is unreachable");
    PlanSerializer.validate(plan);
  }

  @Test
  public void testCatchTargetsAreReachable() {
    StateMachine plan = new StateMachine("main", "t");
    plan.define(new TaskState("t", LOC, "arn:fn", "$", null, "$", "$.env.r",
        null, null, new ArrayList<Retrier>(),
        Arrays.asList(new Catcher(Arrays.asList("States.ALL"), "$.env.e",
                                  "handler")),
        "done"));
    plan.define(pass("handler", "done"));
    plan.define(end("done"));
    PlanSerializer.validate(plan);
  }

  @Test
  public void testRejectsMissingStart() {
    StateMachine plan = new StateMachine("main", "start");
    plan.define(end("b"));
    exception.expect(SFCRuntimeError.class);
    exception.expectMessage("Start state start does not exist");
    PlanSerializer.validate(plan);
  }
}
