package exm.sfc.sfnbackend;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sfc.PipelineFixture;
import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.sfnbackend.tree.Catcher;
import exm.sfc.sfnbackend.tree.ChoiceState;
import exm.sfc.sfnbackend.tree.PassState;
import exm.sfc.sfnbackend.tree.State.StateType;
import exm.sfc.sfnbackend.tree.StateMachine;
import exm.sfc.sfnbackend.tree.TaskState;
import exm.sfc.sfnbackend.tree.WaitState;

public class StateMachineLoweringTest {

  private static final String ACCOUNT = Settings.ACCOUNT_PLACEHOLDER;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static String lambdaArn(String fn) {
    return "arn:aws:lambda:us-east-1:" + ACCOUNT + ":function:" + fn;
  }

  @Test
  public void testIdentityFunction() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def f(x):",
        "    return x")).lower("f");
    StateMachine plan = f.plan;

    assertEquals(Arrays.asList("env_init", "exit_pass"), plan.stateNames());
    assertTrue(f.units.isEmpty());
    assertEquals("env_init", plan.getStartAt());

    PassState init = (PassState)plan.getState("env_init");
    assertEquals("exit_pass", init.getNext());
    assertEquals("$.x", init.getParameters().get("env").get("x.$").asText());
    assertEquals(1, init.getParameters().get("env").size());

    PassState exit = (PassState)plan.getState("exit_pass");
    assertTrue(exit.isEnd());
    assertEquals("$.env.x", exit.getOutputPath());
  }

  @Test
  public void testIfElifElse() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x, y):",
        "    if x:",
        "        cohesion.Lambda.a()",
        "    elif y:",
        "        cohesion.Lambda.b()",
        "    else:",
        "        cohesion.Lambda.c()")).lower("main");
    StateMachine plan = f.plan;

    assertEquals(Arrays.asList("env_init", "main_func_1", "choice", "a",
                               "exit_pass", "b", "c"), plan.stateNames());
    assertEquals(1, plan.statesOfType(StateType.CHOICE).size());
    assertEquals(1, f.units.size());

    TaskState unit = (TaskState)plan.getState("main_func_1");
    assertEquals(lambdaArn("main-func-1"), unit.getResource());
    assertEquals("choice", unit.getNext());

    ChoiceState choice = (ChoiceState)plan.getState("choice");
    List<ChoiceState.ChoiceRule> rules = choice.getRules();
    assertEquals(2, rules.size());
    assertEquals("$.env.test_1", rules.get(0).variable);
    assertEquals("a", rules.get(0).next);
    assertEquals("$.env.test_2", rules.get(1).variable);
    assertEquals("b", rules.get(1).next);
    assertEquals("c", choice.getDefault());

    for (String name: Arrays.asList("a", "b", "c")) {
      TaskState task = (TaskState)plan.getState(name);
      assertEquals(lambdaArn(name), task.getResource());
      assertEquals("$.discard_1", task.getResultPath());
      assertEquals(0, task.getParameters().size());
      assertEquals("exit_pass", task.getNext());
    }

    // No function returns a value, so the result key starts out null
    PassState init = (PassState)plan.getState("env_init");
    assertTrue(init.getParameters().get("env").get("ret_1").isNull());
    assertEquals("$.env.ret_1",
        ((PassState)plan.getState("exit_pass")).getOutputPath());
  }

  @Test
  public void testWhileWithBreak() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def loop(more):",
        "    while more:",
        "        more = cohesion.Lambda.step(more)",
        "        if more:",
        "            break",
        "    return more")).lower("loop");
    StateMachine plan = f.plan;

    assertEquals(Arrays.asList("env_init", "loop_func_1", "while_test",
                 "step", "loop_func_2", "choice", "break", "exit_pass"),
                 plan.stateNames());
    assertEquals(2, f.units.size());

    ChoiceState header = (ChoiceState)plan.getState("while_test");
    assertEquals("step", header.getRules().get(0).next);
    assertEquals("exit_pass", header.getDefault());

    TaskState step = (TaskState)plan.getState("step");
    assertEquals("$.env.more", step.getInputPath());
    assertNull(step.getParameters());
    assertEquals("$.env.more", step.getResultPath());
    assertEquals("loop_func_2", step.getNext());

    ChoiceState test = (ChoiceState)plan.getState("choice");
    assertEquals("break", test.getRules().get(0).next);
    // Back edge re-evaluates the loop condition
    assertEquals("loop_func_1", test.getDefault());

    assertEquals("exit_pass", ((PassState)plan.getState("break")).getNext());
  }

  @Test
  public void testInfiniteLoopWithBreak() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def loop(n):",
        "    while True:",
        "        r = cohesion.Lambda.step(n)",
        "        if r:",
        "            break",
        "    return r")).lower("loop");
    StateMachine plan = f.plan;

    assertEquals(Arrays.asList("env_init", "step", "loop_func_1", "choice",
                               "break", "exit_pass"), plan.stateNames());
    ChoiceState test = (ChoiceState)plan.getState("choice");
    assertEquals("step", test.getDefault());
    assertEquals("step", ((PassState)plan.getState("env_init")).getNext());
    assertTrue(plan.getState("env_init") instanceof PassState);
    assertTrue(((PassState)plan.getState("env_init"))
                    .getParameters().get("env").get("r").isNull());
  }

  @Test
  public void testCatchOrder() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x):",
        "    try:",
        "        y = cohesion.Lambda.work(x)",
        "    except K1:",
        "        y = 1",
        "    except K2 as e:",
        "        y = 2",
        "    except K3:",
        "        y = 3",
        "    return y")).lower("main");
    StateMachine plan = f.plan;

    TaskState work = (TaskState)plan.getState("work");
    assertEquals("$.env.x", work.getInputPath());
    assertEquals("$.env.y", work.getResultPath());
    assertEquals("exit_pass", work.getNext());

    List<Catcher> catchers = work.getCatchers();
    assertEquals(3, catchers.size());
    assertEquals(Arrays.asList("K1"), catchers.get(0).errorEquals);
    assertEquals("$.discard_1", catchers.get(0).resultPath);
    assertEquals("main_func_1", catchers.get(0).next);
    assertEquals(Arrays.asList("K2"), catchers.get(1).errorEquals);
    assertEquals("$.env.e", catchers.get(1).resultPath);
    assertEquals("main_func_2", catchers.get(1).next);
    assertEquals(Arrays.asList("K3"), catchers.get(2).errorEquals);
    assertEquals("main_func_3", catchers.get(2).next);

    for (String unit: Arrays.asList("main_func_1", "main_func_2",
                                    "main_func_3")) {
      TaskState task = (TaskState)plan.getState(unit);
      assertEquals("exit_pass", task.getNext());
      assertTrue(task.getCatchers().isEmpty());
    }
  }

  @Test
  public void testNestedTryInheritsOuterHandlers() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x):",
        "    try:",
        "        try:",
        "            x = cohesion.Lambda.inner(x)",
        "        except A:",
        "            x = 1",
        "        x = cohesion.Lambda.outer(x)",
        "    except (A, B):",
        "        x = 2",
        "    except:",
        "        x = 3",
        "    return x")).lower("main");

    List<Catcher> inner = ((TaskState)f.plan.getState("inner"))
                                                      .getCatchers();
    assertEquals(3, inner.size());
    assertEquals(Arrays.asList("A"), inner.get(0).errorEquals);
    assertEquals(Arrays.asList("B"), inner.get(1).errorEquals);
    assertEquals(Arrays.asList("States.ALL"), inner.get(2).errorEquals);

    List<Catcher> outer = ((TaskState)f.plan.getState("outer"))
                                                      .getCatchers();
    assertEquals(2, outer.size());
    assertEquals(Arrays.asList("A", "B"), outer.get(0).errorEquals);
    assertEquals(Arrays.asList("States.ALL"), outer.get(1).errorEquals);
    assertEquals(outer.get(0).next, inner.get(1).next);
  }

  @Test
  public void testSleep() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(n):",
        "    cohesion.sleep(5)",
        "    cohesion.sleep(seconds=n * 2)",
        "    return n")).lower("main");
    StateMachine plan = f.plan;

    assertEquals(Arrays.asList("env_init", "sleep", "main_func_1",
                               "sleep_1", "exit_pass"), plan.stateNames());
    WaitState first = (WaitState)plan.getState("sleep");
    assertEquals("main_func_1", first.getNext());
    assertEquals(1, f.units.size());
    assertTrue(f.units.get(0).envVars.contains("a_1"));
    assertEquals("sleep_1", ((TaskState)plan.getState("main_func_1"))
                                                          .getNext());
    assertEquals("exit_pass", ((WaitState)plan.getState("sleep_1"))
                                                          .getNext());
  }

  @Test
  public void testRemoteTaskOptions() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x):",
        "    r = cohesion.activity.approve(user=x, level=3, note='hi',",
        "             timeout=60, heartbeat=10,",
        "             retry={'ErrorEquals': ['E1'], 'MaxAttempts': 2})",
        "    return r")).lower("main");
    TaskState task = (TaskState)f.plan.getState("approve");

    assertEquals("arn:aws:states:us-east-1:" + ACCOUNT + ":activity:approve",
                 task.getResource());
    assertEquals("$", task.getInputPath());
    assertEquals("$.env.x", task.getParameters().get("user.$").asText());
    assertEquals(3, task.getParameters().get("level").asInt());
    assertEquals("hi", task.getParameters().get("note").asText());
    assertEquals(3, task.getParameters().size());
    assertEquals(Long.valueOf(60), task.getTimeoutSeconds());
    assertEquals(Long.valueOf(10), task.getHeartbeatSeconds());
    assertEquals(1, task.getRetriers().size());
    assertEquals(Arrays.asList("E1"), task.getRetriers().get(0).errorEquals);
    assertEquals(Long.valueOf(2), task.getRetriers().get(0).maxAttempts);
    assertNull(task.getRetriers().get(0).intervalSeconds);
  }

  @Test
  public void testNestedWorkflow() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def child(a, b):",
        "    return a",
        "",
        "def main(x):",
        "    r = child(x, b=-1)",
        "    return r")).lower("main");
    TaskState task = (TaskState)f.plan.getState("child");

    assertEquals("arn:aws:states:::states:startExecution.sync:2",
                 task.getResource());
    assertEquals("arn:aws:states:us-east-1:" + ACCOUNT +
                 ":stateMachine:child",
        task.getParameters().get("StateMachineArn").asText());
    assertEquals("$.env.x",
        task.getParameters().get("Input").get("a.$").asText());
    assertEquals(-1, task.getParameters().get("Input").get("b").asInt());
    assertEquals("$.env.r", task.getResultPath());
  }

  @Test
  public void testRouterMode() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x):",
        "    y = x + 1",
        "    return y")).lower("main", "router_1");
    TaskState unit = (TaskState)f.plan.getState("main_func_1");

    assertEquals(lambdaArn("router-1"), unit.getResource());
    assertEquals("$.env", unit.getParameters().get("env.$").asText());
    assertEquals("main_func_1", unit.getParameters().get("func").asText());
  }

  @Test
  public void testStateNamesUnique() throws Exception {
    LoweredFunction f = new PipelineFixture(lines(
        "def main(x):",
        "    x = cohesion.Lambda.go(x)",
        "    x = cohesion.Lambda.go(x)",
        "    x = cohesion.Lambda.go(x)",
        "    return x")).lower("main");

    assertEquals(Arrays.asList("env_init", "go", "go_1", "go_2",
                               "exit_pass"), f.plan.stateNames());
    assertEquals("go_1", ((TaskState)f.plan.getState("go")).getNext());
    assertFalse(f.plan.contains("go_3"));
  }
}
