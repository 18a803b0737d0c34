package exm.sfc.pybackend;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sfc.PipelineFixture;
import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.sfnbackend.LoweredFunction;

public class FunctionUnitEmitterTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  @Test
  public void testUnitsAndHelpers() throws Exception {
    Settings settings = new Settings();
    settings.set(Settings.LOCAL_FUNCTIONS, "helper");
    PipelineFixture fixture = new PipelineFixture(lines(
        "import json",
        "from os import path as p",
        "",
        "def helper(v):",
        "    # doubles v",
        "    return v * 2",
        "",
        "",
        "def main(x):",
        "    y = helper(x)",
        "    z = cohesion.Lambda.work(y)",
        "    print(json.dumps(z))",
        "    return z"), settings);
    LoweredFunction main = fixture.lower("main");

    FunctionUnitEmitter emitter = new FunctionUnitEmitter("wf.py");
    emitter.addImports(fixture.module().imports);
    emitter.addHelper(fixture.module().lookupFunction("helper"));
    emitter.addUnits(main.units);

    String expected = lines(
        "# Function units generated by sfc from wf.py",
        "",
        "import json",
        "from os import path as p",
        "",
        "",
        "def helper(v):",
        "    # doubles v",
        "    return v * 2",
        "",
        "",
        "def main_func_1(event, context):",
        "    env = event['env']",
        "    env['y'] = helper(env['x'])",
        "    return {'env': env}",
        "",
        "",
        "def main_func_2(event, context):",
        "    env = event['env']",
        "    print(json.dumps(env['z']))",
        "    return {'env': env}");
    assertEquals(expected, emitter.getCode());
  }

  @Test
  public void testRouter() {
    FunctionUnitEmitter emitter = new FunctionUnitEmitter("wf.py");
    emitter.addRouter("router_1");
    String expected = lines(
        "# Function units generated by sfc from wf.py",
        "",
        "",
        "def router_1(event, context):",
        "    funcName = event['func']",
        "    func = globals()[funcName]",
        "    return func(event, context)");
    assertEquals(expected, emitter.getCode());
  }
}
