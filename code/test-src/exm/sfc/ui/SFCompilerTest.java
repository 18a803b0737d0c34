package exm.sfc.ui;

import static exm.sfc.PipelineFixture.lines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.common.exceptions.InvalidConstructException;
import exm.sfc.common.exceptions.SFCFatal;

public class SFCompilerTest {

  private static final String WORKFLOWS = lines(
      "import math",
      "",
      "def child(n):",
      "    return n",
      "",
      "def main(x, y):",
      "    \"\"\"Entry point\"\"\"",
      "    if x > 0:",
      "        r = cohesion.Lambda.a(x)",
      "    elif y:",
      "        r = child(n=y)",
      "    else:",
      "        r = math.floor(x)",
      "    return r");

  private static Logger logger;

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging(null, false);
  }

  private static Map<String, String> compile(String src, Settings settings)
                                                      throws Exception {
    return new SFCompiler(logger, settings).compileSource("wf.py", src);
  }

  private static JsonNode json(String text) throws Exception {
    return new ObjectMapper().readTree(text);
  }

  @Test
  public void testArtifacts() throws Exception {
    Map<String, String> out = compile(WORKFLOWS, new Settings());
    assertEquals(Arrays.asList("child.sfn.json", "child.graph.json",
        "main.sfn.json", "main.graph.json", "functions.py"),
        new ArrayList<String>(out.keySet()));

    JsonNode main = json(out.get("main.sfn.json"));
    assertEquals("env_init", main.get("StartAt").asText());
    JsonNode states = main.get("States");
    assertEquals("Choice", states.get("choice").get("Type").asText());
    assertEquals("Task", states.get("a").get("Type").asText());
    assertEquals("arn:aws:states:::states:startExecution.sync:2",
                 states.get("child").get("Resource").asText());
    assertEquals("$.env.y", states.get("child").get("Parameters")
                        .get("Input").get("n.$").asText());

    String functions = out.get("functions.py");
    assertTrue(functions.startsWith(
        "# Function units generated by sfc from wf.py\n\nimport math\n"));
    assertTrue(functions.contains("env['r'] = math.floor(env['x'])"));
    assertFalse(functions.contains("Entry point"));
  }

  @Test
  public void testFunctionImportsVisibleToEveryUnit() throws Exception {
    Map<String, String> out = compile(lines(
        "import json",
        "",
        "def main(x):",
        "    import json",
        "    y = cohesion.Lambda.f(x)",
        "    from os import path",
        "    s = json.dumps(path.basename(y))",
        "    return s"), new Settings());
    String functions = out.get("functions.py");
    assertTrue(functions.startsWith(lines(
        "# Function units generated by sfc from wf.py",
        "",
        "import json",
        "from os import path",
        "",
        "",
        "def main_func_1(event, context):")));
    assertTrue(functions.contains(
        "env['s'] = json.dumps(path.basename(env['y']))"));
  }

  @Test
  public void testLargeIntegerParameter() throws Exception {
    Map<String, String> out = compile(lines(
        "def main(x):",
        "    big = 123456789012345678901234567890",
        "    y = cohesion.Lambda.f(n=123456789012345678901234567890)",
        "    return y + big"), new Settings());
    JsonNode params = json(out.get("main.sfn.json")).get("States")
                                .get("f").get("Parameters");
    assertEquals(new BigInteger("123456789012345678901234567890"),
                 params.get("n").bigIntegerValue());
    assertTrue(out.get("functions.py").contains(
        "env['big'] = 123456789012345678901234567890"));
  }

  @Test
  public void testGraph() throws Exception {
    Map<String, String> out = compile(WORKFLOWS, new Settings());
    JsonNode graph = json(out.get("main.graph.json"));
    JsonNode plan = json(out.get("main.sfn.json"));

    assertEquals(plan.get("States").size(), graph.get("nodes").size());
    JsonNode choiceLoc = graph.get("nodes").get("choice").get("srcmap")
                              .get("loc");
    assertEquals(8, choiceLoc.get(0).asInt());
    boolean found = false;
    for (JsonNode edge: graph.get("edges")) {
      if (edge.get("from").asText().equals("choice") &&
          edge.get("to").asText().equals("a")) {
        found = true;
      }
    }
    assertTrue(found);
  }

  @Test
  public void testDeterministic() throws Exception {
    assertEquals(compile(WORKFLOWS, new Settings()),
                 compile(WORKFLOWS, new Settings()));
  }

  @Test
  public void testConfiguredPlatform() throws Exception {
    Settings settings = new Settings();
    settings.define("region=eu-west-2");
    settings.define("account-id=123456789012");
    settings.define("use-router-func=true");
    Map<String, String> out = compile(WORKFLOWS, settings);

    JsonNode states = json(out.get("main.sfn.json")).get("States");
    assertEquals("arn:aws:lambda:eu-west-2:123456789012:function:a",
                 states.get("a").get("Resource").asText());
    assertEquals("arn:aws:lambda:eu-west-2:123456789012:function:router-1",
                 states.get("main_func_1").get("Resource").asText());
    assertTrue(out.get("functions.py").contains(
                 "def router_1(event, context):"));
  }

  @Test
  public void testStructuralErrorRejected() throws Exception {
    exception.expect(InvalidConstructException.class);
    exception.expectMessage("can never complete");
    compile(lines(
        "def main(x):",
        "    while True:",
        "        x = cohesion.Lambda.poll(x)"), new Settings());
  }

  @Test
  public void testCompileWritesFiles() throws Exception {
    File input = tmp.newFile("wf.py");
    FileUtils.writeStringToFile(input, WORKFLOWS, StandardCharsets.UTF_8);
    File outDir = tmp.newFolder("out");

    new SFCompiler(logger, new Settings()).compile(input, outDir);

    for (String name: Arrays.asList("main.sfn.json", "main.graph.json",
            "child.sfn.json", "child.graph.json", "functions.py")) {
      assertTrue(name, new File(outDir, name).isFile());
    }
    String plan = FileUtils.readFileToString(
        new File(outDir, "main.sfn.json"), StandardCharsets.UTF_8);
    assertTrue(plan.endsWith("}\n"));
  }

  @Test
  public void testSyntaxErrorExitCode() throws Exception {
    File input = tmp.newFile("bad.py");
    FileUtils.writeStringToFile(input, lines(
        "def main(x):",
        "    for i in x:",
        "        pass"), StandardCharsets.UTF_8);
    File outDir = tmp.newFolder("out");
    try {
      new SFCompiler(logger, new Settings()).compile(input, outDir);
      assertTrue("expected failure", false);
    } catch (SFCFatal e) {
      assertEquals(ExitCode.ERROR_PARSER.code(), e.exitCode);
    }
    assertEquals(0, outDir.list().length);
  }

  @Test
  public void testUserErrorExitCode() throws Exception {
    File input = tmp.newFile("bad.py");
    FileUtils.writeStringToFile(input, lines(
        "def main(x):",
        "    break"), StandardCharsets.UTF_8);
    File outDir = tmp.newFolder("out");
    try {
      new SFCompiler(logger, new Settings()).compile(input, outDir);
      assertTrue("expected failure", false);
    } catch (SFCFatal e) {
      assertEquals(ExitCode.ERROR_USER.code(), e.exitCode);
    }
  }
}
