/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sfc.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Module;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.parser.Parser;
import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.common.exceptions.InvalidSyntaxException;
import exm.sfc.common.exceptions.SFCFatal;
import exm.sfc.common.exceptions.UserException;
import exm.sfc.common.util.Misc;
import exm.sfc.frontend.GenSym;
import exm.sfc.frontend.Names;
import exm.sfc.frontend.NormalizedFunction;
import exm.sfc.frontend.Normalizer;
import exm.sfc.frontend.RemoteCallClassifier;
import exm.sfc.ic.CFGBuilder;
import exm.sfc.ic.opt.LiftabilityAnalyzer;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.pybackend.FunctionUnitEmitter;
import exm.sfc.sfnbackend.GraphEmitter;
import exm.sfc.sfnbackend.LoweredFunction;
import exm.sfc.sfnbackend.PlanSerializer;
import exm.sfc.sfnbackend.StateMachineLowering;
import exm.sfc.sfnbackend.StateMachineLowering.Platform;

/**
 * This is the main entry point to the compiler
 */
public class SFCompiler {
  public static final String FUNCTIONS_FILE = "functions.py";
  public static final String PLAN_SUFFIX = ".sfn.json";
  public static final String GRAPH_SUFFIX = ".graph.json";
  public static final String DISCARD_PREFIX = "discard";
  public static final String ROUTER_PREFIX = "router";

  private final Logger logger;
  private final Settings settings;

  public SFCompiler(Logger logger, Settings settings) {
    super();
    this.logger = logger;
    this.settings = settings;
  }

  /**
   * Compile a source file, writing plans, graphs and the function unit
   * module into outputDir.  Errors are reported to stderr and raised
   * as SFCFatal with the exit code.
   * @param inputFile
   * @param outputDir
   */
  public void compile(File inputFile, File outputDir) {
    try {
      logger.info("SFC starting: " + Misc.timestamp());
      String src = FileUtils.readFileToString(inputFile,
                                              StandardCharsets.UTF_8);
      Map<String, String> artifacts = compileSource(inputFile.getPath(), src);
      for (Map.Entry<String, String> e: artifacts.entrySet()) {
        FileUtils.writeStringToFile(new File(outputDir, e.getKey()),
                                    e.getValue(), StandardCharsets.UTF_8);
      }
      logger.debug("SFC done: " + Misc.timestamp());
    }
    catch (SFCFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidSyntaxException e) {
      reportUserError(e);
      throw new SFCFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      reportUserError(e);
      throw new SFCFatal(ExitCode.ERROR_USER.code());
    }
    catch (IOException e) {
      System.err.println("sfc error:");
      System.err.println("I/O error: " + e.getMessage());
      throw new SFCFatal(ExitCode.ERROR_IO.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new SFCFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new SFCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run the whole pipeline on source text.  Nothing is written, so a
   * failure leaves no partial output.
   * @param fileName name used in source locations
   * @param src
   * @return output file name to contents, in output order
   * @throws UserException
   */
  public Map<String, String> compileSource(String fileName, String src)
                                                  throws UserException {
    Module module = Parser.parse(fileName, src);
    RemoteCallClassifier classifier =
                    RemoteCallClassifier.forModule(settings, module);
    for (String local: settings.getList(Settings.LOCAL_FUNCTIONS)) {
      if (module.lookupFunction(local) == null) {
        Logging.uniqueWarn("Local function " + local + " is not defined in "
                           + fileName);
      }
    }

    GenSym gensym = new GenSym(module);
    String discardKey = gensym.sym(DISCARD_PREFIX);
    String router = null;
    if (settings.getBoolean(Settings.USE_ROUTER_FUNC)) {
      router = gensym.sym(ROUTER_PREFIX);
    }
    Platform platform = new Platform(settings.get(Settings.REGION),
                            settings.get(Settings.ACCOUNT_ID), router);

    Normalizer normalizer = new Normalizer(module, classifier, gensym);
    LiftabilityAnalyzer liftability = new LiftabilityAnalyzer();
    FunctionUnitEmitter unitEmitter = new FunctionUnitEmitter(fileName);
    List<Stmt.Import> imports = new ArrayList<Stmt.Import>(module.imports);
    for (FunctionDef fn: module.functions) {
      if (!classifier.isLocalHelper(fn.name)) {
        imports.addAll(Names.localImports(fn));
      }
    }
    unitEmitter.addImports(imports);

    List<LoweredFunction> lowered = new ArrayList<LoweredFunction>();
    for (FunctionDef fn: module.functions) {
      if (classifier.isLocalHelper(fn.name)) {
        unitEmitter.addHelper(fn);
        continue;
      }
      logger.debug("Compiling workflow " + fn.name);
      NormalizedFunction normalized = normalizer.normalize(fn);
      ControlFlowGraph cfg = CFGBuilder.build(normalized);
      liftability.analyze(logger, cfg);
      lowered.add(StateMachineLowering.lower(logger, cfg, platform, gensym,
                                             discardKey));
    }

    Map<String, String> artifacts = new LinkedHashMap<String, String>();
    int states = 0, units = 0;
    for (LoweredFunction fn: lowered) {
      artifacts.put(fn.name() + PLAN_SUFFIX,
                    PlanSerializer.serialize(fn.plan));
      artifacts.put(fn.name() + GRAPH_SUFFIX, GraphEmitter.emit(fn.plan));
      unitEmitter.addUnits(fn.units);
      states += fn.plan.size();
      units += fn.units.size();
    }
    if (router != null) {
      unitEmitter.addRouter(router);
    }
    artifacts.put(FUNCTIONS_FILE, unitEmitter.getCode());

    logger.info("Generated " + lowered.size() + " state machine(s) with " +
                states + " states, and generated " + units +
                " function units");
    return artifacts;
  }

  private void reportUserError(UserException e) {
    System.err.println("sfc error:");
    System.err.println(e.getMessage());
    if (logger.isDebugEnabled())
      logger.debug(Misc.stackTrace(e));
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SFC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
