package exm.sfc;

import org.apache.log4j.Logger;

import exm.sfc.ast.Module;
import exm.sfc.ast.parser.Parser;
import exm.sfc.common.Logging;
import exm.sfc.common.Settings;
import exm.sfc.common.exceptions.UserException;
import exm.sfc.frontend.GenSym;
import exm.sfc.frontend.NormalizedFunction;
import exm.sfc.frontend.Normalizer;
import exm.sfc.frontend.RemoteCallClassifier;
import exm.sfc.ic.CFGBuilder;
import exm.sfc.ic.opt.LiftabilityAnalyzer;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.sfnbackend.LoweredFunction;
import exm.sfc.sfnbackend.StateMachineLowering;
import exm.sfc.sfnbackend.StateMachineLowering.Platform;

/**
 * Runs the compiler pipeline up to a given stage on a source snippet
 */
public class PipelineFixture {
  public static final String FILE = "test.py";
  public static final String REGION = "us-east-1";

  private final Logger logger = Logging.getSFCLogger();
  private final Module module;
  private final GenSym gensym;
  private final String discardKey;
  private final Normalizer normalizer;

  public PipelineFixture(String src) throws UserException {
    this(src, new Settings());
  }

  public PipelineFixture(String src, Settings settings) throws UserException {
    module = Parser.parse(FILE, src);
    gensym = new GenSym(module);
    discardKey = gensym.sym("discard");
    normalizer = new Normalizer(module,
              RemoteCallClassifier.forModule(settings, module), gensym);
  }

  public static String lines(String... lines) {
    StringBuilder sb = new StringBuilder();
    for (String line: lines) {
      sb.append(line).append("\n");
    }
    return sb.toString();
  }

  public Module module() {
    return module;
  }

  public String discardKey() {
    return discardKey;
  }

  public NormalizedFunction normalize(String function) throws UserException {
    return normalizer.normalize(module.lookupFunction(function));
  }

  public ControlFlowGraph cfg(String function) throws UserException {
    ControlFlowGraph cfg = CFGBuilder.build(normalize(function));
    new LiftabilityAnalyzer().analyze(logger, cfg);
    return cfg;
  }

  public LoweredFunction lower(String function) throws UserException {
    return lower(function, null);
  }

  public LoweredFunction lower(String function, String router)
                                                  throws UserException {
    Platform platform = new Platform(REGION, Settings.ACCOUNT_PLACEHOLDER,
                                     router);
    return StateMachineLowering.lower(logger, cfg(function), platform,
                                      gensym, discardKey);
  }
}
