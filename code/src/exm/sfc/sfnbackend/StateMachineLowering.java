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
package exm.sfc.sfnbackend;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Sets;

import exm.sfc.ast.Expr.Constant;
import exm.sfc.ast.RemoteCall;
import exm.sfc.ast.RemoteCall.Arg;
import exm.sfc.ast.RemoteCall.CallKind;
import exm.sfc.ast.RemoteCall.Retry;
import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;
import exm.sfc.common.exceptions.SFCRuntimeError;
import exm.sfc.frontend.GenSym;
import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.ic.tree.FunctionUnit;
import exm.sfc.ic.tree.HandlerTable;
import exm.sfc.ic.tree.Liftability;
import exm.sfc.ic.tree.Terminator;
import exm.sfc.ic.tree.Terminator.BranchKind;
import exm.sfc.ic.tree.Terminator.TerminatorType;
import exm.sfc.sfnbackend.tree.Catcher;
import exm.sfc.sfnbackend.tree.ChoiceState;
import exm.sfc.sfnbackend.tree.ChoiceState.ChoiceRule;
import exm.sfc.sfnbackend.tree.PassState;
import exm.sfc.sfnbackend.tree.Retrier;
import exm.sfc.sfnbackend.tree.StateMachine;
import exm.sfc.sfnbackend.tree.TaskState;
import exm.sfc.sfnbackend.tree.WaitState;

/**
 * Lowers a liftability-tagged CFG to a plan and its function units.
 *
 * Blocks are lowered depth-first from the entry.  Starting at a block,
 * statements are collected along fall-through edges into fusible blocks;
 * a non-empty collection becomes a function unit and a task invoking it,
 * followed by the state for the terminator of the last block.  An empty
 * collection is just the state for the terminator.  The state name of
 * each lowered block is memoized by block identity, and is recorded
 * before lowering successors, so that back edges resolve to the loop
 * header's state.
 */
public class StateMachineLowering {

  public static final String ENV = "env";
  public static final String INIT_STATE = "env_init";
  public static final String EXIT_STATE = "exit_pass";
  public static final String CHOICE_STATE = "choice";
  public static final String WHILE_STATE = "while_test";
  public static final String BREAK_STATE = "break";
  public static final String LOOP_START_STATE = "loop_start";
  public static final String SLEEP_STATE = "sleep";
  public static final String UNIT_SUFFIX = "_func";

  /**
   * Deployment target substituted into resource names
   */
  public static class Platform {
    public final String region;
    public final String accountId;
    /** Name of router function, or null to invoke units directly */
    public final String routerFunction;

    public Platform(String region, String accountId, String routerFunction) {
      this.region = region;
      this.accountId = accountId;
      this.routerFunction = routerFunction;
    }
  }

  private static final JsonNodeFactory json = JsonNodeFactory.instance;

  private final ControlFlowGraph cfg;
  private final Platform platform;
  private final GenSym gensym;
  private final String discardKey;

  private final StateMachine plan;
  private final StateNamer namer = new StateNamer();
  private final Map<Block, String> memo = new IdentityHashMap<Block, String>();
  private final Set<Block> inProgress = Sets.newIdentityHashSet();
  private final List<FunctionUnit> units = new ArrayList<FunctionUnit>();

  private StateMachineLowering(ControlFlowGraph cfg, Platform platform,
                               GenSym gensym, String discardKey) {
    this.cfg = cfg;
    this.platform = platform;
    this.gensym = gensym;
    this.discardKey = discardKey;
    this.plan = new StateMachine(cfg.name(), INIT_STATE);
  }

  /**
   * @param logger
   * @param cfg CFG with liftability tags
   * @param platform
   * @param gensym module-wide generator for function unit names
   * @param discardKey top-level key for results nobody reads
   * @return
   */
  public static LoweredFunction lower(Logger logger, ControlFlowGraph cfg,
        Platform platform, GenSym gensym, String discardKey) {
    StateMachineLowering lowering = new StateMachineLowering(cfg, platform,
                                                    gensym, discardKey);
    LoweredFunction result = lowering.lower();
    if (logger.isDebugEnabled()) {
      logger.debug("Lowered " + cfg.name() + " to " + result.plan.size() +
                   " states and " + result.units.size() + " function units");
    }
    return result;
  }

  private LoweredFunction lower() {
    String initName = allocate(INIT_STATE, null);
    assert(initName.equals(INIT_STATE));
    String start = lowerBlock(cfg.entry());
    plan.define(initState(initName, start));
    return new LoweredFunction(plan, units);
  }

  /**
   * Initializer copies plan input into the environment
   */
  private PassState initState(String name, String next) {
    ObjectNode env = json.objectNode();
    for (String param: cfg.function().def.params) {
      env.put(param + ".$", "$." + param);
    }
    if (cfg.function().initResult) {
      env.putNull(cfg.resultKey());
    }
    ObjectNode params = json.objectNode();
    params.set(ENV, env);
    return new PassState(name, cfg.function().def.loc, "$", params, null,
                         next, false);
  }

  /**
   * Reserve a state name, recording it as the name of owner block
   * @param base
   * @param owner block to record the name for, or null
   * @return
   */
  private String allocate(String base, Block owner) {
    String name = namer.name(base);
    plan.reserve(name);
    if (owner != null) {
      memo.put(owner, name);
    }
    return name;
  }

  private static class Segment {
    final List<Stmt> stmts;
    final Block last;

    Segment(List<Stmt> stmts, Block last) {
      this.stmts = stmts;
      this.last = last;
    }
  }

  /**
   * Collect statements from start along fall-through edges into fusible
   * blocks
   */
  private Segment segment(Block start) {
    List<Stmt> stmts = new ArrayList<Stmt>();
    Block curr = start;
    while (true) {
      stmts.addAll(curr.stmts());
      Terminator t = curr.getTerminator();
      if (t.type() == TerminatorType.FALLTHROUGH) {
        Block target = ((Terminator.Fallthrough)t).target;
        if (target.getLiftability() == Liftability.FUSIBLE &&
            !memo.containsKey(target)) {
          curr = target;
          continue;
        }
      }
      return new Segment(stmts, curr);
    }
  }

  /**
   * @param b
   * @return name of first state for block
   */
  private String lowerBlock(Block b) {
    String name = memo.get(b);
    if (name != null) {
      return name;
    }
    if (b.getLiftability() == null) {
      throw new SFCRuntimeError("Block " + b + " of " + cfg.name() +
                                " not tagged");
    }
    if (!inProgress.add(b)) {
      throw new SFCRuntimeError("Cycle of empty blocks through " + b +
                                " in " + cfg.name());
    }

    Segment seg = segment(b);
    if (!seg.stmts.isEmpty()) {
      String unitName = gensym.sym(cfg.name() + UNIT_SUFFIX);
      name = allocate(unitName, b);
      FunctionUnit unit = new FunctionUnit(unitName, cfg.name(), seg.stmts,
                                           cfg.function().variables, b.loc());
      units.add(unit);
      String next = lowerTerminator(seg.last, null);
      plan.define(unitTask(name, unit, next));
    } else {
      name = lowerTerminator(seg.last, b);
    }
    inProgress.remove(b);
    assert(name.equals(memo.get(b))) : b;
    return name;
  }

  /**
   * Lower terminator of block
   * @param last
   * @param owner if not null, block whose name is the terminator's state
   * @return name of terminator's state
   */
  private String lowerTerminator(Block last, Block owner) {
    Terminator t = last.getTerminator();
    SourceLocation loc = owner != null ? owner.loc() : last.loc();
    switch (t.type()) {
      case FALLTHROUGH:
      case LOOP_BACK: {
        Block target = t.successors().get(0);
        if (owner != null && owner.isLoopHeader()) {
          // Back edges need a state to target
          String name = allocate(LOOP_START_STATE, owner);
          plan.define(PassState.transfer(name, loc, lowerBlock(target)));
          return name;
        }
        String name = lowerBlock(target);
        if (owner != null) {
          memo.put(owner, name);
        }
        return name;
      }
      case BREAK: {
        Terminator.Break br = (Terminator.Break)t;
        String name = allocate(BREAK_STATE, owner);
        plan.define(PassState.transfer(name, br.loc, lowerBlock(br.post)));
        return name;
      }
      case BRANCH:
        return lowerChoice((Terminator.Branch)t, owner);
      case CALL:
        return lowerCall((Terminator.Call)t, owner);
      case EXIT: {
        String name = allocate(EXIT_STATE, owner);
        plan.define(new PassState(name, cfg.function().def.loc, "$", null,
                        envPath(((Terminator.Exit)t).resultKey), null, true));
        return name;
      }
      default:
        throw new SFCRuntimeError("Unexpected terminator " + t);
    }
  }

  /**
   * One choice state for an if chain: empty elif test blocks are folded
   * into the rules of the first test
   */
  private String lowerChoice(Terminator.Branch branch, Block owner) {
    String base = branch.kind == BranchKind.WHILE ? WHILE_STATE : CHOICE_STATE;
    String name = allocate(base, owner);

    List<Terminator.Branch> tests = new ArrayList<Terminator.Branch>();
    Terminator.Branch curr = branch;
    Block dflt;
    while (true) {
      tests.add(curr);
      Block f = curr.ifFalse;
      if (isElifLink(f)) {
        curr = (Terminator.Branch)f.getTerminator();
      } else {
        dflt = f;
        break;
      }
    }

    List<ChoiceRule> rules = new ArrayList<ChoiceRule>();
    for (Terminator.Branch test: tests) {
      rules.add(new ChoiceRule(envPath(test.testVar),
                               lowerBlock(test.ifTrue)));
    }
    String dfltName = lowerBlock(dflt);
    plan.define(new ChoiceState(name, branch.loc, rules, dfltName));
    return name;
  }

  private boolean isElifLink(Block b) {
    if (!b.isEmpty() || b.getLiftability() != Liftability.FUSIBLE ||
        memo.containsKey(b)) {
      return false;
    }
    Terminator t = b.getTerminator();
    return t.type() == TerminatorType.BRANCH &&
           ((Terminator.Branch)t).kind == BranchKind.ELIF;
  }

  private String lowerCall(Terminator.Call t, Block owner) {
    RemoteCall call = t.call;
    if (call.kind == CallKind.SLEEP) {
      String name = allocate(SLEEP_STATE, owner);
      String next = lowerBlock(t.next);
      Arg seconds = call.args.get(0);
      if (seconds.isVar()) {
        plan.define(WaitState.secondsPath(name, call.loc,
                                          envPath(seconds.var), next));
      } else {
        plan.define(WaitState.seconds(name, call.loc,
                                      (Long)seconds.constant.value, next));
      }
      return name;
    }

    String name = allocate(call.target, owner);
    String next = lowerBlock(t.next);
    List<Catcher> catchers = new ArrayList<Catcher>();
    for (HandlerTable.Entry entry: t.handlers.entries()) {
      catchers.add(new Catcher(entry.kinds, resultPath(entry.errorVar),
                               lowerBlock(entry.target)));
    }
    plan.define(remoteTask(name, call, next, catchers));
    return name;
  }

  private TaskState unitTask(String name, FunctionUnit unit, String next) {
    String resource;
    ObjectNode params = null;
    if (platform.routerFunction != null) {
      resource = Arns.lambdaFunction(platform.region, platform.accountId,
                          Arns.unitFunctionName(platform.routerFunction));
      params = json.objectNode();
      params.put(ENV + ".$", "$." + ENV);
      params.put("func", unit.name);
    } else {
      resource = Arns.lambdaFunction(platform.region, platform.accountId,
                                     Arns.unitFunctionName(unit.name));
    }
    return new TaskState(name, unit.loc, resource, "$", params, "$", "$",
                         null, null, new ArrayList<Retrier>(),
                         new ArrayList<Catcher>(), next);
  }

  private TaskState remoteTask(String name, RemoteCall call, String next,
                               List<Catcher> catchers) {
    String resource;
    String inputPath = "$";
    ObjectNode params;
    switch (call.kind) {
      case LAMBDA:
      case ACTIVITY:
        if (call.kind == CallKind.LAMBDA) {
          resource = Arns.lambdaFunction(platform.region, platform.accountId,
                                         call.target);
        } else {
          resource = Arns.activity(platform.region, platform.accountId,
                                   call.target);
        }
        if (call.args.size() == 1) {
          inputPath = envPath(call.args.get(0).var);
          params = null;
        } else {
          params = keywordParams(call);
        }
        break;
      case WORKFLOW:
        resource = Arns.START_EXECUTION_SYNC;
        params = json.objectNode();
        params.put("StateMachineArn", Arns.stateMachine(platform.region,
                                       platform.accountId, call.target));
        params.set("Input", keywordParams(call));
        break;
      default:
        throw new SFCRuntimeError("Unexpected call kind " + call.kind);
    }

    List<Retrier> retriers = new ArrayList<Retrier>();
    for (Retry r: call.retries) {
      retriers.add(new Retrier(r.errors, r.intervalSeconds, r.maxAttempts,
                               r.backoffRate));
    }
    return new TaskState(name, call.loc, resource, inputPath, params, "$",
                         resultPath(call.binding), call.timeoutSeconds,
                         call.heartbeatSeconds, retriers, catchers, next);
  }

  private static ObjectNode keywordParams(RemoteCall call) {
    ObjectNode params = json.objectNode();
    for (Map.Entry<String, Arg> kw: call.keywords.entrySet()) {
      Arg arg = kw.getValue();
      if (arg.isVar()) {
        params.put(kw.getKey() + ".$", envPath(arg.var));
      } else {
        params.set(kw.getKey(), constantValue(arg.constant));
      }
    }
    return params;
  }

  private static JsonNode constantValue(Constant c) {
    switch (c.constType) {
      case INT:
        if (c.value instanceof BigInteger) {
          return json.numberNode((BigInteger)c.value);
        }
        return json.numberNode((Long)c.value);
      case FLOAT:
        return json.numberNode((Double)c.value);
      case STRING:
        return json.textNode((String)c.value);
      case BOOL:
        return json.booleanNode((Boolean)c.value);
      case NONE:
        return json.nullNode();
      default:
        throw new SFCRuntimeError("Unexpected constant " + c.constType);
    }
  }

  private String resultPath(String var) {
    if (var == null) {
      return "$." + discardKey;
    }
    return envPath(var);
  }

  private static String envPath(String var) {
    return "$." + ENV + "." + var;
  }
}
