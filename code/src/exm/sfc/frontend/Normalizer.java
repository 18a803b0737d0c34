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
package exm.sfc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Expr.Constant;
import exm.sfc.ast.Expr.Constant.ConstType;
import exm.sfc.ast.Expr.ExprType;
import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Module;
import exm.sfc.ast.RemoteCall;
import exm.sfc.ast.RemoteCall.Arg;
import exm.sfc.ast.RemoteCall.CallKind;
import exm.sfc.ast.RemoteCall.Retry;
import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.Stmt.ExceptHandler;
import exm.sfc.ast.Stmt.IfBranch;
import exm.sfc.common.exceptions.InvalidConstructException;
import exm.sfc.common.exceptions.UserException;
import exm.sfc.frontend.RemoteCallClassifier.Target;

/**
 * Rewrite a workflow function so that control flow only depends on
 * statements the CFG builder understands:
 * - remote calls are hoisted out of expressions into call statements,
 *   with arguments pinned to environment variables or literals
 * - if/elif conditions become boolean test variables, computed before
 *   the chain so that exactly one test is true
 * - while conditions become a test recomputed in the loop header
 * - value-returning returns write the function's result key
 */
public class Normalizer {
  public static final String TEST_PREFIX = "test";
  public static final String CALL_PREFIX = "call";
  public static final String ARG_PREFIX = "a";
  public static final String RESULT_PREFIX = "ret";

  private static final Set<String> TIMEOUT_OPTIONS = new HashSet<String>(
                        Arrays.asList("timeout", "timeoutSeconds"));
  private static final Set<String> HEARTBEAT_OPTIONS = new HashSet<String>(
                        Arrays.asList("heartbeat", "heartbeatSeconds"));
  private static final String RETRY_OPTION = "retry";
  private static final String SLEEP_SECONDS = "seconds";

  private final Module module;
  private final RemoteCallClassifier classifier;
  private final GenSym gensym;

  /** Variables of function being normalized */
  private Set<String> variables;
  private String resultKey;
  /** Whether returns must assign result key */
  private boolean assignResult;

  public Normalizer(Module module, RemoteCallClassifier classifier,
                    GenSym gensym) {
    this.module = module;
    this.classifier = classifier;
    this.gensym = gensym;
  }

  public NormalizedFunction normalize(FunctionDef fn) throws UserException {
    variables = Names.assignedVariables(fn);
    chooseResultKey(fn);
    List<Stmt> body = block(fn.body);
    LogHelper.debug(2, "Normalized " + fn.name + ": result key " +
                       resultKey + ", " + variables.size() + " variables");
    return new NormalizedFunction(fn.withBody(body), resultKey,
                          !fn.params.contains(resultKey), variables);
  }

  /**
   * Return a variable directly if every return returns it and control
   * can't fall off the end, otherwise use a fresh result key
   */
  private void chooseResultKey(FunctionDef fn) {
    List<Stmt.Return> returns = new ArrayList<Stmt.Return>();
    collectReturns(fn.body, returns);

    String common = null;
    boolean same = !returns.isEmpty() && !fn.body.isEmpty() &&
        fn.body.get(fn.body.size() - 1).type() == Stmt.StmtType.RETURN;
    for (Stmt.Return ret: returns) {
      if (ret.value == null || ret.value.type() != ExprType.NAME) {
        same = false;
        break;
      }
      String id = ((Expr.Name)ret.value).id;
      if (!variables.contains(id) || (common != null && !common.equals(id))) {
        same = false;
        break;
      }
      common = id;
    }

    if (same) {
      resultKey = common;
      assignResult = false;
    } else {
      resultKey = gensym.sym(RESULT_PREFIX);
      assignResult = true;
      variables.add(resultKey);
    }
  }

  private static void collectReturns(List<Stmt> stmts,
                                     List<Stmt.Return> acc) {
    for (Stmt stmt: stmts) {
      switch (stmt.type()) {
        case RETURN:
          acc.add((Stmt.Return)stmt);
          break;
        case IF: {
          Stmt.If ifStmt = (Stmt.If)stmt;
          for (IfBranch branch: ifStmt.branches) {
            collectReturns(branch.body, acc);
          }
          collectReturns(ifStmt.orelse, acc);
          break;
        }
        case WHILE:
          collectReturns(((Stmt.While)stmt).body, acc);
          break;
        case TRY: {
          Stmt.Try tryStmt = (Stmt.Try)stmt;
          collectReturns(tryStmt.body, acc);
          for (ExceptHandler handler: tryStmt.handlers) {
            collectReturns(handler.body, acc);
          }
          break;
        }
        default:
          break;
      }
    }
  }

  private List<Stmt> block(List<Stmt> stmts) throws UserException {
    List<Stmt> out = new ArrayList<Stmt>();
    for (Stmt stmt: stmts) {
      statement(stmt, out);
    }
    return out;
  }

  private void statement(Stmt stmt, List<Stmt> out) throws UserException {
    switch (stmt.type()) {
      case ASSIGN:
        assign((Stmt.Assign)stmt, out);
        break;
      case AUG_ASSIGN: {
        Stmt.AugAssign aug = (Stmt.AugAssign)stmt;
        Expr value = liftExpr(aug.value, out);
        Expr target = liftExpr(aug.target, out);
        out.add(new Stmt.AugAssign(aug.loc(), target, aug.op, value));
        break;
      }
      case EXPR:
        exprStmt((Stmt.ExprStmt)stmt, out);
        break;
      case IF:
        ifStmt((Stmt.If)stmt, out);
        break;
      case WHILE:
        whileStmt((Stmt.While)stmt, out);
        break;
      case RETURN:
        returnStmt((Stmt.Return)stmt, out);
        break;
      case TRY: {
        Stmt.Try tryStmt = (Stmt.Try)stmt;
        List<ExceptHandler> handlers = new ArrayList<ExceptHandler>();
        for (ExceptHandler h: tryStmt.handlers) {
          handlers.add(new ExceptHandler(h.loc, h.kinds, h.name,
                                         block(h.body)));
        }
        out.add(new Stmt.Try(tryStmt.loc(), block(tryStmt.body), handlers));
        break;
      }
      case PASS:
        break;
      case BREAK:
      case CONTINUE:
      case IMPORT:
      case CALL:
        out.add(stmt);
        break;
      default:
        throw new InvalidConstructException(stmt.loc(),
                        "unexpected statement " + stmt.type());
    }
  }

  private void assign(Stmt.Assign assign, List<Stmt> out)
                                                throws UserException {
    if (assign.value.type() == ExprType.CALL &&
        assign.target.type() == ExprType.NAME) {
      Expr.Call call = (Expr.Call)assign.value;
      Target target = classifier.classify(call, variables);
      if (target != null) {
        String binding = ((Expr.Name)assign.target).id;
        out.add(new Stmt.CallStmt(remoteCall(call, target, binding, out)));
        return;
      }
    }
    Expr value = liftExpr(assign.value, out);
    Expr target = liftExpr(assign.target, out);
    out.add(new Stmt.Assign(assign.loc(), target, value));
  }

  private void exprStmt(Stmt.ExprStmt stmt, List<Stmt> out)
                                                throws UserException {
    Expr expr = stmt.expr;
    if (expr.type() == ExprType.CONSTANT) {
      // Docstrings and other bare literals have no effect
      return;
    }
    if (expr.type() == ExprType.CALL) {
      Expr.Call call = (Expr.Call)expr;
      Target target = classifier.classify(call, variables);
      if (target != null) {
        out.add(new Stmt.CallStmt(remoteCall(call, target, null, out)));
        return;
      }
    }
    out.add(new Stmt.ExprStmt(stmt.loc(), liftExpr(expr, out)));
  }

  private void ifStmt(Stmt.If ifStmt, List<Stmt> out) throws UserException {
    List<IfBranch> branches = new ArrayList<IfBranch>();
    List<String> tests = new ArrayList<String>();
    int n = ifStmt.branches.size();
    for (int i = 0; i < n; i++) {
      IfBranch branch = ifStmt.branches.get(i);
      SourceLocation loc = branch.cond.loc();
      if (i > 0 && classifier.containsRemoteCall(branch.cond, variables)) {
        // Condition can't be evaluated ahead of the chain: nest the
        // remainder of the chain in the else branch
        Stmt.If rest = new Stmt.If(loc, ifStmt.branches.subList(i, n),
                                   ifStmt.orelse);
        List<Stmt> orelse = new ArrayList<Stmt>();
        ifStmt(rest, orelse);
        out.add(new Stmt.If(ifStmt.loc(), branches, orelse));
        return;
      }

      Expr testVal = boolCall(liftExpr(branch.cond, out));
      if (!tests.isEmpty()) {
        List<Expr> conj = new ArrayList<Expr>();
        for (String prev: tests) {
          conj.add(new Expr.UnaryOp(loc, "not", new Expr.Name(loc, prev)));
        }
        conj.add(testVal);
        testVal = new Expr.BoolOp(loc, "and", conj);
      }
      String test = fresh(TEST_PREFIX);
      out.add(new Stmt.Assign(loc, new Expr.Name(loc, test), testVal));
      tests.add(test);
      branches.add(new IfBranch(new Expr.Name(loc, test),
                                block(branch.body)));
    }
    out.add(new Stmt.If(ifStmt.loc(), branches, block(ifStmt.orelse)));
  }

  private void whileStmt(Stmt.While loop, List<Stmt> out)
                                                throws UserException {
    if (loop.cond.type() == ExprType.CONSTANT &&
        ((Constant)loop.cond).isTrue()) {
      out.add(new Stmt.While(loop.loc(), loop.header, loop.cond,
                             block(loop.body)));
      return;
    }
    List<Stmt> header = new ArrayList<Stmt>(loop.header);
    Expr cond = liftExpr(loop.cond, header);
    SourceLocation loc = loop.cond.loc();
    String test = fresh(TEST_PREFIX);
    header.add(new Stmt.Assign(loc, new Expr.Name(loc, test),
                               boolCall(cond)));
    out.add(new Stmt.While(loop.loc(), header, new Expr.Name(loc, test),
                           block(loop.body)));
  }

  private void returnStmt(Stmt.Return ret, List<Stmt> out)
                                                throws UserException {
    SourceLocation loc = ret.loc();
    if (ret.value == null) {
      out.add(ret);
      return;
    }
    if (assignResult) {
      Target target = null;
      if (ret.value.type() == ExprType.CALL) {
        target = classifier.classify((Expr.Call)ret.value, variables);
      }
      if (target != null) {
        out.add(new Stmt.CallStmt(remoteCall((Expr.Call)ret.value, target,
                                             resultKey, out)));
      } else {
        out.add(new Stmt.Assign(loc, new Expr.Name(loc, resultKey),
                                liftExpr(ret.value, out)));
      }
    }
    out.add(new Stmt.Return(loc, new Expr.Name(loc, resultKey)));
  }

  private static Expr boolCall(Expr cond) {
    List<Expr> args = new ArrayList<Expr>(1);
    args.add(cond);
    return new Expr.Call(cond.loc(), new Expr.Name(cond.loc(), "bool"),
                         args, new ArrayList<Expr.Keyword>());
  }

  private String fresh(String prefix) {
    String name = gensym.sym(prefix);
    variables.add(name);
    return name;
  }

  /**
   * Hoist remote calls out of expression, appending call statements
   * to out in evaluation order
   * @param e
   * @param out
   * @return expression with remote calls replaced by temporaries
   * @throws UserException
   */
  private Expr liftExpr(Expr e, List<Stmt> out) throws UserException {
    switch (e.type()) {
      case NAME:
      case CONSTANT:
        return e;
      case ATTRIBUTE: {
        Expr.Attribute attr = (Expr.Attribute)e;
        return new Expr.Attribute(e.loc(), liftExpr(attr.value, out),
                                  attr.attr);
      }
      case SUBSCRIPT: {
        Expr.Subscript sub = (Expr.Subscript)e;
        Expr value = liftExpr(sub.value, out);
        return new Expr.Subscript(e.loc(), value, liftExpr(sub.index, out));
      }
      case CALL: {
        Expr.Call call = (Expr.Call)e;
        Target target = classifier.classify(call, variables);
        if (target != null) {
          String tmp = fresh(CALL_PREFIX);
          out.add(new Stmt.CallStmt(remoteCall(call, target, tmp, out)));
          return new Expr.Name(e.loc(), tmp);
        }
        Expr func = liftExpr(call.func, out);
        List<Expr> args = liftAll(call.args, out);
        List<Expr.Keyword> keywords = new ArrayList<Expr.Keyword>();
        for (Expr.Keyword kw: call.keywords) {
          keywords.add(new Expr.Keyword(kw.name, liftExpr(kw.value, out)));
        }
        return new Expr.Call(e.loc(), func, args, keywords);
      }
      case BINOP: {
        Expr.BinOp binop = (Expr.BinOp)e;
        Expr left = liftExpr(binop.left, out);
        return new Expr.BinOp(e.loc(), binop.op, left,
                              liftExpr(binop.right, out));
      }
      case BOOLOP: {
        Expr.BoolOp boolop = (Expr.BoolOp)e;
        List<Expr> values = new ArrayList<Expr>();
        values.add(liftExpr(boolop.values.get(0), out));
        for (Expr v: boolop.values.subList(1, boolop.values.size())) {
          checkNotConditional(v, "'" + boolop.op + "'");
          values.add(v);
        }
        return new Expr.BoolOp(e.loc(), boolop.op, values);
      }
      case UNARYOP: {
        Expr.UnaryOp unop = (Expr.UnaryOp)e;
        return new Expr.UnaryOp(e.loc(), unop.op,
                                liftExpr(unop.operand, out));
      }
      case COMPARE: {
        Expr.Compare cmp = (Expr.Compare)e;
        Expr left = liftExpr(cmp.left, out);
        List<Expr> comparators = new ArrayList<Expr>();
        comparators.add(liftExpr(cmp.comparators.get(0), out));
        for (Expr c: cmp.comparators.subList(1, cmp.comparators.size())) {
          checkNotConditional(c, "chained comparison");
          comparators.add(c);
        }
        return new Expr.Compare(e.loc(), left, cmp.ops, comparators);
      }
      case LIST:
        return new Expr.ListExpr(e.loc(),
                                 liftAll(((Expr.ListExpr)e).elts, out));
      case TUPLE:
        return new Expr.TupleExpr(e.loc(),
                                  liftAll(((Expr.TupleExpr)e).elts, out));
      case DICT: {
        Expr.DictExpr dict = (Expr.DictExpr)e;
        List<Expr> keys = new ArrayList<Expr>();
        List<Expr> values = new ArrayList<Expr>();
        for (int i = 0; i < dict.keys.size(); i++) {
          keys.add(liftExpr(dict.keys.get(i), out));
          values.add(liftExpr(dict.values.get(i), out));
        }
        return new Expr.DictExpr(e.loc(), keys, values);
      }
      default:
        throw new InvalidConstructException(e.loc(),
                      "unexpected expression " + e.type());
    }
  }

  private List<Expr> liftAll(List<Expr> exprs, List<Stmt> out)
                                                  throws UserException {
    List<Expr> result = new ArrayList<Expr>(exprs.size());
    for (Expr e: exprs) {
      result.add(liftExpr(e, out));
    }
    return result;
  }

  /**
   * Operands that are only evaluated conditionally can't contain remote
   * calls, since hoisting would evaluate them unconditionally
   */
  private void checkNotConditional(Expr e, String context)
                                        throws InvalidConstructException {
    if (classifier.containsRemoteCall(e, variables)) {
      throw new InvalidConstructException(e.loc(), "remote calls are not " +
          "supported in conditionally evaluated operand of " + context);
    }
  }

  private RemoteCall remoteCall(Expr.Call call, Target target,
        String binding, List<Stmt> out) throws UserException {
    Long timeout = null;
    Long heartbeat = null;
    List<Retry> retries = new ArrayList<Retry>();
    List<Expr.Keyword> keywords = new ArrayList<Expr.Keyword>();
    for (Expr.Keyword kw: call.keywords) {
      if (TIMEOUT_OPTIONS.contains(kw.name)) {
        timeout = positiveInt(kw.value, kw.name);
      } else if (HEARTBEAT_OPTIONS.contains(kw.name)) {
        heartbeat = positiveInt(kw.value, kw.name);
      } else if (kw.name.equals(RETRY_OPTION)) {
        retries.addAll(retryPolicies(kw.value));
      } else {
        keywords.add(kw);
      }
    }

    List<Arg> args = new ArrayList<Arg>();
    Map<String, Arg> kwArgs = new LinkedHashMap<String, Arg>();
    switch (target.kind) {
      case SLEEP:
        if (binding != null) {
          throw new InvalidConstructException(call.loc(),
                            call.calleeName() + " does not return a value");
        }
        if (timeout != null || heartbeat != null || !retries.isEmpty()) {
          throw new InvalidConstructException(call.loc(),
                            call.calleeName() + " does not take options");
        }
        args.add(sleepArg(call, keywords, out));
        break;
      case LAMBDA:
      case ACTIVITY:
        if (call.args.size() > 1) {
          throw new InvalidConstructException(call.loc(), "remote call " +
              call.calleeName() + " takes at most one positional argument," +
              " pass further values as keyword arguments");
        }
        if (call.args.size() == 1 && !keywords.isEmpty()) {
          throw new InvalidConstructException(call.loc(), "remote call " +
              call.calleeName() + " can't mix positional and keyword " +
              "arguments");
        }
        for (Expr arg: call.args) {
          args.add(varArg(arg, out));
        }
        for (Expr.Keyword kw: keywords) {
          kwArgs.put(kw.name, valueArg(kw.value, out));
        }
        break;
      case WORKFLOW:
        workflowArgs(call, target, keywords, kwArgs, out);
        break;
      default:
        throw new InvalidConstructException(call.loc(),
                            "unexpected remote call kind " + target.kind);
    }

    return new RemoteCall(target.kind, target.name, call.calleeName(),
        args, kwArgs, timeout, heartbeat, retries, binding, call.loc());
  }

  private Arg sleepArg(Expr.Call call, List<Expr.Keyword> keywords,
                       List<Stmt> out) throws UserException {
    Expr seconds;
    if (call.args.size() == 1 && keywords.isEmpty()) {
      seconds = call.args.get(0);
    } else if (call.args.isEmpty() && keywords.size() == 1 &&
               keywords.get(0).name.equals(SLEEP_SECONDS)) {
      seconds = keywords.get(0).value;
    } else {
      throw new InvalidConstructException(call.loc(), call.calleeName() +
                        " takes exactly one argument: " + SLEEP_SECONDS);
    }
    Constant c = literal(seconds);
    if (c != null) {
      Long secs = c.longValue();
      if (secs == null || secs < 0) {
        throw new InvalidConstructException(seconds.loc(),
                        "sleep time must be a non-negative integer");
      }
      return Arg.constant(c);
    }
    return varArg(seconds, out);
  }

  /**
   * Map arguments of call to workflow onto callee's parameters
   */
  private void workflowArgs(Expr.Call call, Target target,
          List<Expr.Keyword> keywords, Map<String, Arg> kwArgs,
          List<Stmt> out) throws UserException {
    FunctionDef callee = module.lookupFunction(target.name);
    if (call.args.size() > callee.params.size()) {
      throw new InvalidConstructException(call.loc(), target.name +
          " takes " + callee.params.size() + " arguments but " +
          call.args.size() + " were given");
    }
    Map<String, Arg> given = new LinkedHashMap<String, Arg>();
    for (int i = 0; i < call.args.size(); i++) {
      given.put(callee.params.get(i), valueArg(call.args.get(i), out));
    }
    for (Expr.Keyword kw: keywords) {
      if (!callee.params.contains(kw.name)) {
        throw new InvalidConstructException(call.loc(), target.name +
            " has no parameter named " + kw.name);
      }
      if (given.containsKey(kw.name)) {
        throw new InvalidConstructException(call.loc(), target.name +
            " got multiple values for argument " + kw.name);
      }
      given.put(kw.name, valueArg(kw.value, out));
    }
    for (String param: callee.params) {
      Arg arg = given.get(param);
      if (arg == null) {
        throw new InvalidConstructException(call.loc(), target.name +
            " missing argument " + param);
      }
      kwArgs.put(param, arg);
    }
  }

  /**
   * @return argument as a variable, hoisting it into a temporary if needed
   */
  private Arg varArg(Expr e, List<Stmt> out) throws UserException {
    Expr lifted = liftExpr(e, out);
    if (lifted.type() == ExprType.NAME &&
        variables.contains(((Expr.Name)lifted).id)) {
      return Arg.var(((Expr.Name)lifted).id);
    }
    String tmp = fresh(ARG_PREFIX);
    out.add(new Stmt.Assign(e.loc(), new Expr.Name(e.loc(), tmp), lifted));
    return Arg.var(tmp);
  }

  /**
   * @return argument as a literal if it is one, otherwise as a variable
   */
  private Arg valueArg(Expr e, List<Stmt> out) throws UserException {
    Constant c = literal(e);
    if (c != null) {
      return Arg.constant(c);
    }
    return varArg(e, out);
  }

  /**
   * @return constant value of expression, folding negated numbers,
   *         or null if not a literal
   */
  private static Constant literal(Expr e) {
    if (e.type() == ExprType.CONSTANT) {
      return (Constant)e;
    }
    if (e.type() == ExprType.UNARYOP) {
      Expr.UnaryOp unop = (Expr.UnaryOp)e;
      if (unop.op.equals("-") && unop.operand.type() == ExprType.CONSTANT) {
        Constant c = (Constant)unop.operand;
        if (c.constType == ConstType.INT) {
          return new Constant(e.loc(), ConstType.INT, "-" + c.text,
                    Constant.intValue(c.bigIntegerValue().negate()));
        } else if (c.constType == ConstType.FLOAT) {
          return new Constant(e.loc(), ConstType.FLOAT, "-" + c.text,
                              -(Double)c.value);
        }
      }
    }
    return null;
  }

  private static Long positiveInt(Expr e, String option)
                                      throws InvalidConstructException {
    if (e.type() == ExprType.CONSTANT) {
      Constant c = (Constant)e;
      Long v = c.longValue();
      if (v != null && v > 0) {
        return v;
      }
    }
    throw new InvalidConstructException(e.loc(),
              option + " must be a positive integer literal");
  }

  private static List<Retry> retryPolicies(Expr e)
                                      throws InvalidConstructException {
    List<Expr> policies;
    if (e.type() == ExprType.LIST) {
      policies = ((Expr.ListExpr)e).elts;
    } else if (e.type() == ExprType.DICT) {
      policies = new ArrayList<Expr>();
      policies.add(e);
    } else {
      throw new InvalidConstructException(e.loc(),
          "retry must be a retry policy dict or a list of them");
    }

    List<Retry> result = new ArrayList<Retry>();
    for (Expr policy: policies) {
      if (policy.type() != ExprType.DICT) {
        throw new InvalidConstructException(policy.loc(),
                                "retry policy must be a dict");
      }
      result.add(retryPolicy((Expr.DictExpr)policy));
    }
    return result;
  }

  private static Retry retryPolicy(Expr.DictExpr dict)
                                      throws InvalidConstructException {
    List<String> errors = new ArrayList<String>();
    Long interval = null, maxAttempts = null;
    Double backoff = null;
    for (int i = 0; i < dict.keys.size(); i++) {
      String key = retryKey(dict.keys.get(i));
      Expr val = dict.values.get(i);
      if (key.equals("ErrorEquals") || key.equals("Error")) {
        errors.addAll(errorNames(val));
      } else if (key.equals("IntervalSeconds")) {
        interval = positiveInt(val, key);
      } else if (key.equals("MaxAttempts")) {
        maxAttempts = nonNegativeInt(val, key);
      } else if (key.equals("BackoffRate")) {
        backoff = number(val, key);
      } else {
        throw new InvalidConstructException(val.loc(),
            "unknown retry policy field " + key + ", expected ErrorEquals, " +
            "IntervalSeconds, MaxAttempts or BackoffRate");
      }
    }
    if (errors.isEmpty()) {
      errors.add("States.ALL");
    }
    return new Retry(errors, interval, maxAttempts, backoff);
  }

  private static String retryKey(Expr key) throws InvalidConstructException {
    if (key.type() == ExprType.NAME) {
      return ((Expr.Name)key).id;
    } else if (key.type() == ExprType.CONSTANT &&
               ((Constant)key).constType == ConstType.STRING) {
      return (String)((Constant)key).value;
    }
    throw new InvalidConstructException(key.loc(),
                "retry policy keys must be names or strings");
  }

  private static List<String> errorNames(Expr e)
                                      throws InvalidConstructException {
    List<Expr> elts;
    if (e.type() == ExprType.LIST) {
      elts = ((Expr.ListExpr)e).elts;
    } else {
      elts = new ArrayList<Expr>();
      elts.add(e);
    }
    List<String> names = new ArrayList<String>();
    for (Expr elt: elts) {
      String name = Expr.dottedName(elt);
      if (name == null && elt.type() == ExprType.CONSTANT &&
          ((Constant)elt).constType == ConstType.STRING) {
        name = (String)((Constant)elt).value;
      }
      if (name == null) {
        throw new InvalidConstructException(elt.loc(),
                        "expected error name in retry policy");
      }
      names.add(name);
    }
    return names;
  }

  private static Long nonNegativeInt(Expr e, String option)
                                      throws InvalidConstructException {
    Constant c = literal(e);
    Long v = c == null ? null : c.longValue();
    if (v != null && v >= 0) {
      return v;
    }
    throw new InvalidConstructException(e.loc(),
              option + " must be a non-negative integer literal");
  }

  private static Double number(Expr e, String option)
                                      throws InvalidConstructException {
    Constant c = literal(e);
    if (c != null && c.constType == ConstType.INT) {
      return ((Number)c.value).doubleValue();
    } else if (c != null && c.constType == ConstType.FLOAT) {
      return (Double)c.value;
    }
    throw new InvalidConstructException(e.loc(),
              option + " must be a number literal");
  }
}
