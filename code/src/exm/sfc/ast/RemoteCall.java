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
package exm.sfc.ast;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.sfc.ast.Expr.Constant;

/**
 * A call to a remote service, executed by the orchestrator as its own step
 * rather than inside a function unit.  Arguments are already reduced to
 * environment variables or literal constants.
 */
public class RemoteCall {

  public static enum CallKind {
    /** User Lambda function */
    LAMBDA,
    /** Activity worker polled by the orchestrator */
    ACTIVITY,
    /** Timed wait */
    SLEEP,
    /** Nested execution of another workflow in the module */
    WORKFLOW,
  }

  /**
   * Argument value: either an environment variable or a literal.
   */
  public static class Arg {
    public final String var;
    public final Constant constant;

    private Arg(String var, Constant constant) {
      assert((var == null) != (constant == null));
      this.var = var;
      this.constant = constant;
    }

    public static Arg var(String var) {
      return new Arg(var, null);
    }

    public static Arg constant(Constant constant) {
      return new Arg(null, constant);
    }

    public boolean isVar() {
      return var != null;
    }

    @Override
    public String toString() {
      return isVar() ? var : constant.text;
    }
  }

  /**
   * Retry policy attached to the call
   */
  public static class Retry {
    public final ImmutableList<String> errors;
    public final Long intervalSeconds;
    public final Long maxAttempts;
    public final Double backoffRate;

    public Retry(List<String> errors, Long intervalSeconds,
                 Long maxAttempts, Double backoffRate) {
      this.errors = ImmutableList.copyOf(errors);
      this.intervalSeconds = intervalSeconds;
      this.maxAttempts = maxAttempts;
      this.backoffRate = backoffRate;
    }
  }

  public final CallKind kind;
  /** Name of service: function, activity or workflow name */
  public final String target;
  /** Callee as written in source */
  public final String callee;
  public final ImmutableList<Arg> args;
  public final ImmutableMap<String, Arg> keywords;
  public final Long timeoutSeconds;
  public final Long heartbeatSeconds;
  public final ImmutableList<Retry> retries;
  /** Variable that receives result, or null */
  public final String binding;
  public final SourceLocation loc;

  public RemoteCall(CallKind kind, String target, String callee,
      List<Arg> args, Map<String, Arg> keywords,
      Long timeoutSeconds, Long heartbeatSeconds, List<Retry> retries,
      String binding, SourceLocation loc) {
    this.kind = kind;
    this.target = target;
    this.callee = callee;
    this.args = ImmutableList.copyOf(args);
    this.keywords = ImmutableMap.copyOf(keywords);
    this.timeoutSeconds = timeoutSeconds;
    this.heartbeatSeconds = heartbeatSeconds;
    this.retries = ImmutableList.copyOf(retries);
    this.binding = binding;
    this.loc = loc;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (binding != null) {
      sb.append(binding).append(" = ");
    }
    sb.append(callee).append("(");
    boolean first = true;
    for (Arg arg: args) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(arg);
    }
    for (Map.Entry<String, Arg> kw: keywords.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(kw.getKey()).append("=").append(kw.getValue());
    }
    sb.append(")");
    return sb.toString();
  }
}
