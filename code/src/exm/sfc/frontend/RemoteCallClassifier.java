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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Expr.ExprType;
import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Module;
import exm.sfc.ast.RemoteCall.CallKind;
import exm.sfc.common.Settings;
import exm.sfc.common.exceptions.InvalidConstructException;

/**
 * Decides which call sites are remote, i.e. run as their own step in the
 * state machine, and which are ordinary local computation.
 *
 * Remote calls are:
 * - service calls under the configured prefix: prefix.Lambda.f(...),
 *   prefix.activity.a(...) and prefix.sleep(n)
 * - calls to other workflow functions defined in the module
 * - calls to functions named in the remote functions setting
 */
public class RemoteCallClassifier {

  public static final String LAMBDA_SERVICE = "Lambda";
  public static final String ACTIVITY_SERVICE = "activity";
  public static final String SLEEP_SERVICE = "sleep";

  public static class Target {
    public final CallKind kind;
    public final String name;

    public Target(CallKind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public String toString() {
      return kind + ":" + name;
    }
  }

  private final String prefix;
  private final Set<String> workflows;
  private final Set<String> localHelpers;
  private final Set<String> remoteFunctions;

  public RemoteCallClassifier(String prefix, Set<String> workflows,
            Set<String> localHelpers, Set<String> remoteFunctions) {
    this.prefix = prefix;
    this.workflows = workflows;
    this.localHelpers = localHelpers;
    this.remoteFunctions = remoteFunctions;
  }

  /**
   * Classifier for a module.  All module functions not listed as local
   * helpers are workflows.
   * @param settings
   * @param module
   * @return
   */
  public static RemoteCallClassifier forModule(Settings settings,
                                               Module module) {
    Set<String> local = new LinkedHashSet<String>(
                              settings.getList(Settings.LOCAL_FUNCTIONS));
    Set<String> workflows = new LinkedHashSet<String>();
    for (FunctionDef fn: module.functions) {
      if (!local.contains(fn.name)) {
        workflows.add(fn.name);
      }
    }
    Set<String> remote = new LinkedHashSet<String>(
                              settings.getList(Settings.REMOTE_FUNCTIONS));
    return new RemoteCallClassifier(settings.get(Settings.SERVICE_PREFIX),
        Collections.unmodifiableSet(workflows),
        Collections.unmodifiableSet(local),
        Collections.unmodifiableSet(remote));
  }

  public boolean isWorkflow(String functionName) {
    return workflows.contains(functionName);
  }

  public boolean isLocalHelper(String functionName) {
    return localHelpers.contains(functionName);
  }

  /**
   * @param call
   * @param variables names of variables in scope, which shadow
   *                  function names
   * @return remote target, or null if call is local
   * @throws InvalidConstructException if call names an unknown service
   */
  public Target classify(Expr.Call call, Set<String> variables)
                                      throws InvalidConstructException {
    String callee = call.calleeName();
    if (callee == null) {
      return null;
    }
    String[] parts = callee.split("\\.");
    if (variables.contains(parts[0])) {
      return null;
    }

    if (parts[0].equals(prefix)) {
      return serviceCall(call, callee, parts);
    }
    if (parts.length == 1) {
      if (workflows.contains(callee)) {
        return new Target(CallKind.WORKFLOW, callee);
      } else if (remoteFunctions.contains(callee)) {
        return new Target(CallKind.LAMBDA, callee);
      }
    }
    return null;
  }

  private Target serviceCall(Expr.Call call, String callee, String[] parts)
                                      throws InvalidConstructException {
    if (parts.length == 2 && parts[1].equals(SLEEP_SERVICE)) {
      return new Target(CallKind.SLEEP, SLEEP_SERVICE);
    } else if (parts.length == 3 && parts[1].equals(LAMBDA_SERVICE)) {
      return new Target(CallKind.LAMBDA, parts[2]);
    } else if (parts.length == 3 && parts[1].equals(ACTIVITY_SERVICE)) {
      return new Target(CallKind.ACTIVITY, parts[2]);
    }
    throw new InvalidConstructException(call.loc(),
        "unknown remote service " + callee + ": expected " + prefix + "." +
        LAMBDA_SERVICE + ".<function>, " + prefix + "." + ACTIVITY_SERVICE +
        ".<name> or " + prefix + "." + SLEEP_SERVICE);
  }

  /**
   * @param e
   * @param variables
   * @return true if any call in expression tree is remote
   * @throws InvalidConstructException
   */
  public boolean containsRemoteCall(Expr e, Set<String> variables)
                                        throws InvalidConstructException {
    for (Expr sub: Expr.preorder(e)) {
      if (sub.type() == ExprType.CALL &&
          classify((Expr.Call)sub, variables) != null) {
        return true;
      }
    }
    return false;
  }
}
