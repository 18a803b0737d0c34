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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Expr.ExprType;
import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Module;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.Stmt.ExceptHandler;
import exm.sfc.ast.Stmt.IfBranch;

/**
 * Collect names used in the AST
 */
public class Names {

  /**
   * Variables of a function: parameters first, then every name assigned
   * or bound by an except clause, in source order.
   * @param fn
   * @return
   */
  public static Set<String> assignedVariables(FunctionDef fn) {
    Set<String> vars = new LinkedHashSet<String>(fn.params);
    addAssigned(fn.body, vars);
    return vars;
  }

  private static void addAssigned(List<Stmt> stmts, Set<String> vars) {
    for (Stmt stmt: stmts) {
      switch (stmt.type()) {
        case ASSIGN:
          addTarget(((Stmt.Assign)stmt).target, vars);
          break;
        case AUG_ASSIGN:
          addTarget(((Stmt.AugAssign)stmt).target, vars);
          break;
        case CALL: {
          String binding = ((Stmt.CallStmt)stmt).call.binding;
          if (binding != null) {
            vars.add(binding);
          }
          break;
        }
        case IF: {
          Stmt.If ifStmt = (Stmt.If)stmt;
          for (IfBranch branch: ifStmt.branches) {
            addAssigned(branch.body, vars);
          }
          addAssigned(ifStmt.orelse, vars);
          break;
        }
        case WHILE: {
          Stmt.While loop = (Stmt.While)stmt;
          addAssigned(loop.header, vars);
          addAssigned(loop.body, vars);
          break;
        }
        case TRY: {
          Stmt.Try tryStmt = (Stmt.Try)stmt;
          addAssigned(tryStmt.body, vars);
          for (ExceptHandler handler: tryStmt.handlers) {
            if (handler.name != null) {
              vars.add(handler.name);
            }
            addAssigned(handler.body, vars);
          }
          break;
        }
        default:
          break;
      }
    }
  }

  /**
   * Imports inside a function body, at any depth, in source order.
   * @param fn
   * @return
   */
  public static List<Stmt.Import> localImports(FunctionDef fn) {
    List<Stmt.Import> imports = new ArrayList<Stmt.Import>();
    addImports(fn.body, imports);
    return imports;
  }

  private static void addImports(List<Stmt> stmts,
                                 List<Stmt.Import> imports) {
    for (Stmt stmt: stmts) {
      switch (stmt.type()) {
        case IMPORT:
          imports.add((Stmt.Import)stmt);
          break;
        case IF: {
          Stmt.If ifStmt = (Stmt.If)stmt;
          for (IfBranch branch: ifStmt.branches) {
            addImports(branch.body, imports);
          }
          addImports(ifStmt.orelse, imports);
          break;
        }
        case WHILE: {
          Stmt.While loop = (Stmt.While)stmt;
          addImports(loop.header, imports);
          addImports(loop.body, imports);
          break;
        }
        case TRY: {
          Stmt.Try tryStmt = (Stmt.Try)stmt;
          addImports(tryStmt.body, imports);
          for (ExceptHandler handler: tryStmt.handlers) {
            addImports(handler.body, imports);
          }
          break;
        }
        default:
          break;
      }
    }
  }

  private static void addTarget(Expr target, Set<String> vars) {
    if (target.type() == ExprType.NAME) {
      vars.add(((Expr.Name)target).id);
    }
  }

  /**
   * @param module
   * @return every identifier appearing in the module
   */
  public static Set<String> allNames(Module module) {
    Set<String> names = new LinkedHashSet<String>();
    for (FunctionDef fn: module.functions) {
      names.add(fn.name);
      names.addAll(fn.params);
      addNames(fn.body, names);
    }
    return names;
  }

  private static void addNames(List<Stmt> stmts, Set<String> names) {
    for (Stmt stmt: stmts) {
      switch (stmt.type()) {
        case ASSIGN: {
          Stmt.Assign assign = (Stmt.Assign)stmt;
          addNames(assign.target, names);
          addNames(assign.value, names);
          break;
        }
        case AUG_ASSIGN: {
          Stmt.AugAssign assign = (Stmt.AugAssign)stmt;
          addNames(assign.target, names);
          addNames(assign.value, names);
          break;
        }
        case EXPR:
          addNames(((Stmt.ExprStmt)stmt).expr, names);
          break;
        case RETURN: {
          Expr value = ((Stmt.Return)stmt).value;
          if (value != null) {
            addNames(value, names);
          }
          break;
        }
        case IF: {
          Stmt.If ifStmt = (Stmt.If)stmt;
          for (IfBranch branch: ifStmt.branches) {
            addNames(branch.cond, names);
            addNames(branch.body, names);
          }
          addNames(ifStmt.orelse, names);
          break;
        }
        case WHILE: {
          Stmt.While loop = (Stmt.While)stmt;
          addNames(loop.header, names);
          addNames(loop.cond, names);
          addNames(loop.body, names);
          break;
        }
        case TRY: {
          Stmt.Try tryStmt = (Stmt.Try)stmt;
          addNames(tryStmt.body, names);
          for (ExceptHandler handler: tryStmt.handlers) {
            if (handler.name != null) {
              names.add(handler.name);
            }
            addNames(handler.body, names);
          }
          break;
        }
        default:
          break;
      }
    }
  }

  private static void addNames(Expr expr, Set<String> names) {
    for (Expr e: Expr.preorder(expr)) {
      if (e.type() == ExprType.NAME) {
        names.add(((Expr.Name)e).id);
      }
    }
  }
}
