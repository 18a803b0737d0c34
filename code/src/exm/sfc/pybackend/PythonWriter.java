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
package exm.sfc.pybackend;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Stmt;
import exm.sfc.common.exceptions.SFCRuntimeError;

/**
 * Prints statements and expressions back to source form, adding only the
 * parentheses precedence requires.  Environment variables are printed as
 * lookups in the env dict.
 */
public class PythonWriter {
  public static final String ENV_VAR = "env";

  private static final int PREC_OR = 1;
  private static final int PREC_AND = 2;
  private static final int PREC_NOT = 3;
  private static final int PREC_COMPARE = 4;
  private static final int PREC_ADD = 6;
  private static final int PREC_MUL = 7;
  private static final int PREC_UNARY = 8;
  private static final int PREC_POW = 9;
  private static final int PREC_POSTFIX = 10;
  private static final int PREC_ATOM = 11;

  private final Set<String> envVars;

  /**
   * @param envVars names to print as environment lookups
   */
  public PythonWriter(Set<String> envVars) {
    this.envVars = envVars;
  }

  public PythonWriter() {
    this(Collections.<String>emptySet());
  }

  public String envRef(String var) {
    return ENV_VAR + "['" + var + "']";
  }

  public String stmt(Stmt stmt) {
    switch (stmt.type()) {
      case ASSIGN: {
        Stmt.Assign assign = (Stmt.Assign)stmt;
        return expr(assign.target) + " = " + expr(assign.value);
      }
      case AUG_ASSIGN: {
        Stmt.AugAssign aug = (Stmt.AugAssign)stmt;
        return expr(aug.target) + " " + aug.op + "= " + expr(aug.value);
      }
      case EXPR:
        return expr(((Stmt.ExprStmt)stmt).expr);
      case IMPORT:
        return ((Stmt.Import)stmt).text;
      default:
        throw new SFCRuntimeError("Statement " + stmt.type() + " at " +
                        stmt.loc() + " can't appear in a function unit");
    }
  }

  public String expr(Expr e) {
    StringBuilder sb = new StringBuilder();
    appendExpr(sb, e, 0);
    return sb.toString();
  }

  private void appendExpr(StringBuilder sb, Expr e, int minPrec) {
    int prec = precedence(e);
    boolean paren = prec < minPrec;
    if (paren) {
      sb.append('(');
    }
    switch (e.type()) {
      case NAME: {
        String id = ((Expr.Name)e).id;
        sb.append(envVars.contains(id) ? envRef(id) : id);
        break;
      }
      case CONSTANT:
        sb.append(((Expr.Constant)e).text);
        break;
      case ATTRIBUTE: {
        Expr.Attribute attr = (Expr.Attribute)e;
        appendExpr(sb, attr.value, PREC_POSTFIX);
        sb.append('.').append(attr.attr);
        break;
      }
      case SUBSCRIPT: {
        Expr.Subscript sub = (Expr.Subscript)e;
        appendExpr(sb, sub.value, PREC_POSTFIX);
        sb.append('[');
        appendExpr(sb, sub.index, 0);
        sb.append(']');
        break;
      }
      case CALL: {
        Expr.Call call = (Expr.Call)e;
        appendExpr(sb, call.func, PREC_POSTFIX);
        sb.append('(');
        boolean first = true;
        for (Expr arg: call.args) {
          first = comma(sb, first);
          appendExpr(sb, arg, PREC_OR);
        }
        for (Expr.Keyword kw: call.keywords) {
          first = comma(sb, first);
          sb.append(kw.name).append('=');
          appendExpr(sb, kw.value, PREC_OR);
        }
        sb.append(')');
        break;
      }
      case BINOP: {
        Expr.BinOp binop = (Expr.BinOp)e;
        if (binop.op.equals("**")) {
          // Right associative, binds tighter than unary on the left
          appendExpr(sb, binop.left, PREC_POSTFIX);
          sb.append(" ** ");
          appendExpr(sb, binop.right, PREC_UNARY);
        } else {
          appendExpr(sb, binop.left, prec);
          sb.append(' ').append(binop.op).append(' ');
          appendExpr(sb, binop.right, prec + 1);
        }
        break;
      }
      case BOOLOP: {
        Expr.BoolOp boolop = (Expr.BoolOp)e;
        boolean first = true;
        for (Expr v: boolop.values) {
          if (!first) {
            sb.append(' ').append(boolop.op).append(' ');
          }
          first = false;
          appendExpr(sb, v, prec + 1);
        }
        break;
      }
      case UNARYOP: {
        Expr.UnaryOp unop = (Expr.UnaryOp)e;
        sb.append(unop.op);
        if (unop.op.equals("not")) {
          sb.append(' ');
        }
        appendExpr(sb, unop.operand, prec);
        break;
      }
      case COMPARE: {
        Expr.Compare cmp = (Expr.Compare)e;
        appendExpr(sb, cmp.left, PREC_COMPARE + 1);
        for (int i = 0; i < cmp.ops.size(); i++) {
          sb.append(' ').append(cmp.ops.get(i)).append(' ');
          appendExpr(sb, cmp.comparators.get(i), PREC_COMPARE + 1);
        }
        break;
      }
      case LIST:
        sb.append('[');
        appendElts(sb, ((Expr.ListExpr)e).elts);
        sb.append(']');
        break;
      case TUPLE: {
        List<Expr> elts = ((Expr.TupleExpr)e).elts;
        sb.append('(');
        appendElts(sb, elts);
        if (elts.size() == 1) {
          sb.append(',');
        }
        sb.append(')');
        break;
      }
      case DICT: {
        Expr.DictExpr dict = (Expr.DictExpr)e;
        sb.append('{');
        for (int i = 0; i < dict.keys.size(); i++) {
          comma(sb, i == 0);
          appendExpr(sb, dict.keys.get(i), PREC_OR);
          sb.append(": ");
          appendExpr(sb, dict.values.get(i), PREC_OR);
        }
        sb.append('}');
        break;
      }
      default:
        throw new SFCRuntimeError("Unexpected expression " + e.type());
    }
    if (paren) {
      sb.append(')');
    }
  }

  private void appendElts(StringBuilder sb, List<Expr> elts) {
    boolean first = true;
    for (Expr elt: elts) {
      first = comma(sb, first);
      appendExpr(sb, elt, PREC_OR);
    }
  }

  private static boolean comma(StringBuilder sb, boolean first) {
    if (!first) {
      sb.append(", ");
    }
    return false;
  }

  private static int precedence(Expr e) {
    switch (e.type()) {
      case BOOLOP:
        return ((Expr.BoolOp)e).op.equals("or") ? PREC_OR : PREC_AND;
      case UNARYOP:
        return ((Expr.UnaryOp)e).op.equals("not") ? PREC_NOT : PREC_UNARY;
      case COMPARE:
        return PREC_COMPARE;
      case BINOP: {
        String op = ((Expr.BinOp)e).op;
        if (op.equals("+") || op.equals("-")) {
          return PREC_ADD;
        } else if (op.equals("**")) {
          return PREC_POW;
        }
        return PREC_MUL;
      }
      case ATTRIBUTE:
      case SUBSCRIPT:
      case CALL:
        return PREC_POSTFIX;
      default:
        return PREC_ATOM;
    }
  }
}
