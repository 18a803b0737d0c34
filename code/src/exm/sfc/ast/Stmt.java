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

import com.google.common.collect.ImmutableList;

/**
 * Statement nodes of the source dialect.  Immutable.
 */
public abstract class Stmt {

  public static enum StmtType {
    ASSIGN,
    AUG_ASSIGN,
    EXPR,
    IF,
    WHILE,
    BREAK,
    CONTINUE,
    PASS,
    RETURN,
    TRY,
    IMPORT,
    /** Remote call, only present after normalization */
    CALL,
  }

  private final SourceLocation loc;

  protected Stmt(SourceLocation loc) {
    this.loc = loc;
  }

  public SourceLocation loc() {
    return loc;
  }

  public abstract StmtType type();

  /**
   * @return true if statement has no nested statements
   */
  public boolean isSimple() {
    switch (type()) {
      case IF:
      case WHILE:
      case TRY:
        return false;
      default:
        return true;
    }
  }

  public static class Assign extends Stmt {
    public final Expr target;
    public final Expr value;

    public Assign(SourceLocation loc, Expr target, Expr value) {
      super(loc);
      this.target = target;
      this.value = value;
    }

    @Override
    public StmtType type() {
      return StmtType.ASSIGN;
    }
  }

  public static class AugAssign extends Stmt {
    public final Expr target;
    /** Operator without "=", e.g. "+" */
    public final String op;
    public final Expr value;

    public AugAssign(SourceLocation loc, Expr target, String op, Expr value) {
      super(loc);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public StmtType type() {
      return StmtType.AUG_ASSIGN;
    }
  }

  public static class ExprStmt extends Stmt {
    public final Expr expr;

    public ExprStmt(SourceLocation loc, Expr expr) {
      super(loc);
      this.expr = expr;
    }

    @Override
    public StmtType type() {
      return StmtType.EXPR;
    }
  }

  public static class IfBranch {
    public final Expr cond;
    public final ImmutableList<Stmt> body;

    public IfBranch(Expr cond, List<Stmt> body) {
      this.cond = cond;
      this.body = ImmutableList.copyOf(body);
    }
  }

  /**
   * if/elif chain with optional else.  Branches are in source order.
   */
  public static class If extends Stmt {
    public final ImmutableList<IfBranch> branches;
    /** Empty if no else */
    public final ImmutableList<Stmt> orelse;

    public If(SourceLocation loc, List<IfBranch> branches, List<Stmt> orelse) {
      super(loc);
      assert(!branches.isEmpty());
      this.branches = ImmutableList.copyOf(branches);
      this.orelse = ImmutableList.copyOf(orelse);
    }

    public boolean hasElse() {
      return !orelse.isEmpty();
    }

    @Override
    public StmtType type() {
      return StmtType.IF;
    }
  }

  public static class While extends Stmt {
    /**
     * Statements evaluated at loop header before each test of the
     * condition.  Empty until normalization.
     */
    public final ImmutableList<Stmt> header;
    public final Expr cond;
    public final ImmutableList<Stmt> body;

    public While(SourceLocation loc, List<Stmt> header, Expr cond,
                 List<Stmt> body) {
      super(loc);
      this.header = ImmutableList.copyOf(header);
      this.cond = cond;
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public StmtType type() {
      return StmtType.WHILE;
    }
  }

  public static class Break extends Stmt {
    public Break(SourceLocation loc) {
      super(loc);
    }

    @Override
    public StmtType type() {
      return StmtType.BREAK;
    }
  }

  public static class Continue extends Stmt {
    public Continue(SourceLocation loc) {
      super(loc);
    }

    @Override
    public StmtType type() {
      return StmtType.CONTINUE;
    }
  }

  public static class Pass extends Stmt {
    public Pass(SourceLocation loc) {
      super(loc);
    }

    @Override
    public StmtType type() {
      return StmtType.PASS;
    }
  }

  public static class Return extends Stmt {
    /** null for bare return */
    public final Expr value;

    public Return(SourceLocation loc, Expr value) {
      super(loc);
      this.value = value;
    }

    @Override
    public StmtType type() {
      return StmtType.RETURN;
    }
  }

  /**
   * except clause.  An empty kinds list is a bare "except:".
   */
  public static class ExceptHandler {
    public final ImmutableList<String> kinds;
    /** Name bound to caught error, or null */
    public final String name;
    public final ImmutableList<Stmt> body;
    public final SourceLocation loc;

    public ExceptHandler(SourceLocation loc, List<String> kinds, String name,
                         List<Stmt> body) {
      this.loc = loc;
      this.kinds = ImmutableList.copyOf(kinds);
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }
  }

  public static class Try extends Stmt {
    public final ImmutableList<Stmt> body;
    public final ImmutableList<ExceptHandler> handlers;

    public Try(SourceLocation loc, List<Stmt> body,
               List<ExceptHandler> handlers) {
      super(loc);
      this.body = ImmutableList.copyOf(body);
      this.handlers = ImmutableList.copyOf(handlers);
    }

    @Override
    public StmtType type() {
      return StmtType.TRY;
    }
  }

  /**
   * import or from-import, kept as normalized source text
   */
  public static class Import extends Stmt {
    public final String text;

    public Import(SourceLocation loc, String text) {
      super(loc);
      this.text = text;
    }

    @Override
    public StmtType type() {
      return StmtType.IMPORT;
    }
  }

  public static class CallStmt extends Stmt {
    public final RemoteCall call;

    public CallStmt(RemoteCall call) {
      super(call.loc);
      this.call = call;
    }

    @Override
    public StmtType type() {
      return StmtType.CALL;
    }
  }
}
