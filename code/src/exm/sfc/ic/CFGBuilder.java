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
package exm.sfc.ic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Expr.ExprType;
import exm.sfc.ast.RemoteCall.CallKind;
import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.Stmt.ExceptHandler;
import exm.sfc.ast.Stmt.IfBranch;
import exm.sfc.common.exceptions.InvalidConstructException;
import exm.sfc.common.exceptions.SFCRuntimeError;
import exm.sfc.common.exceptions.UserException;
import exm.sfc.frontend.LogHelper;
import exm.sfc.frontend.NormalizedFunction;
import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.ic.tree.HandlerTable;
import exm.sfc.ic.tree.Terminator;
import exm.sfc.ic.tree.Terminator.BranchKind;

/**
 * Builds the control flow graph for a normalized function.
 *
 * Walks statement sequences recursively, appending simple statements to
 * the current block and closing it with a terminator at each remote
 * call, branch, loop edge or return.  Each walk returns the block where
 * control continues, or null if control can't reach the end of the
 * sequence.
 */
public class CFGBuilder {

  private static class LoopContext {
    final Block header;
    final Block post;
    int breaks = 0;

    LoopContext(Block header, Block post) {
      this.header = header;
      this.post = post;
    }
  }

  private final NormalizedFunction function;
  private final List<Block> blocks = new ArrayList<Block>();
  private final Deque<LoopContext> loops = new ArrayDeque<LoopContext>();
  private Block exit;
  private int callCount = 0;

  private CFGBuilder(NormalizedFunction function) {
    this.function = function;
  }

  public static ControlFlowGraph build(NormalizedFunction function)
                                                  throws UserException {
    return new CFGBuilder(function).build();
  }

  private ControlFlowGraph build() throws UserException {
    SourceLocation loc = function.def.loc;
    Block entry = newBlock(loc);
    exit = newBlock(loc);
    exit.setTerminator(new Terminator.Exit(function.resultKey));

    Block end = walkSeq(entry, function.def.body, HandlerScope.empty());
    if (end != null) {
      end.setTerminator(new Terminator.Fallthrough(exit));
    }
    assert(loops.isEmpty());

    ControlFlowGraph cfg = new ControlFlowGraph(function, entry, exit,
                                                blocks);
    if (!cfg.reachableBlocks().contains(exit)) {
      throw new InvalidConstructException(loc, "function " +
          function.name() + " can never complete: loop has no break " +
          "or return");
    }
    if (LogHelper.isDebugEnabled()) {
      LogHelper.debug(2, "CFG for " + function.name() + ":\n" +
                         cfg.prettyPrint());
    }
    return cfg;
  }

  private Block newBlock(SourceLocation loc) {
    Block b = new Block(blocks.size(), loc);
    blocks.add(b);
    return b;
  }

  private static SourceLocation firstLoc(List<Stmt> stmts,
                                         SourceLocation dflt) {
    return stmts.isEmpty() ? dflt : stmts.get(0).loc();
  }

  private Block walkSeq(Block current, List<Stmt> stmts, HandlerScope scope)
                                                  throws UserException {
    for (Stmt stmt: stmts) {
      if (current == null) {
        LogHelper.warn(stmt.loc(), "unreachable code: dropping " +
                       "statements after break, continue or return");
        return null;
      }
      current = walkStmt(current, stmt, scope);
    }
    return current;
  }

  private Block walkStmt(Block current, Stmt stmt, HandlerScope scope)
                                                  throws UserException {
    switch (stmt.type()) {
      case ASSIGN:
      case AUG_ASSIGN:
      case EXPR:
      case IMPORT:
        current.addStatement(stmt);
        return current;
      case PASS:
        return current;
      case CALL: {
        Stmt.CallStmt call = (Stmt.CallStmt)stmt;
        Block next = newBlock(stmt.loc());
        if (call.call.kind == CallKind.SLEEP) {
          // Waits can't fail
          current.setTerminator(new Terminator.Call(call.call, next,
                                                    HandlerTable.EMPTY));
        } else {
          current.setTerminator(new Terminator.Call(call.call, next,
                                                    scope.resolve()));
          callCount++;
        }
        return next;
      }
      case IF:
        return ifStmt(current, (Stmt.If)stmt, scope);
      case WHILE:
        return whileStmt(current, (Stmt.While)stmt, scope);
      case BREAK: {
        LoopContext loop = enclosingLoop(stmt, "break");
        current.setTerminator(new Terminator.Break(loop.post, stmt.loc()));
        loop.breaks++;
        return null;
      }
      case CONTINUE: {
        LoopContext loop = enclosingLoop(stmt, "continue");
        current.setTerminator(new Terminator.LoopBack(loop.header));
        return null;
      }
      case RETURN:
        current.setTerminator(new Terminator.Fallthrough(exit));
        return null;
      case TRY:
        return tryStmt(current, (Stmt.Try)stmt, scope);
      default:
        throw new SFCRuntimeError("Unexpected statement type " +
                                  stmt.type() + " at " + stmt.loc());
    }
  }

  private LoopContext enclosingLoop(Stmt stmt, String keyword)
                                      throws InvalidConstructException {
    if (loops.isEmpty()) {
      throw new InvalidConstructException(stmt.loc(),
                                "'" + keyword + "' outside loop");
    }
    return loops.peek();
  }

  private Block ifStmt(Block current, Stmt.If ifStmt, HandlerScope scope)
                                                  throws UserException {
    Block merge = newBlock(ifStmt.loc());
    boolean mergeReached = false;
    Block test = current;
    int n = ifStmt.branches.size();
    for (int i = 0; i < n; i++) {
      IfBranch branch = ifStmt.branches.get(i);
      Block body = newBlock(firstLoc(branch.body, branch.cond.loc()));
      Block next;
      if (i == n - 1 && !ifStmt.hasElse()) {
        next = merge;
        mergeReached = true;
      } else if (i == n - 1) {
        next = newBlock(firstLoc(ifStmt.orelse, ifStmt.loc()));
      } else {
        next = newBlock(ifStmt.branches.get(i + 1).cond.loc());
      }
      BranchKind kind = (i == 0) ? BranchKind.IF : BranchKind.ELIF;
      test.setTerminator(new Terminator.Branch(kind, testVar(branch.cond),
                                      body, next, branch.cond.loc()));

      Block end = walkSeq(body, branch.body, scope);
      if (end != null) {
        end.setTerminator(new Terminator.Fallthrough(merge));
        mergeReached = true;
      }
      test = next;
    }

    if (ifStmt.hasElse()) {
      Block end = walkSeq(test, ifStmt.orelse, scope);
      if (end != null) {
        end.setTerminator(new Terminator.Fallthrough(merge));
        mergeReached = true;
      }
    }
    return mergeReached ? merge : null;
  }

  private Block whileStmt(Block current, Stmt.While loop, HandlerScope scope)
                                                  throws UserException {
    Block header = newBlock(loop.loc());
    header.markLoopHeader();
    current.setTerminator(new Terminator.Fallthrough(header));
    Block post = newBlock(loop.loc());

    Block testBlock = walkSeq(header, loop.header, scope);
    if (testBlock == null) {
      throw new SFCRuntimeError("Loop header can't complete at " +
                                loop.loc());
    }
    Block body = newBlock(firstLoc(loop.body, loop.loc()));
    boolean infinite = isTrue(loop.cond);
    if (infinite) {
      testBlock.setTerminator(new Terminator.Fallthrough(body));
    } else {
      testBlock.setTerminator(new Terminator.Branch(BranchKind.WHILE,
                        testVar(loop.cond), body, post, loop.cond.loc()));
    }

    LoopContext ctx = new LoopContext(header, post);
    loops.push(ctx);
    Block end = walkSeq(body, loop.body, scope);
    loops.pop();
    if (end != null) {
      end.setTerminator(new Terminator.LoopBack(header));
    }

    if (infinite && ctx.breaks == 0) {
      return null;
    }
    return post;
  }

  private Block tryStmt(Block current, Stmt.Try tryStmt, HandlerScope scope)
                                                  throws UserException {
    Block post = newBlock(tryStmt.loc());
    boolean postReached = false;

    List<HandlerScope.Clause> frame = new ArrayList<HandlerScope.Clause>();
    for (ExceptHandler handler: tryStmt.handlers) {
      Block entry = newBlock(handler.loc);
      frame.add(new HandlerScope.Clause(handler.kinds, handler.name, entry,
                                        handler.loc));
    }

    int callsBefore = callCount;
    Block end = walkSeq(current, tryStmt.body, scope.push(frame));
    if (end != null) {
      end.setTerminator(new Terminator.Fallthrough(post));
      postReached = true;
    }
    if (callCount == callsBefore) {
      LogHelper.warn(tryStmt.loc(), "try block makes no remote calls, " +
                     "its except clauses will never run");
    }

    // Handlers run in the enclosing scope
    for (int i = 0; i < tryStmt.handlers.size(); i++) {
      ExceptHandler handler = tryStmt.handlers.get(i);
      Block handlerEnd = walkSeq(frame.get(i).entry, handler.body, scope);
      if (handlerEnd != null) {
        handlerEnd.setTerminator(new Terminator.Fallthrough(post));
        postReached = true;
      }
    }
    return postReached ? post : null;
  }

  private static String testVar(Expr cond) {
    if (cond.type() != ExprType.NAME) {
      throw new SFCRuntimeError("Branch condition not normalized at " +
                                cond.loc());
    }
    return ((Expr.Name)cond).id;
  }

  private static boolean isTrue(Expr cond) {
    return cond.type() == ExprType.CONSTANT &&
           ((Expr.Constant)cond).isTrue();
  }
}
