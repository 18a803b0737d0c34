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
package exm.sfc.ic.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;
import exm.sfc.common.exceptions.SFCRuntimeError;

/**
 * Basic block: straight-line statements followed by a terminator.
 * Blocks are compared by identity.
 */
public class Block {
  private final int id;
  private final SourceLocation loc;
  private final List<Stmt> stmts = new ArrayList<Stmt>();
  private Terminator terminator = null;
  private boolean loopHeader = false;
  /** Set by liftability analysis */
  private Liftability liftability = null;

  public Block(int id, SourceLocation loc) {
    this.id = id;
    this.loc = loc;
  }

  public int id() {
    return id;
  }

  public SourceLocation loc() {
    return loc;
  }

  public List<Stmt> stmts() {
    return Collections.unmodifiableList(stmts);
  }

  public boolean isEmpty() {
    return stmts.isEmpty();
  }

  public void addStatement(Stmt stmt) {
    assert(stmt.isSimple()) : stmt;
    checkOpen();
    stmts.add(stmt);
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public boolean isTerminated() {
    return terminator != null;
  }

  public void setTerminator(Terminator terminator) {
    checkOpen();
    this.terminator = terminator;
  }

  private void checkOpen() {
    if (terminator != null) {
      throw new SFCRuntimeError("Block " + this + " already terminated by "
                                + terminator);
    }
  }

  public boolean isLoopHeader() {
    return loopHeader;
  }

  public void markLoopHeader() {
    this.loopHeader = true;
  }

  public Liftability getLiftability() {
    return liftability;
  }

  public void setLiftability(Liftability liftability) {
    this.liftability = liftability;
  }

  /**
   * @return normal control flow successors
   */
  public List<Block> successors() {
    if (terminator == null) {
      return Collections.emptyList();
    }
    return terminator.successors();
  }

  /**
   * @return successors through exception edges
   */
  public List<Block> exceptionSuccessors() {
    if (terminator == null) {
      return Collections.emptyList();
    }
    return terminator.exceptionSuccessors();
  }

  public void prettyPrint(StringBuilder sb) {
    sb.append(this);
    if (loopHeader) {
      sb.append(" (loop header)");
    }
    if (liftability != null) {
      sb.append(" [").append(liftability).append("]");
    }
    sb.append(":\n");
    for (Stmt stmt: stmts) {
      sb.append("    ").append(stmt.type()).append(" at ")
        .append(stmt.loc()).append("\n");
    }
    sb.append("    ").append(terminator).append("\n");
  }

  @Override
  public String toString() {
    return "B" + id;
  }
}
