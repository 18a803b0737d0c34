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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.sfc.ast.RemoteCall;
import exm.sfc.ast.SourceLocation;

/**
 * Block terminators.  Each kind describes the outgoing edges of a block.
 */
public abstract class Terminator {

  public static enum TerminatorType {
    FALLTHROUGH,
    BRANCH,
    LOOP_BACK,
    BREAK,
    CALL,
    EXIT,
  }

  public abstract TerminatorType type();

  public abstract List<Block> successors();

  public List<Block> exceptionSuccessors() {
    return Collections.emptyList();
  }

  public static class Fallthrough extends Terminator {
    public final Block target;

    public Fallthrough(Block target) {
      this.target = target;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.FALLTHROUGH;
    }

    @Override
    public List<Block> successors() {
      return Collections.singletonList(target);
    }

    @Override
    public String toString() {
      return "goto " + target;
    }
  }

  public static enum BranchKind {
    /** First test of an if chain */
    IF,
    /** Later test of an if chain */
    ELIF,
    /** Loop condition */
    WHILE,
  }

  /**
   * Two-way branch on a boolean test variable
   */
  public static class Branch extends Terminator {
    public final BranchKind kind;
    public final String testVar;
    public final Block ifTrue;
    public final Block ifFalse;
    public final SourceLocation loc;

    public Branch(BranchKind kind, String testVar, Block ifTrue,
                  Block ifFalse, SourceLocation loc) {
      this.kind = kind;
      this.testVar = testVar;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
      this.loc = loc;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.BRANCH;
    }

    @Override
    public List<Block> successors() {
      return Arrays.asList(ifTrue, ifFalse);
    }

    @Override
    public String toString() {
      return kind.toString().toLowerCase() + " " + testVar + " then " +
             ifTrue + " else " + ifFalse;
    }
  }

  /**
   * Back edge to loop header, from end of loop body or continue
   */
  public static class LoopBack extends Terminator {
    public final Block header;

    public LoopBack(Block header) {
      this.header = header;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.LOOP_BACK;
    }

    @Override
    public List<Block> successors() {
      return Collections.singletonList(header);
    }

    @Override
    public String toString() {
      return "loop " + header;
    }
  }

  /**
   * Forward edge out of loop to block following it
   */
  public static class Break extends Terminator {
    public final Block post;
    public final SourceLocation loc;

    public Break(Block post, SourceLocation loc) {
      this.post = post;
      this.loc = loc;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.BREAK;
    }

    @Override
    public List<Block> successors() {
      return Collections.singletonList(post);
    }

    @Override
    public String toString() {
      return "break " + post;
    }
  }

  /**
   * Remote call, continuing at next, or at a handler entry if the call
   * fails with an error the handler table catches
   */
  public static class Call extends Terminator {
    public final RemoteCall call;
    public final Block next;
    public final HandlerTable handlers;

    public Call(RemoteCall call, Block next, HandlerTable handlers) {
      this.call = call;
      this.next = next;
      this.handlers = handlers;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.CALL;
    }

    @Override
    public List<Block> successors() {
      return Collections.singletonList(next);
    }

    @Override
    public List<Block> exceptionSuccessors() {
      List<Block> result = new ArrayList<Block>();
      for (HandlerTable.Entry entry: handlers.entries()) {
        result.add(entry.target);
      }
      return result;
    }

    @Override
    public String toString() {
      String s = "call " + call + " then " + next;
      if (!handlers.isEmpty()) {
        s += " catch " + handlers;
      }
      return s;
    }
  }

  /**
   * Function completes, returning value of result key
   */
  public static class Exit extends Terminator {
    public final String resultKey;

    public Exit(String resultKey) {
      this.resultKey = resultKey;
    }

    @Override
    public TerminatorType type() {
      return TerminatorType.EXIT;
    }

    @Override
    public List<Block> successors() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return "exit " + resultKey;
    }
  }
}
