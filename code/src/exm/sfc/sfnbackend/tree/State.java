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
package exm.sfc.sfnbackend.tree;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

import exm.sfc.ast.SourceLocation;

/**
 * A state in a plan.  Each state renders itself into a JSON object
 * with keys in the order the plan format lists them.
 */
public abstract class State {

  public static enum StateType {
    PASS("Pass"),
    TASK("Task"),
    CHOICE("Choice"),
    WAIT("Wait");

    private final String jsonName;

    private StateType(String jsonName) {
      this.jsonName = jsonName;
    }

    public String jsonName() {
      return jsonName;
    }
  }

  protected final String name;
  /** Source location the state was generated from */
  protected final SourceLocation loc;

  protected State(String name, SourceLocation loc) {
    this.name = name;
    this.loc = loc;
  }

  public String name() {
    return name;
  }

  public SourceLocation loc() {
    return loc;
  }

  public abstract StateType type();

  /**
   * @return names of states reached by normal transitions, in order
   */
  public abstract List<String> transitions();

  /**
   * @return names of states reached by catching an error
   */
  public List<String> catchTargets() {
    return Collections.emptyList();
  }

  /**
   * @return true if this state ends the execution
   */
  public boolean isEnd() {
    return false;
  }

  public void appendTo(ObjectNode node) {
    node.put("Type", type().jsonName());
    appendFields(node);
  }

  protected abstract void appendFields(ObjectNode node);

  @Override
  public String toString() {
    return type().jsonName() + " " + name + " -> " + transitions();
  }
}
