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
package exm.sfc.sfnbackend;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;

import exm.sfc.common.exceptions.SFCRuntimeError;
import exm.sfc.sfnbackend.tree.State;
import exm.sfc.sfnbackend.tree.StateMachine;

/**
 * Renders plans as JSON documents.  A plan that breaks any structural
 * invariant is a compiler bug and is rejected rather than written.
 */
public class PlanSerializer {

  /**
   * Two-space indentation with "key": value separators
   */
  static class PlanPrettyPrinter extends DefaultPrettyPrinter {
    private static final long serialVersionUID = 1L;

    PlanPrettyPrinter() {
      DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
      indentObjectsWith(indenter);
      indentArraysWith(indenter);
    }

    PlanPrettyPrinter(PlanPrettyPrinter base) {
      super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new PlanPrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g)
                                                  throws IOException {
      g.writeRaw(": ");
    }

    // Empty containers render as {} and []
    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries)
                                                  throws IOException {
      if (!_objectIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfEntries > 0) {
        _objectIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues)
                                                  throws IOException {
      if (!_arrayIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfValues > 0) {
        _arrayIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw(']');
    }
  }

  private static final ObjectMapper MAPPER = new ObjectMapper();

  static ObjectWriter writer() {
    return MAPPER.writer(new PlanPrettyPrinter());
  }

  public static String serialize(StateMachine plan) {
    validate(plan);
    return toText(toJson(plan));
  }

  static String toText(ObjectNode node) {
    try {
      return writer().writeValueAsString(node) + "\n";
    } catch (JsonProcessingException e) {
      throw new SFCRuntimeError("Could not render JSON: " + e.getMessage(),
                                e);
    }
  }

  public static ObjectNode toJson(StateMachine plan) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("StartAt", plan.getStartAt());
    ObjectNode states = root.putObject("States");
    for (State state: plan.getStates()) {
      state.appendTo(states.putObject(state.name()));
    }
    return root;
  }

  /**
   * Check structural invariants of plan
   * @param plan
   * @throws SFCRuntimeError if plan is malformed
   */
  public static void validate(StateMachine plan) {
    String where = " in plan " + plan.name();
    for (String name: plan.stateNames()) {
      if (!plan.isDefined(name)) {
        throw new SFCRuntimeError("State " + name + " reserved but never " +
                                  "defined" + where);
      }
    }
    if (!plan.isDefined(plan.getStartAt())) {
      throw new SFCRuntimeError("Start state " + plan.getStartAt() +
                                " does not exist" + where);
    }

    int ends = 0;
    for (State state: plan.getStates()) {
      if (state.isEnd()) {
        ends++;
        if (!state.transitions().isEmpty()) {
          throw new SFCRuntimeError("End state " + state.name() +
                                    " has a successor" + where);
        }
      } else if (state.transitions().isEmpty()) {
        throw new SFCRuntimeError("State " + state.name() +
                                  " has no successor" + where);
      }
      List<String> targets = new ArrayList<String>(state.transitions());
      targets.addAll(state.catchTargets());
      for (String target: targets) {
        if (target == null || !plan.isDefined(target)) {
          throw new SFCRuntimeError("State " + state.name() +
              " transitions to missing state " + target + where);
        }
      }
    }
    if (ends != 1) {
      throw new SFCRuntimeError("Expected exactly one end state, found " +
                                ends + where);
    }

    Set<String> reached = reachable(plan);
    for (String name: plan.stateNames()) {
      if (!reached.contains(name)) {
        throw new SFCRuntimeError("State " + name + " is unreachable" +
                                  where);
      }
    }
  }

  private static Set<String> reachable(StateMachine plan) {
    Set<String> reached = new HashSet<String>();
    Deque<String> work = new ArrayDeque<String>();
    work.push(plan.getStartAt());
    while (!work.isEmpty()) {
      String name = work.pop();
      if (!reached.add(name)) {
        continue;
      }
      State state = plan.getState(name);
      for (String succ: state.transitions()) {
        work.push(succ);
      }
      for (String succ: state.catchTargets()) {
        work.push(succ);
      }
    }
    return reached;
  }
}
