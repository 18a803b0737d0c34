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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import exm.sfc.ast.SourceLocation;
import exm.sfc.sfnbackend.tree.State;
import exm.sfc.sfnbackend.tree.StateMachine;

/**
 * Visualization graph of a plan: every state with the source location
 * it came from, and every transition, marking those taken on errors
 */
public class GraphEmitter {

  public static ObjectNode toJson(StateMachine plan) {
    JsonNodeFactory json = JsonNodeFactory.instance;
    ObjectNode root = json.objectNode();
    ObjectNode nodes = root.putObject("nodes");
    ArrayNode edges = root.putArray("edges");
    for (State state: plan.getStates()) {
      ObjectNode node = nodes.putObject(state.name());
      SourceLocation loc = state.loc();
      if (loc != null && loc != SourceLocation.UNKNOWN) {
        ArrayNode srcLoc = node.putObject("srcmap").putArray("loc");
        srcLoc.add(loc.line);
        srcLoc.add(loc.column);
      }
      for (String target: state.transitions()) {
        ObjectNode edge = edges.addObject();
        edge.put("from", state.name());
        edge.put("to", target);
      }
      for (String target: state.catchTargets()) {
        ObjectNode edge = edges.addObject();
        edge.put("from", state.name());
        edge.put("to", target);
        edge.put("type", "catch");
      }
    }
    return root;
  }

  public static String emit(StateMachine plan) {
    return PlanSerializer.toText(toJson(plan));
  }
}
