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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.sfc.common.exceptions.SFCRuntimeError;

/**
 * Plan for one workflow function.  States keep the order in which their
 * names were reserved, which is the order they are serialized in.
 */
public class StateMachine {
  private final String name;
  private final String startAt;
  /** Reserved names map to null until the state is defined */
  private final Map<String, State> states = new LinkedHashMap<String, State>();

  public StateMachine(String name, String startAt) {
    this.name = name;
    this.startAt = startAt;
  }

  public String name() {
    return name;
  }

  public String getStartAt() {
    return startAt;
  }

  /**
   * Reserve position for a state whose successors are not yet known
   * @param stateName
   */
  public void reserve(String stateName) {
    if (states.containsKey(stateName)) {
      throw new SFCRuntimeError("Duplicate state name " + stateName +
                                " in " + name);
    }
    states.put(stateName, null);
  }

  public void define(State state) {
    if (!states.containsKey(state.name())) {
      reserve(state.name());
    } else if (states.get(state.name()) != null) {
      throw new SFCRuntimeError("State " + state.name() +
                                " defined twice in " + name);
    }
    states.put(state.name(), state);
  }

  public boolean isDefined(String stateName) {
    return states.get(stateName) != null;
  }

  public boolean contains(String stateName) {
    return states.containsKey(stateName);
  }

  /**
   * @param stateName
   * @return the state, or null if not defined
   */
  public State getState(String stateName) {
    return states.get(stateName);
  }

  public List<String> stateNames() {
    return Collections.unmodifiableList(
                  new ArrayList<String>(states.keySet()));
  }

  /**
   * @return defined states in order
   */
  public List<State> getStates() {
    List<State> result = new ArrayList<State>(states.size());
    for (State s: states.values()) {
      if (s != null) {
        result.add(s);
      }
    }
    return result;
  }

  public int size() {
    return states.size();
  }

  public List<State> statesOfType(State.StateType type) {
    List<State> result = new ArrayList<State>();
    for (State s: getStates()) {
      if (s.type() == type) {
        result.add(s);
      }
    }
    return result;
  }
}
