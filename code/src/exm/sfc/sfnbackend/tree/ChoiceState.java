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
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import exm.sfc.ast.SourceLocation;

/**
 * Choice state: the first rule whose boolean variable is true is
 * taken, otherwise the default
 */
public class ChoiceState extends State {

  public static class ChoiceRule {
    /** JSON path of boolean test variable */
    public final String variable;
    public final String next;

    public ChoiceRule(String variable, String next) {
      this.variable = variable;
      this.next = next;
    }
  }

  private final ImmutableList<ChoiceRule> rules;
  private final String defaultTarget;

  public ChoiceState(String name, SourceLocation loc, List<ChoiceRule> rules,
                     String defaultTarget) {
    super(name, loc);
    assert(!rules.isEmpty()) : name;
    this.rules = ImmutableList.copyOf(rules);
    this.defaultTarget = defaultTarget;
  }

  public List<ChoiceRule> getRules() {
    return rules;
  }

  public String getDefault() {
    return defaultTarget;
  }

  @Override
  public StateType type() {
    return StateType.CHOICE;
  }

  @Override
  public List<String> transitions() {
    List<String> result = new ArrayList<String>(rules.size() + 1);
    for (ChoiceRule rule: rules) {
      result.add(rule.next);
    }
    result.add(defaultTarget);
    return result;
  }

  @Override
  protected void appendFields(ObjectNode node) {
    ArrayNode choices = node.putArray("Choices");
    for (ChoiceRule rule: rules) {
      ObjectNode choice = choices.addObject();
      choice.put("Variable", rule.variable);
      choice.put("BooleanEquals", true);
      choice.put("Next", rule.next);
    }
    node.put("Default", defaultTarget);
  }
}
