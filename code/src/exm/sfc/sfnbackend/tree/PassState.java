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
 * Pass state: reshapes the environment without calling anything.
 * Exactly one of next and end is set.
 */
public class PassState extends State {
  private final String inputPath;
  private final ObjectNode parameters;
  private final String outputPath;
  private final String next;
  private final boolean end;

  public PassState(String name, SourceLocation loc, String inputPath,
                   ObjectNode parameters, String outputPath,
                   String next, boolean end) {
    super(name, loc);
    assert((next == null) == end) : name;
    this.inputPath = inputPath;
    this.parameters = parameters;
    this.outputPath = outputPath;
    this.next = next;
    this.end = end;
  }

  /**
   * Pass through the environment unchanged
   */
  public static PassState transfer(String name, SourceLocation loc,
                                   String next) {
    return new PassState(name, loc, "$", null, null, next, false);
  }

  public String getNext() {
    return next;
  }

  public ObjectNode getParameters() {
    return parameters;
  }

  public String getOutputPath() {
    return outputPath;
  }

  @Override
  public StateType type() {
    return StateType.PASS;
  }

  @Override
  public List<String> transitions() {
    if (next == null) {
      return Collections.emptyList();
    }
    return Collections.singletonList(next);
  }

  @Override
  public boolean isEnd() {
    return end;
  }

  @Override
  protected void appendFields(ObjectNode node) {
    if (inputPath != null) {
      node.put("InputPath", inputPath);
    }
    if (parameters != null) {
      node.set("Parameters", parameters.deepCopy());
    }
    if (outputPath != null) {
      node.put("OutputPath", outputPath);
    }
    if (end) {
      node.put("End", true);
    } else {
      node.put("Next", next);
    }
  }
}
