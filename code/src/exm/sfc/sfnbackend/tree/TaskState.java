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
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import exm.sfc.ast.SourceLocation;

/**
 * Task state: invokes a function unit, a remote function, an activity
 * or a nested execution
 */
public class TaskState extends State {
  private final String resource;
  private final String inputPath;
  private final ObjectNode parameters;
  private final String outputPath;
  private final String resultPath;
  private final Long timeoutSeconds;
  private final Long heartbeatSeconds;
  private final ImmutableList<Retrier> retriers;
  private final ImmutableList<Catcher> catchers;
  private final String next;

  public TaskState(String name, SourceLocation loc, String resource,
      String inputPath, ObjectNode parameters, String outputPath,
      String resultPath, Long timeoutSeconds, Long heartbeatSeconds,
      List<Retrier> retriers, List<Catcher> catchers, String next) {
    super(name, loc);
    this.resource = resource;
    this.inputPath = inputPath;
    this.parameters = parameters;
    this.outputPath = outputPath;
    this.resultPath = resultPath;
    this.timeoutSeconds = timeoutSeconds;
    this.heartbeatSeconds = heartbeatSeconds;
    this.retriers = ImmutableList.copyOf(retriers);
    this.catchers = ImmutableList.copyOf(catchers);
    this.next = next;
  }

  public String getResource() {
    return resource;
  }

  public String getInputPath() {
    return inputPath;
  }

  public ObjectNode getParameters() {
    return parameters;
  }

  public String getResultPath() {
    return resultPath;
  }

  public Long getTimeoutSeconds() {
    return timeoutSeconds;
  }

  public Long getHeartbeatSeconds() {
    return heartbeatSeconds;
  }

  public List<Retrier> getRetriers() {
    return retriers;
  }

  public List<Catcher> getCatchers() {
    return catchers;
  }

  public String getNext() {
    return next;
  }

  @Override
  public StateType type() {
    return StateType.TASK;
  }

  @Override
  public List<String> transitions() {
    return Collections.singletonList(next);
  }

  @Override
  public List<String> catchTargets() {
    List<String> result = new ArrayList<String>(catchers.size());
    for (Catcher c: catchers) {
      result.add(c.next);
    }
    return result;
  }

  @Override
  protected void appendFields(ObjectNode node) {
    node.put("Resource", resource);
    if (inputPath != null) {
      node.put("InputPath", inputPath);
    }
    if (parameters != null) {
      node.set("Parameters", parameters.deepCopy());
    }
    if (outputPath != null) {
      node.put("OutputPath", outputPath);
    }
    node.put("ResultPath", resultPath);
    if (timeoutSeconds != null) {
      node.put("TimeoutSeconds", timeoutSeconds);
    }
    if (heartbeatSeconds != null) {
      node.put("HeartbeatSeconds", heartbeatSeconds);
    }
    if (!retriers.isEmpty()) {
      ArrayNode retry = node.putArray("Retry");
      for (Retrier r: retriers) {
        r.appendTo(retry.addObject());
      }
    }
    if (!catchers.isEmpty()) {
      ArrayNode catchNode = node.putArray("Catch");
      for (Catcher c: catchers) {
        c.appendTo(catchNode.addObject());
      }
    }
    node.put("Next", next);
  }
}
