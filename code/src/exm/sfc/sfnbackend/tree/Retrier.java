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

import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

/**
 * Retry policy of a task.  Unset fields are left to the orchestrator's
 * defaults.
 */
public class Retrier {
  public final ImmutableList<String> errorEquals;
  public final Long intervalSeconds;
  public final Long maxAttempts;
  public final Double backoffRate;

  public Retrier(List<String> errorEquals, Long intervalSeconds,
                 Long maxAttempts, Double backoffRate) {
    this.errorEquals = ImmutableList.copyOf(errorEquals);
    this.intervalSeconds = intervalSeconds;
    this.maxAttempts = maxAttempts;
    this.backoffRate = backoffRate;
  }

  public void appendTo(ObjectNode node) {
    ArrayNode errors = node.putArray("ErrorEquals");
    for (String error: errorEquals) {
      errors.add(error);
    }
    if (intervalSeconds != null) {
      node.put("IntervalSeconds", intervalSeconds);
    }
    if (maxAttempts != null) {
      node.put("MaxAttempts", maxAttempts);
    }
    if (backoffRate != null) {
      node.put("BackoffRate", backoffRate);
    }
  }
}
