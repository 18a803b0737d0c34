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
 * Catch clause of a task: errors matching any of the kinds transfer to
 * next, with the error payload written at the result path
 */
public class Catcher {
  public final ImmutableList<String> errorEquals;
  public final String resultPath;
  public final String next;

  public Catcher(List<String> errorEquals, String resultPath, String next) {
    this.errorEquals = ImmutableList.copyOf(errorEquals);
    this.resultPath = resultPath;
    this.next = next;
  }

  public void appendTo(ObjectNode node) {
    ArrayNode errors = node.putArray("ErrorEquals");
    for (String error: errorEquals) {
      errors.add(error);
    }
    node.put("ResultPath", resultPath);
    node.put("Next", next);
  }
}
