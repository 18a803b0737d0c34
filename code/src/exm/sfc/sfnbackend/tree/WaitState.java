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
 * Wait state: fixed number of seconds, or seconds read from the
 * environment
 */
public class WaitState extends State {
  private final Long seconds;
  private final String secondsPath;
  private final String next;

  private WaitState(String name, SourceLocation loc, Long seconds,
                    String secondsPath, String next) {
    super(name, loc);
    assert((seconds == null) != (secondsPath == null));
    this.seconds = seconds;
    this.secondsPath = secondsPath;
    this.next = next;
  }

  public static WaitState seconds(String name, SourceLocation loc,
                                  long seconds, String next) {
    return new WaitState(name, loc, seconds, null, next);
  }

  public static WaitState secondsPath(String name, SourceLocation loc,
                                      String secondsPath, String next) {
    return new WaitState(name, loc, null, secondsPath, next);
  }

  public String getNext() {
    return next;
  }

  @Override
  public StateType type() {
    return StateType.WAIT;
  }

  @Override
  public List<String> transitions() {
    return Collections.singletonList(next);
  }

  @Override
  protected void appendFields(ObjectNode node) {
    if (seconds != null) {
      node.put("Seconds", seconds);
    } else {
      node.put("SecondsPath", secondsPath);
    }
    node.put("Next", next);
  }
}
