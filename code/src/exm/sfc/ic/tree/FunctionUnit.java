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
package exm.sfc.ic.tree;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;

/**
 * Straight-line statements between two boundaries, run as one
 * stateless function that reads and writes the environment
 */
public class FunctionUnit {
  public final String name;
  /** Workflow function the unit was generated from */
  public final String function;
  public final ImmutableList<Stmt> body;
  /** Environment variables of the workflow function */
  public final Set<String> envVars;
  public final SourceLocation loc;

  public FunctionUnit(String name, String function, List<Stmt> body,
                      Set<String> envVars, SourceLocation loc) {
    this.name = name;
    this.function = function;
    this.body = ImmutableList.copyOf(body);
    this.envVars = Collections.unmodifiableSet(
                            new LinkedHashSet<String>(envVars));
    this.loc = loc;
  }

  @Override
  public String toString() {
    return name + " (" + body.size() + " statements)";
  }
}
