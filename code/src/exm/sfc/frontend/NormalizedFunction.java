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
package exm.sfc.frontend;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import exm.sfc.ast.FunctionDef;

/**
 * Workflow function after normalization: remote calls are statements,
 * branch and loop conditions are test variables and every value-returning
 * return writes the result key.
 */
public class NormalizedFunction {
  public final FunctionDef def;
  /** Environment key holding the function's result */
  public final String resultKey;
  /** True if the initializer must set the result key to null */
  public final boolean initResult;
  /** All environment variables of the function, parameters first */
  public final Set<String> variables;

  public NormalizedFunction(FunctionDef def, String resultKey,
                            boolean initResult, Set<String> variables) {
    this.def = def;
    this.resultKey = resultKey;
    this.initResult = initResult;
    this.variables = Collections.unmodifiableSet(
                          new LinkedHashSet<String>(variables));
  }

  public String name() {
    return def.name;
  }
}
