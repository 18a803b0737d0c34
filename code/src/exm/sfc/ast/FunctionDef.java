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
package exm.sfc.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Module-level function definition
 */
public class FunctionDef {
  public final String name;
  public final ImmutableList<String> params;
  public final ImmutableList<Stmt> body;
  public final SourceLocation loc;
  /** Source text of the definition, or null if not known */
  public final String source;

  public FunctionDef(SourceLocation loc, String name, List<String> params,
                     List<Stmt> body) {
    this(loc, name, params, body, null);
  }

  public FunctionDef(SourceLocation loc, String name, List<String> params,
                     List<Stmt> body, String source) {
    this.loc = loc;
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
    this.source = source;
  }

  /**
   * @param newBody
   * @return copy of this definition with body replaced
   */
  public FunctionDef withBody(List<Stmt> newBody) {
    return new FunctionDef(loc, name, params, newBody, source);
  }

  @Override
  public String toString() {
    return name + params;
  }
}
