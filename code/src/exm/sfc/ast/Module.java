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
 * A parsed source file: imports and function definitions in source order
 */
public class Module {
  public final String fileName;
  public final ImmutableList<Stmt.Import> imports;
  public final ImmutableList<FunctionDef> functions;

  public Module(String fileName, List<Stmt.Import> imports,
                List<FunctionDef> functions) {
    this.fileName = fileName;
    this.imports = ImmutableList.copyOf(imports);
    this.functions = ImmutableList.copyOf(functions);
  }

  /**
   * @param name
   * @return function with name, or null
   */
  public FunctionDef lookupFunction(String name) {
    for (FunctionDef fn: functions) {
      if (fn.name.equals(name)) {
        return fn;
      }
    }
    return null;
  }
}
