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
package exm.sfc.pybackend;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Stmt;
import exm.sfc.common.exceptions.SFCRuntimeError;
import exm.sfc.ic.tree.FunctionUnit;

/**
 * Writes the module of function units: the source module's imports, its
 * local helpers as written, then one handler function per unit.  Each
 * unit takes the environment from its event and returns it updated.
 */
public class FunctionUnitEmitter {
  public static final String INDENT = "    ";
  public static final String FUNC_PARAM = "func";

  private final StringBuilder sb = new StringBuilder();

  public FunctionUnitEmitter(String sourceFile) {
    sb.append("# Function units generated by sfc from ")
      .append(sourceFile).append("\n");
  }

  /**
   * Add import statements at module level.  Imports from function bodies
   * go here too, so that every unit sees the names they bind.  Repeated
   * statements are written once.
   * @param imports
   */
  public void addImports(List<Stmt.Import> imports) {
    Set<String> written = new LinkedHashSet<String>();
    for (Stmt.Import imp: imports) {
      written.add(imp.text);
    }
    if (written.isEmpty()) {
      return;
    }
    sb.append("\n");
    for (String text: written) {
      sb.append(text).append("\n");
    }
  }

  /**
   * Add local helper function with its original source text
   * @param helper
   */
  public void addHelper(FunctionDef helper) {
    if (helper.source == null) {
      throw new SFCRuntimeError("No source text for helper " + helper.name);
    }
    sb.append("\n\n").append(helper.source);
  }

  public void addUnits(List<FunctionUnit> units) {
    for (FunctionUnit unit: units) {
      addUnit(unit);
    }
  }

  public void addUnit(FunctionUnit unit) {
    PythonWriter writer = new PythonWriter(unit.envVars);
    sb.append("\n\n");
    sb.append("def ").append(unit.name).append("(event, context):\n");
    sb.append(INDENT).append(PythonWriter.ENV_VAR)
      .append(" = event['").append(PythonWriter.ENV_VAR).append("']\n");
    for (Stmt stmt: unit.body) {
      sb.append(INDENT).append(writer.stmt(stmt)).append("\n");
    }
    sb.append(INDENT).append("return {'").append(PythonWriter.ENV_VAR)
      .append("': ").append(PythonWriter.ENV_VAR).append("}\n");
  }

  /**
   * Add router that dispatches to the unit named in the event
   * @param routerName
   */
  public void addRouter(String routerName) {
    sb.append("\n\n");
    sb.append("def ").append(routerName).append("(event, context):\n");
    sb.append(INDENT).append("funcName = event['").append(FUNC_PARAM)
      .append("']\n");
    sb.append(INDENT).append("func = globals()[funcName]\n");
    sb.append(INDENT).append("return func(event, context)\n");
  }

  public String getCode() {
    return sb.toString();
  }
}
