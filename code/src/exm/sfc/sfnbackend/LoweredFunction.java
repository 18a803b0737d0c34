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
package exm.sfc.sfnbackend;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sfc.ic.tree.FunctionUnit;
import exm.sfc.sfnbackend.tree.StateMachine;

/**
 * Output of lowering one workflow function
 */
public class LoweredFunction {
  public final StateMachine plan;
  public final ImmutableList<FunctionUnit> units;

  public LoweredFunction(StateMachine plan, List<FunctionUnit> units) {
    this.plan = plan;
    this.units = ImmutableList.copyOf(units);
  }

  public String name() {
    return plan.name();
  }
}
