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

import java.util.HashSet;
import java.util.Set;

import exm.sfc.ast.Module;
import exm.sfc.common.util.Counters;

/**
 * Generate fresh names of the form prefix_N, N counting up from 1 per
 * prefix.  Never returns a name used in the source module or already
 * generated.
 */
public class GenSym {
  private final Set<String> taken;
  private final Counters<String> counters = new Counters<String>();

  public GenSym(Module module) {
    this(Names.allNames(module));
  }

  public GenSym(Set<String> reserved) {
    this.taken = new HashSet<String>(reserved);
  }

  public String sym(String prefix) {
    while (true) {
      String name = prefix + "_" + counters.increment(prefix);
      if (taken.add(name)) {
        return name;
      }
    }
  }
}
