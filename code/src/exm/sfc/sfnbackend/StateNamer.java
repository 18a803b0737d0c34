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

import java.util.HashSet;
import java.util.Set;

/**
 * Allocates unique state names within one plan: the first use of a base
 * name is bare, later uses get a numeric suffix
 */
public class StateNamer {
  private final Set<String> used = new HashSet<String>();

  public String name(String base) {
    if (used.add(base)) {
      return base;
    }
    for (int i = 1; ; i++) {
      String candidate = base + "_" + i;
      if (used.add(candidate)) {
        return candidate;
      }
    }
  }
}
