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
package exm.sfc.common.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Map of counters, one per key.  Missing keys count as zero.
 * @param <K>
 */
public class Counters<K> {
  private final Map<K, Long> map = new HashMap<K, Long>();

  public long increment(K key) {
    return add(key, 1);
  }

  public long add(K key, long incr) {
    Long count = map.get(key);
    if (count == null) {
      count = incr;
    } else {
      count += incr;
    }
    map.put(key, count);
    return count;
  }

  public long getCount(K key) {
    Long res = map.get(key);
    return res == null ? 0 : res;
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
