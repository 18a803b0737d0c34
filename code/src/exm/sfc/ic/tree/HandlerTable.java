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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.sfc.ast.SourceLocation;

/**
 * Ordered error handlers for a remote call: the first entry whose kinds
 * match the error is taken.
 */
public class HandlerTable {
  public static final HandlerTable EMPTY =
                    new HandlerTable(ImmutableList.<Entry>of());

  public static class Entry {
    public final ImmutableList<String> kinds;
    /** Variable to receive error payload, or null to discard it */
    public final String errorVar;
    public final Block target;
    public final SourceLocation loc;

    public Entry(List<String> kinds, String errorVar, Block target,
                 SourceLocation loc) {
      this.kinds = ImmutableList.copyOf(kinds);
      this.errorVar = errorVar;
      this.target = target;
      this.loc = loc;
    }

    @Override
    public String toString() {
      return kinds + (errorVar == null ? "" : " as " + errorVar) +
             " -> " + target;
    }
  }

  private final ImmutableList<Entry> entries;

  public HandlerTable(List<Entry> entries) {
    this.entries = ImmutableList.copyOf(entries);
  }

  public List<Entry> entries() {
    return entries;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}
