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
package exm.sfc.ic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.sfc.ast.SourceLocation;
import exm.sfc.common.util.PersistentStack;
import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.HandlerTable;

/**
 * Exception handlers active at a point in the program: one frame per
 * enclosing try statement, innermost on top.  Immutable, so the scope
 * captured by a call is not affected by later pushes.
 */
public class HandlerScope {
  public static final String CATCH_ALL = "States.ALL";

  /**
   * One except clause
   */
  public static class Clause {
    /** Error kinds caught, empty for bare except */
    public final ImmutableList<String> kinds;
    public final String errorVar;
    public final Block entry;
    public final SourceLocation loc;

    public Clause(List<String> kinds, String errorVar, Block entry,
                  SourceLocation loc) {
      this.kinds = ImmutableList.copyOf(kinds);
      this.errorVar = errorVar;
      this.entry = entry;
      this.loc = loc;
    }

    public boolean catchesAll() {
      return kinds.isEmpty() || kinds.contains(CATCH_ALL);
    }
  }

  private static final HandlerScope EMPTY =
      new HandlerScope(PersistentStack.<List<Clause>>empty());

  private final PersistentStack<List<Clause>> frames;

  private HandlerScope(PersistentStack<List<Clause>> frames) {
    this.frames = frames;
  }

  public static HandlerScope empty() {
    return EMPTY;
  }

  public HandlerScope push(List<Clause> frame) {
    return new HandlerScope(frames.push(ImmutableList.copyOf(frame)));
  }

  public int depth() {
    return frames.size();
  }

  /**
   * Build handler table for a call in this scope.  Inner clauses come
   * first, each frame in source order.  Kinds caught by an earlier clause
   * are dropped from later ones, and nothing follows a catch-all.
   * @return
   */
  public HandlerTable resolve() {
    List<HandlerTable.Entry> entries = new ArrayList<HandlerTable.Entry>();
    Set<String> covered = new HashSet<String>();
    for (List<Clause> frame: frames) {
      for (Clause clause: frame) {
        if (clause.catchesAll()) {
          entries.add(new HandlerTable.Entry(ImmutableList.of(CATCH_ALL),
                        clause.errorVar, clause.entry, clause.loc));
          return new HandlerTable(entries);
        }
        List<String> kinds = new ArrayList<String>();
        for (String kind: clause.kinds) {
          if (covered.add(kind)) {
            kinds.add(kind);
          }
        }
        if (!kinds.isEmpty()) {
          entries.add(new HandlerTable.Entry(kinds, clause.errorVar,
                                             clause.entry, clause.loc));
        }
      }
    }
    return new HandlerTable(entries);
  }
}
