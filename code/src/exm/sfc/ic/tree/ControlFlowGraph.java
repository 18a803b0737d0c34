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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Sets;

import exm.sfc.frontend.NormalizedFunction;

/**
 * Control flow graph of one workflow function, with a single entry block
 * and a single exit block
 */
public class ControlFlowGraph {
  private final NormalizedFunction function;
  private final Block entry;
  private final Block exit;
  /** All blocks in creation order, including unreachable ones */
  private final List<Block> blocks;

  public ControlFlowGraph(NormalizedFunction function, Block entry,
                          Block exit, List<Block> blocks) {
    this.function = function;
    this.entry = entry;
    this.exit = exit;
    this.blocks = Collections.unmodifiableList(new ArrayList<Block>(blocks));
  }

  public NormalizedFunction function() {
    return function;
  }

  public String name() {
    return function.name();
  }

  public String resultKey() {
    return function.resultKey;
  }

  public Block entry() {
    return entry;
  }

  public Block exit() {
    return exit;
  }

  public List<Block> allBlocks() {
    return blocks;
  }

  /**
   * @return blocks reachable from entry through normal or exception
   *         edges, in depth-first preorder
   */
  public List<Block> reachableBlocks() {
    List<Block> result = new ArrayList<Block>();
    Set<Block> visited = Sets.newIdentityHashSet();
    Deque<Block> stack = new ArrayDeque<Block>();
    stack.push(entry);
    while (!stack.isEmpty()) {
      Block b = stack.pop();
      if (!visited.add(b)) {
        continue;
      }
      result.add(b);
      List<Block> succs = new ArrayList<Block>(b.successors());
      succs.addAll(b.exceptionSuccessors());
      // Push in reverse so first successor is visited first
      for (int i = succs.size() - 1; i >= 0; i--) {
        if (!visited.contains(succs.get(i))) {
          stack.push(succs.get(i));
        }
      }
    }
    return result;
  }

  /**
   * Predecessors of each reachable block, one entry per edge from a
   * reachable block, including exception edges
   * @return
   */
  public Map<Block, List<Block>> predecessors() {
    List<Block> reachable = reachableBlocks();
    Map<Block, List<Block>> preds = new IdentityHashMap<Block, List<Block>>();
    for (Block b: reachable) {
      preds.put(b, new ArrayList<Block>());
    }
    for (Block b: reachable) {
      for (Block succ: b.successors()) {
        preds.get(succ).add(b);
      }
      for (Block succ: b.exceptionSuccessors()) {
        preds.get(succ).add(b);
      }
    }
    return preds;
  }

  public String prettyPrint() {
    StringBuilder sb = new StringBuilder();
    sb.append("function ").append(name()).append(" entry ").append(entry)
      .append(" exit ").append(exit).append("\n");
    for (Block b: reachableBlocks()) {
      b.prettyPrint(sb);
    }
    return sb.toString();
  }
}
