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
package exm.sfc.ic.opt;

import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.sfc.ic.tree.Block;
import exm.sfc.ic.tree.ControlFlowGraph;
import exm.sfc.ic.tree.Liftability;
import exm.sfc.ic.tree.Terminator.TerminatorType;

/**
 * Tag every reachable block as a boundary, which must start a new step in
 * the plan, or fusible, which may run in the same function unit as its
 * predecessor.  Tags depend only on the shape of the graph.
 */
public class LiftabilityAnalyzer {

  public String getPassName() {
    return "Liftability analysis";
  }

  public void analyze(Logger logger, ControlFlowGraph cfg) {
    Map<Block, List<Block>> preds = cfg.predecessors();
    int boundaries = 0;
    for (Block b: cfg.reachableBlocks()) {
      Liftability tag = classify(cfg, b, preds.get(b));
      b.setLiftability(tag);
      if (tag == Liftability.BOUNDARY) {
        boundaries++;
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace(getPassName() + " of " + cfg.name() + ": " +
                   boundaries + " boundary blocks");
    }
  }

  private static Liftability classify(ControlFlowGraph cfg, Block b,
                                      List<Block> preds) {
    if (b == cfg.entry() || b.isLoopHeader() || preds.size() > 1) {
      return Liftability.BOUNDARY;
    }
    assert(preds.size() == 1) : b;
    if (preds.get(0).getTerminator().type() == TerminatorType.CALL) {
      return Liftability.BOUNDARY;
    }
    return Liftability.FUSIBLE;
  }
}
