// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.ir.code.BasicBlock;
import com.android.tools.absint.ir.code.Phi;
import com.android.tools.absint.ir.code.Value;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Lowers the phis of a block to assignments on one incoming edge.
 *
 * <p>All phis of a block read the state before any of them is assigned. If a phi flows into
 * another phi of the same block, its old value is first saved in a temporary.
 */
public class PhiResolver {

  private final SymbolMapper mapper;
  private final CfgBuilderOptions options;

  public PhiResolver(SymbolMapper mapper, CfgBuilderOptions options) {
    this.mapper = mapper;
    this.options = options;
  }

  /** Emits into {@code target} the assignments for the edge from predecessor to block. */
  public void resolve(BasicBlock block, BasicBlock predecessor, CfgBlock target) {
    if (block.getPhis().isEmpty()) {
      return;
    }
    Map<Phi, LinearExpression> oldValues = new IdentityHashMap<>();
    for (Phi phi : block.getPhis()) {
      if (!isTranslated(phi)) {
        continue;
      }
      Value incoming = getIncomingValue(phi, predecessor);
      if (incoming.isPhi()
          && incoming.asPhi().getBlock() == block
          && !oldValues.containsKey(incoming.asPhi())) {
        LinearExpression expression = mapper.lookup(incoming);
        if (expression != null) {
          Variable oldValue = mapper.fresh();
          target.assign(oldValue, expression);
          oldValues.put(incoming.asPhi(), LinearExpression.of(oldValue));
        }
      }
    }
    for (Phi phi : block.getPhis()) {
      if (!isTranslated(phi)) {
        continue;
      }
      Variable lhs = mapper.symVar(phi);
      Value incoming = getIncomingValue(phi, predecessor);
      LinearExpression expression =
          incoming.isPhi() ? oldValues.get(incoming.asPhi()) : null;
      if (expression == null) {
        expression = mapper.lookup(incoming);
      }
      if (expression != null) {
        target.assign(lhs, expression);
      } else {
        target.havoc(lhs);
      }
    }
  }

  private boolean isTranslated(Phi phi) {
    return mapper.isTracked(phi)
        && (!options.isPointerArithmeticDisabled() || phi.getType().isInt());
  }

  private static Value getIncomingValue(Phi phi, BasicBlock predecessor) {
    Value incoming = phi.getOperand(predecessor);
    if (incoming == null) {
      throw new CompilationError(
          "Phi " + phi + " in " + phi.getBlock() + " has no value for " + predecessor);
    }
    return incoming;
  }
}
