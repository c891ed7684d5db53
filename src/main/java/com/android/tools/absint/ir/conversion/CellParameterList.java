// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import com.android.tools.absint.cfg.linear.TypedVariable;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableType;
import com.android.tools.absint.memory.RefModNewCells;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;

/**
 * The array cells passed between a caller and a callee.
 *
 * <p>Cells are passed as {@code In's . Passed . New's}. The passed cells are the cells the callee
 * may read or modify, in oracle order with the read cells first. Each passed cell has a fresh
 * input version, the In's, and is itself the output version. Call sites and the declaration of
 * the callee both use this order, so actuals and formals line up.
 */
public class CellParameterList {

  private final IntList passedCells;
  private final IntList newCells;

  private CellParameterList(IntList passedCells, IntList newCells) {
    this.passedCells = passedCells;
    this.newCells = newCells;
  }

  public static CellParameterList create(RefModNewCells cells) {
    IntLinkedOpenHashSet passed = new IntLinkedOpenHashSet(cells.getRefs());
    passed.addAll(cells.getMods());
    return new CellParameterList(new IntArrayList(passed), cells.getNews());
  }

  public IntList getPassedCells() {
    return passedCells;
  }

  /**
   * Appends the cell parameters to the given list.
   *
   * @param inputVersions the input version of each passed cell, in the order of {@link
   *     #getPassedCells()}
   */
  public void appendTo(
      List<TypedVariable> parameters, List<Variable> inputVersions, SymbolMapper mapper) {
    assert inputVersions.size() == passedCells.size();
    for (Variable inputVersion : inputVersions) {
      parameters.add(new TypedVariable(inputVersion, VariableType.ARR));
    }
    for (int cell : passedCells) {
      parameters.add(new TypedVariable(mapper.symVar(cell), VariableType.ARR));
    }
    for (int cell : newCells) {
      parameters.add(new TypedVariable(mapper.symVar(cell), VariableType.ARR));
    }
  }
}
