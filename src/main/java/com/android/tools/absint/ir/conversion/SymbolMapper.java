// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.errors.Unreachable;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.TypeElement;
import com.android.tools.absint.memory.MemoryAnalysis;

/**
 * Maps SSA values to variables and linear expressions of the analysis CFG.
 *
 * <p>A value is tracked if it is an integer, or a pointer and memory is translated through array
 * cells. Every tracked value is mapped to the same variable for the lifetime of the underlying
 * {@link VariableFactory}.
 */
public class SymbolMapper {

  private final VariableFactory variableFactory;
  private final MemoryAnalysis memoryAnalysis;
  private final CfgBuilderOptions options;

  public SymbolMapper(
      VariableFactory variableFactory, MemoryAnalysis memoryAnalysis, CfgBuilderOptions options) {
    this.variableFactory = variableFactory;
    this.memoryAnalysis = memoryAnalysis;
    this.options = options;
  }

  public boolean isTracked(Value value) {
    if (options.isIgnoredValue(value.getName())) {
      return false;
    }
    TypeElement type = value.getType();
    if (type.isPointer()) {
      return memoryAnalysis.getTrackLevel().tracksMemory();
    }
    return type.isInt();
  }

  public Variable symVar(Value value) {
    if (!isTracked(value)) {
      throw new Unreachable("Expected tracked value, got " + value);
    }
    return variableFactory.get(value);
  }

  /** The variable of an array cell. */
  public Variable symVar(int arrayId) {
    return variableFactory.getCell(arrayId);
  }

  public Variable fresh() {
    return variableFactory.fresh();
  }

  /**
   * Returns the linear expression of the value, or null if the value cannot be expressed. A null
   * result means unknown and must never be read as zero.
   */
  public LinearExpression lookup(Value value) {
    if (value.isConstantInt()) {
      return LinearExpression.constant(value.asConstantInt().getValue());
    }
    if (value.isConstantNull()) {
      return memoryAnalysis.getTrackLevel().tracksMemory() ? LinearExpression.zero() : null;
    }
    if (value.isUndef() || !isTracked(value)) {
      return null;
    }
    return LinearExpression.of(symVar(value));
  }
}
