// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.TypedVariable;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableType;
import com.android.tools.absint.ir.code.Cast;
import com.android.tools.absint.ir.code.CastType;
import com.android.tools.absint.ir.code.Invoke;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.memory.RefModNewCells;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/** Translates calls, dispatching on the identity of the callee. */
public class InvokeTranslator {

  private static final String MEMSET_PREFIX = "llvm.memset";
  private static final String MEMCPY_PREFIX = "llvm.memcpy";

  private final Procedure procedure;
  private final SymbolMapper mapper;
  private final ConditionTranslator conditionTranslator;
  private final MemoryAnalysis memoryAnalysis;
  private final CfgBuilderOptions options;

  public InvokeTranslator(
      Procedure procedure,
      SymbolMapper mapper,
      ConditionTranslator conditionTranslator,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options) {
    this.procedure = procedure;
    this.mapper = mapper;
    this.conditionTranslator = conditionTranslator;
    this.memoryAnalysis = memoryAnalysis;
    this.options = options;
  }

  public void translate(Invoke invoke, CfgBlock block) {
    if (!invoke.hasCallee()) {
      // Unresolved indirect call.
      havocResult(invoke, block);
      return;
    }
    Procedure callee = invoke.getCallee();
    if (options.isIgnoredCallee(callee)) {
      return;
    }
    if (callee.isDeclaration()
        && options.isHeapAllocator(callee)
        && options.isEntryPoint(procedure)) {
      translateHeapAllocation(invoke, block);
      return;
    }
    if (callee.isIntrinsic()) {
      translateIntrinsic(invoke, callee, block);
      return;
    }
    if (options.isAssume(callee) || options.isAssumeNot(callee)) {
      Value condition = stripZeroExtension(invoke.getArgument(0));
      conditionTranslator.translateCondition(condition, options.isAssumeNot(callee), block);
      return;
    }
    if (!options.isInterproceduralEnabled() || callee.isVarArg()) {
      havocResult(invoke, block);
      if (memoryAnalysis.getTrackLevel().tracksMemory()) {
        for (int cell : memoryAnalysis.getRefModNewCells(invoke).getMods()) {
          block.havoc(mapper.symVar(cell));
        }
      }
      return;
    }
    translateCallSite(invoke, callee, block);
  }

  private void translateCallSite(Invoke invoke, Procedure callee, CfgBlock block) {
    List<TypedVariable> actuals = new ArrayList<>();
    for (Value argument : invoke.arguments()) {
      if (mapper.isTracked(argument) && isTranslatedType(argument)) {
        actuals.add(normalizeParameter(argument, block));
      }
    }
    if (memoryAnalysis.getTrackLevel().tracksMemory()) {
      RefModNewCells cells = memoryAnalysis.getRefModNewCells(invoke);
      CellParameterList cellParameters = CellParameterList.create(cells);
      List<Variable> inputVersions = new ArrayList<>();
      for (int cell : cellParameters.getPassedCells()) {
        Variable inputVersion = mapper.fresh();
        Variable cellVariable = mapper.symVar(cell);
        block.assign(inputVersion, LinearExpression.of(cellVariable));
        // The callee may rewrite the cell.
        block.havoc(cellVariable);
        inputVersions.add(inputVersion);
      }
      cellParameters.appendTo(actuals, inputVersions, mapper);
    }
    TypedVariable lhs = null;
    if (invoke.hasOutValue()) {
      Value result = invoke.outValue();
      VariableType type = VariableType.fromType(result.getType());
      if (type != VariableType.UNK && mapper.isTracked(result) && isTranslatedType(result)) {
        lhs = new TypedVariable(mapper.symVar(result), type);
      }
    }
    block.callSite(lhs, callee.getName(), actuals);
  }

  /**
   * Returns the variable that carries the value into a call or a return. Constants are first
   * assigned to a fresh variable.
   */
  public TypedVariable normalizeParameter(Value value, CfgBlock block) {
    if (!value.isConstant()) {
      return new TypedVariable(mapper.symVar(value), VariableType.fromType(value.getType()));
    }
    Variable temporary = mapper.fresh();
    if (value.isConstantInt()) {
      block.assign(temporary, mapper.lookup(value));
      return new TypedVariable(temporary, VariableType.INT);
    }
    block.havoc(temporary);
    return new TypedVariable(temporary, VariableType.UNK);
  }

  private void translateHeapAllocation(Invoke invoke, CfgBlock block) {
    if (!invoke.hasOutValue() || !memoryAnalysis.getTrackLevel().tracksMemory()) {
      return;
    }
    int arrayId = memoryAnalysis.getArrayId(procedure, invoke.outValue());
    if (arrayId < 0) {
      return;
    }
    // Fresh memory is assumed to be zero.
    block.assumeArray(mapper.symVar(arrayId), BigInteger.ZERO);
  }

  private void translateIntrinsic(Invoke invoke, Procedure callee, CfgBlock block) {
    if (memoryAnalysis.getTrackLevel().tracksMemory()) {
      if (callee.getName().startsWith(MEMSET_PREFIX)) {
        translateMemset(invoke, block);
        return;
      }
      if (callee.getName().startsWith(MEMCPY_PREFIX)) {
        translateMemcpy(invoke, block);
        return;
      }
    }
    // Other intrinsics, including memmove, are not modeled.
    havocResult(invoke, block);
  }

  private void translateMemset(Invoke invoke, CfgBlock block) {
    int arrayId = memoryAnalysis.getArrayId(procedure, invoke.getArgument(0));
    if (arrayId < 0) {
      return;
    }
    LinearExpression fill = mapper.lookup(invoke.getArgument(1));
    if (fill == null || !fill.isConstant()) {
      return;
    }
    Variable cell = mapper.symVar(arrayId);
    block.havoc(cell);
    block.assumeArray(cell, fill.getConstant());
  }

  private void translateMemcpy(Invoke invoke, CfgBlock block) {
    int destination = memoryAnalysis.getArrayId(procedure, invoke.getArgument(0));
    int source = memoryAnalysis.getArrayId(procedure, invoke.getArgument(1));
    if (destination < 0 || source < 0) {
      return;
    }
    Variable destinationCell = mapper.symVar(destination);
    block.havoc(destinationCell);
    block.assign(destinationCell, LinearExpression.of(mapper.symVar(source)));
  }

  private void havocResult(Invoke invoke, CfgBlock block) {
    if (invoke.hasOutValue()
        && mapper.isTracked(invoke.outValue())
        && options.isIncludeHavocEnabled()) {
      block.havoc(mapper.symVar(invoke.outValue()));
    }
  }

  private boolean isTranslatedType(Value value) {
    return !options.isPointerArithmeticDisabled() || value.getType().isInt();
  }

  private static Value stripZeroExtension(Value value) {
    if (value.isDefinedByInstruction() && value.getDefinition().isCast()) {
      Cast cast = value.getDefinition().asCast();
      if (cast.getType() == CastType.ZEXT) {
        return cast.source();
      }
    }
    return value;
  }
}
