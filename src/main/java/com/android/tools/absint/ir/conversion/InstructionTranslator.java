// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static com.android.tools.absint.cfg.linear.LinearConstraint.greaterThanOrEqualTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.lessThanOrEqualTo;

import com.android.tools.absint.cfg.CfgBinop.Operation;
import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.linear.LinearConstraintSystem;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.errors.Unreachable;
import com.android.tools.absint.ir.code.Alloca;
import com.android.tools.absint.ir.code.BasicBlock;
import com.android.tools.absint.ir.code.Binop;
import com.android.tools.absint.ir.code.BinopType;
import com.android.tools.absint.ir.code.Cast;
import com.android.tools.absint.ir.code.GetElementPtr;
import com.android.tools.absint.ir.code.Instruction;
import com.android.tools.absint.ir.code.Load;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Return;
import com.android.tools.absint.ir.code.Select;
import com.android.tools.absint.ir.code.Store;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.DataLayout;
import com.android.tools.absint.ir.type.StructTypeElement;
import com.android.tools.absint.ir.type.TypeElement;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.utils.Reporter;
import com.android.tools.absint.utils.StringDiagnostic;
import java.math.BigInteger;

/**
 * Translates the non-branching instructions of a block to statements of the analysis CFG.
 *
 * <p>Values that cannot be expressed are havoced, or left unconstrained if havocs are disabled.
 * Comparisons produce no statements here; they are translated where a branch, a select or an
 * assume consumes them.
 */
public class InstructionTranslator {

  private final Procedure procedure;
  private final DataLayout dataLayout;
  private final SymbolMapper mapper;
  private final ConditionTranslator conditionTranslator;
  private final InvokeTranslator invokeTranslator;
  private final MemoryAnalysis memoryAnalysis;
  private final CfgBuilderOptions options;
  private final Reporter reporter;

  public InstructionTranslator(
      Procedure procedure,
      SymbolMapper mapper,
      ConditionTranslator conditionTranslator,
      InvokeTranslator invokeTranslator,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options,
      Reporter reporter) {
    this.procedure = procedure;
    this.dataLayout = procedure.getProgram().getDataLayout();
    this.mapper = mapper;
    this.conditionTranslator = conditionTranslator;
    this.invokeTranslator = invokeTranslator;
    this.memoryAnalysis = memoryAnalysis;
    this.options = options;
    this.reporter = reporter;
  }

  public void translate(BasicBlock block, CfgBlock target) {
    for (Instruction instruction : block.getInstructions()) {
      translate(instruction, target);
    }
  }

  public void translate(Instruction instruction, CfgBlock block) {
    switch (instruction.opcode()) {
      case BINOP:
        translateBinop(instruction.asBinop(), block);
        break;
      case CAST:
        translateCast(instruction.asCast(), block);
        break;
      case GET_ELEMENT_PTR:
        translateGetElementPtr(instruction.asGetElementPtr(), block);
        break;
      case LOAD:
        translateLoad(instruction.asLoad(), block);
        break;
      case STORE:
        translateStore(instruction.asStore(), block);
        break;
      case ALLOCA:
        translateAlloca(instruction.asAlloca(), block);
        break;
      case SELECT:
        translateSelect(instruction.asSelect(), block);
        break;
      case INVOKE:
        invokeTranslator.translate(instruction.asInvoke(), block);
        break;
      case RETURN:
        translateReturn(instruction.asReturn(), block);
        break;
      case UNREACHABLE:
        block.unreachable();
        break;
      case OPAQUE:
        havocOutValue(instruction, block);
        break;
      case CMP:
        // Translated where the boolean is consumed.
      case IF:
      case GOTO:
      case SWITCH:
        // Edges are translated by the CfgBuilder.
        break;
      default:
        throw new Unreachable("Unexpected opcode " + instruction.opcode());
    }
  }

  private void translateBinop(Binop binop, CfgBlock block) {
    Value outValue = binop.outValue();
    if (!mapper.isTracked(outValue)) {
      return;
    }
    Variable lhs = mapper.symVar(outValue);
    BinopType type = binop.getType();
    if (type == BinopType.LSHR) {
      havoc(lhs, block);
      return;
    }
    LinearExpression left = mapper.lookup(binop.leftValue());
    LinearExpression right = mapper.lookup(binop.rightValue());
    if (left == null || right == null) {
      havoc(lhs, block);
      return;
    }
    switch (type) {
      case ADD:
        block.binop(Operation.ADD, lhs, left, right);
        break;
      case MUL:
        block.binop(Operation.MUL, lhs, left, right);
        break;
      case SUB:
        translateNonCommutative(Operation.SUB, lhs, left, right, block);
        break;
      case SDIV:
        translateNonCommutative(Operation.SDIV, lhs, left, right, block);
        break;
      case SREM:
        translateNonCommutative(Operation.SREM, lhs, left, right, block);
        break;
      case UDIV:
        translateUnsigned(Operation.UDIV, binop, lhs, left, right, block);
        break;
      case UREM:
        translateUnsigned(Operation.UREM, binop, lhs, left, right, block);
        break;
      case SHL:
        translateShift(Operation.MUL, binop, lhs, left, right, block);
        break;
      case ASHR:
        translateShift(Operation.SDIV, binop, lhs, left, right, block);
        break;
      case AND:
        block.binop(Operation.AND, lhs, left, right);
        break;
      case OR:
        block.binop(Operation.OR, lhs, left, right);
        break;
      case XOR:
        block.binop(Operation.XOR, lhs, left, right);
        break;
      default:
        throw new Unreachable("Unexpected binop " + type);
    }
  }

  // The first operand of a non-commutative operation must be a variable.
  private void translateNonCommutative(
      Operation operation,
      Variable lhs,
      LinearExpression left,
      LinearExpression right,
      CfgBlock block) {
    if (left.isConstant()) {
      block.assign(lhs, left);
      block.binop(operation, lhs, LinearExpression.of(lhs), right);
    } else {
      block.binop(operation, lhs, left, right);
    }
  }

  private void translateUnsigned(
      Operation operation,
      Binop binop,
      Variable lhs,
      LinearExpression left,
      LinearExpression right,
      CfgBlock block) {
    if (left.isConstant() && right.isConstant()) {
      reporter.warning(
          new StringDiagnostic(
              "Ignored " + binop.getMnemonic() + " with constant operands: " + binop,
              procedure.getName()));
      havoc(lhs, block);
      return;
    }
    translateNonCommutative(operation, lhs, left, right, block);
  }

  private void translateShift(
      Operation operation,
      Binop binop,
      Variable lhs,
      LinearExpression left,
      LinearExpression right,
      CfgBlock block) {
    if (!right.isConstant()) {
      havoc(lhs, block);
      return;
    }
    BigInteger shift = right.getConstant();
    int bits = binop.outValue().getType().asInt().getBits();
    if (shift.signum() < 0 || shift.compareTo(BigInteger.valueOf(bits)) >= 0) {
      reporter.warning(
          new StringDiagnostic(
              "Ignored " + binop.getMnemonic() + " by out of range amount: " + binop,
              procedure.getName()));
      havoc(lhs, block);
      return;
    }
    LinearExpression factor = LinearExpression.constant(BigInteger.ONE.shiftLeft(shift.intValue()));
    translateNonCommutative(operation, lhs, left, factor, block);
  }

  private void translateCast(Cast cast, CfgBlock block) {
    Value outValue = cast.outValue();
    if (cast.getType().isIntegerExtension() && allUsersAreAddressComputations(outValue)) {
      return;
    }
    if (!mapper.isTracked(outValue)
        || !isTranslatedType(outValue)
        || allUsersAreUntrackedMemoryAccesses(outValue)) {
      return;
    }
    Variable lhs = mapper.symVar(outValue);
    Value source = cast.source();
    LinearExpression expression = mapper.lookup(source);
    if (expression != null) {
      block.assign(lhs, expression);
      return;
    }
    if (source.getType().isInt(1)) {
      block.assume(greaterThanOrEqualTo(LinearExpression.of(lhs), LinearExpression.zero()));
      block.assume(lessThanOrEqualTo(LinearExpression.of(lhs), LinearExpression.constant(1)));
      return;
    }
    havoc(lhs, block);
  }

  private void translateGetElementPtr(GetElementPtr getElementPtr, CfgBlock block) {
    Value outValue = getElementPtr.outValue();
    if (!mapper.isTracked(outValue)) {
      return;
    }
    Variable lhs = mapper.symVar(outValue);
    if (options.isPointerArithmeticDisabled() || allUsersAreUntrackedMemoryAccesses(outValue)) {
      havoc(lhs, block);
      return;
    }
    LinearExpression base = mapper.lookup(getElementPtr.base());
    if (base == null) {
      havoc(lhs, block);
      return;
    }
    BigInteger constantOffset = computeConstantOffset(getElementPtr);
    if (constantOffset != null) {
      block.binop(Operation.ADD, lhs, base, LinearExpression.constant(constantOffset));
      return;
    }
    if (hasUnknownArrayIndex(getElementPtr)) {
      havoc(lhs, block);
      return;
    }
    block.assign(lhs, base);
    TypeElement type = getElementPtr.base().getType();
    for (Value index : getElementPtr.indices()) {
      Value strippedIndex = stripIntegerExtension(index);
      if (type.isStruct()) {
        StructTypeElement structType = type.asStruct();
        int field = getStructIndex(strippedIndex);
        long offset = dataLayout.getFieldOffset(structType, field);
        block.binop(
            Operation.ADD, lhs, LinearExpression.of(lhs), LinearExpression.constant(offset));
        type = structType.getField(field);
      } else if (type.isSequential()) {
        type = type.getSequentialElementType();
        LinearExpression indexExpression = mapper.lookup(strippedIndex);
        Variable offset = mapper.fresh();
        block.binop(
            Operation.MUL,
            offset,
            indexExpression,
            LinearExpression.constant(dataLayout.getTypeStoreSize(type)));
        block.binop(Operation.ADD, lhs, LinearExpression.of(lhs), LinearExpression.of(offset));
      } else {
        throw new CompilationError("Cannot index into " + type + " in " + getElementPtr);
      }
    }
  }

  private boolean hasUnknownArrayIndex(GetElementPtr getElementPtr) {
    TypeElement type = getElementPtr.base().getType();
    for (Value index : getElementPtr.indices()) {
      if (type.isStruct()) {
        type = type.asStruct().getField(getStructIndex(stripIntegerExtension(index)));
      } else if (type.isSequential()) {
        type = type.getSequentialElementType();
        if (mapper.lookup(stripIntegerExtension(index)) == null) {
          return true;
        }
      } else {
        throw new CompilationError("Cannot index into " + type + " in " + getElementPtr);
      }
    }
    return false;
  }

  /** Returns the offset in bytes if all indices are constants, otherwise null. */
  private BigInteger computeConstantOffset(GetElementPtr getElementPtr) {
    BigInteger offset = BigInteger.ZERO;
    TypeElement type = getElementPtr.base().getType();
    for (Value index : getElementPtr.indices()) {
      if (!index.isConstantInt()) {
        return null;
      }
      if (type.isStruct()) {
        int field = getStructIndex(index);
        offset = offset.add(BigInteger.valueOf(dataLayout.getFieldOffset(type.asStruct(), field)));
        type = type.asStruct().getField(field);
      } else if (type.isSequential()) {
        type = type.getSequentialElementType();
        BigInteger elementSize = BigInteger.valueOf(dataLayout.getTypeAllocSize(type));
        offset = offset.add(index.asConstantInt().getValue().multiply(elementSize));
      } else {
        throw new CompilationError("Cannot index into " + type + " in " + getElementPtr);
      }
    }
    return offset;
  }

  private static int getStructIndex(Value index) {
    if (!index.isConstantInt()) {
      throw new CompilationError("Struct index must be a constant: " + index);
    }
    return index.asConstantInt().getValue().intValueExact();
  }

  private void translateLoad(Load load, CfgBlock block) {
    Value outValue = load.outValue();
    if (outValue.getType().isInt() && memoryAnalysis.getTrackLevel().tracksMemory()) {
      int arrayId = memoryAnalysis.getArrayId(procedure, load.pointer());
      LinearExpression index = arrayId >= 0 ? mapper.lookup(load.pointer()) : null;
      if (index != null) {
        Variable lhs = mapper.symVar(outValue);
        Value singleton = memoryAnalysis.getSingleton(arrayId);
        if (singleton != null) {
          block.assign(lhs, LinearExpression.of(mapper.symVar(singleton)));
        } else {
          block.arrayLoad(
              lhs,
              mapper.symVar(arrayId),
              index,
              dataLayout.getTypeAllocSize(outValue.getType()));
        }
        return;
      }
    }
    havocOutValue(load, block);
  }

  private void translateStore(Store store, CfgBlock block) {
    Value value = store.value();
    if (!value.getType().isInt() || !memoryAnalysis.getTrackLevel().tracksMemory()) {
      return;
    }
    int arrayId = memoryAnalysis.getArrayId(procedure, store.pointer());
    if (arrayId < 0) {
      return;
    }
    LinearExpression index = mapper.lookup(store.pointer());
    LinearExpression expression = mapper.lookup(value);
    // TODO: havoc the cell when the index or the stored value is unknown.
    if (index == null || expression == null) {
      return;
    }
    Value singleton = memoryAnalysis.getSingleton(arrayId);
    if (singleton != null) {
      block.assign(mapper.symVar(singleton), expression);
    } else {
      block.arrayStore(
          mapper.symVar(arrayId), index, expression, dataLayout.getTypeAllocSize(value.getType()));
    }
  }

  private void translateAlloca(Alloca alloca, CfgBlock block) {
    if (!memoryAnalysis.getTrackLevel().tracksMemory()) {
      return;
    }
    int arrayId = memoryAnalysis.getArrayId(procedure, alloca.outValue());
    if (arrayId < 0) {
      return;
    }
    // Stack memory is assumed to be zero initialized.
    block.assumeArray(mapper.symVar(arrayId), BigInteger.ZERO);
  }

  private void translateSelect(Select select, CfgBlock block) {
    Value outValue = select.outValue();
    if (!mapper.isTracked(outValue)) {
      return;
    }
    if (!isTranslatedType(select.trueValue()) || !isTranslatedType(select.falseValue())) {
      return;
    }
    Variable lhs = mapper.symVar(outValue);
    LinearExpression trueValue = mapper.lookup(select.trueValue());
    LinearExpression falseValue = mapper.lookup(select.falseValue());
    if (trueValue == null || falseValue == null) {
      havoc(lhs, block);
      return;
    }
    Value condition = select.condition();
    if (condition.isConstantInt()) {
      block.assign(lhs, condition.asConstantInt().isZero() ? falseValue : trueValue);
      return;
    }
    if (condition.isDefinedByInstruction() && condition.getDefinition().isCmp()) {
      // Only a single constraint can guard the select.
      LinearConstraintSystem constraints =
          conditionTranslator.translateComparison(condition.getDefinition().asCmp(), false);
      if (constraints.size() == 1) {
        block.select(lhs, constraints.get(0), trueValue, falseValue);
        return;
      }
    }
    LinearExpression conditionExpression = mapper.lookup(condition);
    if (conditionExpression == null) {
      havoc(lhs, block);
      return;
    }
    block.select(
        lhs,
        greaterThanOrEqualTo(conditionExpression, LinearExpression.constant(1)),
        trueValue,
        falseValue);
  }

  private void translateReturn(Return ret, CfgBlock block) {
    if (!options.isInterproceduralEnabled()
        || options.isEntryPoint(procedure)
        || ret.isReturnVoid()) {
      return;
    }
    Value value = ret.returnValue();
    if (!mapper.isTracked(value) || !isTranslatedType(value)) {
      return;
    }
    block.ret(invokeTranslator.normalizeParameter(value, block));
  }

  private void havocOutValue(Instruction instruction, CfgBlock block) {
    if (instruction.hasOutValue() && mapper.isTracked(instruction.outValue())) {
      havoc(mapper.symVar(instruction.outValue()), block);
    }
  }

  private void havoc(Variable variable, CfgBlock block) {
    if (options.isIncludeHavocEnabled()) {
      block.havoc(variable);
    }
  }

  private boolean isTranslatedType(Value value) {
    return !options.isPointerArithmeticDisabled() || value.getType().isInt();
  }

  private static boolean allUsersAreAddressComputations(Value value) {
    for (Instruction user : value.users()) {
      if (!user.isGetElementPtr()) {
        return false;
      }
    }
    return value.phiUsers().isEmpty();
  }

  // True if the value only reaches memory accesses that are not translated. Calls do not count.
  private static boolean allUsersAreUntrackedMemoryAccesses(Value value) {
    if (!value.phiUsers().isEmpty()) {
      return false;
    }
    for (Instruction user : value.users()) {
      if (user.isStore()) {
        if (user.asStore().value().getType().isInt()) {
          return false;
        }
      } else if (user.isLoad()) {
        if (user.outValue().getType().isInt()) {
          return false;
        }
      } else if (!user.isInvoke()) {
        return false;
      }
    }
    return true;
  }

  private static Value stripIntegerExtension(Value value) {
    if (value.isDefinedByInstruction()
        && value.getDefinition().isCast()
        && value.getDefinition().asCast().getType().isIntegerExtension()) {
      return value.getDefinition().asCast().source();
    }
    return value;
  }
}
