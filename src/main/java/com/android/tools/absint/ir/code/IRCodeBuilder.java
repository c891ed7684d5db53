// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.ir.type.IntTypeElement;
import com.android.tools.absint.ir.type.PointerTypeElement;
import com.android.tools.absint.ir.type.TypeElement;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Builds the code of a procedure block by block.
 *
 * <p>Instructions are appended to the current block, see {@link #setCurrentBlock}. The first block
 * created is the entry block.
 */
public class IRCodeBuilder {

  private final Procedure procedure;
  private final IRCode code;
  private BasicBlock currentBlock = null;

  private IRCodeBuilder(Procedure procedure) {
    this.procedure = procedure;
    this.code = new IRCode(procedure);
  }

  public static IRCodeBuilder create(Procedure procedure) {
    if (!procedure.isDeclaration()) {
      throw new CompilationError("Procedure " + procedure.getName() + " already has code");
    }
    return new IRCodeBuilder(procedure);
  }

  public Procedure getProcedure() {
    return procedure;
  }

  /** Returns the block with the given label, creating it if needed. */
  public BasicBlock block(String label) {
    return code.getOrCreateBlock(label);
  }

  public IRCodeBuilder setCurrentBlock(BasicBlock block) {
    assert block.getCode() == code;
    currentBlock = block;
    return this;
  }

  /** Creates the block with the given label and makes it the current block. */
  public BasicBlock startBlock(String label) {
    BasicBlock block = block(label);
    setCurrentBlock(block);
    return block;
  }

  public Argument argument(int index) {
    return procedure.getArgument(index);
  }

  // Constants.

  public ConstantInt constInt(IntTypeElement type, long value) {
    return ConstantInt.of(type, value);
  }

  public ConstantInt i32(long value) {
    return ConstantInt.of(IntTypeElement.I32, value);
  }

  public ConstantInt i64(long value) {
    return ConstantInt.of(IntTypeElement.I64, value);
  }

  public ConstantInt bool(boolean value) {
    return ConstantInt.ofBoolean(value);
  }

  public ConstantNull nullPointer(PointerTypeElement type) {
    return new ConstantNull(type);
  }

  public Undef undef(TypeElement type) {
    return new Undef(type);
  }

  // Phis.

  public Phi phi(String name, TypeElement type) {
    Phi phi = new Phi(name, type, currentBlock());
    currentBlock.addPhi(phi);
    return phi;
  }

  // Instructions.

  public Value binop(BinopType type, String name, Value left, Value right) {
    Value outValue = new Value(name, left.getType());
    add(new Binop(type, outValue, left, right));
    return outValue;
  }

  public Value add(String name, Value left, Value right) {
    return binop(BinopType.ADD, name, left, right);
  }

  public Value sub(String name, Value left, Value right) {
    return binop(BinopType.SUB, name, left, right);
  }

  public Value mul(String name, Value left, Value right) {
    return binop(BinopType.MUL, name, left, right);
  }

  public Value and(String name, Value left, Value right) {
    return binop(BinopType.AND, name, left, right);
  }

  public Value or(String name, Value left, Value right) {
    return binop(BinopType.OR, name, left, right);
  }

  public Value cmp(CmpPredicate predicate, String name, Value left, Value right) {
    Value outValue = new Value(name, IntTypeElement.I1);
    add(new Cmp(predicate, outValue, left, right));
    return outValue;
  }

  public Value cast(CastType type, String name, Value source, TypeElement targetType) {
    Value outValue = new Value(name, targetType);
    add(new Cast(type, outValue, source));
    return outValue;
  }

  public Value zext(String name, Value source, IntTypeElement targetType) {
    return cast(CastType.ZEXT, name, source, targetType);
  }

  public Value sext(String name, Value source, IntTypeElement targetType) {
    return cast(CastType.SEXT, name, source, targetType);
  }

  /** Address computation whose result type is derived from the base pointer and the indices. */
  public Value gep(String name, Value base, Value... indices) {
    return gep(name, computeGetElementPtrType(base, indices), base, indices);
  }

  public Value gep(String name, PointerTypeElement resultType, Value base, Value... indices) {
    Value outValue = new Value(name, resultType);
    add(new GetElementPtr(outValue, base, ImmutableList.copyOf(indices)));
    return outValue;
  }

  public Value load(String name, Value pointer) {
    if (!pointer.getType().isPointer()) {
      throw new CompilationError("Load from non-pointer " + pointer);
    }
    Value outValue = new Value(name, pointer.getType().asPointer().getPointee());
    add(new Load(outValue, pointer));
    return outValue;
  }

  public void store(Value value, Value pointer) {
    add(new Store(value, pointer));
  }

  public Value alloca(String name, TypeElement allocatedType) {
    Value outValue = new Value(name, PointerTypeElement.to(allocatedType));
    add(new Alloca(outValue, allocatedType));
    return outValue;
  }

  public Value select(String name, Value condition, Value trueValue, Value falseValue) {
    Value outValue = new Value(name, trueValue.getType());
    add(new Select(outValue, condition, trueValue, falseValue));
    return outValue;
  }

  /** Direct call. Returns the result, or null if the callee returns void. */
  public Value call(String name, Procedure callee, Value... arguments) {
    Value outValue =
        callee.getReturnType().isVoid() ? null : new Value(name, callee.getReturnType());
    add(new Invoke(outValue, callee, ImmutableList.copyOf(arguments)));
    return outValue;
  }

  public Value callIndirect(
      String name, TypeElement returnType, Value calledValue, Value... arguments) {
    Value outValue = returnType.isVoid() ? null : new Value(name, returnType);
    add(new Invoke(outValue, calledValue, ImmutableList.copyOf(arguments)));
    return outValue;
  }

  public Value opaque(String mnemonic, String name, TypeElement type, Value... operands) {
    Value outValue = type == null || type.isVoid() ? null : new Value(name, type);
    add(new OpaqueInstruction(mnemonic, outValue, ImmutableList.copyOf(operands)));
    return outValue;
  }

  // Terminators.

  public void ret() {
    add(new Return());
  }

  public void ret(Value value) {
    add(new Return(value));
  }

  public void br(BasicBlock target) {
    add(new Goto(target));
  }

  public void br(Value condition, BasicBlock trueTarget, BasicBlock falseTarget) {
    add(new If(condition, trueTarget, falseTarget));
  }

  public void switchOn(Value value, BasicBlock defaultTarget, Map<Long, BasicBlock> cases) {
    List<BigInteger> keys = new ArrayList<>(cases.size());
    List<BasicBlock> targets = new ArrayList<>(cases.size());
    for (Entry<Long, BasicBlock> entry : cases.entrySet()) {
      keys.add(BigInteger.valueOf(entry.getKey()));
      targets.add(entry.getValue());
    }
    add(new Switch(value, defaultTarget, keys, targets));
  }

  public void unreachable() {
    add(new UnreachableInstruction());
  }

  /** Finishes the code and attaches it to the procedure. */
  public IRCode build() {
    for (BasicBlock block : code.blocks()) {
      if (!block.isFilled()) {
        throw new CompilationError(
            "Block " + block.getLabel() + " of " + procedure.getName() + " has no terminator");
      }
    }
    procedure.setCode(code);
    return code;
  }

  private BasicBlock currentBlock() {
    if (currentBlock == null) {
      throw new CompilationError("No current block");
    }
    return currentBlock;
  }

  private void add(Instruction instruction) {
    currentBlock().add(instruction);
  }

  private static PointerTypeElement computeGetElementPtrType(Value base, Value[] indices) {
    if (!base.getType().isPointer()) {
      throw new CompilationError("Address computation on non-pointer " + base);
    }
    TypeElement current = base.getType();
    for (Value index : indices) {
      if (current.isStruct()) {
        if (!index.isConstantInt()) {
          throw new CompilationError("Struct index must be a constant: " + index);
        }
        current = current.asStruct().getField(index.asConstantInt().getValue().intValueExact());
      } else if (current.isSequential()) {
        current = current.getSequentialElementType();
      } else {
        throw new CompilationError("Cannot index into " + current);
      }
    }
    return PointerTypeElement.to(current);
  }
}
