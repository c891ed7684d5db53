// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

public abstract class Instruction {

  protected final Value outValue;
  protected final List<Value> inValues;
  private BasicBlock block = null;

  protected Instruction(Value outValue, List<Value> inValues) {
    this.outValue = outValue;
    this.inValues = ImmutableList.copyOf(inValues);
    if (outValue != null) {
      assert outValue.definition == null;
      outValue.definition = this;
    }
    for (Value value : this.inValues) {
      value.addUser(this);
    }
  }

  public abstract Opcode opcode();

  public abstract String getMnemonic();

  public Value outValue() {
    return outValue;
  }

  public boolean hasOutValue() {
    return outValue != null;
  }

  public Value getOperand(int index) {
    return inValues.get(index);
  }

  public BasicBlock getBlock() {
    return block;
  }

  void setBlock(BasicBlock block) {
    assert this.block == null;
    this.block = block;
  }

  /** The procedure that contains this instruction. */
  public Procedure getProcedure() {
    return block.getCode().procedure();
  }

  public boolean isJumpInstruction() {
    return false;
  }

  public JumpInstruction asJumpInstruction() {
    return null;
  }

  public boolean isBinop() {
    return false;
  }

  public Binop asBinop() {
    return null;
  }

  public boolean isCmp() {
    return false;
  }

  public Cmp asCmp() {
    return null;
  }

  public boolean isCast() {
    return false;
  }

  public Cast asCast() {
    return null;
  }

  public boolean isGetElementPtr() {
    return false;
  }

  public GetElementPtr asGetElementPtr() {
    return null;
  }

  public boolean isLoad() {
    return false;
  }

  public Load asLoad() {
    return null;
  }

  public boolean isStore() {
    return false;
  }

  public Store asStore() {
    return null;
  }

  public boolean isAlloca() {
    return false;
  }

  public Alloca asAlloca() {
    return null;
  }

  public boolean isSelect() {
    return false;
  }

  public Select asSelect() {
    return null;
  }

  public boolean isInvoke() {
    return false;
  }

  public Invoke asInvoke() {
    return null;
  }

  public boolean isReturn() {
    return false;
  }

  public Return asReturn() {
    return null;
  }

  public boolean isIf() {
    return false;
  }

  public If asIf() {
    return null;
  }

  public boolean isGoto() {
    return false;
  }

  public Goto asGoto() {
    return null;
  }

  public boolean isSwitch() {
    return false;
  }

  public Switch asSwitch() {
    return null;
  }

  public boolean isUnreachableInstruction() {
    return false;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    if (outValue != null) {
      builder.append(outValue).append(" = ");
    }
    builder.append(getMnemonic());
    if (!inValues.isEmpty()) {
      builder.append(' ');
      builder.append(inValues.stream().map(Value::toString).collect(Collectors.joining(", ")));
    }
    return builder.toString();
  }
}
