// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

/** Integer arithmetic, shift and bitwise operations. */
public class Binop extends Instruction {

  private final BinopType type;

  public Binop(BinopType type, Value outValue, Value left, Value right) {
    super(outValue, ImmutableList.of(left, right));
    this.type = type;
  }

  public BinopType getType() {
    return type;
  }

  public Value leftValue() {
    return inValues.get(0);
  }

  public Value rightValue() {
    return inValues.get(1);
  }

  @Override
  public Opcode opcode() {
    return Opcode.BINOP;
  }

  @Override
  public String getMnemonic() {
    return type.getMnemonic();
  }

  @Override
  public boolean isBinop() {
    return true;
  }

  @Override
  public Binop asBinop() {
    return this;
  }
}
