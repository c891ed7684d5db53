// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

public class Cast extends Instruction {

  private final CastType type;

  public Cast(CastType type, Value outValue, Value source) {
    super(outValue, ImmutableList.of(source));
    this.type = type;
  }

  public CastType getType() {
    return type;
  }

  public Value source() {
    return inValues.get(0);
  }

  @Override
  public Opcode opcode() {
    return Opcode.CAST;
  }

  @Override
  public String getMnemonic() {
    return type.getMnemonic();
  }

  @Override
  public boolean isCast() {
    return true;
  }

  @Override
  public Cast asCast() {
    return this;
  }

  @Override
  public String toString() {
    return super.toString() + " to " + outValue.getType();
  }
}
