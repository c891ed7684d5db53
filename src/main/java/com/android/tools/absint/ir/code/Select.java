// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

public class Select extends Instruction {

  public Select(Value outValue, Value condition, Value trueValue, Value falseValue) {
    super(outValue, ImmutableList.of(condition, trueValue, falseValue));
  }

  public Value condition() {
    return inValues.get(0);
  }

  public Value trueValue() {
    return inValues.get(1);
  }

  public Value falseValue() {
    return inValues.get(2);
  }

  @Override
  public Opcode opcode() {
    return Opcode.SELECT;
  }

  @Override
  public String getMnemonic() {
    return "select";
  }

  @Override
  public boolean isSelect() {
    return true;
  }

  @Override
  public Select asSelect() {
    return this;
  }
}
