// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

public class Load extends Instruction {

  public Load(Value outValue, Value pointer) {
    super(outValue, ImmutableList.of(pointer));
  }

  public Value pointer() {
    return inValues.get(0);
  }

  @Override
  public Opcode opcode() {
    return Opcode.LOAD;
  }

  @Override
  public String getMnemonic() {
    return "load";
  }

  @Override
  public boolean isLoad() {
    return true;
  }

  @Override
  public Load asLoad() {
    return this;
  }
}
