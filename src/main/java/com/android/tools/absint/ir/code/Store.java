// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

public class Store extends Instruction {

  public Store(Value value, Value pointer) {
    super(null, ImmutableList.of(value, pointer));
  }

  public Value value() {
    return inValues.get(0);
  }

  public Value pointer() {
    return inValues.get(1);
  }

  @Override
  public Opcode opcode() {
    return Opcode.STORE;
  }

  @Override
  public String getMnemonic() {
    return "store";
  }

  @Override
  public boolean isStore() {
    return true;
  }

  @Override
  public Store asStore() {
    return this;
  }
}
