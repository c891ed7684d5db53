// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class Return extends JumpInstruction {

  public Return() {
    super(ImmutableList.of());
  }

  public Return(Value value) {
    super(ImmutableList.of(value));
  }

  public boolean isReturnVoid() {
    return inValues.isEmpty();
  }

  public Value returnValue() {
    assert !isReturnVoid();
    return inValues.get(0);
  }

  @Override
  public List<BasicBlock> getSuccessors() {
    return ImmutableList.of();
  }

  @Override
  public Opcode opcode() {
    return Opcode.RETURN;
  }

  @Override
  public String getMnemonic() {
    return "ret";
  }

  @Override
  public boolean isReturn() {
    return true;
  }

  @Override
  public Return asReturn() {
    return this;
  }
}
