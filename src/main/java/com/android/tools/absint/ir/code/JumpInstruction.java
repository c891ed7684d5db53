// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import java.util.List;

/** Block terminator. */
public abstract class JumpInstruction extends Instruction {

  protected JumpInstruction(List<Value> inValues) {
    super(null, inValues);
  }

  /** The successors in operand order. A block may occur more than once. */
  public abstract List<BasicBlock> getSuccessors();

  @Override
  public boolean isJumpInstruction() {
    return true;
  }

  @Override
  public JumpInstruction asJumpInstruction() {
    return this;
  }
}
