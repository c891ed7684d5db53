// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Conditional branch on a 1-bit value. */
public class If extends JumpInstruction {

  private final BasicBlock trueTarget;
  private final BasicBlock falseTarget;

  public If(Value condition, BasicBlock trueTarget, BasicBlock falseTarget) {
    super(ImmutableList.of(condition));
    this.trueTarget = trueTarget;
    this.falseTarget = falseTarget;
  }

  public Value condition() {
    return inValues.get(0);
  }

  public BasicBlock getTrueTarget() {
    return trueTarget;
  }

  public BasicBlock getFalseTarget() {
    return falseTarget;
  }

  /** Successor 0 is the true target, successor 1 the false target. */
  @Override
  public List<BasicBlock> getSuccessors() {
    return ImmutableList.of(trueTarget, falseTarget);
  }

  @Override
  public Opcode opcode() {
    return Opcode.IF;
  }

  @Override
  public String getMnemonic() {
    return "br";
  }

  @Override
  public boolean isIf() {
    return true;
  }

  @Override
  public If asIf() {
    return this;
  }

  @Override
  public String toString() {
    return "br " + condition() + ", " + trueTarget.getLabel() + ", " + falseTarget.getLabel();
  }
}
