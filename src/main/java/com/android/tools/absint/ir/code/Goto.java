// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class Goto extends JumpInstruction {

  private final BasicBlock target;

  public Goto(BasicBlock target) {
    super(ImmutableList.of());
    this.target = target;
  }

  public BasicBlock getTarget() {
    return target;
  }

  @Override
  public List<BasicBlock> getSuccessors() {
    return ImmutableList.of(target);
  }

  @Override
  public Opcode opcode() {
    return Opcode.GOTO;
  }

  @Override
  public String getMnemonic() {
    return "br";
  }

  @Override
  public boolean isGoto() {
    return true;
  }

  @Override
  public Goto asGoto() {
    return this;
  }

  @Override
  public String toString() {
    return "br " + target.getLabel();
  }
}
