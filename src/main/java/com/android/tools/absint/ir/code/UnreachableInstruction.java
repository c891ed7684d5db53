// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Terminator of a block that cannot be executed to its end. */
public class UnreachableInstruction extends JumpInstruction {

  public UnreachableInstruction() {
    super(ImmutableList.of());
  }

  @Override
  public List<BasicBlock> getSuccessors() {
    return ImmutableList.of();
  }

  @Override
  public Opcode opcode() {
    return Opcode.UNREACHABLE;
  }

  @Override
  public String getMnemonic() {
    return "unreachable";
  }

  @Override
  public boolean isUnreachableInstruction() {
    return true;
  }
}
