// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Multi-way branch: jumps to the target of the key equal to the value, or to the default. */
public class Switch extends JumpInstruction {

  private final BasicBlock defaultTarget;
  private final List<BigInteger> keys;
  private final List<BasicBlock> targets;

  public Switch(
      Value value, BasicBlock defaultTarget, List<BigInteger> keys, List<BasicBlock> targets) {
    super(ImmutableList.of(value));
    assert keys.size() == targets.size();
    this.defaultTarget = defaultTarget;
    this.keys = ImmutableList.copyOf(keys);
    this.targets = ImmutableList.copyOf(targets);
  }

  public Value value() {
    return inValues.get(0);
  }

  public BasicBlock getDefaultTarget() {
    return defaultTarget;
  }

  public List<BigInteger> getKeys() {
    return keys;
  }

  public List<BasicBlock> getTargets() {
    return targets;
  }

  /** The default target followed by the case targets. */
  @Override
  public List<BasicBlock> getSuccessors() {
    return ImmutableList.<BasicBlock>builder().add(defaultTarget).addAll(targets).build();
  }

  @Override
  public Opcode opcode() {
    return Opcode.SWITCH;
  }

  @Override
  public String getMnemonic() {
    return "switch";
  }

  @Override
  public boolean isSwitch() {
    return true;
  }

  @Override
  public Switch asSwitch() {
    return this;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("switch ");
    builder.append(value()).append(", ").append(defaultTarget.getLabel()).append(" [");
    for (int i = 0; i < keys.size(); i++) {
      builder.append(i == 0 ? "" : ", ").append(keys.get(i)).append(": ");
      builder.append(targets.get(i).getLabel());
    }
    return builder.append("]").toString();
  }
}
