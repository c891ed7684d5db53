// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.errors.CompilationError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A block of the source IR: a prefix of phis, ordinary instructions and one terminator. */
public class BasicBlock {

  private final String label;
  private final IRCode code;
  private final List<Phi> phis = new ArrayList<>();
  private final List<Instruction> instructions = new ArrayList<>();
  private final List<BasicBlock> predecessors = new ArrayList<>();

  BasicBlock(String label, IRCode code) {
    this.label = label;
    this.code = code;
  }

  public String getLabel() {
    return label;
  }

  public IRCode getCode() {
    return code;
  }

  public List<Phi> getPhis() {
    return Collections.unmodifiableList(phis);
  }

  public List<Instruction> getInstructions() {
    return Collections.unmodifiableList(instructions);
  }

  public List<BasicBlock> getPredecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public boolean isEntry() {
    return code.entryBlock() == this;
  }

  public boolean isFilled() {
    return !instructions.isEmpty() && instructions.get(instructions.size() - 1).isJumpInstruction();
  }

  public JumpInstruction exit() {
    if (!isFilled()) {
      throw new CompilationError("Block " + label + " does not end in a terminator");
    }
    return instructions.get(instructions.size() - 1).asJumpInstruction();
  }

  public List<BasicBlock> getSuccessors() {
    return exit().getSuccessors();
  }

  public boolean isReturnBlock() {
    return exit().isReturn();
  }

  void addPhi(Phi phi) {
    assert phi.getBlock() == this;
    phis.add(phi);
  }

  void add(Instruction instruction) {
    if (isFilled()) {
      throw new CompilationError("Block " + label + " already has a terminator");
    }
    instruction.setBlock(this);
    instructions.add(instruction);
    if (instruction.isJumpInstruction()) {
      for (BasicBlock successor : instruction.asJumpInstruction().getSuccessors()) {
        if (!successor.predecessors.contains(this)) {
          successor.predecessors.add(this);
        }
      }
    }
  }

  @Override
  public String toString() {
    return label;
  }

  public String toDetailedString() {
    StringBuilder builder = new StringBuilder(label).append(":\n");
    for (Phi phi : phis) {
      builder.append("  ").append(phi.toDetailedString()).append('\n');
    }
    for (Instruction instruction : instructions) {
      builder.append("  ").append(instruction).append('\n');
    }
    return builder.toString();
  }
}
