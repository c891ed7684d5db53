// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** A merge of values at the entry of a block, selected by the incoming edge. */
public class Phi extends Value {

  private final BasicBlock block;
  private final Map<BasicBlock, Value> operands = new LinkedHashMap<>();

  public Phi(String name, TypeElement type, BasicBlock block) {
    super(name, type);
    this.block = block;
  }

  public BasicBlock getBlock() {
    return block;
  }

  public void addOperand(BasicBlock predecessor, Value value) {
    Value previous = operands.putIfAbsent(predecessor, value);
    assert previous == null || previous == value
        : "Conflicting operands for " + this + " from " + predecessor;
    if (previous == null) {
      value.addPhiUser(this);
    }
  }

  /** Returns the incoming value for the given predecessor, or null if there is none. */
  public Value getOperand(BasicBlock predecessor) {
    return operands.get(predecessor);
  }

  public Map<BasicBlock, Value> getOperands() {
    return Collections.unmodifiableMap(operands);
  }

  @Override
  public boolean isPhi() {
    return true;
  }

  @Override
  public Phi asPhi() {
    return this;
  }

  public String toDetailedString() {
    return super.toString()
        + " = phi "
        + operands.entrySet().stream()
            .map(entry -> "[" + entry.getValue() + ", " + entry.getKey().getLabel() + "]")
            .collect(Collectors.joining(", "));
  }
}
