// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;

/** Integer or pointer comparison producing a 1-bit value. */
public class Cmp extends Instruction {

  private final CmpPredicate predicate;

  public Cmp(CmpPredicate predicate, Value outValue, Value left, Value right) {
    super(outValue, ImmutableList.of(left, right));
    this.predicate = predicate;
  }

  public CmpPredicate getPredicate() {
    return predicate;
  }

  public Value leftValue() {
    return inValues.get(0);
  }

  public Value rightValue() {
    return inValues.get(1);
  }

  @Override
  public Opcode opcode() {
    return Opcode.CMP;
  }

  @Override
  public String getMnemonic() {
    return "icmp " + predicate.getMnemonic();
  }

  @Override
  public boolean isCmp() {
    return true;
  }

  @Override
  public Cmp asCmp() {
    return this;
  }
}
