// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;
import com.google.common.collect.ImmutableList;

/** Stack allocation of a single object of the allocated type. */
public class Alloca extends Instruction {

  private final TypeElement allocatedType;

  public Alloca(Value outValue, TypeElement allocatedType) {
    super(outValue, ImmutableList.of());
    this.allocatedType = allocatedType;
  }

  public TypeElement getAllocatedType() {
    return allocatedType;
  }

  @Override
  public Opcode opcode() {
    return Opcode.ALLOCA;
  }

  @Override
  public String getMnemonic() {
    return "alloca " + allocatedType;
  }

  @Override
  public boolean isAlloca() {
    return true;
  }

  @Override
  public Alloca asAlloca() {
    return this;
  }
}
