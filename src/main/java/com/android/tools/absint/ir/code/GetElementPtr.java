// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Address computation: base pointer plus a list of indices. The first index steps over whole
 * pointees, each subsequent index selects a struct field or an array element.
 */
public class GetElementPtr extends Instruction {

  public GetElementPtr(Value outValue, Value base, List<Value> indices) {
    super(outValue, ImmutableList.<Value>builder().add(base).addAll(indices).build());
  }

  public Value base() {
    return inValues.get(0);
  }

  public List<Value> indices() {
    return inValues.subList(1, inValues.size());
  }

  @Override
  public Opcode opcode() {
    return Opcode.GET_ELEMENT_PTR;
  }

  @Override
  public String getMnemonic() {
    return "getelementptr";
  }

  @Override
  public boolean isGetElementPtr() {
    return true;
  }

  @Override
  public GetElementPtr asGetElementPtr() {
    return this;
  }
}
