// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;

/** {@code lhs = array[index]}, reading {@code elementSize} bytes. */
public class CfgArrayLoad extends CfgStatement {

  private final Variable lhs;
  private final Variable array;
  private final LinearExpression index;
  private final long elementSize;

  public CfgArrayLoad(Variable lhs, Variable array, LinearExpression index, long elementSize) {
    this.lhs = lhs;
    this.array = array;
    this.index = index;
    this.elementSize = elementSize;
  }

  public Variable getLhs() {
    return lhs;
  }

  public Variable getArray() {
    return array;
  }

  public LinearExpression getIndex() {
    return index;
  }

  public long getElementSize() {
    return elementSize;
  }

  @Override
  public boolean isArrayLoad() {
    return true;
  }

  @Override
  public CfgArrayLoad asArrayLoad() {
    return this;
  }

  @Override
  public String toString() {
    return lhs + " = array_load(" + array + ", " + index + ", sz=" + elementSize + ")";
  }
}
