// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;

/** {@code array[index] = value}, writing {@code elementSize} bytes. */
public class CfgArrayStore extends CfgStatement {

  private final Variable array;
  private final LinearExpression index;
  private final LinearExpression value;
  private final long elementSize;

  public CfgArrayStore(
      Variable array, LinearExpression index, LinearExpression value, long elementSize) {
    this.array = array;
    this.index = index;
    this.value = value;
    this.elementSize = elementSize;
  }

  public Variable getArray() {
    return array;
  }

  public LinearExpression getIndex() {
    return index;
  }

  public LinearExpression getValue() {
    return value;
  }

  public long getElementSize() {
    return elementSize;
  }

  @Override
  public boolean isArrayStore() {
    return true;
  }

  @Override
  public CfgArrayStore asArrayStore() {
    return this;
  }

  @Override
  public String toString() {
    return "array_store(" + array + ", " + index + ", " + value + ", sz=" + elementSize + ")";
  }
}
