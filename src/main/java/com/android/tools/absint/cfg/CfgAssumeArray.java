// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.Variable;
import java.math.BigInteger;

/** Assumes that every element of the array equals the given value. */
public class CfgAssumeArray extends CfgStatement {

  private final Variable array;
  private final BigInteger value;

  public CfgAssumeArray(Variable array, BigInteger value) {
    this.array = array;
    this.value = value;
  }

  public Variable getArray() {
    return array;
  }

  public BigInteger getValue() {
    return value;
  }

  @Override
  public boolean isAssumeArray() {
    return true;
  }

  @Override
  public CfgAssumeArray asAssumeArray() {
    return this;
  }

  @Override
  public String toString() {
    return "assume_array(" + array + ", " + value + ")";
  }
}
