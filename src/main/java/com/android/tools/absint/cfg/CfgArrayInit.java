// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.Variable;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Initializes the array with a sequence of constants. */
public class CfgArrayInit extends CfgStatement {

  private final Variable array;
  private final List<BigInteger> values;

  public CfgArrayInit(Variable array, List<BigInteger> values) {
    this.array = array;
    this.values = ImmutableList.copyOf(values);
  }

  public Variable getArray() {
    return array;
  }

  public List<BigInteger> getValues() {
    return values;
  }

  @Override
  public boolean isArrayInit() {
    return true;
  }

  @Override
  public CfgArrayInit asArrayInit() {
    return this;
  }

  @Override
  public String toString() {
    return "array_init(" + array + ", " + values + ")";
  }
}
