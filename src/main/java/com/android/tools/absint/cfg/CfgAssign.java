// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;

public class CfgAssign extends CfgStatement {

  private final Variable lhs;
  private final LinearExpression rhs;

  public CfgAssign(Variable lhs, LinearExpression rhs) {
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public Variable getLhs() {
    return lhs;
  }

  public LinearExpression getRhs() {
    return rhs;
  }

  @Override
  public boolean isAssign() {
    return true;
  }

  @Override
  public CfgAssign asAssign() {
    return this;
  }

  @Override
  public String toString() {
    return lhs + " = " + rhs;
  }
}
