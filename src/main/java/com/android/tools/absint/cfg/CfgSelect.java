// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearConstraint;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;

/** {@code lhs = condition ? trueValue : falseValue}. */
public class CfgSelect extends CfgStatement {

  private final Variable lhs;
  private final LinearConstraint condition;
  private final LinearExpression trueValue;
  private final LinearExpression falseValue;

  public CfgSelect(
      Variable lhs,
      LinearConstraint condition,
      LinearExpression trueValue,
      LinearExpression falseValue) {
    this.lhs = lhs;
    this.condition = condition;
    this.trueValue = trueValue;
    this.falseValue = falseValue;
  }

  public Variable getLhs() {
    return lhs;
  }

  public LinearConstraint getCondition() {
    return condition;
  }

  public LinearExpression getTrueValue() {
    return trueValue;
  }

  public LinearExpression getFalseValue() {
    return falseValue;
  }

  @Override
  public boolean isSelect() {
    return true;
  }

  @Override
  public CfgSelect asSelect() {
    return this;
  }

  @Override
  public String toString() {
    return lhs + " = ite(" + condition + ", " + trueValue + ", " + falseValue + ")";
  }
}
