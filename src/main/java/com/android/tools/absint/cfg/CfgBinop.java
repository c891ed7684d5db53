// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;

/** {@code lhs = left op right}. */
public class CfgBinop extends CfgStatement {

  public enum Operation {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    SDIV("/"),
    UDIV("/_u"),
    SREM("%"),
    UREM("%_u"),
    AND("&"),
    OR("|"),
    XOR("^");

    private final String symbol;

    Operation(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  private final Operation operation;
  private final Variable lhs;
  private final LinearExpression left;
  private final LinearExpression right;

  public CfgBinop(
      Operation operation, Variable lhs, LinearExpression left, LinearExpression right) {
    this.operation = operation;
    this.lhs = lhs;
    this.left = left;
    this.right = right;
  }

  public Operation getOperation() {
    return operation;
  }

  public Variable getLhs() {
    return lhs;
  }

  public LinearExpression getLeft() {
    return left;
  }

  public LinearExpression getRight() {
    return right;
  }

  @Override
  public boolean isBinop() {
    return true;
  }

  @Override
  public CfgBinop asBinop() {
    return this;
  }

  @Override
  public String toString() {
    return lhs + " = " + left + " " + operation.getSymbol() + " " + right;
  }
}
