// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import com.android.tools.absint.errors.Unreachable;
import java.util.Objects;

/** A relation {@code e = 0}, {@code e != 0} or {@code e <= 0} for a linear expression e. */
public final class LinearConstraint {

  public enum Kind {
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN_OR_EQUALS("<=");

    private final String symbol;

    Kind(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  private final Kind kind;
  private final LinearExpression expression;

  private LinearConstraint(Kind kind, LinearExpression expression) {
    this.kind = kind;
    this.expression = expression;
  }

  public static LinearConstraint equalTo(LinearExpression left, LinearExpression right) {
    return new LinearConstraint(Kind.EQUALS, left.minus(right));
  }

  public static LinearConstraint notEqualTo(LinearExpression left, LinearExpression right) {
    return new LinearConstraint(Kind.NOT_EQUALS, left.minus(right));
  }

  public static LinearConstraint lessThanOrEqualTo(
      LinearExpression left, LinearExpression right) {
    return new LinearConstraint(Kind.LESS_THAN_OR_EQUALS, left.minus(right));
  }

  public static LinearConstraint lessThan(LinearExpression left, LinearExpression right) {
    return lessThanOrEqualTo(left, right.plus(-1));
  }

  public static LinearConstraint greaterThanOrEqualTo(
      LinearExpression left, LinearExpression right) {
    return lessThanOrEqualTo(right, left);
  }

  public static LinearConstraint greaterThan(LinearExpression left, LinearExpression right) {
    return lessThan(right, left);
  }

  public Kind getKind() {
    return kind;
  }

  /** The expression e of {@code e op 0}. */
  public LinearExpression getExpression() {
    return expression;
  }

  public LinearConstraint negate() {
    switch (kind) {
      case EQUALS:
        return new LinearConstraint(Kind.NOT_EQUALS, expression);
      case NOT_EQUALS:
        return new LinearConstraint(Kind.EQUALS, expression);
      case LESS_THAN_OR_EQUALS:
        // not(e <= 0) iff -e + 1 <= 0
        return new LinearConstraint(Kind.LESS_THAN_OR_EQUALS, expression.negate().plus(1));
      default:
        throw new Unreachable("Unexpected constraint kind " + kind);
    }
  }

  public boolean isTautology() {
    return expression.isConstant() && evaluate();
  }

  public boolean isContradiction() {
    return expression.isConstant() && !evaluate();
  }

  private boolean evaluate() {
    int sign = expression.getConstant().signum();
    switch (kind) {
      case EQUALS:
        return sign == 0;
      case NOT_EQUALS:
        return sign != 0;
      case LESS_THAN_OR_EQUALS:
        return sign <= 0;
      default:
        throw new Unreachable("Unexpected constraint kind " + kind);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LinearConstraint)) {
      return false;
    }
    LinearConstraint constraint = (LinearConstraint) other;
    return kind == constraint.kind && expression.equals(constraint.expression);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, expression);
  }

  /** Prints the constraint with the constant on the right hand side, e.g. {@code x - y <= -1}. */
  @Override
  public String toString() {
    LinearExpression left = expression.plus(expression.getConstant().negate());
    String leftString = left.isConstant() ? "0" : left.toString();
    return leftString + " " + kind.getSymbol() + " " + expression.getConstant().negate();
  }
}
