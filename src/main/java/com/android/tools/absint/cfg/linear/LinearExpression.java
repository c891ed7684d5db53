// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import com.android.tools.absint.errors.Unreachable;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigInteger;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** An immutable affine expression {@code c_1*x_1 + ... + c_n*x_n + c_0} over the integers. */
public final class LinearExpression {

  private static final LinearExpression ZERO =
      new LinearExpression(ImmutableSortedMap.of(), BigInteger.ZERO);

  // Never holds a zero coefficient.
  private final ImmutableSortedMap<Variable, BigInteger> terms;
  private final BigInteger constant;

  private LinearExpression(ImmutableSortedMap<Variable, BigInteger> terms, BigInteger constant) {
    this.terms = terms;
    this.constant = constant;
  }

  public static LinearExpression zero() {
    return ZERO;
  }

  public static LinearExpression constant(long value) {
    return constant(BigInteger.valueOf(value));
  }

  public static LinearExpression constant(BigInteger value) {
    return value.signum() == 0 ? ZERO : new LinearExpression(ImmutableSortedMap.of(), value);
  }

  public static LinearExpression of(Variable variable) {
    return new LinearExpression(ImmutableSortedMap.of(variable, BigInteger.ONE), BigInteger.ZERO);
  }

  public boolean isConstant() {
    return terms.isEmpty();
  }

  public BigInteger getConstant() {
    return constant;
  }

  /** True if this is exactly {@code 1*x} for some variable x. */
  public boolean isVariable() {
    return terms.size() == 1
        && constant.signum() == 0
        && terms.values().iterator().next().equals(BigInteger.ONE);
  }

  public Variable getVariable() {
    if (!isVariable()) {
      throw new Unreachable("Not a variable: " + this);
    }
    return terms.firstKey();
  }

  public Set<Variable> getVariables() {
    return terms.keySet();
  }

  public BigInteger getCoefficient(Variable variable) {
    return terms.getOrDefault(variable, BigInteger.ZERO);
  }

  public LinearExpression plus(LinearExpression other) {
    TreeMap<Variable, BigInteger> result = new TreeMap<>(terms);
    for (Entry<Variable, BigInteger> entry : other.terms.entrySet()) {
      BigInteger coefficient = result.getOrDefault(entry.getKey(), BigInteger.ZERO);
      BigInteger sum = coefficient.add(entry.getValue());
      if (sum.signum() == 0) {
        result.remove(entry.getKey());
      } else {
        result.put(entry.getKey(), sum);
      }
    }
    return new LinearExpression(
        ImmutableSortedMap.copyOfSorted(result), constant.add(other.constant));
  }

  public LinearExpression plus(long value) {
    return plus(BigInteger.valueOf(value));
  }

  public LinearExpression plus(BigInteger value) {
    return new LinearExpression(terms, constant.add(value));
  }

  public LinearExpression minus(LinearExpression other) {
    return plus(other.negate());
  }

  public LinearExpression negate() {
    return times(BigInteger.ONE.negate());
  }

  public LinearExpression times(BigInteger factor) {
    if (factor.signum() == 0) {
      return ZERO;
    }
    ImmutableSortedMap.Builder<Variable, BigInteger> builder = ImmutableSortedMap.naturalOrder();
    terms.forEach((variable, coefficient) -> builder.put(variable, coefficient.multiply(factor)));
    return new LinearExpression(builder.build(), constant.multiply(factor));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LinearExpression)) {
      return false;
    }
    LinearExpression expression = (LinearExpression) other;
    return terms.equals(expression.terms) && constant.equals(expression.constant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(terms, constant);
  }

  @Override
  public String toString() {
    if (isConstant()) {
      return constant.toString();
    }
    StringBuilder builder = new StringBuilder();
    terms.forEach((variable, coefficient) -> appendTerm(builder, coefficient, variable.getName()));
    if (constant.signum() != 0) {
      appendTerm(builder, constant, null);
    }
    return builder.toString();
  }

  private static void appendTerm(StringBuilder builder, BigInteger coefficient, String name) {
    BigInteger magnitude = coefficient.abs();
    if (builder.length() == 0) {
      if (coefficient.signum() < 0) {
        builder.append('-');
      }
    } else {
      builder.append(coefficient.signum() < 0 ? " - " : " + ");
    }
    if (name == null) {
      builder.append(magnitude);
      return;
    }
    if (!magnitude.equals(BigInteger.ONE)) {
      builder.append(magnitude).append('*');
    }
    builder.append(name);
  }
}
