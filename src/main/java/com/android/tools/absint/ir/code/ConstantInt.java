// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.IntTypeElement;
import java.math.BigInteger;

/**
 * An integer literal. The value is the signed interpretation of the bits, except for 1-bit
 * constants which are 0 (false) or 1 (true).
 */
public class ConstantInt extends Value {

  private final BigInteger value;

  private ConstantInt(IntTypeElement type, BigInteger value) {
    super(null, type);
    this.value = value;
  }

  public static ConstantInt of(IntTypeElement type, long value) {
    return of(type, BigInteger.valueOf(value));
  }

  public static ConstantInt of(IntTypeElement type, BigInteger value) {
    assert !type.isBoolean() || value.signum() == 0 || value.equals(BigInteger.ONE);
    return new ConstantInt(type, value);
  }

  public static ConstantInt ofBoolean(boolean value) {
    return of(IntTypeElement.I1, value ? 1 : 0);
  }

  public BigInteger getValue() {
    return value;
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  @Override
  public IntTypeElement getType() {
    return type.asInt();
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public boolean isConstantInt() {
    return true;
  }

  @Override
  public ConstantInt asConstantInt() {
    return this;
  }

  @Override
  public String toString() {
    return type + " " + value;
  }
}
