// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

public class FloatTypeElement extends TypeElement {

  public static final FloatTypeElement FLOAT = new FloatTypeElement(32);
  public static final FloatTypeElement DOUBLE = new FloatTypeElement(64);

  private final int bits;

  private FloatTypeElement(int bits) {
    this.bits = bits;
  }

  public int getBits() {
    return bits;
  }

  @Override
  public boolean isFloat() {
    return true;
  }

  @Override
  public String toString() {
    return bits == 32 ? "float" : "double";
  }
}
