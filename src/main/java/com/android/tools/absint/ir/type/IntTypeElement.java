// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceOpenHashMap;

public class IntTypeElement extends TypeElement {

  private static final Int2ReferenceMap<IntTypeElement> CACHE = new Int2ReferenceOpenHashMap<>();

  public static final IntTypeElement I1 = get(1);
  public static final IntTypeElement I8 = get(8);
  public static final IntTypeElement I16 = get(16);
  public static final IntTypeElement I32 = get(32);
  public static final IntTypeElement I64 = get(64);

  private final int bits;

  private IntTypeElement(int bits) {
    this.bits = bits;
  }

  public static IntTypeElement get(int bits) {
    assert bits > 0;
    synchronized (CACHE) {
      return CACHE.computeIfAbsent(bits, IntTypeElement::new);
    }
  }

  public int getBits() {
    return bits;
  }

  public boolean isBoolean() {
    return bits == 1;
  }

  @Override
  public boolean isInt() {
    return true;
  }

  @Override
  public IntTypeElement asInt() {
    return this;
  }

  @Override
  public String toString() {
    return "i" + bits;
  }
}
