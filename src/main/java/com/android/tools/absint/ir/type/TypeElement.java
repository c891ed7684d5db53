// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

/** Static type of a value in the source IR. */
public abstract class TypeElement {

  public boolean isInt() {
    return false;
  }

  public IntTypeElement asInt() {
    return null;
  }

  /** Returns true if this is an integer type of exactly {@param bits} bits. */
  public boolean isInt(int bits) {
    return isInt() && asInt().getBits() == bits;
  }

  public boolean isPointer() {
    return false;
  }

  public PointerTypeElement asPointer() {
    return null;
  }

  public boolean isStruct() {
    return false;
  }

  public StructTypeElement asStruct() {
    return null;
  }

  public boolean isArray() {
    return false;
  }

  public ArrayTypeElement asArray() {
    return null;
  }

  /** Pointers and arrays are indexed by a GEP index that is scaled by the element size. */
  public boolean isSequential() {
    return isPointer() || isArray();
  }

  /** Element type of a sequential type. */
  public TypeElement getSequentialElementType() {
    if (isPointer()) {
      return asPointer().getPointee();
    }
    assert isArray();
    return asArray().getElementType();
  }

  public boolean isFloat() {
    return false;
  }

  public boolean isVoid() {
    return false;
  }

  @Override
  public abstract String toString();
}
