// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import java.util.Objects;

public class ArrayTypeElement extends TypeElement {

  private final TypeElement elementType;
  private final long length;

  private ArrayTypeElement(TypeElement elementType, long length) {
    this.elementType = elementType;
    this.length = length;
  }

  public static ArrayTypeElement of(TypeElement elementType, long length) {
    assert length >= 0;
    return new ArrayTypeElement(elementType, length);
  }

  public TypeElement getElementType() {
    return elementType;
  }

  public long getLength() {
    return length;
  }

  @Override
  public boolean isArray() {
    return true;
  }

  @Override
  public ArrayTypeElement asArray() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ArrayTypeElement)) {
      return false;
    }
    ArrayTypeElement other = (ArrayTypeElement) obj;
    return length == other.length && elementType.equals(other.elementType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, length);
  }

  @Override
  public String toString() {
    return "[" + length + " x " + elementType + "]";
  }
}
