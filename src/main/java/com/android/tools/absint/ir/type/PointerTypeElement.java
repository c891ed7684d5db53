// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import java.util.Objects;

/** A typed pointer. The pointee drives the scaling of the first index of address computations. */
public class PointerTypeElement extends TypeElement {

  private final TypeElement pointee;

  private PointerTypeElement(TypeElement pointee) {
    this.pointee = pointee;
  }

  public static PointerTypeElement to(TypeElement pointee) {
    return new PointerTypeElement(pointee);
  }

  public TypeElement getPointee() {
    return pointee;
  }

  @Override
  public boolean isPointer() {
    return true;
  }

  @Override
  public PointerTypeElement asPointer() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PointerTypeElement)) {
      return false;
    }
    return pointee.equals(((PointerTypeElement) obj).pointee);
  }

  @Override
  public int hashCode() {
    return Objects.hash(PointerTypeElement.class, pointee);
  }

  @Override
  public String toString() {
    return pointee + "*";
  }
}
