// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

public class StructTypeElement extends TypeElement {

  private final ImmutableList<TypeElement> fields;

  private StructTypeElement(ImmutableList<TypeElement> fields) {
    this.fields = fields;
  }

  public static StructTypeElement of(TypeElement... fields) {
    return new StructTypeElement(ImmutableList.copyOf(fields));
  }

  public static StructTypeElement of(List<TypeElement> fields) {
    return new StructTypeElement(ImmutableList.copyOf(fields));
  }

  public List<TypeElement> getFields() {
    return fields;
  }

  public TypeElement getField(int index) {
    return fields.get(index);
  }

  public int getNumberOfFields() {
    return fields.size();
  }

  @Override
  public boolean isStruct() {
    return true;
  }

  @Override
  public StructTypeElement asStruct() {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StructTypeElement)) {
      return false;
    }
    return fields.equals(((StructTypeElement) obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.stream().map(TypeElement::toString).collect(Collectors.joining(", ", "{ ", " }"));
  }
}
