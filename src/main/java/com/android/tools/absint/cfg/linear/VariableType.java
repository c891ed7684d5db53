// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import com.android.tools.absint.ir.type.TypeElement;

public enum VariableType {
  INT("int"),
  PTR("ptr"),
  ARR("arr"),
  UNK("unknown");

  private final String name;

  VariableType(String name) {
    this.name = name;
  }

  public static VariableType fromType(TypeElement type) {
    if (type.isInt()) {
      return INT;
    }
    if (type.isPointer()) {
      return PTR;
    }
    return UNK;
  }

  @Override
  public String toString() {
    return name;
  }
}
