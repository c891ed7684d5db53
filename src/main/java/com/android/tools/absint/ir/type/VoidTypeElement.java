// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

public class VoidTypeElement extends TypeElement {

  private static final VoidTypeElement INSTANCE = new VoidTypeElement();

  private VoidTypeElement() {}

  public static VoidTypeElement get() {
    return INSTANCE;
  }

  @Override
  public boolean isVoid() {
    return true;
  }

  @Override
  public String toString() {
    return "void";
  }
}
