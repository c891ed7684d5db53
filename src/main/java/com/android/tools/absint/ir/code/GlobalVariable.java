// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.PointerTypeElement;
import com.android.tools.absint.ir.type.TypeElement;

/** A global variable. As a value it denotes the address of the global. */
public class GlobalVariable extends Value {

  private final TypeElement valueType;
  private final GlobalInitializer initializer;

  public GlobalVariable(String name, TypeElement valueType, GlobalInitializer initializer) {
    super(name, PointerTypeElement.to(valueType));
    this.valueType = valueType;
    this.initializer = initializer;
  }

  public TypeElement getValueType() {
    return valueType;
  }

  public boolean hasInitializer() {
    return initializer != null;
  }

  public GlobalInitializer getInitializer() {
    return initializer;
  }

  @Override
  public String toString() {
    return "@" + getName();
  }
}
