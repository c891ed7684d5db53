// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;

public class Undef extends Value {

  public Undef(TypeElement type) {
    super(null, type);
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public boolean isUndef() {
    return true;
  }

  @Override
  public String toString() {
    return "undef";
  }
}
