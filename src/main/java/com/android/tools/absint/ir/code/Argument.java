// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;

/** A formal parameter of a procedure. */
public class Argument extends Value {

  private final int index;

  public Argument(String name, TypeElement type, int index) {
    super(name, type);
    this.index = index;
  }

  public int getIndex() {
    return index;
  }
}
