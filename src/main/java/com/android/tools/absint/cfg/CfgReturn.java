// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.TypedVariable;

public class CfgReturn extends CfgStatement {

  private final TypedVariable value;

  public CfgReturn(TypedVariable value) {
    this.value = value;
  }

  public TypedVariable getValue() {
    return value;
  }

  @Override
  public boolean isReturn() {
    return true;
  }

  @Override
  public CfgReturn asReturn() {
    return this;
  }

  @Override
  public String toString() {
    return "return " + value;
  }
}
