// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.Variable;

/** Forgets everything known about a variable. */
public class CfgHavoc extends CfgStatement {

  private final Variable variable;

  public CfgHavoc(Variable variable) {
    this.variable = variable;
  }

  public Variable getVariable() {
    return variable;
  }

  @Override
  public boolean isHavoc() {
    return true;
  }

  @Override
  public CfgHavoc asHavoc() {
    return this;
  }

  @Override
  public String toString() {
    return "havoc(" + variable + ")";
  }
}
