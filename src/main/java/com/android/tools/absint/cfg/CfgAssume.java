// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.LinearConstraint;

public class CfgAssume extends CfgStatement {

  private final LinearConstraint constraint;

  public CfgAssume(LinearConstraint constraint) {
    this.constraint = constraint;
  }

  public LinearConstraint getConstraint() {
    return constraint;
  }

  @Override
  public boolean isAssume() {
    return true;
  }

  @Override
  public CfgAssume asAssume() {
    return this;
  }

  @Override
  public String toString() {
    return "assume(" + constraint + ")";
  }
}
