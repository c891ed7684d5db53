// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

/** A formal or actual parameter. */
public class TypedVariable {

  private final Variable variable;
  private final VariableType type;

  public TypedVariable(Variable variable, VariableType type) {
    this.variable = variable;
    this.type = type;
  }

  public Variable getVariable() {
    return variable;
  }

  public VariableType getType() {
    return type;
  }

  @Override
  public String toString() {
    return variable + ":" + type;
  }
}
