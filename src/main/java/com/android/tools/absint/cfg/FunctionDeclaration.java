// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.TypedVariable;
import com.android.tools.absint.cfg.linear.VariableType;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** Signature of a translated procedure, used to match call sites in interprocedural mode. */
public class FunctionDeclaration {

  private final VariableType returnType;
  private final String name;
  private final List<TypedVariable> parameters;

  public FunctionDeclaration(
      VariableType returnType, String name, List<TypedVariable> parameters) {
    this.returnType = returnType;
    this.name = name;
    this.parameters = ImmutableList.copyOf(parameters);
  }

  public VariableType getReturnType() {
    return returnType;
  }

  public String getName() {
    return name;
  }

  public List<TypedVariable> getParameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return parameters.stream()
        .map(TypedVariable::toString)
        .collect(Collectors.joining(", ", returnType + " " + name + "(", ")"));
  }
}
