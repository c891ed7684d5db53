// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.linear.TypedVariable;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** A call to a procedure, optionally capturing the result. */
public class CfgCallSite extends CfgStatement {

  private final TypedVariable lhs;
  private final String callee;
  private final List<TypedVariable> actuals;

  public CfgCallSite(TypedVariable lhs, String callee, List<TypedVariable> actuals) {
    this.lhs = lhs;
    this.callee = callee;
    this.actuals = ImmutableList.copyOf(actuals);
  }

  public boolean hasLhs() {
    return lhs != null;
  }

  public TypedVariable getLhs() {
    return lhs;
  }

  public String getCallee() {
    return callee;
  }

  public List<TypedVariable> getActuals() {
    return actuals;
  }

  @Override
  public boolean isCallSite() {
    return true;
  }

  @Override
  public CfgCallSite asCallSite() {
    return this;
  }

  @Override
  public String toString() {
    String call =
        actuals.stream()
            .map(TypedVariable::toString)
            .collect(Collectors.joining(", ", "call " + callee + "(", ")"));
    return hasLhs() ? lhs + " = " + call : call;
  }
}
