// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import java.util.List;

/**
 * A call. The callee is null for indirect calls that could not be resolved to a procedure, in
 * which case {@link #getCalledValue()} holds the function pointer.
 */
public class Invoke extends Instruction {

  private final Procedure callee;
  private final Value calledValue;

  public Invoke(Value outValue, Procedure callee, List<Value> arguments) {
    super(outValue, arguments);
    this.callee = callee;
    this.calledValue = null;
  }

  public Invoke(Value outValue, Value calledValue, List<Value> arguments) {
    super(outValue, arguments);
    this.callee = null;
    this.calledValue = calledValue;
  }

  public boolean hasCallee() {
    return callee != null;
  }

  public Procedure getCallee() {
    return callee;
  }

  public Value getCalledValue() {
    return calledValue;
  }

  public List<Value> arguments() {
    return inValues;
  }

  public Value getArgument(int index) {
    return inValues.get(index);
  }

  @Override
  public Opcode opcode() {
    return Opcode.INVOKE;
  }

  @Override
  public String getMnemonic() {
    return "call " + (callee != null ? "@" + callee.getName() : String.valueOf(calledValue));
  }

  @Override
  public boolean isInvoke() {
    return true;
  }

  @Override
  public Invoke asInvoke() {
    return this;
  }
}
