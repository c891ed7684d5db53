// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** A procedure of the program. Declarations (external procedures) have no code. */
public class Procedure {

  private static final String INTRINSIC_PREFIX = "llvm.";

  private final String name;
  private final TypeElement returnType;
  private final List<Argument> arguments;
  private final boolean isVarArg;
  private final Program program;
  private IRCode code = null;

  Procedure(
      Program program,
      String name,
      TypeElement returnType,
      List<Argument> arguments,
      boolean isVarArg) {
    this.program = program;
    this.name = name;
    this.returnType = returnType;
    this.arguments = ImmutableList.copyOf(arguments);
    this.isVarArg = isVarArg;
  }

  public String getName() {
    return name;
  }

  public TypeElement getReturnType() {
    return returnType;
  }

  public List<Argument> getArguments() {
    return arguments;
  }

  public Argument getArgument(int index) {
    return arguments.get(index);
  }

  public boolean isVarArg() {
    return isVarArg;
  }

  public Program getProgram() {
    return program;
  }

  public boolean isDeclaration() {
    return code == null;
  }

  public boolean isIntrinsic() {
    return name.startsWith(INTRINSIC_PREFIX);
  }

  public boolean isEntryPoint() {
    return name.equals(program.getEntryPointName());
  }

  public IRCode getCode() {
    return code;
  }

  void setCode(IRCode code) {
    assert this.code == null;
    this.code = code;
  }

  @Override
  public String toString() {
    return returnType
        + " @"
        + name
        + arguments.stream()
            .map(argument -> argument.getType() + " " + argument)
            .collect(Collectors.joining(", ", "(", isVarArg ? ", ...)" : ")"));
  }
}
