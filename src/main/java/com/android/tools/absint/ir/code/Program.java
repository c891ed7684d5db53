// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.ir.type.DataLayout;
import com.android.tools.absint.ir.type.TypeElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A whole program: data layout, global variables and procedures. */
public class Program {

  public static final String DEFAULT_ENTRY_POINT_NAME = "main";

  private final DataLayout dataLayout;
  private final String entryPointName;
  private final List<GlobalVariable> globals = new ArrayList<>();
  private final Map<String, Procedure> procedures = new LinkedHashMap<>();

  public Program(DataLayout dataLayout) {
    this(dataLayout, DEFAULT_ENTRY_POINT_NAME);
  }

  public Program(DataLayout dataLayout, String entryPointName) {
    this.dataLayout = dataLayout;
    this.entryPointName = entryPointName;
  }

  public DataLayout getDataLayout() {
    return dataLayout;
  }

  public String getEntryPointName() {
    return entryPointName;
  }

  public List<GlobalVariable> getGlobals() {
    return Collections.unmodifiableList(globals);
  }

  public GlobalVariable addGlobal(
      String name, TypeElement valueType, GlobalInitializer initializer) {
    GlobalVariable global = new GlobalVariable(name, valueType, initializer);
    globals.add(global);
    return global;
  }

  public Procedure addProcedure(String name, TypeElement returnType, TypeElement... argumentTypes) {
    List<String> argumentNames = new ArrayList<>(argumentTypes.length);
    for (int i = 0; i < argumentTypes.length; i++) {
      argumentNames.add("arg" + i);
    }
    return addProcedure(name, returnType, argumentNames, List.of(argumentTypes), false);
  }

  public Procedure addProcedure(
      String name,
      TypeElement returnType,
      List<String> argumentNames,
      List<TypeElement> argumentTypes,
      boolean isVarArg) {
    assert argumentNames.size() == argumentTypes.size();
    if (procedures.containsKey(name)) {
      throw new CompilationError("Duplicate procedure " + name);
    }
    List<Argument> arguments = new ArrayList<>(argumentTypes.size());
    for (int i = 0; i < argumentTypes.size(); i++) {
      arguments.add(new Argument(argumentNames.get(i), argumentTypes.get(i), i));
    }
    Procedure procedure = new Procedure(this, name, returnType, arguments, isVarArg);
    procedures.put(name, procedure);
    return procedure;
  }

  public Procedure getProcedure(String name) {
    return procedures.get(name);
  }

  public List<Procedure> getProcedures() {
    return Collections.unmodifiableList(new ArrayList<>(procedures.values()));
  }

  /** Procedures with code, in declaration order. */
  public List<Procedure> getDefinedProcedures() {
    List<Procedure> defined = new ArrayList<>();
    for (Procedure procedure : procedures.values()) {
      if (!procedure.isDeclaration()) {
        defined.add(procedure);
      }
    }
    return defined;
  }
}
