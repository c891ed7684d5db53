// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.TypeElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An SSA value of the source IR.
 *
 * <p>Uses are recorded per operand slot: an instruction that reads the same value twice is listed
 * twice in {@link #users()}.
 */
public class Value {

  private final String name;
  protected final TypeElement type;

  Instruction definition = null;

  private final List<Instruction> users = new ArrayList<>(2);
  private final List<Phi> phiUsers = new ArrayList<>(0);

  public Value(String name, TypeElement type) {
    this.name = name;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public boolean hasName() {
    return name != null && !name.isEmpty();
  }

  public TypeElement getType() {
    return type;
  }

  public Instruction getDefinition() {
    return definition;
  }

  public boolean isDefinedByInstruction() {
    return definition != null;
  }

  void addUser(Instruction user) {
    users.add(user);
  }

  void addPhiUser(Phi user) {
    phiUsers.add(user);
  }

  public List<Instruction> users() {
    return Collections.unmodifiableList(users);
  }

  public List<Phi> phiUsers() {
    return Collections.unmodifiableList(phiUsers);
  }

  public int numberOfAllUsers() {
    return users.size() + phiUsers.size();
  }

  public boolean isConstant() {
    return false;
  }

  public boolean isConstantInt() {
    return false;
  }

  public ConstantInt asConstantInt() {
    return null;
  }

  public boolean isConstantNull() {
    return false;
  }

  public boolean isUndef() {
    return false;
  }

  public boolean isPhi() {
    return false;
  }

  public Phi asPhi() {
    return null;
  }

  @Override
  public String toString() {
    return hasName() ? "%" + name : "%<" + System.identityHashCode(this) + ">";
  }
}
