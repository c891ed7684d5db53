// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

/**
 * A symbolic integer variable of the analysis CFG. Variables are only created by a {@link
 * VariableFactory}, which guarantees that ids and names are unique.
 */
public final class Variable implements Comparable<Variable> {

  private final int id;
  private final String name;

  Variable(int id, String name) {
    this.id = id;
    this.name = name;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(Variable other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public String toString() {
    return name;
  }
}
