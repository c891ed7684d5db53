// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import com.android.tools.absint.ir.code.Value;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceOpenHashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mints the variables of the analysis CFG.
 *
 * <p>SSA values and array cells are mapped to the same variable for the lifetime of the factory.
 * Names are unique: a name that is already taken gets a numeric suffix. The factory may be shared
 * by translations running on different threads.
 */
public class VariableFactory {

  private static final String TEMPORARY_PREFIX = "@V_";
  private static final String CELL_PREFIX = "@A_";

  private final Map<Value, Variable> valueVariables = new IdentityHashMap<>();
  private final Int2ReferenceMap<Variable> cellVariables = new Int2ReferenceOpenHashMap<>();
  private final Set<String> usedNames = new HashSet<>();
  private int nextId = 0;
  private int nextTemporary = 0;

  public synchronized Variable get(Value value) {
    Variable variable = valueVariables.get(value);
    if (variable == null) {
      variable = value.hasName() ? mint(value.getName()) : mintTemporary();
      valueVariables.put(value, variable);
    }
    return variable;
  }

  public synchronized Variable getCell(int arrayId) {
    assert arrayId >= 0;
    Variable variable = cellVariables.get(arrayId);
    if (variable == null) {
      variable = mint(CELL_PREFIX + arrayId);
      cellVariables.put(arrayId, variable);
    }
    return variable;
  }

  /** Returns a variable that is not associated with any value. */
  public synchronized Variable fresh() {
    return mintTemporary();
  }

  public synchronized int size() {
    return nextId;
  }

  private Variable mintTemporary() {
    return mint(TEMPORARY_PREFIX + nextTemporary++);
  }

  private Variable mint(String name) {
    String uniqueName = name;
    for (int suffix = 1; !usedNames.add(uniqueName); suffix++) {
      uniqueName = name + "." + suffix;
    }
    return new Variable(nextId++, uniqueName);
  }
}
