// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/** An ordered conjunction of linear constraints. The empty system is trivially true. */
public class LinearConstraintSystem implements Iterable<LinearConstraint> {

  private final List<LinearConstraint> constraints = new ArrayList<>();

  public LinearConstraintSystem add(LinearConstraint constraint) {
    constraints.add(constraint);
    return this;
  }

  public LinearConstraintSystem addAll(LinearConstraintSystem other) {
    constraints.addAll(other.constraints);
    return this;
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  public int size() {
    return constraints.size();
  }

  public LinearConstraint get(int index) {
    return constraints.get(index);
  }

  public List<LinearConstraint> getConstraints() {
    return ImmutableList.copyOf(constraints);
  }

  @Override
  public Iterator<LinearConstraint> iterator() {
    return getConstraints().iterator();
  }

  @Override
  public String toString() {
    return constraints.stream()
        .map(LinearConstraint::toString)
        .collect(Collectors.joining("; ", "{", "}"));
  }
}
