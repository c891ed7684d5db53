// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.cfg.CfgBinop.Operation;
import com.android.tools.absint.cfg.linear.LinearConstraint;
import com.android.tools.absint.cfg.linear.LinearConstraintSystem;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.TypedVariable;
import com.android.tools.absint.cfg.linear.Variable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A block of the analysis CFG: a label, an ordered list of statements and the edges to the
 * neighbouring blocks. Blocks are created and owned by their {@link Cfg}.
 */
public class CfgBlock {

  private final String label;
  private final boolean synthetic;
  private final List<CfgStatement> statements = new ArrayList<>();
  private final Set<CfgBlock> successors = new LinkedHashSet<>();
  private final Set<CfgBlock> predecessors = new LinkedHashSet<>();

  CfgBlock(String label, boolean synthetic) {
    this.label = label;
    this.synthetic = synthetic;
  }

  public String getLabel() {
    return label;
  }

  /** True if the block does not correspond to a block of the source procedure. */
  public boolean isSynthetic() {
    return synthetic;
  }

  public List<CfgStatement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public Set<CfgBlock> getSuccessors() {
    return Collections.unmodifiableSet(successors);
  }

  public Set<CfgBlock> getPredecessors() {
    return Collections.unmodifiableSet(predecessors);
  }

  void link(CfgBlock successor) {
    successors.add(successor);
    successor.predecessors.add(this);
  }

  void unlink(CfgBlock successor) {
    successors.remove(successor);
    successor.predecessors.remove(this);
  }

  void moveStatementsTo(CfgBlock other) {
    other.statements.addAll(statements);
    statements.clear();
  }

  public CfgBlock add(CfgStatement statement) {
    statements.add(statement);
    return this;
  }

  /** Inserts the statements, in order, before all existing statements. */
  public void insertAtFront(List<CfgStatement> prologue) {
    statements.addAll(0, prologue);
  }

  public CfgBlock assign(Variable lhs, LinearExpression rhs) {
    return add(new CfgAssign(lhs, rhs));
  }

  public CfgBlock havoc(Variable variable) {
    return add(new CfgHavoc(variable));
  }

  public CfgBlock assume(LinearConstraint constraint) {
    return add(new CfgAssume(constraint));
  }

  public CfgBlock assume(LinearConstraintSystem constraints) {
    for (LinearConstraint constraint : constraints) {
      assume(constraint);
    }
    return this;
  }

  public CfgBlock binop(
      Operation operation, Variable lhs, LinearExpression left, LinearExpression right) {
    return add(new CfgBinop(operation, lhs, left, right));
  }

  public CfgBlock select(
      Variable lhs,
      LinearConstraint condition,
      LinearExpression trueValue,
      LinearExpression falseValue) {
    return add(new CfgSelect(lhs, condition, trueValue, falseValue));
  }

  public CfgBlock arrayLoad(
      Variable lhs, Variable array, LinearExpression index, long elementSize) {
    return add(new CfgArrayLoad(lhs, array, index, elementSize));
  }

  public CfgBlock arrayStore(
      Variable array, LinearExpression index, LinearExpression value, long elementSize) {
    return add(new CfgArrayStore(array, index, value, elementSize));
  }

  public CfgBlock assumeArray(Variable array, BigInteger value) {
    return add(new CfgAssumeArray(array, value));
  }

  public CfgBlock callSite(TypedVariable lhs, String callee, List<TypedVariable> actuals) {
    return add(new CfgCallSite(lhs, callee, actuals));
  }

  public CfgBlock ret(TypedVariable value) {
    return add(new CfgReturn(value));
  }

  public CfgBlock unreachable() {
    return add(new CfgUnreachable());
  }

  @Override
  public String toString() {
    return label;
  }

  public String toDetailedString() {
    StringBuilder builder = new StringBuilder(label).append(":\n");
    for (CfgStatement statement : statements) {
      builder.append("  ").append(statement).append(";\n");
    }
    if (!successors.isEmpty()) {
      builder.append("  goto ");
      boolean first = true;
      for (CfgBlock successor : successors) {
        if (!first) {
          builder.append(", ");
        }
        builder.append(successor.label);
        first = false;
      }
      builder.append(";\n");
    }
    return builder.toString();
  }
}
