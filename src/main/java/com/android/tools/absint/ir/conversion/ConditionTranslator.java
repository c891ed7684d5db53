// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static com.android.tools.absint.cfg.linear.LinearConstraint.equalTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.greaterThanOrEqualTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.lessThanOrEqualTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.notEqualTo;

import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.linear.LinearConstraintSystem;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.errors.Unreachable;
import com.android.tools.absint.ir.code.Binop;
import com.android.tools.absint.ir.code.BinopType;
import com.android.tools.absint.ir.code.Cmp;
import com.android.tools.absint.ir.code.CmpPredicate;
import com.android.tools.absint.ir.code.Instruction;
import com.android.tools.absint.ir.code.Value;

/**
 * Translates boolean conditions into conjunctions of linear constraints.
 *
 * <p>The constraints describe the states in which the condition evaluates to true, or to false if
 * the condition is negated. Conditions that would require a disjunction, such as the negation of
 * a conjunction, are under-constrained. A boolean that is not a comparison or a logic operation
 * is only constrained if it is not computed in the procedure, for example an argument.
 */
public class ConditionTranslator {

  private final SymbolMapper mapper;
  private final CfgBuilderOptions options;

  public ConditionTranslator(SymbolMapper mapper, CfgBuilderOptions options) {
    this.mapper = mapper;
    this.options = options;
  }

  /**
   * Adds to the block what is known when the condition evaluates to {@code !negated}. A constant
   * condition makes the block unreachable if it contradicts the expected outcome.
   */
  public void translateCondition(Value condition, boolean negated, CfgBlock block) {
    if (condition.isConstantInt()) {
      if (condition.asConstantInt().isZero() != negated) {
        block.unreachable();
      }
      return;
    }
    block.assume(computeConstraints(condition, negated));
  }

  public LinearConstraintSystem computeConstraints(Value condition, boolean negated) {
    if (condition.isDefinedByInstruction()) {
      Instruction definition = condition.getDefinition();
      if (definition.isCmp()) {
        return translateBranchComparison(definition.asCmp(), negated);
      }
      if (definition.isBinop()) {
        return translateConjunction(definition.asBinop(), negated);
      }
    }
    LinearConstraintSystem constraints = new LinearConstraintSystem();
    // The variable of any other computed boolean may hold values other than 0 and 1, such as the
    // source of a truncation.
    if (condition.isDefinedByInstruction() || condition.isPhi()) {
      return constraints;
    }
    LinearExpression expression = mapper.lookup(condition);
    if (expression != null) {
      constraints.add(equalTo(expression, LinearExpression.constant(negated ? 0 : 1)));
    }
    return constraints;
  }

  private LinearConstraintSystem translateBranchComparison(Cmp cmp, boolean negated) {
    LinearConstraintSystem constraints = translateComparison(cmp, negated);
    // Other users of the boolean need its value.
    if (cmp.outValue().numberOfAllUsers() >= 2 && mapper.isTracked(cmp.outValue())) {
      constraints.add(
          equalTo(
              LinearExpression.of(mapper.symVar(cmp.outValue())),
              LinearExpression.constant(negated ? 0 : 1)));
    }
    return constraints;
  }

  // Only and(c1, c2) on the true edge and or(c1, c2) on the false edge are conjunctions.
  private LinearConstraintSystem translateConjunction(Binop binop, boolean negated) {
    LinearConstraintSystem constraints = new LinearConstraintSystem();
    BinopType expected = negated ? BinopType.OR : BinopType.AND;
    if (binop.getType() != expected) {
      return constraints;
    }
    Cmp first = getComparison(binop.leftValue());
    Cmp second = getComparison(binop.rightValue());
    if (first != null && second != null) {
      constraints.addAll(translateComparison(first, negated));
      constraints.addAll(translateComparison(second, negated));
    }
    return constraints;
  }

  private static Cmp getComparison(Value value) {
    return value.isDefinedByInstruction() && value.getDefinition().isCmp()
        ? value.getDefinition().asCmp()
        : null;
  }

  /**
   * Returns the constraints that hold when the comparison evaluates to {@code !negated}, or no
   * constraints if an operand cannot be expressed.
   */
  public LinearConstraintSystem translateComparison(Cmp cmp, boolean negated) {
    LinearConstraintSystem constraints = new LinearConstraintSystem();
    Value left = cmp.leftValue();
    Value right = cmp.rightValue();
    if (options.isPointerArithmeticDisabled()
        && (!left.getType().isInt() || !right.getType().isInt())) {
      return constraints;
    }
    CmpPredicate predicate = cmp.getPredicate();
    if (predicate.isGreater()) {
      Value tmp = left;
      left = right;
      right = tmp;
      predicate = predicate.forSwappedOperands();
    }
    LinearExpression op1 = mapper.lookup(left);
    LinearExpression op2 = mapper.lookup(right);
    if (op1 == null || op2 == null) {
      return constraints;
    }
    if (predicate.isUnsigned()) {
      // The domain has no unsigned integers. Assume the operands are non-negative.
      if (op1.isVariable()) {
        constraints.add(greaterThanOrEqualTo(op1, LinearExpression.zero()));
      }
      if (op2.isVariable()) {
        constraints.add(greaterThanOrEqualTo(op2, LinearExpression.zero()));
      }
    }
    switch (predicate) {
      case EQ:
        constraints.add(negated ? notEqualTo(op1, op2) : equalTo(op1, op2));
        break;
      case NE:
        constraints.add(negated ? equalTo(op1, op2) : notEqualTo(op1, op2));
        break;
      case SLT:
      case ULT:
        constraints.add(
            negated ? greaterThanOrEqualTo(op1, op2) : lessThanOrEqualTo(op1, op2.plus(-1)));
        break;
      case SLE:
      case ULE:
        constraints.add(
            negated ? greaterThanOrEqualTo(op1, op2.plus(1)) : lessThanOrEqualTo(op1, op2));
        break;
      default:
        throw new Unreachable("Unexpected predicate " + predicate);
    }
    return constraints;
  }
}
