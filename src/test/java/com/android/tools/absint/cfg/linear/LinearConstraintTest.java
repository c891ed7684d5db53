// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import static com.android.tools.absint.cfg.linear.LinearConstraint.equalTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.greaterThan;
import static com.android.tools.absint.cfg.linear.LinearConstraint.greaterThanOrEqualTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.lessThan;
import static com.android.tools.absint.cfg.linear.LinearConstraint.lessThanOrEqualTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.notEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.cfg.linear.LinearConstraint.Kind;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.IntTypeElement;
import org.junit.Before;
import org.junit.Test;

public class LinearConstraintTest extends TestBase {

  private LinearExpression x;
  private LinearExpression y;

  @Before
  public void setUp() {
    VariableFactory factory = new VariableFactory();
    x = LinearExpression.of(factory.get(new Value("x", IntTypeElement.I32)));
    y = LinearExpression.of(factory.get(new Value("y", IntTypeElement.I32)));
  }

  @Test
  public void testStrictInequalitiesAreShifted() {
    LinearConstraint constraint = lessThan(x, y);
    assertEquals(Kind.LESS_THAN_OR_EQUALS, constraint.getKind());
    assertEquals("x - y <= -1", constraint.toString());
    assertEquals("-x + y <= -1", greaterThan(x, y).toString());
    assertEquals("-x + y <= 0", greaterThanOrEqualTo(x, y).toString());
    assertEquals("x - y <= 0", lessThanOrEqualTo(x, y).toString());
  }

  @Test
  public void testConstantIsPrintedOnTheRight() {
    assertEquals("x = 3", equalTo(x, LinearExpression.constant(3)).toString());
    assertEquals("x != -2", notEqualTo(x, LinearExpression.constant(-2)).toString());
    assertEquals("-x <= 0", greaterThanOrEqualTo(x, LinearExpression.zero()).toString());
  }

  @Test
  public void testNegate() {
    assertEquals("-x + y <= 0", lessThan(x, y).negate().toString());
    assertEquals(lessThan(x, y), lessThan(x, y).negate().negate());
    assertEquals(notEqualTo(x, y), equalTo(x, y).negate());
    assertEquals(equalTo(x, y), notEqualTo(x, y).negate());
  }

  @Test
  public void testConstantConstraints() {
    LinearExpression two = LinearExpression.constant(2);
    LinearExpression three = LinearExpression.constant(3);
    assertTrue(equalTo(two, two).isTautology());
    assertTrue(notEqualTo(two, two).isContradiction());
    assertTrue(lessThanOrEqualTo(two, three).isTautology());
    assertTrue(lessThanOrEqualTo(three, two).isContradiction());
    assertTrue(lessThan(two, two).isContradiction());
    assertFalse(lessThan(x, two).isTautology());
    assertFalse(lessThan(x, two).isContradiction());
  }

  @Test
  public void testSystemToString() {
    LinearConstraintSystem system =
        new LinearConstraintSystem().add(lessThan(x, y)).add(equalTo(y, LinearExpression.zero()));
    assertEquals(2, system.size());
    assertEquals("{x - y <= -1; y = 0}", system.toString());
  }
}
