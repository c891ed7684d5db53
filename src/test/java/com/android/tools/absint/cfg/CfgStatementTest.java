// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import static com.android.tools.absint.cfg.linear.LinearConstraint.lessThanOrEqualTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.cfg.CfgBinop.Operation;
import com.android.tools.absint.cfg.linear.LinearConstraint;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.memory.TrackLevel;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class CfgStatementTest extends TestBase {

  private CfgBlock block;
  private Variable x;
  private Variable y;
  private Variable array;

  @Before
  public void setUp() {
    VariableFactory factory = new VariableFactory();
    x = factory.fresh();
    y = factory.fresh();
    array = factory.getCell(1);
    block = new Cfg("f", "entry", TrackLevel.ARRAY).entry();
  }

  private CfgStatement last() {
    List<CfgStatement> statements = block.getStatements();
    return statements.get(statements.size() - 1);
  }

  @Test
  public void testScalarStatements() {
    block.assign(x, LinearExpression.of(y).plus(1));
    CfgStatement assign = last();
    assertTrue(assign.isAssign());
    assertFalse(assign.isHavoc());
    assertSame(x, assign.asAssign().getLhs());
    assertEquals(LinearExpression.of(y).plus(1), assign.asAssign().getRhs());
    assertNull(assign.asHavoc());

    block.havoc(y);
    assertTrue(last().isHavoc());
    assertSame(y, last().asHavoc().getVariable());

    block.binop(Operation.SREM, x, LinearExpression.of(y), LinearExpression.constant(3));
    CfgBinop binop = last().asBinop();
    assertEquals(Operation.SREM, binop.getOperation());
    assertEquals(LinearExpression.of(y), binop.getLeft());
    assertEquals(LinearExpression.constant(3), binop.getRight());
  }

  @Test
  public void testConstraintStatements() {
    LinearConstraint constraint =
        lessThanOrEqualTo(LinearExpression.of(x), LinearExpression.constant(10));
    block.assume(constraint);
    CfgStatement assume = last();
    assertTrue(assume.isAssume());
    assertEquals(
        LinearExpression.of(x).plus(-10), assume.asAssume().getConstraint().getExpression());

    block.select(y, constraint, LinearExpression.of(x), LinearExpression.zero());
    CfgStatement select = last();
    assertTrue(select.isSelect());
    assertSame(constraint, select.asSelect().getCondition());
    assertEquals(LinearExpression.of(x), select.asSelect().getTrueValue());
    assertEquals(LinearExpression.zero(), select.asSelect().getFalseValue());

    block.unreachable();
    assertTrue(last().isUnreachable());
    assertFalse(select.isUnreachable());
  }

  @Test
  public void testArrayStatements() {
    block.arrayLoad(x, array, LinearExpression.of(y), 4);
    CfgStatement load = last();
    assertTrue(load.isArrayLoad());
    assertFalse(load.isArrayStore());
    assertSame(array, load.asArrayLoad().getArray());
    assertEquals(LinearExpression.of(y), load.asArrayLoad().getIndex());
    assertEquals(4, load.asArrayLoad().getElementSize());

    block.arrayStore(array, LinearExpression.of(y), LinearExpression.constant(7), 8);
    CfgStatement store = last();
    assertTrue(store.isArrayStore());
    assertSame(array, store.asArrayStore().getArray());
    assertEquals(LinearExpression.of(y), store.asArrayStore().getIndex());
    assertEquals(LinearExpression.constant(7), store.asArrayStore().getValue());
    assertEquals(8, store.asArrayStore().getElementSize());

    block.add(new CfgArrayInit(array, ImmutableList.of(BigInteger.ONE, BigInteger.TEN)));
    CfgStatement init = last();
    assertTrue(init.isArrayInit());
    assertSame(array, init.asArrayInit().getArray());
    assertThat(init.asArrayInit().getValues(), contains(BigInteger.ONE, BigInteger.TEN));
    assertNull(init.asArrayLoad());

    block.assumeArray(array, BigInteger.ZERO);
    CfgStatement assumeArray = last();
    assertTrue(assumeArray.isAssumeArray());
    assertFalse(init.isAssumeArray());
    assertSame(array, assumeArray.asAssumeArray().getArray());
    assertEquals(BigInteger.ZERO, assumeArray.asAssumeArray().getValue());
    assertNull(assumeArray.asArrayInit());
    assertNull(assumeArray.asArrayStore());
    assertNull(assumeArray.asAssign());
    assertNull(assumeArray.asAssume());
  }
}
