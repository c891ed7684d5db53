// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.errors.Unreachable;
import com.android.tools.absint.ir.code.ConstantInt;
import com.android.tools.absint.ir.code.ConstantNull;
import com.android.tools.absint.ir.code.Undef;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.FloatTypeElement;
import com.android.tools.absint.ir.type.IntTypeElement;
import com.android.tools.absint.ir.type.PointerTypeElement;
import com.android.tools.absint.memory.NoMemoryAnalysis;
import com.android.tools.absint.memory.TestMemoryAnalysis;
import org.junit.Test;

public class SymbolMapperTest extends TestBase {

  private static final PointerTypeElement POINTER = PointerTypeElement.to(IntTypeElement.I8);

  private static SymbolMapper createMapper(boolean trackMemory) {
    return new SymbolMapper(
        new VariableFactory(),
        trackMemory ? new TestMemoryAnalysis() : NoMemoryAnalysis.getInstance(),
        defaultOptions());
  }

  @Test
  public void testTracking() {
    SymbolMapper mapper = createMapper(false);
    assertTrue(mapper.isTracked(new Value("x", IntTypeElement.I1)));
    assertTrue(mapper.isTracked(new Value("x", IntTypeElement.I64)));
    assertFalse(mapper.isTracked(new Value("p", POINTER)));
    assertFalse(mapper.isTracked(new Value("f", FloatTypeElement.DOUBLE)));
    assertFalse(mapper.isTracked(new Value("shadow.mem.0", IntTypeElement.I32)));
    assertTrue(createMapper(true).isTracked(new Value("p", POINTER)));
  }

  @Test
  public void testSymVar() {
    SymbolMapper mapper = createMapper(false);
    Value value = new Value("x", IntTypeElement.I32);
    assertSame(mapper.symVar(value), mapper.symVar(value));
    assertEquals("x", mapper.symVar(value).getName());
    assertEquals("@A_7", mapper.symVar(7).getName());
    assertThrows(Unreachable.class, () -> mapper.symVar(new Value("p", POINTER)));
  }

  @Test
  public void testLookup() {
    SymbolMapper mapper = createMapper(false);
    Value value = new Value("x", IntTypeElement.I32);
    assertEquals(LinearExpression.of(mapper.symVar(value)), mapper.lookup(value));
    assertEquals(
        LinearExpression.constant(-7), mapper.lookup(ConstantInt.of(IntTypeElement.I32, -7)));
    assertNull(mapper.lookup(new Undef(IntTypeElement.I32)));
    assertNull(mapper.lookup(new Value("p", POINTER)));
    assertNull(mapper.lookup(new Value("d", FloatTypeElement.DOUBLE)));
  }

  @Test
  public void testNullPointer() {
    ConstantNull nullPointer = new ConstantNull(POINTER);
    assertNull(createMapper(false).lookup(nullPointer));
    assertEquals(LinearExpression.zero(), createMapper(true).lookup(nullPointer));
  }
}
