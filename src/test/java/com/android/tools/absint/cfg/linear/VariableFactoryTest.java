// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.IntTypeElement;
import com.android.tools.absint.utils.ThreadUtils;
import com.android.tools.absint.utils.ThreadUtils.WorkLoad;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.Test;

public class VariableFactoryTest extends TestBase {

  @Test
  public void testSameValueSameVariable() {
    VariableFactory factory = new VariableFactory();
    Value value = new Value("x", IntTypeElement.I32);
    assertSame(factory.get(value), factory.get(value));
    assertEquals("x", factory.get(value).getName());
    assertEquals(1, factory.size());
  }

  @Test
  public void testNameClashesAreSuffixed() {
    VariableFactory factory = new VariableFactory();
    Variable first = factory.get(new Value("x", IntTypeElement.I32));
    Variable second = factory.get(new Value("x", IntTypeElement.I32));
    Variable third = factory.get(new Value("x", IntTypeElement.I64));
    assertNotSame(first, second);
    assertEquals("x", first.getName());
    assertEquals("x.1", second.getName());
    assertEquals("x.2", third.getName());
  }

  @Test
  public void testTemporariesAndCells() {
    VariableFactory factory = new VariableFactory();
    assertEquals("@V_0", factory.fresh().getName());
    assertEquals("@V_1", factory.get(new Value(null, IntTypeElement.I32)).getName());
    assertEquals("@A_3", factory.getCell(3).getName());
    assertSame(factory.getCell(3), factory.getCell(3));
    // A value may be named like a temporary.
    assertEquals("@V_0.1", factory.get(new Value("@V_0", IntTypeElement.I32)).getName());
  }

  @Test
  public void testIdsFollowCreationOrder() {
    VariableFactory factory = new VariableFactory();
    Variable b = factory.get(new Value("b", IntTypeElement.I32));
    Variable a = factory.get(new Value("a", IntTypeElement.I32));
    assertEquals(-1, Integer.signum(b.compareTo(a)));
  }

  @Test
  public void testConcurrentMinting() throws Exception {
    VariableFactory factory = new VariableFactory();
    List<Integer> items = IntStream.range(0, 1000).boxed().collect(Collectors.toList());
    ExecutorService executorService = Executors.newFixedThreadPool(4);
    try {
      List<Variable> variables =
          ThreadUtils.processItemsWithResults(
              items,
              i -> i % 2 == 0 ? factory.fresh() : factory.get(new Value("v", IntTypeElement.I32)),
              executorService,
              WorkLoad.LIGHT);
      Set<String> names = new HashSet<>();
      Set<Integer> ids = new HashSet<>();
      for (Variable variable : variables) {
        names.add(variable.getName());
        ids.add(variable.getId());
      }
      assertEquals(1000, names.size());
      assertEquals(1000, ids.size());
      assertEquals(999, (int) Collections.max(ids));
    } finally {
      executorService.shutdown();
    }
  }
}
