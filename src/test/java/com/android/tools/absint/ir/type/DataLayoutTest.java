// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.errors.Unreachable;
import org.junit.Test;

public class DataLayoutTest extends TestBase {

  private final DataLayout dataLayout = DataLayout.createDefault();

  @Test
  public void testScalars() {
    assertEquals(64, dataLayout.getPointerSizeInBits());
    assertEquals(1, dataLayout.getTypeStoreSize(IntTypeElement.I1));
    assertEquals(1, dataLayout.getTypeStoreSize(IntTypeElement.I8));
    assertEquals(4, dataLayout.getTypeStoreSize(IntTypeElement.I32));
    assertEquals(8, dataLayout.getTypeAllocSize(IntTypeElement.I64));
    assertEquals(8, dataLayout.getTypeStoreSize(PointerTypeElement.to(IntTypeElement.I8)));
    assertEquals(
        4, new DataLayout(32).getTypeStoreSize(PointerTypeElement.to(IntTypeElement.I8)));
  }

  @Test
  public void testStoreAndAllocSizesDiffer() {
    IntTypeElement i24 = IntTypeElement.get(24);
    assertEquals(3, dataLayout.getTypeStoreSize(i24));
    assertEquals(4, dataLayout.getTypeAllocSize(i24));
    assertEquals(12, dataLayout.getTypeStoreSize(ArrayTypeElement.of(i24, 3)));
  }

  @Test
  public void testStructLayout() {
    StructTypeElement struct =
        StructTypeElement.of(IntTypeElement.I8, IntTypeElement.I32, IntTypeElement.I8);
    assertEquals(0, dataLayout.getFieldOffset(struct, 0));
    assertEquals(4, dataLayout.getFieldOffset(struct, 1));
    assertEquals(8, dataLayout.getFieldOffset(struct, 2));
    assertEquals(12, dataLayout.getTypeAllocSize(struct));
    assertEquals(4, dataLayout.getAlignment(struct));
    assertEquals(24, dataLayout.getTypeAllocSize(ArrayTypeElement.of(struct, 2)));
  }

  @Test
  public void testNestedStruct() {
    StructTypeElement inner = StructTypeElement.of(IntTypeElement.I8, IntTypeElement.I64);
    StructTypeElement outer = StructTypeElement.of(IntTypeElement.I8, inner);
    assertEquals(16, dataLayout.getTypeAllocSize(inner));
    assertEquals(8, dataLayout.getFieldOffset(outer, 1));
    assertEquals(24, dataLayout.getTypeAllocSize(outer));
  }

  @Test
  public void testFieldOutOfBounds() {
    StructTypeElement struct = StructTypeElement.of(IntTypeElement.I32);
    assertThrows(Unreachable.class, () -> dataLayout.getFieldOffset(struct, 1));
  }
}
