// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.type;

import com.android.tools.absint.errors.Unreachable;
import com.google.common.math.LongMath;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target data layout: sizes, alignments and struct field offsets, all in bytes.
 *
 * <p>Scalars are naturally aligned (to the next power of two of their store size, at most
 * {@link #MAX_SCALAR_ALIGNMENT}). Structs are laid out without packing.
 */
public class DataLayout {

  private static final long MAX_SCALAR_ALIGNMENT = 8;

  private final int pointerSizeInBits;
  private final Map<StructTypeElement, long[]> structLayouts = new ConcurrentHashMap<>();

  public DataLayout(int pointerSizeInBits) {
    assert pointerSizeInBits > 0 && pointerSizeInBits % 8 == 0;
    this.pointerSizeInBits = pointerSizeInBits;
  }

  public static DataLayout createDefault() {
    return new DataLayout(64);
  }

  public int getPointerSizeInBits() {
    return pointerSizeInBits;
  }

  /** Number of bytes written by a store of the given type. */
  public long getTypeStoreSize(TypeElement type) {
    if (type.isInt()) {
      return (type.asInt().getBits() + 7) / 8;
    }
    if (type.isPointer()) {
      return pointerSizeInBits / 8;
    }
    if (type.isFloat()) {
      return ((FloatTypeElement) type).getBits() / 8;
    }
    if (type.isArray()) {
      ArrayTypeElement arrayType = type.asArray();
      return arrayType.getLength() * getTypeAllocSize(arrayType.getElementType());
    }
    if (type.isStruct()) {
      long[] layout = getStructLayout(type.asStruct());
      return layout[layout.length - 1];
    }
    if (type.isVoid()) {
      return 0;
    }
    throw new Unreachable("Unexpected type " + type);
  }

  /** Offset between consecutive elements of the given type in memory, including padding. */
  public long getTypeAllocSize(TypeElement type) {
    return alignTo(getTypeStoreSize(type), getAlignment(type));
  }

  public long getAlignment(TypeElement type) {
    if (type.isArray()) {
      return getAlignment(type.asArray().getElementType());
    }
    if (type.isStruct()) {
      long alignment = 1;
      for (TypeElement field : type.asStruct().getFields()) {
        alignment = Math.max(alignment, getAlignment(field));
      }
      return alignment;
    }
    long storeSize = getTypeStoreSize(type);
    if (storeSize <= 1) {
      return 1;
    }
    return Math.min(LongMath.ceilingPowerOfTwo(storeSize), MAX_SCALAR_ALIGNMENT);
  }

  public long getFieldOffset(StructTypeElement type, int field) {
    if (field < 0 || field >= type.getNumberOfFields()) {
      throw new Unreachable("Field index " + field + " out of bounds for " + type);
    }
    return getStructLayout(type)[field];
  }

  // The layout holds the offset of each field followed by the size of the struct.
  private long[] getStructLayout(StructTypeElement type) {
    long[] layout = structLayouts.get(type);
    if (layout == null) {
      layout = computeStructLayout(type);
      structLayouts.put(type, layout);
    }
    return layout;
  }

  private long[] computeStructLayout(StructTypeElement type) {
    long[] layout = new long[type.getNumberOfFields() + 1];
    long offset = 0;
    for (int i = 0; i < type.getNumberOfFields(); i++) {
      TypeElement field = type.getField(i);
      offset = alignTo(offset, getAlignment(field));
      layout[i] = offset;
      offset += getTypeAllocSize(field);
    }
    layout[type.getNumberOfFields()] = alignTo(offset, getAlignment(type));
    return layout;
  }

  private static long alignTo(long value, long alignment) {
    return (value + alignment - 1) / alignment * alignment;
  }
}
