// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.ir.type.IntTypeElement;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Static initial value of a {@link GlobalVariable}. */
public abstract class GlobalInitializer {

  public static GlobalInitializer zeroAggregate() {
    return ZeroAggregateInitializer.INSTANCE;
  }

  public static GlobalInitializer scalar(long value) {
    return new ScalarInitializer(BigInteger.valueOf(value));
  }

  public static GlobalInitializer dataSequence(IntTypeElement elementType, long... values) {
    ImmutableList.Builder<BigInteger> builder = ImmutableList.builder();
    for (long value : values) {
      builder.add(BigInteger.valueOf(value));
    }
    return new DataSequenceInitializer(elementType, builder.build());
  }

  public static GlobalInitializer aliasOf(GlobalVariable aliasee) {
    return new AliasInitializer(aliasee);
  }

  public boolean isZeroAggregate() {
    return false;
  }

  public boolean isScalar() {
    return false;
  }

  public boolean isDataSequence() {
    return false;
  }

  public DataSequenceInitializer asDataSequence() {
    return null;
  }

  public boolean isAlias() {
    return false;
  }

  public AliasInitializer asAlias() {
    return null;
  }

  /** A struct or array with all elements initialized to zero. */
  public static class ZeroAggregateInitializer extends GlobalInitializer {

    private static final ZeroAggregateInitializer INSTANCE = new ZeroAggregateInitializer();

    private ZeroAggregateInitializer() {}

    @Override
    public boolean isZeroAggregate() {
      return true;
    }

    @Override
    public String toString() {
      return "zeroinitializer";
    }
  }

  public static class ScalarInitializer extends GlobalInitializer {

    private final BigInteger value;

    ScalarInitializer(BigInteger value) {
      this.value = value;
    }

    public BigInteger getValue() {
      return value;
    }

    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /** A constant array of integers. */
  public static class DataSequenceInitializer extends GlobalInitializer {

    private final IntTypeElement elementType;
    private final List<BigInteger> elements;

    DataSequenceInitializer(IntTypeElement elementType, List<BigInteger> elements) {
      this.elementType = elementType;
      this.elements = elements;
    }

    public IntTypeElement getElementType() {
      return elementType;
    }

    public List<BigInteger> getElements() {
      return elements;
    }

    @Override
    public boolean isDataSequence() {
      return true;
    }

    @Override
    public DataSequenceInitializer asDataSequence() {
      return this;
    }

    @Override
    public String toString() {
      return elementType + " " + elements;
    }
  }

  /** The global shares the initial value of another global. */
  public static class AliasInitializer extends GlobalInitializer {

    private final GlobalVariable aliasee;

    AliasInitializer(GlobalVariable aliasee) {
      this.aliasee = aliasee;
    }

    public GlobalVariable getAliasee() {
      return aliasee;
    }

    @Override
    public boolean isAlias() {
      return true;
    }

    @Override
    public AliasInitializer asAlias() {
      return this;
    }

    @Override
    public String toString() {
      return "alias " + aliasee;
    }
  }
}
