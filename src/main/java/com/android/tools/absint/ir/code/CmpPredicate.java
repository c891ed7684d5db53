// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.errors.Unreachable;

public enum CmpPredicate {
  EQ("eq"),
  NE("ne"),
  SLT("slt"),
  SLE("sle"),
  SGT("sgt"),
  SGE("sge"),
  ULT("ult"),
  ULE("ule"),
  UGT("ugt"),
  UGE("uge");

  private final String mnemonic;

  CmpPredicate(String mnemonic) {
    this.mnemonic = mnemonic;
  }

  public String getMnemonic() {
    return mnemonic;
  }

  public boolean isUnsigned() {
    return this == ULT || this == ULE || this == UGT || this == UGE;
  }

  /** True for the predicates that are rewritten by swapping the operands, e.g., a > b to b < a. */
  public boolean isGreater() {
    return this == SGT || this == SGE || this == UGT || this == UGE;
  }

  // Returns the predicate if the operands are swapped.
  public CmpPredicate forSwappedOperands() {
    switch (this) {
      case EQ:
      case NE:
        return this;
      case SLT:
        return SGT;
      case SLE:
        return SGE;
      case SGT:
        return SLT;
      case SGE:
        return SLE;
      case ULT:
        return UGT;
      case ULE:
        return UGE;
      case UGT:
        return ULT;
      case UGE:
        return ULE;
      default:
        throw new Unreachable("Unknown predicate " + this);
    }
  }
}
