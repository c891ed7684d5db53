// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

public enum BinopType {
  ADD("add"),
  SUB("sub"),
  MUL("mul"),
  SDIV("sdiv"),
  UDIV("udiv"),
  SREM("srem"),
  UREM("urem"),
  SHL("shl"),
  ASHR("ashr"),
  LSHR("lshr"),
  AND("and"),
  OR("or"),
  XOR("xor");

  private final String mnemonic;

  BinopType(String mnemonic) {
    this.mnemonic = mnemonic;
  }

  public String getMnemonic() {
    return mnemonic;
  }
}
