// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

public enum CastType {
  ZEXT("zext"),
  SEXT("sext"),
  TRUNC("trunc"),
  PTR_TO_INT("ptrtoint"),
  INT_TO_PTR("inttoptr"),
  BITCAST("bitcast"),
  FP_TO_SI("fptosi"),
  FP_TO_UI("fptoui"),
  SI_TO_FP("sitofp"),
  UI_TO_FP("uitofp"),
  FP_EXT("fpext"),
  FP_TRUNC("fptrunc");

  private final String mnemonic;

  CastType(String mnemonic) {
    this.mnemonic = mnemonic;
  }

  public String getMnemonic() {
    return mnemonic;
  }

  public boolean isIntegerExtension() {
    return this == ZEXT || this == SEXT;
  }
}
