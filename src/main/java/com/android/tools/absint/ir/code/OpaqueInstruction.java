// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import java.util.List;

/**
 * An instruction the translator has no dedicated rule for, e.g., floating point arithmetic or
 * aggregate manipulation. Its result, if any, is treated as unknown.
 */
public class OpaqueInstruction extends Instruction {

  private final String mnemonic;

  public OpaqueInstruction(String mnemonic, Value outValue, List<Value> operands) {
    super(outValue, operands);
    this.mnemonic = mnemonic;
  }

  @Override
  public Opcode opcode() {
    return Opcode.OPAQUE;
  }

  @Override
  public String getMnemonic() {
    return mnemonic;
  }
}
