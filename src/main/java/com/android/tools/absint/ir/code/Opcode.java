// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

/**
 * The closed set of instruction kinds. Consumers switch over this enum exhaustively (with switch
 * expressions), so that a new kind fails compilation until every consumer handles it.
 */
public enum Opcode {
  BINOP,
  CMP,
  CAST,
  GET_ELEMENT_PTR,
  LOAD,
  STORE,
  ALLOCA,
  SELECT,
  INVOKE,
  RETURN,
  IF,
  GOTO,
  SWITCH,
  UNREACHABLE,
  // Any instruction without a dedicated kind, e.g., floating point arithmetic.
  OPAQUE
}
