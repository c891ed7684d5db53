// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.errors;

/** Thrown when a state is reached that the translator guarantees cannot happen. */
public class Unreachable extends RuntimeException {

  public Unreachable() {}

  public Unreachable(String message) {
    super(message);
  }

  public Unreachable(Throwable cause) {
    super(cause);
  }
}
