// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.errors;

/**
 * Raised when the input procedure violates a structural invariant of the IR, e.g., a branch to a
 * block that is not part of the procedure or a phi without an operand for one of its
 * predecessors.
 *
 * <p>Translation of the procedure is aborted. Representation gaps (values that cannot be expressed
 * linearly, unmodelable memory) are never reported through this exception.
 */
public class CompilationError extends RuntimeException {

  public CompilationError(String message) {
    super(message);
  }

  public CompilationError(String message, Throwable cause) {
    super(message, cause);
  }
}
