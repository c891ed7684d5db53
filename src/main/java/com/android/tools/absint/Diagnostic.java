// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint;

/** Interface for all diagnostic messages reported while building analysis CFGs. */
public interface Diagnostic {

  /** Name of the procedure being translated when the diagnostic was raised, if any. */
  default String getProcedureName() {
    return null;
  }

  /** Diagnostic message. */
  String getDiagnosticMessage();
}
