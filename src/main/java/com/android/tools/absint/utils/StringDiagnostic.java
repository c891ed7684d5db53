// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.utils;

import com.android.tools.absint.Diagnostic;

public class StringDiagnostic implements Diagnostic {

  private final String procedureName;
  private final String message;

  public StringDiagnostic(String message) {
    this(message, null);
  }

  public StringDiagnostic(String message, String procedureName) {
    this.procedureName = procedureName;
    this.message = message;
  }

  @Override
  public String getProcedureName() {
    return procedureName;
  }

  @Override
  public String getDiagnosticMessage() {
    return message;
  }

  @Override
  public String toString() {
    return procedureName == null ? message : procedureName + ": " + message;
  }
}
