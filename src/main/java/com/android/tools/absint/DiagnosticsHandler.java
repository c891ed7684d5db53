// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint;

import java.io.PrintStream;

/**
 * A DiagnosticsHandler can be provided to customize handling of diagnostics information.
 *
 * <p>During translation, warnings and information diagnostics are reported to the handler. The
 * default implementation prints warnings to {@link System#err} and information to {@link
 * System#out}.
 */
public interface DiagnosticsHandler {

  /**
   * Handle warning diagnostics.
   *
   * @param warning Diagnostic containing warning information.
   */
  default void warning(Diagnostic warning) {
    System.err.print("Warning");
    printProcedure(System.err, warning);
    System.err.println(warning.getDiagnosticMessage());
  }

  /**
   * Handle info diagnostics.
   *
   * @param info Diagnostic containing the information.
   */
  default void info(Diagnostic info) {
    System.out.print("Info");
    printProcedure(System.out, info);
    System.out.println(info.getDiagnosticMessage());
  }

  private static void printProcedure(PrintStream stream, Diagnostic diagnostic) {
    if (diagnostic.getProcedureName() != null) {
      stream.print(" in ");
      stream.print(diagnostic.getProcedureName());
    }
    stream.print(": ");
  }
}
