// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.utils;

import com.android.tools.absint.Diagnostic;
import com.android.tools.absint.DiagnosticsHandler;

/**
 * Forwards diagnostics to the client supplied {@link DiagnosticsHandler}.
 *
 * <p>The reporter may be shared by translations running on different threads, so all forwarding
 * is synchronized on the reporter.
 */
public class Reporter {

  private final DiagnosticsHandler clientHandler;
  private int warningCount = 0;

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  public synchronized void info(Diagnostic diagnostic) {
    clientHandler.info(diagnostic);
  }

  public void info(String message) {
    info(new StringDiagnostic(message));
  }

  public synchronized void warning(Diagnostic diagnostic) {
    warningCount++;
    clientHandler.warning(diagnostic);
  }

  public void warning(String message) {
    warning(new StringDiagnostic(message));
  }

  public synchronized int getWarningCount() {
    return warningCount;
  }
}
