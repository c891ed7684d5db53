// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import com.android.tools.absint.TestBase;
import org.junit.Test;

public class ReporterTest extends TestBase {

  @Test
  public void testForwarding() {
    TestDiagnosticMessages diagnostics = new TestDiagnosticMessages();
    Reporter reporter = new Reporter(diagnostics);
    reporter.info("cfg");
    reporter.warning(new StringDiagnostic("shift out of range", "f"));
    reporter.warning("plain");
    assertEquals(2, reporter.getWarningCount());
    assertEquals(1, diagnostics.getInfos().size());
    assertEquals("cfg", diagnostics.getInfos().get(0).getDiagnosticMessage());
    assertNull(diagnostics.getInfos().get(0).getProcedureName());
    assertEquals("f", diagnostics.getWarnings().get(0).getProcedureName());
    assertEquals("plain", diagnostics.getWarnings().get(1).getDiagnosticMessage());
  }
}
