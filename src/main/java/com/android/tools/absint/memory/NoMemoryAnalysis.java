// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.memory;

import com.android.tools.absint.ir.code.Invoke;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Value;

/** Memory analysis for translations that only track integer registers. */
public class NoMemoryAnalysis implements MemoryAnalysis {

  private static final NoMemoryAnalysis INSTANCE = new NoMemoryAnalysis();

  private NoMemoryAnalysis() {}

  public static NoMemoryAnalysis getInstance() {
    return INSTANCE;
  }

  @Override
  public TrackLevel getTrackLevel() {
    return TrackLevel.NONE;
  }

  @Override
  public int getArrayId(Procedure procedure, Value pointer) {
    return -1;
  }

  @Override
  public Value getSingleton(int arrayId) {
    return null;
  }

  @Override
  public RefModNewCells getRefModNewCells(Invoke invoke) {
    return RefModNewCells.empty();
  }

  @Override
  public RefModNewCells getRefModNewCells(Procedure procedure) {
    return RefModNewCells.empty();
  }
}
