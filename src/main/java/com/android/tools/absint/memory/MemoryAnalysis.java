// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.memory;

import com.android.tools.absint.ir.code.Invoke;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Value;

/**
 * Points-to oracle that partitions memory into array cells.
 *
 * <p>All accesses through the same cell are assumed to be of the same type and aligned. Queries
 * may come from translations running on different threads.
 */
public interface MemoryAnalysis {

  TrackLevel getTrackLevel();

  /** Returns the id of the cell the pointer points into, or a negative number if unknown. */
  int getArrayId(Procedure procedure, Value pointer);

  /** Returns the only object represented by the cell, or null if the cell is not a singleton. */
  Value getSingleton(int arrayId);

  RefModNewCells getRefModNewCells(Invoke invoke);

  RefModNewCells getRefModNewCells(Procedure procedure);
}
