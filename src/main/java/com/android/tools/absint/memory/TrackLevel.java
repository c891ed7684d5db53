// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.memory;

/** How much of the program state is translated. */
public enum TrackLevel {
  /** Only integer registers. */
  NONE,
  /** Integer registers, pointers and memory through array cells. */
  ARRAY;

  public boolean tracksMemory() {
    return this == ARRAY;
  }
}
