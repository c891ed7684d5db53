// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

/** Marks the block as not executable. */
public class CfgUnreachable extends CfgStatement {

  @Override
  public boolean isUnreachable() {
    return true;
  }

  @Override
  public String toString() {
    return "unreachable";
  }
}
