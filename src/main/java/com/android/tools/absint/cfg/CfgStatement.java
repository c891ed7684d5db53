// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

/** A statement of the analysis CFG. */
public abstract class CfgStatement {

  public boolean isAssign() {
    return false;
  }

  public CfgAssign asAssign() {
    return null;
  }

  public boolean isHavoc() {
    return false;
  }

  public CfgHavoc asHavoc() {
    return null;
  }

  public boolean isAssume() {
    return false;
  }

  public CfgAssume asAssume() {
    return null;
  }

  public boolean isBinop() {
    return false;
  }

  public CfgBinop asBinop() {
    return null;
  }

  public boolean isSelect() {
    return false;
  }

  public CfgSelect asSelect() {
    return null;
  }

  public boolean isArrayLoad() {
    return false;
  }

  public CfgArrayLoad asArrayLoad() {
    return null;
  }

  public boolean isArrayStore() {
    return false;
  }

  public CfgArrayStore asArrayStore() {
    return null;
  }

  public boolean isArrayInit() {
    return false;
  }

  public CfgArrayInit asArrayInit() {
    return null;
  }

  public boolean isAssumeArray() {
    return false;
  }

  public CfgAssumeArray asAssumeArray() {
    return null;
  }

  public boolean isCallSite() {
    return false;
  }

  public CfgCallSite asCallSite() {
    return null;
  }

  public boolean isReturn() {
    return false;
  }

  public CfgReturn asReturn() {
    return null;
  }

  public boolean isUnreachable() {
    return false;
  }

  @Override
  public abstract String toString();
}
