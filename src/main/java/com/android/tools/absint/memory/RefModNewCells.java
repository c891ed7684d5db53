// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.memory;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * The array cells read, modified and created by a procedure, or by the callee of a call. The
 * order of the ids within each list is stable and shared by the procedure and all its call sites.
 */
public class RefModNewCells {

  private static final RefModNewCells EMPTY =
      new RefModNewCells(IntLists.emptyList(), IntLists.emptyList(), IntLists.emptyList());

  private final IntList refs;
  private final IntList mods;
  private final IntList news;

  public RefModNewCells(IntList refs, IntList mods, IntList news) {
    this.refs = IntLists.unmodifiable(new IntArrayList(refs));
    this.mods = IntLists.unmodifiable(new IntArrayList(mods));
    this.news = IntLists.unmodifiable(new IntArrayList(news));
  }

  public static RefModNewCells empty() {
    return EMPTY;
  }

  public IntList getRefs() {
    return refs;
  }

  public IntList getMods() {
    return mods;
  }

  public IntList getNews() {
    return news;
  }

  public boolean isEmpty() {
    return refs.isEmpty() && mods.isEmpty() && news.isEmpty();
  }

  @Override
  public String toString() {
    return "ref=" + refs + " mod=" + mods + " new=" + news;
  }
}
