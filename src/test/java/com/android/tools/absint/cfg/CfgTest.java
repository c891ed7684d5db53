// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.memory.TrackLevel;
import org.junit.Before;
import org.junit.Test;

public class CfgTest extends TestBase {

  private VariableFactory factory;
  private Cfg cfg;

  @Before
  public void setUp() {
    factory = new VariableFactory();
    cfg = new Cfg("f", "entry", TrackLevel.NONE);
  }

  @Test
  public void testSyntheticLabelsSkipExistingBlocks() {
    cfg.createBlock("__@bb_0");
    CfgBlock synthetic = cfg.createSyntheticBlock();
    assertEquals("__@bb_1", synthetic.getLabel());
    assertTrue(synthetic.isSynthetic());
    assertFalse(cfg.getBlock("__@bb_0").isSynthetic());
  }

  @Test
  public void testDuplicateBlock() {
    cfg.createBlock("b");
    assertThrows(CompilationError.class, () -> cfg.createBlock("b"));
    assertThrows(CompilationError.class, () -> cfg.getBlock("missing"));
    assertThrows(CompilationError.class, () -> cfg.exit());
  }

  @Test
  public void testSimplifyMergesChains() {
    Variable x = factory.fresh();
    CfgBlock entry = cfg.entry();
    CfgBlock middle = cfg.createBlock("middle");
    CfgBlock last = cfg.createBlock("last");
    CfgBlock dead = cfg.createBlock("dead");
    entry.assign(x, LinearExpression.constant(1));
    middle.assign(x, LinearExpression.constant(2));
    last.havoc(x);
    dead.havoc(x);
    cfg.addEdge(entry, middle);
    cfg.addEdge(middle, last);
    cfg.addEdge(dead, dead);
    cfg.setExit(last);

    cfg.simplify();

    assertEquals(1, cfg.numberOfBlocks());
    assertSame(entry, cfg.exit());
    assertThat(statements(entry), contains("@V_0 = 1", "@V_0 = 2", "havoc(@V_0)"));
    assertFalse(cfg.hasBlock("dead"));
  }

  @Test
  public void testSimplifyKeepsJoins() {
    CfgBlock entry = cfg.entry();
    CfgBlock left = cfg.createBlock("left");
    CfgBlock right = cfg.createBlock("right");
    CfgBlock join = cfg.createBlock("join");
    cfg.addEdge(entry, left);
    cfg.addEdge(entry, right);
    cfg.addEdge(left, join);
    cfg.addEdge(right, join);
    cfg.setExit(join);

    cfg.simplify();

    assertEquals(4, cfg.numberOfBlocks());
    assertSame(join, cfg.exit());
  }

  @Test
  public void testSimplifyKeepsUnreachableExit() {
    CfgBlock exit = cfg.createSyntheticBlock();
    cfg.entry().unreachable();
    cfg.setExit(exit);

    cfg.simplify();

    assertTrue(cfg.hasBlock(exit.getLabel()));
    assertSame(exit, cfg.exit());
  }

  @Test
  public void testSimplifyFoldsLoopIntoEntry() {
    CfgBlock entry = cfg.entry();
    CfgBlock loop = cfg.createBlock("loop");
    cfg.addEdge(entry, loop);
    cfg.addEdge(loop, entry);
    cfg.setExit(loop);

    cfg.simplify();

    assertEquals(1, cfg.numberOfBlocks());
    assertSame(entry, cfg.exit());
    assertThat(entry.getSuccessors(), contains(entry));
  }

  @Test
  public void testToString() {
    Variable x = factory.fresh();
    CfgBlock exit = cfg.createBlock("exit");
    cfg.entry().havoc(x);
    cfg.addEdge(cfg.entry(), exit);
    cfg.setExit(exit);
    assertEquals(
        "f\nentry: entry, exit: exit\nentry:\n  havoc(@V_0);\n  goto exit;\nexit:\n",
        cfg.toString());
  }
}
