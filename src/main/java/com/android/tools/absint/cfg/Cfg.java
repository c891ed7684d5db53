// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.cfg;

import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.memory.TrackLevel;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The analysis CFG of a single procedure.
 *
 * <p>The CFG owns all its blocks, both the translations of source blocks and the synthetic blocks
 * inserted on edges or as the unified exit. Blocks are kept in creation order, which makes the
 * printed form deterministic.
 */
public class Cfg {

  private static final String SYNTHETIC_LABEL_PREFIX = "__@bb_";

  private final String procedureName;
  private final TrackLevel trackLevel;
  private final Map<String, CfgBlock> blocks = new LinkedHashMap<>();
  private final CfgBlock entry;
  private CfgBlock exit = null;
  private FunctionDeclaration functionDeclaration = null;
  private int nextSyntheticLabel = 0;

  public Cfg(String procedureName, String entryLabel, TrackLevel trackLevel) {
    this.procedureName = procedureName;
    this.trackLevel = trackLevel;
    this.entry = createBlock(entryLabel);
  }

  public String getProcedureName() {
    return procedureName;
  }

  public TrackLevel getTrackLevel() {
    return trackLevel;
  }

  public CfgBlock entry() {
    return entry;
  }

  public CfgBlock exit() {
    if (exit == null) {
      throw new CompilationError("CFG of " + procedureName + " has no exit block");
    }
    return exit;
  }

  public void setExit(CfgBlock exit) {
    assert blocks.get(exit.getLabel()) == exit;
    this.exit = exit;
  }

  public boolean hasFunctionDeclaration() {
    return functionDeclaration != null;
  }

  public FunctionDeclaration getFunctionDeclaration() {
    return functionDeclaration;
  }

  public void setFunctionDeclaration(FunctionDeclaration functionDeclaration) {
    this.functionDeclaration = functionDeclaration;
  }

  public Collection<CfgBlock> blocks() {
    return Collections.unmodifiableCollection(blocks.values());
  }

  public int numberOfBlocks() {
    return blocks.size();
  }

  public boolean hasBlock(String label) {
    return blocks.containsKey(label);
  }

  public CfgBlock getBlock(String label) {
    CfgBlock block = blocks.get(label);
    if (block == null) {
      throw new CompilationError("No block " + label + " in CFG of " + procedureName);
    }
    return block;
  }

  public CfgBlock createBlock(String label) {
    return createBlock(label, false);
  }

  /** Creates a block that has no counterpart in the source procedure. */
  public CfgBlock createSyntheticBlock() {
    String label;
    do {
      label = SYNTHETIC_LABEL_PREFIX + nextSyntheticLabel++;
    } while (blocks.containsKey(label));
    return createBlock(label, true);
  }

  private CfgBlock createBlock(String label, boolean synthetic) {
    if (blocks.containsKey(label)) {
      throw new CompilationError("Duplicate block " + label + " in CFG of " + procedureName);
    }
    CfgBlock block = new CfgBlock(label, synthetic);
    blocks.put(label, block);
    return block;
  }

  public void addEdge(CfgBlock from, CfgBlock to) {
    assert blocks.get(from.getLabel()) == from && blocks.get(to.getLabel()) == to;
    from.link(to);
  }

  /**
   * Merges straight-line chains of blocks and removes the blocks that are unreachable from the
   * entry. The entry and the exit block are never removed.
   */
  public void simplify() {
    mergeChains();
    removeUnreachableBlocks();
  }

  private void mergeChains() {
    boolean changed = true;
    while (changed) {
      changed = false;
      for (CfgBlock block : new ArrayList<>(blocks.values())) {
        if (!blocks.containsKey(block.getLabel()) || block.getSuccessors().size() != 1) {
          continue;
        }
        CfgBlock successor = block.getSuccessors().iterator().next();
        if (successor == block || successor == entry || successor.getPredecessors().size() != 1) {
          continue;
        }
        successor.moveStatementsTo(block);
        block.unlink(successor);
        for (CfgBlock next : new ArrayList<>(successor.getSuccessors())) {
          successor.unlink(next);
          block.link(next);
        }
        if (successor == exit) {
          exit = block;
        }
        blocks.remove(successor.getLabel());
        changed = true;
      }
    }
  }

  private void removeUnreachableBlocks() {
    Set<CfgBlock> reachable = Sets.newIdentityHashSet();
    Deque<CfgBlock> worklist = new ArrayDeque<>();
    reachable.add(entry);
    worklist.add(entry);
    while (!worklist.isEmpty()) {
      for (CfgBlock successor : worklist.removeFirst().getSuccessors()) {
        if (reachable.add(successor)) {
          worklist.addLast(successor);
        }
      }
    }
    List<CfgBlock> unreachable = new ArrayList<>();
    for (CfgBlock block : blocks.values()) {
      if (!reachable.contains(block) && block != exit) {
        unreachable.add(block);
      }
    }
    for (CfgBlock block : unreachable) {
      for (CfgBlock successor : new ArrayList<>(block.getSuccessors())) {
        block.unlink(successor);
      }
      blocks.remove(block.getLabel());
    }
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    if (functionDeclaration != null) {
      builder.append(functionDeclaration).append('\n');
    } else {
      builder.append(procedureName).append('\n');
    }
    builder.append("entry: ").append(entry.getLabel());
    builder.append(", exit: ").append(exit == null ? "<none>" : exit.getLabel()).append('\n');
    for (CfgBlock block : blocks.values()) {
      builder.append(block.toDetailedString());
    }
    return builder.toString();
  }
}
