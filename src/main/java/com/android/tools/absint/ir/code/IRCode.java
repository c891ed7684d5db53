// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.code;

import com.android.tools.absint.errors.CompilationError;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The body of a procedure. The first block is the entry block. */
public class IRCode {

  private final Procedure procedure;
  private final Map<String, BasicBlock> blocks = new LinkedHashMap<>();

  IRCode(Procedure procedure) {
    this.procedure = procedure;
  }

  public Procedure procedure() {
    return procedure;
  }

  public BasicBlock entryBlock() {
    if (blocks.isEmpty()) {
      throw new CompilationError("Procedure " + procedure.getName() + " has no blocks");
    }
    return blocks.values().iterator().next();
  }

  public List<BasicBlock> blocks() {
    return Collections.unmodifiableList(new ArrayList<>(blocks.values()));
  }

  public BasicBlock getBlock(String label) {
    BasicBlock block = blocks.get(label);
    if (block == null) {
      throw new CompilationError(
          "Block " + label + " not found in procedure " + procedure.getName());
    }
    return block;
  }

  BasicBlock getOrCreateBlock(String label) {
    return blocks.computeIfAbsent(label, key -> new BasicBlock(key, this));
  }

  public List<BasicBlock> computeNormalExitBlocks() {
    List<BasicBlock> exits = new ArrayList<>();
    for (BasicBlock block : blocks.values()) {
      if (block.isReturnBlock()) {
        exits.add(block);
      }
    }
    return exits;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append("define ").append(procedure).append(" {\n");
    for (BasicBlock block : blocks.values()) {
      builder.append(block.toDetailedString());
    }
    return builder.append("}\n").toString();
  }
}
