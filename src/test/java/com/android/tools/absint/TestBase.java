// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint;

import static org.junit.Assert.assertEquals;

import com.android.tools.absint.cfg.Cfg;
import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.CfgStatement;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Program;
import com.android.tools.absint.ir.conversion.CfgBuilder;
import com.android.tools.absint.ir.conversion.CfgBuilderOptions;
import com.android.tools.absint.ir.type.DataLayout;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.memory.NoMemoryAnalysis;
import com.android.tools.absint.utils.Reporter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

public abstract class TestBase {

  public static Program createProgram() {
    return new Program(DataLayout.createDefault());
  }

  /** Options with every flag set explicitly, so that system properties do not leak in. */
  public static CfgBuilderOptions defaultOptions() {
    return new CfgBuilderOptions()
        .setEnableSimplify(false)
        .setEnablePrint(false)
        .setDisablePointerArithmetic(false)
        .setIncludeHavoc(true)
        .setEnableInterprocedural(false)
        .setEntryPointName(null);
  }

  public static Cfg buildCfg(Procedure procedure) {
    return buildCfg(procedure, NoMemoryAnalysis.getInstance(), defaultOptions());
  }

  public static Cfg buildCfg(
      Procedure procedure, MemoryAnalysis memoryAnalysis, CfgBuilderOptions options) {
    return buildCfg(
        procedure, memoryAnalysis, options, new Reporter(new TestDiagnosticMessages()));
  }

  public static Cfg buildCfg(
      Procedure procedure,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options,
      Reporter reporter) {
    return new CfgBuilder(procedure, new VariableFactory(), memoryAnalysis, options, reporter)
        .build();
  }

  public static List<String> statements(CfgBlock block) {
    List<String> result = new ArrayList<>();
    for (CfgStatement statement : block.getStatements()) {
      result.add(statement.toString());
    }
    return result;
  }

  /** Returns the synthetic block on the edge between the two blocks of the source procedure. */
  public static CfgBlock edgeBlock(Cfg cfg, String from, String to) {
    List<CfgBlock> edges = edgeBlocks(cfg, from, to);
    assertEquals("Edges from " + from + " to " + to, 1, edges.size());
    return edges.get(0);
  }

  public static List<CfgBlock> edgeBlocks(Cfg cfg, String from, String to) {
    CfgBlock target = cfg.getBlock(to);
    ImmutableList.Builder<CfgBlock> edges = ImmutableList.builder();
    for (CfgBlock successor : cfg.getBlock(from).getSuccessors()) {
      if (successor.isSynthetic() && successor.getSuccessors().contains(target)) {
        edges.add(successor);
      }
    }
    return edges.build();
  }

  /** Collects the diagnostics instead of printing them. */
  public static class TestDiagnosticMessages implements DiagnosticsHandler {

    private final List<Diagnostic> infos = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();

    @Override
    public synchronized void info(Diagnostic info) {
      infos.add(info);
    }

    @Override
    public synchronized void warning(Diagnostic warning) {
      warnings.add(warning);
    }

    public synchronized List<Diagnostic> getInfos() {
      return ImmutableList.copyOf(infos);
    }

    public synchronized List<Diagnostic> getWarnings() {
      return ImmutableList.copyOf(warnings);
    }

    public synchronized void assertNoWarnings() {
      assertEquals(ImmutableList.of(), warnings);
    }
  }
}
