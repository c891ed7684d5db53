// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import com.android.tools.absint.cfg.Cfg;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.errors.Unreachable;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Program;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.utils.Reporter;
import com.android.tools.absint.utils.ThreadUtils;
import com.android.tools.absint.utils.ThreadUtils.WorkLoad;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Translates all procedures with a body.
 *
 * <p>Procedures are independent and can be translated in parallel. All translations share one
 * {@link VariableFactory}, so variable names are unique across the program. When translating in
 * parallel, the numbering of temporaries depends on the schedule.
 */
public class ProgramTranslator {

  private final Program program;
  private final MemoryAnalysis memoryAnalysis;
  private final CfgBuilderOptions options;
  private final Reporter reporter;
  private final VariableFactory variableFactory;

  public ProgramTranslator(
      Program program,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options,
      Reporter reporter) {
    this(program, memoryAnalysis, options, reporter, new VariableFactory());
  }

  public ProgramTranslator(
      Program program,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options,
      Reporter reporter,
      VariableFactory variableFactory) {
    this.program = program;
    this.memoryAnalysis = memoryAnalysis;
    this.options = options;
    this.reporter = reporter;
    this.variableFactory = variableFactory;
  }

  public VariableFactory getVariableFactory() {
    return variableFactory;
  }

  /** Translates the procedures on the calling thread, in program order. */
  public Map<Procedure, Cfg> translate() {
    try {
      return translate((ExecutorService) null);
    } catch (ExecutionException e) {
      // Only tasks submitted to an executor report failures this way.
      throw new Unreachable(e);
    }
  }

  /** Returns the CFG of each procedure with a body, in program order. */
  public Map<Procedure, Cfg> translate(ExecutorService executorService)
      throws ExecutionException {
    List<Procedure> procedures = program.getDefinedProcedures();
    List<Cfg> cfgs =
        ThreadUtils.processItemsWithResults(
            procedures, procedure -> translate(procedure), executorService, WorkLoad.HEAVY);
    Map<Procedure, Cfg> result = new LinkedHashMap<>();
    for (int i = 0; i < procedures.size(); i++) {
      result.put(procedures.get(i), cfgs.get(i));
    }
    return result;
  }

  public Cfg translate(Procedure procedure) {
    return new CfgBuilder(procedure, variableFactory, memoryAnalysis, options, reporter).build();
  }
}
