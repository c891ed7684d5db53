// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static com.android.tools.absint.utils.SystemPropertyUtils.getSystemPropertyOrDefault;
import static com.android.tools.absint.utils.SystemPropertyUtils.parseSystemPropertyOrDefault;

import com.android.tools.absint.ir.code.Procedure;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Options of the CFG translation. Defaults can be overridden with system properties, which are
 * read once when the options are created.
 */
public class CfgBuilderOptions {

  private static final String PREFIX = "com.android.tools.absint.cfg.";

  /** When enabled, straight-line chains are merged and unreachable blocks removed. */
  private boolean enableSimplify = parseSystemPropertyOrDefault(PREFIX + "simplify", false);

  /** When enabled, each translated CFG is reported as an info diagnostic. */
  private boolean enablePrint = parseSystemPropertyOrDefault(PREFIX + "print", false);

  /**
   * When enabled, pointer values are not translated. Address computations are havoced and only
   * integer typed values flow into conditions, call sites and returns.
   */
  private boolean disablePointerArithmetic =
      parseSystemPropertyOrDefault(PREFIX + "disablepointerarithmetic", false);

  /**
   * When enabled, values that cannot be translated are explicitly havoced. In SSA form these
   * havocs are not needed for soundness, since an unassigned variable is already unconstrained.
   */
  private boolean includeHavoc = parseSystemPropertyOrDefault(PREFIX + "includehavoc", true);

  /** When enabled, calls and returns are translated to call sites and return statements. */
  private boolean enableInterprocedural =
      parseSystemPropertyOrDefault(PREFIX + "interprocedural", false);

  /** Overrides the entry point of the program when set. */
  private String entryPointName = getSystemPropertyOrDefault(PREFIX + "entrypoint", null);

  private Set<String> heapAllocators =
      parseSystemPropertyOrDefault(
          PREFIX + "heapallocators", ImmutableSet.of("calloc", "malloc", "valloc", "palloc"));

  private String assumeName = getSystemPropertyOrDefault(PREFIX + "assume", "verifier.assume");

  private String assumeNotName =
      getSystemPropertyOrDefault(PREFIX + "assumenot", "verifier.assume.not");

  private Set<String> ignoredCallees = ImmutableSet.of("seahorn.fn.enter");

  private String ignoredCalleePrefix = "shadow.mem";

  private String ignoredValuePrefix = "shadow.mem";

  public CfgBuilderOptions() {}

  public CfgBuilderOptions(CfgBuilderOptions options) {
    this.enableSimplify = options.enableSimplify;
    this.enablePrint = options.enablePrint;
    this.disablePointerArithmetic = options.disablePointerArithmetic;
    this.includeHavoc = options.includeHavoc;
    this.enableInterprocedural = options.enableInterprocedural;
    this.entryPointName = options.entryPointName;
    this.heapAllocators = options.heapAllocators;
    this.assumeName = options.assumeName;
    this.assumeNotName = options.assumeNotName;
    this.ignoredCallees = options.ignoredCallees;
    this.ignoredCalleePrefix = options.ignoredCalleePrefix;
    this.ignoredValuePrefix = options.ignoredValuePrefix;
  }

  public boolean isSimplifyEnabled() {
    return enableSimplify;
  }

  public CfgBuilderOptions setEnableSimplify(boolean enableSimplify) {
    this.enableSimplify = enableSimplify;
    return this;
  }

  public boolean isPrintEnabled() {
    return enablePrint;
  }

  public CfgBuilderOptions setEnablePrint(boolean enablePrint) {
    this.enablePrint = enablePrint;
    return this;
  }

  public boolean isPointerArithmeticDisabled() {
    return disablePointerArithmetic;
  }

  public CfgBuilderOptions setDisablePointerArithmetic(boolean disablePointerArithmetic) {
    this.disablePointerArithmetic = disablePointerArithmetic;
    return this;
  }

  public boolean isIncludeHavocEnabled() {
    return includeHavoc;
  }

  public CfgBuilderOptions setIncludeHavoc(boolean includeHavoc) {
    this.includeHavoc = includeHavoc;
    return this;
  }

  public boolean isInterproceduralEnabled() {
    return enableInterprocedural;
  }

  public CfgBuilderOptions setEnableInterprocedural(boolean enableInterprocedural) {
    this.enableInterprocedural = enableInterprocedural;
    return this;
  }

  public CfgBuilderOptions setEntryPointName(String entryPointName) {
    this.entryPointName = entryPointName;
    return this;
  }

  public boolean isEntryPoint(Procedure procedure) {
    return entryPointName != null
        ? procedure.getName().equals(entryPointName)
        : procedure.isEntryPoint();
  }

  public boolean isHeapAllocator(Procedure procedure) {
    return heapAllocators.contains(procedure.getName());
  }

  public CfgBuilderOptions setHeapAllocators(Set<String> heapAllocators) {
    this.heapAllocators = ImmutableSet.copyOf(heapAllocators);
    return this;
  }

  public boolean isAssume(Procedure procedure) {
    return procedure.getName().equals(assumeName);
  }

  public boolean isAssumeNot(Procedure procedure) {
    return procedure.getName().equals(assumeNotName);
  }

  public boolean isIgnoredCallee(Procedure procedure) {
    return ignoredCallees.contains(procedure.getName())
        || procedure.getName().startsWith(ignoredCalleePrefix);
  }

  public boolean isIgnoredValue(String name) {
    return name != null && name.startsWith(ignoredValuePrefix);
  }
}
