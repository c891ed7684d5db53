// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static com.android.tools.absint.cfg.linear.LinearConstraint.equalTo;
import static com.android.tools.absint.cfg.linear.LinearConstraint.notEqualTo;

import com.android.tools.absint.cfg.Cfg;
import com.android.tools.absint.cfg.CfgArrayInit;
import com.android.tools.absint.cfg.CfgAssign;
import com.android.tools.absint.cfg.CfgAssumeArray;
import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.CfgStatement;
import com.android.tools.absint.cfg.FunctionDeclaration;
import com.android.tools.absint.cfg.linear.LinearConstraint;
import com.android.tools.absint.cfg.linear.LinearExpression;
import com.android.tools.absint.cfg.linear.TypedVariable;
import com.android.tools.absint.cfg.linear.Variable;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.cfg.linear.VariableType;
import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.ir.code.Argument;
import com.android.tools.absint.ir.code.BasicBlock;
import com.android.tools.absint.ir.code.GlobalInitializer;
import com.android.tools.absint.ir.code.GlobalVariable;
import com.android.tools.absint.ir.code.IRCode;
import com.android.tools.absint.ir.code.If;
import com.android.tools.absint.ir.code.JumpInstruction;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Switch;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.memory.RefModNewCells;
import com.android.tools.absint.utils.Reporter;
import com.android.tools.absint.utils.StringDiagnostic;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the analysis CFG of a procedure.
 *
 * <p>Each source block is translated to a block with the same label. Every edge out of a
 * conditional branch or a switch gets a synthetic block holding the constraint of the edge,
 * followed by the phi assignments of the successor. Phis of a successor reached by a goto are
 * assigned at the end of the source block. All return blocks flow into a single exit block.
 *
 * <p>A builder translates a single procedure once and is not thread safe. Builders of different
 * procedures may run concurrently if they share a thread safe {@link VariableFactory}.
 */
public class CfgBuilder {

  private final Procedure procedure;
  private final MemoryAnalysis memoryAnalysis;
  private final CfgBuilderOptions options;
  private final Reporter reporter;

  private final SymbolMapper mapper;
  private final ConditionTranslator conditionTranslator;
  private final PhiResolver phiResolver;
  private final InstructionTranslator instructionTranslator;

  private final Map<BasicBlock, CfgBlock> blocks = new IdentityHashMap<>();
  private Cfg cfg = null;

  public CfgBuilder(
      Procedure procedure,
      VariableFactory variableFactory,
      MemoryAnalysis memoryAnalysis,
      CfgBuilderOptions options,
      Reporter reporter) {
    this.procedure = procedure;
    this.memoryAnalysis = memoryAnalysis;
    this.options = options;
    this.reporter = reporter;
    this.mapper = new SymbolMapper(variableFactory, memoryAnalysis, options);
    this.conditionTranslator = new ConditionTranslator(mapper, options);
    this.phiResolver = new PhiResolver(mapper, options);
    InvokeTranslator invokeTranslator =
        new InvokeTranslator(procedure, mapper, conditionTranslator, memoryAnalysis, options);
    this.instructionTranslator =
        new InstructionTranslator(
            procedure,
            mapper,
            conditionTranslator,
            invokeTranslator,
            memoryAnalysis,
            options,
            reporter);
  }

  public Cfg build() {
    if (cfg != null) {
      return cfg;
    }
    if (procedure.isDeclaration()) {
      throw new CompilationError("Cannot build the CFG of declaration " + procedure.getName());
    }
    IRCode code = procedure.getCode();
    cfg =
        new Cfg(
            procedure.getName(), code.entryBlock().getLabel(), memoryAnalysis.getTrackLevel());
    for (BasicBlock block : code.blocks()) {
      blocks.put(block, block.isEntry() ? cfg.entry() : cfg.createBlock(block.getLabel()));
    }

    List<CfgBlock> returnBlocks = new ArrayList<>();
    for (BasicBlock block : code.blocks()) {
      CfgBlock target = getBlock(block);
      instructionTranslator.translate(block, target);
      if (block.isReturnBlock()) {
        returnBlocks.add(target);
      } else {
        translateEdges(block, target);
      }
    }
    unifyExits(returnBlocks);

    List<Variable> inputVersions = new ArrayList<>();
    CellParameterList cellParameters = null;
    if (memoryAnalysis.getTrackLevel().tracksMemory()) {
      RefModNewCells cells = memoryAnalysis.getRefModNewCells(procedure);
      if (hasCellParameters()) {
        cellParameters = CellParameterList.create(cells);
      }
      insertPrologue(cells, cellParameters, inputVersions);
    }
    if (options.isInterproceduralEnabled()) {
      addFunctionDeclaration(cellParameters, inputVersions);
    }

    if (options.isSimplifyEnabled()) {
      cfg.simplify();
    }
    if (options.isPrintEnabled()) {
      reporter.info(new StringDiagnostic(cfg.toString(), procedure.getName()));
    }
    return cfg;
  }

  private CfgBlock getBlock(BasicBlock block) {
    CfgBlock result = blocks.get(block);
    if (result == null) {
      throw new CompilationError(
          "Block " + block.getLabel() + " does not belong to " + procedure.getName());
    }
    return result;
  }

  private boolean hasCellParameters() {
    return options.isInterproceduralEnabled()
        && !options.isEntryPoint(procedure)
        && !procedure.isVarArg();
  }

  private void translateEdges(BasicBlock block, CfgBlock source) {
    JumpInstruction exit = block.exit();
    if (exit.isGoto()) {
      BasicBlock successor = exit.asGoto().getTarget();
      cfg.addEdge(source, getBlock(successor));
      phiResolver.resolve(successor, block, source);
    } else if (exit.isIf()) {
      If branch = exit.asIf();
      List<BasicBlock> successors = branch.getSuccessors();
      for (int i = 0; i < successors.size(); i++) {
        BasicBlock successor = successors.get(i);
        CfgBlock edge = createEdgeBlock(source, successor);
        // The second successor is taken when the condition is false.
        conditionTranslator.translateCondition(branch.condition(), i == 1, edge);
        phiResolver.resolve(successor, block, edge);
      }
    } else if (exit.isSwitch()) {
      translateSwitch(exit.asSwitch(), block, source);
    } else {
      assert exit.isUnreachableInstruction();
    }
  }

  private CfgBlock createEdgeBlock(CfgBlock source, BasicBlock successor) {
    CfgBlock edge = cfg.createSyntheticBlock();
    cfg.addEdge(source, edge);
    cfg.addEdge(edge, getBlock(successor));
    return edge;
  }

  /**
   * A successor reached by a single case is guarded by {@code value = key}. The default successor
   * is guarded by {@code value != key} for all keys, unless a case also leads to it.
   */
  private void translateSwitch(Switch switchInstruction, BasicBlock block, CfgBlock source) {
    Map<BasicBlock, List<BigInteger>> keysPerSuccessor = new IdentityHashMap<>();
    for (int i = 0; i < switchInstruction.getKeys().size(); i++) {
      keysPerSuccessor
          .computeIfAbsent(switchInstruction.getTargets().get(i), ignore -> new ArrayList<>())
          .add(switchInstruction.getKeys().get(i));
    }
    LinearExpression value = mapper.lookup(switchInstruction.value());
    Set<BasicBlock> successors = Sets.newIdentityHashSet();
    for (BasicBlock successor : switchInstruction.getSuccessors()) {
      if (!successors.add(successor)) {
        continue;
      }
      CfgBlock edge = createEdgeBlock(source, successor);
      List<BigInteger> keys = keysPerSuccessor.get(successor);
      if (value != null) {
        if (keys == null) {
          assert successor == switchInstruction.getDefaultTarget();
          for (BigInteger key : switchInstruction.getKeys()) {
            assume(notEqualTo(value, LinearExpression.constant(key)), edge);
          }
        } else if (keys.size() == 1 && successor != switchInstruction.getDefaultTarget()) {
          assume(equalTo(value, LinearExpression.constant(keys.get(0))), edge);
        }
      }
      phiResolver.resolve(successor, block, edge);
    }
  }

  private static void assume(LinearConstraint constraint, CfgBlock block) {
    if (constraint.isContradiction()) {
      block.unreachable();
    } else if (!constraint.isTautology()) {
      block.assume(constraint);
    }
  }

  private void unifyExits(List<CfgBlock> returnBlocks) {
    if (returnBlocks.size() == 1) {
      cfg.setExit(returnBlocks.get(0));
      return;
    }
    // Also used when nothing returns, so that there is always an exit.
    CfgBlock exit = cfg.createSyntheticBlock();
    for (CfgBlock returnBlock : returnBlocks) {
      cfg.addEdge(returnBlock, exit);
    }
    cfg.setExit(exit);
  }

  /**
   * Inserts at the front of the entry block, in order: the copies of the input versions into the
   * passed cells, the zero initialization of new cells and the initial values of globals.
   */
  private void insertPrologue(
      RefModNewCells cells, CellParameterList cellParameters, List<Variable> inputVersions) {
    List<CfgStatement> prologue = new ArrayList<>();
    if (cellParameters != null) {
      for (int cell : cellParameters.getPassedCells()) {
        Variable inputVersion = mapper.fresh();
        prologue.add(new CfgAssign(mapper.symVar(cell), LinearExpression.of(inputVersion)));
        inputVersions.add(inputVersion);
      }
    }
    for (int cell : cells.getNews()) {
      prologue.add(new CfgAssumeArray(mapper.symVar(cell), BigInteger.ZERO));
    }
    if (options.isEntryPoint(procedure)) {
      for (GlobalVariable global : procedure.getProgram().getGlobals()) {
        if (!global.hasInitializer()) {
          continue;
        }
        int arrayId = memoryAnalysis.getArrayId(procedure, global);
        if (arrayId >= 0) {
          addInitializer(
              global.getInitializer(),
              mapper.symVar(arrayId),
              prologue,
              Sets.newIdentityHashSet());
        }
      }
    }
    cfg.entry().insertAtFront(prologue);
  }

  private static void addInitializer(
      GlobalInitializer initializer,
      Variable cell,
      List<CfgStatement> prologue,
      Set<GlobalVariable> seenAliasees) {
    if (initializer.isZeroAggregate()) {
      prologue.add(new CfgAssumeArray(cell, BigInteger.ZERO));
    } else if (initializer.isDataSequence()) {
      prologue.add(new CfgArrayInit(cell, initializer.asDataSequence().getElements()));
    } else if (initializer.isAlias()) {
      GlobalVariable aliasee = initializer.asAlias().getAliasee();
      if (aliasee.hasInitializer() && seenAliasees.add(aliasee)) {
        addInitializer(aliasee.getInitializer(), cell, prologue, seenAliasees);
      }
    } else {
      // Scalars live in registers.
      assert initializer.isScalar();
    }
  }

  private void addFunctionDeclaration(
      CellParameterList cellParameters, List<Variable> inputVersions) {
    if (procedure.isVarArg()) {
      reporter.warning(
          new StringDiagnostic(
              "No declaration for variadic procedure " + procedure.getName(),
              procedure.getName()));
      return;
    }
    List<TypedVariable> parameters = new ArrayList<>();
    for (Argument argument : procedure.getArguments()) {
      if (mapper.isTracked(argument)
          && (!options.isPointerArithmeticDisabled() || argument.getType().isInt())) {
        parameters.add(
            new TypedVariable(
                mapper.symVar(argument), VariableType.fromType(argument.getType())));
      }
    }
    if (cellParameters != null) {
      cellParameters.appendTo(parameters, inputVersions, mapper);
    }
    VariableType returnType =
        !options.isPointerArithmeticDisabled() || procedure.getReturnType().isInt()
            ? VariableType.fromType(procedure.getReturnType())
            : VariableType.UNK;
    cfg.setFunctionDeclaration(
        new FunctionDeclaration(returnType, procedure.getName(), parameters));
  }
}
