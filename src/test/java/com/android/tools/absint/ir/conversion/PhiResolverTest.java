// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThrows;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.cfg.Cfg;
import com.android.tools.absint.cfg.CfgBlock;
import com.android.tools.absint.cfg.linear.VariableFactory;
import com.android.tools.absint.errors.CompilationError;
import com.android.tools.absint.ir.code.BasicBlock;
import com.android.tools.absint.ir.code.CmpPredicate;
import com.android.tools.absint.ir.code.IRCodeBuilder;
import com.android.tools.absint.ir.code.Phi;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Program;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.IntTypeElement;
import com.android.tools.absint.ir.type.PointerTypeElement;
import com.android.tools.absint.ir.type.VoidTypeElement;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.memory.NoMemoryAnalysis;
import com.android.tools.absint.memory.TestMemoryAnalysis;
import com.android.tools.absint.memory.TrackLevel;
import org.junit.Before;
import org.junit.Test;

public class PhiResolverTest extends TestBase {

  private IRCodeBuilder builder;
  private BasicBlock entry;
  private BasicBlock loop;
  private Value bound;
  private CfgBlock target;

  @Before
  public void setUp() {
    Program program = createProgram();
    Procedure procedure =
        program.addProcedure(
            "f",
            VoidTypeElement.get(),
            IntTypeElement.I32,
            PointerTypeElement.to(IntTypeElement.I32));
    builder = IRCodeBuilder.create(procedure);
    entry = builder.startBlock("entry");
    loop = builder.block("loop");
    BasicBlock exit = builder.block("exit");
    builder.br(loop);
    builder.setCurrentBlock(exit);
    builder.ret();
    builder.setCurrentBlock(loop);
    bound = builder.argument(0);
    target = new Cfg("f", "entry", TrackLevel.NONE).entry();
  }

  private void closeLoop(Value condition) {
    builder.br(condition, loop, builder.block("exit"));
    builder.build();
  }

  private static PhiResolver createResolver(MemoryAnalysis memoryAnalysis, boolean disable) {
    CfgBuilderOptions options = defaultOptions().setDisablePointerArithmetic(disable);
    return new PhiResolver(
        new SymbolMapper(new VariableFactory(), memoryAnalysis, options), options);
  }

  private static PhiResolver createResolver() {
    return createResolver(NoMemoryAnalysis.getInstance(), false);
  }

  @Test
  public void testSwap() {
    Phi a = builder.phi("a", IntTypeElement.I32);
    Phi b = builder.phi("b", IntTypeElement.I32);
    a.addOperand(entry, builder.i32(0));
    a.addOperand(loop, b);
    b.addOperand(entry, builder.i32(1));
    b.addOperand(loop, a);
    closeLoop(builder.cmp(CmpPredicate.SLT, "c", a, bound));

    PhiResolver resolver = createResolver();
    CfgBlock fromEntry = new Cfg("f", "entry", TrackLevel.NONE).entry();
    resolver.resolve(loop, entry, fromEntry);
    assertThat(statements(fromEntry), contains("a = 0", "b = 1"));

    resolver.resolve(loop, loop, target);
    assertThat(statements(target), contains("@V_0 = b", "@V_1 = a", "a = @V_0", "b = @V_1"));
  }

  @Test
  public void testSharedIncomingPhiIsCopiedOnce() {
    Phi p = builder.phi("p", IntTypeElement.I32);
    Phi r = builder.phi("r", IntTypeElement.I32);
    Phi q = builder.phi("q", IntTypeElement.I32);
    p.addOperand(entry, builder.i32(0));
    p.addOperand(loop, q);
    r.addOperand(entry, builder.i32(0));
    r.addOperand(loop, q);
    q.addOperand(entry, builder.i32(0));
    q.addOperand(loop, builder.i32(5));
    closeLoop(builder.cmp(CmpPredicate.SLT, "c", p, bound));

    createResolver().resolve(loop, loop, target);
    assertThat(statements(target), contains("@V_0 = q", "p = @V_0", "r = @V_0", "q = 5"));
  }

  @Test
  public void testUnknownIncomingValue() {
    Phi a = builder.phi("a", IntTypeElement.I32);
    a.addOperand(entry, builder.undef(IntTypeElement.I32));
    a.addOperand(loop, builder.add("n", a, builder.i32(1)));
    closeLoop(builder.cmp(CmpPredicate.SLT, "c", a, bound));

    PhiResolver resolver = createResolver();
    resolver.resolve(loop, entry, target);
    resolver.resolve(loop, loop, target);
    assertThat(statements(target), contains("havoc(a)", "a = n"));
  }

  @Test
  public void testMissingIncomingValue() {
    Phi a = builder.phi("a", IntTypeElement.I32);
    a.addOperand(entry, builder.i32(0));
    closeLoop(builder.cmp(CmpPredicate.SLT, "c", a, bound));

    assertThrows(CompilationError.class, () -> createResolver().resolve(loop, loop, target));
  }

  @Test
  public void testPointerPhis() {
    Phi pointer = builder.phi("p", builder.argument(1).getType());
    pointer.addOperand(entry, builder.argument(1));
    pointer.addOperand(loop, pointer);
    closeLoop(builder.cmp(CmpPredicate.EQ, "c", pointer, builder.argument(1)));

    createResolver().resolve(loop, entry, target);
    assertThat(statements(target), empty());

    createResolver(new TestMemoryAnalysis(), true).resolve(loop, entry, target);
    assertThat(statements(target), empty());

    createResolver(new TestMemoryAnalysis(), false).resolve(loop, entry, target);
    assertThat(statements(target), contains("p = arg1"));
  }
}
