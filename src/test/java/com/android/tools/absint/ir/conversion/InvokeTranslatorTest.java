// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.ir.conversion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import com.android.tools.absint.TestBase;
import com.android.tools.absint.ir.code.CmpPredicate;
import com.android.tools.absint.ir.code.IRCodeBuilder;
import com.android.tools.absint.ir.code.Procedure;
import com.android.tools.absint.ir.code.Program;
import com.android.tools.absint.ir.code.Value;
import com.android.tools.absint.ir.type.IntTypeElement;
import com.android.tools.absint.ir.type.PointerTypeElement;
import com.android.tools.absint.ir.type.TypeElement;
import com.android.tools.absint.ir.type.VoidTypeElement;
import com.android.tools.absint.memory.MemoryAnalysis;
import com.android.tools.absint.memory.NoMemoryAnalysis;
import com.android.tools.absint.memory.TestMemoryAnalysis;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class InvokeTranslatorTest extends TestBase {

  private static final IntTypeElement I32 = IntTypeElement.I32;
  private static final PointerTypeElement POINTER = PointerTypeElement.to(IntTypeElement.I8);
  private static final TypeElement VOID = VoidTypeElement.get();

  private Program program;
  private CfgBuilderOptions options;

  @Before
  public void setUp() {
    program = createProgram();
    options = defaultOptions();
  }

  private IRCodeBuilder start(String name, List<String> argumentNames, TypeElement... types) {
    Procedure procedure =
        program.addProcedure(name, VOID, argumentNames, ImmutableList.copyOf(types), false);
    IRCodeBuilder builder = IRCodeBuilder.create(procedure);
    builder.startBlock("entry");
    return builder;
  }

  private Procedure declare(String name, TypeElement returnType, TypeElement... types) {
    return program.addProcedure(name, returnType, types);
  }

  private List<String> translate(IRCodeBuilder builder, MemoryAnalysis memoryAnalysis) {
    builder.ret();
    builder.build();
    return statements(buildCfg(builder.getProcedure(), memoryAnalysis, options).entry());
  }

  private List<String> translate(IRCodeBuilder builder) {
    return translate(builder, NoMemoryAnalysis.getInstance());
  }

  @Test
  public void testIndirectCall() {
    IRCodeBuilder builder = start("f", ImmutableList.of("fp"), POINTER);
    builder.callIndirect("r", I32, builder.argument(0));
    builder.callIndirect(null, VOID, builder.argument(0));
    assertThat(translate(builder), contains("havoc(r)"));
  }

  @Test
  public void testIgnoredCallees() {
    Procedure shadow = declare("shadow.mem.init", I32, I32);
    Procedure enter = declare("seahorn.fn.enter", VOID);
    IRCodeBuilder builder = start("f", ImmutableList.of());
    builder.call("r", shadow, builder.i32(0));
    builder.call(null, enter);
    assertThat(translate(builder, new TestMemoryAnalysis()), empty());
  }

  @Test
  public void testHeapAllocation() {
    Procedure malloc = declare("malloc", POINTER, IntTypeElement.I64);
    IRCodeBuilder main = start("main", ImmutableList.of());
    Value allocation = main.call("m", malloc, main.i64(16));
    assertThat(
        translate(main, new TestMemoryAnalysis().setArrayId(allocation, 3)),
        contains("assume_array(@A_3, 0)"));

    // Outside of the entry point an allocation is an unknown call.
    IRCodeBuilder other = start("f", ImmutableList.of());
    Value otherAllocation = other.call("m", malloc, other.i64(16));
    assertThat(
        translate(other, new TestMemoryAnalysis().setArrayId(otherAllocation, 3)),
        contains("havoc(m)"));
  }

  @Test
  public void testMemset() {
    Procedure memset =
        declare(
            "llvm.memset.p0i8.i64",
            VOID,
            POINTER,
            IntTypeElement.I8,
            IntTypeElement.I64,
            IntTypeElement.I1);
    IRCodeBuilder builder = start("f", ImmutableList.of("p", "c"), POINTER, IntTypeElement.I8);
    Value pointer = builder.argument(0);
    builder.call(
        null,
        memset,
        pointer,
        builder.constInt(IntTypeElement.I8, 0),
        builder.i64(40),
        builder.bool(false));
    builder.call(null, memset, pointer, builder.argument(1), builder.i64(40), builder.bool(false));
    assertThat(
        translate(builder, new TestMemoryAnalysis().setArrayId(pointer, 1)),
        contains("havoc(@A_1)", "assume_array(@A_1, 0)"));
  }

  @Test
  public void testMemcpy() {
    Procedure memcpy =
        declare(
            "llvm.memcpy.p0i8.p0i8.i64",
            VOID,
            POINTER,
            POINTER,
            IntTypeElement.I64,
            IntTypeElement.I1);
    IRCodeBuilder builder = start("f", ImmutableList.of("p", "q"), POINTER, POINTER);
    Value destination = builder.argument(0);
    Value source = builder.argument(1);
    builder.call(null, memcpy, destination, source, builder.i64(8), builder.bool(false));
    TestMemoryAnalysis memoryAnalysis =
        new TestMemoryAnalysis().setArrayId(destination, 1).setArrayId(source, 2);
    assertThat(translate(builder, memoryAnalysis), contains("havoc(@A_1)", "@A_1 = @A_2"));
  }

  @Test
  public void testOtherIntrinsics() {
    Procedure memmove =
        declare(
            "llvm.memmove.p0i8.p0i8.i64",
            VOID,
            POINTER,
            POINTER,
            IntTypeElement.I64,
            IntTypeElement.I1);
    Procedure popcount = declare("llvm.ctpop.i32", I32, I32);
    IRCodeBuilder builder = start("f", ImmutableList.of("p", "q", "x"), POINTER, POINTER, I32);
    builder.call(
        null,
        memmove,
        builder.argument(0),
        builder.argument(1),
        builder.i64(8),
        builder.bool(false));
    builder.call("r", popcount, builder.argument(2));
    TestMemoryAnalysis memoryAnalysis =
        new TestMemoryAnalysis()
            .setArrayId(builder.argument(0), 1)
            .setArrayId(builder.argument(1), 2);
    assertThat(translate(builder, memoryAnalysis), contains("havoc(r)"));
  }

  @Test
  public void testAssume() {
    Procedure assume = declare("verifier.assume", VOID, I32);
    Procedure assumeNot = declare("verifier.assume.not", VOID, IntTypeElement.I1);
    IRCodeBuilder builder = start("f", ImmutableList.of("x", "y"), I32, I32);
    Value condition = builder.cmp(CmpPredicate.SLT, "c", builder.argument(0), builder.argument(1));
    builder.call(null, assume, builder.zext("d", condition, I32));
    Value other = builder.cmp(CmpPredicate.SLE, "e", builder.argument(0), builder.i32(9));
    builder.call(null, assumeNot, other);
    assertThat(translate(builder), contains("assume(x - y <= -1)", "assume(-x <= -10)"));
  }

  @Test
  public void testAssumeConstant() {
    Procedure assume = declare("verifier.assume", VOID, IntTypeElement.I1);
    IRCodeBuilder builder = start("f", ImmutableList.of());
    builder.call(null, assume, builder.bool(true));
    builder.call(null, assume, builder.bool(false));
    assertThat(translate(builder), contains("unreachable"));
  }

  @Test
  public void testCallWithoutInterprocedural() {
    Procedure callee = declare("g", I32, I32);
    IRCodeBuilder builder = start("f", ImmutableList.of("x"), I32);
    builder.call("r", callee, builder.argument(0));
    TestMemoryAnalysis memoryAnalysis =
        new TestMemoryAnalysis().setCells("g", new int[] {}, new int[] {4}, new int[] {});
    assertThat(translate(builder, memoryAnalysis), contains("havoc(r)", "havoc(@A_4)"));
  }

  @Test
  public void testVariadicCallee() {
    options.setEnableInterprocedural(true);
    Procedure callee =
        program.addProcedure(
            "printf", I32, ImmutableList.of("fmt"), ImmutableList.of(POINTER), true);
    IRCodeBuilder builder = start("f", ImmutableList.of("x"), I32);
    builder.call("r", callee, builder.nullPointer(POINTER), builder.argument(0));
    assertThat(translate(builder), contains("havoc(r)"));
  }

  @Test
  public void testCallSite() {
    options.setEnableInterprocedural(true);
    Procedure callee = declare("g", I32, I32, I32, I32);
    Procedure sink = declare("h", VOID, POINTER, I32);
    IRCodeBuilder builder = start("f", ImmutableList.of("p", "x"), POINTER, I32);
    Value x = builder.argument(1);
    builder.call("r", callee, x, builder.i32(5), builder.undef(I32));
    builder.call(null, sink, builder.argument(0), x);
    assertThat(
        translate(builder),
        contains(
            "@V_0 = 5",
            "havoc(@V_1)",
            "r:int = call g(x:int, @V_0:int, @V_1:unknown)",
            "call h(x:int)"));
  }

  @Test
  public void testCallSiteWithCells() {
    options.setEnableInterprocedural(true);
    Procedure callee = declare("g", I32, I32);
    IRCodeBuilder builder = start("f", ImmutableList.of("x"), I32);
    builder.call("r", callee, builder.argument(0));
    TestMemoryAnalysis memoryAnalysis =
        new TestMemoryAnalysis().setCells("g", new int[] {1}, new int[] {1, 2}, new int[] {3});
    assertThat(
        translate(builder, memoryAnalysis),
        contains(
            "@V_0 = @A_1",
            "havoc(@A_1)",
            "@V_1 = @A_2",
            "havoc(@A_2)",
            "r:int = call g(x:int, @V_0:arr, @V_1:arr, @A_1:arr, @A_2:arr, @A_3:arr)"));
  }
}
