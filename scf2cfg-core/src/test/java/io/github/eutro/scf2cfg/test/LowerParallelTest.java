package io.github.eutro.scf2cfg.test;

import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.passes.lower.ConversionResult;
import io.github.eutro.scf2cfg.core.passes.lower.LowerParallel;
import io.github.eutro.scf2cfg.core.passes.lower.LowerStructuredControl;
import io.github.eutro.scf2cfg.core.passes.meta.VerifyIntegrity;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import java.util.Collections;
import java.util.List;

import static io.github.eutro.scf2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LowerParallelTest {
    private Function func;
    private Effect parallel;

    // reduce (+) over [0, n) x [0, m) of f(i, j)
    private BasicBlock buildSum(int n, int m) {
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var vn = constant(ib, n);
        Var vm = constant(ib, m);
        parallel = buildParallel(ib, vars(zero, zero), vars(vn, vm), vars(one, one), vars(zero));
        ib.insertCtrl(ret(parallel.getAssignsTo().get(0)));
        return body(parallel);
    }

    private static void sumCombiner(Function func, BasicBlock combiner) {
        IRBuilder cb = new IRBuilder(func, combiner);
        combiner.setControl(reduceReturn(add(cb, combiner.args.get(0), combiner.args.get(1))));
    }

    @Test
    void testCount2D() throws Throwable {
        BasicBlock body = buildSum(2, 3);
        IRBuilder bb = new IRBuilder(func, body);
        sumCombiner(func, buildReduce(bb, constant(bb, 1)));

        assertEquals(6, Interpreter.run(func));
        assertTrue(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        VerifyIntegrity.INSTANCE.run(func);
        assertTrue(findAll(func, OpKind.PARALLEL_LOOP).isEmpty());
        assertTrue(findAll(func, OpKind.REDUCE).isEmpty());

        List<Effect> loops = findAll(func, OpKind.LOOP);
        assertEquals(2, loops.size());
        Effect outer = loops.get(0);
        Effect inner = loops.get(1);
        assertSame(func.blocks.get(0), IRUtils.blockOf(outer));
        assertSame(body(outer), IRUtils.blockOf(inner));
        // the outer loop yields the inner loop's result
        assertEquals(inner.getAssignsTo(), body(outer).getControl().insn().args());
        assertEquals(6, Interpreter.run(func));

        LowerStructuredControl.INSTANCE.run(func);
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(6, Interpreter.run(func));
        assertEquals(6, compileAndInvoke(func));
    }

    @Test
    void testInductionVariables() throws Throwable {
        BasicBlock body = buildSum(3, 4);
        IRBuilder bb = new IRBuilder(func, body);
        Var prod = mul(bb, body.args.get(0), body.args.get(1));
        sumCombiner(func, buildReduce(bb, prod));

        assertEquals(18, Interpreter.run(func));
        LowerStructuredControl.INSTANCE.run(func);
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(18, Interpreter.run(func));
        assertEquals(18, compileAndInvoke(func));
    }

    @Test
    void testTwoReductions() throws Throwable {
        // (sum of i, product of i + 1) over i in [0, 4)
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var four = constant(ib, 4);
        Var hundred = constant(ib, 100);
        parallel = buildParallel(ib, vars(zero), vars(four), vars(one), vars(zero, one));
        List<Var> results = parallel.getAssignsTo();
        ib.insertCtrl(ret(add(ib, mul(ib, results.get(0), hundred), results.get(1))));

        BasicBlock body = body(parallel);
        IRBuilder bb = new IRBuilder(func, body);
        Var i = body.args.get(0);
        sumCombiner(func, buildReduce(bb, i));
        BasicBlock productCombiner = buildReduce(bb, add(bb, i, one));
        IRBuilder pb = new IRBuilder(func, productCombiner);
        productCombiner.setControl(reduceReturn(mul(pb, productCombiner.args.get(0), productCombiner.args.get(1))));

        assertEquals(6 * 100 + 24, Interpreter.run(func));
        LowerStructuredControl.INSTANCE.run(func);
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(6 * 100 + 24, Interpreter.run(func));
        assertEquals(6 * 100 + 24, compileAndInvoke(func));
    }

    @Test
    void testNoReductions() {
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var two = constant(ib, 2);
        parallel = buildParallel(ib, vars(zero, zero), vars(two, two), vars(one, one), Collections.emptyList());
        ib.insertCtrl(ret());
        IRBuilder bb = new IRBuilder(func, body(parallel));
        add(bb, body(parallel).args.get(0), body(parallel).args.get(1));

        assertTrue(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        VerifyIntegrity.INSTANCE.run(func);
        List<Effect> loops = findAll(func, OpKind.LOOP);
        assertEquals(2, loops.size());
        for (Effect loop : loops) {
            assertTrue(loop.getAssignsTo().isEmpty());
            assertTrue(body(loop).getControl().insn().args().isEmpty());
        }
        assertEquals(1, countOps(func, ArithOps.ADD));
    }

    @Test
    void testMalformedCombinerIsRejected() {
        BasicBlock body = buildSum(2, 3);
        IRBuilder bb = new IRBuilder(func, body);
        BasicBlock combiner = buildReduce(bb, constant(bb, 1));
        IRBuilder cb = new IRBuilder(func, combiner);
        combiner.setControl(StructuredOps.yield(vars(add(cb, combiner.args.get(0), combiner.args.get(1)))));

        String before = func.toString();
        assertFalse(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        assertEquals(before, func.toString());
        assertTrue(findAll(func, OpKind.LOOP).isEmpty());
    }

    @Test
    void testReductionCountMismatchIsRejected() {
        buildSum(2, 3);
        String before = func.toString();
        assertFalse(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        assertEquals(before, func.toString());
    }

    // sum over i in [0, 2) of (sum over j in [0, 3) of 1)
    private Effect buildNestedCount() {
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var two = constant(ib, 2);
        Var three = constant(ib, 3);
        parallel = buildParallel(ib, vars(zero), vars(two), vars(one), vars(zero));
        ib.insertCtrl(ret(parallel.getAssignsTo().get(0)));

        IRBuilder ob = new IRBuilder(func, body(parallel));
        Effect inner = buildParallel(ob, vars(zero), vars(three), vars(one), vars(zero));
        sumCombiner(func, buildReduce(ob, inner.getAssignsTo().get(0)));
        IRBuilder nb = new IRBuilder(func, body(inner));
        sumCombiner(func, buildReduce(nb, one));
        return inner;
    }

    @Test
    void testNestedParallel() throws Throwable {
        buildNestedCount();
        assertEquals(6, Interpreter.run(func));

        ConversionResult result = LowerStructuredControl.INSTANCE.convert(func);
        VerifyIntegrity.INSTANCE.run(func);
        // two parallel loops and the loop each expands to
        assertEquals(4, result.getConverted());
        assertTrue(result.isFullyConverted());
        assertEquals(6, Interpreter.run(func));
        assertEquals(6, compileAndInvoke(func));
    }

    @Test
    void testExpandingLeavesNestedOriginalDetached() {
        Effect inner = buildNestedCount();
        assertTrue(IRUtils.isAttached(inner, func));
        assertTrue(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        VerifyIntegrity.INSTANCE.run(func);

        assertFalse(IRUtils.isAttached(parallel, func));
        assertFalse(IRUtils.isAttached(inner, func));
        List<Effect> clones = findAll(func, OpKind.PARALLEL_LOOP);
        assertEquals(1, clones.size());
        assertNotSame(inner, clones.get(0));
        assertTrue(IRUtils.isAttached(clones.get(0), func));
    }

    @Test
    void testParallelWithConditionalInBody() throws Throwable {
        // sum over i in [0, 4) of (i < 2 ? 1 : 10)
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var two = constant(ib, 2);
        Var four = constant(ib, 4);
        Var ten = constant(ib, 10);
        parallel = buildParallel(ib, vars(zero), vars(four), vars(one), vars(zero));
        ib.insertCtrl(ret(parallel.getAssignsTo().get(0)));

        BasicBlock body = body(parallel);
        IRBuilder bb = new IRBuilder(func, body);
        Effect cond = buildIf(bb, cmp(bb, ArithOps.Predicate.SLT, body.args.get(0), two), true, Type.INT_TYPE);
        body(cond).setControl(StructuredOps.yield(vars(one)));
        cond.insn().regions().get(1).getEntry().setControl(StructuredOps.yield(vars(ten)));
        sumCombiner(func, buildReduce(bb, cond.getAssignsTo().get(0)));

        assertEquals(22, Interpreter.run(func));
        ConversionResult result = LowerStructuredControl.INSTANCE.convert(func);
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(3, result.getConverted());
        assertTrue(findAll(func, OpKind.CONDITIONAL).isEmpty());
        assertEquals(22, Interpreter.run(func));
        assertEquals(22, compileAndInvoke(func));
    }

    @Test
    void testParallelInLoopBody() throws Throwable {
        // sum over k in [0, 4) of (sum over i in [0, k) of i)
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var four = constant(ib, 4);
        Effect loop = StructuredOps.buildFor(ib, zero, four, one, vars(zero));
        ib.insertCtrl(ret(loop.getAssignsTo().get(0)));

        BasicBlock loopBody = body(loop);
        IRBuilder lb = new IRBuilder(func, loopBody);
        parallel = buildParallel(lb, vars(zero), vars(loopBody.args.get(0)), vars(one), vars(zero));
        lb.insertCtrl(StructuredOps.yield(vars(add(lb, loopBody.args.get(1), parallel.getAssignsTo().get(0)))));
        IRBuilder pb = new IRBuilder(func, body(parallel));
        sumCombiner(func, buildReduce(pb, body(parallel).args.get(0)));

        assertEquals(4, Interpreter.run(func));
        ConversionResult result = LowerStructuredControl.INSTANCE.convert(func);
        VerifyIntegrity.INSTANCE.run(func);
        // the parallel loop, the loop it expands to, and the enclosing loop
        assertEquals(3, result.getConverted());
        assertEquals(4, Interpreter.run(func));
        assertEquals(4, compileAndInvoke(func));
    }

    @Test
    void testMismatchedBoundTypesAreRejected() {
        func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1L);
        Var two = constant(ib, 2);
        parallel = buildParallel(ib, vars(zero), vars(two), vars(one), Collections.emptyList());
        ib.insertCtrl(ret());

        String before = func.toString();
        assertFalse(LowerParallel.INSTANCE.matchAndRewrite(parallel, new Rewriter(func)));
        assertEquals(before, func.toString());
    }
}
