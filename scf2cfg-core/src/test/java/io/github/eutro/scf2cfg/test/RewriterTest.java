package io.github.eutro.scf2cfg.test;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.passes.meta.VerifyIntegrity;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import java.util.Collections;

import static io.github.eutro.scf2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class RewriterTest {
    @Test
    void testSplitBlock() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var a = constant(ib, 1);
        Var b = constant(ib, 2);
        Effect bDef = lastEffect(ib);
        Control ret = ret(add(ib, a, b));
        ib.insertCtrl(ret);

        BasicBlock tail = new Rewriter(func).splitBlock(entry, 1);
        assertEquals(2, func.blocks.size());
        assertSame(tail, func.blocks.get(1));
        assertEquals(1, entry.getEffects().size());
        assertNull(entry.getControl());
        assertSame(bDef, tail.getEffects().get(0));
        assertSame(tail, IRUtils.blockOf(bDef));
        assertSame(ret, tail.getControl());
        assertSame(tail, ret.getExtOrThrow(CommonExts.OWNING_BLOCK));

        entry.setControl(Control.br(tail));
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(3, Interpreter.run(func));
    }

    @Test
    void testSplitBlockOutOfRange() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        entry.setControl(ret());
        assertThrows(IndexOutOfBoundsException.class, () -> new Rewriter(func).splitBlock(entry, 1));
        assertEquals(1, func.blocks.size());
    }

    @Test
    void testCreateBlockBefore() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock exit = func.newBb();
        Var like = func.newVar("like", Type.LONG_TYPE);
        BasicBlock created = new Rewriter(func).createBlockBefore(exit, vars(like));
        assertSame(created, func.blocks.get(1));
        assertEquals(1, created.args.size());
        Var arg = created.args.get(0);
        assertNotSame(like, arg);
        assertEquals("like", arg.name);
        assertEquals(Type.LONG_TYPE, arg.getExtOrThrow(CommonExts.TYPE));
        assertSame(created, arg.getExtOrThrow(CommonExts.BLOCK_ARG_OF));
        assertNull(created.getControl());
        assertSame(entry, func.blocks.get(0));
    }

    @Test
    void testInlineRegionBefore() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 0);
        Effect loop = StructuredOps.buildFor(ib, k, k, k, vars());
        ib.insertCtrl(ret());
        BasicBlock exit = func.newBb();
        exit.setControl(ret());
        Region region = loop.insn().regions().get(0);
        BasicBlock moved = region.getEntry();

        new Rewriter(func).inlineRegionBefore(region, exit);
        assertTrue(region.blocks.isEmpty());
        assertEquals(3, func.blocks.size());
        assertSame(moved, func.blocks.get(1));
        assertSame(func.body, IRUtils.regionOf(moved));
    }

    @Test
    void testReplaceAllUsesAndErase() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var a = constant(ib, 4);
        Var doubled = add(ib, a, a);
        Effect op = lastEffect(ib);
        Var b = constant(ib, 5);
        ib.insertCtrl(ret(mul(ib, doubled, b)));

        Rewriter rw = new Rewriter(func);
        assertThrows(IllegalArgumentException.class,
                () -> rw.replaceAllUsesAndErase(op, Collections.emptyList()));
        assertSame(entry, IRUtils.blockOf(op));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> rw.eraseOp(op));
        assertTrue(e.getMessage().contains("is still used"));
        assertSame(entry, IRUtils.blockOf(op));

        rw.replaceAllUsesAndErase(op, vars(a));
        assertNull(op.getNullable(CommonExts.OWNING_BLOCK));
        assertEquals(0, countOps(func, ArithOps.ADD));
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(20, Interpreter.run(func));
    }

    @Test
    void testEraseKeepsInsertionPoint() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        constant(ib, 1);
        Effect dead = lastEffect(ib);
        Var two = constant(ib, 2);
        ib.insertCtrl(ret(two));

        Rewriter rw = new Rewriter(func);
        rw.setInsertionPointBefore(entry.getEffects().get(1));
        rw.eraseOp(dead);
        Var three = constant(rw, 3);
        assertEquals(2, entry.getEffects().size());
        assertSame(three.getExtOrThrow(CommonExts.ASSIGNED_AT), entry.getEffects().get(0));
        assertSame(two.getExtOrThrow(CommonExts.ASSIGNED_AT), entry.getEffects().get(1));
    }

    @Test
    void testCloneOperation() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 0);
        Var init = constant(ib, 1);
        Effect loop = StructuredOps.buildFor(ib, k, k, k, vars(init));
        BasicBlock body = body(loop);
        IRBuilder bb = new IRBuilder(func, body);
        bb.insertCtrl(StructuredOps.yield(vars(add(bb, body.args.get(1), k))));

        Var replacement = constant(ib, 7);
        Cloner cloner = new Cloner(func);
        cloner.map(init, replacement);
        Rewriter rw = new Rewriter(func);
        rw.setBlock(entry);
        Effect clone = rw.cloneOperation(loop, cloner);
        ib.insertCtrl(ret(clone.getAssignsTo().get(0)));

        assertNotSame(loop.getAssignsTo().get(0), clone.getAssignsTo().get(0));
        assertSame(replacement, clone.insn().args().get(StructuredOps.FOR_INITS));
        BasicBlock clonedBody = body(clone);
        assertNotSame(body, clonedBody);
        assertNotSame(body.args.get(1), clonedBody.args.get(1));
        // the carried value is remapped, the value from outside is kept
        Insn clonedAdd = clonedBody.getEffects().get(0).insn();
        assertSame(clonedBody.args.get(1), clonedAdd.args().get(0));
        assertSame(k, clonedAdd.args().get(1));
        VerifyIntegrity.INSTANCE.run(func);
        assertEquals(7, Interpreter.run(func));
    }

    @Test
    void testReplaceAllUsesWithReachesNestedRegions() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 0);
        Var old = constant(ib, 1);
        Var fresh = constant(ib, 2);
        Effect loop = StructuredOps.buildFor(ib, k, k, k, vars(old));
        ib.insertCtrl(ret(old));
        BasicBlock body = body(loop);
        IRBuilder bb = new IRBuilder(func, body);
        bb.insertCtrl(StructuredOps.yield(vars(add(bb, old, body.args.get(1)))));
        Insn nestedAdd = body.getEffects().get(0).insn();

        new Rewriter(func).replaceAllUsesWith(old, fresh);
        assertSame(fresh, loop.insn().args().get(StructuredOps.FOR_INITS));
        assertSame(fresh, nestedAdd.args().get(0));
        assertSame(fresh, entry.getControl().insn().args().get(0));
        assertEquals(2, Interpreter.run(func));
    }
}
