package io.github.eutro.scf2cfg.test;

import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.CommonOps;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.passes.meta.VerifyIntegrity;
import io.github.eutro.scf2cfg.core.ssa.*;
import org.junit.jupiter.api.Test;

import static io.github.eutro.scf2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class VerifyIntegrityTest {
    private static IllegalStateException assertInvalid(Function func, String message) {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> VerifyIntegrity.INSTANCE.run(func));
        assertTrue(e.getMessage().startsWith(message), e.getMessage());
        return e;
    }

    @Test
    void testWellFormed() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock next = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 1);
        entry.setControl(Control.br(next, k));
        next.args.add(func.newVar("x", null));
        next.setControl(ret(next.args.get(0)));
        VerifyIntegrity.INSTANCE.run(func);
    }

    @Test
    void testMissingControl() {
        Function func = new Function();
        constant(new IRBuilder(func, func.newBb()), 1);
        assertInvalid(func, "block has no control");
    }

    @Test
    void testArgumentCountMismatch() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock next = func.newBb();
        entry.setControl(Control.br(next));
        next.args.add(func.newVar("x", null));
        next.setControl(ret());
        assertInvalid(func, "branch passes 0 values to a block with 1 arguments");
    }

    @Test
    void testUseNotDominated() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock left = func.newBb();
        BasicBlock right = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var cond = constant(ib, true);
        entry.setControl(Control.brCond(cond,
                left, vars(),
                right, vars()));
        Var leftOnly = constant(new IRBuilder(func, left), 1);
        left.setControl(Control.br(right));
        right.setControl(ret(leftOnly));
        assertInvalid(func, "use of " + leftOnly + " is not dominated by its definition");
    }

    @Test
    void testUseBeforeDefinition() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        Var later = func.newVar("later", null);
        entry.addEffect(ArithOps.ADD.insn(later, later).assignTo(func.newVar("sum", null)));
        entry.addEffect(CommonOps.constant(1).assignTo(later));
        entry.setControl(ret());
        assertInvalid(func, "use of $later");
    }

    @Test
    void testBranchOutOfRegion() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 0);
        Effect loop = StructuredOps.buildFor(ib, k, k, k, vars());
        entry.setControl(ret());
        body(loop).setControl(Control.br(entry));
        assertInvalid(func, "branch target not in the same region");
    }

    @Test
    void testNestedRegionSeesOuterValues() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var k = constant(ib, 0);
        Effect loop = StructuredOps.buildFor(ib, k, k, k, vars(k));
        entry.setControl(ret(loop.getAssignsTo().get(0)));
        IRBuilder bb = new IRBuilder(func, body(loop));
        bb.insertCtrl(StructuredOps.yield(vars(add(bb, k, body(loop).args.get(1)))));
        VerifyIntegrity.INSTANCE.run(func);
    }

    @Test
    void testDefinedTwice() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock next = func.newBb();
        Var x = func.newVar("x", null);
        entry.args.add(x);
        entry.setControl(Control.br(next));
        next.args.add(x);
        next.setControl(ret());
        assertInvalid(func, "variable $x is defined more than once");
    }
}
