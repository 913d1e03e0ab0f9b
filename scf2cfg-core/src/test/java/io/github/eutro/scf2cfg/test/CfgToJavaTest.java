package io.github.eutro.scf2cfg.test;

import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.passes.convert.CfgToJava;
import io.github.eutro.scf2cfg.core.passes.lower.ConversionException;
import io.github.eutro.scf2cfg.core.ssa.*;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.lang.reflect.Method;
import java.util.Collections;

import static io.github.eutro.scf2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class CfgToJavaTest {
    @Test
    void testDescriptor() {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var b = arg(ib, 1, Type.LONG_TYPE);
        arg(ib, 0, Type.BOOLEAN_TYPE);
        ib.insertCtrl(ret(b));

        ClassNode cn = new CfgToJava("pkg/Out", "f").run(func);
        assertEquals("pkg/Out", cn.name);
        assertEquals(1, cn.methods.size());
        MethodNode mn = cn.methods.get(0);
        assertEquals("f", mn.name);
        assertEquals("(ZJ)J", mn.desc);
    }

    @Test
    void testSumBelow() throws Throwable {
        // sum of [0, n)
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var n = arg(ib, 0, Type.INT_TYPE);
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Effect loop = StructuredOps.buildFor(ib, zero, n, one, vars(zero));
        ib.insertCtrl(ret(loop.getAssignsTo().get(0)));
        BasicBlock body = body(loop);
        IRBuilder bb = new IRBuilder(func, body);
        bb.insertCtrl(StructuredOps.yield(vars(add(bb, body.args.get(1), body.args.get(0)))));

        Method method = compile(func);
        assertEquals(int.class, method.getReturnType());
        assertEquals(10, method.invoke(null, 5));
        assertEquals(0, method.invoke(null, 0));
        assertEquals(0, method.invoke(null, -3));
    }

    @Test
    void testSwappedBlockArguments() throws Throwable {
        // (a, b) = (1, 2); repeat n times: (a, b) = (b, a); return a * 10 + b
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var n = arg(ib, 0, Type.INT_TYPE);
        Var zero = constant(ib, 0);
        Var one = constant(ib, 1);
        Var two = constant(ib, 2);
        Var ten = constant(ib, 10);
        Effect loop = StructuredOps.buildFor(ib, zero, n, one, vars(one, two));
        Var a = loop.getAssignsTo().get(0);
        Var b = loop.getAssignsTo().get(1);
        ib.insertCtrl(ret(add(ib, mul(ib, a, ten), b)));
        BasicBlock body = body(loop);
        body.setControl(StructuredOps.yield(vars(body.args.get(2), body.args.get(1))));

        Method method = compile(func);
        assertEquals(12, method.invoke(null, 0));
        assertEquals(21, method.invoke(null, 3));
        assertEquals(12, method.invoke(null, 4));
        assertEquals(21, Interpreter.run(func, 3));
    }

    @Test
    void testComparisons() throws Throwable {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var x = arg(ib, 0, Type.LONG_TYPE);
        Var y = arg(ib, 1, Type.LONG_TYPE);
        Effect op = buildIf(ib, cmp(ib, ArithOps.Predicate.SGE, x, y), true, Type.LONG_TYPE);
        ib.insertCtrl(ret(op.getAssignsTo().get(0)));
        IRBuilder tb = new IRBuilder(func, body(op));
        tb.insertCtrl(StructuredOps.yield(vars(tb.insert(ArithOps.SUB.insn(x, y), "diff", Type.LONG_TYPE))));
        op.insn().regions().get(1).getEntry().setControl(StructuredOps.yield(vars(x)));

        Method method = compile(func);
        assertEquals(3L, method.invoke(null, 5L, 2L));
        assertEquals(0L, method.invoke(null, 2L, 2L));
        assertEquals(-7L, method.invoke(null, -7L, 2L));
    }

    @Test
    void testVoidReturn() throws Throwable {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        constant(ib, 1);
        ib.insertCtrl(ret());
        Method method = compile(func);
        assertEquals(void.class, method.getReturnType());
        assertNull(method.invoke(null));
    }

    @Test
    void testRejectsLeftoverStructuredOps() {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var k = constant(ib, 0);
        StructuredOps.buildFor(ib, k, null, k, Collections.emptyList());
        ib.insertCtrl(ret());
        assertThrows(ConversionException.class, () -> new CfgToJava("pkg/Out", "f").run(func));
    }

    @Test
    void testRejectsUntypedVariables() {
        Function func = new Function();
        IRBuilder ib = new IRBuilder(func, func.newBb());
        Var k = ib.insert(ArithOps.ADD.insn(), func.newVar("untyped", null));
        ib.insertCtrl(ret(k));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new CfgToJava("pkg/Out", "f").run(func));
        assertTrue(e.getMessage().contains("type of var $untyped is not known"));
    }
}
