package io.github.eutro.scf2cfg.test;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.*;
import io.github.eutro.scf2cfg.core.passes.convert.CfgToJava;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Utils {
    public static Var constant(IRBuilder ib, Object k) {
        return ib.insert(CommonOps.constant(k), "k", CommonOps.constantType(k));
    }

    public static Var arg(IRBuilder ib, int n, Type type) {
        return ib.insert(CommonOps.ARG.create(n).insn(), "arg" + n, type);
    }

    public static Var add(IRBuilder ib, Var a, Var b) {
        return ib.insert(ArithOps.ADD.insn(a, b), "sum", a.getExtOrThrow(CommonExts.TYPE));
    }

    public static Var mul(IRBuilder ib, Var a, Var b) {
        return ib.insert(ArithOps.MUL.insn(a, b), "prod", a.getExtOrThrow(CommonExts.TYPE));
    }

    public static Var cmp(IRBuilder ib, ArithOps.Predicate pred, Var a, Var b) {
        return ib.insert(ArithOps.CMP.create(pred).insn(a, b), "cmp", Type.BOOLEAN_TYPE);
    }

    public static Effect lastEffect(IRBuilder ib) {
        List<Effect> effects = ib.getBlock().getEffects();
        return effects.get(effects.size() - 1);
    }

    public static BasicBlock body(Effect op) {
        return op.insn().regions().get(0).getEntry();
    }

    public static Effect buildIf(IRBuilder ib, Var cond, boolean withElse, Type... resultTypes) {
        List<Region> regions = new ArrayList<>();
        Region thenRegion = new Region();
        thenRegion.newBb();
        regions.add(thenRegion);
        if (withElse) {
            Region elseRegion = new Region();
            elseRegion.newBb();
            regions.add(elseRegion);
        }
        List<Var> results = new ArrayList<>();
        for (Type type : resultTypes) {
            results.add(ib.func.newVar("r", type));
        }
        Effect op = StructuredOps.IF.insn(Collections.singletonList(cond), regions).assignTo(results);
        ib.insert(op);
        return op;
    }

    public static Effect buildParallel(IRBuilder ib, List<Var> lowers, List<Var> uppers, List<Var> steps, List<Var> inits) {
        Region region = new Region();
        BasicBlock body = region.newBb();
        for (int i = 0; i < lowers.size(); i++) {
            body.args.add(ib.func.newVar("i" + i, lowers.get(i).getExtOrThrow(CommonExts.TYPE)));
        }
        body.setControl(StructuredOps.yield(Collections.emptyList()));
        List<Var> operands = new ArrayList<>();
        operands.addAll(lowers);
        operands.addAll(uppers);
        operands.addAll(steps);
        operands.addAll(inits);
        List<Var> results = new ArrayList<>();
        for (Var init : inits) {
            results.add(ib.func.newVar("red", init.getExtOrThrow(CommonExts.TYPE)));
        }
        Effect op = StructuredOps.PARALLEL.create(lowers.size())
                .insn(operands, Collections.singletonList(region))
                .assignTo(results);
        ib.insert(op);
        return op;
    }

    /**
     * Insert a reduce of {@code contribution}, returning the empty combiner block,
     * which takes {@code (acc, value)}.
     */
    public static BasicBlock buildReduce(IRBuilder ib, Var contribution) {
        Region region = new Region();
        BasicBlock combiner = region.newBb();
        Type type = contribution.getExtOrThrow(CommonExts.TYPE);
        combiner.args.add(ib.func.newVar("acc", type));
        combiner.args.add(ib.func.newVar("val", type));
        ib.insert(StructuredOps.REDUCE.insn(Collections.singletonList(contribution),
                Collections.singletonList(region)).assignTo());
        return combiner;
    }

    public static Control reduceReturn(Var value) {
        return StructuredOps.REDUCE_RETURN.insn(value).jumpsTo();
    }

    public static Control ret(Var... values) {
        return CommonOps.RETURN.insn(values).jumpsTo();
    }

    public static List<Effect> findAll(Function func, OpKind kind) {
        List<Effect> found = new ArrayList<>();
        for (BasicBlock block : IRUtils.allBlocks(func.body)) {
            for (Effect effect : block.getEffects()) {
                if (OpKind.of(effect.insn()) == kind) found.add(effect);
            }
        }
        return found;
    }

    public static int countOps(Function func, Op op) {
        int count = 0;
        for (BasicBlock block : IRUtils.allBlocks(func.body)) {
            for (Effect effect : block.getEffects()) {
                if (effect.insn().op.key == op.key) count++;
            }
        }
        return count;
    }

    public static Method compile(Function func) throws ReflectiveOperationException {
        ClassNode cn = new CfgToJava("io/github/eutro/scf2cfg/test/Compiled", "run").run(func);
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        cn.accept(cw);
        byte[] bytes = cw.toByteArray();
        Class<?> clazz = new ClassLoader(Utils.class.getClassLoader()) {
            Class<?> define() {
                return defineClass(cn.name.replace('/', '.'), bytes, 0, bytes.length);
            }
        }.define();
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals("run")) return method;
        }
        throw new NoSuchMethodException("run");
    }

    public static Object compileAndInvoke(Function func, Object... args) throws ReflectiveOperationException {
        return compile(func).invoke(null, args);
    }

    public static List<Var> vars(Var... vars) {
        return Arrays.asList(vars);
    }
}
