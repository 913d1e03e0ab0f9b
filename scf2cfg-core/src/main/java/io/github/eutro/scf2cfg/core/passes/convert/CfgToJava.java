package io.github.eutro.scf2cfg.core.passes.convert;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.Ext;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.CommonOps;
import io.github.eutro.scf2cfg.core.ops.OpKey;
import io.github.eutro.scf2cfg.core.passes.IRPass;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.GraphWalker;
import org.objectweb.asm.Label;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.*;

/**
 * Compiles a function into a class with a single {@code public static} method.
 * <p>
 * Structured control flow is lowered first if it hasn't been already. The parameter types are
 * the types of the {@link CommonOps#ARG} results, the return type is that of the
 * {@link CommonOps#RETURN} operand, or {@code void}.
 * <p>
 * Every variable gets its own local. Stack map frames are not emitted, so the class should be
 * written with {@link org.objectweb.asm.ClassWriter#COMPUTE_FRAMES}.
 */
public class CfgToJava implements IRPass<Function, ClassNode> {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private static final Ext<Integer> LOCAL_EXT = Ext.create(Integer.class, "LOCAL_EXT");
    private static final Ext<Label> LABEL_EXT = Ext.create(Label.class, "LABEL_EXT");
    private static final Ext<BasicBlock> NEXT_BLOCK_EXT = Ext.create(BasicBlock.class, "NEXT_BLOCK_EXT");

    private final String className;
    private final String methodName;

    /**
     * Construct a compiler producing the given class and method.
     *
     * @param className  The internal name of the class.
     * @param methodName The name of the method.
     */
    public CfgToJava(String className, String methodName) {
        this.className = className;
        this.methodName = methodName;
    }

    @Override
    public ClassNode run(Function func) {
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.CONTROL_FLATTENED);

        List<BasicBlock> blockOrder = GraphWalker.blockWalker(func.body, true).postOrder().toList();
        Collections.reverse(blockOrder);

        ClassNode cn = new ClassNode();
        cn.visit(
                Opcodes.V1_8,
                Opcodes.ACC_SUPER | Opcodes.ACC_PUBLIC,
                className,
                null,
                Type.getInternalName(Object.class),
                null
        );
        MethodNode mn = new MethodNode(
                Opcodes.ACC_PUBLIC | Opcodes.ACC_STATIC,
                methodName,
                computeDescriptor(blockOrder),
                null,
                null
        );
        try {
            compileFuncInto(mn, blockOrder);
        } catch (RuntimeException e) {
            throw new RuntimeException("error generating code for method " + methodName, e);
        }
        cn.methods.add(mn);
        logger.atFine().log("compiled %s.%s%s from %d blocks", className, methodName, mn.desc, blockOrder.size());
        return cn;
    }

    private static String computeDescriptor(List<BasicBlock> blocks) {
        Map<Integer, Type> params = new TreeMap<>();
        Type returnType = null;
        for (BasicBlock block : blocks) {
            for (Effect effect : block.getEffects()) {
                if (effect.insn().op.key != CommonOps.ARG) continue;
                int index = CommonOps.ARG.cast(effect.insn().op).arg;
                Type ty = typeOf(effect.getAssignsTo().get(0));
                Type existing = params.put(index, ty);
                if (existing != null && !existing.equals(ty)) {
                    throw new IllegalStateException(String.format(
                            "parameter %d read as both %s and %s\n  in block: %s",
                            index, existing, ty, block));
                }
            }
            Control ctrl = block.getControl();
            if (ctrl == null) {
                throw new IllegalStateException(String.format("block has no control\n  in block: %s", block));
            }
            if (ctrl.insn().op.key == CommonOps.RETURN.key) {
                List<Var> args = ctrl.insn().args();
                if (args.size() > 1) {
                    throw new IllegalStateException(String.format(
                            "cannot return %d values\n  in block: %s",
                            args.size(), block));
                }
                Type ty = args.isEmpty() ? Type.VOID_TYPE : typeOf(args.get(0));
                if (returnType != null && !returnType.equals(ty)) {
                    throw new IllegalStateException(String.format(
                            "returns both %s and %s\n  in block: %s",
                            returnType, ty, block));
                }
                returnType = ty;
            }
        }
        Type[] paramTypes = new Type[params.size()];
        for (Map.Entry<Integer, Type> entry : params.entrySet()) {
            if (entry.getKey() < 0 || entry.getKey() >= paramTypes.length) {
                throw new IllegalStateException("parameters are not numbered contiguously from 0: " + params.keySet());
            }
            paramTypes[entry.getKey()] = entry.getValue();
        }
        return Type.getMethodDescriptor(returnType == null ? Type.VOID_TYPE : returnType, paramTypes);
    }

    private static Type typeOf(Var var) {
        Type ty = var.getNullable(CommonExts.TYPE);
        if (ty == null) {
            throw new IllegalStateException(String.format("type of var %s is not known", var));
        }
        return ty;
    }

    private void compileFuncInto(MethodNode mn, List<BasicBlock> blockOrder) {
        // 1. tag each block with a label, and the block laid out after it
        {
            Iterator<BasicBlock> it = blockOrder.iterator();
            BasicBlock next = it.next();
            while (true) {
                BasicBlock curr = next;
                curr.attachExt(LABEL_EXT, new Label());
                if (it.hasNext()) {
                    next = it.next();
                    curr.attachExt(NEXT_BLOCK_EXT, next);
                } else {
                    break;
                }
            }
        }

        // 2. a local for every variable
        JavaBuilder jb = new JavaBuilder(mn);
        List<Var> allVars = new ArrayList<>();
        for (BasicBlock block : blockOrder) {
            allVars.addAll(block.args);
            for (Effect effect : block.getEffects()) {
                allVars.addAll(effect.getAssignsTo());
            }
        }
        for (Var var : allVars) {
            var.attachExt(LOCAL_EXT, jb.newLocal(typeOf(var)));
        }

        // 3. the code, block by block
        jb.visitCode();
        for (BasicBlock block : blockOrder) {
            jb.mark(block.getExtOrThrow(LABEL_EXT));
            for (Effect effect : block.getEffects()) {
                Converter<Effect> converter = FX_CONVERTERS.get(effect.insn().op.key);
                if (converter == null) {
                    throw missingConverter(effect.insn(), block);
                }
                emitLoads(jb, effect.insn().args());
                converter.convert(jb, effect);
                emitStores(jb, effect.getAssignsTo());
            }
            Control ctrl = block.getControl();
            Converter<Control> converter = CTRL_CONVERTERS.get(ctrl.insn().op.key);
            if (converter == null) {
                throw missingConverter(ctrl.insn(), block);
            }
            converter.convert(jb, ctrl);
        }
        jb.endMethod();

        for (BasicBlock block : blockOrder) {
            block.removeExt(LABEL_EXT);
            block.removeExt(NEXT_BLOCK_EXT);
        }
        for (Var var : allVars) {
            var.removeExt(LOCAL_EXT);
        }
    }

    private static RuntimeException missingConverter(Insn insn, BasicBlock block) {
        return new IllegalStateException(String.format(
                "converter missing for key: %s\n  in block: %s",
                insn.op.key,
                block));
    }

    private static class JavaBuilder extends GeneratorAdapter {
        protected JavaBuilder(MethodNode node) {
            super(Opcodes.ASM9, node, node.access, node.name, node.desc);
        }
    }

    private interface Converter<T> {
        void convert(JavaBuilder jb, T t);
    }

    private static final Map<OpKey, Converter<Effect>> FX_CONVERTERS = new HashMap<>();
    private static final Map<OpKey, Converter<Control>> CTRL_CONVERTERS = new HashMap<>();

    static {
        FX_CONVERTERS.put(CommonOps.ARG, (jb, fx) ->
                jb.loadArg(CommonOps.ARG.cast(fx.insn().op).arg));
        FX_CONVERTERS.put(CommonOps.CONST, (jb, fx) -> {
            Object cst = CommonOps.CONST.cast(fx.insn().op).arg;
            if (cst instanceof Integer) jb.push((int) cst);
            else if (cst instanceof Long) jb.push((long) cst);
            else if (cst instanceof Boolean) jb.push((boolean) cst);
            else throw new IllegalStateException("unsupported constant: " + cst);
        });
        FX_CONVERTERS.put(ArithOps.ADD.key, (jb, fx) ->
                jb.math(GeneratorAdapter.ADD, typeOf(fx.getAssignsTo().get(0))));
        FX_CONVERTERS.put(ArithOps.SUB.key, (jb, fx) ->
                jb.math(GeneratorAdapter.SUB, typeOf(fx.getAssignsTo().get(0))));
        FX_CONVERTERS.put(ArithOps.MUL.key, (jb, fx) ->
                jb.math(GeneratorAdapter.MUL, typeOf(fx.getAssignsTo().get(0))));
        FX_CONVERTERS.put(ArithOps.CMP, (jb, fx) -> {
            ArithOps.Predicate pred = ArithOps.CMP.cast(fx.insn().op).arg;
            Label trueLabel = jb.newLabel();
            Label endLabel = jb.newLabel();
            jb.ifCmp(typeOf(fx.insn().args().get(0)), pred.mode, trueLabel);
            jb.push(false);
            jb.goTo(endLabel);
            jb.mark(trueLabel);
            jb.push(true);
            jb.mark(endLabel);
        });
    }

    static {
        CTRL_CONVERTERS.put(CommonOps.BR.key, (jb, ct) -> {
            emitCopies(jb, ct, 0);
            jumpTo(jb, ct, ct.targets.get(0));
        });
        CTRL_CONVERTERS.put(CommonOps.BR_COND, (jb, ct) -> {
            Label trueEdge = jb.newLabel();
            emitLoads(jb, ct.insn().args().subList(0, 1));
            jb.ifZCmp(GeneratorAdapter.NE, trueEdge);
            emitCopies(jb, ct, 1);
            jb.goTo(ct.targets.get(1).getExtOrThrow(LABEL_EXT));
            jb.mark(trueEdge);
            emitCopies(jb, ct, 0);
            jumpTo(jb, ct, ct.targets.get(0));
        });
        CTRL_CONVERTERS.put(CommonOps.RETURN.key, (jb, ct) -> {
            emitLoads(jb, ct.insn().args());
            jb.returnValue();
        });
    }

    private static void jumpTo(JavaBuilder jb, Control ct, BasicBlock target) {
        if (ct.getExtOrThrow(CommonExts.OWNING_BLOCK).getExt(NEXT_BLOCK_EXT).orElse(null) != target) {
            jb.goTo(target.getExtOrThrow(LABEL_EXT));
        }
    }

    // all values are loaded before any argument is stored, since a branch may permute them
    private static void emitCopies(JavaBuilder jb, Control ct, int target) {
        emitLoads(jb, ct.targetArgs(target));
        emitStores(jb, ct.targets.get(target).args);
    }

    private static void emitLoads(JavaBuilder jb, List<Var> vars) {
        for (Var arg : vars) {
            jb.loadLocal(arg.getExtOrThrow(LOCAL_EXT), typeOf(arg));
        }
    }

    private static void emitStores(JavaBuilder jb, List<Var> vars) {
        ListIterator<Var> it = vars.listIterator(vars.size());
        while (it.hasPrevious()) {
            Var var = it.previous();
            jb.storeLocal(var.getExtOrThrow(LOCAL_EXT), typeOf(var));
        }
    }
}
