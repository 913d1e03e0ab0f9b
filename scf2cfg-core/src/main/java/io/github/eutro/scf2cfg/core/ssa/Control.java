package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.Ext;
import io.github.eutro.scf2cfg.core.ext.ExtHolder;
import io.github.eutro.scf2cfg.core.ops.CommonOps;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A control instruction, the terminator of a block, encapsulating a raw {@link Insn instruction}
 * and the jump targets.
 */
public final class Control extends ExtHolder {
    private Insn insn;
    /**
     * The jump targets of this instruction. The semantics of the order depend on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        this.setInsn(insn);
        this.targets = targets;
    }

    /**
     * Construct an unconditional branch to a block.
     *
     * @param target The jump target.
     * @param args   The values passed as the target's block arguments.
     * @return The branch.
     */
    public static Control br(BasicBlock target, Var... args) {
        return br(target, Arrays.asList(args));
    }

    /**
     * Construct an unconditional branch to a block.
     *
     * @param target The jump target.
     * @param args   The values passed as the target's block arguments.
     * @return The branch.
     */
    public static Control br(BasicBlock target, List<Var> args) {
        return CommonOps.BR.insn(args).jumpsTo(target);
    }

    /**
     * Construct a conditional branch.
     *
     * @param cond      The {@code boolean} condition.
     * @param ifTrue    The block to go to if the condition holds.
     * @param trueArgs  The block arguments passed to {@code ifTrue}.
     * @param ifFalse   The block to go to otherwise.
     * @param falseArgs The block arguments passed to {@code ifFalse}.
     * @return The branch.
     */
    public static Control brCond(Var cond,
                                 BasicBlock ifTrue, List<Var> trueArgs,
                                 BasicBlock ifFalse, List<Var> falseArgs) {
        List<Var> args = new ArrayList<>(1 + trueArgs.size() + falseArgs.size());
        args.add(cond);
        args.addAll(trueArgs);
        args.addAll(falseArgs);
        return CommonOps.BR_COND.create(trueArgs.size()).insn(args).jumpsTo(ifTrue, ifFalse);
    }

    /**
     * Get the values this instruction passes to the block arguments of one of its targets.
     *
     * @param target The index of the target in {@link #targets}.
     * @return A view of the instruction's arguments.
     * @throws IllegalStateException If this is not a branch.
     */
    public List<Var> targetArgs(int target) {
        List<Var> args = insn.args();
        switch (OpKind.of(insn)) {
            case BRANCH:
                if (target != 0) throw new IndexOutOfBoundsException("br has one target, not " + (target + 1));
                return args;
            case CONDITIONAL_BRANCH: {
                int trueCount = CommonOps.BR_COND.cast(insn.op).arg;
                switch (target) {
                    // @formatter:off
                    case 0: return args.subList(1, 1 + trueCount);
                    case 1: return args.subList(1 + trueCount, args.size());
                    // @formatter:on
                    default:
                        throw new IndexOutOfBoundsException("br_cond has two targets, not " + (target + 1));
                }
            }
            default:
                throw new IllegalStateException(String.format("%s does not pass block arguments", insn.op));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn());
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this control instruction.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
