package io.github.eutro.scf2cfg.core.passes.meta;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants of a function, throwing an {@link IllegalStateException}
 * describing the first violation found.
 * <p>
 * Checked are: ownership of blocks, effects and controls; every block having a control;
 * branches staying in their region and passing exactly as many values as their target
 * has arguments; every variable being defined once; and every use being dominated by its definition.
 * Uses in unreachable blocks are not checked for dominance.
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function func) {
        List<BasicBlock> blocks = IRUtils.allBlocks(func.body);
        Set<BasicBlock> blockSet = new HashSet<>(blocks);
        if (blockSet.size() != blocks.size()) {
            throw new IllegalStateException("function contains duplicate blocks");
        }

        Set<Var> defined = new HashSet<>();
        for (BasicBlock block : blocks) {
            checkStructure(block, defined);
        }

        // structure is sound, so the CFG analyses can be trusted
        ComputePreds.INSTANCE.run(func);
        ComputeDoms.INSTANCE.run(func);
        for (BasicBlock block : blocks) {
            if (!block.getExtOrThrow(CommonExts.REACHABLE)) continue;
            List<Effect> effects = block.getEffects();
            for (int i = 0; i < effects.size(); i++) {
                checkUses(effects.get(i).insn(), block, i);
            }
            checkUses(block.getControl().insn(), block, effects.size());
        }
    }

    private static void checkStructure(BasicBlock block, Set<Var> defined) {
        Region region = IRUtils.regionOf(block);
        if (!region.blocks.contains(block)) {
            throw new IllegalStateException(String.format(
                    "block not in its owning region\n  in block: %s",
                    block));
        }
        for (Var arg : block.args) {
            if (!defined.add(arg) || arg.getNullable(CommonExts.BLOCK_ARG_OF) != block) {
                throwRedefined(arg, block);
            }
        }
        for (Effect effect : block.getEffects()) {
            if (effect.getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(String.format(
                        "effect not owned by block\n  effect: %s\n  in block: %s",
                        effect,
                        block));
            }
            for (Var result : effect.getAssignsTo()) {
                if (!defined.add(result) || result.getNullable(CommonExts.ASSIGNED_AT) != effect) {
                    throwRedefined(result, block);
                }
            }
            checkOperandsPresent(effect.insn(), block);
        }

        Control ctrl = block.getControl();
        if (ctrl == null) {
            throw new IllegalStateException(String.format(
                    "block has no control\n  in block: %s",
                    block));
        }
        if (ctrl.getNullable(CommonExts.OWNING_BLOCK) != block) {
            throw new IllegalStateException(String.format(
                    "control not owned by block\n  control: %s\n  in block: %s",
                    ctrl,
                    block));
        }
        checkOperandsPresent(ctrl.insn(), block);

        OpKind kind = OpKind.of(ctrl.insn());
        int expectedTargets = !kind.isBranch() ? 0 : kind == OpKind.BRANCH ? 1 : 2;
        if (ctrl.targets.size() != expectedTargets) {
            throw new IllegalStateException(String.format(
                    "%s must have %d targets, has %d\n  in block: %s",
                    ctrl.insn().op, expectedTargets, ctrl.targets.size(), block));
        }
        if (kind == OpKind.CONDITIONAL_BRANCH && ctrl.insn().args().isEmpty()) {
            throw new IllegalStateException(String.format(
                    "conditional branch without a condition\n  in block: %s",
                    block));
        }
        for (int i = 0; i < ctrl.targets.size(); i++) {
            BasicBlock target = ctrl.targets.get(i);
            if (target.getNullable(CommonExts.OWNING_REGION) != region) {
                throw new IllegalStateException(String.format(
                        "branch target not in the same region;" +
                                "\n  referenced: %s" +
                                "\n  instruction: %s" +
                                "\n  in block: %s",
                        target.toTargetString(),
                        ctrl,
                        block));
            }
            int passed = ctrl.targetArgs(i).size();
            if (passed != target.args.size()) {
                throw new IllegalStateException(String.format(
                        "branch passes %d values to a block with %d arguments" +
                                "\n  referenced: %s" +
                                "\n  in block: %s",
                        passed,
                        target.args.size(),
                        target,
                        block));
            }
        }
    }

    private static void checkOperandsPresent(Insn insn, BasicBlock block) {
        for (Var arg : insn.args()) {
            if (arg == null) {
                throw new IllegalStateException(String.format(
                        "missing operand\n  instruction: %s\n  in block: %s",
                        insn,
                        block));
            }
        }
    }

    private static void throwRedefined(Var var, BasicBlock block) {
        throw new IllegalStateException(String.format(
                "variable %s is defined more than once\n  in block: %s",
                var,
                block));
    }

    private static void checkUses(Insn insn, BasicBlock block, int position) {
        for (Var arg : insn.args()) {
            if (!isVisible(arg, block, position)) {
                throw new IllegalStateException(String.format(
                        "use of %s is not dominated by its definition\n  instruction: %s\n  in block: %s",
                        arg,
                        insn,
                        block));
            }
        }
    }

    /**
     * Check whether the definition of {@code var} dominates a position in a block. Block arguments
     * are at position -1, the control at the number of effects. Uses in nested regions are
     * checked at the position of the instruction that owns the region.
     */
    private static boolean isVisible(Var var, BasicBlock useBlock, int usePos) {
        BasicBlock defBlock;
        int defPos;
        Effect assignedAt = var.getNullable(CommonExts.ASSIGNED_AT);
        if (assignedAt != null) {
            defBlock = assignedAt.getNullable(CommonExts.OWNING_BLOCK);
            if (defBlock == null) return false;
            defPos = defBlock.getEffects().indexOf(assignedAt);
        } else {
            defBlock = var.getNullable(CommonExts.BLOCK_ARG_OF);
            if (defBlock == null) return false;
            defPos = -1;
        }
        Region defRegion = defBlock.getNullable(CommonExts.OWNING_REGION);

        BasicBlock block = useBlock;
        int pos = usePos;
        while (true) {
            if (IRUtils.regionOf(block) == defRegion) {
                if (block == defBlock) return defPos < pos;
                return ComputeDoms.dominates(defBlock, block);
            }
            Effect parent = IRUtils.parentEffect(block);
            if (parent == null) return false;
            block = IRUtils.blockOf(parent);
            pos = block.getEffects().indexOf(parent);
        }
    }
}
