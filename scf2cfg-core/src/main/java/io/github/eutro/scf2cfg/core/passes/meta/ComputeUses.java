package io.github.eutro.scf2cfg.core.passes.meta;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compute the {@link CommonExts#USED_AT uses} of every {@link Var} in a function, nested regions included.
 * Every variable defined in the function gets a (possibly empty) set.
 */
public class ComputeUses implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Function func) {
        List<BasicBlock> blocks = IRUtils.allBlocks(func.body);
        for (BasicBlock block : blocks) {
            for (Var arg : block.args) {
                arg.attachExt(CommonExts.USED_AT, new HashSet<>());
            }
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    var.attachExt(CommonExts.USED_AT, new HashSet<>());
                }
            }
        }
        for (BasicBlock block : blocks) {
            for (Effect effect : block.getEffects()) {
                addUses(effect.insn());
            }
            if (block.getControl() != null) {
                addUses(block.getControl().insn());
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.USES);
    }

    private static void addUses(Insn insn) {
        for (Var arg : insn.args()) {
            if (arg != null) getOrCreateUses(arg).add(insn);
        }
    }

    // variables defined outside the function still get their uses recorded
    @NotNull
    private static Set<Insn> getOrCreateUses(Var arg) {
        Set<Insn> uses = arg.getNullable(CommonExts.USED_AT);
        if (uses == null) {
            uses = new HashSet<>();
            arg.attachExt(CommonExts.USED_AT, uses);
        }
        return uses;
    }
}
