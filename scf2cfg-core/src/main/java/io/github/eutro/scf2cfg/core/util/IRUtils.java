package io.github.eutro.scf2cfg.core.util;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Helpers for walking and navigating nested regions.
 */
public class IRUtils {
    /**
     * Get every block in a region, including the blocks of regions nested in its instructions.
     * <p>
     * Each block comes before the blocks nested in it, and nested blocks come before the
     * next block of the enclosing region.
     *
     * @param region The region.
     * @return The blocks.
     */
    public static List<BasicBlock> allBlocks(Region region) {
        List<BasicBlock> blocks = new ArrayList<>();
        collectBlocks(region, blocks);
        return blocks;
    }

    private static void collectBlocks(Region region, List<BasicBlock> out) {
        for (BasicBlock block : region.blocks) {
            out.add(block);
            for (Effect effect : block.getEffects()) {
                for (Region nested : effect.insn().regions()) {
                    collectBlocks(nested, out);
                }
            }
        }
    }

    /**
     * Run {@code f} on every instruction in a region, nested ones included.
     *
     * @param region The region.
     * @param f      The function to run.
     */
    public static void forEachInsn(Region region, Consumer<Insn> f) {
        for (BasicBlock block : allBlocks(region)) {
            for (Effect effect : block.getEffects()) {
                f.accept(effect.insn());
            }
            if (block.getControl() != null) {
                f.accept(block.getControl().insn());
            }
        }
    }

    /**
     * Get the region a block is in.
     *
     * @param block The block.
     * @return The region.
     */
    public static Region regionOf(BasicBlock block) {
        return block.getExtOrThrow(CommonExts.OWNING_REGION);
    }

    /**
     * Get the effect whose instruction owns the region a block is in.
     *
     * @param block The block.
     * @return The enclosing effect, or null if the block is in a function body.
     */
    public static @Nullable Effect parentEffect(BasicBlock block) {
        Insn parent = regionOf(block).getNullable(CommonExts.OWNING_INSN);
        return parent == null ? null : parent.getNullable(CommonExts.OWNING_EFFECT);
    }

    /**
     * Get the block an effect is in.
     *
     * @param effect The effect.
     * @return The block.
     */
    public static BasicBlock blockOf(Effect effect) {
        return effect.getExtOrThrow(CommonExts.OWNING_BLOCK);
    }

    /**
     * Check whether an effect is still part of a function, in its body or in a region
     * nested in it. An effect in the region of an erased instruction is not.
     *
     * @param effect The effect.
     * @param func   The function.
     * @return Whether the effect is reachable from the function's body.
     */
    public static boolean isAttached(Effect effect, Function func) {
        Effect current = effect;
        while (current != null) {
            BasicBlock block = current.getNullable(CommonExts.OWNING_BLOCK);
            Region region = block == null ? null : block.getNullable(CommonExts.OWNING_REGION);
            if (region == null) return false;
            if (region.getNullable(CommonExts.OWNING_FUNCTION) == func) return true;
            Insn insn = region.getNullable(CommonExts.OWNING_INSN);
            current = insn == null ? null : insn.getNullable(CommonExts.OWNING_EFFECT);
        }
        return false;
    }
}
