package io.github.eutro.scf2cfg.core.ssa;

import com.google.common.base.Preconditions;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.util.IRUtils;

import java.util.*;

/**
 * An {@link IRBuilder} that can also restructure the function: split blocks, move regions,
 * replace terminators and values, and erase operations.
 * <p>
 * None of these are transactional. Callers check everything that can go wrong before
 * making the first change.
 */
public class Rewriter extends IRBuilder {
    /**
     * Construct a rewriter over a function, inserting at the end of its entry block.
     *
     * @param func The function.
     */
    public Rewriter(Function func) {
        super(func, func.blocks.isEmpty() ? null : func.blocks.get(0));
    }

    /**
     * Split a block in two. The effects from {@code index} on, and the control,
     * move to a new block inserted right after {@code block} in its region.
     * <p>
     * {@code block} keeps its arguments and is left without a control.
     * The new block has no arguments.
     *
     * @param block The block to split.
     * @param index The index of the first effect to move.
     * @return The new block.
     */
    public BasicBlock splitBlock(BasicBlock block, int index) {
        List<Effect> effects = block.getEffects();
        Preconditions.checkPositionIndex(index, effects.size(), "split index");
        Region region = IRUtils.regionOf(block);
        BasicBlock tail = region.newBbAt(region.blocks.indexOf(block) + 1);
        while (effects.size() > index) {
            tail.addEffect(effects.remove(index));
        }
        tail.setControl(block.getControl());
        block.setControl(null);
        return tail;
    }

    /**
     * Move all blocks of {@code region}, in order, into the region of {@code target},
     * right before it. {@code region} is left empty.
     * <p>
     * Arguments and controls of the moved blocks are kept as they are.
     *
     * @param region The region to empty.
     * @param target The block to insert the blocks before.
     */
    public void inlineRegionBefore(Region region, BasicBlock target) {
        Region dest = IRUtils.regionOf(target);
        Preconditions.checkArgument(region != dest, "cannot inline a region into itself");
        List<BasicBlock> moved = new ArrayList<>(region.blocks);
        region.blocks.clear();
        dest.blocks.addAll(dest.blocks.indexOf(target), moved);
    }

    /**
     * Create a block right before {@code target} in its region, with a fresh argument
     * for each of {@code argsLike}, of the same name and type.
     *
     * @param target   The block to insert before.
     * @param argsLike The variables to model the arguments on.
     * @return The new block, without a control.
     */
    public BasicBlock createBlockBefore(BasicBlock target, List<Var> argsLike) {
        Region region = IRUtils.regionOf(target);
        BasicBlock block = region.newBbAt(region.blocks.indexOf(target));
        for (Var like : argsLike) {
            block.args.add(func.newVar(like.name, like.getNullable(CommonExts.TYPE)));
        }
        return block;
    }

    /**
     * Replace the control of a block.
     *
     * @param block The block.
     * @param ctrl  The new control.
     */
    public void replaceTerminator(BasicBlock block, Control ctrl) {
        block.setControl(ctrl);
    }

    /**
     * Insert a copy of an effect at the insertion point.
     *
     * @param fx     The effect to clone.
     * @param cloner The mapping to clone under.
     * @return The inserted copy.
     */
    public Effect cloneOperation(Effect fx, Cloner cloner) {
        Effect clone = cloner.cloneEffect(fx);
        insert(clone);
        return clone;
    }

    /**
     * Make every instruction in the function that uses {@code from} use {@code to} instead.
     *
     * @param from The variable to replace.
     * @param to   The replacement.
     */
    public void replaceAllUsesWith(Var from, Var to) {
        replaceAllUses(Collections.singletonMap(from, to));
    }

    private void replaceAllUses(Map<Var, Var> replacements) {
        if (replacements.isEmpty()) return;
        IRUtils.forEachInsn(func.body, insn -> {
            ListIterator<Var> it = insn.args().listIterator();
            while (it.hasNext()) {
                Var replacement = replacements.get(it.next());
                if (replacement != null) it.set(replacement);
            }
        });
        func.getExtOrThrow(CommonExts.METADATA_STATE).varsChanged();
    }

    /**
     * Replace each result of {@code op} with the value at the same position in {@code values},
     * then erase {@code op}.
     *
     * @param op     The operation.
     * @param values The replacements, one per result.
     */
    public void replaceAllUsesAndErase(Effect op, List<Var> values) {
        List<Var> results = op.getAssignsTo();
        Preconditions.checkArgument(results.size() == values.size(),
                "%s has %s results, but %s replacements were given", op, results.size(), values.size());
        Map<Var, Var> replacements = new HashMap<>();
        for (int i = 0; i < results.size(); i++) {
            replacements.put(results.get(i), values.get(i));
        }
        replaceAllUses(replacements);
        erase(op);
    }

    /**
     * Erase an effect whose results are unused.
     *
     * @param op The effect.
     * @throws IllegalStateException If a result is still used.
     */
    public void eraseOp(Effect op) {
        Set<Var> results = new HashSet<>(op.getAssignsTo());
        if (!results.isEmpty()) {
            IRUtils.forEachInsn(func.body, insn -> {
                for (Var arg : insn.args()) {
                    Preconditions.checkState(!results.contains(arg),
                            "result %s of %s is still used by %s", arg, op, insn);
                }
            });
        }
        erase(op);
    }

    private void erase(Effect op) {
        BasicBlock block = IRUtils.blockOf(op);
        int index = block.getEffects().indexOf(op);
        block.getEffects().remove(index);
        if (getBlock() == block && insertionIndex() > index) {
            stepBack();
        }
    }
}
