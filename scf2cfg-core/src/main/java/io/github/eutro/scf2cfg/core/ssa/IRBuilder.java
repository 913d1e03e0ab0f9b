package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import org.objectweb.asm.Type;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions are being inserted.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    // -1 inserts at the end of the block
    private int index = -1;

    /**
     * Construct an instruction builder, inserting at the end of a specific basic block.
     *
     * @param func The function.
     * @param bb   A block in the function.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    /**
     * Get the block this builder is inserting into.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return bb;
    }

    /**
     * Insert at the end of the given block from now on.
     *
     * @param bb The block.
     */
    public void setBlock(BasicBlock bb) {
        this.bb = bb;
        this.index = -1;
    }

    /**
     * Insert right before the given effect from now on.
     *
     * @param effect The effect, which must be in a block.
     */
    public void setInsertionPointBefore(Effect effect) {
        BasicBlock block = effect.getExtOrThrow(CommonExts.OWNING_BLOCK);
        this.bb = block;
        this.index = block.getEffects().indexOf(effect);
    }

    int insertionIndex() {
        return index;
    }

    void stepBack() {
        index--;
    }

    /**
     * Insert an effect at the insertion point. Later insertions go after it.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        if (index < 0) {
            bb.addEffect(effect);
        } else {
            bb.getEffects().add(index++, effect);
        }
    }

    /**
     * Assign the result of the instruction to a variable, and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new variable, and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the variable.
     * @param type The type of the variable.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name, Type type) {
        return insert(insn, func.newVar(name, type));
    }

    /**
     * Set the control instruction of the current block.
     *
     * @param ctrl The instruction to insert.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(ctrl);
    }
}
