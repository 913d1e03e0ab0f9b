package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a list of block arguments, a list of {@link Effect} instructions,
 * and exactly one {@link Control} instruction at the end.
 * <p>
 * Block arguments take the place of phis; every branch to the block passes one value per argument.
 * A block may be without a control only while it is being built.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The arguments of this block, in order.
     */
    public final List<Var> args = new TrackedList<Var>(new ArrayList<>()) {
        @Override
        protected void onAdded(Var elt) {
            elt.attachExt(CommonExts.BLOCK_ARG_OF, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Var elt) {
            if (elt.getNullable(CommonExts.BLOCK_ARG_OF) == BasicBlock.this) {
                elt.removeExt(CommonExts.BLOCK_ARG_OF);
            }
        }
    };
    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            if (elt.getNullable(CommonExts.OWNING_BLOCK) == BasicBlock.this) {
                elt.removeExt(CommonExts.OWNING_BLOCK);
            }
        }
    };
    private Control control;

    BasicBlock() {
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (!args.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(args.get(i));
            }
            sb.append(')');
        }
        sb.append(":\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control == null ? "<no control>" : control);
        return sb.toString();
    }

    /**
     * Get the (mutable) list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block.
     *
     * @return The control instruction, or null if the block is still being built.
     */
    public Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block, replacing any existing one.
     *
     * @param control The control instruction, or null to leave the block unterminated.
     */
    public void setControl(@Nullable Control control) {
        if (this.control != null && this.control.getNullable(CommonExts.OWNING_BLOCK) == this) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        if (control != null) {
            control.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        this.control = control;
    }

    // exts
    private Region owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = (Region) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_REGION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
