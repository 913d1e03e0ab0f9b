package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.*;
import io.github.eutro.scf2cfg.core.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An instruction: an {@link Op} applied to argument {@link Var}s, owning any nested {@link Region}s.
 * <p>
 * An instruction is either wrapped in an {@link Effect}, which gives it results,
 * or in a {@link Control}, which gives it jump targets.
 */
public final class Insn extends DelegatingExtHolder {
    /**
     * Whether to record where each instruction was constructed, for debugging.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("SCF2CFG_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this instruction was constructed, if {@link #TRACK_INSN_CREATIONS} is set.
     */
    public final Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    /**
     * The operation.
     */
    public Op op;
    private final List<Var> args;
    private final List<Region> regions = new TrackedList<Region>(new ArrayList<>(0)) {
        @Override
        protected void onAdded(Region elt) {
            elt.attachExt(CommonExts.OWNING_INSN, Insn.this);
        }

        @Override
        protected void onRemoved(Region elt) {
            elt.removeExt(CommonExts.OWNING_INSN);
        }
    };

    /**
     * Construct an instruction.
     *
     * @param op      The operation.
     * @param args    The arguments, which are copied.
     * @param regions The nested regions, which this instruction takes ownership of.
     */
    public Insn(Op op, List<Var> args, List<Region> regions) {
        this.op = op;
        this.args = new ArrayList<>(args);
        this.regions.addAll(regions);
    }

    /**
     * Construct an instruction without regions.
     *
     * @param op   The operation.
     * @param args The arguments.
     */
    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args), new ArrayList<>(0));
    }

    /**
     * Get the (mutable) list of arguments of this instruction.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    /**
     * Get the (mutable) list of regions nested in this instruction.
     *
     * @return The regions.
     */
    public List<Region> regions() {
        return regions;
    }

    /**
     * Wrap this instruction in an effect assigning to the given variables.
     *
     * @param vars The results.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return assignTo(Arrays.asList(vars));
    }

    /**
     * Wrap this instruction in an effect assigning to the given variables.
     *
     * @param vars The results.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Wrap this instruction in a control instruction jumping to the given blocks.
     *
     * @param targets The jump targets.
     * @return The control instruction.
     */
    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    /**
     * Wrap this instruction in a control instruction jumping to the given blocks.
     *
     * @param targets The jump targets.
     * @return The control instruction.
     */
    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        for (Region region : regions) {
            sb.append(' ').append(region);
        }
        return sb.toString();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
