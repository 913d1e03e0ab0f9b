package io.github.eutro.scf2cfg.core.ext;

import io.github.eutro.scf2cfg.core.ops.OpKey;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.passes.meta.ComputeDoms;
import io.github.eutro.scf2cfg.core.passes.meta.ComputePreds;
import io.github.eutro.scf2cfg.core.passes.meta.ComputeUses;
import io.github.eutro.scf2cfg.core.ssa.*;
import org.objectweb.asm.Type;

import java.util.List;
import java.util.Set;

/**
 * The {@link Ext}s used throughout the IR.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which analyses are currently up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The
     * <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">immediate dominator</a> of the block
     * within its region. Absent on region entries and unreachable blocks.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");
    /**
     * Attached to a {@link BasicBlock}. Whether the block is reachable from its region's entry.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<Boolean> REACHABLE = Ext.create(Boolean.class, "REACHABLE");
    /**
     * Attached to a {@link BasicBlock}. The blocks that branch to this one, once per branching block.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to a {@link Var}. The {@link Effect} whose result it is, if it is an op result.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    /**
     * Attached to a {@link Var}. The {@link BasicBlock} whose argument it is, if it is a block argument.
     */
    public static final Ext<BasicBlock> BLOCK_ARG_OF = Ext.create(BasicBlock.class, "BLOCK_ARG_OF");
    /**
     * Attached to a {@link Var}, computed by {@link ComputeUses}. The instructions that use the variable.
     */
    public static final Ext<Set<Insn>> USED_AT = Ext.create(Set.class, "USED_AT");
    /**
     * Attached to a {@link Var}. Its value type: {@link Type#INT_TYPE}, {@link Type#LONG_TYPE}
     * or {@link Type#BOOLEAN_TYPE}.
     */
    public static final Ext<Type> TYPE = Ext.create(Type.class, "TYPE");

    /**
     * Attached to a {@link Region}. The function whose body it is, if any.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to a {@link Region}. The instruction it is nested in, if any.
     */
    public static final Ext<Insn> OWNING_INSN = Ext.create(Insn.class, "OWNING_INSN");
    /**
     * Attached to a {@link BasicBlock}. The region the block is in.
     */
    public static final Ext<Region> OWNING_REGION = Ext.create(Region.class, "OWNING_REGION");
    /**
     * Attached to a {@link Control} or {@link Effect}. The block this instruction is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to an {@link Insn}. The control instruction this insn is part of, if any.
     */
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    /**
     * Attached to an {@link Insn}. The effect instruction this insn is part of, if any.
     */
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Attached to an {@link OpKey}, and so visible from its ops and instructions.
     * The shape of the operation, as far as lowering is concerned.
     */
    public static final Ext<OpKind> OP_KIND = Ext.create(OpKind.class, "OP_KIND");
}
