package io.github.eutro.scf2cfg.core.ops;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ssa.Insn;

/**
 * The shapes of operation that lowering has to tell apart.
 *
 * @see CommonExts#OP_KIND
 */
public enum OpKind {
    LOOP,
    CONDITIONAL,
    PARALLEL_LOOP,
    YIELD,
    REDUCE,
    REDUCE_RETURN,
    BRANCH,
    CONDITIONAL_BRANCH,
    RETURN,
    // anything else
    OTHER;

    /**
     * Get the kind of an instruction.
     *
     * @param insn The instruction.
     * @return Its kind, {@link #OTHER} if its key has none.
     */
    public static OpKind of(Insn insn) {
        OpKind kind = insn.getNullable(CommonExts.OP_KIND);
        return kind == null ? OTHER : kind;
    }

    /**
     * Whether operations of this kind own regions and must be lowered away.
     *
     * @return Whether this is a structured kind.
     */
    public boolean isStructured() {
        return this == LOOP || this == CONDITIONAL || this == PARALLEL_LOOP;
    }

    /**
     * Whether this kind terminates a block by branching to other blocks in its region.
     *
     * @return Whether this is a branch kind.
     */
    public boolean isBranch() {
        return this == BRANCH || this == CONDITIONAL_BRANCH;
    }

    /**
     * Attach this kind to {@code key}.
     *
     * @param key The key.
     * @param <K> The type of the key.
     * @return {@code key}.
     */
    <K extends OpKey> K mark(K key) {
        key.attachExt(CommonExts.OP_KIND, this);
        return key;
    }
}
