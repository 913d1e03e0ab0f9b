package io.github.eutro.scf2cfg.core.ext;

import io.github.eutro.scf2cfg.core.passes.IRPass;
import io.github.eutro.scf2cfg.core.passes.lower.LowerStructuredControl;
import io.github.eutro.scf2cfg.core.passes.meta.ComputeDoms;
import io.github.eutro.scf2cfg.core.passes.meta.ComputePreds;
import io.github.eutro.scf2cfg.core.passes.meta.ComputeUses;
import io.github.eutro.scf2cfg.core.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived facts about a {@link Function} are still valid.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that knows which passes compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("pass for " + name + " is not in-place");
                pass.run(t);
            }
        }
    }

    /**
     * Metadata that can be computed for functions.
     */
    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            USES = new ComputableMetaKind<>("USES", ComputeUses.INSTANCE),
            CONTROL_FLATTENED = new ComputableMetaKind<>("CONTROL_FLATTENED", LowerStructuredControl.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not already valid.
     *
     * @param t     What the passes should run on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    /**
     * Mark the given metadata as invalid.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that depends on the shape of the block graph.
     */
    public void graphChanged() {
        invalidate(PREDS, DOMS);
        varsChanged();
    }

    /**
     * Invalidate everything that depends on which variables are used where.
     */
    public void varsChanged() {
        invalidate(USES);
    }
}
