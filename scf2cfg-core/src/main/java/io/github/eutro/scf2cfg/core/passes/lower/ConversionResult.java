package io.github.eutro.scf2cfg.core.passes.lower;

import io.github.eutro.scf2cfg.core.ssa.Effect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of running {@link LowerStructuredControl} on a function.
 */
public final class ConversionResult {
    private final int converted;
    private final List<Effect> failed;

    ConversionResult(int converted, List<Effect> failed) {
        this.converted = converted;
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
    }

    /**
     * Get how many structured operations were rewritten.
     *
     * @return The number of successful rewrites.
     */
    public int getConverted() {
        return converted;
    }

    /**
     * Get the structured operations left in the function, in the order they were found.
     *
     * @return The unmodifiable list of leftover operations.
     */
    public List<Effect> getFailed() {
        return failed;
    }

    /**
     * Get whether no structured operations are left.
     *
     * @return Whether the function is now a flat control-flow graph.
     */
    public boolean isFullyConverted() {
        return failed.isEmpty();
    }

    @Override
    public String toString() {
        return "converted " + converted + ", failed " + failed.size();
    }
}
