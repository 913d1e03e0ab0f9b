package io.github.eutro.scf2cfg.core.passes.lower;

import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.ssa.Effect;
import io.github.eutro.scf2cfg.core.ssa.Rewriter;

/**
 * Lowers one kind of structured operation in place.
 * <p>
 * A pattern checks everything it needs before it changes anything, so if it fails
 * the function is exactly as it was.
 */
public interface RewritePattern {
    /**
     * Get the kind of operation this pattern lowers.
     *
     * @return The kind.
     */
    OpKind getKind();

    /**
     * Try to lower {@code op}, replacing its results and erasing it.
     *
     * @param op       The operation, which must be in a block of the rewriter's function.
     * @param rewriter The rewriter to make changes with.
     * @return Whether the operation was lowered. If false, nothing was changed.
     */
    boolean matchAndRewrite(Effect op, Rewriter rewriter);
}
