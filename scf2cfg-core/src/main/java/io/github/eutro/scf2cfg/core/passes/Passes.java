package io.github.eutro.scf2cfg.core.passes;

import io.github.eutro.scf2cfg.core.passes.lower.LowerStructuredControl;
import io.github.eutro.scf2cfg.core.passes.meta.VerifyIntegrity;
import io.github.eutro.scf2cfg.core.passes.misc.ForPass;
import io.github.eutro.scf2cfg.core.ssa.Function;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Lower all structured control flow, then check that the result is well-formed.
     */
    public static final IRPass<Function, Function> LOWER_AND_VERIFY =
            LowerStructuredControl.INSTANCE
                    .then(VerifyIntegrity.INSTANCE);

    /**
     * {@link #LOWER_AND_VERIFY} every function in a collection.
     */
    public static final IRPass<Iterable<Function>, Iterable<Function>> LOWER_ALL =
            ForPass.liftFunctions(LOWER_AND_VERIFY);
}
