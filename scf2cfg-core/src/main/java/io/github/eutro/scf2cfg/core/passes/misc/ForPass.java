package io.github.eutro.scf2cfg.core.passes.misc;

import io.github.eutro.scf2cfg.core.passes.IRPass;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.ssa.Function;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place function pass to run on every function in a collection, in order.
     * <p>
     * An exception thrown for one function gets a suppressed exception saying which one it was,
     * and stops the run.
     *
     * @param pass The function pass.
     * @return The lifted pass.
     */
    public static InPlaceIRPass<Iterable<Function>> liftFunctions(IRPass<Function, Function> pass) {
        if (!pass.isInPlace()) throw new IllegalArgumentException("pass must be in-place");
        return funcs -> {
            int i = 0;
            for (Function func : funcs) {
                try {
                    pass.run(func);
                } catch (RuntimeException | Error t) {
                    t.addSuppressed(new RuntimeException("in function " + i));
                    throw t;
                }
                i++;
            }
        };
    }
}
