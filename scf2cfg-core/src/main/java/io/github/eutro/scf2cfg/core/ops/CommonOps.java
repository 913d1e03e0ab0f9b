package io.github.eutro.scf2cfg.core.ops;

import io.github.eutro.scf2cfg.core.ssa.Insn;
import org.objectweb.asm.Type;

/**
 * Operations that make up a flat control-flow graph: branches, returns, arguments and constants.
 */
public class CommonOps {
    /**
     * Control: an unconditional branch to its single target, passing all arguments
     * as the target's block arguments.
     */
    public static final Op BR = OpKind.BRANCH.mark(new SimpleOpKey("br")).create();
    /**
     * Control: a two-way branch. The first argument is the {@code boolean} condition,
     * the intermediate {@code n} says how many of the following arguments are passed to
     * the true target (target 0); the rest go to the false target (target 1).
     */
    public static final UnaryOpKey<Integer> BR_COND = OpKind.CONDITIONAL_BRANCH.mark(new UnaryOpKey<>("br_cond"));
    /**
     * Control: returns its argument, if any, from the function.
     */
    public static final Op RETURN = OpKind.RETURN.mark(new SimpleOpKey("return")).create();

    /**
     * Effect: returns the {@code n}th parameter of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: returns the constant, an {@link Integer}, {@link Long} or {@link Boolean}.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        constantType(k);
        return CONST.create(k).insn();
    }

    /**
     * Get the IR type of a constant.
     *
     * @param k The constant.
     * @return Its type.
     * @throws IllegalArgumentException If {@code k} is not a supported constant.
     */
    public static Type constantType(Object k) {
        if (k instanceof Integer) return Type.INT_TYPE;
        if (k instanceof Long) return Type.LONG_TYPE;
        if (k instanceof Boolean) return Type.BOOLEAN_TYPE;
        throw new IllegalArgumentException("unsupported constant: " + k);
    }
}
