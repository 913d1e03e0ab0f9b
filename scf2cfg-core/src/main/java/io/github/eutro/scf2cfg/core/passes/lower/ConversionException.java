package io.github.eutro.scf2cfg.core.passes.lower;

import io.github.eutro.scf2cfg.core.ssa.Effect;

/**
 * Thrown by a full {@link LowerStructuredControl} when structured operations are left after lowering.
 */
public class ConversionException extends RuntimeException {
    private final ConversionResult result;

    /**
     * Construct a conversion exception.
     *
     * @param result The result of the failed conversion.
     */
    public ConversionException(ConversionResult result) {
        super(describe(result));
        this.result = result;
    }

    /**
     * Get the result of the conversion that failed.
     *
     * @return The result.
     */
    public ConversionResult getResult() {
        return result;
    }

    private static String describe(ConversionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("failed to lower ").append(result.getFailed().size()).append(" structured operations");
        for (Effect op : result.getFailed()) {
            sb.append("\n  op: ").append(op.toString().replace("\n", "\n  "));
        }
        return sb.toString();
    }
}
