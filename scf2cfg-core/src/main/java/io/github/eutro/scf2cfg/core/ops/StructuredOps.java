package io.github.eutro.scf2cfg.core.ops;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ssa.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured control-flow operations, which own nested {@link Region}s and have
 * to be lowered away before the function is a flat control-flow graph.
 */
public class StructuredOps {
    /**
     * Effect: a counted loop.
     * <p>
     * Arguments are {@code [lower, upper, step, init...]}. The single region's entry block takes
     * {@code [iv, carried...]}, one carried value per init, and its last block ends in a
     * {@link #YIELD} of the next carried values. The results are the final carried values.
     * The induction variable starts at {@code lower} and runs while it is (signed) less than
     * {@code upper}.
     */
    public static final Op FOR = OpKind.LOOP.mark(new SimpleOpKey("for")).create();
    /**
     * Effect: a conditional.
     * <p>
     * The argument is the {@code boolean} condition, the regions are {@code [then]} or {@code [then, else]},
     * each ending in a {@link #YIELD} of the results. Conditionals with results must have an else region.
     */
    public static final Op IF = OpKind.CONDITIONAL.mark(new SimpleOpKey("if")).create();
    /**
     * Effect: a multidimensional parallel loop with reductions. The intermediate is the number
     * of dimensions {@code d}.
     * <p>
     * Arguments are {@code [lower..., upper..., step..., init...]} with {@code d} of each bound.
     * The single region has one block, taking the {@code d} induction variables and ending in
     * an empty {@link #YIELD}. The results are the final values of the {@link #REDUCE} sites
     * in the body, in order, starting from the inits.
     */
    public static final UnaryOpKey<Integer> PARALLEL = OpKind.PARALLEL_LOOP.mark(new UnaryOpKey<>("parallel"));
    /**
     * Effect: contributes its argument to a reduction of the enclosing {@link #PARALLEL}.
     * <p>
     * The single region is the combiner: one block taking {@code (accumulator, contribution)}
     * and ending in a {@link #REDUCE_RETURN} of the new accumulator.
     */
    public static final Op REDUCE = OpKind.REDUCE.mark(new SimpleOpKey("reduce")).create();
    /**
     * Control: ends a loop or conditional region, passing its arguments to the enclosing operation.
     */
    public static final Op YIELD = OpKind.YIELD.mark(new SimpleOpKey("yield")).create();
    /**
     * Control: ends a reduction combiner with the combined value.
     */
    public static final Op REDUCE_RETURN = OpKind.REDUCE_RETURN.mark(new SimpleOpKey("reduce_return")).create();

    /**
     * Index of the lower bound among a {@link #FOR}'s arguments.
     */
    public static final int FOR_LOWER = 0;
    /**
     * Index of the upper bound among a {@link #FOR}'s arguments.
     */
    public static final int FOR_UPPER = 1;
    /**
     * Index of the step among a {@link #FOR}'s arguments.
     */
    public static final int FOR_STEP = 2;
    /**
     * Index of the first init among a {@link #FOR}'s arguments.
     */
    public static final int FOR_INITS = 3;

    /**
     * Construct a yield of the given values.
     *
     * @param values The values.
     * @return The control instruction.
     */
    public static Control yield(List<Var> values) {
        return YIELD.insn(values).jumpsTo();
    }

    /**
     * Create a {@link #FOR} at the builder's insertion point, with an empty body
     * whose entry block takes the induction variable and one carried value per init.
     * <p>
     * If there are no inits, the body is already terminated by an empty yield.
     * Otherwise the caller must terminate it.
     *
     * @param ib    The builder.
     * @param lower The lower bound.
     * @param upper The upper bound.
     * @param step  The step.
     * @param inits The initial carried values.
     * @return The loop.
     */
    public static Effect buildFor(IRBuilder ib, Var lower, Var upper, Var step, List<Var> inits) {
        Function func = ib.func;
        Region body = new Region();
        BasicBlock entry = body.newBb();
        entry.args.add(func.newVar("iv", lower.getExtOrThrow(CommonExts.TYPE)));
        List<Var> operands = new ArrayList<>();
        operands.add(lower);
        operands.add(upper);
        operands.add(step);
        List<Var> results = new ArrayList<>();
        for (Var init : inits) {
            operands.add(init);
            entry.args.add(func.newVar(init.name, init.getExtOrThrow(CommonExts.TYPE)));
            results.add(func.newVar(init.name, init.getExtOrThrow(CommonExts.TYPE)));
        }
        if (inits.isEmpty()) {
            entry.setControl(yield(Collections.emptyList()));
        }
        Effect loop = FOR.insn(operands, Collections.singletonList(body)).assignTo(results);
        ib.insert(loop);
        return loop;
    }
}
