package io.github.eutro.scf2cfg.core.passes.lower;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.ssa.*;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a {@link StructuredOps#PARALLEL} into a nest of {@link StructuredOps#FOR} loops,
 * one per dimension, outermost first, which {@link LowerFor} lowers afterwards.
 * <p>
 * The accumulators are carried through every loop of the nest. In the innermost body, each
 * {@link StructuredOps#REDUCE} site is replaced by a copy of its combiner, applied to the
 * site's accumulator and its contribution, and the innermost loop yields the combined values.
 *
 * <pre>
 *   r = parallel 2 lo0, lo1, hi0, hi1, st0, st1, init {
 *   (i, j):
 *     x = ...
 *     reduce x {
 *     (acc, v):
 *       s = add acc, v
 *       reduce_return s
 *     }
 *     yield
 *   }
 *
 * becomes
 *
 *   r = for lo0, hi0, st0, init {
 *   (i, a):
 *     r' = for lo1, hi1, st1, a {
 *     (j, b):
 *       x = ...
 *       s = add b, x
 *       yield s
 *     }
 *     yield r'
 *   }
 * </pre>
 */
public class LowerParallel implements RewritePattern {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * A singleton instance of this pattern.
     */
    public static final LowerParallel INSTANCE = new LowerParallel();

    @Override
    public OpKind getKind() {
        return OpKind.PARALLEL_LOOP;
    }

    @Override
    public boolean matchAndRewrite(Effect op, Rewriter rewriter) {
        String problem = checkShape(op);
        if (problem != null) {
            logger.atFiner().log("not lowering %s: %s", op, problem);
            return false;
        }

        Insn insn = op.insn();
        int dims = StructuredOps.PARALLEL.cast(insn.op).arg;
        List<Var> args = insn.args();
        BasicBlock body = insn.regions().get(0).getEntry();

        Cloner cloner = new Cloner(rewriter.func);
        rewriter.setInsertionPointBefore(op);
        List<Var> accumulators = new ArrayList<>(args.subList(3 * dims, args.size()));
        List<Var> replacements = null;
        BasicBlock loopBody = null;
        for (int d = 0; d < dims; d++) {
            Effect loop = StructuredOps.buildFor(rewriter,
                    args.get(d),
                    args.get(dims + d),
                    args.get(2 * dims + d),
                    accumulators);
            BasicBlock newBody = loop.insn().regions().get(0).getEntry();
            cloner.map(body.args.get(d), newBody.args.get(0));
            if (replacements == null) {
                replacements = loop.getAssignsTo();
            } else if (!loop.getAssignsTo().isEmpty()) {
                loopBody.setControl(StructuredOps.yield(loop.getAssignsTo()));
            }
            accumulators = new ArrayList<>(newBody.args.subList(1, newBody.args.size()));
            loopBody = newBody;
            rewriter.setBlock(loopBody);
        }

        List<Var> combined = new ArrayList<>(accumulators);
        int slot = 0;
        for (Effect effect : body.getEffects()) {
            if (OpKind.of(effect.insn()) != OpKind.REDUCE) {
                rewriter.cloneOperation(effect, cloner);
                continue;
            }
            BasicBlock combiner = effect.insn().regions().get(0).getEntry();
            cloner.map(combiner.args.get(0), accumulators.get(slot));
            cloner.map(combiner.args.get(1), cloner.lookup(effect.insn().args().get(0)));
            for (Effect combinerEffect : combiner.getEffects()) {
                rewriter.cloneOperation(combinerEffect, cloner);
            }
            combined.set(slot, cloner.lookup(combiner.getControl().insn().args().get(0)));
            slot++;
        }
        if (!combined.isEmpty()) {
            loopBody.setControl(StructuredOps.yield(combined));
        }

        rewriter.replaceAllUsesAndErase(op, new ArrayList<>(replacements));
        logger.atFine().log("expanded %d-dimensional parallel loop with %d reductions", dims, slot);
        return true;
    }

    private static @Nullable String checkShape(Effect op) {
        Insn insn = op.insn();
        Integer dims = StructuredOps.PARALLEL.check(insn.op).map(it -> it.arg).orElse(null);
        if (dims == null) return "not a parallel loop";
        if (dims < 1) return "no dimensions";
        List<Var> args = insn.args();
        if (args.size() < 3 * dims) return "expected " + 3 * dims + " bounds, got " + args.size();
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == null) return "missing operand " + i;
        }
        for (int d = 0; d < dims; d++) {
            Type boundType = args.get(d).getNullable(CommonExts.TYPE);
            if (!Objects.equals(boundType, args.get(dims + d).getNullable(CommonExts.TYPE))
                    || !Objects.equals(boundType, args.get(2 * dims + d).getNullable(CommonExts.TYPE))) {
                return "bounds and step of dimension " + d + " have different types";
            }
        }
        int initCount = args.size() - 3 * dims;
        if (op.getAssignsTo().size() != initCount) {
            return op.getAssignsTo().size() + " results for " + initCount + " inits";
        }
        if (insn.regions().size() != 1 || insn.regions().get(0).blocks.size() != 1) {
            return "body must be exactly one block";
        }
        BasicBlock body = insn.regions().get(0).getEntry();
        if (body.args.size() != dims) {
            return "body takes " + body.args.size() + " arguments, expected " + dims;
        }
        Control ctrl = body.getControl();
        if (ctrl == null || OpKind.of(ctrl.insn()) != OpKind.YIELD || !ctrl.insn().args().isEmpty()) {
            return "body must end in an empty yield";
        }
        int reduceCount = 0;
        for (Effect effect : body.getEffects()) {
            if (OpKind.of(effect.insn()) != OpKind.REDUCE) continue;
            String problem = checkReduce(effect);
            if (problem != null) return "reduce " + reduceCount + ": " + problem;
            reduceCount++;
        }
        if (reduceCount != initCount) return reduceCount + " reductions for " + initCount + " inits";
        return null;
    }

    private static @Nullable String checkReduce(Effect reduce) {
        Insn insn = reduce.insn();
        if (insn.args().size() != 1 || insn.args().get(0) == null) return "expected one contribution";
        if (!reduce.getAssignsTo().isEmpty()) return "reduce has no results";
        if (insn.regions().size() != 1 || insn.regions().get(0).blocks.size() != 1) {
            return "combiner must be exactly one block";
        }
        BasicBlock combiner = insn.regions().get(0).getEntry();
        if (combiner.args.size() != 2) return "combiner takes " + combiner.args.size() + " arguments, expected 2";
        Control ctrl = combiner.getControl();
        if (ctrl == null || OpKind.of(ctrl.insn()) != OpKind.REDUCE_RETURN || ctrl.insn().args().size() != 1) {
            return "combiner must end in a reduce_return of one value";
        }
        return null;
    }
}
