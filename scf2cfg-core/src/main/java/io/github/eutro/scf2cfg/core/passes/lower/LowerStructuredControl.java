package io.github.eutro.scf2cfg.core.passes.lower;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.passes.meta.VerifyIntegrity;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;

import java.util.*;
import java.util.function.Predicate;

import static com.google.common.flogger.LazyArgs.lazy;

/**
 * Lowers all structured control flow in a function to a flat graph of blocks, by applying
 * {@link RewritePattern}s until none of them succeed.
 * <p>
 * Each iteration first expands every parallel loop, outermost first, since its body must still
 * be a single block. It then flattens loops and conditionals, innermost first, so that the
 * body a pattern sees is already flat. An operation whose pattern fails is not tried again.
 * <p>
 * A full conversion throws a {@link ConversionException} if any structured operation is left,
 * a partial one only logs them.
 */
public class LowerStructuredControl implements InPlaceIRPass<Function> {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * Whether to check the function with {@link VerifyIntegrity} after every rewrite. Useful for debugging.
     */
    public static boolean VERIFY_EACH_REWRITE = System.getenv("SCF2CFG_VERIFY_EACH_REWRITE") != null;

    /**
     * Full conversion with all the patterns in this package.
     */
    public static final LowerStructuredControl INSTANCE = new LowerStructuredControl(true,
            LowerParallel.INSTANCE, LowerFor.INSTANCE, LowerIf.INSTANCE);
    /**
     * Partial conversion with all the patterns in this package.
     */
    public static final LowerStructuredControl PARTIAL = new LowerStructuredControl(false,
            LowerParallel.INSTANCE, LowerFor.INSTANCE, LowerIf.INSTANCE);

    private final boolean fullConversion;
    private final Map<OpKind, RewritePattern> patterns = new EnumMap<>(OpKind.class);

    /**
     * Construct a lowering pass.
     *
     * @param fullConversion Whether leftover structured operations are an error.
     * @param patterns       The patterns to apply, at most one per kind.
     */
    public LowerStructuredControl(boolean fullConversion, RewritePattern... patterns) {
        this.fullConversion = fullConversion;
        for (RewritePattern pattern : patterns) {
            if (this.patterns.put(pattern.getKind(), pattern) != null) {
                throw new IllegalArgumentException("more than one pattern for " + pattern.getKind());
            }
        }
    }

    @Override
    public void runInPlace(Function func) {
        convert(func);
    }

    /**
     * Lower the structured control flow in a function.
     *
     * @param func The function.
     * @return What was converted and what was left.
     * @throws ConversionException If this is a full conversion and structured operations are left.
     */
    public ConversionResult convert(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        Rewriter rewriter = new Rewriter(func);
        Set<Effect> failed = Collections.newSetFromMap(new IdentityHashMap<>());
        int converted = 0;
        for (int iteration = 0; ; iteration++) {
            int before = converted;
            for (Effect op : collect(func.body, true, kind -> kind == OpKind.PARALLEL_LOOP)) {
                if (tryRewrite(func, rewriter, op, failed)) converted++;
            }
            for (Effect op : collect(func.body, false, kind -> kind == OpKind.LOOP || kind == OpKind.CONDITIONAL)) {
                if (tryRewrite(func, rewriter, op, failed)) converted++;
            }
            logger.atFine().log("iteration %d converted %d operations", iteration, converted - before);
            if (converted == before) break;
        }

        List<Effect> leftover = collect(func.body, true, OpKind::isStructured);
        ConversionResult result = new ConversionResult(converted, leftover);
        if (converted != 0) ms.graphChanged();
        if (result.isFullyConverted()) {
            ms.validate(MetadataState.CONTROL_FLATTENED);
        } else if (fullConversion) {
            throw new ConversionException(result);
        } else {
            logger.atWarning().log("%d structured operations left after lowering:\n%s",
                    leftover.size(), lazy(() -> describe(leftover)));
        }
        return result;
    }

    private boolean tryRewrite(Function func, Rewriter rewriter, Effect op, Set<Effect> failed) {
        // erased, or left behind in the body of an expanded enclosing operation
        if (failed.contains(op) || !IRUtils.isAttached(op, func)) return false;
        RewritePattern pattern = patterns.get(OpKind.of(op.insn()));
        if (pattern == null || !pattern.matchAndRewrite(op, rewriter)) {
            failed.add(op);
            return false;
        }
        func.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        if (VERIFY_EACH_REWRITE) {
            try {
                VerifyIntegrity.INSTANCE.run(func);
            } catch (IllegalStateException e) {
                e.addSuppressed(new RuntimeException("after lowering " + OpKind.of(op.insn())));
                throw e;
            }
        }
        return true;
    }

    private static List<Effect> collect(Region region, boolean preOrder, Predicate<OpKind> kinds) {
        List<Effect> out = new ArrayList<>();
        collect(region, preOrder, kinds, out);
        return out;
    }

    private static void collect(Region region, boolean preOrder, Predicate<OpKind> kinds, List<Effect> out) {
        for (BasicBlock block : region.blocks) {
            for (Effect effect : block.getEffects()) {
                boolean matches = kinds.test(OpKind.of(effect.insn()));
                if (matches && preOrder) out.add(effect);
                for (Region nested : effect.insn().regions()) {
                    collect(nested, preOrder, kinds, out);
                }
                if (matches && !preOrder) out.add(effect);
            }
        }
    }

    private static String describe(List<Effect> ops) {
        StringBuilder sb = new StringBuilder();
        for (Effect op : ops) {
            if (sb.length() != 0) sb.append('\n');
            sb.append("  ").append(op.toString().replace("\n", "\n  "));
        }
        return sb.toString();
    }
}
