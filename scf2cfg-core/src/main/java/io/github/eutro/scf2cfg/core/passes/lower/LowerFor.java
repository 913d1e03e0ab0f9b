package io.github.eutro.scf2cfg.core.passes.lower;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.ArithOps;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static io.github.eutro.scf2cfg.core.ops.StructuredOps.*;

/**
 * Lowers a {@link StructuredOps#FOR} into a loop with a single entry and a single exit.
 *
 * <pre>
 *   before...                      before...
 *   r = for lo, hi, st, init {     br cond(lo, init)
 *   (iv, x):                     cond(iv, x):
 *     body...                      c = cmp slt iv, hi
 *     yield x'                     br_cond c -> body, end
 *   }                            body:
 *   after(r)                       body...
 *                                  next = add iv, st
 *                                  br cond(next, x')
 *                                end:
 *                                  after(x)
 * </pre>
 * <p>
 * On exit the arguments of the condition block hold the final carried values,
 * and the condition block dominates the end block, so they replace the results.
 */
public class LowerFor implements RewritePattern {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * A singleton instance of this pattern.
     */
    public static final LowerFor INSTANCE = new LowerFor();

    @Override
    public OpKind getKind() {
        return OpKind.LOOP;
    }

    @Override
    public boolean matchAndRewrite(Effect op, Rewriter rewriter) {
        String problem = checkShape(op);
        if (problem != null) {
            logger.atFiner().log("not lowering %s: %s", op, problem);
            return false;
        }

        Insn insn = op.insn();
        List<Var> args = insn.args();
        Var lower = args.get(FOR_LOWER);
        Var upper = args.get(FOR_UPPER);
        Var step = args.get(FOR_STEP);
        List<Var> inits = new ArrayList<>(args.subList(FOR_INITS, args.size()));
        Region region = insn.regions().get(0);

        BasicBlock initBlock = IRUtils.blockOf(op);
        BasicBlock endBlock = rewriter.splitBlock(initBlock, initBlock.getEffects().indexOf(op) + 1);

        BasicBlock condBlock = region.getEntry();
        BasicBlock bodyEntry = rewriter.splitBlock(condBlock, 0);
        BasicBlock bodyExit = region.getLast();
        rewriter.inlineRegionBefore(region, endBlock);

        Var iv = condBlock.args.get(0);
        List<Var> carried = new ArrayList<>(condBlock.args.subList(1, condBlock.args.size()));

        // back edge
        rewriter.setBlock(bodyExit);
        Var stepped = rewriter.insert(ArithOps.ADD.insn(iv, step), "iv.next", iv.getNullable(CommonExts.TYPE));
        List<Var> next = new ArrayList<>();
        next.add(stepped);
        next.addAll(bodyExit.getControl().insn().args());
        rewriter.replaceTerminator(bodyExit, Control.br(condBlock, next));

        // entry edge
        List<Var> start = new ArrayList<>();
        start.add(lower);
        start.addAll(inits);
        rewriter.replaceTerminator(initBlock, Control.br(condBlock, start));

        // exit test
        rewriter.setBlock(condBlock);
        Var inRange = rewriter.insert(ArithOps.CMP.create(ArithOps.Predicate.SLT).insn(iv, upper),
                "in.range", Type.BOOLEAN_TYPE);
        rewriter.insertCtrl(Control.brCond(
                inRange,
                bodyEntry, Collections.emptyList(),
                endBlock, Collections.emptyList()));

        rewriter.replaceAllUsesAndErase(op, carried);
        logger.atFine().log("lowered for with %d carried values", carried.size());
        return true;
    }

    private static @Nullable String checkShape(Effect op) {
        Insn insn = op.insn();
        if (insn.op != StructuredOps.FOR) return "not a for";
        List<Var> args = insn.args();
        if (args.size() <= FOR_LOWER || args.get(FOR_LOWER) == null) return "missing lower bound";
        if (args.size() <= FOR_UPPER || args.get(FOR_UPPER) == null) return "missing upper bound";
        if (args.size() <= FOR_STEP || args.get(FOR_STEP) == null) return "missing step";
        Type boundType = args.get(FOR_LOWER).getNullable(CommonExts.TYPE);
        if (!Objects.equals(boundType, args.get(FOR_UPPER).getNullable(CommonExts.TYPE))
                || !Objects.equals(boundType, args.get(FOR_STEP).getNullable(CommonExts.TYPE))) {
            return "bounds and step have different types";
        }
        int initCount = args.size() - FOR_INITS;
        for (int i = FOR_INITS; i < args.size(); i++) {
            if (args.get(i) == null) return "missing init " + (i - FOR_INITS);
        }
        if (op.getAssignsTo().size() != initCount) {
            return op.getAssignsTo().size() + " results for " + initCount + " inits";
        }
        if (insn.regions().size() != 1) return "expected exactly one region";
        Region region = insn.regions().get(0);
        if (region.blocks.isEmpty()) return "empty body";
        int argCount = region.getEntry().args.size();
        if (argCount != 1 + initCount) {
            return "body takes " + argCount + " arguments, expected " + (1 + initCount);
        }
        String problem = LowerIf.checkBranch(region, initCount);
        if (problem != null) return "body: " + problem;
        return null;
    }
}
