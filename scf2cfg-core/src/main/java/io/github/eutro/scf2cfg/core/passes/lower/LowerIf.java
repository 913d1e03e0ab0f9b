package io.github.eutro.scf2cfg.core.passes.lower;

import com.google.common.flogger.FluentLogger;
import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ops.OpKind;
import io.github.eutro.scf2cfg.core.ops.StructuredOps;
import io.github.eutro.scf2cfg.core.ssa.*;
import io.github.eutro.scf2cfg.core.util.IRUtils;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers a {@link StructuredOps#IF} into a diamond, or a triangle if there is no else region.
 *
 * <pre>
 *   before...               before...
 *   r = if c {              br_cond c -> then, else
 *     then...             then:
 *     yield a               then...
 *   } {                     br continue(a)
 *     else...             else:
 *     yield b               else...
 *   }                       br continue(b)
 *   after(r)              continue(r):
 *                           br remainder
 *                         remainder:
 *                           after(r)
 * </pre>
 * <p>
 * Without results there are no block arguments, the remainder is the continuation itself,
 * and a missing else region makes the false edge go straight to it.
 */
public class LowerIf implements RewritePattern {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * A singleton instance of this pattern.
     */
    public static final LowerIf INSTANCE = new LowerIf();

    @Override
    public OpKind getKind() {
        return OpKind.CONDITIONAL;
    }

    @Override
    public boolean matchAndRewrite(Effect op, Rewriter rewriter) {
        String problem = checkShape(op);
        if (problem != null) {
            logger.atFiner().log("not lowering %s: %s", op, problem);
            return false;
        }

        Insn insn = op.insn();
        List<Var> results = op.getAssignsTo();
        Var cond = insn.args().get(0);
        Region thenRegion = insn.regions().get(0);
        Region elseRegion = insn.regions().size() > 1 ? insn.regions().get(1) : null;

        BasicBlock condBlock = IRUtils.blockOf(op);
        BasicBlock remainder = rewriter.splitBlock(condBlock, condBlock.getEffects().indexOf(op) + 1);
        BasicBlock continueBlock;
        if (results.isEmpty()) {
            continueBlock = remainder;
        } else {
            continueBlock = rewriter.createBlockBefore(remainder, results);
            continueBlock.setControl(Control.br(remainder));
        }

        BasicBlock thenTarget = inlineBranch(rewriter, thenRegion, continueBlock);
        BasicBlock elseTarget = elseRegion == null || elseRegion.blocks.isEmpty()
                ? continueBlock
                : inlineBranch(rewriter, elseRegion, continueBlock);

        rewriter.replaceTerminator(condBlock, Control.brCond(
                cond,
                thenTarget, Collections.emptyList(),
                elseTarget, Collections.emptyList()));
        rewriter.replaceAllUsesAndErase(op, new ArrayList<>(continueBlock.args));
        logger.atFine().log("lowered if with %d results, %s else region",
                results.size(), elseTarget == continueBlock ? "without" : "with");
        return true;
    }

    private static BasicBlock inlineBranch(Rewriter rewriter, Region region, BasicBlock continueBlock) {
        BasicBlock entry = region.getEntry();
        BasicBlock exit = region.getLast();
        rewriter.replaceTerminator(exit, Control.br(continueBlock, exit.getControl().insn().args()));
        rewriter.inlineRegionBefore(region, continueBlock);
        return entry;
    }

    private static @Nullable String checkShape(Effect op) {
        Insn insn = op.insn();
        if (insn.op != StructuredOps.IF) return "not an if";
        if (insn.args().size() != 1 || insn.args().get(0) == null) return "missing condition";
        Type condType = insn.args().get(0).getNullable(CommonExts.TYPE);
        if (condType != null && !Type.BOOLEAN_TYPE.equals(condType)) return "condition is not a boolean";
        List<Region> regions = insn.regions();
        if (regions.isEmpty() || regions.size() > 2) return "expected a then and an optional else region";
        int resultCount = op.getAssignsTo().size();
        if (regions.get(0).blocks.isEmpty()) return "empty then region";
        String problem = checkBranch(regions.get(0), resultCount);
        if (problem != null) return "then region: " + problem;
        if (regions.size() > 1 && !regions.get(1).blocks.isEmpty()) {
            problem = checkBranch(regions.get(1), resultCount);
            if (problem != null) return "else region: " + problem;
        } else if (resultCount != 0) {
            return "an if with results needs an else region";
        }
        return null;
    }

    static @Nullable String checkBranch(Region region, int yieldCount) {
        List<BasicBlock> blocks = region.blocks;
        for (int i = 0; i < blocks.size(); i++) {
            Control ctrl = blocks.get(i).getControl();
            if (ctrl == null) return "unterminated block";
            boolean isYield = OpKind.of(ctrl.insn()) == OpKind.YIELD;
            if (isYield != (i == blocks.size() - 1)) return "the last block, and only it, must end in a yield";
        }
        int yielded = region.getLast().getControl().insn().args().size();
        if (yielded != yieldCount) return "yields " + yielded + " values, expected " + yieldCount;
        return null;
    }
}
