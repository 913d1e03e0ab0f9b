package io.github.eutro.scf2cfg.core.passes.meta;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.ssa.BasicBlock;
import io.github.eutro.scf2cfg.core.ssa.Control;
import io.github.eutro.scf2cfg.core.ssa.Function;
import io.github.eutro.scf2cfg.core.util.IRUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for each block, in every region of the function.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        List<BasicBlock> blocks = IRUtils.allBlocks(func.body);
        for (BasicBlock block : blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : blocks) {
            Control ctrl = block.getControl();
            if (ctrl == null) continue;
            for (BasicBlock target : ctrl.targets) {
                List<BasicBlock> preds = target.getNullable(CommonExts.PREDS);
                // targets outside the function are reported by VerifyIntegrity
                if (preds != null) preds.add(block);
            }
        }

        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
    }
}
