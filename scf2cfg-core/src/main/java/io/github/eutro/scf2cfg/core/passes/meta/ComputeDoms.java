package io.github.eutro.scf2cfg.core.passes.meta;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import io.github.eutro.scf2cfg.core.passes.InPlaceIRPass;
import io.github.eutro.scf2cfg.core.ssa.BasicBlock;
import io.github.eutro.scf2cfg.core.ssa.Function;
import io.github.eutro.scf2cfg.core.ssa.Region;
import io.github.eutro.scf2cfg.core.util.GraphWalker;
import io.github.eutro.scf2cfg.core.util.IRUtils;

import java.util.*;

/*
 Keith D. Cooper, Timothy J. Harvey and Ken Kennedy. A simple, fast dominance algorithm.
 Software Practice & Experience, 4:1-10, 2001.
*/

/**
 * Computes {@link CommonExts#IDOM immediate dominators} and {@link CommonExts#REACHABLE reachability}
 * separately for every region of a function. Blocks are not reordered.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        Set<Region> regions = new LinkedHashSet<>();
        for (BasicBlock block : IRUtils.allBlocks(func.body)) {
            regions.add(IRUtils.regionOf(block));
        }
        for (Region region : regions) {
            computeDoms(region);
        }

        ms.validate(MetadataState.DOMS);
    }

    private static void computeDoms(Region region) {
        for (BasicBlock block : region.blocks) {
            block.removeExt(CommonExts.IDOM);
            block.attachExt(CommonExts.REACHABLE, false);
        }

        // the entry is last in post-order
        List<BasicBlock> postOrder = GraphWalker.blockWalker(region, false).postOrder().toList();
        Map<BasicBlock, Integer> index = new HashMap<>();
        for (int i = 0; i < postOrder.size(); i++) {
            index.put(postOrder.get(i), i);
        }
        int root = postOrder.size() - 1;
        int[] doms = new int[postOrder.size()];
        Arrays.fill(doms, -1);
        doms[root] = root;

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b = root - 1; b >= 0; b--) {
                int newIdom = -1;
                for (BasicBlock pred : postOrder.get(b).getExtOrThrow(CommonExts.PREDS)) {
                    Integer p = index.get(pred);
                    if (p == null || doms[p] == -1) continue;
                    newIdom = newIdom == -1 ? p : intersect(doms, p, newIdom);
                }
                if (doms[b] != newIdom) {
                    doms[b] = newIdom;
                    changed = true;
                }
            }
        }

        for (int i = 0; i < postOrder.size(); i++) {
            BasicBlock block = postOrder.get(i);
            block.attachExt(CommonExts.REACHABLE, true);
            if (i != root) {
                block.attachExt(CommonExts.IDOM, postOrder.get(doms[i]));
            }
        }
    }

    private static int intersect(int[] doms, int b1, int b2) {
        while (b1 != b2) {
            while (b1 < b2) b1 = doms[b1];
            while (b2 < b1) b2 = doms[b2];
        }
        return b1;
    }

    /**
     * Check whether {@code a} dominates {@code b}, using the computed {@link CommonExts#IDOM}s.
     * Every block dominates itself.
     *
     * @param a The potential dominator.
     * @param b The potentially dominated block.
     * @return Whether {@code a} dominates {@code b}.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        for (BasicBlock it = b; it != null; it = it.getNullable(CommonExts.IDOM)) {
            if (it == a) return true;
        }
        return false;
    }
}
