package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.CommonExts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies instructions under a mapping of variables and blocks.
 * <p>
 * Variables and blocks without a mapping are left as they are, so a clone can keep referring
 * to values defined outside of what is being cloned. Results and block arguments of
 * cloned instructions are fresh, and mapped from the originals as they are created.
 */
public class Cloner {
    private final Function func;
    private final Map<Var, Var> varMap = new HashMap<>();
    private final Map<BasicBlock, BasicBlock> blockMap = new HashMap<>();

    /**
     * Construct a cloner creating variables in the given function.
     *
     * @param func The function.
     */
    public Cloner(Function func) {
        this.func = func;
    }

    /**
     * Map {@code from} to {@code to} in everything cloned from now on.
     *
     * @param from The original variable.
     * @param to   Its replacement.
     */
    public void map(Var from, Var to) {
        varMap.put(from, to);
    }

    /**
     * Get what a variable is mapped to.
     *
     * @param var The variable.
     * @return Its replacement, or itself if it is not mapped.
     */
    public Var lookup(Var var) {
        return varMap.getOrDefault(var, var);
    }

    private List<Var> lookupAll(List<Var> vars) {
        List<Var> ret = new ArrayList<>(vars.size());
        for (Var var : vars) {
            ret.add(var == null ? null : lookup(var));
        }
        return ret;
    }

    private Var fresh(Var old) {
        return varMap.computeIfAbsent(old, $ -> func.newVar(old.name, old.getNullable(CommonExts.TYPE)));
    }

    /**
     * Clone an effect, including its nested regions.
     *
     * @param fx The effect.
     * @return The clone, not yet in any block.
     */
    public Effect cloneEffect(Effect fx) {
        Insn insn = fx.insn();
        List<Region> regions = new ArrayList<>(insn.regions().size());
        for (Region region : insn.regions()) {
            regions.add(cloneRegion(region));
        }
        List<Var> results = new ArrayList<>(fx.getAssignsTo().size());
        for (Var result : fx.getAssignsTo()) {
            results.add(fresh(result));
        }
        return insn.op.insn(lookupAll(insn.args()), regions).assignTo(results);
    }

    /**
     * Clone a control instruction, remapping its targets.
     *
     * @param ctrl The control instruction.
     * @return The clone, not yet in any block.
     */
    public Control cloneControl(Control ctrl) {
        List<BasicBlock> targets = new ArrayList<>(ctrl.targets.size());
        for (BasicBlock target : ctrl.targets) {
            targets.add(blockMap.getOrDefault(target, target));
        }
        return ctrl.insn().op.insn(lookupAll(ctrl.insn().args())).jumpsTo(targets);
    }

    /**
     * Clone a region with all of its blocks.
     *
     * @param region The region.
     * @return The clone, not owned by anything.
     */
    public Region cloneRegion(Region region) {
        Region clone = new Region();
        // every block and value must exist before any branch or use refers to it
        for (BasicBlock block : region.blocks) {
            BasicBlock cloneBlock = clone.newBb();
            blockMap.put(block, cloneBlock);
            for (Var arg : block.args) {
                cloneBlock.args.add(fresh(arg));
            }
            for (Effect effect : block.getEffects()) {
                for (Var result : effect.getAssignsTo()) {
                    fresh(result);
                }
            }
        }
        for (BasicBlock block : region.blocks) {
            BasicBlock cloneBlock = blockMap.get(block);
            for (Effect effect : block.getEffects()) {
                cloneBlock.addEffect(cloneEffect(effect));
            }
            if (block.getControl() != null) {
                cloneBlock.setControl(cloneControl(block.getControl()));
            }
        }
        return clone;
    }
}
