package io.github.eutro.scf2cfg.core.ops;

import io.github.eutro.scf2cfg.core.ext.DelegatingExtHolder;
import io.github.eutro.scf2cfg.core.ext.ExtContainer;
import io.github.eutro.scf2cfg.core.ssa.Insn;
import io.github.eutro.scf2cfg.core.ssa.Region;
import io.github.eutro.scf2cfg.core.ssa.Var;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any intermediates.
 */
public class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... vars) {
        return insn(Arrays.asList(vars));
    }

    public Insn insn(List<Var> vars) {
        return insn(vars, Collections.emptyList());
    }

    /**
     * Construct an instruction applying this operation to the given arguments,
     * taking ownership of the given regions.
     *
     * @param vars    The arguments.
     * @param regions The nested regions.
     * @return The instruction.
     */
    public Insn insn(List<Var> vars, List<Region> regions) {
        return new Insn(this, vars, regions);
    }
}
