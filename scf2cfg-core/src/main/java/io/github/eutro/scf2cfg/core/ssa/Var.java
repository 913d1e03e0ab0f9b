package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.Ext;
import io.github.eutro.scf2cfg.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.util.Set;

/**
 * An SSA value.
 * <p>
 * Defined exactly once, either as a result of an {@link Effect}
 * ({@link CommonExts#ASSIGNED_AT}) or as an argument of a {@link BasicBlock}
 * ({@link CommonExts#BLOCK_ARG_OF}).
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to tell apart variables with the same name
     * if {@link Function#UNIQUE_VAR_NAMES} is set.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;
    private BasicBlock blockArgOf = null;
    private Set<Insn> usedAt = null;
    private Type type = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) return (T) assignedAt;
        if (ext == CommonExts.BLOCK_ARG_OF) return (T) blockArgOf;
        if (ext == CommonExts.USED_AT) return (T) usedAt;
        if (ext == CommonExts.TYPE) return (T) type;
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
        } else if (ext == CommonExts.BLOCK_ARG_OF) {
            blockArgOf = (BasicBlock) value;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = (Set<Insn>) value;
        } else if (ext == CommonExts.TYPE) {
            type = (Type) value;
        } else {
            super.attachExt(ext, value);
        }
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
        } else if (ext == CommonExts.BLOCK_ARG_OF) {
            blockArgOf = null;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = null;
        } else if (ext == CommonExts.TYPE) {
            type = null;
        } else {
            super.removeExt(ext);
        }
    }
}
