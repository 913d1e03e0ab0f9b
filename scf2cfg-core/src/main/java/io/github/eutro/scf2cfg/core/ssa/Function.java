package io.github.eutro.scf2cfg.core.ssa;

import io.github.eutro.scf2cfg.core.ext.CommonExts;
import io.github.eutro.scf2cfg.core.ext.Ext;
import io.github.eutro.scf2cfg.core.ext.ExtHolder;
import io.github.eutro.scf2cfg.core.ext.MetadataState;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.lang.ref.SoftReference;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function, whose body is a {@link Region}.
 * <p>
 * Parameters are read with {@link io.github.eutro.scf2cfg.core.ops.CommonOps#ARG} effects,
 * and results are returned with {@link io.github.eutro.scf2cfg.core.ops.CommonOps#RETURN}.
 */
public final class Function extends ExtHolder {
    /**
     * Whether variables with the same name should be numbered apart. Useful for debugging.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("SCF2CFG_UNIQUE_VAR_NAMES") != null;

    /**
     * The body of the function.
     */
    public final Region body = new Region();
    /**
     * The blocks of the {@link #body}. The first one is the entry.
     */
    public final List<BasicBlock> blocks = body.blocks;

    // names only matter for debugging, so let the GC have them if it needs the memory
    private SoftReference<Map<String, Integer>> varsRef = UNIQUE_VAR_NAMES ? new SoftReference<>(new HashMap<>()) : null;

    /**
     * Construct an empty function.
     */
    public Function() {
        body.attachExt(CommonExts.OWNING_FUNCTION, this);
    }

    /**
     * Create a new variable.
     *
     * @param name The name.
     * @param type The type, or null if it is not known yet.
     * @return The new variable.
     */
    public Var newVar(String name, @Nullable Type type) {
        Var var = new Var(name, nextIndex(name));
        if (type != null) var.attachExt(CommonExts.TYPE, type);
        return var;
    }

    private int nextIndex(String name) {
        if (!UNIQUE_VAR_NAMES) return 0;
        Map<String, Integer> vars = varsRef.get();
        if (vars == null) {
            vars = new HashMap<>();
            varsRef = new SoftReference<>(vars);
        }
        Integer last = vars.get(name);
        int index = last == null ? 0 : last + 1;
        vars.put(name, index);
        return index;
    }

    /**
     * Create a new basic block at the end of the body.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        return body.newBb();
    }

    @Override
    public String toString() {
        return "fn " + body;
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
