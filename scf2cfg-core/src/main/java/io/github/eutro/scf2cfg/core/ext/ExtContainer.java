package io.github.eutro.scf2cfg.core.ext;

import io.github.eutro.scf2cfg.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something {@link Ext}s can be attached to. See the {@link io.github.eutro.scf2cfg.core.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} under {@code ext}, replacing any previous value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    <T> void removeExt(Ext<T> ext);

    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value under {@code ext}, failing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new IllegalStateException(String.format("ext %s not present on %s", ext.getName(), this));
    }

    /**
     * Get the value under {@code ext}, running {@code pass} on {@code o} first if it is absent.
     *
     * @param ext  The ext.
     * @param o    What to run the pass on.
     * @param pass The pass that computes the ext.
     * @param <T>  The type of the ext.
     * @param <O>  The type the pass runs on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
