package io.github.eutro.scf2cfg.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} that looks exts up in another container when it has none of its own,
 * so an instruction sees the exts of its op, and an op those of its key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T local = super.getNullable(ext);
        if (local != null) return local;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
