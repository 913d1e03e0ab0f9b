package io.github.eutro.scf2cfg.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a lazily allocated sorted map.
 * <p>
 * Subclasses store their hot exts in fields and only fall back to the map for the rest.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (map == null) map = new TreeMap<>();
        map.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        map.remove(ext);
        if (map.isEmpty()) map = null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return map == null ? null : (T) map.get(ext);
    }
}
