package io.github.eutro.scf2cfg.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for a piece of metadata that can be attached to an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, which is what {@link ExtHolder} relies on to keep
 * its map sorted. That order is stable within one run but not across runs.
 *
 * @param <T> The type of the value stored under this ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code type} only needs to be a (possibly raw) superclass of the stored values,
     * since class literals cannot express generic types like {@code List<BasicBlock>}.
     *
     * @param type The erased type of the ext's values.
     * @param name A name, for debugging.
     * @param <T>  The erased type.
     * @param <R>  The actual type of the ext's values.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the erased type this ext was created with.
     *
     * @return The type.
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
