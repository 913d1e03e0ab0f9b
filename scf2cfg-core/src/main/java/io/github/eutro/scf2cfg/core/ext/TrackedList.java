package io.github.eutro.scf2cfg.core.ext;

import java.util.*;

/**
 * A list that notifies on every element entering or leaving it, used to keep owner exts in sync.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        viewed.add(index, element);
        onAdded(element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        boolean changed = viewed.addAll(index, c);
        for (E e : c) {
            onAdded(e);
        }
        return changed;
    }

    @Override
    public void clear() {
        List<E> removed = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : removed) {
            onRemoved(e);
        }
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        List<E> range = viewed.subList(fromIndex, toIndex);
        List<E> removed = new ArrayList<>(range);
        range.clear();
        for (E e : removed) {
            onRemoved(e);
        }
    }
}
