package io.github.eutro.cil2ast.ext;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list view that is notified of every element entering or leaving it.
 * <p>
 * Only the primitive mutators are overridden; {@link AbstractList} routes bulk operations
 * and iterator removal through them.
 *
 * @param <E> The element type.
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
    public void add(int index, E element) {
        viewed.add(index, element);
        onAdded(element);
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }
}
