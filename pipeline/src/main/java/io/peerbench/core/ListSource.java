package io.peerbench.core;

import java.util.List;
import java.util.Optional;

/**
 * Emits a fixed list of items as records, then completes.
 */
public class ListSource<T> implements Source<T> {
    private final List<T> items;
    private int idx = 0;

    public ListSource(List<T> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public synchronized Optional<Record<T>> poll() {
        if (idx >= items.size()) return Optional.empty();
        Record<T> r = Record.of(idx, items.get(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public synchronized boolean isFinished() {
        return idx >= items.size();
    }

    public int size() { return items.size(); }
}
