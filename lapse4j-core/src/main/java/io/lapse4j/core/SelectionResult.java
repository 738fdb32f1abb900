package io.lapse4j.core;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/**
 * Paths picked by a selector: sorted by path, no duplicates.
 */
public record SelectionResult(List<Path> paths) implements Iterable<Path> {

    private static final SelectionResult EMPTY = new SelectionResult(List.of());

    public SelectionResult {
        paths = List.copyOf(new TreeSet<>(paths));
    }

    public static SelectionResult empty() {
        return EMPTY;
    }

    public static SelectionResult of(Collection<Path> paths) {
        return paths.isEmpty() ? EMPTY : new SelectionResult(List.copyOf(paths));
    }

    public int size() {
        return paths.size();
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public boolean contains(Path path) {
        return paths.contains(path);
    }

    @Override
    public Iterator<Path> iterator() {
        return paths.iterator();
    }
}
