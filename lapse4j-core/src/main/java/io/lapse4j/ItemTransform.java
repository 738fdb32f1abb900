package io.lapse4j;

/**
 * Per-item unit of work executed by {@link io.lapse4j.exec.ParallelExecutor}.
 *
 * <p>Fixed arguments (output directory, writer options, ...) are captured by the implementation.
 *
 * @param <T> item type, usually a path or a (path, timestamp) pair
 * @param <R> result type
 */
@FunctionalInterface
public interface ItemTransform<T, R> {

    /**
     * @param item  the item to process
     * @param index position of the item in the submitted list
     */
    R apply(T item, int index) throws Exception;
}
