package io.lapse4j.exec;

import io.lapse4j.ItemTransform;
import io.lapse4j.ProgressCallback;
import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.ExecutionResult;
import io.lapse4j.core.ExecutionStrategy;
import io.lapse4j.core.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an {@link ItemTransform} over a list of items on a worker pool, with progress reporting and cooperative
 * cancellation.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ParallelExecutor executor = new ParallelExecutor(ExecutorSettings.builder().workers(4).build());
 *
 * List<Path> written = executor.run(
 *         (file, idx) -> writer.write(file, idx),
 *         files,
 *         ExecutionStrategy.THREADED,
 *         (done, total, msg) -> log.info("{}/{}", done, total));
 * }</pre>
 *
 * <p>Results come back in completion order. A failing item aborts the whole run: pending work is cancelled,
 * in-flight chunks stop after their current item and the pool is shut down without waiting for stragglers.
 * The same teardown happens when the {@link CancellationToken} is set, which the collector notices within one
 * {@link ExecutorSettings#pollInterval() poll interval}.
 */
public class ParallelExecutor {
    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    private final ExecutorSettings settings;

    public ParallelExecutor() {
        this(ExecutorSettings.defaults());
    }

    public ParallelExecutor(ExecutorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public ExecutorSettings settings() {
        return settings;
    }

    /**
     * Runs to completion and returns the results.
     *
     * @throws TransformException if any item failed
     */
    public <T, R> List<R> run(ItemTransform<? super T, ? extends R> transform,
                              List<T> items,
                              ExecutionStrategy strategy,
                              ProgressCallback progress) {
        return run(transform, items, strategy, progress, new CancellationToken());
    }

    /**
     * Throwing variant of {@link #execute}.
     *
     * @throws TransformException                          if any item failed
     * @throws io.lapse4j.core.ExecutionCancelledException if {@code token} was cancelled
     */
    public <T, R> List<R> run(ItemTransform<? super T, ? extends R> transform,
                              List<T> items,
                              ExecutionStrategy strategy,
                              ProgressCallback progress,
                              CancellationToken token) {
        ExecutionResult<R> result = execute(transform, items, strategy, progress, token);
        return result.orThrow();
    }

    public <T, R> List<R> runThreaded(ItemTransform<? super T, ? extends R> transform, List<T> items, ProgressCallback progress) {
        return run(transform, items, ExecutionStrategy.THREADED, progress);
    }

    public <T, R> List<R> runChunked(ItemTransform<? super T, ? extends R> transform, List<T> items, ProgressCallback progress) {
        return run(transform, items, ExecutionStrategy.CHUNKED, progress);
    }

    /**
     * Runs {@code transform} once per item as {@code transform.apply(item, index)}.
     *
     * @param progress optional; THREADED reports once per completed item, CHUNKED whenever the shared counter
     *                 moved since the last poll
     * @param token    checked by workers between items and by the collector on every poll
     * @return tri-state outcome; never throws for transform failures or cancellation
     */
    public <T, R> ExecutionResult<R> execute(ItemTransform<? super T, ? extends R> transform,
                                             List<T> items,
                                             ExecutionStrategy strategy,
                                             ProgressCallback progress,
                                             CancellationToken token) {
        Objects.requireNonNull(transform, "transform must not be null");
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(token, "token must not be null");

        List<T> work = new ArrayList<>(items);
        int total = work.size();
        if (token.isCancelled()) {
            return ExecutionResult.cancelled(List.of(), 0, total);
        }
        if (total == 0) {
            return ExecutionResult.completed(List.of(), 0);
        }
        if (settings.debug()) {
            return runSynchronously(transform, work, token);
        }

        boolean perItem = strategy == ExecutionStrategy.THREADED;
        int chunkSize = perItem ? 1 : settings.chunkSize(total);
        int poolSize = perItem ? settings.threadPoolSize() : settings.workers();

        List<Chunk<T>> chunks = new ArrayList<>();
        for (int start = 0; start < total; start += chunkSize) {
            chunks.add(new Chunk<>(start, work.subList(start, Math.min(total, start + chunkSize))));
        }
        poolSize = Math.min(poolSize, chunks.size());

        log.debug("parallel run strategy={} items={} chunks={} chunkSize={} poolSize={}",
                strategy, total, chunks.size(), chunkSize, poolSize);

        ProgressAggregator aggregator = new ProgressAggregator(total, progress);
        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads(strategy));
        CompletionService<List<R>> completion = new ExecutorCompletionService<>(pool);
        List<Future<List<R>>> futures = new ArrayList<>(chunks.size());
        boolean clean = false;
        try {
            for (Chunk<T> chunk : chunks) {
                futures.add(completion.submit(chunkTask(transform, chunk, aggregator, stop, token)));
            }
            ExecutionResult<R> result = collect(completion, futures, aggregator, progress, perItem, total, token);
            clean = result.isCompleted();
            return result;
        } finally {
            if (clean) {
                pool.shutdown();
            } else {
                stop.set(true);
                for (Future<?> f : futures) {
                    f.cancel(false);
                }
                pool.shutdown();
            }
        }
    }

    private <R> ExecutionResult<R> collect(CompletionService<List<R>> completion,
                                           List<Future<List<R>>> futures,
                                           ProgressAggregator aggregator,
                                           ProgressCallback progress,
                                           boolean perItem,
                                           int total,
                                           CancellationToken token) {
        ProgressCallback cb = ProgressCallback.orNoop(progress);
        List<R> results = new ArrayList<>(total);
        int pending = futures.size();
        int drained = 0;
        long pollMillis = settings.pollInterval().toMillis();

        while (pending > 0) {
            if (token.isCancelled()) {
                log.debug("parallel run cancelled completed={} total={}", aggregator.completed(), total);
                return ExecutionResult.cancelled(results, aggregator.completed(), total);
            }

            Future<List<R>> done;
            try {
                done = completion.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel();
                return ExecutionResult.cancelled(results, aggregator.completed(), total);
            }

            if (done != null) {
                pending--;
                List<R> chunkResults;
                try {
                    chunkResults = done.get();
                } catch (ExecutionException e) {
                    TransformException failure = asTransformException(e.getCause());
                    log.debug("parallel run failed item={} msg={}", failure.itemIndex(), failure.getMessage());
                    return ExecutionResult.failed(results, aggregator.completed(), total, failure);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    return ExecutionResult.cancelled(results, aggregator.completed(), total);
                }
                results.addAll(chunkResults);

                if (perItem && !chunkResults.isEmpty()) {
                    drained += chunkResults.size();
                    cb.onProgress(drained, total, "");
                }
            }

            if (!perItem) {
                aggregator.publishIfChanged();
            }
        }

        if (token.isCancelled() && results.size() < total) {
            return ExecutionResult.cancelled(results, aggregator.completed(), total);
        }
        if (!perItem) {
            // the counter may lag slightly behind chunk completion
            aggregator.publishIfChanged();
        }
        return ExecutionResult.completed(results, total);
    }

    private <T, R> Callable<List<R>> chunkTask(ItemTransform<? super T, ? extends R> transform,
                                               Chunk<T> chunk,
                                               ProgressAggregator aggregator,
                                               AtomicBoolean stop,
                                               CancellationToken token) {
        return () -> {
            List<R> out = new ArrayList<>(chunk.items().size());
            for (int i = 0; i < chunk.items().size(); i++) {
                if (stop.get() || token.isCancelled()) {
                    break;
                }
                int index = chunk.start() + i;
                T item = chunk.items().get(i);
                try {
                    out.add(transform.apply(item, index));
                } catch (Exception e) {
                    throw new TransformException(item, index, e);
                }
                aggregator.increment();
            }
            return out;
        };
    }

    private <T, R> ExecutionResult<R> runSynchronously(ItemTransform<? super T, ? extends R> transform,
                                                       List<T> items,
                                                       CancellationToken token) {
        int total = items.size();
        List<R> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            if (token.isCancelled()) {
                return ExecutionResult.cancelled(results, i, total);
            }
            T item = items.get(i);
            R result;
            try {
                result = transform.apply(item, i);
            } catch (Exception e) {
                return ExecutionResult.failed(results, i, total, new TransformException(item, i, e));
            }
            results.add(result);
            if (i < settings.debugSampleSize()) {
                log.debug("result #{}: {}", i, result);
            }
        }
        return ExecutionResult.completed(results, total);
    }

    private static TransformException asTransformException(Throwable cause) {
        if (cause instanceof TransformException te) {
            return te;
        }
        return new TransformException(null, -1, cause);
    }

    private static ThreadFactory workerThreads(ExecutionStrategy strategy) {
        String prefix = "lapse." + strategy.name().toLowerCase() + "-worker-";
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Chunk<T>(int start, List<T> items) {
        Chunk {
            items = Collections.unmodifiableList(items);
        }
    }
}
