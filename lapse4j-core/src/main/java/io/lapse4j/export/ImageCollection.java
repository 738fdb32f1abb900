package io.lapse4j.export;

import io.lapse4j.ProgressCallback;
import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ExecutionResult;
import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.FixedWindowSpec;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.SelectionResult;
import io.lapse4j.exec.ParallelExecutor;
import io.lapse4j.index.TimestampIndexer;
import io.lapse4j.select.FixedWindowSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named directory of time-lapse images, its index and the exports registered against it.
 *
 * <p>Exports are kept in registration order; registering a name again replaces the earlier export.
 */
public final class ImageCollection {
    private static final Logger log = LoggerFactory.getLogger(ImageCollection.class);

    public static final String DEFAULT_MASK = "*";
    public static final String DEFAULT_EXTENSION = "jpg";

    private final String name;
    private final Path sourceDir;
    private final Path exportDir;
    private final String mask;
    private final String extension;
    private final TimestampIndexer indexer;
    private final Map<String, ScheduledExport> exports = new LinkedHashMap<>();
    private volatile ImageIndex index;

    private ImageCollection(String name, Path sourceDir, Path exportDir, String mask, String extension,
                            TimestampIndexer indexer, ImageIndex index) {
        this.name = name;
        this.sourceDir = sourceDir;
        this.exportDir = exportDir;
        this.mask = mask;
        this.extension = extension;
        this.indexer = indexer;
        this.index = index;
    }

    /**
     * Scans and indexes {@code sourceDir} with the default mask and extension.
     */
    public static ImageCollection load(String name, Path sourceDir, Path exportDir, TimestampIndexer indexer)
            throws IOException {
        return load(name, sourceDir, exportDir, DEFAULT_MASK, DEFAULT_EXTENSION, indexer, ProgressCallback.NOOP);
    }

    public static ImageCollection load(String name, Path sourceDir, Path exportDir, String mask, String extension,
                                       TimestampIndexer indexer, ProgressCallback progress) throws IOException {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(sourceDir, "sourceDir must not be null");
        Objects.requireNonNull(exportDir, "exportDir must not be null");
        Objects.requireNonNull(indexer, "indexer must not be null");
        ImageIndex index = indexer.indexDirectory(sourceDir, mask, extension, progress);
        log.info("collection loaded name={} images={} days={}", name, index.imageCount(), index.days().size());
        return new ImageCollection(name, sourceDir, exportDir, mask, extension, indexer, index);
    }

    public String name() {
        return name;
    }

    public Path sourceDir() {
        return sourceDir;
    }

    public Path exportDir() {
        return exportDir;
    }

    public ImageIndex index() {
        return index;
    }

    public int imageCount() {
        return index.imageCount();
    }

    /**
     * Re-scans the source directory and replaces the index.
     */
    public ImageIndex refresh(ProgressCallback progress) throws IOException {
        ImageIndex fresh = indexer.indexDirectory(sourceDir, mask, extension, progress);
        this.index = fresh;
        log.info("collection refreshed name={} images={}", name, fresh.imageCount());
        return fresh;
    }

    public ScheduledExport addExport(String exportName, String subdir, String prefix, String description,
                                     CronSchedule schedule) {
        return addExport(new ScheduledExport(exportName, subdir, prefix, description, schedule));
    }

    public synchronized ScheduledExport addExport(ScheduledExport export) {
        Objects.requireNonNull(export, "export must not be null");
        ScheduledExport previous = exports.put(export.name(), export);
        if (previous != null) {
            log.debug("export replaced collection={} name={}", name, export.name());
        }
        return export;
    }

    public synchronized List<ScheduledExport> exports() {
        return Collections.unmodifiableList(new ArrayList<>(exports.values()));
    }

    public synchronized ScheduledExport getExport(String exportName) {
        ScheduledExport export = exports.get(exportName);
        if (export == null) {
            throw new IllegalStateException("No export registered for name: " + exportName);
        }
        return export;
    }

    public ExecutionResult<Path> export(String exportName,
                                        ExportOptions options,
                                        ImageWriter writer,
                                        ParallelExecutor executor,
                                        ProgressCallback progress,
                                        CancellationToken token) throws IOException {
        return getExport(exportName).run(index, exportDir, options, writer, executor, progress, token);
    }

    /**
     * Runs every registered export in registration order. Stops early once {@code token} is cancelled.
     *
     * @return outcome per export name, for the exports that ran
     */
    public Map<String, ExecutionResult<Path>> exportAll(ExportOptions options,
                                                        ImageWriter writer,
                                                        ParallelExecutor executor,
                                                        ProgressCallback progress,
                                                        CancellationToken token) throws IOException {
        Map<String, ExecutionResult<Path>> results = new LinkedHashMap<>();
        for (ScheduledExport export : exports()) {
            if (token.isCancelled()) {
                log.info("exportAll cancelled collection={} remaining from={}", name, export.name());
                break;
            }
            results.put(export.name(), export.run(index, exportDir, options, writer, executor, progress, token));
        }
        return results;
    }

    public FilteredImages filterImages(FixedWindowSpec spec) {
        ImageIndex current = index;
        SelectionResult selection = new FixedWindowSelector().select(current, spec);
        return new FilteredImages(selection, current.subIndex(selection.paths()));
    }

    /**
     * A fixed-window selection together with the index restricted to it.
     */
    public record FilteredImages(SelectionResult selection, ImageIndex index) {
    }

    @Override
    public String toString() {
        return "ImageCollection{name=" + name + ", sourceDir=" + sourceDir + ", images=" + index.imageCount() + "}";
    }
}
