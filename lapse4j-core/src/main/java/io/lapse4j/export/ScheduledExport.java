package io.lapse4j.export;

import io.lapse4j.FireTimeEvaluator;
import io.lapse4j.ItemTransform;
import io.lapse4j.ProgressCallback;
import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ExecutionResult;
import io.lapse4j.core.ExecutionStrategy;
import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.SelectionResult;
import io.lapse4j.core.TimestampedFile;
import io.lapse4j.exec.ParallelExecutor;
import io.lapse4j.internal.QuartzFireTimeEvaluator;
import io.lapse4j.select.CronFireTimeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A named export: the images matching a cron schedule, written as a numbered sequence into {@code subdir}.
 */
public final class ScheduledExport {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExport.class);

    private final String name;
    private final String subdir;
    private final String prefix;
    private final String description;
    private final CronSchedule schedule;
    private final FireTimeEvaluator evaluator;
    private final int fuzzyMinutes;
    private final CronFireTimeSelector selector = new CronFireTimeSelector();

    public ScheduledExport(String name, String subdir, String prefix, String description, CronSchedule schedule) {
        this(name, subdir, prefix, description, schedule, CronFireTimeSelector.DEFAULT_FUZZY_MINUTES);
    }

    public ScheduledExport(String name, String subdir, String prefix, String description,
                           CronSchedule schedule, int fuzzyMinutes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("export name must not be blank");
        }
        if (fuzzyMinutes < 0) {
            throw new IllegalArgumentException("fuzzyMinutes must be non-negative: " + fuzzyMinutes);
        }
        this.name = name;
        this.subdir = subdir == null || subdir.isBlank() ? name : subdir;
        this.prefix = prefix == null ? "" : prefix;
        this.description = description == null ? "" : description;
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.evaluator = QuartzFireTimeEvaluator.of(schedule);
        this.fuzzyMinutes = fuzzyMinutes;
    }

    public String name() {
        return name;
    }

    public String subdir() {
        return subdir;
    }

    public String prefix() {
        return prefix;
    }

    public String description() {
        return description;
    }

    public CronSchedule schedule() {
        return schedule;
    }

    public FireTimeEvaluator evaluator() {
        return evaluator;
    }

    public int fuzzyMinutes() {
        return fuzzyMinutes;
    }

    public Path targetDirectory(Path exportRoot) {
        return exportRoot.resolve(subdir);
    }

    public SelectionResult select(ImageIndex index) {
        return selector.select(index, evaluator, fuzzyMinutes);
    }

    /**
     * Selects, clears the target directory and writes the selection in timestamp order.
     *
     * @return the written files (in completion order), or the cancelled/failed outcome of the write phase
     * @throws IOException if the target directory cannot be created or cleared
     */
    public ExecutionResult<Path> run(ImageIndex index,
                                     Path exportRoot,
                                     ExportOptions options,
                                     ImageWriter writer,
                                     ParallelExecutor executor,
                                     ProgressCallback progress,
                                     CancellationToken token) throws IOException {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(writer, "writer must not be null");

        SelectionResult selection = select(index);
        Path target = targetDirectory(exportRoot);
        log.info("export selected name={} images={} target={}", name, selection.size(), target);

        OutputDirectories.prepare(target, options.extension());

        List<TimestampedFile> ordered = index.subIndex(selection.paths()).timeline();
        SequenceNaming naming = SequenceNaming.of(prefix, options, target);
        ItemTransform<TimestampedFile, Path> transform =
                (file, i) -> writer.write(file, target.resolve(naming.fileName(i)), options);

        ExecutionResult<Path> result = executor.execute(transform, ordered, ExecutionStrategy.THREADED,
                ProgressCallback.orNoop(progress), token);
        log.info("export finished name={} outcome={} written={}/{}",
                name, result.outcome(), result.completed(), result.total());
        return result;
    }

    @Override
    public String toString() {
        return "ScheduledExport{name=" + name + ", subdir=" + subdir + ", schedule=" + schedule + "}";
    }
}
