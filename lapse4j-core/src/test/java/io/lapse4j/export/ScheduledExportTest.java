package io.lapse4j.export;

import io.lapse4j.core.CancellationToken;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ExecutionResult;
import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.TimestampedFile;
import io.lapse4j.exec.ExecutorSettings;
import io.lapse4j.exec.ParallelExecutor;
import io.lapse4j.index.TimestampIndexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledExportTest {

    @TempDir
    Path source;

    @TempDir
    Path exportRoot;

    private final ParallelExecutor executor = new ParallelExecutor(ExecutorSettings.builder()
            .workers(2)
            .pollInterval(Duration.ofMillis(20))
            .build());

    private ImageIndex index;

    @BeforeEach
    void createImages() throws IOException {
        for (int hour = 0; hour < 24; hour++) {
            for (int minute = 0; minute < 60; minute += 10) {
                String name = String.format("cam-2024-05-01-%02d%02d.jpg", hour, minute);
                Files.writeString(source.resolve(name), name);
            }
        }
        index = new TimestampIndexer().indexDirectory(source, "cam*", "jpg", null);
    }

    @Test
    void runShouldWriteSelectionAsNumberedSequence() throws IOException {
        Path target = Files.createDirectories(exportRoot.resolve("hourly"));
        Path stale = Files.writeString(target.resolve("hourly 00099.jpg"), "stale");
        Path unrelated = Files.writeString(target.resolve("notes.txt"), "keep");
        ScheduledExport export = new ScheduledExport("hourly", "hourly", "", "one frame per hour",
                CronSchedule.builder().minute("0").timezone("UTC").build());

        ExecutionResult<Path> result = export.run(index, exportRoot, ExportOptions.defaults(),
                new CopyingImageWriter(), executor, null, new CancellationToken());

        assertTrue(result.isCompleted());
        assertEquals(24, result.results().size());
        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(unrelated));
        assertEquals("cam-2024-05-01-0000.jpg", Files.readString(target.resolve("hourly 00001.jpg")));
        assertEquals("cam-2024-05-01-2300.jpg", Files.readString(target.resolve("hourly 00024.jpg")));
    }

    @Test
    void writerShouldReceiveImagesInTimestampOrder() throws IOException {
        List<String> written = new ArrayList<>();
        ScheduledExport export = new ScheduledExport("noon", null, "midday", null,
                CronSchedule.builder().hour("12").minute("*/30").timezone("UTC").build());
        ImageWriter recording = (TimestampedFile file, Path target, ExportOptions options) -> {
            synchronized (written) {
                written.add(target.getFileName() + "=" + file.path().getFileName());
            }
            return target;
        };

        ExecutionResult<Path> result = export.run(index, exportRoot, ExportOptions.defaults().withZeroPadding(2),
                recording, executor, null, new CancellationToken());

        assertTrue(result.isCompleted());
        assertEquals("noon", export.subdir());
        assertTrue(Files.isDirectory(exportRoot.resolve("noon")));
        written.sort(null);
        assertEquals(List.of(
                "midday 01.jpg=cam-2024-05-01-1200.jpg",
                "midday 02.jpg=cam-2024-05-01-1230.jpg"), written);
    }

    @Test
    void cancelledRunShouldReportCancellation() throws IOException {
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScheduledExport export = new ScheduledExport("hourly", "hourly", "", "",
                CronSchedule.builder().minute("0").timezone("UTC").build());

        ExecutionResult<Path> result = export.run(index, exportRoot, ExportOptions.defaults(),
                new CopyingImageWriter(), executor, null, token);

        assertTrue(result.isCancelled());
        assertEquals(0, result.completed());
    }
}
