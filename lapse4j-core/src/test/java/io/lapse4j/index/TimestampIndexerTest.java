package io.lapse4j.index;

import io.lapse4j.core.DateSource;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.TimestampedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimestampIndexerTest {

    @TempDir
    Path dir;

    private final TimestampIndexer indexer = new TimestampIndexer();

    @Test
    void parseShouldReadTimestampFromFilename() {
        assertEquals(Optional.of(new TimestampedFile(Path.of("cam-2024-05-01-1230.jpg"), LocalDateTime.of(2024, 5, 1, 12, 30))),
                indexer.parse(Path.of("cam-2024-05-01-1230.jpg")));
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 30, 45),
                indexer.parse(Path.of("cam-2024-05-01-123045.jpg")).orElseThrow().timestamp());
    }

    @Test
    void parseShouldSkipNamesWithoutValidTimestamp() {
        assertTrue(indexer.parse(Path.of("notes.jpg")).isEmpty());
        assertTrue(indexer.parse(Path.of("cam-2024-13-01-1200.jpg")).isEmpty());
        assertTrue(indexer.parse(Path.of("cam-2024-02-30-1200.jpg")).isEmpty());
    }

    @Test
    void timestampMustSitRightBeforeTheExtension() {
        assertTrue(indexer.parse(Path.of("cam 2024-05-01-1200-copy.jpg")).isEmpty());
        assertTrue(indexer.parse(Path.of("cam 2024-05-01-12005.jpg")).isEmpty());
        assertTrue(indexer.parse(Path.of("cam 2024-05-01-1200")).isEmpty());
        assertEquals(LocalDateTime.of(2024, 5, 1, 12, 30),
                indexer.parse(Path.of("2023-01-01-0000 of 2024-05-01-1230.jpg")).orElseThrow().timestamp());
    }

    @Test
    void indexDirectoryShouldGroupMatchingFilesByDay() throws IOException {
        touch("cam-2024-05-01-1200.jpg");
        touch("cam-2024-05-01-1300.jpg");
        touch("cam-2024-05-02-0800.jpg");
        touch("cam-2024-05-02-0900.png");
        touch("readme.jpg");
        Files.createDirectory(dir.resolve("cam-2024-05-03-0000.jpg"));

        ImageIndex index = indexer.indexDirectory(dir, "cam*", "jpg", null);

        assertEquals(List.of("2024-05-01", "2024-05-02"), index.days());
        assertEquals(3, index.imageCount());
        assertEquals(index, indexer.indexDirectory(dir, "cam*", "jpg", null));
    }

    @Test
    void missingDirectoryShouldFail() {
        assertThrows(NoSuchFileException.class, () -> indexer.scan(dir.resolve("missing"), "*", "jpg"));
    }

    @Test
    void indexShouldReportProgressPeriodicallyAndOnCompletion() {
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < 1001; i++) {
            paths.add(Path.of(String.format("cam-2024-05-01-%02d%02d%02d.jpg", i / 3600, (i / 60) % 60, i % 60)));
        }
        List<String> events = new ArrayList<>();

        ImageIndex index = indexer.index(paths, (done, total, message) -> events.add(done + "/" + total + " " + message));

        assertEquals(1001, index.imageCount());
        assertEquals(List.of(
                "500/1001 Indexing filenames",
                "1000/1001 Indexing filenames",
                "1001/1001 Indexing complete"), events);
    }

    @Test
    void fileTimeModeShouldUseFileAttributes() throws IOException {
        touch("whatever.jpg");
        touch("no-date-in-name.jpg");

        TimestampIndexer byTime = TimestampIndexer.byFileTime(ZoneId.of("UTC"));
        ImageIndex index = byTime.indexDirectory(dir, "*", "jpg", null);

        assertEquals(DateSource.FILE_TIME, byTime.dateSource());
        assertEquals(2, index.imageCount());
    }

    @Test
    void patternWithoutRequiredGroupsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimestampIndexer(Pattern.compile("(?<year>\\d{4})")));
    }

    @Test
    void customPatternMayNameTheSecondsGroupSeconds() {
        TimestampIndexer custom = new TimestampIndexer(Pattern.compile(
                "IMG_(?<year>\\d{4})(?<month>\\d{2})(?<day>\\d{2})_(?<hour>\\d{2})(?<minute>\\d{2})(?<seconds>\\d{2})\\.jpg"));

        assertEquals(LocalDateTime.of(2023, 12, 31, 23, 59, 58),
                custom.parse(Path.of("IMG_20231231_235958.jpg")).orElseThrow().timestamp());
    }

    private Path touch(String name) throws IOException {
        return Files.createFile(dir.resolve(name));
    }
}
