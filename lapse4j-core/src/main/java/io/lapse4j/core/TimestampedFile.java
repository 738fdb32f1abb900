package io.lapse4j.core;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * An image file paired with the civil time it was captured.
 */
public record TimestampedFile(Path path, LocalDateTime timestamp) {

    public static final Comparator<TimestampedFile> BY_TIMESTAMP =
            Comparator.comparing(TimestampedFile::timestamp).thenComparing(TimestampedFile::path);

    public TimestampedFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * ISO calendar date of the timestamp, used as day-key in {@link ImageIndex}.
     */
    public String dayKey() {
        return timestamp.toLocalDate().toString();
    }
}
