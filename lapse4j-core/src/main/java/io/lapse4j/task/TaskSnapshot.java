package io.lapse4j.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time, serializable view of a {@link BackgroundTask}. Result values are not included.
 */
public record TaskSnapshot(
        String id,
        String name,
        String status,
        double progress,
        int current,
        int total,
        String message,
        String error,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("finished_at") String finishedAt
) {

    public static TaskSnapshot of(BackgroundTask<?> task) {
        return new TaskSnapshot(
                task.id(),
                task.name(),
                task.status().wireName(),
                task.progressPercent(),
                task.current(),
                task.total(),
                task.message(),
                task.error().orElse(null),
                task.createdAt().toString(),
                iso(task.startedAt()),
                iso(task.completedAt())
        );
    }

    private static String iso(Optional<Instant> instant) {
        return instant.map(Instant::toString).orElse(null);
    }
}
