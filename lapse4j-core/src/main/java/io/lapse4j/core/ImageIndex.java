package io.lapse4j.core;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Day-grouped index of timestamped images: {@code day-key -> (path -> timestamp)}.
 *
 * <p>Every file is stored under the ISO date of its own timestamp. Instances are immutable;
 * use {@link Builder} or {@link #subIndex(Collection)} to derive new ones.
 */
public final class ImageIndex {

    private static final ImageIndex EMPTY = new ImageIndex(new TreeMap<>());

    private final SortedMap<String, SortedMap<Path, LocalDateTime>> days;
    private final int imageCount;

    private ImageIndex(SortedMap<String, SortedMap<Path, LocalDateTime>> days) {
        SortedMap<String, SortedMap<Path, LocalDateTime>> copy = new TreeMap<>();
        int count = 0;
        for (var e : days.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(e.getValue())));
            count += e.getValue().size();
        }
        this.days = Collections.unmodifiableSortedMap(copy);
        this.imageCount = count;
    }

    public static ImageIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ImageIndex of(Collection<TimestampedFile> files) {
        Builder b = builder();
        files.forEach(b::add);
        return b.build();
    }

    /**
     * Sorted day-keys present in the index.
     */
    public List<String> days() {
        return List.copyOf(days.keySet());
    }

    public SortedMap<String, SortedMap<Path, LocalDateTime>> asMap() {
        return days;
    }

    /**
     * Files captured on {@code day}, keyed by path.
     *
     * @throws IllegalArgumentException if the day is not in the index
     */
    public SortedMap<Path, LocalDateTime> filesOn(String day) {
        SortedMap<Path, LocalDateTime> files = days.get(day);
        if (files == null) {
            throw new IllegalArgumentException("Day '" + day + "' not found in image index: " + days.keySet());
        }
        return files;
    }

    /**
     * Files captured on the {@code position}-th day (in day-key order).
     */
    public SortedMap<Path, LocalDateTime> filesOn(int position) {
        List<String> keys = days();
        if (position < 0 || position >= keys.size()) {
            throw new IndexOutOfBoundsException("day position " + position + " out of range, days=" + keys.size());
        }
        return days.get(keys.get(position));
    }

    /**
     * Day's files ordered by (timestamp, path).
     */
    public List<TimestampedFile> timelineOf(String day) {
        List<TimestampedFile> out = new ArrayList<>();
        filesOn(day).forEach((path, ts) -> out.add(new TimestampedFile(path, ts)));
        out.sort(TimestampedFile.BY_TIMESTAMP);
        return out;
    }

    /**
     * All files ordered by (timestamp, path).
     */
    public List<TimestampedFile> timeline() {
        List<TimestampedFile> out = new ArrayList<>(imageCount);
        for (var day : days.values()) {
            day.forEach((path, ts) -> out.add(new TimestampedFile(path, ts)));
        }
        out.sort(TimestampedFile.BY_TIMESTAMP);
        return out;
    }

    public LocalDateTime timestampOf(Path path) {
        Path p = path.normalize();
        for (var day : days.values()) {
            LocalDateTime ts = day.get(p);
            if (ts != null) {
                return ts;
            }
        }
        return null;
    }

    public int imageCount() {
        return imageCount;
    }

    public boolean isEmpty() {
        return imageCount == 0;
    }

    /**
     * Narrows this index to {@code paths} without touching the filesystem.
     *
     * <p>The result groups the subset exactly as indexing those files directly would. Paths not in this
     * index are ignored.
     */
    public ImageIndex subIndex(Collection<Path> paths) {
        Objects.requireNonNull(paths, "paths must not be null");
        Set<Path> wanted = new HashSet<>();
        for (Path p : paths) {
            wanted.add(p.normalize());
        }

        SortedMap<String, SortedMap<Path, LocalDateTime>> result = new TreeMap<>();
        for (var day : days.entrySet()) {
            SortedMap<Path, LocalDateTime> matched = new TreeMap<>();
            day.getValue().forEach((path, ts) -> {
                if (wanted.contains(path)) {
                    matched.put(path, ts);
                }
            });
            if (!matched.isEmpty()) {
                result.put(day.getKey(), matched);
            }
        }
        return new ImageIndex(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageIndex other)) return false;
        return days.equals(other.days);
    }

    @Override
    public int hashCode() {
        return days.hashCode();
    }

    @Override
    public String toString() {
        return "ImageIndex(days=" + days.size() + ", images=" + imageCount + ")";
    }

    public static final class Builder {
        private final SortedMap<String, SortedMap<Path, LocalDateTime>> days = new TreeMap<>();
        private final Map<Path, String> dayOfPath = new HashMap<>();

        public Builder add(TimestampedFile file) {
            Objects.requireNonNull(file, "file must not be null");
            return add(file.path(), file.timestamp());
        }

        public Builder add(Path path, LocalDateTime timestamp) {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(timestamp, "timestamp must not be null");
            Path p = path.normalize();
            String day = timestamp.toLocalDate().toString();

            // a re-added path must not linger under its previous day
            String previous = dayOfPath.put(p, day);
            if (previous != null && !previous.equals(day)) {
                SortedMap<Path, LocalDateTime> old = days.get(previous);
                old.remove(p);
                if (old.isEmpty()) {
                    days.remove(previous);
                }
            }
            days.computeIfAbsent(day, d -> new TreeMap<>()).put(p, timestamp);
            return this;
        }

        public ImageIndex build() {
            return new ImageIndex(days);
        }
    }
}
