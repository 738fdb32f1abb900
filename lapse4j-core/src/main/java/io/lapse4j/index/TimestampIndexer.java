package io.lapse4j.index;

import io.lapse4j.ProgressCallback;
import io.lapse4j.core.DateSource;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.TimestampedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link ImageIndex}es from image files.
 *
 * <p>Two mutually exclusive modes, chosen per indexer:
 * <ul>
 *   <li>{@link DateSource#FILENAME}: the whole base name, extension included, must match a pattern with
 *   named groups {@code year, month, day, hour, minute} and an optional {@code second}/{@code seconds}
 *   group; missing or empty seconds count as 0. Files that do not match are skipped.</li>
 *   <li>{@link DateSource#FILE_TIME}: the file's creation time, converted to civil time in the indexer's zone.
 *   Files whose attributes cannot be read are skipped.</li>
 * </ul>
 */
public class TimestampIndexer {
    private static final Logger log = LoggerFactory.getLogger(TimestampIndexer.class);

    /**
     * {@code <prefix>YYYY-MM-DD-HHMM[SS].<ext>}; the timestamp sits right before the extension.
     */
    public static final Pattern DEFAULT_FILENAME_PATTERN = Pattern.compile(
            ".*(?<year>\\d{4})-(?<month>\\d{2})-(?<day>\\d{2})-(?<hour>\\d{2})(?<minute>\\d{2})(?<second>\\d{2})?\\.[^.]+");

    static final int FILENAME_PROGRESS_EVERY = 500;
    static final int FILE_TIME_PROGRESS_EVERY = 200;

    private final Pattern pattern;
    private final String secondGroup;
    private final DateSource dateSource;
    private final ZoneId zone;

    public TimestampIndexer() {
        this(DEFAULT_FILENAME_PATTERN, DateSource.FILENAME, ZoneId.systemDefault());
    }

    public TimestampIndexer(Pattern pattern) {
        this(pattern, DateSource.FILENAME, ZoneId.systemDefault());
    }

    public TimestampIndexer(Pattern pattern, DateSource dateSource, ZoneId zone) {
        this.pattern = pattern != null ? pattern : DEFAULT_FILENAME_PATTERN;
        this.dateSource = Objects.requireNonNull(dateSource, "dateSource must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");

        for (String group : List.of("year", "month", "day", "hour", "minute")) {
            if (!hasGroup(this.pattern, group)) {
                throw new IllegalArgumentException("filename pattern must define named group '" + group + "': " + this.pattern);
            }
        }
        if (hasGroup(this.pattern, "second")) {
            this.secondGroup = "second";
        } else if (hasGroup(this.pattern, "seconds")) {
            this.secondGroup = "seconds";
        } else {
            this.secondGroup = null;
        }
    }

    public static TimestampIndexer byFileTime(ZoneId zone) {
        return new TimestampIndexer(DEFAULT_FILENAME_PATTERN, DateSource.FILE_TIME, zone);
    }

    public DateSource dateSource() {
        return dateSource;
    }

    public Pattern pattern() {
        return pattern;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Lists regular files directly inside {@code directory} whose name matches the glob {@code mask.ext}, sorted.
     *
     * @throws NoSuchFileException   if the directory does not exist
     * @throws NotDirectoryException if it is not a directory
     */
    public List<Path> scan(Path directory, String mask, String ext) throws IOException {
        Objects.requireNonNull(directory, "directory must not be null");
        String glob = (mask == null || mask.isBlank() ? "*" : mask) + "." + (ext == null || ext.isBlank() ? "*" : ext);
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) && matcher.matches(entry.getFileName())) {
                    files.add(entry);
                }
            }
        }
        files.sort(null);
        log.debug("scanned directory={} glob={} files={}", directory, glob, files.size());
        return files;
    }

    /**
     * {@link #scan} followed by {@link #index(Collection, ProgressCallback)}.
     */
    public ImageIndex indexDirectory(Path directory, String mask, String ext, ProgressCallback progress) throws IOException {
        ProgressCallback cb = ProgressCallback.orNoop(progress);
        cb.onProgress(0, 0, "Scanning " + directory);
        return index(scan(directory, mask, ext), cb);
    }

    public ImageIndex index(Collection<Path> paths) {
        return index(paths, null);
    }

    /**
     * Indexes {@code paths} with this indexer's date source. Unparseable files are skipped.
     */
    public ImageIndex index(Collection<Path> paths, ProgressCallback progress) {
        Objects.requireNonNull(paths, "paths must not be null");
        ProgressCallback cb = ProgressCallback.orNoop(progress);

        boolean byName = dateSource == DateSource.FILENAME;
        int every = byName ? FILENAME_PROGRESS_EVERY : FILE_TIME_PROGRESS_EVERY;
        String message = byName ? "Indexing filenames" : "Reading file dates";
        int total = paths.size();

        ImageIndex.Builder builder = ImageIndex.builder();
        int i = 0;
        int skipped = 0;
        for (Path path : paths) {
            i++;
            Optional<TimestampedFile> file = byName ? parse(path) : readFileTime(path);
            if (file.isPresent()) {
                builder.add(file.get());
            } else {
                skipped++;
            }
            if (i % every == 0) {
                cb.onProgress(i, total, message);
            }
        }
        cb.onProgress(total, total, "Indexing complete");

        ImageIndex index = builder.build();
        log.debug("indexed files={} images={} days={} skipped={}", total, index.imageCount(), index.days().size(), skipped);
        return index;
    }

    /**
     * Parses the capture time out of the file's base name.
     */
    public Optional<TimestampedFile> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path name = path.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(name.toString());
        if (!m.matches()) {
            return Optional.empty();
        }

        String seconds = secondGroup != null ? m.group(secondGroup) : null;
        try {
            LocalDateTime ts = LocalDateTime.of(
                    Integer.parseInt(m.group("year")),
                    Integer.parseInt(m.group("month")),
                    Integer.parseInt(m.group("day")),
                    Integer.parseInt(m.group("hour")),
                    Integer.parseInt(m.group("minute")),
                    (seconds == null || seconds.isEmpty()) ? 0 : Integer.parseInt(seconds));
            return Optional.of(new TimestampedFile(path, ts));
        } catch (DateTimeException | NumberFormatException ex) {
            log.debug("skipping file with invalid timestamp path={} msg={}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TimestampedFile> readFileTime(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            LocalDateTime ts = LocalDateTime.ofInstant(attrs.creationTime().toInstant(), zone);
            return Optional.of(new TimestampedFile(path, ts));
        } catch (IOException ex) {
            log.debug("skipping unreadable file path={} msg={}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Re-derives a day-grouped view of already selected files from {@code full}, without touching the filesystem.
     */
    public ImageIndex subIndex(ImageIndex full, Collection<Path> subset) {
        Objects.requireNonNull(full, "full must not be null");
        return full.subIndex(subset);
    }

    private static boolean hasGroup(Pattern pattern, String name) {
        return pattern.pattern().contains("(?<" + name + ">");
    }
}
