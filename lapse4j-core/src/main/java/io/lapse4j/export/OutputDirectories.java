package io.lapse4j.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prepares export target directories.
 */
public final class OutputDirectories {
    private static final Logger log = LoggerFactory.getLogger(OutputDirectories.class);

    public static final int DEFAULT_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private OutputDirectories() {
    }

    /**
     * Creates {@code dir}, or clears its {@code *.ext} files if it already exists.
     */
    public static void prepare(Path dir, String ext) throws IOException {
        Objects.requireNonNull(dir, "dir must not be null");
        if (Files.isDirectory(dir)) {
            log.info("Clearing out files from {}", dir);
            clearTarget(dir, "*." + ext, DEFAULT_RETRIES, DEFAULT_RETRY_DELAY);
        } else {
            log.info("Creating {}", dir);
            Files.createDirectories(dir);
        }
    }

    /**
     * Deletes files in {@code dir} matching the glob {@code mask}.
     *
     * <p>Files another process holds open (typical on Windows) fail with a {@link FileSystemException}; those are
     * retried up to {@code retries} times, {@code delay} apart.
     *
     * @throws IOException if some files are still locked after the last retry
     */
    public static void clearTarget(Path dir, String mask, int retries, Duration delay) throws IOException {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative: " + retries);
        }
        List<Path> remaining = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, mask)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    remaining.add(entry);
                }
            }
        }
        if (remaining.isEmpty()) {
            return;
        }
        int targets = remaining.size();

        for (int attempt = 0; attempt <= retries; attempt++) {
            List<Path> locked = new ArrayList<>();
            for (Path file : remaining) {
                try {
                    Files.deleteIfExists(file);
                } catch (FileSystemException e) {
                    locked.add(file);
                }
            }
            if (locked.isEmpty()) {
                if (attempt > 0) {
                    log.info("Cleared {} files from {} (after {} retries)", targets, dir, attempt);
                }
                return;
            }
            remaining = locked;
            if (attempt < retries) {
                log.warn("clearTarget: {} file(s) locked in {}, retrying in {} ({}/{})",
                        remaining.size(), dir, delay, attempt + 1, retries);
                sleep(delay);
            }
        }

        throw new IOException("Could not delete " + remaining.size() + " file(s) in " + dir + " after "
                + retries + " retries. First locked file: " + remaining.get(0));
    }

    private static void sleep(Duration delay) throws InterruptedIOException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for locked files");
        }
    }
}
