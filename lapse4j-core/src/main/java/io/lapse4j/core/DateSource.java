package io.lapse4j.core;

/**
 * Where an image's capture time comes from. The two modes are exclusive per index build.
 */
public enum DateSource {
    /**
     * Parse the timestamp out of the file name.
     */
    FILENAME,
    /**
     * Use the file's creation time (falls back to modification time where the filesystem has none).
     */
    FILE_TIME
}
