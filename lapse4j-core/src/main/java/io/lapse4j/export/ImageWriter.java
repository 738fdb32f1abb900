package io.lapse4j.export;

import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.TimestampedFile;

import java.nio.file.Path;

/**
 * Writes one selected image to its sequence file. Resizing, overlays and re-encoding live in implementations.
 */
@FunctionalInterface
public interface ImageWriter {

    /**
     * @return the file actually written
     */
    Path write(TimestampedFile source, Path target, ExportOptions options) throws Exception;
}
