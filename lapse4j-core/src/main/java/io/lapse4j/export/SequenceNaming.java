package io.lapse4j.export;

import io.lapse4j.core.ExportOptions;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Output names of an exported sequence: {@code <prefix> <n>.<ext>} with {@code n = index + 1} zero-padded.
 */
public record SequenceNaming(String prefix, int zeroPadding, String extension) {

    public SequenceNaming {
        Objects.requireNonNull(prefix, "prefix must not be null");
        Objects.requireNonNull(extension, "extension must not be null");
        if (zeroPadding < 1) {
            throw new IllegalArgumentException("zeroPadding must be positive: " + zeroPadding);
        }
    }

    /**
     * Naming for {@code outputDir}; a blank prefix falls back to the directory's name.
     */
    public static SequenceNaming of(String prefix, ExportOptions options, Path outputDir) {
        String p = prefix;
        if (p == null || p.isBlank()) {
            p = options.hasPrefix() ? options.prefix() : String.valueOf(outputDir.getFileName());
        }
        return new SequenceNaming(p, options.zeroPadding(), options.extension());
    }

    public String fileName(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        String seq = String.valueOf(index + 1);
        StringBuilder sb = new StringBuilder(prefix).append(' ');
        for (int i = seq.length(); i < zeroPadding; i++) {
            sb.append('0');
        }
        return sb.append(seq).append('.').append(extension).toString();
    }
}
