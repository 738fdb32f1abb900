package io.lapse4j.export;

import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.TimestampedFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies the source image unchanged to its sequence name.
 */
public class CopyingImageWriter implements ImageWriter {

    @Override
    public Path write(TimestampedFile source, Path target, ExportOptions options) throws IOException {
        return Files.copy(source.path(), target, StandardCopyOption.REPLACE_EXISTING);
    }
}
