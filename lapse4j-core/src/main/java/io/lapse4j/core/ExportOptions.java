package io.lapse4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Writer options for an export run. Unknown options are rejected when read from JSON.
 *
 * @param prefix          output file name prefix; blank means "name of the output directory"
 * @param zeroPadding     digits of the sequence number in output names
 * @param extension       output file extension, without dot
 * @param quality         encoder quality 1-100, for transforms that re-encode
 * @param resize          whether re-encoding transforms scale to {@code width x height}
 * @param drawTimestamp   whether re-encoding transforms draw the capture time on the image
 * @param timestampFormat {@link java.time.format.DateTimeFormatter} pattern of the drawn timestamp
 */
public record ExportOptions(
        String prefix,
        @JsonProperty("zeropadding") Integer zeroPadding,
        @JsonProperty("ext") String extension,
        Integer quality,
        Boolean resize,
        Integer width,
        Integer height,
        @JsonProperty("drawtimestamp") Boolean drawTimestamp,
        @JsonProperty("timestampformat") String timestampFormat
) {

    public static final int DEFAULT_ZERO_PADDING = 5;
    public static final String DEFAULT_EXTENSION = "jpg";
    public static final String DEFAULT_TIMESTAMP_FORMAT = "yyyy-MM-dd hh:mm:ss a";

    public ExportOptions {
        prefix = prefix == null ? "" : prefix;
        zeroPadding = zeroPadding == null ? DEFAULT_ZERO_PADDING : zeroPadding;
        extension = (extension == null || extension.isBlank()) ? DEFAULT_EXTENSION : stripDot(extension);
        quality = quality == null ? 50 : quality;
        resize = resize == null ? Boolean.TRUE : resize;
        width = width == null ? 1920 : width;
        height = height == null ? 1080 : height;
        drawTimestamp = drawTimestamp == null ? Boolean.FALSE : drawTimestamp;
        timestampFormat = (timestampFormat == null || timestampFormat.isBlank()) ? DEFAULT_TIMESTAMP_FORMAT : timestampFormat;

        if (zeroPadding < 1) {
            throw new IllegalArgumentException("zeroPadding must be positive: " + zeroPadding);
        }
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be within 1-100: " + quality);
        }
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("resolution must be positive: " + width + "x" + height);
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(null, null, null, null, null, null, null, null, null);
    }

    public ExportOptions withPrefix(String prefix) {
        return new ExportOptions(prefix, zeroPadding, extension, quality, resize, width, height, drawTimestamp, timestampFormat);
    }

    public ExportOptions withZeroPadding(int zeroPadding) {
        return new ExportOptions(prefix, zeroPadding, extension, quality, resize, width, height, drawTimestamp, timestampFormat);
    }

    public ExportOptions withExtension(String extension) {
        return new ExportOptions(prefix, zeroPadding, extension, quality, resize, width, height, drawTimestamp, timestampFormat);
    }

    public boolean hasPrefix() {
        return !prefix.isBlank();
    }

    private static String stripDot(String ext) {
        String e = ext.trim();
        return e.startsWith(".") ? e.substring(1) : e;
    }
}
