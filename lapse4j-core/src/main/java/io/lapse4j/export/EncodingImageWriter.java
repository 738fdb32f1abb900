package io.lapse4j.export;

import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.TimestampedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes the source image and re-encodes it in the format named by the output extension.
 *
 * <p>Honors the image settings of {@link ExportOptions}:
 * <ul>
 *   <li>{@code resize}: scale down to fit within {@code width x height}, keeping the aspect ratio. Smaller
 *   images are never enlarged.</li>
 *   <li>{@code drawTimestamp}: the capture time, formatted with {@code timestampFormat}, in the top left corner.</li>
 *   <li>{@code quality}: JPEG compression quality, 1-100. Ignored by lossless formats.</li>
 * </ul>
 */
public class EncodingImageWriter implements ImageWriter {
    private static final Logger log = LoggerFactory.getLogger(EncodingImageWriter.class);

    static final int TIMESTAMP_FONT_SIZE = 36;

    @Override
    public Path write(TimestampedFile source, Path target, ExportOptions options) throws IOException {
        BufferedImage image = ImageIO.read(source.path().toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + source.path());
        }

        String format = formatName(options.extension());
        boolean opaque = "jpeg".equals(format) || "bmp".equals(format);
        BufferedImage out = render(image, options, opaque);
        if (options.drawTimestamp()) {
            drawTimestamp(out, timestampText(source, options));
        }

        Files.deleteIfExists(target);
        if ("jpeg".equals(format)) {
            writeJpeg(out, target, options.quality());
        } else if (!ImageIO.write(out, format, target.toFile())) {
            throw new IOException("No image writer for extension: " + options.extension());
        }
        log.debug("encoded source={} target={} size={}x{}", source.path(), target, out.getWidth(), out.getHeight());
        return target;
    }

    /**
     * Size of {@code width x height} after fitting it within {@code maxWidth x maxHeight}.
     */
    static int[] fitWithin(int width, int height, int maxWidth, int maxHeight) {
        if (width <= maxWidth && height <= maxHeight) {
            return new int[]{width, height};
        }
        double scale = Math.min((double) maxWidth / width, (double) maxHeight / height);
        return new int[]{
                Math.max(1, (int) Math.round(width * scale)),
                Math.max(1, (int) Math.round(height * scale))
        };
    }

    static String timestampText(TimestampedFile source, ExportOptions options) {
        return DateTimeFormatter.ofPattern(options.timestampFormat(), Locale.ENGLISH).format(source.timestamp());
    }

    private static BufferedImage render(BufferedImage image, ExportOptions options, boolean opaque) {
        int[] size = options.resize()
                ? fitWithin(image.getWidth(), image.getHeight(), options.width(), options.height())
                : new int[]{image.getWidth(), image.getHeight()};

        BufferedImage target = new BufferedImage(size[0], size[1],
                opaque ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, size[0], size[1], null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private static void drawTimestamp(BufferedImage image, String text) {
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, TIMESTAMP_FONT_SIZE));
            g.setColor(Color.WHITE);
            g.drawString(text, 0, g.getFontMetrics().getAscent());
        } finally {
            g.dispose();
        }
    }

    private static void writeJpeg(BufferedImage image, Path target, int quality) throws IOException {
        Iterator<javax.imageio.ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        javax.imageio.ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality / 100f);

        try (ImageOutputStream stream = ImageIO.createImageOutputStream(target.toFile())) {
            writer.setOutput(stream);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    private static String formatName(String extension) {
        String ext = extension.toLowerCase(Locale.ROOT);
        switch (ext) {
            case "jpg":
            case "jpeg":
                return "jpeg";
            case "tif":
                return "tiff";
            default:
                return ext;
        }
    }
}
