package io.lapse4j.export;

import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.TimestampedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncodingImageWriterTest {

    @TempDir
    Path dir;

    private final EncodingImageWriter writer = new EncodingImageWriter();

    @Test
    void resizeShouldFitWithinResolutionKeepingAspect() throws IOException {
        TimestampedFile source = image("wide.png", 400, 300);
        ExportOptions options = new ExportOptions(null, null, "png", null, true, 200, 200, null, null);

        Path written = writer.write(source, dir.resolve("out 00001.png"), options);

        BufferedImage out = ImageIO.read(written.toFile());
        assertEquals(200, out.getWidth());
        assertEquals(150, out.getHeight());
    }

    @Test
    void smallImagesShouldNotBeEnlarged() throws IOException {
        TimestampedFile source = image("small.png", 100, 50);
        ExportOptions resized = new ExportOptions(null, null, "png", null, true, 1920, 1080, null, null);
        ExportOptions untouched = new ExportOptions(null, null, "png", null, false, 10, 10, null, null);

        BufferedImage a = ImageIO.read(writer.write(source, dir.resolve("a.png"), resized).toFile());
        BufferedImage b = ImageIO.read(writer.write(source, dir.resolve("b.png"), untouched).toFile());

        assertEquals(100, a.getWidth());
        assertEquals(50, a.getHeight());
        assertEquals(100, b.getWidth());
        assertEquals(50, b.getHeight());
    }

    @Test
    void lowerQualityShouldProduceSmallerJpeg() throws IOException {
        TimestampedFile source = image("noise.png", 256, 256);
        ExportOptions low = new ExportOptions(null, null, "jpg", 10, false, null, null, null, null);
        ExportOptions high = new ExportOptions(null, null, "jpg", 95, false, null, null, null, null);

        Path lowFile = writer.write(source, dir.resolve("low.jpg"), low);
        Path highFile = writer.write(source, dir.resolve("high.jpg"), high);

        assertNotNull(ImageIO.read(lowFile.toFile()));
        assertTrue(Files.size(lowFile) < Files.size(highFile));
    }

    @Test
    void existingTargetShouldBeReplaced() throws IOException {
        TimestampedFile source = image("frame.png", 40, 30);
        Path target = Files.writeString(dir.resolve("seq 00001.jpg"), "stale");

        writer.write(source, target, ExportOptions.defaults());

        assertEquals(40, ImageIO.read(target.toFile()).getWidth());
    }

    @Test
    void unreadableSourceShouldFail() throws IOException {
        Path text = Files.writeString(dir.resolve("notes.jpg"), "not an image");
        TimestampedFile source = new TimestampedFile(text, LocalDateTime.of(2024, 5, 1, 12, 0));

        assertThrows(IOException.class, () -> writer.write(source, dir.resolve("out.jpg"), ExportOptions.defaults()));
    }

    @Test
    void timestampTextShouldUseConfiguredFormat() {
        TimestampedFile file = new TimestampedFile(Path.of("a.jpg"), LocalDateTime.of(2024, 5, 1, 13, 30, 5));

        assertEquals("2024-05-01 01:30:05 PM", EncodingImageWriter.timestampText(file, ExportOptions.defaults()));
        assertEquals("01.05.2024 13:30", EncodingImageWriter.timestampText(file,
                new ExportOptions(null, null, null, null, null, null, null, true, "dd.MM.yyyy HH:mm")));
    }

    @Test
    void fitWithinShouldScaleByTheTighterBound() {
        assertArrayEquals(new int[]{1440, 1080}, EncodingImageWriter.fitWithin(4000, 3000, 1920, 1080));
        assertArrayEquals(new int[]{1920, 1080}, EncodingImageWriter.fitWithin(3840, 2160, 1920, 1080));
        assertArrayEquals(new int[]{640, 480}, EncodingImageWriter.fitWithin(640, 480, 1920, 1080));
    }

    private TimestampedFile image(String name, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(42);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0xFFFFFF));
            }
        }
        Path path = dir.resolve(name);
        ImageIO.write(image, "png", path.toFile());
        return new TimestampedFile(path, LocalDateTime.of(2024, 5, 1, 12, 0));
    }
}
