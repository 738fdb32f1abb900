package io.lapse4j.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageIndexTest {

    private static final LocalDateTime MAY_1_NOON = LocalDateTime.of(2024, 5, 1, 12, 0);

    private final ImageIndex index = ImageIndex.builder()
            .add(Path.of("b.jpg"), MAY_1_NOON)
            .add(Path.of("a.jpg"), MAY_1_NOON)
            .add(Path.of("c.jpg"), MAY_1_NOON.minusHours(1))
            .add(Path.of("d.jpg"), MAY_1_NOON.plusDays(1))
            .build();

    @Test
    void imagesShouldBeGroupedBySortedDay() {
        assertEquals(List.of("2024-05-01", "2024-05-02"), index.days());
        assertEquals(4, index.imageCount());
        assertEquals(3, index.filesOn("2024-05-01").size());
        assertEquals(index.filesOn("2024-05-02"), index.filesOn(1));
    }

    @Test
    void unknownDayShouldListKnownDays() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> index.filesOn("2024-06-01"));
        assertTrue(ex.getMessage().contains("2024-05-02"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.filesOn(2));
    }

    @Test
    void timelineShouldOrderByTimestampThenPath() {
        List<Path> order = index.timeline().stream().map(TimestampedFile::path).toList();
        assertEquals(List.of(Path.of("c.jpg"), Path.of("a.jpg"), Path.of("b.jpg"), Path.of("d.jpg")), order);
    }

    @Test
    void subIndexShouldKeepGroupingAndIgnoreUnknownPaths() {
        ImageIndex sub = index.subIndex(List.of(Path.of("./d.jpg"), Path.of("a.jpg"), Path.of("zzz.jpg")));

        assertEquals(List.of("2024-05-01", "2024-05-02"), sub.days());
        assertEquals(2, sub.imageCount());
        assertEquals(MAY_1_NOON.plusDays(1), sub.timestampOf(Path.of("d.jpg")));
        assertNull(sub.timestampOf(Path.of("b.jpg")));
    }

    @Test
    void addingAPathAgainShouldMoveItToItsNewDay() {
        ImageIndex moved = ImageIndex.builder()
                .add(Path.of("x.jpg"), MAY_1_NOON)
                .add(Path.of("x.jpg"), MAY_1_NOON.plusDays(3))
                .build();

        assertEquals(List.of("2024-05-04"), moved.days());
        assertEquals(1, moved.imageCount());
    }

    @Test
    void indexesWithSameContentShouldBeEqual() {
        assertEquals(index, index.subIndex(List.of(Path.of("a.jpg"), Path.of("b.jpg"), Path.of("c.jpg"), Path.of("d.jpg"))));
        assertTrue(ImageIndex.empty().isEmpty());
    }
}
