package io.lapse4j.export;

import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.FixedWindowSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleDefinitionsTest {

    private final ScheduleDefinitions definitions = new ScheduleDefinitions();

    @Test
    void scheduleShouldBeReadFromCronFields() {
        CronSchedule schedule = definitions.readSchedule(
                "{\"day_of_week\": \"0-4\", \"hour\": \"8\", \"timezone\": \"UTC\"}");

        assertEquals("0 0 8 ? * MON-FRI", schedule.toQuartzExpression());
    }

    @Test
    void fixedWindowShouldApplyDefaults() {
        FixedWindowSpec spec = definitions.readFixedWindow("{\"hourlist\": [7, 19]}");

        assertEquals(Set.of(7, 19), spec.hours());
        assertEquals(Set.of(0), spec.minutes());
        assertEquals(FixedWindowSpec.DEFAULT_FUZZY_MINUTES, spec.fuzzyMinutes());
    }

    @Test
    void exportOptionsShouldUseWriterNames() {
        ExportOptions options = definitions.readExportOptions(
                "{\"prefix\": \"cam\", \"zeropadding\": 4, \"ext\": \"png\", \"drawtimestamp\": true}");

        assertEquals("cam", options.prefix());
        assertEquals(4, options.zeroPadding());
        assertEquals("png", options.extension());
        assertTrue(options.drawTimestamp());
        assertEquals(50, options.quality());
    }

    @Test
    void unknownFieldsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> definitions.readSchedule("{\"hours\": \"8\"}"));
        assertThrows(IllegalArgumentException.class, () -> definitions.readExportOptions("{\"colour\": \"red\"}"));
    }

    @Test
    void invalidValuesShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> definitions.readFixedWindow("{\"hourlist\": [24]}"));
        assertThrows(IllegalArgumentException.class, () -> definitions.readExportOptions("{\"quality\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> definitions.readSchedule("not json"));
    }

    @Test
    void exportsShouldBeLoadedFromFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("exports.json"), "["
                + "{\"name\": \"daily\", \"subdir\": \"daily\", \"desc\": \"noon every day\","
                + " \"schedule\": {\"hour\": \"12\"}},"
                + "{\"name\": \"weekly\", \"prefix\": \"week\", \"fuzzy_minutes\": 10,"
                + " \"schedule\": {\"day_of_week\": \"6\", \"hour\": \"12\"}}"
                + "]");

        List<ScheduledExport> exports = definitions.loadExports(file);

        assertEquals(2, exports.size());
        assertEquals("noon every day", exports.get(0).description());
        assertEquals("weekly", exports.get(1).subdir());
        assertEquals(10, exports.get(1).fuzzyMinutes());
        assertFalse(exports.get(1).prefix().isEmpty());
    }

    @Test
    void exportWithoutScheduleShouldBeRejected() {
        List<ExportDefinition> parsed = definitions.readExports("[{\"name\": \"empty\"}]");
        assertThrows(IllegalArgumentException.class, () -> parsed.get(0).toExport());
    }
}
