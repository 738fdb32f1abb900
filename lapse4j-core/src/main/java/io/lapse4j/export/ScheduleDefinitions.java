package io.lapse4j.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ExportOptions;
import io.lapse4j.core.FixedWindowSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads schedules, fixed windows, writer options and export lists from JSON.
 *
 * <p>Unknown fields are rejected. Malformed or invalid definitions surface as {@link IllegalArgumentException}.
 */
public class ScheduleDefinitions {

    private static final TypeReference<List<ExportDefinition>> EXPORT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ScheduleDefinitions() {
        this(new ObjectMapper());
    }

    public ScheduleDefinitions(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public CronSchedule readSchedule(String json) {
        return read(json, CronSchedule.class);
    }

    public FixedWindowSpec readFixedWindow(String json) {
        return read(json, FixedWindowSpec.class);
    }

    public ExportOptions readExportOptions(String json) {
        return read(json, ExportOptions.class);
    }

    public List<ExportDefinition> readExports(String json) {
        try {
            List<ExportDefinition> definitions = objectMapper.readValue(json, EXPORT_LIST);
            return definitions == null ? List.of() : definitions;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid export definitions: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a JSON array of export definitions and builds the exports.
     */
    public List<ScheduledExport> loadExports(Path file) throws IOException {
        List<ScheduledExport> exports = new ArrayList<>();
        for (ExportDefinition definition : readExports(Files.readString(file))) {
            exports.add(definition.toExport());
        }
        return exports;
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid " + type.getSimpleName() + " definition: "
                    + e.getOriginalMessage(), e);
        }
    }
}
