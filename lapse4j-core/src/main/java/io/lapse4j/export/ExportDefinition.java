package io.lapse4j.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.select.CronFireTimeSelector;

/**
 * Declarative form of a {@link ScheduledExport}, as read from a definitions file.
 */
public record ExportDefinition(
        String name,
        String subdir,
        String prefix,
        @JsonProperty("desc") String description,
        CronSchedule schedule,
        @JsonProperty("fuzzy_minutes") Integer fuzzyMinutes
) {

    public ScheduledExport toExport() {
        if (schedule == null) {
            throw new IllegalArgumentException("export '" + name + "' has no schedule");
        }
        int fuzzy = fuzzyMinutes == null ? CronFireTimeSelector.DEFAULT_FUZZY_MINUTES : fuzzyMinutes;
        return new ScheduledExport(name, subdir, prefix, description, schedule, fuzzy);
    }
}
