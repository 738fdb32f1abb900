package io.lapse4j.select;

import io.lapse4j.core.FixedWindowSpec;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.SelectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Day-slice selection: at most one image per (day, target hour, target minute).
 *
 * <p>For every day and every target hour, the minutes of that hour's images are collected in path order and
 * each target minute is matched with {@link NearestValueMatcher} within the window's fuzzy tolerance. Hours without
 * images are skipped.
 */
public class FixedWindowSelector {
    private static final Logger log = LoggerFactory.getLogger(FixedWindowSelector.class);

    public SelectionResult select(ImageIndex index, FixedWindowSpec spec) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        log.debug("dayslice hours={} minutes={} fuzzy={}", spec.hours(), spec.minutes(), spec.fuzzyMinutes());

        TreeSet<Path> selected = new TreeSet<>();
        for (var day : index.asMap().entrySet()) {
            selectDay(day.getKey(), day.getValue(), spec, selected);
        }
        return SelectionResult.of(selected);
    }

    /**
     * Convenience overload; null or empty lists take the {@link FixedWindowSpec} defaults.
     */
    public SelectionResult select(ImageIndex index, Collection<Integer> hours, Collection<Integer> minutes, int fuzzyMinutes) {
        return select(index, FixedWindowSpec.of(hours, minutes, fuzzyMinutes));
    }

    private void selectDay(String day, SortedMap<Path, LocalDateTime> files, FixedWindowSpec spec, Collection<Path> out) {
        for (int targetHour : spec.hours()) {
            List<Integer> hourMinutes = new ArrayList<>();
            List<Path> hourFiles = new ArrayList<>();

            files.forEach((path, ts) -> {
                if (ts.getHour() == targetHour) {
                    hourMinutes.add(ts.getMinute());
                    hourFiles.add(path);
                }
            });

            if (hourMinutes.isEmpty()) {
                continue;
            }

            for (int targetMinute : spec.minutes()) {
                NearestValueMatcher.nearest(hourMinutes, targetMinute, spec.fuzzyMinutes()).ifPresent(match -> {
                    Path file = hourFiles.get(match.index());
                    log.debug("day={} hour={} minute {} is close enough to {} file={}",
                            day, targetHour, match.value(), targetMinute, file);
                    out.add(file);
                });
            }
        }
    }
}
