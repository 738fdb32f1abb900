package io.lapse4j.select;

import io.lapse4j.FireTimeEvaluator;
import io.lapse4j.core.CronSchedule;
import io.lapse4j.core.ImageIndex;
import io.lapse4j.core.SelectionResult;
import io.lapse4j.core.TimestampedFile;
import io.lapse4j.internal.QuartzFireTimeEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Picks, for every fire time of a cron schedule, the image whose timestamp is nearest to it.
 *
 * <p>Days on which the schedule does not fire are skipped entirely. Each fire time matches at most one image,
 * the one with the smallest absolute time difference within {@code fuzzyMinutes}; on exact ties the earlier
 * image in (timestamp, path) order wins.
 */
public class CronFireTimeSelector {
    private static final Logger log = LoggerFactory.getLogger(CronFireTimeSelector.class);

    public static final int DEFAULT_FUZZY_MINUTES = 5;

    public SelectionResult select(ImageIndex index, CronSchedule schedule, int fuzzyMinutes) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        return select(index, QuartzFireTimeEvaluator.of(schedule), fuzzyMinutes);
    }

    public SelectionResult select(ImageIndex index, FireTimeEvaluator evaluator, int fuzzyMinutes) {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(evaluator, "evaluator must not be null");
        if (fuzzyMinutes < 0) {
            throw new IllegalArgumentException("fuzzyMinutes must be non-negative: " + fuzzyMinutes);
        }
        Duration tolerance = Duration.ofMinutes(fuzzyMinutes);

        TreeSet<Path> selected = new TreeSet<>();
        for (String day : index.days()) {
            LocalDate date = LocalDate.parse(day);
            if (!firesOn(evaluator, date)) {
                log.debug("schedule inactive on day={}", day);
                continue;
            }

            List<TimestampedFile> timeline = index.timelineOf(day);
            int matched = 0;
            for (ZonedDateTime fire : fireTimes(evaluator, date)) {
                TimestampedFile nearest = nearestWithin(timeline, fire.toLocalDateTime(), tolerance);
                if (nearest != null && selected.add(nearest.path())) {
                    matched++;
                }
            }
            log.debug("day={} images={} selected={}", day, timeline.size(), matched);
        }
        return SelectionResult.of(selected);
    }

    /**
     * True if the first fire time at or after the start of {@code date} still falls on {@code date}.
     */
    public static boolean firesOn(FireTimeEvaluator evaluator, LocalDate date) {
        ZonedDateTime first = evaluator.nextFireTime(date.atStartOfDay(evaluator.zone()));
        return first != null && first.toLocalDate().equals(date);
    }

    /**
     * Every fire time of the schedule on {@code date}, in order. Empty if the schedule does not fire that day.
     */
    public static List<ZonedDateTime> fireTimes(FireTimeEvaluator evaluator, LocalDate date) {
        Objects.requireNonNull(evaluator, "evaluator must not be null");
        Objects.requireNonNull(date, "date must not be null");

        List<ZonedDateTime> times = new ArrayList<>();
        ZonedDateTime next = evaluator.nextFireTime(date.atStartOfDay(evaluator.zone()));
        while (next != null && next.toLocalDate().equals(date)) {
            times.add(next);
            ZonedDateTime following = evaluator.nextFireTime(next.plusNanos(1_000_000));
            if (following != null && !following.isAfter(next)) {
                throw new IllegalStateException("Fire time evaluator did not advance past " + next);
            }
            next = following;
        }
        return times;
    }

    /**
     * Nearest entry of a (timestamp, path)-ordered timeline, or null if none lies within the tolerance.
     */
    static TimestampedFile nearestWithin(List<TimestampedFile> timeline, LocalDateTime target, Duration tolerance) {
        if (timeline.isEmpty()) {
            return null;
        }

        // first entry at or after target
        int lo = 0;
        int hi = timeline.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (timeline.get(mid).timestamp().isBefore(target)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }

        TimestampedFile after = lo < timeline.size() ? timeline.get(lo) : null;
        TimestampedFile before = null;
        if (lo > 0) {
            int b = lo - 1;
            LocalDateTime ts = timeline.get(b).timestamp();
            while (b > 0 && timeline.get(b - 1).timestamp().equals(ts)) {
                b--;
            }
            before = timeline.get(b);
        }

        TimestampedFile best;
        if (before == null) {
            best = after;
        } else if (after == null) {
            best = before;
        } else {
            best = distance(before, target).compareTo(distance(after, target)) <= 0 ? before : after;
        }
        return distance(best, target).compareTo(tolerance) <= 0 ? best : null;
    }

    private static Duration distance(TimestampedFile file, LocalDateTime target) {
        return Duration.between(target, file.timestamp()).abs();
    }
}
