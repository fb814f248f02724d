package github.sarthakdev143.signage_engine.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A named folder/transition pair competing for the active slot. Days are numbered from Monday (0) to
 * Sunday (6). Time bounds are a half-open {@code [start, end)} range and may wrap past midnight.
 */
public record ScheduleWindow(
        String name,
        Path folder,
        String transition,
        double transitionOffsetSeconds,
        Integer dayOfWeek,
        LocalTime start,
        LocalTime end) {

    public ScheduleWindow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schedule window name is required.");
        }
        Objects.requireNonNull(folder, "folder");
        if (transition == null || transition.isBlank()) {
            throw new IllegalArgumentException("Schedule window " + name + " requires a transition.");
        }
        if (!Double.isFinite(transitionOffsetSeconds) || transitionOffsetSeconds < 0.0) {
            throw new IllegalArgumentException("Schedule window " + name + " transition offset must be >= 0.");
        }
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new IllegalArgumentException("Schedule window " + name + " day must be between 0 (Monday) and 6 (Sunday).");
        }
        if ((start == null) != (end == null)) {
            throw new IllegalArgumentException("Schedule window " + name + " needs both a start and an end time, or neither.");
        }
    }

    public static ScheduleWindow unrestricted(String name, Path folder, String transition, double transitionOffsetSeconds) {
        return new ScheduleWindow(name, folder, transition, transitionOffsetSeconds, null, null, null);
    }

    public boolean matches(LocalDateTime now) {
        if (dayOfWeek != null && now.getDayOfWeek().getValue() - 1 != dayOfWeek) {
            return false;
        }
        if (start == null) {
            return true;
        }

        LocalTime time = now.toLocalTime();
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
