package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Picks the first configured window matching the current local time, falling back to the default window.
 */
public class WindowScheduler {

    private static final Logger logger = LoggerFactory.getLogger(WindowScheduler.class);

    private final List<ScheduleWindow> windows;
    private final ScheduleWindow defaultWindow;
    private final ZoneId zone;
    private final Clock clock;
    private final AtomicReference<ScheduleWindow> lastWindow = new AtomicReference<>();

    public WindowScheduler(List<ScheduleWindow> windows, ScheduleWindow defaultWindow, ZoneId zone, Clock clock) {
        this.windows = windows == null ? List.of() : List.copyOf(windows);
        this.defaultWindow = Objects.requireNonNull(defaultWindow, "defaultWindow");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScheduleWindow activeWindow(LocalDateTime now) {
        for (ScheduleWindow window : windows) {
            if (window.matches(now)) {
                return window;
            }
        }
        return defaultWindow;
    }

    public ScheduleWindow activeWindow() {
        return activeWindow(now());
    }

    /**
     * Records the window active right now as the baseline for {@link #checkChange()} and returns it.
     */
    public ScheduleWindow selectInitial() {
        ScheduleWindow window = activeWindow();
        lastWindow.set(window);
        logger.info("Starting in schedule window {} ({})", window.name(), window.folder());
        return window;
    }

    /**
     * @return the newly active window when it differs from the one seen by the previous call
     */
    public Optional<ScheduleWindow> checkChange(LocalDateTime now) {
        ScheduleWindow window = activeWindow(now);
        ScheduleWindow previous = lastWindow.getAndSet(window);
        if (window.equals(previous)) {
            return Optional.empty();
        }
        logger.info(
                "Schedule window changed from {} to {}",
                previous == null ? "none" : previous.name(),
                window.name());
        return Optional.of(window);
    }

    public Optional<ScheduleWindow> checkChange() {
        return checkChange(now());
    }

    public ZoneId zone() {
        return zone;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock.withZone(zone));
    }
}
