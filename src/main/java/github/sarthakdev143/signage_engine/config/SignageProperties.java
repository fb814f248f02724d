package github.sarthakdev143.signage_engine.config;

import github.sarthakdev143.signage_engine.model.MediaExtensions;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Immutable engine configuration, bound once at startup from {@code signage.*} properties and handed to
 * each component through its constructor.
 */
@ConfigurationProperties(prefix = "signage")
public record SignageProperties(
        @DefaultValue("content") Path contentDir,
        @DefaultValue("waiting_for_content_scene") String placeholderScene,
        @DefaultValue Media media,
        @DefaultValue Canvas canvas,
        @DefaultValue Rotation rotation,
        @DefaultValue Probe probe,
        @DefaultValue Schedule schedule,
        @DefaultValue Sync sync) {

    private static final DateTimeFormatter WINDOW_TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public SignageProperties {
        if (placeholderScene == null || placeholderScene.isBlank()) {
            throw new IllegalArgumentException("signage.placeholder-scene must not be blank.");
        }
    }

    public record Media(
            @DefaultValue({".mp4", ".mov", ".avi", ".mkv", ".wmv", ".webm", ".m4v"}) Set<String> videoExtensions,
            @DefaultValue({".jpg", ".jpeg", ".png", ".bmp", ".gif", ".tiff", ".webp"}) Set<String> imageExtensions,
            @DefaultValue({".mp3", ".wav", ".ogg", ".flac", ".m4a"}) Set<String> audioExtensions,
            @DefaultValue("8") double slideDurationSeconds,
            @DefaultValue("900") double maxVideoDurationSeconds,
            @DefaultValue("10") double fallbackVideoDurationSeconds) {

        public Media {
            requirePositive(slideDurationSeconds, "signage.media.slide-duration-seconds");
            requirePositive(maxVideoDurationSeconds, "signage.media.max-video-duration-seconds");
            requirePositive(fallbackVideoDurationSeconds, "signage.media.fallback-video-duration-seconds");
        }

        public MediaExtensions extensions() {
            return new MediaExtensions(videoExtensions, imageExtensions, audioExtensions);
        }
    }

    public record Canvas(
            @DefaultValue("1920") int width,
            @DefaultValue("1080") int height) {

        public Canvas {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("signage.canvas width and height must be positive.");
            }
        }
    }

    public record Rotation(
            @DefaultValue("500ms") Duration tickInterval,
            @DefaultValue("2.0") double transitionOffsetSeconds,
            @DefaultValue("2s") Duration rescanDebounce,
            @DefaultValue("256") int changeQueueCapacity) {

        public Rotation {
            if (transitionOffsetSeconds < 0.0) {
                throw new IllegalArgumentException("signage.rotation.transition-offset-seconds must be >= 0.");
            }
            if (changeQueueCapacity <= 0) {
                throw new IllegalArgumentException("signage.rotation.change-queue-capacity must be positive.");
            }
        }
    }

    public record Probe(
            @DefaultValue("ffprobe") String ffprobePath,
            @DefaultValue("5s") Duration timeout) {
    }

    public record Schedule(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("60s") Duration checkInterval,
            @DefaultValue("") String timezone,
            @DefaultValue Window defaultWindow,
            List<Window> windows) {

        public Schedule {
            windows = windows == null ? List.of() : List.copyOf(windows);
        }
    }

    /**
     * Raw window definition. Times use {@code HH:mm}; the day runs from 0 (Monday) to 6 (Sunday).
     */
    public record Window(
            @DefaultValue("Default") String name,
            Path folder,
            @DefaultValue("Fade") String transition,
            Double transitionOffsetSeconds,
            Integer day,
            String start,
            String end) {
    }

    public record Sync(
            Path sourceDir,
            Path targetDir,
            @DefaultValue("30s") Duration interval) {
    }

    public MediaExtensions extensions() {
        return media.extensions();
    }

    public Path contentRoot() {
        return contentDir.toAbsolutePath().normalize();
    }

    public Path syncTargetRoot() {
        Path target = sync.targetDir() == null ? contentDir : sync.targetDir();
        return target.toAbsolutePath().normalize();
    }

    public ScheduleWindow defaultWindow() {
        Window window = schedule.defaultWindow();
        return toScheduleWindow(window, true);
    }

    /**
     * Restricted windows in priority order. Empty when scheduling is disabled.
     */
    public List<ScheduleWindow> scheduledWindows() {
        if (!schedule.enabled()) {
            return List.of();
        }
        List<ScheduleWindow> windows = new ArrayList<>();
        for (Window window : schedule.windows()) {
            windows.add(toScheduleWindow(window, false));
        }
        return List.copyOf(windows);
    }

    public ZoneId zone() {
        String configured = schedule.timezone();
        if (configured == null || configured.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(configured.trim());
    }

    private ScheduleWindow toScheduleWindow(Window window, boolean isDefault) {
        Window source = window == null
                ? new Window("Default", null, "Fade", null, null, null, null)
                : window;
        Path folder = source.folder() == null ? contentDir : source.folder();
        double offset = source.transitionOffsetSeconds() == null
                ? rotation.transitionOffsetSeconds()
                : source.transitionOffsetSeconds();

        if (isDefault) {
            return ScheduleWindow.unrestricted(
                    source.name(),
                    folder.toAbsolutePath().normalize(),
                    source.transition(),
                    offset);
        }

        return new ScheduleWindow(
                source.name(),
                folder.toAbsolutePath().normalize(),
                source.transition(),
                offset,
                source.day(),
                parseTime(source.start(), source.name()),
                parseTime(source.end(), source.name()));
    }

    private static LocalTime parseTime(String value, String windowName) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), WINDOW_TIME_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(
                    "Schedule window " + windowName + " has an invalid time '" + value + "'. Use HH:mm.", ex);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(name + " must be a positive number.");
        }
    }
}
