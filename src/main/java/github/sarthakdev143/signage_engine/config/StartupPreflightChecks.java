package github.sarthakdev143.signage_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(name = "signage.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final int FFPROBE_CHECK_TIMEOUT_SECONDS = 10;

    private final SignageProperties properties;

    public StartupPreflightChecks(SignageProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkContentFolders();
        checkFfprobeConfiguration();
    }

    private void checkContentFolders() {
        Set<Path> folders = new LinkedHashSet<>();
        folders.add(properties.contentRoot());
        folders.add(properties.defaultWindow().folder());
        properties.scheduledWindows().forEach(window -> folders.add(window.folder()));

        for (Path folder : folders) {
            try {
                Files.createDirectories(folder);
            } catch (IOException e) {
                throw new IllegalStateException(
                        "Content folder " + folder + " does not exist and could not be created. "
                                + "Check signage.content-dir and the schedule window folders.",
                        e);
            }
            if (!Files.isReadable(folder)) {
                throw new IllegalStateException("Content folder is not readable at " + folder + ".");
            }
        }
    }

    /**
     * A missing ffprobe is not fatal: videos then play for the fallback duration.
     */
    private void checkFfprobeConfiguration() {
        String configuredPath = System.getenv(FFPROBE_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            if (!Files.isRegularFile(Path.of(configuredPath))) {
                logger.warn(
                        "ffprobe binary not found at {}. Video durations will use the fallback of {}s.",
                        Path.of(configuredPath).toAbsolutePath(),
                        properties.media().fallbackVideoDurationSeconds());
            }
            return;
        }

        String binary = properties.probe().ffprobePath();
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFPROBE_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                warnFfprobeMissing(binary);
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            warnFfprobeMissing(binary);
        }
    }

    private void warnFfprobeMissing(String binary) {
        logger.warn(
                "ffprobe ({}) is not available. Install FFmpeg or set {}; video durations will use the fallback of {}s.",
                binary,
                FFPROBE_PATH_ENV,
                properties.media().fallbackVideoDurationSeconds());
    }
}
