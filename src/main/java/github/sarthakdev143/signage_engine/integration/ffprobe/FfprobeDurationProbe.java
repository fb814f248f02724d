package github.sarthakdev143.signage_engine.integration.ffprobe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.service.DurationProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class FfprobeDurationProbe implements DurationProbe {

    private static final Logger logger = LoggerFactory.getLogger(FfprobeDurationProbe.class);
    static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final long OUTPUT_DRAIN_SECONDS = 1;

    private final String configuredBinary;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public FfprobeDurationProbe(SignageProperties properties, ObjectMapper objectMapper) {
        this.configuredBinary = properties.probe().ffprobePath();
        this.timeout = properties.probe().timeout();
        this.objectMapper = objectMapper;
    }

    @Override
    public double probeDurationSeconds(Path mediaFile) throws IOException, InterruptedException {
        List<String> command = buildCommand(mediaFile);
        logger.debug("Running ffprobe: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        return parseDuration(runToCompletion(process, mediaFile));
    }

    /**
     * Waits for {@code process} and returns its output. The process never outlives this call.
     */
    String runToCompletion(Process process, Path mediaFile) throws IOException, InterruptedException {
        try {
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IOException("ffprobe timed out after " + timeout.toMillis() + "ms for " + mediaFile.getFileName());
            }

            String text = awaitOutput(output, mediaFile);
            if (process.exitValue() != 0) {
                throw new IOException(
                        "ffprobe failed for "
                                + mediaFile.getFileName()
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + text.trim());
            }
            return text;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    List<String> buildCommand(Path mediaFile) {
        return List.of(
                resolveFfprobeBinary(),
                "-v",
                "error",
                "-show_entries",
                "format=duration",
                "-of",
                "json",
                mediaFile.toString());
    }

    double parseDuration(String json) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new IOException("ffprobe output is not valid JSON.", e);
        }
        JsonNode duration = root == null ? null : root.path("format").get("duration");
        if (duration == null || duration.isNull()) {
            throw new IOException("ffprobe output has no format.duration.");
        }

        double seconds;
        try {
            seconds = duration.isNumber() ? duration.asDouble() : Double.parseDouble(duration.asText().trim());
        } catch (NumberFormatException e) {
            throw new IOException("ffprobe reported an unparseable duration: " + duration.asText(), e);
        }
        if (!Double.isFinite(seconds) || seconds <= 0.0) {
            throw new IOException("ffprobe reported a non-positive duration: " + duration.asText());
        }
        return seconds;
    }

    String resolveFfprobeBinary() {
        String fromEnvironment = System.getenv(FFPROBE_PATH_ENV);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return fromEnvironment;
        }
        return configuredBinary;
    }

    private String awaitOutput(CompletableFuture<String> output, Path mediaFile) throws IOException, InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Could not read ffprobe output for " + mediaFile.getFileName(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("ffprobe output for " + mediaFile.getFileName() + " was not closed in time.", e);
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
