package github.sarthakdev143.signage_engine.service;

import java.io.IOException;
import java.nio.file.Path;

public interface DurationProbe {

    /**
     * Reads the playback length of a media file.
     *
     * @throws IOException when the probe fails, times out or returns output that cannot be parsed
     */
    double probeDurationSeconds(Path mediaFile) throws IOException, InterruptedException;
}
