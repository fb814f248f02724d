package github.sarthakdev143.signage_engine.model;

import java.nio.file.Path;
import java.time.Instant;

public record ContentChangeEvent(
        Path path,
        ChangeType type,
        Instant detectedAt) {

    public enum ChangeType {
        CREATED,
        MODIFIED,
        DELETED,
        OVERFLOW
    }
}
