package github.sarthakdev143.signage_engine.model;

import java.util.Objects;

public record TimedMediaEntry(
        MediaEntry entry,
        double durationSeconds) {

    public TimedMediaEntry {
        Objects.requireNonNull(entry, "entry");
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0.0) {
            throw new IllegalArgumentException("durationSeconds must be a finite, non-negative number.");
        }
    }

    public String filename() {
        return entry.filename();
    }

    public String sceneName() {
        return entry.sceneName();
    }

    public String sourceName() {
        return entry.sourceName();
    }

    /**
     * Elapsed seconds after which rotation moves on. Videos hand over {@code transitionOffsetSeconds}
     * early so the transition overlaps the end of the clip; images stay up for their whole duration.
     */
    public double switchTimeSeconds(double transitionOffsetSeconds) {
        if (entry.isVideo()) {
            return Math.max(0.0, durationSeconds - transitionOffsetSeconds);
        }
        return durationSeconds;
    }
}
