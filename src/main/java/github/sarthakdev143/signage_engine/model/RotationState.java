package github.sarthakdev143.signage_engine.model;

import java.time.Instant;
import java.util.Optional;

public record RotationState(
        TimedCatalog catalog,
        int index,
        Instant startedAt,
        boolean active,
        double transitionOffsetSeconds) {

    public RotationState {
        if (catalog == null || catalog.isEmpty() || index < 0 || index >= catalog.size()) {
            index = 0;
        }
        active = active && catalog != null && !catalog.isEmpty();
    }

    public static RotationState inactive(TimedCatalog catalog) {
        return new RotationState(catalog, 0, null, false, 0.0);
    }

    public Optional<TimedMediaEntry> current() {
        if (catalog == null || catalog.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(catalog.get(index));
    }
}
