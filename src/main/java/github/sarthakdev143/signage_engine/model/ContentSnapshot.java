package github.sarthakdev143.signage_engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The catalog and managed state published together after a refresh. Readers only ever see a complete pair.
 */
public record ContentSnapshot(
        TimedCatalog catalog,
        ManagedState managedState,
        ScheduleWindow window,
        Instant publishedAt) {

    public ContentSnapshot {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(managedState, "managedState");
        Objects.requireNonNull(window, "window");
    }

    public static ContentSnapshot initial(ScheduleWindow window) {
        return new ContentSnapshot(TimedCatalog.empty(window.folder()), ManagedState.empty(), window, null);
    }
}
