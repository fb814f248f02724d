package github.sarthakdev143.signage_engine.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A {@link Catalog} whose entries all carry a resolved playback duration. Only this type is accepted
 * when scenes are created or rotated.
 */
public record TimedCatalog(
        Path directory,
        List<TimedMediaEntry> entries,
        String fingerprint) {

    public TimedCatalog {
        Objects.requireNonNull(directory, "directory");
        entries = entries == null ? List.of() : List.copyOf(entries);
        fingerprint = fingerprint == null ? "" : fingerprint;
    }

    public static TimedCatalog empty(Path directory) {
        return new TimedCatalog(directory, List.of(), "");
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public TimedMediaEntry get(int index) {
        return entries.get(index);
    }

    public int indexOf(String filename) {
        for (int index = 0; index < entries.size(); index++) {
            if (entries.get(index).filename().equals(filename)) {
                return index;
            }
        }
        return -1;
    }

    public TimedCatalog without(String filename) {
        List<TimedMediaEntry> remaining = entries.stream()
                .filter(entry -> !entry.filename().equals(filename))
                .toList();
        if (remaining.size() == entries.size()) {
            return this;
        }
        String remainingFingerprint = Catalog.fingerprintOf(remaining.stream().map(TimedMediaEntry::entry).toList());
        return new TimedCatalog(directory, remaining, remainingFingerprint);
    }
}
