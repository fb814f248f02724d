package github.sarthakdev143.signage_engine.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rotation-eligible media of one directory, sorted by file name ignoring case.
 * Durations are not known yet; see {@link TimedCatalog}.
 */
public record Catalog(
        Path directory,
        List<MediaEntry> entries) {

    public static final Comparator<String> FILENAME_ORDER =
            String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    public Catalog {
        Objects.requireNonNull(directory, "directory");
        entries = sortedUnique(entries);
    }

    public static Catalog empty(Path directory) {
        return new Catalog(directory, List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public String fingerprint() {
        return fingerprintOf(entries);
    }

    public static String fingerprintOf(Collection<MediaEntry> entries) {
        return entries.stream()
                .map(MediaEntry::fingerprintToken)
                .sorted()
                .reduce((left, right) -> left + "|" + right)
                .orElse("");
    }

    private static List<MediaEntry> sortedUnique(List<MediaEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }

        Map<String, MediaEntry> byName = new LinkedHashMap<>();
        for (MediaEntry entry : entries) {
            if (!entry.kind().isRotatable()) {
                throw new IllegalArgumentException("Audio entries cannot be part of a catalog: " + entry.filename());
            }
            if (byName.putIfAbsent(entry.filename(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + entry.filename());
            }
        }

        List<MediaEntry> sorted = new ArrayList<>(byName.values());
        sorted.sort(Comparator.comparing(MediaEntry::filename, FILENAME_ORDER));
        return List.copyOf(sorted);
    }
}
