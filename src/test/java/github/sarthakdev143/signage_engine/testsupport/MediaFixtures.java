package github.sarthakdev143.signage_engine.testsupport;

import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.MediaKind;
import github.sarthakdev143.signage_engine.model.TimedCatalog;
import github.sarthakdev143.signage_engine.model.TimedMediaEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class MediaFixtures {

    public static final Path CONTENT = Path.of("/srv/signage/content").toAbsolutePath().normalize();

    private MediaFixtures() {
    }

    public static MediaEntry image(String filename) {
        return new MediaEntry(filename, CONTENT.resolve(filename), MediaKind.IMAGE, 1024, 1_700_000_000_000L);
    }

    public static MediaEntry video(String filename) {
        return new MediaEntry(filename, CONTENT.resolve(filename), MediaKind.VIDEO, 4096, 1_700_000_000_000L);
    }

    public static TimedMediaEntry timed(MediaEntry entry, double seconds) {
        return new TimedMediaEntry(entry, seconds);
    }

    public static TimedCatalog timedCatalog(TimedMediaEntry... entries) {
        List<TimedMediaEntry> list = List.of(entries);
        List<MediaEntry> raw = new ArrayList<>();
        list.forEach(entry -> raw.add(entry.entry()));
        Catalog catalog = new Catalog(CONTENT, raw);
        List<TimedMediaEntry> sorted = new ArrayList<>();
        for (MediaEntry entry : catalog.entries()) {
            list.stream().filter(timed -> timed.entry().equals(entry)).findFirst().ifPresent(sorted::add);
        }
        return new TimedCatalog(CONTENT, sorted, catalog.fingerprint());
    }
}
