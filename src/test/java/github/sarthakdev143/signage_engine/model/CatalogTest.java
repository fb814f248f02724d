package github.sarthakdev143.signage_engine.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static github.sarthakdev143.signage_engine.testsupport.MediaFixtures.CONTENT;
import static github.sarthakdev143.signage_engine.testsupport.MediaFixtures.image;
import static github.sarthakdev143.signage_engine.testsupport.MediaFixtures.video;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogTest {

    @Test
    void entriesAreSortedByNameIgnoringCase() {
        Catalog catalog = new Catalog(CONTENT, List.of(image("b.png"), video("A.mp4"), image("c.jpg")));

        assertThat(catalog.entries())
                .extracting(MediaEntry::filename)
                .containsExactly("A.mp4", "b.png", "c.jpg");
    }

    @Test
    void fingerprintDoesNotDependOnScanOrder() {
        Catalog first = new Catalog(CONTENT, List.of(image("b.png"), video("a.mp4")));
        Catalog second = new Catalog(CONTENT, List.of(video("a.mp4"), image("b.png")));

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(Catalog.fingerprintOf(List.of(image("b.png"), video("a.mp4"))))
                .isEqualTo("a.mp4:4096:1700000000000|b.png:1024:1700000000000");
    }

    @Test
    void fingerprintChangesWhenSizeChanges() {
        MediaEntry original = image("a.png");
        MediaEntry resized = new MediaEntry("a.png", original.path(), MediaKind.IMAGE, 2048, original.modifiedMillis());

        assertThat(new Catalog(CONTENT, List.of(original)).fingerprint())
                .isNotEqualTo(new Catalog(CONTENT, List.of(resized)).fingerprint());
    }

    @Test
    void emptyCatalogHasEmptyFingerprint() {
        assertThat(Catalog.empty(CONTENT).fingerprint()).isEmpty();
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> new Catalog(CONTENT, List.of(image("a.png"), image("a.png"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a.png");
    }

    @Test
    void rejectsAudioEntries() {
        MediaEntry audio = new MediaEntry("song.mp3", Path.of("/tmp/song.mp3"), MediaKind.AUDIO, 10, 0);

        assertThatThrownBy(() -> new Catalog(CONTENT, List.of(audio)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derivedNamesUseSceneAndSourceSuffixes() {
        MediaEntry entry = image("holiday.png");

        assertThat(entry.sceneName()).isEqualTo("holiday.png_scene");
        assertThat(entry.sourceName()).isEqualTo("holiday.png_source");
        assertThat(MediaEntry.filenameOfSource("holiday.png_source")).isEqualTo("holiday.png");
    }

    @Test
    void timedCatalogWithoutRecomputesFingerprint() {
        TimedCatalog catalog = new TimedCatalog(
                CONTENT,
                List.of(new TimedMediaEntry(video("a.mp4"), 10.0), new TimedMediaEntry(image("b.png"), 8.0)),
                "ignored");

        TimedCatalog remaining = catalog.without("a.mp4");

        assertThat(remaining.entries()).extracting(TimedMediaEntry::filename).containsExactly("b.png");
        assertThat(remaining.fingerprint()).isEqualTo("b.png:1024:1700000000000");
        assertThat(catalog.without("missing.png")).isSameAs(catalog);
    }
}
