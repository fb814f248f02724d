package github.sarthakdev143.signage_engine.service.impl;

import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.MediaKind;
import github.sarthakdev143.signage_engine.testsupport.SignageTestProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryCatalogScannerTest {

    @TempDir
    Path contentDir;

    private DirectoryCatalogScanner scanner() {
        return new DirectoryCatalogScanner(SignageTestProperties.forContent(contentDir));
    }

    @Test
    void scanClassifiesAndSortsSupportedFiles() throws IOException {
        write("b.PNG", 10);
        write("A.mp4", 20);
        write("c.jpeg", 30);
        write("notes.txt", 5);
        write("song.mp3", 40);

        Catalog catalog = scanner().scan(contentDir);

        assertThat(catalog.entries()).extracting(MediaEntry::filename).containsExactly("A.mp4", "b.PNG", "c.jpeg");
        assertThat(catalog.entries()).extracting(MediaEntry::kind)
                .containsExactly(MediaKind.VIDEO, MediaKind.IMAGE, MediaKind.IMAGE);
        assertThat(catalog.directory()).isEqualTo(contentDir.toAbsolutePath().normalize());
    }

    @Test
    void scanSkipsEmptyFilesAndSubdirectories() throws IOException {
        write("empty.png", 0);
        write("real.png", 3);
        Files.createDirectories(contentDir.resolve("nested.png"));
        Files.createDirectories(contentDir.resolve("sub"));
        Files.write(contentDir.resolve("sub").resolve("deep.png"), new byte[] {1, 2, 3});

        Catalog catalog = scanner().scan(contentDir);

        assertThat(catalog.entries()).extracting(MediaEntry::filename).containsExactly("real.png");
    }

    @Test
    void scanRecordsSizeAndModificationTime() throws IOException {
        Path file = write("clip.mp4", 7);
        Files.setLastModifiedTime(file, FileTime.fromMillis(1_700_000_000_000L));

        MediaEntry entry = scanner().scan(contentDir).entries().get(0);

        assertThat(entry.sizeBytes()).isEqualTo(7);
        assertThat(entry.modifiedMillis()).isEqualTo(1_700_000_000_000L);
        assertThat(entry.fingerprintToken()).isEqualTo("clip.mp4:7:1700000000000");
    }

    @Test
    void unchangedFolderProducesSameFingerprint() throws IOException {
        write("a.png", 3);
        write("b.mp4", 4);

        assertThat(scanner().scan(contentDir).fingerprint()).isEqualTo(scanner().scan(contentDir).fingerprint());
    }

    @Test
    void missingDirectoryFailsTheScan() {
        assertThatThrownBy(() -> scanner().scan(contentDir.resolve("missing")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void emptyDirectoryGivesEmptyCatalog() throws IOException {
        assertThat(scanner().scan(contentDir).isEmpty()).isTrue();
    }

    private Path write(String name, int size) throws IOException {
        return Files.write(contentDir.resolve(name), new byte[size]);
    }
}
