package github.sarthakdev143.signage_engine.service.impl;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.MediaExtensions;
import github.sarthakdev143.signage_engine.model.MediaKind;
import github.sarthakdev143.signage_engine.service.CatalogScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@Service
public class DirectoryCatalogScanner implements CatalogScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryCatalogScanner.class);

    private final MediaExtensions extensions;

    public DirectoryCatalogScanner(SignageProperties properties) {
        this.extensions = properties.extensions();
    }

    @Override
    public Catalog scan(Path directory) throws IOException {
        Path root = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IOException("Content directory does not exist or is not a directory: " + root);
        }

        List<Path> candidates;
        try (Stream<Path> listing = Files.list(root)) {
            candidates = listing.toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<MediaEntry> entries = new ArrayList<>();
        for (Path candidate : candidates) {
            toEntry(candidate).ifPresent(entries::add);
        }

        Catalog catalog = new Catalog(root, entries);
        logger.debug("Scanned {}: {} rotatable file(s)", root, catalog.size());
        return catalog;
    }

    private Optional<MediaEntry> toEntry(Path file) {
        String filename = file.getFileName().toString();
        Optional<MediaKind> kind = extensions.classify(filename);
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        if (!kind.get().isRotatable()) {
            logger.debug("Skipping audio file {}", filename);
            return Optional.empty();
        }

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            logger.warn("Skipping unreadable file {}: {}", filename, e.getMessage());
            return Optional.empty();
        }

        if (!attributes.isRegularFile()) {
            return Optional.empty();
        }
        if (attributes.size() == 0) {
            logger.warn("Skipping empty file {}", filename);
            return Optional.empty();
        }
        if (!Files.isReadable(file)) {
            logger.warn("Skipping unreadable file {}", filename);
            return Optional.empty();
        }

        return Optional.of(new MediaEntry(
                filename,
                file.toAbsolutePath().normalize(),
                kind.get(),
                attributes.size(),
                attributes.lastModifiedTime().toMillis()));
    }
}
