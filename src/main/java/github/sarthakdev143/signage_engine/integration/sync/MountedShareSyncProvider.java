package github.sarthakdev143.signage_engine.integration.sync;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.model.MediaExtensions;
import github.sarthakdev143.signage_engine.service.ContentRemovalListener;
import github.sarthakdev143.signage_engine.service.RemoteSyncProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Mirrors supported media from a mounted network share into the local content folder.
 */
@Component
@ConditionalOnProperty(name = "signage.sync.source-dir")
public class MountedShareSyncProvider implements RemoteSyncProvider {

    private static final Logger logger = LoggerFactory.getLogger(MountedShareSyncProvider.class);
    static final String DELETE_MARKER_SUFFIX = ".delete";
    private static final String PARTIAL_SUFFIX = ".part";

    private final Path sourceRoot;
    private final Path targetRoot;
    private final MediaExtensions extensions;

    public MountedShareSyncProvider(SignageProperties properties) {
        this.sourceRoot = properties.sync().sourceDir().toAbsolutePath().normalize();
        this.targetRoot = properties.syncTargetRoot();
        this.extensions = properties.extensions();
    }

    @Override
    public boolean synchronize(ContentRemovalListener listener) throws IOException {
        if (!Files.isDirectory(sourceRoot)) {
            throw new IOException("Remote share is not available at " + sourceRoot);
        }
        Files.createDirectories(targetRoot);
        removeDeleteMarkers();

        boolean changed = false;
        Set<Path> remoteFiles = new LinkedHashSet<>();
        for (Path remote : mediaFiles(sourceRoot)) {
            Path relative = sourceRoot.relativize(remote);
            remoteFiles.add(relative);
            Path local = targetRoot.resolve(relative);
            if (needsCopy(remote, local) && copy(remote, local)) {
                changed = true;
            }
        }

        for (Path local : mediaFiles(targetRoot)) {
            if (remoteFiles.contains(targetRoot.relativize(local))) {
                continue;
            }
            listener.onContentRemoved(local);
            deleteOrMark(local);
            changed = true;
        }

        if (changed) {
            logger.info("Synchronized {} into {}", sourceRoot, targetRoot);
        }
        return changed;
    }

    private List<Path> mediaFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> extensions.isSupported(path.getFileName().toString()))
                    .toList();
        }
    }

    private boolean needsCopy(Path remote, Path local) throws IOException {
        if (!Files.exists(local)) {
            return true;
        }
        if (Files.size(remote) != Files.size(local)) {
            return true;
        }
        return Files.getLastModifiedTime(remote).compareTo(Files.getLastModifiedTime(local)) > 0;
    }

    private boolean copy(Path remote, Path local) {
        Path partial = local.resolveSibling(local.getFileName() + PARTIAL_SUFFIX);
        try {
            Files.createDirectories(local.getParent());
            Files.copy(remote, partial, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            Files.move(partial, local, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Copied {}", sourceRoot.relativize(remote));
            return true;
        } catch (IOException e) {
            logger.warn("Could not copy {}: {}", remote, e.getMessage());
            try {
                Files.deleteIfExists(partial);
            } catch (IOException cleanup) {
                logger.debug("Could not remove partial copy {}", partial, cleanup);
            }
            return false;
        }
    }

    private void deleteOrMark(Path local) {
        try {
            Files.delete(local);
            logger.info("Deleted {} (removed from share)", targetRoot.relativize(local));
        } catch (IOException e) {
            Path marker = local.resolveSibling(local.getFileName() + DELETE_MARKER_SUFFIX);
            try {
                Files.move(local, marker, StandardCopyOption.REPLACE_EXISTING);
                logger.warn("Could not delete {}; renamed to {}", local, marker.getFileName());
            } catch (IOException renameError) {
                logger.error("Could not delete or rename {}", local, renameError);
            }
        }
    }

    private void removeDeleteMarkers() throws IOException {
        List<Path> markers;
        try (Stream<Path> walk = Files.walk(targetRoot)) {
            markers = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(DELETE_MARKER_SUFFIX))
                    .toList();
        }
        for (Path marker : markers) {
            try {
                Files.delete(marker);
            } catch (IOException e) {
                logger.warn("Could not remove leftover {}: {}", marker, e.getMessage());
            }
        }
    }
}
