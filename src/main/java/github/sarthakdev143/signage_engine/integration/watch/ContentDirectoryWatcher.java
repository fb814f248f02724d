package github.sarthakdev143.signage_engine.integration.watch;

import github.sarthakdev143.signage_engine.model.ContentChangeEvent;
import github.sarthakdev143.signage_engine.model.ContentChangeEvent.ChangeType;
import github.sarthakdev143.signage_engine.model.MediaExtensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Clock;

/**
 * Watches one content folder (non-recursively) on a daemon thread and feeds a {@link ContentChangeQueue}.
 */
public class ContentDirectoryWatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ContentDirectoryWatcher.class);

    private final ContentChangeQueue queue;
    private final MediaExtensions extensions;
    private final Clock clock;
    private WatchService watchService;
    private Thread worker;
    private Path directory;

    public ContentDirectoryWatcher(ContentChangeQueue queue, MediaExtensions extensions, Clock clock) {
        this.queue = queue;
        this.extensions = extensions;
        this.clock = clock;
    }

    /**
     * Starts watching {@code folder}, replacing any previous watch.
     */
    public synchronized void watch(Path folder) throws IOException {
        Path target = folder.toAbsolutePath().normalize();
        if (target.equals(directory) && worker != null && worker.isAlive()) {
            return;
        }
        stopWorker();

        WatchService service = FileSystems.getDefault().newWatchService();
        try {
            target.register(
                    service,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            service.close();
            throw e;
        }

        Thread thread = new Thread(() -> pollLoop(service, target), "content-watcher");
        thread.setDaemon(true);
        this.watchService = service;
        this.worker = thread;
        this.directory = target;
        thread.start();
        logger.info("Watching {} for changes", target);
    }

    synchronized Path watchedDirectory() {
        return directory;
    }

    @Override
    public synchronized void close() {
        stopWorker();
        directory = null;
    }

    private void stopWorker() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("Could not close watch on {}: {}", directory, e.getMessage());
            }
            watchService = null;
        }
        if (worker != null) {
            worker.interrupt();
            worker = null;
        }
    }

    private void pollLoop(WatchService service, Path folder) {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    queue.offer(new ContentChangeEvent(folder, ChangeType.OVERFLOW, clock.instant()));
                    continue;
                }
                Path name = (Path) event.context();
                if (!extensions.isSupported(name.toString())) {
                    continue;
                }
                if (!queue.offer(new ContentChangeEvent(folder.resolve(name), toChangeType(event.kind()), clock.instant()))) {
                    logger.debug("Change queue full; {} folded into a full rescan", name);
                }
            }

            if (!key.reset()) {
                logger.warn("Watch on {} is no longer valid", folder);
                return;
            }
        }
    }

    private static ChangeType toChangeType(WatchEvent.Kind<?> kind) {
        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            return ChangeType.CREATED;
        }
        if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            return ChangeType.DELETED;
        }
        return ChangeType.MODIFIED;
    }
}
