package github.sarthakdev143.signage_engine.scheduling;

import github.sarthakdev143.signage_engine.integration.watch.ContentDirectoryWatcher;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import github.sarthakdev143.signage_engine.service.RemoteSyncProvider;
import github.sarthakdev143.signage_engine.service.WindowScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Selects the initial window, publishes the first catalog synchronously and only then lets the loops run.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@ConditionalOnProperty(name = "signage.startup.enabled", havingValue = "true", matchIfMissing = true)
public class SignageStartup implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SignageStartup.class);

    private final WindowScheduler windowScheduler;
    private final ContentRefreshService refreshService;
    private final ContentDirectoryWatcher directoryWatcher;
    private final ObjectProvider<RemoteSyncProvider> syncProvider;
    private final SignageLoops loops;

    public SignageStartup(
            WindowScheduler windowScheduler,
            ContentRefreshService refreshService,
            ContentDirectoryWatcher directoryWatcher,
            ObjectProvider<RemoteSyncProvider> syncProvider,
            SignageLoops loops) {
        this.windowScheduler = windowScheduler;
        this.refreshService = refreshService;
        this.directoryWatcher = directoryWatcher;
        this.syncProvider = syncProvider;
        this.loops = loops;
    }

    @Override
    public void run(ApplicationArguments args) {
        ScheduleWindow window = windowScheduler.selectInitial();
        refreshService.useWindow(window);

        RemoteSyncProvider provider = syncProvider.getIfAvailable();
        if (provider != null) {
            try {
                provider.synchronize(refreshService);
            } catch (IOException e) {
                logger.warn("Initial remote sync failed; continuing with local content: {}", e.getMessage());
            }
        }

        try {
            refreshService.refresh(true);
        } catch (RuntimeException e) {
            logger.error("Initial refresh failed; the loops will retry on the next change or rescan", e);
        }

        try {
            directoryWatcher.watch(window.folder());
        } catch (IOException e) {
            logger.warn("Could not watch {}; only scheduled and manual rescans will pick up changes", window.folder(), e);
        }

        loops.start();
        logger.info("Signage engine started in window {}", window.name());
    }
}
