package github.sarthakdev143.signage_engine.scheduling;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.integration.watch.ContentChangeQueue;
import github.sarthakdev143.signage_engine.integration.watch.ContentDirectoryWatcher;
import github.sarthakdev143.signage_engine.model.ContentChangeEvent;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import github.sarthakdev143.signage_engine.service.RemoteSyncProvider;
import github.sarthakdev143.signage_engine.service.RotationClock;
import github.sarthakdev143.signage_engine.service.WindowScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Periodic work of the engine. Every loop is a no-op until {@link #start()} and returns after the current
 * iteration once {@link #stop()} was called. Intervals come from {@link SignageProperties}.
 */
@Component
public class SignageLoops implements SchedulingConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(SignageLoops.class);
    static final Duration DRAIN_INTERVAL = Duration.ofMillis(250);

    private final RotationClock rotationClock;
    private final WindowScheduler windowScheduler;
    private final ContentRefreshService refreshService;
    private final ContentChangeQueue changeQueue;
    private final ContentDirectoryWatcher directoryWatcher;
    private final ObjectProvider<RemoteSyncProvider> syncProvider;
    private final Clock clock;
    private final boolean scheduleEnabled;
    private final Duration tickInterval;
    private final Duration checkInterval;
    private final Duration syncInterval;

    private final AtomicBoolean running = new AtomicBoolean();
    private final ReentrantReadWriteLock iterationLock = new ReentrantReadWriteLock();

    public SignageLoops(
            RotationClock rotationClock,
            WindowScheduler windowScheduler,
            ContentRefreshService refreshService,
            ContentChangeQueue changeQueue,
            ContentDirectoryWatcher directoryWatcher,
            ObjectProvider<RemoteSyncProvider> syncProvider,
            Clock clock,
            SignageProperties properties) {
        this.rotationClock = rotationClock;
        this.windowScheduler = windowScheduler;
        this.refreshService = refreshService;
        this.changeQueue = changeQueue;
        this.directoryWatcher = directoryWatcher;
        this.syncProvider = syncProvider;
        this.clock = clock;
        this.scheduleEnabled = properties.schedule().enabled();
        this.tickInterval = properties.rotation().tickInterval();
        this.checkInterval = properties.schedule().checkInterval();
        this.syncInterval = properties.sync().interval();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::rotationTick, tickInterval);
        registrar.addFixedDelayTask(this::drainChanges, DRAIN_INTERVAL);
        registrar.addFixedDelayTask(this::retryReconciliation, checkInterval);
        if (scheduleEnabled) {
            registrar.addFixedDelayTask(this::scheduleCheck, checkInterval);
        }
        registrar.addFixedDelayTask(this::remoteSync, syncInterval);
    }

    public void start() {
        running.set(true);
        logger.info("Signage loops started");
    }

    @PreDestroy
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        iterationLock.writeLock().lock();
        try {
            directoryWatcher.close();
            logger.info("Signage loops stopped");
        } finally {
            iterationLock.writeLock().unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void rotationTick() {
        iterate("rotation", rotationClock::tick);
    }

    public void scheduleCheck() {
        if (!scheduleEnabled) {
            return;
        }
        iterate("schedule", () -> windowScheduler.checkChange().ifPresent(this::switchWindow));
    }

    public void drainChanges() {
        iterate("change-drain", () -> {
            List<ContentChangeEvent> events = changeQueue.drainSettled(clock.instant());
            if (!events.isEmpty()) {
                refreshService.requestRescan(events.size() + " file change(s)");
            }
        });
    }

    public void retryReconciliation() {
        iterate("reconcile-retry", () -> {
            if (refreshService.reconciliationPending()) {
                refreshService.requestRescan("retrying failed controller operations");
            }
        });
    }

    public void remoteSync() {
        RemoteSyncProvider provider = syncProvider.getIfAvailable();
        if (provider == null) {
            return;
        }
        iterate("remote-sync", () -> synchronize(provider));
    }

    void synchronize(RemoteSyncProvider provider) {
        try {
            if (provider.synchronize(refreshService)) {
                refreshService.requestRescan("remote sync");
            }
        } catch (IOException e) {
            logger.warn("Remote sync failed: {}", e.getMessage());
        }
    }

    private void switchWindow(ScheduleWindow window) {
        refreshService.activateWindow(window);
        try {
            directoryWatcher.watch(window.folder());
        } catch (IOException e) {
            logger.warn("Could not watch {}; changes will be picked up on the next rescan", window.folder(), e);
        }
    }

    private void iterate(String loop, Runnable body) {
        if (!running.get()) {
            return;
        }
        iterationLock.readLock().lock();
        try {
            if (running.get()) {
                body.run();
            }
        } catch (RuntimeException e) {
            logger.error("Iteration of the {} loop failed", loop, e);
        } finally {
            iterationLock.readLock().unlock();
        }
    }
}
