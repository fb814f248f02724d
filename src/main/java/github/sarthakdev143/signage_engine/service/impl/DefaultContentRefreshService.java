package github.sarthakdev143.signage_engine.service.impl;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationController;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationException;
import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.ContentSnapshot;
import github.sarthakdev143.signage_engine.model.ManagedState;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.ReconciliationResult;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import github.sarthakdev143.signage_engine.model.TimedCatalog;
import github.sarthakdev143.signage_engine.service.CatalogScanner;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import github.sarthakdev143.signage_engine.service.DurationResolver;
import github.sarthakdev143.signage_engine.service.RotationClock;
import github.sarthakdev143.signage_engine.service.SceneReconciler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class DefaultContentRefreshService implements ContentRefreshService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultContentRefreshService.class);

    private final CatalogScanner catalogScanner;
    private final DurationResolver durationResolver;
    private final SceneReconciler sceneReconciler;
    private final RotationClock rotationClock;
    private final PresentationController controller;
    private final TaskExecutor refreshExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter refreshRunsCounter;
    private final Counter refreshSkippedCounter;
    private final Counter refreshFailureCounter;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicBoolean rescanPending = new AtomicBoolean();
    private final AtomicBoolean forceNextRefresh = new AtomicBoolean();
    private final AtomicBoolean reconciliationPending = new AtomicBoolean();
    private final AtomicReference<ScheduleWindow> activeWindow;
    private final AtomicReference<ContentSnapshot> snapshot;

    public DefaultContentRefreshService(
            CatalogScanner catalogScanner,
            DurationResolver durationResolver,
            SceneReconciler sceneReconciler,
            RotationClock rotationClock,
            PresentationController controller,
            @Qualifier("refreshExecutor") TaskExecutor refreshExecutor,
            Clock clock,
            SignageProperties properties,
            MeterRegistry meterRegistry) {
        this.catalogScanner = catalogScanner;
        this.durationResolver = durationResolver;
        this.sceneReconciler = sceneReconciler;
        this.rotationClock = rotationClock;
        this.controller = controller;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.refreshRunsCounter = meterRegistry.counter("signage.refresh.runs");
        this.refreshSkippedCounter = meterRegistry.counter("signage.refresh.skipped");
        this.refreshFailureCounter = meterRegistry.counter("signage.refresh.failures");

        ScheduleWindow initialWindow = properties.defaultWindow();
        this.activeWindow = new AtomicReference<>(initialWindow);
        this.snapshot = new AtomicReference<>(ContentSnapshot.initial(initialWindow));
    }

    @Override
    public boolean refresh(boolean forced) {
        refreshLock.lock();
        try {
            boolean force = forceNextRefresh.getAndSet(false) || forced;
            return runCycle(force);
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void requestRescan(String reason) {
        if (!rescanPending.compareAndSet(false, true)) {
            logger.debug("Rescan already queued; merged request ({})", reason);
            return;
        }

        logger.debug("Queued rescan ({})", reason);
        try {
            refreshExecutor.execute(this::runQueuedRefresh);
        } catch (RuntimeException e) {
            rescanPending.set(false);
            refreshFailureCounter.increment();
            logger.error("Could not queue rescan ({})", reason, e);
        }
    }

    @Override
    public void useWindow(ScheduleWindow window) {
        ScheduleWindow previous = activeWindow.getAndSet(window);
        if (!window.equals(previous)) {
            logger.info(
                    "Active window is now {} folder={} transition={}",
                    window.name(),
                    window.folder(),
                    window.transition());
        }
        try {
            controller.setTransitionStyle(window.transition());
        } catch (PresentationException | RuntimeException e) {
            meterRegistry.counter("signage.controller.failures", "operation", "set_transition").increment();
            logger.warn("Could not set transition {}: {}", window.transition(), e.getMessage());
        }
    }

    @Override
    public void activateWindow(ScheduleWindow window) {
        useWindow(window);
        forceNextRefresh.set(true);
        requestRescan("schedule window " + window.name());
    }

    @Override
    public void onContentRemoved(Path file) {
        refreshLock.lock();
        try {
            ContentSnapshot current = snapshot.get();
            Path parent = file.toAbsolutePath().normalize().getParent();
            if (parent == null || !parent.equals(current.catalog().directory().toAbsolutePath().normalize())) {
                logger.debug("Ignoring removal outside the active folder: {}", file);
                return;
            }

            String filename = file.getFileName().toString();
            boolean inCatalog = current.catalog().indexOf(filename) >= 0;
            if (!inCatalog && !current.managedState().managesScene(MediaEntry.sceneNameFor(filename))) {
                return;
            }

            ManagedState state = sceneReconciler.removeEntry(current.managedState(), filename);
            if (state.managesScene(MediaEntry.sceneNameFor(filename))
                    || state.managesSource(MediaEntry.sourceNameFor(filename))) {
                reconciliationPending.set(true);
                logger.warn("Scene of {} could not be removed; the next refresh will sweep it", filename);
            }
            TimedCatalog remaining = current.catalog().without(filename);
            snapshot.set(new ContentSnapshot(remaining, state, current.window(), clock.instant()));
            rotationClock.retire(filename);
            logger.info("Removed {} ahead of the next rescan; {} item(s) left", filename, remaining.size());

            if (remaining.isEmpty()) {
                requestRescan("last item removed");
            }
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public boolean reconciliationPending() {
        return reconciliationPending.get();
    }

    @Override
    public ScheduleWindow activeWindow() {
        return activeWindow.get();
    }

    @Override
    public ContentSnapshot currentSnapshot() {
        return snapshot.get();
    }

    private void runQueuedRefresh() {
        rescanPending.set(false);
        try {
            refresh(false);
        } catch (RuntimeException e) {
            refreshFailureCounter.increment();
            logger.error("Refresh cycle failed", e);
        }
    }

    private boolean runCycle(boolean forced) {
        ScheduleWindow window = activeWindow.get();
        ContentSnapshot previous = snapshot.get();
        boolean windowChanged = !previous.window().equals(window);

        Catalog catalog;
        try {
            catalog = catalogScanner.scan(window.folder());
        } catch (IOException | UncheckedIOException e) {
            refreshFailureCounter.increment();
            logger.error("Could not scan {}; keeping the previous catalog", window.folder(), e);
            return false;
        }

        if (!forced
                && !windowChanged
                && !previous.catalog().isEmpty()
                && !reconciliationPending.get()
                && catalog.fingerprint().equals(previous.catalog().fingerprint())) {
            refreshSkippedCounter.increment();
            logger.debug("Content of {} unchanged; skipping reconciliation", window.folder());
            return false;
        }

        TimedCatalog timed = durationResolver.resolveAll(catalog);
        ReconciliationResult result = sceneReconciler.apply(previous.managedState(), timed);
        reconciliationPending.set(result.failedOperations() > 0);
        snapshot.set(new ContentSnapshot(timed, result.managedState(), window, clock.instant()));
        refreshRunsCounter.increment();

        if (timed.isEmpty()) {
            rotationClock.deactivate();
        } else {
            rotationClock.reset(timed, window.transitionOffsetSeconds());
        }
        logger.info(
                "Published {} item(s) from {} (window {}, forced={}, failures={})",
                timed.size(),
                window.folder(),
                window.name(),
                forced,
                result.failedOperations());
        return true;
    }
}
