package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.integration.presentation.PresentationController;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationException;
import github.sarthakdev143.signage_engine.model.RotationState;
import github.sarthakdev143.signage_engine.model.TimedCatalog;
import github.sarthakdev143.signage_engine.model.TimedMediaEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polled rotation through a {@link TimedCatalog}. {@link #tick()} is called a few times per second; it
 * activates the next scene once the current one reached its switch time.
 * <p>
 * State is swapped with compare-and-set, so a {@link #reset(TimedCatalog, double)} racing with a tick always
 * wins and the stale advance is dropped.
 */
public class RotationClock {

    private static final Logger logger = LoggerFactory.getLogger(RotationClock.class);

    private final PresentationController controller;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter advanceCounter;
    private final AtomicReference<RotationState> state = new AtomicReference<>(RotationState.inactive(null));

    public RotationClock(PresentationController controller, Clock clock, MeterRegistry meterRegistry) {
        this.controller = controller;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.advanceCounter = meterRegistry.counter("signage.rotation.advances");
    }

    public void reset(TimedCatalog catalog, double transitionOffsetSeconds) {
        RotationState next = new RotationState(catalog, 0, clock.instant(), true, transitionOffsetSeconds);
        state.set(next);
        if (next.active()) {
            logger.info("Rotation restarted with {} item(s)", catalog.size());
            next.current().ifPresent(this::activate);
        } else {
            logger.info("Rotation stopped: catalog is empty");
        }
    }

    public void tick() {
        RotationState current = state.get();
        if (!current.active()) {
            return;
        }

        TimedMediaEntry entry = current.current().orElseThrow();
        Instant now = clock.instant();
        double elapsedSeconds = Duration.between(current.startedAt(), now).toNanos() / 1_000_000_000.0;
        if (elapsedSeconds < entry.switchTimeSeconds(current.transitionOffsetSeconds())) {
            return;
        }

        int nextIndex = (current.index() + 1) % current.catalog().size();
        RotationState advanced = new RotationState(
                current.catalog(),
                nextIndex,
                now,
                true,
                current.transitionOffsetSeconds());
        if (!state.compareAndSet(current, advanced)) {
            logger.debug("Rotation was reset during tick; dropping advance");
            return;
        }

        advanceCounter.increment();
        advanced.current().ifPresent(this::activate);
    }

    /**
     * Drops {@code filename} from the rotation. If it was on screen the rotation restarts from the first item;
     * otherwise the current item keeps playing.
     */
    public void retire(String filename) {
        while (true) {
            RotationState current = state.get();
            TimedCatalog catalog = current.catalog();
            int removedIndex = catalog == null ? -1 : catalog.indexOf(filename);
            if (removedIndex < 0) {
                return;
            }

            TimedCatalog remaining = catalog.without(filename);
            boolean wasOnScreen = current.active() && removedIndex == current.index();
            RotationState next;
            if (remaining.isEmpty()) {
                next = RotationState.inactive(remaining);
            } else if (wasOnScreen) {
                next = new RotationState(remaining, 0, clock.instant(), true, current.transitionOffsetSeconds());
            } else {
                int index = removedIndex < current.index() ? current.index() - 1 : current.index();
                next = new RotationState(
                        remaining,
                        index,
                        current.startedAt(),
                        current.active(),
                        current.transitionOffsetSeconds());
            }

            if (state.compareAndSet(current, next)) {
                logger.info("Retired {} from rotation; {} item(s) left", filename, remaining.size());
                if (wasOnScreen && next.active()) {
                    next.current().ifPresent(this::activate);
                }
                return;
            }
        }
    }

    public void deactivate() {
        RotationState current = state.get();
        state.set(RotationState.inactive(current.catalog()));
    }

    public RotationState currentState() {
        return state.get();
    }

    private void activate(TimedMediaEntry entry) {
        try {
            controller.setActiveScene(entry.sceneName());
            logger.debug("Showing {} for {}s", entry.filename(), entry.durationSeconds());
        } catch (PresentationException | RuntimeException e) {
            meterRegistry.counter("signage.controller.failures", "operation", "set_active_scene").increment();
            logger.warn("Could not activate scene {}: {}", entry.sceneName(), e.getMessage());
        }
    }
}
