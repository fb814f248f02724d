package github.sarthakdev143.signage_engine.scheduling;

import github.sarthakdev143.signage_engine.integration.watch.ContentChangeQueue;
import github.sarthakdev143.signage_engine.integration.watch.ContentDirectoryWatcher;
import github.sarthakdev143.signage_engine.model.ContentChangeEvent;
import github.sarthakdev143.signage_engine.model.ContentChangeEvent.ChangeType;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;
import github.sarthakdev143.signage_engine.service.ContentRefreshService;
import github.sarthakdev143.signage_engine.service.RemoteSyncProvider;
import github.sarthakdev143.signage_engine.service.RotationClock;
import github.sarthakdev143.signage_engine.service.WindowScheduler;
import github.sarthakdev143.signage_engine.testsupport.MutableClock;
import github.sarthakdev143.signage_engine.testsupport.SignageTestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignageLoopsTest {

    private static final Path CONTENT = Path.of("/srv/signage/content");

    @Mock
    private RotationClock rotationClock;

    @Mock
    private WindowScheduler windowScheduler;

    @Mock
    private ContentRefreshService refreshService;

    @Mock
    private ContentDirectoryWatcher directoryWatcher;

    @Mock
    private ObjectProvider<RemoteSyncProvider> syncProvider;

    @Mock
    private RemoteSyncProvider remoteSyncProvider;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-09T08:00:00Z"));
    private final ContentChangeQueue changeQueue = new ContentChangeQueue(8, Duration.ofSeconds(2));
    private SignageLoops loops;

    @BeforeEach
    void setUp() {
        loops = new SignageLoops(
                rotationClock,
                windowScheduler,
                refreshService,
                changeQueue,
                directoryWatcher,
                syncProvider,
                clock,
                SignageTestProperties.withSchedule(CONTENT, List.of()));
    }

    @Test
    void loopsDoNothingBeforeStart() {
        loops.rotationTick();
        loops.scheduleCheck();
        loops.drainChanges();

        verifyNoInteractions(rotationClock, windowScheduler, refreshService);
    }

    @Test
    void rotationTickDrivesClock() {
        loops.start();

        loops.rotationTick();

        verify(rotationClock).tick();
    }

    @Test
    void windowChangeActivatesWindowAndRepointsWatcher() throws IOException {
        ScheduleWindow sunday = ScheduleWindow.unrestricted("Sunday", Path.of("/srv/signage/sunday"), "Cut", 2.0);
        when(windowScheduler.checkChange()).thenReturn(Optional.of(sunday));
        loops.start();

        loops.scheduleCheck();

        verify(refreshService).activateWindow(sunday);
        verify(directoryWatcher).watch(sunday.folder());
    }

    @Test
    void settledChangesRequestOneRescan() {
        loops.start();
        changeQueue.offer(new ContentChangeEvent(CONTENT.resolve("a.png"), ChangeType.CREATED, clock.instant()));
        changeQueue.offer(new ContentChangeEvent(CONTENT.resolve("b.png"), ChangeType.CREATED, clock.instant()));

        loops.drainChanges();
        verify(refreshService, never()).requestRescan(anyString());

        clock.advance(Duration.ofSeconds(2));
        loops.drainChanges();
        verify(refreshService).requestRescan("2 file change(s)");
    }

    @Test
    void remoteSyncChangesRequestRescan() throws IOException {
        when(syncProvider.getIfAvailable()).thenReturn(remoteSyncProvider);
        when(remoteSyncProvider.synchronize(refreshService)).thenReturn(true);
        loops.start();

        loops.remoteSync();

        verify(refreshService).requestRescan("remote sync");
    }

    @Test
    void remoteSyncFailureIsTolerated() throws IOException {
        when(syncProvider.getIfAvailable()).thenReturn(remoteSyncProvider);
        when(remoteSyncProvider.synchronize(refreshService)).thenThrow(new IOException("share offline"));
        loops.start();

        loops.remoteSync();

        verify(refreshService, never()).requestRescan(anyString());
    }

    @Test
    void loopIntervalsComeFromProperties() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        loops.configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList())
                .extracting(IntervalTask::getIntervalDuration)
                .containsExactly(
                        Duration.ofMillis(500),
                        SignageLoops.DRAIN_INTERVAL,
                        Duration.ofSeconds(60),
                        Duration.ofSeconds(60),
                        Duration.ofSeconds(30));
    }

    @Test
    void scheduleCheckIsNotRegisteredWhenScheduleIsDisabled() {
        SignageLoops unscheduled = new SignageLoops(
                rotationClock,
                windowScheduler,
                refreshService,
                changeQueue,
                directoryWatcher,
                syncProvider,
                clock,
                SignageTestProperties.forContent(CONTENT));
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        unscheduled.configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList()).hasSize(4);
    }

    @Test
    void pendingReconciliationIsRetried() {
        when(refreshService.reconciliationPending()).thenReturn(true);
        loops.start();

        loops.retryReconciliation();

        verify(refreshService).requestRescan("retrying failed controller operations");
    }

    @Test
    void settledStateNeedsNoRetry() {
        loops.start();

        loops.retryReconciliation();

        verify(refreshService, never()).requestRescan(anyString());
    }

    @Test
    void stopClosesWatcherAndHaltsLoops() {
        loops.start();

        loops.stop();
        loops.rotationTick();

        verify(directoryWatcher).close();
        verifyNoInteractions(rotationClock);
    }
}
