package github.sarthakdev143.signage_engine.integration.watch;

import github.sarthakdev143.signage_engine.model.ContentChangeEvent;
import github.sarthakdev143.signage_engine.model.ContentChangeEvent.ChangeType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentChangeQueueTest {

    private static final Instant T0 = Instant.parse("2024-06-09T08:00:00Z");

    private final ContentChangeQueue queue = new ContentChangeQueue(2, Duration.ofSeconds(2));

    @Test
    void eventsAreHeldUntilTheFolderSettles() {
        queue.offer(event("a.png", T0));
        queue.offer(event("b.png", T0.plusSeconds(1)));

        assertThat(queue.drainSettled(T0.plusMillis(2_500))).isEmpty();

        List<ContentChangeEvent> drained = queue.drainSettled(T0.plusSeconds(3));
        assertThat(drained).extracting(ContentChangeEvent::path)
                .containsExactly(Path.of("/content/a.png"), Path.of("/content/b.png"));
        assertThat(queue.size()).isZero();
    }

    @Test
    void drainWithoutEventsReturnsNothing() {
        assertThat(queue.drainSettled(T0)).isEmpty();

        queue.offer(event("a.png", T0));
        queue.drainSettled(T0.plusSeconds(5));

        assertThat(queue.drainSettled(T0.plusSeconds(10))).isEmpty();
    }

    @Test
    void fullQueueReportsOverflowOnce() {
        assertThat(queue.offer(event("a.png", T0))).isTrue();
        assertThat(queue.offer(event("b.png", T0))).isTrue();
        assertThat(queue.offer(event("c.png", T0))).isFalse();
        assertThat(queue.hasOverflowed()).isTrue();

        List<ContentChangeEvent> drained = queue.drainSettled(T0.plusSeconds(2));

        assertThat(drained).hasSize(3);
        assertThat(drained.get(2).type()).isEqualTo(ChangeType.OVERFLOW);
        assertThat(queue.hasOverflowed()).isFalse();
    }

    @Test
    void watcherOverflowAloneTriggersDrain() {
        queue.offer(new ContentChangeEvent(Path.of("/content"), ChangeType.OVERFLOW, T0));

        assertThat(queue.drainSettled(T0.plusSeconds(2)))
                .extracting(ContentChangeEvent::type)
                .containsExactly(ChangeType.OVERFLOW);
    }

    private static ContentChangeEvent event(String name, Instant at) {
        return new ContentChangeEvent(Path.of("/content").resolve(name), ChangeType.CREATED, at);
    }
}
