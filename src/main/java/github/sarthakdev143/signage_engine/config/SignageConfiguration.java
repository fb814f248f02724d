package github.sarthakdev143.signage_engine.config;

import github.sarthakdev143.signage_engine.integration.presentation.InMemoryPresentationController;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationController;
import github.sarthakdev143.signage_engine.integration.watch.ContentChangeQueue;
import github.sarthakdev143.signage_engine.integration.watch.ContentDirectoryWatcher;
import github.sarthakdev143.signage_engine.service.RotationClock;
import github.sarthakdev143.signage_engine.service.WindowScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

@Configuration
public class SignageConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SignageConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(PresentationController.class)
    public InMemoryPresentationController inMemoryPresentationController() {
        logger.warn("No presentation controller configured; running against the in-memory dry-run controller");
        return new InMemoryPresentationController();
    }

    @Bean
    public RotationClock rotationClock(PresentationController controller, Clock clock, MeterRegistry meterRegistry) {
        return new RotationClock(controller, clock, meterRegistry);
    }

    @Bean
    public WindowScheduler windowScheduler(SignageProperties properties, Clock clock) {
        return new WindowScheduler(
                properties.scheduledWindows(),
                properties.defaultWindow(),
                scheduleZone(properties),
                clock);
    }

    @Bean
    public ContentChangeQueue contentChangeQueue(SignageProperties properties) {
        return new ContentChangeQueue(
                properties.rotation().changeQueueCapacity(),
                properties.rotation().rescanDebounce());
    }

    @Bean
    public ContentDirectoryWatcher contentDirectoryWatcher(
            ContentChangeQueue queue,
            SignageProperties properties,
            Clock clock) {
        return new ContentDirectoryWatcher(queue, properties.extensions(), clock);
    }

    /**
     * Refresh cycles run one at a time; requests are coalesced before they reach this executor.
     */
    @Bean
    public TaskExecutor refreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setThreadNamePrefix("signage-refresh-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Runs the periodic loops. A slow remote sync must not hold back rotation ticks.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("signage-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    static ZoneId scheduleZone(SignageProperties properties) {
        try {
            return properties.zone();
        } catch (DateTimeException e) {
            ZoneId fallback = ZoneId.systemDefault();
            logger.warn(
                    "Invalid signage.schedule.timezone '{}'; using {}",
                    properties.schedule().timezone(),
                    fallback);
            return fallback;
        }
    }
}
