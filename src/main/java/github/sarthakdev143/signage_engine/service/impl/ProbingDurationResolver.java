package github.sarthakdev143.signage_engine.service.impl;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.TimedCatalog;
import github.sarthakdev143.signage_engine.model.TimedMediaEntry;
import github.sarthakdev143.signage_engine.service.DurationProbe;
import github.sarthakdev143.signage_engine.service.DurationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@Service
public class ProbingDurationResolver implements DurationResolver {

    private static final Logger logger = LoggerFactory.getLogger(ProbingDurationResolver.class);

    private final DurationProbe durationProbe;
    private final double slideDurationSeconds;
    private final double maxVideoDurationSeconds;
    private final double fallbackVideoDurationSeconds;

    public ProbingDurationResolver(DurationProbe durationProbe, SignageProperties properties) {
        this.durationProbe = durationProbe;
        this.slideDurationSeconds = properties.media().slideDurationSeconds();
        this.maxVideoDurationSeconds = properties.media().maxVideoDurationSeconds();
        this.fallbackVideoDurationSeconds = properties.media().fallbackVideoDurationSeconds();
    }

    @Override
    public double resolve(MediaEntry entry) {
        if (!entry.isVideo()) {
            return slideDurationSeconds;
        }

        double probed;
        try {
            probed = durationProbe.probeDurationSeconds(entry.path());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while probing {}; using {}s", entry.filename(), fallbackVideoDurationSeconds);
            return fallbackVideoDurationSeconds;
        } catch (IOException | RuntimeException e) {
            logger.warn(
                    "Could not probe duration of {}; using {}s. Reason: {}",
                    entry.filename(),
                    fallbackVideoDurationSeconds,
                    e.getMessage());
            return fallbackVideoDurationSeconds;
        }

        if (!Double.isFinite(probed) || probed <= 0.0) {
            logger.warn("Probe returned {} for {}; using {}s", probed, entry.filename(), fallbackVideoDurationSeconds);
            return fallbackVideoDurationSeconds;
        }
        if (probed > maxVideoDurationSeconds) {
            logger.info(
                    "Capping duration of {} from {}s to {}s",
                    entry.filename(),
                    probed,
                    maxVideoDurationSeconds);
            return maxVideoDurationSeconds;
        }
        return probed;
    }

    @Override
    public TimedCatalog resolveAll(Catalog catalog) {
        List<TimedMediaEntry> timed = new ArrayList<>(catalog.size());
        for (MediaEntry entry : catalog.entries()) {
            timed.add(new TimedMediaEntry(entry, resolve(entry)));
        }
        return new TimedCatalog(catalog.directory(), timed, catalog.fingerprint());
    }
}
