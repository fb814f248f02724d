package github.sarthakdev143.signage_engine.service.impl;

import github.sarthakdev143.signage_engine.config.SignageProperties;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationController;
import github.sarthakdev143.signage_engine.integration.presentation.PresentationException;
import github.sarthakdev143.signage_engine.model.ManagedState;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.ReconciliationResult;
import github.sarthakdev143.signage_engine.model.SceneItemTransform;
import github.sarthakdev143.signage_engine.model.SourceKind;
import github.sarthakdev143.signage_engine.model.TimedCatalog;
import github.sarthakdev143.signage_engine.model.TimedMediaEntry;
import github.sarthakdev143.signage_engine.service.SceneReconciler;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@Service
public class DefaultSceneReconciler implements SceneReconciler {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSceneReconciler.class);
    private static final List<String> LEGACY_SCENE_MARKERS = List.of("slideshow", "digital_signage");

    private final PresentationController controller;
    private final MeterRegistry meterRegistry;
    private final String placeholderScene;
    private final SceneItemTransform transform;

    public DefaultSceneReconciler(
            PresentationController controller,
            SignageProperties properties,
            MeterRegistry meterRegistry) {
        this.controller = controller;
        this.meterRegistry = meterRegistry;
        this.placeholderScene = properties.placeholderScene();
        this.transform = SceneItemTransform.fitCanvas(properties.canvas().width(), properties.canvas().height());
    }

    @Override
    public ReconciliationResult apply(ManagedState previous, TimedCatalog catalog) {
        Tally tally = new Tally();
        ManagedState.Builder state = previous.toBuilder();
        boolean fullSweep = previous.isEmpty();

        ensurePlaceholder(tally);
        if (fullSweep) {
            bootstrapSweep(tally);
        }

        Map<String, TimedMediaEntry> desired = new LinkedHashMap<>();
        for (TimedMediaEntry entry : catalog.entries()) {
            desired.put(entry.sceneName(), entry);
        }

        removeStale(previous, state, desired, tally);
        for (TimedMediaEntry entry : catalog.entries()) {
            if (!state.managesScene(entry.sceneName())) {
                create(state, entry, tally);
            }
        }

        if (catalog.isEmpty()) {
            call("set_active_scene", tally, () -> controller.setActiveScene(placeholderScene));
        }
        sweepOrphans(state, tally);

        ReconciliationResult result = new ReconciliationResult(
                state.build(),
                fullSweep,
                tally.scenesCreated,
                tally.scenesRemoved,
                tally.sourcesRemoved,
                tally.orphansRemoved,
                tally.failures);
        logger.info(
                "Reconciled {} entries fullSweep={} created={} removed={} sourcesRemoved={} orphans={} failures={}",
                catalog.size(),
                fullSweep,
                result.scenesCreated(),
                result.scenesRemoved(),
                result.sourcesRemoved(),
                result.orphansRemoved(),
                result.failedOperations());
        return result;
    }

    @Override
    public ManagedState removeEntry(ManagedState current, String filename) {
        Tally tally = new Tally();
        ManagedState.Builder state = current.toBuilder();
        String sceneName = MediaEntry.sceneNameFor(filename);
        String sourceName = MediaEntry.sourceNameFor(filename);

        if (state.managesScene(sceneName) && call("remove_scene", tally, () -> controller.removeScene(sceneName))) {
            state.removeScene(sceneName);
        }
        if (state.managesSource(sourceName) && call("remove_source", tally, () -> controller.removeSource(sourceName))) {
            state.removeSource(sourceName);
        }
        logger.info("Removed scene and source of {} (failures={})", filename, tally.failures);
        return state.build();
    }

    private void ensurePlaceholder(Tally tally) {
        Optional<List<String>> scenes = list("list_scenes", tally, controller::listScenes);
        if (scenes.isPresent() && !scenes.get().contains(placeholderScene)) {
            call("create_scene", tally, () -> controller.createScene(placeholderScene));
        }
    }

    /**
     * Deletes everything that looks engine-made. Runs when nothing is known about earlier runs, for example
     * after a crash.
     */
    private void bootstrapSweep(Tally tally) {
        logger.info("No managed state; sweeping leftover scenes and sources");

        for (String source : list("list_sources", tally, controller::listSources).orElse(List.of())) {
            if (MediaEntry.isSourceName(source) && call("remove_source", tally, () -> controller.removeSource(source))) {
                tally.sourcesRemoved++;
            }
        }
        for (String scene : list("list_scenes", tally, controller::listScenes).orElse(List.of())) {
            if (scene.equals(placeholderScene) || !looksEngineMade(scene)) {
                continue;
            }
            if (call("remove_scene", tally, () -> controller.removeScene(scene))) {
                tally.scenesRemoved++;
            }
        }
    }

    private void removeStale(
            ManagedState previous,
            ManagedState.Builder state,
            Map<String, TimedMediaEntry> desired,
            Tally tally) {
        for (String scene : state.scenes()) {
            TimedMediaEntry wanted = desired.get(scene);
            if (wanted != null && previous.revisionOf(scene).equals(Optional.of(wanted.entry().revision()))) {
                continue;
            }
            if (call("remove_scene", tally, () -> controller.removeScene(scene))) {
                state.removeScene(scene);
                tally.scenesRemoved++;
            }
        }

        for (String source : state.sources()) {
            String scene = MediaEntry.sceneNameFor(MediaEntry.filenameOfSource(source));
            if (state.managesScene(scene)) {
                continue;
            }
            if (call("remove_source", tally, () -> controller.removeSource(source))) {
                state.removeSource(source);
                tally.sourcesRemoved++;
            }
        }
    }

    private void create(ManagedState.Builder state, TimedMediaEntry timed, Tally tally) {
        MediaEntry entry = timed.entry();
        String sceneName = entry.sceneName();
        String sourceName = entry.sourceName();
        if (state.managesSource(sourceName)) {
            logger.warn("Source {} is still present from an earlier run; retrying next cycle", sourceName);
            return;
        }

        if (!call("create_scene", tally, () -> controller.createScene(sceneName))) {
            return;
        }
        state.addScene(sceneName);
        tally.scenesCreated++;

        SourceKind kind = SourceKind.forMedia(entry.kind());
        if (!call("create_source", tally, () -> controller.createSource(sceneName, sourceName, kind, settingsFor(entry)))) {
            return;
        }
        state.addSource(sourceName);
        state.recordRevision(sceneName, entry.revision());

        if (entry.isVideo()) {
            call("mute_source", tally, () -> controller.setSourceMuted(sourceName, true));
        }
        applyTransform(sceneName, sourceName, tally);
    }

    private void applyTransform(String sceneName, String sourceName, Tally tally) {
        Optional<OptionalInt> itemId = list("get_scene_item_id", tally,
                () -> controller.getSourceItemId(sceneName, sourceName));
        if (itemId.isEmpty()) {
            return;
        }
        if (itemId.get().isEmpty()) {
            logger.error("No scene item for {} in {}; leaving it untransformed", sourceName, sceneName);
            return;
        }
        int id = itemId.get().getAsInt();
        call("set_transform", tally, () -> controller.setSourceTransform(sceneName, id, transform));
    }

    private void sweepOrphans(ManagedState.Builder state, Tally tally) {
        for (String scene : list("list_scenes", tally, controller::listScenes).orElse(List.of())) {
            if (scene.equals(placeholderScene) || state.managesScene(scene)) {
                continue;
            }
            if (call("remove_scene", tally, () -> controller.removeScene(scene))) {
                logger.info("Removed orphan scene {}", scene);
                tally.orphansRemoved++;
            }
        }
    }

    static Map<String, Object> settingsFor(MediaEntry entry) {
        Map<String, Object> settings = new LinkedHashMap<>();
        String file = entry.path().toAbsolutePath().toString();
        if (entry.isVideo()) {
            settings.put("local_file", file);
            settings.put("looping", false);
            settings.put("restart_on_activate", true);
            settings.put("clear_on_media_end", false);
        } else {
            settings.put("file", file);
            settings.put("unload", false);
        }
        return settings;
    }

    private static boolean looksEngineMade(String scene) {
        if (MediaEntry.isSceneName(scene)) {
            return true;
        }
        String lower = scene.toLowerCase(Locale.ROOT);
        return LEGACY_SCENE_MARKERS.stream().anyMatch(lower::contains);
    }

    private boolean call(String operation, Tally tally, ControllerCall call) {
        try {
            call.run();
            return true;
        } catch (PresentationException | RuntimeException e) {
            recordFailure(operation, tally, e);
            return false;
        }
    }

    private <T> Optional<T> list(String operation, Tally tally, ControllerQuery<T> query) {
        try {
            return Optional.ofNullable(query.get());
        } catch (PresentationException | RuntimeException e) {
            recordFailure(operation, tally, e);
            return Optional.empty();
        }
    }

    private void recordFailure(String operation, Tally tally, Exception e) {
        tally.failures++;
        meterRegistry.counter("signage.controller.failures", "operation", operation).increment();
        logger.warn("Controller call {} failed: {}", operation, e.getMessage());
    }

    @FunctionalInterface
    private interface ControllerCall {
        void run() throws PresentationException;
    }

    @FunctionalInterface
    private interface ControllerQuery<T> {
        T get() throws PresentationException;
    }

    private static final class Tally {
        private int scenesCreated;
        private int scenesRemoved;
        private int sourcesRemoved;
        private int orphansRemoved;
        private int failures;
    }
}
