package github.sarthakdev143.signage_engine.integration.presentation;

import github.sarthakdev143.signage_engine.model.SceneItemTransform;
import github.sarthakdev143.signage_engine.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Keeps the scene graph in memory and logs every request. Used when no real controller is wired in, so the
 * engine can run dry against a content folder.
 */
public class InMemoryPresentationController implements PresentationController {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPresentationController.class);

    private final Set<String> scenes = new LinkedHashSet<>();
    private final Map<String, SourceRecord> sources = new LinkedHashMap<>();
    private final Map<String, SceneItemTransform> transforms = new LinkedHashMap<>();
    private int nextSceneItemId = 1;
    private String activeScene;
    private String transitionStyle;

    public record SourceRecord(
            String sceneName,
            SourceKind kind,
            Map<String, Object> settings,
            int sceneItemId,
            boolean muted) {

        public SourceRecord {
            settings = settings == null ? Map.of() : Map.copyOf(settings);
        }

        SourceRecord withMuted(boolean value) {
            return new SourceRecord(sceneName, kind, settings, sceneItemId, value);
        }
    }

    @Override
    public synchronized void createScene(String sceneName) throws PresentationException {
        if (!scenes.add(sceneName)) {
            throw new PresentationException("Scene already exists: " + sceneName);
        }
        logger.info("[dry-run] created scene {}", sceneName);
    }

    @Override
    public synchronized void removeScene(String sceneName) throws PresentationException {
        if (!scenes.remove(sceneName)) {
            throw new PresentationException("No such scene: " + sceneName);
        }
        if (sceneName.equals(activeScene)) {
            activeScene = null;
        }
        logger.info("[dry-run] removed scene {}", sceneName);
    }

    @Override
    public synchronized List<String> listScenes() {
        return List.copyOf(scenes);
    }

    @Override
    public synchronized void setActiveScene(String sceneName) throws PresentationException {
        if (!scenes.contains(sceneName)) {
            throw new PresentationException("No such scene: " + sceneName);
        }
        activeScene = sceneName;
        logger.info("[dry-run] program scene is now {}", sceneName);
    }

    @Override
    public synchronized void createSource(
            String sceneName,
            String sourceName,
            SourceKind kind,
            Map<String, Object> settings) throws PresentationException {
        if (!scenes.contains(sceneName)) {
            throw new PresentationException("No such scene: " + sceneName);
        }
        if (sources.containsKey(sourceName)) {
            throw new PresentationException("Source already exists: " + sourceName);
        }
        sources.put(sourceName, new SourceRecord(sceneName, kind, settings, nextSceneItemId++, false));
        logger.info("[dry-run] created {} source {} in {}", kind.apiValue(), sourceName, sceneName);
    }

    @Override
    public synchronized void removeSource(String sourceName) throws PresentationException {
        if (sources.remove(sourceName) == null) {
            throw new PresentationException("No such source: " + sourceName);
        }
        transforms.remove(sourceName);
        logger.info("[dry-run] removed source {}", sourceName);
    }

    @Override
    public synchronized List<String> listSources() {
        return List.copyOf(sources.keySet());
    }

    @Override
    public synchronized void setSourceMuted(String sourceName, boolean muted) throws PresentationException {
        SourceRecord source = sources.get(sourceName);
        if (source == null) {
            throw new PresentationException("No such source: " + sourceName);
        }
        sources.put(sourceName, source.withMuted(muted));
    }

    @Override
    public synchronized OptionalInt getSourceItemId(String sceneName, String sourceName) {
        SourceRecord source = sources.get(sourceName);
        if (source == null || !source.sceneName().equals(sceneName) || !scenes.contains(sceneName)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(source.sceneItemId());
    }

    @Override
    public synchronized void setSourceTransform(String sceneName, int sceneItemId, SceneItemTransform transform)
            throws PresentationException {
        String sourceName = null;
        for (Map.Entry<String, SourceRecord> entry : sources.entrySet()) {
            if (entry.getValue().sceneItemId() == sceneItemId && entry.getValue().sceneName().equals(sceneName)) {
                sourceName = entry.getKey();
                break;
            }
        }
        if (sourceName == null) {
            throw new PresentationException("No scene item " + sceneItemId + " in scene " + sceneName);
        }
        transforms.put(sourceName, transform);
    }

    @Override
    public synchronized void setTransitionStyle(String transitionName) {
        transitionStyle = transitionName;
        logger.info("[dry-run] transition set to {}", transitionName);
    }

    public synchronized Optional<String> activeScene() {
        return Optional.ofNullable(activeScene);
    }

    public synchronized Optional<String> transitionStyle() {
        return Optional.ofNullable(transitionStyle);
    }

    public synchronized Optional<SourceRecord> source(String sourceName) {
        return Optional.ofNullable(sources.get(sourceName));
    }

    public synchronized Optional<SceneItemTransform> transformOf(String sourceName) {
        return Optional.ofNullable(transforms.get(sourceName));
    }

    public synchronized List<String> sceneNames() {
        return new ArrayList<>(scenes);
    }
}
