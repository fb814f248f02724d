package github.sarthakdev143.signage_engine.integration.presentation;

import github.sarthakdev143.signage_engine.model.SceneItemTransform;
import github.sarthakdev143.signage_engine.model.SourceKind;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Request surface of the external scene-graph controller (for example OBS Studio over its WebSocket API).
 * Implementations own the connection and bound every call with their own timeout.
 */
public interface PresentationController {

    void createScene(String sceneName) throws PresentationException;

    void removeScene(String sceneName) throws PresentationException;

    List<String> listScenes() throws PresentationException;

    void setActiveScene(String sceneName) throws PresentationException;

    void createSource(String sceneName, String sourceName, SourceKind kind, Map<String, Object> settings)
            throws PresentationException;

    void removeSource(String sourceName) throws PresentationException;

    List<String> listSources() throws PresentationException;

    void setSourceMuted(String sourceName, boolean muted) throws PresentationException;

    /**
     * @return the scene-item id of {@code sourceName} inside {@code sceneName}, or empty when the controller
     * does not know the item
     */
    OptionalInt getSourceItemId(String sceneName, String sourceName) throws PresentationException;

    void setSourceTransform(String sceneName, int sceneItemId, SceneItemTransform transform)
            throws PresentationException;

    void setTransitionStyle(String transitionName) throws PresentationException;
}
