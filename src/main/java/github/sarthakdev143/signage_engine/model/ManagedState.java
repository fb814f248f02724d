package github.sarthakdev143.signage_engine.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scenes and sources this engine created on the presentation controller. Anything outside this value is
 * only deleted by a full sweep.
 */
public record ManagedState(
        Set<String> scenes,
        Set<String> sources,
        Map<String, String> revisions) {

    private static final ManagedState EMPTY = new ManagedState(Set.of(), Set.of(), Map.of());

    public ManagedState {
        scenes = scenes == null ? Set.of() : Set.copyOf(scenes);
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        revisions = revisions == null ? Map.of() : Map.copyOf(revisions);
    }

    public static ManagedState empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return scenes.isEmpty() && sources.isEmpty();
    }

    public boolean managesScene(String sceneName) {
        return scenes.contains(sceneName);
    }

    public boolean managesSource(String sourceName) {
        return sources.contains(sourceName);
    }

    public Optional<String> revisionOf(String sceneName) {
        return Optional.ofNullable(revisions.get(sceneName));
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(EMPTY);
    }

    /**
     * Mutable working copy used while a reconciliation is in flight. Each successful controller call is
     * recorded immediately so partial failures leave an accurate state behind.
     */
    public static final class Builder {

        private final Set<String> scenes;
        private final Set<String> sources;
        private final Map<String, String> revisions;

        private Builder(ManagedState seed) {
            this.scenes = new LinkedHashSet<>(seed.scenes());
            this.sources = new LinkedHashSet<>(seed.sources());
            this.revisions = new LinkedHashMap<>(seed.revisions());
        }

        public Builder addScene(String sceneName) {
            scenes.add(sceneName);
            return this;
        }

        public Builder removeScene(String sceneName) {
            scenes.remove(sceneName);
            revisions.remove(sceneName);
            return this;
        }

        public Builder addSource(String sourceName) {
            sources.add(sourceName);
            return this;
        }

        public Builder removeSource(String sourceName) {
            sources.remove(sourceName);
            return this;
        }

        public Builder recordRevision(String sceneName, String revision) {
            revisions.put(sceneName, revision);
            return this;
        }

        public Set<String> scenes() {
            return Set.copyOf(scenes);
        }

        public Set<String> sources() {
            return Set.copyOf(sources);
        }

        public boolean managesScene(String sceneName) {
            return scenes.contains(sceneName);
        }

        public boolean managesSource(String sourceName) {
            return sources.contains(sourceName);
        }

        public ManagedState build() {
            return new ManagedState(scenes, sources, revisions);
        }
    }
}
