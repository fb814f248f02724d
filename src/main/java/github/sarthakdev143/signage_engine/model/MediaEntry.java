package github.sarthakdev143.signage_engine.model;

import java.nio.file.Path;
import java.util.Objects;

public record MediaEntry(
        String filename,
        Path path,
        MediaKind kind,
        long sizeBytes,
        long modifiedMillis) {

    private static final String SCENE_SUFFIX = "_scene";
    private static final String SOURCE_SUFFIX = "_source";

    public MediaEntry {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
    }

    public static String sceneNameFor(String filename) {
        return filename + SCENE_SUFFIX;
    }

    public static String sourceNameFor(String filename) {
        return filename + SOURCE_SUFFIX;
    }

    public static String filenameOfSource(String sourceName) {
        if (!isSourceName(sourceName)) {
            return sourceName;
        }
        return sourceName.substring(0, sourceName.length() - SOURCE_SUFFIX.length());
    }

    public static boolean isSceneName(String name) {
        return name != null && name.endsWith(SCENE_SUFFIX);
    }

    public static boolean isSourceName(String name) {
        return name != null && name.endsWith(SOURCE_SUFFIX);
    }

    public String sceneName() {
        return sceneNameFor(filename);
    }

    public String sourceName() {
        return sourceNameFor(filename);
    }

    public boolean isVideo() {
        return kind == MediaKind.VIDEO;
    }

    public boolean isImage() {
        return kind == MediaKind.IMAGE;
    }

    /**
     * Triple used by the catalog fingerprint: {@code filename:size:mtime}.
     */
    public String fingerprintToken() {
        return filename + ":" + sizeBytes + ":" + modifiedMillis;
    }

    /**
     * Identifies the file content a scene was built from. A change means the scene must be recreated.
     */
    public String revision() {
        return path.toAbsolutePath().normalize() + ":" + sizeBytes + ":" + modifiedMillis;
    }
}
