package github.sarthakdev143.signage_engine.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public record MediaExtensions(
        Set<String> video,
        Set<String> image,
        Set<String> audio) {

    public MediaExtensions {
        video = normalize(video);
        image = normalize(image);
        audio = normalize(audio);
        requireDisjoint("video", video, "image", image);
        requireDisjoint("video", video, "audio", audio);
        requireDisjoint("image", image, "audio", audio);
    }

    public Optional<MediaKind> classify(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }

        String extension = filename.substring(dot).toLowerCase(Locale.ROOT);
        if (video.contains(extension)) {
            return Optional.of(MediaKind.VIDEO);
        }
        if (image.contains(extension)) {
            return Optional.of(MediaKind.IMAGE);
        }
        if (audio.contains(extension)) {
            return Optional.of(MediaKind.AUDIO);
        }
        return Optional.empty();
    }

    public boolean isSupported(String filename) {
        return classify(filename).isPresent();
    }

    private static Set<String> normalize(Set<String> extensions) {
        if (extensions == null) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String value = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(value.startsWith(".") ? value : "." + value);
        }
        return Set.copyOf(normalized);
    }

    private static void requireDisjoint(String leftName, Set<String> left, String rightName, Set<String> right) {
        for (String extension : left) {
            if (right.contains(extension)) {
                throw new IllegalArgumentException(
                        "Extension " + extension + " is configured for both " + leftName + " and " + rightName + " media.");
            }
        }
    }
}
