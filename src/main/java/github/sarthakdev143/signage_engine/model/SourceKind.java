package github.sarthakdev143.signage_engine.model;

public enum SourceKind {
    IMAGE_SOURCE("image_source"),
    MEDIA_SOURCE("ffmpeg_source");

    private final String apiValue;

    SourceKind(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }

    public static SourceKind forMedia(MediaKind kind) {
        return switch (kind) {
            case IMAGE -> IMAGE_SOURCE;
            case VIDEO -> MEDIA_SOURCE;
            case AUDIO -> throw new IllegalArgumentException("Audio media is not shown as a scene source.");
        };
    }
}
