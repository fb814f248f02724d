package github.sarthakdev143.signage_engine.model;

public enum MediaKind {
    IMAGE,
    VIDEO,
    AUDIO;

    public boolean isRotatable() {
        return this != AUDIO;
    }
}
