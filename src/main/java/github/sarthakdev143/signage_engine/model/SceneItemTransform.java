package github.sarthakdev143.signage_engine.model;

/**
 * Placement of a source inside its scene. {@link #fitCanvas(int, int)} scales the source inside the
 * canvas while keeping its aspect ratio and centers it.
 */
public record SceneItemTransform(
        double positionX,
        double positionY,
        int alignment,
        double scaleX,
        double scaleY,
        int cropLeft,
        int cropTop,
        int cropRight,
        int cropBottom,
        BoundsType boundsType,
        int boundsAlignment,
        double boundsWidth,
        double boundsHeight) {

    /** OBS alignment flags: 0 means centered on both axes. */
    public static final int ALIGN_CENTER = 0;

    public enum BoundsType {
        SCALE_INNER("OBS_BOUNDS_SCALE_INNER");

        private final String apiValue;

        BoundsType(String apiValue) {
            this.apiValue = apiValue;
        }

        public String apiValue() {
            return apiValue;
        }
    }

    public static SceneItemTransform fitCanvas(int canvasWidth, int canvasHeight) {
        if (canvasWidth <= 0 || canvasHeight <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive.");
        }
        return new SceneItemTransform(
                canvasWidth / 2.0,
                canvasHeight / 2.0,
                ALIGN_CENTER,
                1.0,
                1.0,
                0,
                0,
                0,
                0,
                BoundsType.SCALE_INNER,
                ALIGN_CENTER,
                canvasWidth,
                canvasHeight);
    }
}
