package github.sarthakdev143.signage_engine.dto;

import java.time.Instant;

public record SignageStatusResponse(
        String window,
        String folder,
        String transition,
        boolean rotationActive,
        int currentIndex,
        String currentEntry,
        int catalogSize,
        int managedScenes,
        Instant publishedAt) {
}
