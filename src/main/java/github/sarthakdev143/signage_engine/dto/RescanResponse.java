package github.sarthakdev143.signage_engine.dto;

public record RescanResponse(
        boolean accepted,
        String message) {
}
