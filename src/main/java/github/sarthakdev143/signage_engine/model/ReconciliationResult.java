package github.sarthakdev143.signage_engine.model;

public record ReconciliationResult(
        ManagedState managedState,
        boolean fullSweep,
        int scenesCreated,
        int scenesRemoved,
        int sourcesRemoved,
        int orphansRemoved,
        int failedOperations) {

    public int operationsIssued() {
        return scenesCreated + scenesRemoved + sourcesRemoved + orphansRemoved;
    }
}
