package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.model.ManagedState;
import github.sarthakdev143.signage_engine.model.ReconciliationResult;
import github.sarthakdev143.signage_engine.model.TimedCatalog;

public interface SceneReconciler {

    /**
     * Brings the controller's scenes in line with {@code catalog}. An empty {@code previous} state triggers a
     * full sweep of everything that looks like it was created by this engine.
     */
    ReconciliationResult apply(ManagedState previous, TimedCatalog catalog);

    /**
     * Removes the scene and source of a single file, if this engine manages them.
     */
    ManagedState removeEntry(ManagedState current, String filename);
}
