package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.model.ContentSnapshot;
import github.sarthakdev143.signage_engine.model.ScheduleWindow;

public interface ContentRefreshService extends ContentRemovalListener {

    /**
     * Runs one scan/reconcile cycle on the calling thread. Cycles never overlap.
     *
     * @param forced reconcile even when the catalog fingerprint is unchanged
     * @return true when the cycle published a new snapshot
     */
    boolean refresh(boolean forced);

    /**
     * Queues a refresh. Requests arriving while one is already queued are merged into it.
     */
    void requestRescan(String reason);

    /**
     * Points the next refresh at the folder of {@code window} and applies its transition style. Does not
     * schedule a refresh.
     */
    void useWindow(ScheduleWindow window);

    /**
     * Switches to the folder and transition of {@code window} and queues a forced refresh.
     */
    void activateWindow(ScheduleWindow window);

    /**
     * True when the last reconciliation or removal left controller work undone. The next refresh will not skip
     * reconciliation while this holds.
     */
    boolean reconciliationPending();

    ScheduleWindow activeWindow();

    ContentSnapshot currentSnapshot();
}
