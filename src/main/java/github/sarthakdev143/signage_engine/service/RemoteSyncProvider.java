package github.sarthakdev143.signage_engine.service;

import java.io.IOException;

public interface RemoteSyncProvider {

    /**
     * Brings the local content folders up to date with the remote copy. Files removed remotely are reported
     * to {@code removalListener} before they are deleted locally.
     *
     * @return true when any local file was added, replaced or removed
     */
    boolean synchronize(ContentRemovalListener removalListener) throws IOException;
}
