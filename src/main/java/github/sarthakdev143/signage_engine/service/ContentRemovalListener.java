package github.sarthakdev143.signage_engine.service;

import java.nio.file.Path;

/**
 * Told about a single media file that is about to disappear from the local content folders.
 */
public interface ContentRemovalListener {

    void onContentRemoved(Path file);
}
