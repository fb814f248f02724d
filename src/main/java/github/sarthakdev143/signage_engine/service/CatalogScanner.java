package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.model.Catalog;

import java.io.IOException;
import java.nio.file.Path;

public interface CatalogScanner {

    /**
     * Lists the rotation-eligible media directly inside {@code directory}. Single unreadable files are skipped.
     *
     * @throws IOException when the directory itself cannot be listed
     */
    Catalog scan(Path directory) throws IOException;
}
