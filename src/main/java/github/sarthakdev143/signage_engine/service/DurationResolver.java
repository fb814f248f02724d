package github.sarthakdev143.signage_engine.service;

import github.sarthakdev143.signage_engine.model.Catalog;
import github.sarthakdev143.signage_engine.model.MediaEntry;
import github.sarthakdev143.signage_engine.model.TimedCatalog;

public interface DurationResolver {

    double resolve(MediaEntry entry);

    /**
     * Resolves every entry of the catalog. Never fails because of a single file.
     */
    TimedCatalog resolveAll(Catalog catalog);
}
