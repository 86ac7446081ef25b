package com.assetsync.local;

import com.assetsync.domain.model.LocalDataset;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Loads and persists the local asset register.
 */
public interface LocalDatasetStore {

    /**
     * @throws com.assetsync.exception.PreconditionFailedException if the file is missing or unreadable
     */
    LocalDataset load(Path path);

    /**
     * Fails before any row is processed when a required column header is absent.
     *
     * @throws com.assetsync.exception.PreconditionFailedException listing every missing column
     */
    void requireColumns(LocalDataset dataset, Collection<String> requiredColumns);

    /**
     * Writes modified cells back to the dataset's file. Callers only invoke this when
     * {@link LocalDataset#isModified()} is true.
     */
    void save(LocalDataset dataset);
}
