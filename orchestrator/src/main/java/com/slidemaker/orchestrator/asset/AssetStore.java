package com.slidemaker.orchestrator.asset;

import java.nio.file.Path;

/**
 * Run-scoped staging area for generated and extracted assets.
 *
 * Safe to call from several fan-out tasks at once.
 */
public interface AssetStore {

    /**
     * Stores {@code bytes} at {@code destination}, relative to {@link #root()}.
     * A destination that resolves outside the root, or a write past the size
     * or count ceilings, is rejected with {@code RESOURCE_BOUNDARY}.
     */
    AssetWriteResult write(byte[] bytes, String destination);

    Path root();

    /** Removes the staging area and everything in it. */
    void discard();
}
