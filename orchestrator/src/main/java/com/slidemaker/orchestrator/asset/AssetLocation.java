package com.slidemaker.orchestrator.asset;

import java.nio.file.Path;

/** Where a stored asset ended up. */
public record AssetLocation(Path path, long sizeBytes) {

    /** The reference written into page artifacts. */
    public String reference() {
        return path.toString();
    }
}
