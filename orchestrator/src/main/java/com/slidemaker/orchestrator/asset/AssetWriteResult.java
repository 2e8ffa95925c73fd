package com.slidemaker.orchestrator.asset;

import com.slidemaker.orchestrator.error.PipelineException;

/**
 * Either a stored asset or the reason it was rejected. A rejected write
 * leaves nothing on disk.
 */
public record AssetWriteResult(AssetLocation location, PipelineException rejection) {

    public static AssetWriteResult stored(AssetLocation location) {
        return new AssetWriteResult(location, null);
    }

    public static AssetWriteResult rejected(PipelineException rejection) {
        return new AssetWriteResult(null, rejection);
    }

    public boolean isStored() {
        return location != null;
    }

    public AssetLocation orElseThrow() {
        if (rejection != null) throw rejection;
        return location;
    }
}
