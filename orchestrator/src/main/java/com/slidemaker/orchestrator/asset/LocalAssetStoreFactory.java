package com.slidemaker.orchestrator.asset;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;

/** Opens one {@link LocalAssetStore} per run under {@code <staging-root>/<runId>}. */
@Component
public class LocalAssetStoreFactory implements AssetStoreFactory {

    private final Path     stagingRoot;
    private final DataSize maxAssetSize;
    private final int      maxAssetCount;

    public LocalAssetStoreFactory(@Value("${slidemaker.storage.staging-root:${java.io.tmpdir}/slidemaker}") Path stagingRoot,
                                  @Value("${slidemaker.storage.max-asset-size:20MB}") DataSize maxAssetSize,
                                  @Value("${slidemaker.storage.max-asset-count:500}") int maxAssetCount) {
        this.stagingRoot   = stagingRoot;
        this.maxAssetSize  = maxAssetSize;
        this.maxAssetCount = maxAssetCount;
    }

    @Override
    public AssetStore open(String runId) {
        return new LocalAssetStore(stagingRoot.resolve(runId), maxAssetSize.toBytes(), maxAssetCount);
    }
}
