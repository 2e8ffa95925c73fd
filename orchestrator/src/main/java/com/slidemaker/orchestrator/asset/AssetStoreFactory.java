package com.slidemaker.orchestrator.asset;

@FunctionalInterface
public interface AssetStoreFactory {

    AssetStore open(String runId);
}
