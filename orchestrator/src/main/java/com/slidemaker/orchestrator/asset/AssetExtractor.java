package com.slidemaker.orchestrator.asset;

import com.slidemaker.orchestrator.input.InputUnit;

/** Cuts a region out of a raster input unit and returns it encoded. */
public interface AssetExtractor {

    byte[] extract(InputUnit unit, AssetRequest.Region region);
}
