package com.slidemaker.orchestrator.asset;

/**
 * A pending asset: either generated from a prompt, or cut out of an input
 * unit. Exactly one of {@code prompt} / {@code region} is set.
 *
 * @param assetId key shared with the {@code ImageElement} that will receive it
 * @param unitId  input unit to extract from; null for generated assets
 */
public record AssetRequest(String assetId, String unitId, String prompt, String imageSize, Region region) {

    /** A rectangle in the input unit's own pixel space. */
    public record Region(int x, int y, int width, int height) {}

    public static AssetRequest generation(String assetId, String prompt, String imageSize) {
        return new AssetRequest(assetId, null, prompt, imageSize, null);
    }

    public static AssetRequest extraction(String assetId, String unitId, Region region) {
        return new AssetRequest(assetId, unitId, null, null, region);
    }

    /** The asset id reduced to characters safe in a file name. */
    public String fileStem() {
        return assetId.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
