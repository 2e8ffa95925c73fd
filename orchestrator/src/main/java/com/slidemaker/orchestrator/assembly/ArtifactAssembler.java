package com.slidemaker.orchestrator.assembly;

import com.slidemaker.orchestrator.asset.AssetLocation;
import com.slidemaker.orchestrator.model.Background;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Points image elements at the assets that were actually stored.
 *
 * Matching is by exact asset id. An element whose asset was never produced
 * (generation disabled, task failed, no region) keeps its original
 * reference. Page and element order are untouched.
 */
@Component
public class ArtifactAssembler {

    private static final Logger log = LoggerFactory.getLogger(ArtifactAssembler.class);

    public List<PageArtifact> assemble(List<PageArtifact> pages, Map<String, AssetLocation> assets) {
        int rewritten = 0;
        int unresolved = 0;

        for (PageArtifact page : pages) {
            for (ImageElement image : page.imageElements()) {
                AssetLocation location = image.getAssetId() == null ? null : assets.get(image.getAssetId());
                if (location != null) {
                    image.setSource(location.reference());
                    rewritten++;
                } else if (image.getSource().isEmpty()) {
                    unresolved++;
                }
            }

            Background background = page.getBackground();
            if (background.kind() == Background.Kind.IMAGE && assets.containsKey(background.imageRef())) {
                page.setBackground(Background.image(assets.get(background.imageRef()).reference()));
                rewritten++;
            }
        }

        if (unresolved > 0) {
            log.warn("{} image element(s) have no asset and no source", unresolved);
        }
        log.info("Assembled {} page(s): {} asset reference(s) rewritten from {} stored asset(s)",
                pages.size(), rewritten, assets.size());
        return List.copyOf(pages);
    }
}
