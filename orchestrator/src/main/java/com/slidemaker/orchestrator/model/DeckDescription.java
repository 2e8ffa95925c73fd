package com.slidemaker.orchestrator.model;

import java.util.List;

/**
 * Parsed composition response: deck settings plus pages still expressed in
 * the space the model declared.
 */
public record DeckDescription(DeckSettings settings, CoordinateSpace declaredSpace, List<PageArtifact> pages) {

    public DeckDescription {
        pages = List.copyOf(pages);
    }
}
