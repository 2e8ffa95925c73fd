package com.slidemaker.orchestrator.render;

import com.slidemaker.orchestrator.model.DeckSettings;
import com.slidemaker.orchestrator.model.PageArtifact;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes the final document. Pages arrive assembled and in canonical space;
 * the renderer must keep their order.
 */
public interface DocumentRenderer {

    RenderedDocument render(List<PageArtifact> pages, DeckSettings settings, Path output);
}
