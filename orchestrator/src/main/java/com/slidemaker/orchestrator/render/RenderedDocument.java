package com.slidemaker.orchestrator.render;

import java.nio.file.Path;

public record RenderedDocument(Path path, int pageCount, long sizeBytes) {
}
