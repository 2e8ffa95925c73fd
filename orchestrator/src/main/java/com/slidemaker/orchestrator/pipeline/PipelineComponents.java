package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.assembly.ArtifactAssembler;
import com.slidemaker.orchestrator.asset.AssetStoreFactory;
import com.slidemaker.orchestrator.coordinator.ConcurrencyCoordinator;
import com.slidemaker.orchestrator.gateway.ModelGateway;
import com.slidemaker.orchestrator.geometry.CoordinateNormalizer;
import com.slidemaker.orchestrator.parser.StructuredOutputParser;
import com.slidemaker.orchestrator.render.DocumentRenderer;
import com.slidemaker.orchestrator.runner.StepRunner;
import io.micrometer.core.instrument.MeterRegistry;

/** The collaborators every pipeline variant shares. */
public record PipelineComponents(StepRunner stepRunner,
                                 ConcurrencyCoordinator coordinator,
                                 StructuredOutputParser parser,
                                 CoordinateNormalizer normalizer,
                                 ArtifactAssembler assembler,
                                 DocumentRenderer renderer,
                                 AssetStoreFactory assetStores,
                                 ModelGateway gateway,
                                 MeterRegistry meterRegistry) {
}
