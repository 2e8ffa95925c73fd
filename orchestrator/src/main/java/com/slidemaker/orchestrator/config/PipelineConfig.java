package com.slidemaker.orchestrator.config;

import com.slidemaker.orchestrator.assembly.ArtifactAssembler;
import com.slidemaker.orchestrator.asset.AssetStoreFactory;
import com.slidemaker.orchestrator.coordinator.ConcurrencyCoordinator;
import com.slidemaker.orchestrator.gateway.ModelGateway;
import com.slidemaker.orchestrator.geometry.CoordinateNormalizer;
import com.slidemaker.orchestrator.parser.StructuredOutputParser;
import com.slidemaker.orchestrator.pipeline.PipelineComponents;
import com.slidemaker.orchestrator.pipeline.PipelinePolicies;
import com.slidemaker.orchestrator.render.DocumentRenderer;
import com.slidemaker.orchestrator.runner.RetryPolicy;
import com.slidemaker.orchestrator.runner.StepRunner;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds the {@code slidemaker.pipeline.*} and {@code slidemaker.output.*}
 * properties into the objects the pipelines are built from.
 *
 * Stages and per-call steps share the attempt budget and backoff; only
 * per-call steps get the timeout. Rendering runs once.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public PipelinePolicies pipelinePolicies(
            @Value("${slidemaker.pipeline.concurrency:3}") int concurrency,
            @Value("${slidemaker.pipeline.max-attempts:3}") int maxAttempts,
            @Value("${slidemaker.pipeline.base-delay:1s}") Duration baseDelay,
            @Value("${slidemaker.pipeline.backoff-multiplier:2.0}") double multiplier,
            @Value("${slidemaker.pipeline.step-timeout:120s}") Duration stepTimeout,
            @Value("${slidemaker.pipeline.finalize-attempts:1}") int finalizeAttempts,
            @Value("${slidemaker.output.root:.}") Path outputRoot) {

        RetryPolicy stagePolicy = RetryPolicy.of(maxAttempts, baseDelay, multiplier);
        PipelinePolicies policies = new PipelinePolicies(
                concurrency,
                stagePolicy,
                stagePolicy.withTimeout(stepTimeout),
                stagePolicy.withMaxAttempts(finalizeAttempts),
                outputRoot);

        log.info("Pipeline policies: concurrency={}, attempts={}, base delay={} ms, x{}, call timeout={} s, output root={}",
                concurrency, maxAttempts, baseDelay.toMillis(), multiplier, stepTimeout.toSeconds(),
                policies.outputRoot());
        return policies;
    }

    @Bean
    public PipelineComponents pipelineComponents(StepRunner stepRunner,
                                                 ConcurrencyCoordinator coordinator,
                                                 StructuredOutputParser parser,
                                                 CoordinateNormalizer normalizer,
                                                 ArtifactAssembler assembler,
                                                 DocumentRenderer renderer,
                                                 AssetStoreFactory assetStores,
                                                 ModelGateway gateway,
                                                 MeterRegistry meterRegistry) {
        return new PipelineComponents(stepRunner, coordinator, parser, normalizer, assembler,
                renderer, assetStores, gateway, meterRegistry);
    }
}
