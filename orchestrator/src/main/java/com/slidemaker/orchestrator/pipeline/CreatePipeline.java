package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.asset.AssetLocation;
import com.slidemaker.orchestrator.asset.AssetRequest;
import com.slidemaker.orchestrator.coordinator.ConcurrencyCoordinator;
import com.slidemaker.orchestrator.coordinator.TaskRequest;
import com.slidemaker.orchestrator.coordinator.TaskResult;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.gateway.GenerationRequest;
import com.slidemaker.orchestrator.gateway.ImageRequest;
import com.slidemaker.orchestrator.input.InputLoaderRegistry;
import com.slidemaker.orchestrator.input.InputUnit;
import com.slidemaker.orchestrator.input.OutlineInputLoader;
import com.slidemaker.orchestrator.model.DeckDescription;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.prompt.PromptTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outline in, composed deck out.
 *
 *   INGEST    read the outline as one unit
 *   DESCRIBE  one composition call; parse, normalize to the deck canvas,
 *             collect the images the model asked to have generated
 *   ENRICH    when enabled, generate those images with bounded concurrency
 *             and store them; a failed image leaves its element unresolved
 */
@Service
public class CreatePipeline extends AbstractPipeline {

    private static final Logger log = LoggerFactory.getLogger(CreatePipeline.class);

    private final OutlineInputLoader outlineLoader;

    public CreatePipeline(PipelineComponents components, PipelinePolicies policies,
                          OutlineInputLoader outlineLoader) {
        super(PipelineVariant.CREATE, components, policies, policies.taskPolicy());
        this.outlineLoader = outlineLoader;
    }

    // ------------------------------------------------------------------
    // INGEST
    // ------------------------------------------------------------------

    @Override
    protected void ingest(PipelineContext context) {
        InputLoaderRegistry.requireReadableFile(context.getInput());
        String ext = InputLoaderRegistry.extensionOf(context.getInput());
        if (!outlineLoader.extensions().contains(ext)) {
            throw PipelineException.invalidInput(
                    "Unsupported outline format '%s'; expected one of %s".formatted(ext, outlineLoader.extensions()),
                    Map.of("input", context.getInput().toString()));
        }
        context.setUnits(outlineLoader.load(context.getInput()));
    }

    // ------------------------------------------------------------------
    // DESCRIBE
    // ------------------------------------------------------------------

    @Override
    protected void describe(PipelineContext context) {
        InputUnit outline = context.getUnits().get(0);
        String raw = components.gateway().generate(GenerationRequest.text(
                PromptTemplates.COMPOSITION_SYSTEM,
                PromptTemplates.composition(outline.text(), context.getSettings())));

        DeckDescription deck = components.parser().parseDeck(raw, context.getSettings());
        for (PageArtifact page : deck.pages()) {
            components.normalizer().normalizePage(page, deck.settings().canonicalSpace());
        }

        context.setSettings(deck.settings());
        context.setPages(deck.pages());
        context.setAssetRequests(generationRequests(deck.pages()));
        log.info("Composed {} page(s) with {} image(s) to generate",
                deck.pages().size(), context.getAssetRequests().size());
    }

    /** One request per distinct asset id; elements sharing an id share the image. */
    private static List<AssetRequest> generationRequests(List<PageArtifact> pages) {
        Map<String, AssetRequest> requests = new LinkedHashMap<>();
        for (PageArtifact page : pages) {
            for (ImageElement image : page.imageElements()) {
                if (image.requestsGeneration()) {
                    requests.putIfAbsent(image.getAssetId(), AssetRequest.generation(
                            image.getAssetId(), image.getGenerationPrompt(), ImageRequest.DEFAULT_SIZE));
                }
            }
        }
        return List.copyOf(requests.values());
    }

    // ------------------------------------------------------------------
    // ENRICH
    // ------------------------------------------------------------------

    @Override
    protected void enrich(PipelineContext context) {
        List<AssetRequest> requests = context.getAssetRequests();
        if (!context.getOptions().generateImages() || requests.isEmpty()) {
            log.info("Image generation skipped ({} request(s), enabled={})",
                    requests.size(), context.getOptions().generateImages());
            context.setAssets(Map.of());
            return;
        }

        List<TaskRequest<AssetRequest>> tasks = requests.stream()
                .map(r -> new TaskRequest<>(r.assetId(), r))
                .toList();
        Map<String, TaskResult<AssetLocation>> results = fanOut(context, tasks,
                task -> generateAsset(context, task.payload()));

        context.setAssets(ConcurrencyCoordinator.successfulValues(results));
        context.setDegraded(PipelineStage.ENRICH, ConcurrencyCoordinator.failedIds(results));
    }

    private AssetLocation generateAsset(PipelineContext context, AssetRequest request) {
        String prompt = PromptTemplates.imageGeneration(request.prompt(), context.getSettings());
        byte[] image = callExternal(context, "enrich.generate", () -> components.gateway().generateImage(
                new ImageRequest(request.assetId(), prompt, request.imageSize())));
        return context.getAssetStore()
                .write(image, "generated/" + request.fileStem() + ".png")
                .orElseThrow();
    }
}
