package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.asset.AssetExtractor;
import com.slidemaker.orchestrator.asset.AssetLocation;
import com.slidemaker.orchestrator.asset.AssetRequest;
import com.slidemaker.orchestrator.coordinator.ConcurrencyCoordinator;
import com.slidemaker.orchestrator.coordinator.TaskRequest;
import com.slidemaker.orchestrator.coordinator.TaskResult;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.gateway.GenerationRequest;
import com.slidemaker.orchestrator.input.InputLoaderRegistry;
import com.slidemaker.orchestrator.input.InputUnit;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.prompt.PromptTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PDF or slide image in, editable deck out.
 *
 *   INGEST    rasterize the input into one image unit per page
 *   DESCRIBE  analyse every page concurrently; each answer is parsed in the
 *             page's pixel space, picture regions are noted, then the page is
 *             normalized to the deck canvas. A page whose analysis fails is
 *             left out and recorded as degraded, unless the failure cancels
 *             the run (bad credentials), which fails the stage outright
 *   ENRICH    crop the noted regions out of their source pages and store them
 */
@Service
public class ConvertPipeline extends AbstractPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConvertPipeline.class);

    private final InputLoaderRegistry loaders;
    private final AssetExtractor      extractor;

    public ConvertPipeline(PipelineComponents components, PipelinePolicies policies,
                           InputLoaderRegistry loaders, AssetExtractor extractor) {
        super(PipelineVariant.CONVERT, components, policies, policies.stagePolicy());
        this.loaders   = loaders;
        this.extractor = extractor;
    }

    /** A page as analysed, with the regions to extract recorded before normalization. */
    record DescribedPage(PageArtifact page, List<AssetRequest> extractions) {}

    // ------------------------------------------------------------------
    // INGEST
    // ------------------------------------------------------------------

    @Override
    protected void ingest(PipelineContext context) {
        List<InputUnit> units = loaders.forSource(context.getInput()).load(context.getInput());
        for (InputUnit unit : units) {
            if (!unit.isImage()) {
                throw PipelineException.invalidInput(
                        "Convert needs PDF or image input; %s is %s".formatted(unit.id(), unit.mediaType()),
                        Map.of("input", context.getInput().toString()));
            }
        }
        context.setUnits(units);
    }

    // ------------------------------------------------------------------
    // DESCRIBE
    // ------------------------------------------------------------------

    @Override
    protected void describe(PipelineContext context) {
        List<TaskRequest<InputUnit>> tasks = context.getUnits().stream()
                .map(unit -> new TaskRequest<>(unit.id(), unit))
                .toList();
        Map<String, TaskResult<DescribedPage>> results = fanOut(context, tasks,
                task -> describePage(context, task.payload()));

        List<PageArtifact> pages = new ArrayList<>();
        Map<String, AssetRequest> extractions = new LinkedHashMap<>();
        for (DescribedPage described : ConcurrencyCoordinator.successfulValues(results).values()) {
            pages.add(described.page());
            described.extractions().forEach(r -> extractions.putIfAbsent(r.assetId(), r));
        }
        List<String> failed = ConcurrencyCoordinator.failedIds(results);

        context.setPages(pages);
        context.setAssetRequests(List.copyOf(extractions.values()));
        context.setDegraded(PipelineStage.DESCRIBE, failed);
        log.info("Described {} of {} page(s); {} region(s) to extract",
                pages.size(), tasks.size(), extractions.size());
    }

    private DescribedPage describePage(PipelineContext context, InputUnit unit) {
        PageArtifact page = callExternal(context, "describe.page", () -> {
            String raw = components.gateway().generate(GenerationRequest.withImage(
                    PromptTemplates.ANALYSIS_SYSTEM,
                    PromptTemplates.analysis(unit.space()),
                    unit.content(), unit.mediaType()));
            return components.parser().parsePage(raw, unit.index() + 1, unit.space());
        });

        List<AssetRequest> extractions = new ArrayList<>();
        for (ImageElement image : page.imageElements()) {
            extractions.add(AssetRequest.extraction(image.getAssetId(), unit.id(), new AssetRequest.Region(
                    image.getPosition().x(), image.getPosition().y(),
                    image.getSize().width(), image.getSize().height())));
        }

        components.normalizer().normalizePage(page, context.getSettings().canonicalSpace());
        return new DescribedPage(page, extractions);
    }

    // ------------------------------------------------------------------
    // ENRICH
    // ------------------------------------------------------------------

    @Override
    protected void enrich(PipelineContext context) {
        List<AssetRequest> requests = context.getAssetRequests();
        if (!context.getOptions().extractImages() || requests.isEmpty()) {
            log.info("Image extraction skipped ({} region(s), enabled={})",
                    requests.size(), context.getOptions().extractImages());
            context.setAssets(Map.of());
            return;
        }

        List<TaskRequest<AssetRequest>> tasks = requests.stream()
                .map(r -> new TaskRequest<>(r.assetId(), r))
                .toList();
        Map<String, TaskResult<AssetLocation>> results = fanOut(context, tasks,
                task -> extractAsset(context, task.payload()));

        context.setAssets(ConcurrencyCoordinator.successfulValues(results));
        context.setDegraded(PipelineStage.ENRICH, ConcurrencyCoordinator.failedIds(results));
    }

    private AssetLocation extractAsset(PipelineContext context, AssetRequest request) {
        byte[] crop = extractor.extract(context.unit(request.unitId()), request.region());
        return context.getAssetStore()
                .write(crop, "extracted/" + request.fileStem() + ".png")
                .orElseThrow();
    }
}
