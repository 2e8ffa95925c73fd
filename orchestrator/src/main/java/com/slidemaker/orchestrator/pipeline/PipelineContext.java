package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.asset.AssetLocation;
import com.slidemaker.orchestrator.asset.AssetRequest;
import com.slidemaker.orchestrator.asset.AssetStore;
import com.slidemaker.orchestrator.coordinator.CancellationSignal;
import com.slidemaker.orchestrator.input.InputUnit;
import com.slidemaker.orchestrator.model.DeckSettings;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.render.RenderedDocument;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Working state of one run, handed from stage to stage.
 *
 * Each stage replaces what it produces wholesale, so a retried stage starts
 * from the previous stage's output rather than from its own partial result.
 */
public class PipelineContext {

    private final String             runId;
    private final Path               input;
    private final PipelineOptions    options;
    private final int                concurrency;
    private final AssetStore         assetStore;
    private final CancellationSignal cancellation = new CancellationSignal();

    private Path                       output;
    private DeckSettings               settings;
    private List<InputUnit>            units         = List.of();
    private List<PageArtifact>         pages         = List.of();
    private List<AssetRequest>         assetRequests = List.of();
    private Map<String, AssetLocation> assets        = Map.of();
    private final List<String>         degraded      = new ArrayList<>();
    private RenderedDocument           document;

    public PipelineContext(String runId, Path input, Path output, PipelineOptions options,
                           int concurrency, AssetStore assetStore) {
        this.runId       = runId;
        this.input       = input;
        this.output      = output;
        this.options     = options;
        this.concurrency = concurrency;
        this.assetStore  = assetStore;
        this.settings    = DeckSettings.of(options.slideSize(), options.theme());
    }

    // ------------------------------------------------------------------
    // Fixed for the whole run
    // ------------------------------------------------------------------

    public String getRunId()                   { return runId; }
    public Path getInput()                     { return input; }
    public Path getOutput()                    { return output; }
    public PipelineOptions getOptions()        { return options; }
    public int getConcurrency()                { return concurrency; }
    public AssetStore getAssetStore()          { return assetStore; }
    public CancellationSignal getCancellation() { return cancellation; }

    // ------------------------------------------------------------------
    // Stage outputs
    // ------------------------------------------------------------------

    public DeckSettings getSettings()                 { return settings; }
    public List<InputUnit> getUnits()                 { return units; }
    public List<PageArtifact> getPages()              { return pages; }
    public List<AssetRequest> getAssetRequests()      { return assetRequests; }
    public Map<String, AssetLocation> getAssets()     { return assets; }
    public List<String> getDegraded()                 { return List.copyOf(degraded); }
    public Optional<RenderedDocument> getDocument()   { return Optional.ofNullable(document); }

    public void setOutput(Path output)                        { this.output = output; }
    public void setSettings(DeckSettings settings)            { this.settings = settings; }
    public void setUnits(List<InputUnit> units)               { this.units = List.copyOf(units); }
    public void setPages(List<PageArtifact> pages)            { this.pages = List.copyOf(pages); }
    public void setAssetRequests(List<AssetRequest> requests) { this.assetRequests = List.copyOf(requests); }
    public void setAssets(Map<String, AssetLocation> assets)  { this.assets = new LinkedHashMap<>(assets); }
    public void setDocument(RenderedDocument document)        { this.document = document; }

    /** Replaces the degraded ids recorded by {@code stage}. */
    public void setDegraded(PipelineStage stage, List<String> ids) {
        String prefix = stage.stepName() + ":";
        degraded.removeIf(id -> id.startsWith(prefix));
        ids.forEach(id -> degraded.add(prefix + id));
    }

    public InputUnit unit(String unitId) {
        return units.stream()
                .filter(u -> u.id().equals(unitId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No input unit '" + unitId + "'"));
    }
}
