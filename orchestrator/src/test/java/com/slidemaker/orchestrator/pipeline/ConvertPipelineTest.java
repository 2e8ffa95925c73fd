package com.slidemaker.orchestrator.pipeline;

import com.slidemaker.orchestrator.asset.RegionAssetExtractor;
import com.slidemaker.orchestrator.error.ErrorRecord;
import com.slidemaker.orchestrator.gateway.GatewayException;
import com.slidemaker.orchestrator.gateway.GenerationRequest;
import com.slidemaker.orchestrator.gateway.ModelGateway;
import com.slidemaker.orchestrator.input.ImageInputLoader;
import com.slidemaker.orchestrator.input.InputLoaderRegistry;
import com.slidemaker.orchestrator.input.OutlineInputLoader;
import com.slidemaker.orchestrator.input.PdfInputLoader;
import com.slidemaker.orchestrator.model.ElementRecord;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.model.Position;
import com.slidemaker.orchestrator.model.Size;
import com.slidemaker.orchestrator.model.TextElement;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConvertPipelineTest {

    /** One heading and one photo, laid out on an 800x600 slide image. */
    private static final String ANALYSIS = """
            {
              "title": "Quarterly results",
              "background": { "type": "color", "value": "#FFFFFF" },
              "elements": [
                { "type": "text", "content": "Quarterly results",
                  "position": { "x": 40, "y": 30 }, "size": { "width": 720, "height": 60 },
                  "style": { "font_family": "Helvetica", "font_size": 32,
                             "color": { "red": 20, "green": 20, "blue": 20 }, "alignment": "center" } },
                { "type": "image", "id": "photo", "description": "team photo",
                  "position": { "x": 100, "y": 100 }, "size": { "width": 200, "height": 150 } }
              ]
            }
            """;

    /** The same image id as {@link #ANALYSIS}, at a different spot on a 400x300 slide. */
    private static final String SMALL_PHOTO = """
            {
              "title": "Team",
              "elements": [
                { "type": "image", "id": "photo", "description": "team photo",
                  "position": { "x": 50, "y": 50 }, "size": { "width": 100, "height": 60 } }
              ]
            }
            """;

    @TempDir Path dir;
    @Mock ModelGateway gateway;

    PipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture(dir);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ConvertPipeline pipeline() {
        InputLoaderRegistry loaders = new InputLoaderRegistry(List.of(
                new OutlineInputLoader(), new ImageInputLoader(), new PdfInputLoader(72)));
        return new ConvertPipeline(fixture.components(gateway), fixture.policies, loaders, new RegionAssetExtractor());
    }

    private static Path writePng(Path path, int width, int height) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ImageIO.write(image, "png", path.toFile());
        return path;
    }

    private static Path writePdf(Path path, PDRectangle... pages) throws Exception {
        try (PDDocument document = new PDDocument()) {
            for (PDRectangle page : pages) {
                document.addPage(new PDPage(page));
            }
            document.save(path.toFile());
        }
        return path;
    }

    // ------------------------------------------------------------------
    // Single image
    // ------------------------------------------------------------------

    @Test
    void execute_slideImage_normalizesPageAndExtractsPhoto() throws Exception {
        Path slide = writePng(dir.resolve("slide.png"), 800, 600);
        when(gateway.generate(any())).thenReturn(ANALYSIS);

        PipelineRun run = pipeline().execute(slide, Path.of("slide.json"), PipelineOptions.defaults());

        assertThat(run.getState()).isEqualTo(PipelineState.COMPLETED);
        assertThat(run.getPages()).singleElement().satisfies(page -> {
            assertThat(page.getTitle()).isEqualTo("Quarterly results");
            assertThat(page.getSpace().width()).isEqualTo(1920);
        });

        List<ElementRecord> elements = run.getPages().get(0).getElements();
        assertThat(elements.get(0)).isInstanceOf(TextElement.class);
        ImageElement photo = (ImageElement) elements.get(1);
        assertThat(photo.getAssetId()).isEqualTo("page1_photo");
        assertThat(photo.getPosition()).isEqualTo(new Position(240, 180));
        assertThat(photo.getSize()).isEqualTo(new Size(480, 270));

        // the crop is taken in the source image's pixels, before normalization
        Path crop = fixture.staging(run).resolve("extracted/page1_photo.png");
        assertThat(photo.getSource()).isEqualTo(crop.toString());
        BufferedImage stored = ImageIO.read(crop.toFile());
        assertThat(stored.getWidth()).isEqualTo(200);
        assertThat(stored.getHeight()).isEqualTo(150);
        assertThat(run.documentOrThrow().path()).exists();
    }

    @Test
    void execute_sendsImageWithItsPixelSpace() throws Exception {
        Path slide = writePng(dir.resolve("slide.png"), 800, 600);
        when(gateway.generate(any())).thenReturn(ANALYSIS);

        pipeline().execute(slide, Path.of("slide.json"), PipelineOptions.defaults());

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(gateway).generate(captor.capture());
        assertThat(captor.getValue().hasImage()).isTrue();
        assertThat(captor.getValue().image().mediaType()).isEqualTo("image/png");
        assertThat(captor.getValue().prompt()).contains("800x600");
    }

    @Test
    void execute_extractionDisabled_keepsPhotoUnresolved() throws Exception {
        Path slide = writePng(dir.resolve("slide.png"), 800, 600);
        when(gateway.generate(any())).thenReturn(ANALYSIS);

        PipelineRun run = pipeline().execute(slide, Path.of("slide.json"),
                PipelineOptions.defaults().withExtractImages(false));

        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getPages().get(0).imageElements()).extracting(ImageElement::getSource).containsExactly("");
        assertThat(fixture.staging(run).resolve("extracted")).doesNotExist();
    }

    // ------------------------------------------------------------------
    // Multi-page PDF
    // ------------------------------------------------------------------

    @Test
    void execute_pdfWithOneFailingPage_completesWithoutThatPage() throws Exception {
        Path pdf = writePdf(dir.resolve("deck.pdf"), new PDRectangle(800, 600), new PDRectangle(400, 300));
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("800x600")))).thenReturn(ANALYSIS);
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("400x300"))))
                .thenThrow(new GatewayException(GatewayException.Kind.SERVER_ERROR, 500, "boom", null));

        PipelineRun run = pipeline().execute(pdf, Path.of("deck.json"), PipelineOptions.defaults());

        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getDegraded()).containsExactly("describe:page-2");
        assertThat(run.getPages()).extracting(PageArtifact::getPageNumber).containsExactly(1);
        assertThat(fixture.json.readTree(run.documentOrThrow().path().toFile()).path("pages")).hasSize(1);
    }

    @Test
    void execute_pagesReusingAnImageId_eachGetTheirOwnCrop() throws Exception {
        Path pdf = writePdf(dir.resolve("deck.pdf"), new PDRectangle(800, 600), new PDRectangle(400, 300));
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("800x600")))).thenReturn(ANALYSIS);
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("400x300")))).thenReturn(SMALL_PHOTO);

        PipelineRun run = pipeline().execute(pdf, Path.of("deck.json"), PipelineOptions.defaults());

        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getDegraded()).isEmpty();
        ImageElement first = run.getPages().get(0).imageElements().get(0);
        ImageElement second = run.getPages().get(1).imageElements().get(0);
        assertThat(first.getAssetId()).isEqualTo("page1_photo");
        assertThat(second.getAssetId()).isEqualTo("page2_photo");
        assertThat(first.getSource()).isEqualTo(fixture.staging(run).resolve("extracted/page1_photo.png").toString());
        assertThat(second.getSource()).isEqualTo(fixture.staging(run).resolve("extracted/page2_photo.png").toString());

        BufferedImage firstCrop = ImageIO.read(Path.of(first.getSource()).toFile());
        BufferedImage secondCrop = ImageIO.read(Path.of(second.getSource()).toFile());
        assertThat(firstCrop.getWidth()).isEqualTo(200);
        assertThat(firstCrop.getHeight()).isEqualTo(150);
        assertThat(secondCrop.getWidth()).isEqualTo(100);
        assertThat(secondCrop.getHeight()).isEqualTo(60);
    }

    @Test
    void execute_badCredentialsAfterAGoodPage_failsAtDescribeWithoutRetrying() throws Exception {
        Path pdf = writePdf(dir.resolve("deck.pdf"), new PDRectangle(800, 600), new PDRectangle(400, 300));
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("800x600")))).thenReturn(ANALYSIS);
        when(gateway.generate(argThat(r -> r != null && r.prompt().contains("400x300"))))
                .thenThrow(new GatewayException(GatewayException.Kind.AUTHENTICATION, 401, "invalid x-api-key", null));

        PipelineRun run = pipeline().execute(pdf, Path.of("deck.json"),
                PipelineOptions.defaults().withConcurrency(1));

        assertThat(run.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(run.getStage()).isEqualTo(PipelineStage.DESCRIBE);
        assertThat(run.getErrorRecord()).get().satisfies(record -> {
            assertThat(record.attempt()).isEqualTo(1);
            assertThat(record.cause()).hasRootCauseInstanceOf(GatewayException.class);
            assertThat(record.cause().getCause()).isInstanceOfSatisfying(GatewayException.class,
                    e -> assertThat(e.getKind()).isEqualTo(GatewayException.Kind.AUTHENTICATION));
        });
        verify(gateway, times(2)).generate(any());
        assertThat(fixture.staging(run)).doesNotExist();
    }

    @Test
    void execute_everyPageFails_retriesStageThenFailsAtDescribe() throws Exception {
        Path pdf = writePdf(dir.resolve("deck.pdf"), new PDRectangle(800, 600));
        when(gateway.generate(any())).thenReturn("no json here");

        PipelineRun run = pipeline().execute(pdf, Path.of("deck.json"), PipelineOptions.defaults());

        assertThat(run.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(run.getStage()).isEqualTo(PipelineStage.DESCRIBE);
        assertThat(run.getErrorRecord()).get().extracting(ErrorRecord::attempt).isEqualTo(3);
        // three stage attempts, each retrying the page call three times
        verify(gateway, times(9)).generate(any());
        assertThat(fixture.staging(run)).doesNotExist();
    }

    @Test
    void execute_badCredentials_cancelsRemainingPages() throws Exception {
        Path pdf = writePdf(dir.resolve("deck.pdf"),
                new PDRectangle(800, 600), new PDRectangle(800, 600), new PDRectangle(800, 600));
        when(gateway.generate(any())).thenThrow(
                new GatewayException(GatewayException.Kind.AUTHENTICATION, 401, "invalid x-api-key", null));

        PipelineRun run = pipeline().execute(pdf, Path.of("deck.json"),
                PipelineOptions.defaults().withConcurrency(1));

        assertThat(run.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(run.getStage()).isEqualTo(PipelineStage.DESCRIBE);
        verify(gateway, times(1)).generate(any());
    }

    // ------------------------------------------------------------------
    // Ingest
    // ------------------------------------------------------------------

    @Test
    void execute_outlineInput_isRejectedAtIngest() throws Exception {
        Path outline = Files.writeString(dir.resolve("talk.md"), "# Not a slide");

        PipelineRun run = pipeline().execute(outline, Path.of("deck.json"), PipelineOptions.defaults());

        assertThat(run.getStage()).isEqualTo(PipelineStage.INGEST);
        assertThat(run.getErrorRecord()).get().extracting(ErrorRecord::attempt).isEqualTo(1);
        verify(gateway, never()).generate(any());
    }

    @Test
    void execute_missingInput_isRejectedAtIngest() {
        PipelineRun run = pipeline().execute(dir.resolve("missing.pdf"), Path.of("deck.json"),
                PipelineOptions.defaults());

        assertThat(run.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(run.getStage()).isEqualTo(PipelineStage.INGEST);
        assertThat(run.getDocument()).isEmpty();
    }
}
