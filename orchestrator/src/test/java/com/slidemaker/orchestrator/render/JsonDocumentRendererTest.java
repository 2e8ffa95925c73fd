package com.slidemaker.orchestrator.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidemaker.orchestrator.model.Alignment;
import com.slidemaker.orchestrator.model.Background;
import com.slidemaker.orchestrator.model.DeckSettings;
import com.slidemaker.orchestrator.model.FitMode;
import com.slidemaker.orchestrator.model.FontStyle;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.model.Position;
import com.slidemaker.orchestrator.model.RgbColor;
import com.slidemaker.orchestrator.model.Size;
import com.slidemaker.orchestrator.model.SlideSize;
import com.slidemaker.orchestrator.model.TextElement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonDocumentRendererTest {

    @TempDir
    Path dir;

    private final ObjectMapper json = new ObjectMapper();
    private final JsonDocumentRenderer renderer = new JsonDocumentRenderer(json);

    @Test
    void render_writesPagesInOrderWithTypedElements() throws Exception {
        DeckSettings settings = DeckSettings.of(SlideSize.WIDESCREEN_16_9, "dark");
        PageArtifact first = new PageArtifact(1, "Intro", "say hi", List.of(
                new TextElement(new Position(10, 20), new Size(300, 80), 1, 1.0, "Hello",
                        new FontStyle("Georgia", 40, new RgbColor(255, 0, 0), true, false, false),
                        Alignment.CENTER, 1.2)),
                Background.color(RgbColor.BLACK), settings.canonicalSpace());
        ImageElement image = new ImageElement(new Position(0, 0), new Size(100, 100), 0, 0.5,
                "hero", "/staging/hero.png", FitMode.COVER, "sunrise", "a sunrise");
        PageArtifact second = new PageArtifact(2, "Picture", null, List.of(image), null, settings.canonicalSpace());

        RenderedDocument doc = renderer.render(List.of(first, second), settings, dir.resolve("out/deck.json"));

        assertThat(doc.pageCount()).isEqualTo(2);
        assertThat(doc.path()).exists();
        assertThat(doc.sizeBytes()).isEqualTo(Files.size(doc.path()));

        JsonNode root = json.readTree(doc.path().toFile());
        assertThat(root.path("format").asText()).isEqualTo("slidemaker-deck");
        assertThat(root.path("settings").path("slide_size").asText()).isEqualTo("16:9");
        assertThat(root.path("canvas").path("width").asInt()).isEqualTo(1920);

        JsonNode pages = root.path("pages");
        assertThat(pages.get(0).path("title").asText()).isEqualTo("Intro");
        assertThat(pages.get(1).path("title").asText()).isEqualTo("Picture");
        assertThat(pages.get(1).has("notes")).isFalse();

        JsonNode text = pages.get(0).path("elements").get(0);
        assertThat(text.path("type").asText()).isEqualTo("text");
        assertThat(text.path("font").path("color").asText()).isEqualTo("#FF0000");
        assertThat(text.path("alignment").asText()).isEqualTo("center");
        assertThat(text.path("z_index").asInt()).isEqualTo(1);

        JsonNode img = pages.get(1).path("elements").get(0);
        assertThat(img.path("type").asText()).isEqualTo("image");
        assertThat(img.path("source").asText()).isEqualTo("/staging/hero.png");
        assertThat(img.path("fit_mode").asText()).isEqualTo("cover");
        assertThat(img.has("generation_prompt")).isFalse();
    }

    @Test
    void render_existingFile_isReplacedWithoutLeftovers() throws Exception {
        Path target = Files.writeString(dir.resolve("deck.json"), "stale");

        renderer.render(List.of(), DeckSettings.of(null, null), target);

        assertThat(Files.readString(target)).contains("\"pages\"");
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(target);
        }
    }
}
