package com.slidemaker.orchestrator.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidemaker.orchestrator.model.DeckSettings;
import com.slidemaker.orchestrator.model.PageArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the deck as a JSON document that a presentation writer can
 * consume. Written to a sibling temp file first and moved into place, so a
 * failed render never leaves a truncated document behind.
 *
 * Shape:
 * <pre>
 *   { "format": "slidemaker-deck", "version": 1,
 *     "settings": { slide_size, theme, default_font, default_background },
 *     "canvas":   { width, height },
 *     "pages":    [ { page_number, title, background, elements: [...] } ] }
 * </pre>
 */
@Component
public class JsonDocumentRenderer implements DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentRenderer.class);

    public static final String FORMAT  = "slidemaker-deck";
    public static final int    VERSION = 1;

    private final ObjectMapper json;

    public JsonDocumentRenderer(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    @Override
    public RenderedDocument render(List<PageArtifact> pages, DeckSettings settings, Path output) {
        Map<String, Object> settingsNode = new LinkedHashMap<>();
        settingsNode.put("slide_size",         settings.slideSize());
        settingsNode.put("theme",              settings.theme());
        settingsNode.put("default_font",       settings.defaultFont());
        settingsNode.put("default_background", settings.defaultBackground());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("format",   FORMAT);
        document.put("version",  VERSION);
        document.put("settings", settingsNode);
        document.put("canvas",   settings.canonicalSpace());
        document.put("pages",    pages);

        Path target = output.toAbsolutePath().normalize();
        try {
            if (target.getParent() != null) Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                json.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            long size = Files.size(target);
            log.info("Rendered {} page(s) to {} ({} bytes)", pages.size(), target, size);
            return new RenderedDocument(target, pages.size(), size);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not render document to " + target, e);
        }
    }
}
