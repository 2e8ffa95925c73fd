package com.slidemaker.orchestrator.prompt;

import com.slidemaker.orchestrator.model.CoordinateSpace;
import com.slidemaker.orchestrator.model.DeckSettings;

/**
 * Prompt text sent to the model gateway.
 *
 * Each prompt pins down three things:
 *   1. The pixel space coordinates must be expressed in
 *   2. The exact JSON shape expected back
 *   3. That nothing but that JSON should be returned
 *
 * The shapes here are the ones {@code StructuredOutputParser} reads.
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    // ------------------------------------------------------------------
    // Composition (create pipeline)
    // ------------------------------------------------------------------

    public static final String COMPOSITION_SYSTEM = """
            You design slide decks. Given an outline, you lay out every slide as a set of
            positioned text and image elements. You answer with JSON only, no commentary.
            """;

    private static final String COMPOSITION_USER = """
            Turn the outline below into a slide deck.

            Canvas: {{WIDTH}}x{{HEIGHT}} pixels, origin at the top-left corner.
            Theme: {{THEME}}

            Return one JSON object of this shape:
            {
              "slide_config": { "size": "{{SIZE}}", "width": {{WIDTH}}, "height": {{HEIGHT}}, "theme": "{{THEME}}" },
              "pages": [
                {
                  "title": "...",
                  "notes": "speaker notes, optional",
                  "background_color": "#RRGGBB",
                  "elements": [
                    { "type": "text", "content": "...",
                      "position": { "x": 0, "y": 0 }, "size": { "width": 0, "height": 0 },
                      "font": { "family": "Arial", "size": 24, "color": "#000000",
                                "bold": false, "italic": false, "underline": false },
                      "alignment": "left|center|right|justify", "z_index": 0 },
                    { "type": "image", "id": "unique-id",
                      "position": { "x": 0, "y": 0 }, "size": { "width": 0, "height": 0 },
                      "generate": true, "prompt": "what the image should show",
                      "alt_text": "...", "fit_mode": "contain|cover|fill", "z_index": 0 }
                  ]
                }
              ]
            }

            Keep every element inside the canvas. Give each image a unique id.

            OUTLINE:
            {{OUTLINE}}
            """;

    public static String composition(String outline, DeckSettings settings) {
        CoordinateSpace canvas = settings.canonicalSpace();
        return COMPOSITION_USER
                .replace("{{WIDTH}}",   String.valueOf(canvas.width()))
                .replace("{{HEIGHT}}",  String.valueOf(canvas.height()))
                .replace("{{SIZE}}",    settings.slideSize().label())
                .replace("{{THEME}}",   settings.theme())
                .replace("{{OUTLINE}}", outline.strip());
    }

    // ------------------------------------------------------------------
    // Page analysis (convert pipeline)
    // ------------------------------------------------------------------

    public static final String ANALYSIS_SYSTEM = """
            You reverse-engineer slide images into editable layouts. You locate every text
            block and every picture, and report their pixel geometry and styling.
            You answer with JSON only, no commentary.
            """;

    private static final String ANALYSIS_USER = """
            The attached image is one slide, {{WIDTH}}x{{HEIGHT}} pixels, origin at the top-left.
            Report all of its elements in that pixel space.

            Return one JSON object of this shape:
            {
              "title": "slide title if there is one",
              "background": { "type": "color", "value": "#RRGGBB" },
              "elements": [
                { "type": "text", "content": "exact text",
                  "position": { "x": 0, "y": 0 }, "size": { "width": 0, "height": 0 },
                  "style": { "font_family": "Arial", "font_size": 24,
                             "color": { "red": 0, "green": 0, "blue": 0 },
                             "bold": false, "italic": false, "underline": false,
                             "alignment": "left" },
                  "z_index": 0 },
                { "type": "image", "description": "what the picture shows",
                  "position": { "x": 0, "y": 0 }, "size": { "width": 0, "height": 0 },
                  "z_index": 0 }
              ]
            }

            Use the bounding box of each picture, not of its surrounding whitespace.
            """;

    public static String analysis(CoordinateSpace imageSpace) {
        return ANALYSIS_USER
                .replace("{{WIDTH}}",  String.valueOf(imageSpace.width()))
                .replace("{{HEIGHT}}", String.valueOf(imageSpace.height()));
    }

    // ------------------------------------------------------------------
    // Image generation
    // ------------------------------------------------------------------

    public static String imageGeneration(String description, DeckSettings settings) {
        return """
                %s

                Clean presentation artwork for a %s slide in the "%s" theme. No text in the image."""
                .formatted(description.strip(), settings.slideSize().label(), settings.theme());
    }
}
