package com.slidemaker.orchestrator.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.Alignment;
import com.slidemaker.orchestrator.model.Background;
import com.slidemaker.orchestrator.model.CoordinateSpace;
import com.slidemaker.orchestrator.model.DeckDescription;
import com.slidemaker.orchestrator.model.DeckSettings;
import com.slidemaker.orchestrator.model.ElementRecord;
import com.slidemaker.orchestrator.model.ElementType;
import com.slidemaker.orchestrator.model.FitMode;
import com.slidemaker.orchestrator.model.FontStyle;
import com.slidemaker.orchestrator.model.ImageElement;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.model.Position;
import com.slidemaker.orchestrator.model.RgbColor;
import com.slidemaker.orchestrator.model.Size;
import com.slidemaker.orchestrator.model.SlideSize;
import com.slidemaker.orchestrator.model.TextElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into typed page artifacts.
 *
 * Only the top-level shape is strict: a composition without a {@code pages}
 * array, or a page description without an {@code elements} array, is a
 * {@code VALIDATION} failure. Everything below that degrades locally:
 * <ul>
 *   <li>unknown element type: element dropped</li>
 *   <li>missing or non-numeric position/size, non-positive size: element dropped</li>
 *   <li>color channels clamped to [0, 255]; unreadable colors fall back to the default</li>
 *   <li>font size clamped to [1, 200], opacity to [0, 1]</li>
 *   <li>absent optional fields take their documented defaults</li>
 * </ul>
 * Every drop is logged with the page and element index.
 *
 * Image elements without an {@code id} get {@code page<N>_elem<I>}, where
 * {@code I} is the element's index in the raw array, so asset ids are stable
 * and unique across a deck. In a composition a model-supplied id is kept as
 * is, and elements sharing it share one image. A single-page description is
 * produced without knowledge of the other pages, so its ids are prefixed with
 * {@code page<N>_}.
 */
@Component
public class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    private static final double MAX_LINE_SPACING = 3.0;

    private final ObjectMapper json;

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Pulls the JSON payload out of a model response. Accepts a bare object,
     * a fenced code block, or an object surrounded by prose.
     */
    public JsonNode extractJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PipelineException(PipelineException.Kind.VALIDATION, "Model response is empty");
        }

        String candidate = raw.strip();
        Matcher fenced = FENCED_BLOCK.matcher(candidate);
        if (fenced.find()) {
            candidate = fenced.group(1).strip();
        } else if (!candidate.startsWith("{") && !candidate.startsWith("[")) {
            int start = candidate.indexOf('{');
            int end   = candidate.lastIndexOf('}');
            if (start < 0 || end <= start) {
                throw new PipelineException(PipelineException.Kind.VALIDATION,
                        "No JSON object found in model response",
                        Map.of("preview", preview(raw)));
            }
            candidate = candidate.substring(start, end + 1);
        }

        try {
            return json.readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new PipelineException(PipelineException.Kind.VALIDATION,
                    "Model response is not valid JSON: " + e.getOriginalMessage(),
                    Map.of("preview", preview(raw)), e);
        }
    }

    /**
     * Parses a whole-deck composition.
     *
     * @param base settings requested by the caller; a {@code slide_config.theme}
     *             in the response overrides the theme, never the slide size
     */
    public DeckDescription parseDeck(String raw, DeckSettings base) {
        JsonNode root = extractJson(raw);
        if (!root.isObject()) {
            throw new PipelineException(PipelineException.Kind.VALIDATION, "Composition must be a JSON object");
        }
        JsonNode pagesNode = root.get("pages");
        if (pagesNode == null || !pagesNode.isArray()) {
            throw new PipelineException(PipelineException.Kind.VALIDATION,
                    "Composition is missing the 'pages' array",
                    Map.of("fields", fieldNames(root)));
        }

        JsonNode config = root.path("slide_config");
        DeckSettings settings = base;
        String theme = text(config, "theme");
        if (theme != null && !theme.isBlank()) {
            settings = settings.withTheme(theme);
        }
        CoordinateSpace declared = declaredSpace(config, settings.canonicalSpace());

        List<PageArtifact> pages = new ArrayList<>();
        for (int i = 0; i < pagesNode.size(); i++) {
            JsonNode pageNode = pagesNode.get(i);
            if (!pageNode.isObject()) {
                log.warn("Dropping page entry {}: expected an object, got {}", i, pageNode.getNodeType());
                continue;
            }
            pages.add(buildPage(pageNode, pages.size() + 1, declared, settings.defaultBackground(), false));
        }
        log.info("Parsed composition: {} page(s), theme '{}', declared space {}",
                pages.size(), settings.theme(), declared);
        return new DeckDescription(settings, declared, pages);
    }

    /**
     * Parses the description of a single page whose geometry is expressed in
     * {@code sourceSpace} (typically the pixel size of the analysed image).
     */
    public PageArtifact parsePage(String raw, int pageNumber, CoordinateSpace sourceSpace) {
        JsonNode root = extractJson(raw);
        if (!root.isObject() || !root.path("elements").isArray()) {
            throw new PipelineException(PipelineException.Kind.VALIDATION,
                    "Page description is missing the 'elements' array",
                    Map.of("pageNumber", pageNumber, "fields", fieldNames(root)));
        }
        PageArtifact page = buildPage(root, pageNumber, sourceSpace, Background.WHITE, true);
        log.debug("Parsed page {}: {} element(s)", pageNumber, page.getElements().size());
        return page;
    }

    // ------------------------------------------------------------------
    // Pages and elements
    // ------------------------------------------------------------------

    private PageArtifact buildPage(JsonNode node, int pageNumber, CoordinateSpace space, Background fallback,
                                   boolean pageScopedIds) {
        List<ElementRecord> elements = new ArrayList<>();
        JsonNode elementsNode = node.path("elements");
        for (int i = 0; i < elementsNode.size(); i++) {
            parseElement(elementsNode.get(i), pageNumber, i, pageScopedIds).ifPresent(elements::add);
        }
        return new PageArtifact(pageNumber,
                text(node, "title"),
                firstText(node, "notes", "speaker_notes"),
                elements,
                parseBackground(node, fallback),
                space);
    }

    private Optional<ElementRecord> parseElement(JsonNode node, int pageNumber, int index, boolean pageScopedIds) {
        if (node == null || !node.isObject()) {
            log.warn("Dropping element {} on page {}: not an object", index, pageNumber);
            return Optional.empty();
        }
        String tag = text(node, "type");
        Optional<ElementType> type = ElementType.fromTag(tag);
        if (type.isEmpty()) {
            log.warn("Dropping element {} on page {}: unknown type '{}'", index, pageNumber, tag);
            return Optional.empty();
        }

        Optional<Position> position = readPosition(node.get("position"));
        Optional<Size> size = readSize(node.get("size"));
        if (position.isEmpty() || size.isEmpty()) {
            log.warn("Dropping {} element {} on page {}: missing or malformed {}",
                    tag, index, pageNumber, position.isEmpty() ? "position" : "size");
            return Optional.empty();
        }

        int zIndex = (int) number(node.get("z_index")).orElse(0);
        double opacity = clamp(number(node.get("opacity")).orElse(1.0), 0.0, 1.0);

        ElementRecord element = switch (type.get()) {
            case TEXT  -> textElement(node, position.get(), size.get(), zIndex, opacity);
            case IMAGE -> imageElement(node, position.get(), size.get(), zIndex, opacity, pageNumber, index, pageScopedIds);
        };
        return Optional.of(element);
    }

    private TextElement textElement(JsonNode node, Position position, Size size, int zIndex, double opacity) {
        JsonNode style = node.has("font") ? node.get("font") : node.path("style");
        String alignment = firstText(node, "alignment", "align");
        if (alignment == null) alignment = text(style, "alignment");

        double lineSpacing = number(node.get("line_spacing")).orElse(TextElement.DEFAULT_LINE_SPACING);
        if (lineSpacing <= 0) lineSpacing = TextElement.DEFAULT_LINE_SPACING;

        return new TextElement(position, size, zIndex, opacity,
                firstText(node, "content", "text"),
                parseFont(style),
                Alignment.fromValue(alignment).orElse(Alignment.LEFT),
                Math.min(lineSpacing, MAX_LINE_SPACING));
    }

    private ImageElement imageElement(JsonNode node, Position position, Size size, int zIndex, double opacity,
                                      int pageNumber, int index, boolean pageScopedIds) {
        String assetId = text(node, "id");
        if (assetId == null || assetId.isBlank()) {
            assetId = "page%d_elem%d".formatted(pageNumber, index);
        } else if (pageScopedIds) {
            assetId = "page%d_%s".formatted(pageNumber, assetId.strip());
        }

        String altText = firstText(node, "alt_text", "description");
        String prompt = null;
        if (node.path("generate").asBoolean(false)) {
            prompt = text(node, "prompt");
            if (prompt == null || prompt.isBlank()) prompt = altText;
            if (prompt == null || prompt.isBlank()) {
                log.warn("Image {} on page {} asks for generation without a prompt; ignoring", index, pageNumber);
                prompt = null;
            }
        }

        return new ImageElement(position, size, zIndex, opacity,
                assetId,
                firstText(node, "source", "image_path"),
                FitMode.fromValue(text(node, "fit_mode")).orElse(FitMode.CONTAIN),
                altText,
                prompt);
    }

    // ------------------------------------------------------------------
    // Styles
    // ------------------------------------------------------------------

    private FontStyle parseFont(JsonNode style) {
        if (style == null || !style.isObject()) {
            return FontStyle.DEFAULT;
        }
        String family = firstText(style, "family", "font_family", "font_name");
        double size = number(style.has("size") ? style.get("size") : style.get("font_size"))
                .orElse(FontStyle.DEFAULT_SIZE);
        int points = (int) Math.round(clamp(size, FontStyle.MIN_SIZE, FontStyle.MAX_SIZE));

        return new FontStyle(family, points,
                parseColor(style.get("color")).orElse(RgbColor.BLACK),
                style.path("bold").asBoolean(false),
                style.path("italic").asBoolean(false),
                style.path("underline").asBoolean(false));
    }

    private Background parseBackground(JsonNode page, Background fallback) {
        JsonNode bg = page.get("background");
        if (bg != null && bg.isObject()) {
            String kind = text(bg, "type");
            if ("image".equalsIgnoreCase(kind)) {
                String ref = text(bg, "value");
                return ref == null || ref.isBlank() ? fallback : Background.image(ref);
            }
            if ("none".equalsIgnoreCase(kind)) {
                return Background.NONE;
            }
            return parseColor(bg.get("value")).map(Background::color).orElse(fallback);
        }
        if (bg != null && bg.isTextual()) {
            return parseColor(bg).map(Background::color).orElse(fallback);
        }

        String image = text(page, "background_image");
        if (image != null && !image.isBlank()) {
            return Background.image(image);
        }
        return parseColor(page.get("background_color")).map(Background::color).orElse(fallback);
    }

    /** Accepts {@code "#RRGGBB"}, {@code {red, green, blue}}, {@code {r, g, b}} or {@code [r, g, b]}. */
    private Optional<RgbColor> parseColor(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            Optional<RgbColor> hex = RgbColor.fromHex(node.asText());
            if (hex.isEmpty()) log.debug("Unreadable color '{}'", node.asText());
            return hex;
        }
        if (node.isArray() && node.size() == 3) {
            return channels(node.get(0), node.get(1), node.get(2));
        }
        if (node.isObject()) {
            return node.has("red")
                    ? channels(node.get("red"), node.get("green"), node.get("blue"))
                    : channels(node.get("r"), node.get("g"), node.get("b"));
        }
        return Optional.empty();
    }

    private Optional<RgbColor> channels(JsonNode r, JsonNode g, JsonNode b) {
        OptionalDouble red = number(r), green = number(g), blue = number(b);
        if (red.isEmpty() || green.isEmpty() || blue.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RgbColor.clamped(
                Math.round(red.getAsDouble()), Math.round(green.getAsDouble()), Math.round(blue.getAsDouble())));
    }

    // ------------------------------------------------------------------
    // Geometry
    // ------------------------------------------------------------------

    private Optional<Position> readPosition(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        OptionalDouble x = number(node.get("x"));
        OptionalDouble y = number(node.get("y"));
        if (x.isEmpty() || y.isEmpty()) return Optional.empty();
        return Optional.of(new Position(toInt(x.getAsDouble()), toInt(y.getAsDouble())));
    }

    private Optional<Size> readSize(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        OptionalDouble w = number(node.get("width"));
        OptionalDouble h = number(node.get("height"));
        if (w.isEmpty() || h.isEmpty()) return Optional.empty();
        int width  = toInt(w.getAsDouble());
        int height = toInt(h.getAsDouble());
        if (width <= 0 || height <= 0) return Optional.empty();
        return Optional.of(new Size(width, height));
    }

    private CoordinateSpace declaredSpace(JsonNode config, CoordinateSpace canonical) {
        OptionalDouble w = number(config.get("width"));
        OptionalDouble h = number(config.get("height"));
        if (w.isPresent() && h.isPresent() && w.getAsDouble() >= 1 && h.getAsDouble() >= 1) {
            return new CoordinateSpace(toInt(w.getAsDouble()), toInt(h.getAsDouble()));
        }
        return SlideSize.fromLabel(text(config, "size"))
                .filter(size -> !size.space().equals(canonical))
                .map(size -> {
                    log.debug("Model laid out for {} while the deck is {}", size.label(), canonical);
                    return size.space();
                })
                .orElse(canonical);
    }

    // ------------------------------------------------------------------
    // JSON helpers
    // ------------------------------------------------------------------

    /** A finite number, or a string holding one. */
    private static OptionalDouble number(JsonNode node) {
        if (node == null || node.isNull()) return OptionalDouble.empty();
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().strip());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.isContainerNode() ? null : value.asText();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) return value;
        }
        return null;
    }

    private static int toInt(double value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.round(value)));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static String preview(String raw) {
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
