package com.slidemaker.orchestrator.model;

/**
 * Deck-wide settings. The canonical space is the one every page ends up in
 * after normalization and is fixed by the slide size.
 */
public record DeckSettings(SlideSize slideSize, String theme, FontStyle defaultFont, Background defaultBackground) {

    public static final String DEFAULT_THEME = "default";

    public DeckSettings {
        if (slideSize == null)         slideSize         = SlideSize.WIDESCREEN_16_9;
        if (theme == null || theme.isBlank()) theme      = DEFAULT_THEME;
        if (defaultFont == null)       defaultFont       = FontStyle.DEFAULT;
        if (defaultBackground == null) defaultBackground = Background.WHITE;
    }

    public static DeckSettings of(SlideSize slideSize, String theme) {
        return new DeckSettings(slideSize, theme, null, null);
    }

    public CoordinateSpace canonicalSpace() {
        return slideSize.space();
    }

    public DeckSettings withTheme(String newTheme) {
        return new DeckSettings(slideSize, newTheme, defaultFont, defaultBackground);
    }
}
