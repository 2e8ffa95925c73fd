package com.slidemaker.orchestrator.model;

/**
 * A named pixel rectangle (width x height) in which positions and sizes are
 * expressed. The constructor does not validate: a degenerate space from an
 * untrusted source must reach the normalizer so it can be rejected there.
 */
public record CoordinateSpace(int width, int height) {

    public boolean hasPositiveArea() {
        return width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
