package com.slidemaker.orchestrator.geometry;

import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.CoordinateSpace;
import com.slidemaker.orchestrator.model.ElementRecord;
import com.slidemaker.orchestrator.model.PageArtifact;
import com.slidemaker.orchestrator.model.Position;
import com.slidemaker.orchestrator.model.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps geometry from the space a model or source file used into the deck's
 * canonical space.
 *
 * Scaling is proportional per axis and rounds half-up via {@link Math#round}.
 * Results are then clamped so that nothing lands outside the target:
 * positions into [0, dim - 1], sizes into [1, dim]. Clamping loses
 * information, so the mapping is not reversible.
 */
@Component
public class CoordinateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CoordinateNormalizer.class);

    public Position normalize(double x, double y, CoordinateSpace source, CoordinateSpace target) {
        requirePositive(source, "source");
        requirePositive(target, "target");

        long nx = Math.round(x * target.width()  / source.width());
        long ny = Math.round(y * target.height() / source.height());
        return new Position(clamp(nx, 0, target.width() - 1), clamp(ny, 0, target.height() - 1));
    }

    public Size normalizeSize(double width, double height, CoordinateSpace source, CoordinateSpace target) {
        requirePositive(source, "source");
        requirePositive(target, "target");

        long nw = Math.round(width  * target.width()  / source.width());
        long nh = Math.round(height * target.height() / source.height());
        return new Size(clamp(nw, 1, target.width()), clamp(nh, 1, target.height()));
    }

    /**
     * Rescales every element of the page from the page's current space into
     * {@code target}, in place, then records {@code target} as the page's space.
     * Element order is untouched.
     */
    public void normalizePage(PageArtifact page, CoordinateSpace target) {
        CoordinateSpace source = page.getSpace();
        requirePositive(source, "source");
        requirePositive(target, "target");

        for (ElementRecord element : page.getElements()) {
            Position p = element.getPosition();
            Size s = element.getSize();
            element.setPosition(normalize(p.x(), p.y(), source, target));
            element.setSize(normalizeSize(s.width(), s.height(), source, target));
        }
        page.setSpace(target);
        log.debug("Normalized page {} ({} elements) from {} to {}",
                page.getPageNumber(), page.getElements().size(), source, target);
    }

    // ------------------------------------------------------------------

    private static void requirePositive(CoordinateSpace space, String role) {
        if (space == null || !space.hasPositiveArea()) {
            throw new PipelineException(PipelineException.Kind.INVALID_DIMENSION,
                    "The %s coordinate space must have positive width and height, got %s"
                            .formatted(role, space),
                    Map.of("role", role, "space", String.valueOf(space)));
        }
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }
}
