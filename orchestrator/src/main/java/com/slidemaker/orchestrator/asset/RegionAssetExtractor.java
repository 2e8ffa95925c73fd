package com.slidemaker.orchestrator.asset;

import com.slidemaker.orchestrator.input.InputUnit;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Crops with {@link ImageIO} and re-encodes as PNG. The region is clipped to
 * the image bounds first; a region entirely outside the image is an error.
 */
@Component
public class RegionAssetExtractor implements AssetExtractor {

    @Override
    public byte[] extract(InputUnit unit, AssetRequest.Region region) {
        if (!unit.isImage()) {
            throw new IllegalArgumentException("Unit " + unit.id() + " is not an image (" + unit.mediaType() + ")");
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(unit.content()));
            if (image == null) {
                throw new IllegalArgumentException("Unit " + unit.id() + " could not be decoded");
            }

            Rectangle clip = new Rectangle(region.x(), region.y(), region.width(), region.height())
                    .intersection(new Rectangle(0, 0, image.getWidth(), image.getHeight()));
            if (clip.isEmpty()) {
                throw new IllegalArgumentException("Region %s lies outside %dx%d unit %s".formatted(
                        region, image.getWidth(), image.getHeight(), unit.id()));
            }

            BufferedImage crop = image.getSubimage(clip.x, clip.y, clip.width, clip.height);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(crop, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not extract region from " + unit.id(), e);
        }
    }
}
