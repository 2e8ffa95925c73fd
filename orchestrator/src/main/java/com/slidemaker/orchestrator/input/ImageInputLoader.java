package com.slidemaker.orchestrator.input;

import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.CoordinateSpace;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** A single raster image becomes a single page unit in its own pixel space. */
@Component
public class ImageInputLoader implements RawInputLoader {

    private static final Map<String, String> MEDIA_TYPES = Map.of(
            "png",  "image/png",
            "jpg",  "image/jpeg",
            "jpeg", "image/jpeg",
            "gif",  "image/gif",
            "bmp",  "image/bmp");

    @Override
    public List<String> extensions() {
        return List.copyOf(MEDIA_TYPES.keySet());
    }

    @Override
    public List<InputUnit> load(Path source) {
        byte[] content;
        BufferedImage image;
        try {
            content = Files.readAllBytes(source);
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read image " + source, e);
        }
        if (image == null) {
            throw PipelineException.invalidInput("Not a decodable image: " + source, Map.of("input", source.toString()));
        }

        String mediaType = MEDIA_TYPES.get(InputLoaderRegistry.extensionOf(source));
        return List.of(new InputUnit("page-1", 0, content, mediaType,
                new CoordinateSpace(image.getWidth(), image.getHeight())));
    }
}
