package com.slidemaker.orchestrator.input;

import com.slidemaker.orchestrator.error.PipelineException;
import com.slidemaker.orchestrator.model.SlideSize;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** A text or Markdown outline becomes a single unit. */
@Component
public class OutlineInputLoader implements RawInputLoader {

    public static final String MEDIA_TYPE = "text/markdown";

    @Override
    public List<String> extensions() {
        return List.of("md", "markdown", "txt");
    }

    @Override
    public List<InputUnit> load(Path source) {
        byte[] content;
        try {
            content = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read outline " + source, e);
        }
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            throw PipelineException.invalidInput("Outline is empty: " + source, Map.of("input", source.toString()));
        }
        return List.of(new InputUnit("outline", 0, content, MEDIA_TYPE, SlideSize.WIDESCREEN_16_9.space()));
    }
}
