package com.slidemaker.orchestrator.input;

import com.slidemaker.orchestrator.error.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Picks the loader for an input file by extension.
 *
 * All {@link RawInputLoader} beans are collected at startup. The file itself
 * is checked before a loader is chosen: a missing path, a directory or an
 * unknown extension is rejected as fatal {@code VALIDATION}, since retrying
 * cannot change any of them.
 */
@Component
public class InputLoaderRegistry {

    private static final Logger log = LoggerFactory.getLogger(InputLoaderRegistry.class);

    private final Map<String, RawInputLoader> byExtension = new TreeMap<>();

    public InputLoaderRegistry(List<RawInputLoader> loaders) {
        for (RawInputLoader loader : loaders) {
            for (String ext : loader.extensions()) {
                RawInputLoader previous = byExtension.put(ext, loader);
                if (previous != null) {
                    throw new IllegalStateException("Extension '%s' claimed by both %s and %s".formatted(
                            ext, previous.getClass().getSimpleName(), loader.getClass().getSimpleName()));
                }
            }
            log.info("Registered input loader {} for {}", loader.getClass().getSimpleName(), loader.extensions());
        }
    }

    public RawInputLoader forSource(Path source) {
        requireReadableFile(source);
        String ext = extensionOf(source);
        RawInputLoader loader = byExtension.get(ext);
        if (loader == null) {
            throw PipelineException.invalidInput(
                    "Unsupported input format '%s'; expected one of %s".formatted(ext, byExtension.keySet()),
                    Map.of("input", source.toString()));
        }
        return loader;
    }

    public List<String> supportedExtensions() {
        return List.copyOf(byExtension.keySet());
    }

    /** Rejects a path that does not exist or is not a regular file. */
    public static void requireReadableFile(Path source) {
        if (source == null || !Files.exists(source)) {
            throw PipelineException.invalidInput("Input file does not exist: " + source,
                    Map.of("input", String.valueOf(source)));
        }
        if (!Files.isRegularFile(source)) {
            throw PipelineException.invalidInput("Input is not a regular file: " + source,
                    Map.of("input", source.toString()));
        }
    }

    public static String extensionOf(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
