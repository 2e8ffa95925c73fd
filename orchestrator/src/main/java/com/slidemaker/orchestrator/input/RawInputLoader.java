package com.slidemaker.orchestrator.input;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns one input file into ordered {@link InputUnit}s.
 *
 * Implementations are Spring beans; {@link InputLoaderRegistry} collects them.
 */
public interface RawInputLoader {

    /** File extensions handled, lower case, without the dot. */
    List<String> extensions();

    /**
     * Loads every unit of the file, in source order.
     *
     * @throws com.slidemaker.orchestrator.error.PipelineException VALIDATION when the content is unreadable
     * @throws java.io.UncheckedIOException on I/O failure
     */
    List<InputUnit> load(Path source);
}
