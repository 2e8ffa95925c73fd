package com.slidemaker.orchestrator.asset;

import com.slidemaker.orchestrator.error.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * {@link AssetStore} on the local file system.
 *
 * A destination is accepted only if its normalized path, and the real path of
 * its parent directory once created, stay under the root. The count ceiling
 * is reserved before writing and released if the write fails.
 */
public class LocalAssetStore implements AssetStore {

    private static final Logger log = LoggerFactory.getLogger(LocalAssetStore.class);

    private final Path          root;
    private final long          maxAssetBytes;
    private final int           maxAssetCount;
    private final AtomicInteger stored = new AtomicInteger();

    public LocalAssetStore(Path root, long maxAssetBytes, int maxAssetCount) {
        this.root          = root.toAbsolutePath().normalize();
        this.maxAssetBytes = maxAssetBytes;
        this.maxAssetCount = maxAssetCount;
    }

    @Override
    public AssetWriteResult write(byte[] bytes, String destination) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes must not be null");
        }

        Path target;
        try {
            target = root.resolve(destination).normalize();
        } catch (InvalidPathException e) {
            return reject("Invalid asset destination '%s'".formatted(destination), destination);
        }
        if (!target.startsWith(root) || target.equals(root)) {
            return reject("Asset destination '%s' escapes the staging root".formatted(destination), destination);
        }
        if (bytes.length > maxAssetBytes) {
            return reject("Asset '%s' is %d bytes, over the %d byte ceiling"
                    .formatted(destination, bytes.length, maxAssetBytes), destination);
        }
        if (stored.incrementAndGet() > maxAssetCount) {
            stored.decrementAndGet();
            return reject("Asset ceiling of %d reached; '%s' not stored"
                    .formatted(maxAssetCount, destination), destination);
        }

        try {
            Files.createDirectories(target.getParent());
            if (!target.getParent().toRealPath().startsWith(root.toRealPath())) {
                stored.decrementAndGet();
                return reject("Asset destination '%s' resolves outside the staging root via a link"
                        .formatted(destination), destination);
            }
            Files.write(target, bytes);
        } catch (IOException e) {
            stored.decrementAndGet();
            throw new UncheckedIOException("Could not write asset " + target, e);
        }

        log.debug("Stored asset {} ({} bytes)", target, bytes.length);
        return AssetWriteResult.stored(new AssetLocation(target, bytes.length));
    }

    @Override
    public Path root() {
        return root;
    }

    public int storedCount() {
        return stored.get();
    }

    @Override
    public void discard() {
        if (!Files.exists(root)) return;
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(LocalAssetStore::delete);
            log.info("Discarded staging area {}", root);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not clean up staging area " + root, e);
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete " + path, e);
        }
    }

    private AssetWriteResult reject(String message, String destination) {
        log.warn(message);
        return AssetWriteResult.rejected(new PipelineException(PipelineException.Kind.RESOURCE_BOUNDARY,
                message, Map.of("destination", String.valueOf(destination), "root", root.toString())));
    }
}
