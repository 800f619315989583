package ai.pulse.cache;

import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps every entry in its own {@code <fingerprint>.json} file: {@code {"kind": ..., "payload": ...}}.
 * Files are written to a temporary sibling and moved into place, so readers never see a partial entry.
 */
public class DiskCacheBackend implements PersistentCacheBackend {
    private static final Logger LOG = LogManager.getLogger(DiskCacheBackend.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SUFFIX = ".json";

    private final Path directory;

    public DiskCacheBackend(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<StepResult> get(Fingerprint fingerprint) {
        var file = file(fingerprint);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            var entry = MAPPER.readTree(file.toFile());
            var kind = entry.get("kind");
            var payload = entry.get("payload");
            if (kind == null || !kind.isTextual() || payload == null) {
                LOG.warn("Ignore malformed cache entry {}", file);
                return Optional.empty();
            }
            return Optional.of(new StepResult(StepKind.fromId(kind.textValue()), payload));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Ignore unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(Fingerprint fingerprint, StepResult result) {
        var entry = MAPPER.createObjectNode();
        entry.put("kind", result.kind().id());
        entry.set("payload", result.payload());

        var file = file(fingerprint);
        try {
            var tmp = Files.createTempFile(directory, "entry-", ".tmp");
            try {
                MAPPER.writeValue(tmp.toFile(), entry);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write cache entry " + file, e);
        }
        LOG.debug("Cache entry {} written", file);
    }

    @Override
    public void remove(Fingerprint fingerprint) {
        try {
            Files.deleteIfExists(file(fingerprint));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot remove cache entry " + fingerprint, e);
        }
    }

    @Override
    public void clear() {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (var entry : entries) {
                Files.deleteIfExists(entry);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clear cache directory " + directory, e);
        }
        LOG.info("Cache directory {} cleared", directory);
    }

    private Path file(Fingerprint fingerprint) {
        return directory.resolve(fingerprint.value() + SUFFIX);
    }
}
