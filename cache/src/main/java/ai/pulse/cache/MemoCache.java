package ai.pulse.cache;

import ai.pulse.model.StepResult;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Step result cache keyed by {@link Fingerprint}. Memory first, then the optional persistent backend,
 * whose hits are promoted to memory.
 *
 * <p>{@link #getOrCompute} runs at most one computation per fingerprint at a time: concurrent
 * requests join the in-flight one. Only successful results are stored; a failed computation frees
 * its slot so the next request computes again.
 */
public class MemoCache {
    private static final Logger LOG = LogManager.getLogger(MemoCache.class);

    private final ConcurrentHashMap<Fingerprint, StepResult> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Fingerprint, CompletableFuture<StepResult>> inFlight = new ConcurrentHashMap<>();

    @Nullable
    private final PersistentCacheBackend backend;

    public MemoCache() {
        this(null);
    }

    public MemoCache(@Nullable PersistentCacheBackend backend) {
        this.backend = backend;
    }

    public Optional<StepResult> lookup(Fingerprint fingerprint) {
        var result = entries.get(fingerprint);
        if (result != null) {
            return Optional.of(result);
        }
        if (backend == null) {
            return Optional.empty();
        }

        Optional<StepResult> stored;
        try {
            stored = backend.get(fingerprint);
        } catch (RuntimeException e) {
            LOG.warn("Cannot read cache entry {}, treat as miss: {}", fingerprint.shortValue(), e.getMessage(), e);
            return Optional.empty();
        }
        stored.ifPresent(r -> {
            LOG.debug("Promote persistent cache entry {}", fingerprint.shortValue());
            entries.putIfAbsent(fingerprint, r);
        });
        return stored;
    }

    public void store(Fingerprint fingerprint, StepResult result) {
        entries.put(fingerprint, result);
        if (backend != null) {
            try {
                backend.put(fingerprint, result);
            } catch (RuntimeException e) {
                LOG.warn("Cannot persist cache entry {}: {}", fingerprint.shortValue(), e.getMessage(), e);
            }
        }
    }

    public CompletableFuture<CachedResult> getOrCompute(Fingerprint fingerprint,
                                                        Supplier<CompletableFuture<StepResult>> loader)
    {
        var cached = lookup(fingerprint);
        if (cached.isPresent()) {
            LOG.debug("Cache hit {}", fingerprint.shortValue());
            return CompletableFuture.completedFuture(new CachedResult(cached.get(), true));
        }

        var slot = new CompletableFuture<StepResult>();
        var running = inFlight.putIfAbsent(fingerprint, slot);
        if (running != null) {
            LOG.debug("Join in-flight computation {}", fingerprint.shortValue());
            return running.thenApply(r -> new CachedResult(r, true));
        }

        // stored between the lookup and taking the slot
        var late = entries.get(fingerprint);
        if (late != null) {
            inFlight.remove(fingerprint, slot);
            slot.complete(late);
            return CompletableFuture.completedFuture(new CachedResult(late, true));
        }

        LOG.debug("Cache miss {}, compute", fingerprint.shortValue());
        CompletableFuture<StepResult> computation;
        try {
            computation = loader.get();
        } catch (RuntimeException e) {
            computation = CompletableFuture.failedFuture(e);
        }

        computation.whenComplete((result, error) -> {
            if (error == null) {
                store(fingerprint, result);
            }
            inFlight.remove(fingerprint, slot);
            if (error == null) {
                slot.complete(result);
            } else {
                slot.completeExceptionally(error);
            }
        });
        return slot.thenApply(r -> new CachedResult(r, false));
    }

    public void evict(Fingerprint fingerprint) {
        entries.remove(fingerprint);
        if (backend != null) {
            backend.remove(fingerprint);
        }
    }

    public void clear() {
        entries.clear();
        if (backend != null) {
            backend.clear();
        }
        LOG.info("Cache cleared");
    }

    public int size() {
        return entries.size();
    }

    @VisibleForTesting
    boolean computing(Fingerprint fingerprint) {
        return inFlight.containsKey(fingerprint);
    }
}
