package ai.pulse.cache;

import ai.pulse.model.StepResult;

import java.util.Optional;

/**
 * Storage behind the in-memory cache layer, surviving across executor instances. Implementations are
 * called concurrently and must treat unreadable entries as absent.
 */
public interface PersistentCacheBackend {

    Optional<StepResult> get(Fingerprint fingerprint);

    void put(Fingerprint fingerprint, StepResult result);

    void remove(Fingerprint fingerprint);

    void clear();
}
