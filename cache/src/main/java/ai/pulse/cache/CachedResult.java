package ai.pulse.cache;

import ai.pulse.model.StepResult;

/**
 * Result handed out by {@link MemoCache#getOrCompute}. {@code hit} is set when no computation was
 * started for this request: the result was stored already or another request was computing it.
 */
public record CachedResult(StepResult result, boolean hit) {}
