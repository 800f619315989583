package ai.pulse.graph;

import ai.pulse.cache.DiskCacheBackend;
import ai.pulse.cache.Fingerprint;
import ai.pulse.cache.Fingerprinter;
import ai.pulse.cache.MemoCache;
import ai.pulse.graph.config.CacheConfig;
import ai.pulse.graph.config.ExecutorConfig;
import ai.pulse.graph.model.ExecutionGraph;
import ai.pulse.graph.model.ResultStore;
import ai.pulse.longrunning.FutureUtils;
import ai.pulse.longrunning.Job;
import ai.pulse.longrunning.JobMonitor;
import ai.pulse.model.Step;
import ai.pulse.model.StepResult;
import ai.pulse.model.Workflow;
import ai.pulse.model.exceptions.StepCancelledException;
import ai.pulse.model.exceptions.StepFailedException;
import ai.pulse.model.exceptions.UpstreamFailedException;
import ai.pulse.model.remote.AnalysisTransport;
import ai.pulse.model.remote.SubmitResponse;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs workflows against the remote analysis API.
 *
 * <p>Every step is fingerprinted before it runs and answered from the cache when possible. Steps whose
 * inputs are ready run on a fixed pool of {@code parallelism} threads; with {@code parallelism = 1}
 * they run one by one on the calling thread. Remote jobs are awaited through a {@link JobMonitor}.
 *
 * <p>An executor may run many workflows, one after another or at once; the cache is shared by all of
 * them.
 */
public class WorkflowExecutor implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(WorkflowExecutor.class);

    private final AnalysisTransport transport;
    private final ExecutorConfig config;
    private final MemoCache cache;
    private final JobMonitor jobMonitor;
    private final GraphBuilder graphBuilder;
    @Nullable
    private final ExecutorService stepPool;

    public WorkflowExecutor(AnalysisTransport transport) {
        this(transport, new ExecutorConfig());
    }

    public WorkflowExecutor(AnalysisTransport transport, ExecutorConfig config) {
        this(transport, config, createCache(config.getCache()));
    }

    public WorkflowExecutor(AnalysisTransport transport, ExecutorConfig config, MemoCache cache) {
        config.validate();
        this.transport = transport;
        this.config = config;
        this.cache = cache;
        this.jobMonitor = new JobMonitor(transport, config.getJobs());
        this.graphBuilder = new GraphBuilder(config.getAutoInsert());
        this.stepPool = config.getParallelism() > 1
            ? Executors.newFixedThreadPool(config.getParallelism(), new ThreadFactoryBuilder()
                .setNameFormat("pulse-step-%d")
                .setDaemon(true)
                .build())
            : null;
    }

    private static MemoCache createCache(CacheConfig config) {
        if (config.getDirectory() == null) {
            return new MemoCache();
        }
        return new MemoCache(new DiskCacheBackend(Path.of(config.getDirectory())));
    }

    public MemoCache cache() {
        return cache;
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * Validates the workflow and computes its execution order without running anything.
     */
    public ExecutionGraph plan(Workflow workflow) {
        return graphBuilder.build(workflow);
    }

    public ExecutionOutcome execute(Workflow workflow, List<String> dataset) {
        return execute(workflow.withDataset(dataset));
    }

    /**
     * @throws ai.pulse.model.exceptions.ConfigurationException if the workflow is invalid; nothing runs then
     * @throws StepFailedException the first failure, under {@link FailurePolicy#ABORT}
     */
    public ExecutionOutcome execute(Workflow workflow) {
        var graph = plan(workflow);
        var run = new Run(graph);
        LOG.info("Execute workflow of {} steps, order {}, parallelism {}",
            graph.order().size(), graph.order(), config.getParallelism());

        if (stepPool == null) {
            runSequentially(run);
        } else {
            runConcurrently(run, stepPool);
        }
        return run.finish();
    }

    private void runSequentially(Run run) {
        for (var id : run.graph.order()) {
            var step = run.graph.step(id).orElseThrow();
            if (!run.admit(step)) {
                continue;
            }
            try {
                run.succeeded(id, FutureUtils.join(runStep(step, run)));
            } catch (StepFailedException e) {
                run.failed(id, e);
            } catch (RuntimeException e) {
                run.failed(id, asStepFailure(step, null, e));
            }
        }
    }

    private void runConcurrently(Run run, ExecutorService pool) {
        var done = new HashMap<String, CompletableFuture<Void>>();
        for (var id : run.graph.order()) {
            var step = run.graph.step(id).orElseThrow();
            var inputs = run.graph.upstream(id).stream()
                .map(done::get)
                .toArray(CompletableFuture<?>[]::new);

            var finished = CompletableFuture.allOf(inputs)
                .thenComposeAsync(ignored -> {
                    if (!run.admit(step)) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    return runStep(step, run).<Void>handle((result, error) -> {
                        try {
                            if (error == null) {
                                run.succeeded(id, result);
                            } else {
                                run.failed(id, asStepFailure(step, null, error));
                            }
                        } catch (RuntimeException e) {
                            // dependents wait on this future, it must not fail
                            run.failed(id, asStepFailure(step, null, e));
                        }
                        return null;
                    });
                }, pool);
            done.put(id, finished);
        }

        FutureUtils.join(CompletableFuture.allOf(done.values().toArray(CompletableFuture<?>[]::new)));
    }

    /**
     * Runs one step through the cache. The returned future fails with {@link StepFailedException} only.
     */
    private CompletableFuture<StepResult> runStep(Step step, Run run) {
        Fingerprint fingerprint = null;
        try {
            var ctx = new ResolvedStepContext(step, run.graph, run.results, config.isFast(), transport);
            fingerprint = Fingerprinter.fingerprint(step.kind(), step.analysis().options(config.isFast()),
                ctx.inputs());
            run.started(step.id());
            LOG.info("Execute step '{}' of kind {}, fingerprint {}", step.id(), step.kind().id(),
                fingerprint.shortValue());

            CompletableFuture<StepResult> result;
            if (config.getCache().isEnabled()) {
                result = throughCache(step, ctx, run, fingerprint);
            } else {
                result = invoke(step, ctx, run);
            }

            var fp = fingerprint.value();
            var out = new CompletableFuture<StepResult>();
            result.whenComplete((r, error) -> {
                if (error == null) {
                    out.complete(r);
                } else {
                    out.completeExceptionally(asStepFailure(step, fp, error));
                }
            });
            return out;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                asStepFailure(step, fingerprint != null ? fingerprint.value() : null, e));
        }
    }

    /**
     * Computation of a shared fingerprint belongs to the run that started it and stops when that run
     * aborts. A run that only joined it and is not aborted itself computes the step again.
     */
    private CompletableFuture<StepResult> throughCache(Step step, ResolvedStepContext ctx, Run run,
                                                       Fingerprint fingerprint)
    {
        var owner = new AtomicBoolean(false);
        return cache.getOrCompute(fingerprint, () -> {
                owner.set(true);
                return invoke(step, ctx, run);
            })
            .thenApply(cached -> {
                if (cached.hit()) {
                    LOG.info("Step '{}' answered from cache", step.id());
                    run.cacheHits.add(step.id());
                }
                return cached.result();
            })
            .exceptionallyCompose(error -> {
                if (!owner.get() && !run.aborted.get()
                    && FutureUtils.unwrap(error) instanceof StepCancelledException)
                {
                    LOG.info("Joined computation of step '{}' was cancelled by its run, compute again",
                        step.id());
                    return throughCache(step, ctx, run, fingerprint);
                }
                return CompletableFuture.<StepResult>failedFuture(error);
            });
    }

    private CompletableFuture<StepResult> invoke(Step step, ResolvedStepContext ctx, Run run) {
        if (run.aborted.get()) {
            return CompletableFuture.failedFuture(
                new StepCancelledException("Run aborted before step '%s' started".formatted(step.id())));
        }

        SubmitResponse response;
        try {
            response = step.run(ctx);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (response instanceof SubmitResponse.Completed completed) {
            LOG.debug("Step '{}' completed synchronously", step.id());
            try {
                return CompletableFuture.completedFuture(step.complete(completed.payload(), ctx));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        var jobId = ((SubmitResponse.Deferred) response).jobId();
        LOG.info("Step '{}' submitted job {}", step.id(), jobId);
        return jobMonitor.await(new Job(jobId), config.getJobs().getTimeout(), run.aborted::get)
            .thenApply(payload -> step.complete(payload, ctx));
    }

    private static StepFailedException asStepFailure(Step step, @Nullable String fingerprint, Throwable error) {
        var cause = FutureUtils.unwrap(error);
        if (cause instanceof StepFailedException sfe && sfe.stepId().equals(step.id())) {
            return sfe;
        }
        return new StepFailedException(step.id(), fingerprint, cause);
    }

    @Override
    public void close() {
        jobMonitor.close();
        if (stepPool != null) {
            stepPool.shutdown();
            try {
                if (!stepPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Step pool did not terminate in time");
                    stepPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                stepPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * State of one {@link #execute} call.
     */
    private final class Run {
        private final ExecutionGraph graph;
        private final ResultStore results;
        private final Map<String, StepFailedException> failures = new ConcurrentHashMap<>();
        private final Set<String> cancelled = ConcurrentHashMap.newKeySet();
        private final Set<String> cacheHits = ConcurrentHashMap.newKeySet();
        private final List<String> started = Collections.synchronizedList(new ArrayList<>());
        private final AtomicBoolean aborted = new AtomicBoolean(false);
        private final AtomicReference<StepFailedException> firstFailure = new AtomicReference<>();

        Run(ExecutionGraph graph) {
            this.graph = graph;
            this.results = new ResultStore(graph.order());
        }

        /**
         * Decides whether a step whose inputs are settled may start; records why not otherwise.
         */
        boolean admit(Step step) {
            if (aborted.get()) {
                LOG.info("Step '{}' cancelled: run aborted", step.id());
                cancelled.add(step.id());
                return false;
            }
            for (var input : graph.upstream(step.id())) {
                if (!results.contains(input)) {
                    var error = new StepFailedException(step.id(), null, new UpstreamFailedException(step.id(), input));
                    LOG.warn("Step '{}' skipped: input step '{}' has no result", step.id(), input);
                    failures.put(step.id(), error);
                    return false;
                }
            }
            return true;
        }

        void started(String id) {
            started.add(id);
        }

        void succeeded(String id, StepResult result) {
            results.put(id, result);
            LOG.debug("Step '{}' done", id);
        }

        void failed(String id, StepFailedException e) {
            if (aborted.get() && e.getCause() instanceof StepCancelledException) {
                LOG.info("Step '{}' cancelled while running", id);
                cancelled.add(id);
                return;
            }

            failures.put(id, e);
            firstFailure.compareAndSet(null, e);
            LOG.error("Step '{}' failed: {}", id, e.getMessage());
            if (config.getFailurePolicy() == FailurePolicy.ABORT && aborted.compareAndSet(false, true)) {
                LOG.warn("Abort run after failure of step '{}'", id);
            }
        }

        ExecutionOutcome finish() {
            LOG.info("Workflow finished: {} done, {} failed, {} cancelled, {} from cache",
                results.stepIds().size(), failures.size(), cancelled.size(), cacheHits.size());
            var failure = firstFailure.get();
            if (failure != null && config.getFailurePolicy() == FailurePolicy.ABORT) {
                throw failure;
            }
            return new ExecutionOutcome(graph, results, failures, cancelled, List.copyOf(started), cacheHits);
        }
    }
}
