package ai.pulse.graph.mocks;

import ai.pulse.model.StepKind;
import ai.pulse.model.remote.AnalysisTransport;
import ai.pulse.model.remote.JobStatus;
import ai.pulse.model.remote.JobStatusResponse;
import ai.pulse.model.remote.SubmitResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fake analysis API with plausible answers for every step kind. Kinds can be switched to answer through
 * a polled job, to fail, or to run a hook before answering.
 */
public class AnalysisTransportMock implements AnalysisTransport {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public record Call(StepKind kind, Map<String, Object> options, Map<String, JsonNode> inputs, String thread) {}

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Map<StepKind, Supplier<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<StepKind, Runnable> hooks = new ConcurrentHashMap<>();
    private final Set<StepKind> deferred = ConcurrentHashMap.newKeySet();
    private final Map<String, JsonNode> jobs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> jobPolls = new ConcurrentHashMap<>();
    private final AtomicInteger jobCounter = new AtomicInteger(0);
    private final AtomicInteger polls = new AtomicInteger(0);
    private volatile int runningPolls = 1;
    private volatile boolean jobsNeverFinish = false;

    public AnalysisTransportMock deferred(StepKind kind) {
        deferred.add(kind);
        return this;
    }

    public AnalysisTransportMock failOn(StepKind kind, Supplier<RuntimeException> error) {
        failures.put(kind, error);
        return this;
    }

    public AnalysisTransportMock beforeAnswer(StepKind kind, Runnable hook) {
        hooks.put(kind, hook);
        return this;
    }

    public AnalysisTransportMock runningPolls(int count) {
        this.runningPolls = count;
        return this;
    }

    public AnalysisTransportMock jobsNeverFinish() {
        this.jobsNeverFinish = true;
        return this;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public int calls(StepKind kind) {
        return (int) calls.stream().filter(c -> c.kind() == kind).count();
    }

    public int polls() {
        return polls.get();
    }

    @Override
    public SubmitResponse submit(StepKind kind, Map<String, Object> options, Map<String, JsonNode> inputs) {
        calls.add(new Call(kind, options, inputs, Thread.currentThread().getName()));

        var hook = hooks.get(kind);
        if (hook != null) {
            hook.run();
        }
        var failure = failures.get(kind);
        if (failure != null) {
            throw failure.get();
        }

        var payload = answer(kind, inputs);
        if (deferred.contains(kind)) {
            var jobId = "job-" + jobCounter.incrementAndGet();
            jobs.put(jobId, payload);
            jobPolls.put(jobId, new AtomicInteger(0));
            return SubmitResponse.deferred(jobId);
        }
        return SubmitResponse.completed(payload);
    }

    @Override
    public JobStatusResponse pollStatus(String jobId) {
        polls.incrementAndGet();
        var counter = jobPolls.get(jobId);
        if (counter == null) {
            throw new IllegalStateException("Unknown job " + jobId);
        }
        if (jobsNeverFinish || counter.incrementAndGet() <= runningPolls) {
            return JobStatusResponse.of(JobStatus.RUNNING);
        }
        return JobStatusResponse.completed("results/" + jobId);
    }

    @Override
    public JsonNode fetchResult(String resultLocation) {
        var jobId = resultLocation.substring("results/".length());
        var payload = jobs.get(jobId);
        if (payload == null) {
            throw new IllegalStateException("Unknown result " + resultLocation);
        }
        return payload;
    }

    private static JsonNode answer(StepKind kind, Map<String, JsonNode> inputs) {
        ObjectNode out = NODES.objectNode();
        switch (kind) {
            case THEME_GENERATION -> {
                var themes = out.putArray("themes");
                themes.addObject().put("shortLabel", "Price").putArray("representatives").add("too expensive");
                themes.addObject().put("shortLabel", "Staff").putArray("representatives").add("friendly people");
            }
            case THEME_ALLOCATION -> {
                var texts = inputs.get("set_a");
                var themes = inputs.get("set_b");
                var similarity = out.putArray("similarity");
                for (int i = 0; i < texts.size(); i++) {
                    var row = similarity.addArray();
                    for (int j = 0; j < themes.size(); j++) {
                        row.add(j == i % themes.size() ? 0.9 : 0.1);
                    }
                }
            }
            case THEME_EXTRACTION -> {
                var extractions = out.putArray("extractions");
                for (var text : inputs.get("inputs")) {
                    ArrayNode perTheme = extractions.addArray();
                    for (int j = 0; j < inputs.get("themes").size(); j++) {
                        perTheme.addArray().add(text.asText());
                    }
                }
            }
            case SENTIMENT -> {
                var sentiments = out.putArray("sentiments");
                for (var text : inputs.get("inputs")) {
                    sentiments.add(text.asText().contains("bad") ? "negative" : "positive");
                }
            }
            case CLUSTER -> {
                var set = inputs.get("set");
                var similarity = out.putArray("similarity");
                for (int i = 0; i < set.size(); i++) {
                    var row = similarity.addArray();
                    for (int j = 0; j < set.size(); j++) {
                        row.add(i == j ? 1.0 : 0.2);
                    }
                }
            }
        }
        return out;
    }
}
