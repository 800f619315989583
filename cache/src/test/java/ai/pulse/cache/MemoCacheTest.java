package ai.pulse.cache;

import ai.pulse.model.StepKind;
import ai.pulse.model.StepResult;
import ai.pulse.model.exceptions.RemoteFailureException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.rules.Timeout;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;

public class MemoCacheTest {
    private static final Fingerprint FP = new Fingerprint("a".repeat(64));

    @Rule
    public Timeout timeout = Timeout.seconds(10);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MemoCache cache;
    private AtomicInteger computations;

    @Before
    public void setUp() {
        cache = new MemoCache();
        computations = new AtomicInteger();
    }

    @Test
    public void computeOnceThenHit() {
        var first = cache.getOrCompute(FP, () -> compute("x")).join();
        var second = cache.getOrCompute(FP, () -> compute("y")).join();

        Assert.assertFalse(first.hit());
        Assert.assertTrue(second.hit());
        Assert.assertEquals(first.result(), second.result());
        Assert.assertEquals(1, computations.get());
        Assert.assertEquals(Optional.of(first.result()), cache.lookup(FP));
    }

    @Test
    public void concurrentRequestsJoinInFlight() {
        var pending = new CompletableFuture<StepResult>();
        var first = cache.getOrCompute(FP, () -> {
            computations.incrementAndGet();
            return pending;
        });
        var second = cache.getOrCompute(FP, () -> compute("other"));

        Assert.assertTrue(cache.computing(FP));
        Assert.assertFalse(first.isDone());
        Assert.assertFalse(second.isDone());

        pending.complete(result("x"));

        Assert.assertEquals(result("x"), first.join().result());
        Assert.assertEquals(result("x"), second.join().result());
        Assert.assertTrue(second.join().hit());
        Assert.assertEquals(1, computations.get());
        Assert.assertFalse(cache.computing(FP));
    }

    @Test
    public void failureNotCached() {
        var failed = cache.getOrCompute(FP, () -> CompletableFuture.failedFuture(
            new RemoteFailureException("boom", null)));

        var e = Assert.assertThrows(CompletionException.class, failed::join);
        assertThat(e.getCause(), instanceOf(RemoteFailureException.class));
        Assert.assertFalse(cache.computing(FP));
        Assert.assertTrue(cache.lookup(FP).isEmpty());

        var retried = cache.getOrCompute(FP, () -> compute("x")).join();
        Assert.assertFalse(retried.hit());
        Assert.assertEquals(1, computations.get());
    }

    @Test
    public void loaderThrowing() {
        var failed = cache.getOrCompute(FP, () -> {
            throw new IllegalStateException("broken loader");
        });

        var e = Assert.assertThrows(CompletionException.class, failed::join);
        assertThat(e.getCause(), instanceOf(IllegalStateException.class));
        Assert.assertFalse(cache.computing(FP));
    }

    @Test
    public void evictAndClear() {
        cache.store(FP, result("x"));
        var other = new Fingerprint("b".repeat(64));
        cache.store(other, result("y"));

        cache.evict(FP);
        Assert.assertTrue(cache.lookup(FP).isEmpty());
        Assert.assertEquals(1, cache.size());

        cache.clear();
        Assert.assertTrue(cache.lookup(other).isEmpty());
    }

    @Test
    public void persistentHitPromoted() throws Exception {
        var backend = new DiskCacheBackend(folder.newFolder("cache").toPath());
        new MemoCache(backend).store(FP, result("x"));

        var fresh = new MemoCache(backend);
        Assert.assertEquals(0, fresh.size());

        var answer = fresh.getOrCompute(FP, () -> compute("y")).join();
        Assert.assertTrue(answer.hit());
        Assert.assertEquals(result("x"), answer.result());
        Assert.assertEquals(1, fresh.size());
        Assert.assertEquals(0, computations.get());
    }

    @Test
    public void backendReadErrorIsMiss() {
        var broken = new PersistentCacheBackend() {
            @Override
            public Optional<StepResult> get(Fingerprint fingerprint) {
                throw new IllegalStateException("disk on fire");
            }

            @Override
            public void put(Fingerprint fingerprint, StepResult result) {
                throw new IllegalStateException("disk on fire");
            }

            @Override
            public void remove(Fingerprint fingerprint) {}

            @Override
            public void clear() {}
        };
        var failing = new MemoCache(broken);

        var answer = failing.getOrCompute(FP, () -> compute("x")).join();
        Assert.assertFalse(answer.hit());
        Assert.assertEquals(Optional.of(result("x")), failing.lookup(FP));
    }

    private CompletableFuture<StepResult> compute(String value) {
        computations.incrementAndGet();
        return CompletableFuture.completedFuture(result(value));
    }

    private static StepResult result(String value) {
        var payload = JsonNodeFactory.instance.objectNode();
        payload.putArray("sentiments").add(value);
        return new StepResult(StepKind.SENTIMENT, payload);
    }
}
