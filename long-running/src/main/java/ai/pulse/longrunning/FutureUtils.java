package ai.pulse.longrunning;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public enum FutureUtils {
    ;

    /**
     * Strips the wrappers {@link CompletableFuture} puts around the original failure.
     */
    public static Throwable unwrap(Throwable e) {
        var cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null)
        {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Waits for {@code future} and rethrows its failure as is.
     */
    public static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            var cause = unwrap(e);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
