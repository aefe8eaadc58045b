package org.newslens.client;

import lombok.extern.slf4j.Slf4j;
import org.newslens.exception.BackendUnavailableException;
import org.newslens.exception.UpstreamException;
import org.newslens.exception.UpstreamTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking upstream calls with a hard deadline.
 *
 * <p>The call is submitted to a dedicated pool and awaited for at most the given
 * timeout. On timeout, or when the calling thread is interrupted because its
 * request was abandoned, the in-flight call is cancelled with an interrupt.</p>
 *
 * <p>Failures always surface as an {@link UpstreamException} subtype so callers
 * can tag them without inspecting vendor exceptions.</p>
 */
@Slf4j
public class UpstreamCallExecutor {

    private final ExecutorService executor;

    public UpstreamCallExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Executes {@code call} against {@code backend} and waits for its result.
     *
     * @param backend name of the backend, used in log lines and messages
     * @param timeout maximum time to wait
     * @param call    the blocking call
     * @return the call result
     * @throws UpstreamTimeoutException    if the deadline passes
     * @throws BackendUnavailableException if the call fails or cannot be scheduled
     */
    public <T> T call(String backend, Duration timeout, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new BackendUnavailableException("No capacity to call " + backend, e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Call to {} timed out after {}ms, cancelled", backend, timeout.toMillis());
            throw new UpstreamTimeoutException(backend + " did not answer within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.info("Call to {} cancelled because the caller was interrupted", backend);
            throw new BackendUnavailableException("Call to " + backend + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof UpstreamException upstream) {
                throw upstream;
            }
            log.warn("Call to {} failed: {}", backend, cause.getMessage());
            throw new BackendUnavailableException(backend + " call failed: " + cause.getMessage(), cause);
        }
    }
}
