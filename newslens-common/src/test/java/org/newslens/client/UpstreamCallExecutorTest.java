package org.newslens.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.newslens.exception.BackendUnavailableException;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.newslens.exception.UpstreamTimeoutException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamCallExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final UpstreamCallExecutor executor = new UpstreamCallExecutor(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsResultWithinDeadline() {
        assertThat(executor.call("test", Duration.ofSeconds(1), () -> "ok")).isEqualTo("ok");
    }

    @Test
    void timeoutCancelsInFlightCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> executor.call("slow", Duration.ofMillis(50), () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        })).isInstanceOf(UpstreamTimeoutException.class)
                .hasMessageContaining("slow");

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void foreignFailureBecomesBackendUnavailable() {
        assertThatThrownBy(() -> executor.call("db", Duration.ofSeconds(1), () -> {
            throw new IllegalStateException("connection refused");
        })).isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void upstreamFailureIsRethrownAsIs() {
        assertThatThrownBy(() -> executor.call("llm", Duration.ofSeconds(1), () -> {
            throw new UpstreamMalformedResponseException("empty");
        })).isInstanceOf(UpstreamMalformedResponseException.class);
    }
}
