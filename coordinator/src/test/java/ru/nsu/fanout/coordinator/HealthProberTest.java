package ru.nsu.fanout.coordinator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.common.ResultsCodec;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthProberTest {
    private static final WorkerEndpoint ALIVE = new WorkerEndpoint("127.0.0.1", 3001);
    private static final WorkerEndpoint DEAD = new WorkerEndpoint("127.0.0.1", 9999);

    @Mock
    private WorkerClient workerClient;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final WorkerRegistry registry = new WorkerRegistry();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void removesUnresponsiveAndKeepsResponsiveWorkers() {
        registry.register(ALIVE);
        registry.register(DEAD);
        when(workerClient.checkStatus(ALIVE)).thenReturn(true);
        when(workerClient.checkStatus(DEAD)).thenReturn(false);

        HealthProber prober = new HealthProber(registry, workerClient, executor);

        assertThat(prober.probe()).containsExactly(DEAD);
        assertThat(registry.snapshot()).containsExactly(ALIVE);
    }

    @Test
    void checkThatCrashesCountsAsDead() {
        registry.register(DEAD);
        when(workerClient.checkStatus(DEAD)).thenThrow(new IllegalStateException("boom"));

        new HealthProber(registry, workerClient, executor).probe();

        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void emptyRegistryNeedsNoChecks() {
        assertThat(new HealthProber(registry, workerClient, executor).probe()).isEmpty();
        verify(workerClient, never()).checkStatus(any());
    }

    @Test
    void interruptedProbeLeavesUncheckedWorkersRegistered() {
        registry.register(ALIVE);
        registry.register(DEAD);
        CountDownLatch release = new CountDownLatch(1);
        lenient().when(workerClient.checkStatus(any())).thenAnswer(invocation -> {
            release.await();
            return false;
        });

        Thread.currentThread().interrupt();
        try {
            assertThat(new HealthProber(registry, workerClient, executor).probe()).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
            release.countDown();
        }
        assertThat(registry.snapshot()).containsExactly(ALIVE, DEAD);
    }

    @Test
    void probesRealEndpointsOverHttp() throws Exception {
        try (StubWorker healthy = new StubWorker();
             StubWorker failing = new StubWorker().statusCode(500)) {
            WorkerEndpoint unreachable = StubWorker.unusedEndpoint();
            registry.register(healthy.endpoint());
            registry.register(failing.endpoint());
            registry.register(unreachable);

            HttpWorkerClient client = new HttpWorkerClient(
                    new ResultsCodec(JacksonConfig.createObjectMapper()), Duration.ofSeconds(2), Duration.ofSeconds(5));
            new HealthProber(registry, client, executor).probe();

            assertThat(registry.snapshot()).containsExactly(healthy.endpoint());
        }
    }
}
