package com.jreinhal.waypoint.config;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoutingExecutorConfigTest {

    private ThreadPoolExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void stageExecutorUsesConfiguredSizes() {
        RoutingProperties properties = new RoutingProperties();
        properties.getExecutor().setStageCoreThreads(3);
        properties.getExecutor().setStageMaxThreads(6);

        executor = new RoutingExecutorConfig().routingStageExecutor(properties);

        assertEquals(3, executor.getCorePoolSize());
        assertEquals(6, executor.getMaximumPoolSize());
        assertTrue(executor.allowsCoreThreadTimeOut());
    }

    @Test
    void llmExecutorUsesDefaults() {
        executor = new RoutingExecutorConfig().routingLlmExecutor(new RoutingProperties());

        assertEquals(4, executor.getCorePoolSize());
        assertEquals(16, executor.getMaximumPoolSize());
        assertEquals(200, executor.getQueue().remainingCapacity());
    }

    @Test
    void enforcesMinimums() {
        executor = RoutingExecutorConfig.buildExecutor("test-", 0, 0, 1);

        assertEquals(1, executor.getCorePoolSize());
        assertEquals(1, executor.getMaximumPoolSize());
        assertEquals(10, executor.getQueue().remainingCapacity());
    }

    @Test
    void threadsAreNamedWithPrefix() throws Exception {
        executor = RoutingExecutorConfig.buildExecutor("route-test-", 1, 1, 10);

        String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        assertTrue(name.startsWith("route-test-"));
    }

    @Test
    void overloadIsRejectedNotRunOnCaller() throws Exception {
        executor = RoutingExecutorConfig.buildExecutor("route-test-", 1, 1, 10);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            awaitQuietly(release);
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 10; i++) {
            executor.execute(() -> awaitQuietly(release));
        }

        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
        RoutingExecutorConfig.MonitoredRejectionHandler handler =
                (RoutingExecutorConfig.MonitoredRejectionHandler) executor.getRejectedExecutionHandler();
        assertEquals(1, handler.getRejectionCount());
        release.countDown();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
