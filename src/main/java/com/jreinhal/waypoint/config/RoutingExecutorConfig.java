package com.jreinhal.waypoint.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the routing pipeline.
 *
 * <p>Two pools are kept apart on purpose: the stage pool runs the concurrent search and tone
 * stages, which themselves block on model calls submitted to the LLM pool. Sharing one pool
 * could starve the inner calls once every worker is waiting on an outer stage.</p>
 *
 * <p>A full queue is rejected with {@link RejectedExecutionException}; stages catch it and take
 * their fallback path.</p>
 */
@Configuration
public class RoutingExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingExecutorConfig.class);

    @Bean(name = {"routingStageExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor routingStageExecutor(RoutingProperties properties) {
        RoutingProperties.Executor cfg = properties.getExecutor();
        return buildExecutor("route-stage-", cfg.getStageCoreThreads(), cfg.getStageMaxThreads(),
                cfg.getStageQueueCapacity());
    }

    @Bean(name = {"routingLlmExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor routingLlmExecutor(RoutingProperties properties) {
        RoutingProperties.Executor cfg = properties.getExecutor();
        return buildExecutor("route-llm-", cfg.getLlmCoreThreads(), cfg.getLlmMaxThreads(),
                cfg.getLlmQueueCapacity());
    }

    static ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Routing pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Logs overload and rejects. Never runs the task on the caller thread, which would stall the
     * request that is waiting on the pipeline.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from routing pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException("Routing pool '" + this.poolName + "' overloaded (rejected "
                    + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
