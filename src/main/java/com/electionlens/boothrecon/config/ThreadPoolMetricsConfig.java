package com.electionlens.boothrecon.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the contest executor through Micrometer.
 *
 * <ul>
 *   <li>contest.pool.size - current number of threads</li>
 *   <li>contest.pool.active - threads running a contest</li>
 *   <li>contest.pool.queued - contests waiting for a thread</li>
 *   <li>contest.pool.completed - contests finished since start-up</li>
 * </ul>
 *
 * <p>Available at {@code GET /actuator/metrics/contest.pool.active}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> contestExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("contestExecutor") ObjectProvider<ThreadPoolTaskExecutor> contestExecutorProvider) {
        this.contestExecutorProvider = contestExecutorProvider;
    }

    @Bean
    public MeterBinder contestExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = contestExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("contest.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the contest pool")
                    .register(registry);
            Gauge.builder("contest.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads processing a contest")
                    .register(registry);
            Gauge.builder("contest.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of contests waiting in the queue")
                    .register(registry);
            Gauge.builder("contest.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of processed contests")
                    .register(registry);

            LOG.info("Contest pool metrics registered: contest.pool.*");
        };
    }
}
