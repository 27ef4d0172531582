package com.electionlens.boothrecon.config;

import com.electionlens.boothrecon.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThreadPoolMetricsConfigTest {

    @Test
    @SuppressWarnings("unchecked")
    void bindsPoolGauges() {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).contestExecutor();
        ObjectProvider<ThreadPoolTaskExecutor> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(executor);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new ThreadPoolMetricsConfig(provider).contestExecutorMetrics().bindTo(registry);

        assertThat(registry.get("contest.pool.size").gauge().value()).isZero();
        assertThat(registry.get("contest.pool.queued").gauge().value()).isZero();
        assertThat(registry.find("contest.pool.active").gauge()).isNotNull();
        assertThat(registry.find("contest.pool.completed").gauge()).isNotNull();

        executor.shutdown();
    }
}
