package com.github.salilvnair.convflow.config;

import com.github.salilvnair.convflow.store.core.KeyValueStore;
import com.github.salilvnair.convflow.store.provider.InMemoryKeyValueStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan(
        basePackages = "com.github.salilvnair.convflow",
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = ConvFlowAutoConfiguration.class)
)
public class ConvFlowAutoConfiguration {

    public static final String COLLABORATOR_EXECUTOR = "convFlowCollaboratorExecutor";

    @Bean
    @ConditionalOnMissingBean
    public Clock convFlowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    public KeyValueStore convFlowKeyValueStore(Clock clock) {
        return new InMemoryKeyValueStore(clock);
    }

    @Bean(name = COLLABORATOR_EXECUTOR, destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = COLLABORATOR_EXECUTOR)
    public ExecutorService convFlowCollaboratorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "convflow-collaborator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
