package com.bank.payout.config;

import com.bank.payout.support.TracingTaskDecorator;
import io.micrometer.tracing.Tracer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class WorkerPoolConfig {

    /**
     * Pool that drains merchant queues. Sized from configuration, independent of
     * request volume: a merchant occupies at most one thread at a time.
     */
    @Bean(name = "payoutWorkerExecutor")
    public ThreadPoolTaskExecutor payoutWorkerExecutor(AutomationConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = config.getDispatch().getWorkerPoolSize();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(size * 4);
        executor.setThreadNamePrefix("payout-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Alerts are sent off the caller's thread but keep its trace.
     */
    @Bean(name = "alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor(Tracer tracer) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new TracingTaskDecorator(tracer));
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("operator-alert-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
