package io.github.drompincen.planloop.runtime.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PlanloopProperties.class)
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Bounded pool running feedback pipelines and triggered plan generation. */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(PlanloopProperties properties) {
        PlanloopProperties.Worker worker = properties.getWorker();
        int coreSize = Math.max(worker.getCoreSize(), 1);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(Math.max(worker.getMaxSize(), coreSize));
        executor.setQueueCapacity(Math.max(worker.getQueueCapacity(), 1));
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
