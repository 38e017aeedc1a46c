package com.teenagi.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for the two blocking steps of every loop iteration.
 *
 * The request thread hands the model round-trip and each function call to a
 * pool and waits with a deadline, so a hung backend or function can be
 * abandoned. Separate pools keep slow functions from starving model calls.
 * Work queued beyond the core size waits without using up its deadline, which
 * starts once a worker picks it up (see TimeLimitedExecutor).
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "decisionTaskExecutor")
    public AsyncTaskExecutor decisionTaskExecutor(AgentProperties properties) {
        return pool("decision-", properties.getDecisionPool());
    }

    @Bean(name = "functionTaskExecutor")
    public AsyncTaskExecutor functionTaskExecutor(AgentProperties properties) {
        return pool("function-", properties.getFunctionPool());
    }

    private static ThreadPoolTaskExecutor pool(String prefix, AgentProperties.Pool settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
