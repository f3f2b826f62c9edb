package com.meetbridge.config;

import com.meetbridge.service.BridgeEventLoop;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    /**
     * One thread: every bridge handler, timer and pipeline pump runs on it
     */
    @Bean
    public ThreadPoolTaskScheduler bridgeScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("bridge-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean
    public BridgeEventLoop bridgeEventLoop(ThreadPoolTaskScheduler bridgeScheduler) {
        return new BridgeEventLoop(bridgeScheduler, bridgeScheduler);
    }
}
