package com.trailerlink.backend.global.config;

import java.time.Clock;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import com.trailerlink.backend.modules.store.application.StoreConnectionManager;

/**
 * Wires the store connection manager ahead of JPA: the {@link DataSource} bean is only handed out
 * once the manager has connected and brought the schema up to date, so a store that cannot be
 * reached aborts context startup.
 */
@Configuration
public class StoreConfig {

    @Bean
    public ThreadPoolTaskScheduler heartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("store-heartbeat-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public StoreConnectionManager storeConnectionManager(
            StoreProperties storeProperties,
            @Qualifier("heartbeatTaskScheduler") TaskScheduler heartbeatTaskScheduler,
            Clock clock
    ) {
        return new StoreConnectionManager(storeProperties, heartbeatTaskScheduler, clock);
    }

    // the manager owns the pool and closes it on shutdown
    @Bean(destroyMethod = "")
    public DataSource dataSource(StoreConnectionManager storeConnectionManager) {
        DataSource dataSource = storeConnectionManager.connect();
        storeConnectionManager.ensureSchema();
        return dataSource;
    }
}
