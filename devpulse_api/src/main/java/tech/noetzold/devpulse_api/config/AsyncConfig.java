package tech.noetzold.devpulse_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tech.noetzold.devpulse_api.service.Sleeper;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    @Bean(name = "dashboardFanOutExecutor")
    public ThreadPoolTaskExecutor dashboardFanOutExecutor(@Value("${devpulse.fan-out.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("dashboard-fanout-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return d -> Thread.sleep(Math.max(1, d.toMillis()));
    }
}
