package buaa.search.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 异步任务执行器配置。
 * 摄取任务在独立线程池中执行，失败重试由调度器延迟投递，HTTP 触发的爬取在单独的单线程执行器中运行。
 */
@Configuration
public class AsyncConfig {

    /**
     * 摄取任务线程池。
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(SearchEngineProperties properties) {
        SearchEngineProperties.Ingestion ingestion = properties.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ingestion.getCorePoolSize());
        executor.setMaxPoolSize(ingestion.getMaxPoolSize());
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix("ingestion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 摄取任务重试调度器。
     */
    @Bean(name = "ingestionRetryScheduler")
    public ThreadPoolTaskScheduler ingestionRetryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ingestion-retry-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 爬取执行器，同一时间只运行一次爬取。
     */
    @Bean(name = "crawlExecutor")
    public ThreadPoolTaskExecutor crawlExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("crawler-");
        executor.initialize();
        return executor;
    }
}
