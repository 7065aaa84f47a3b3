package com.jefflower.translator.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class WorkerConfig {

    @Bean
    public RestTemplate listingApiRestTemplate(RestTemplateBuilder builder, ListingApiProperties apiProperties) {
        return builder
                .setConnectTimeout(apiProperties.getConnectTimeout())
                .setReadTimeout(apiProperties.getReadTimeout())
                .build();
    }

    /**
     * 批次内并发处理房源的线程池，关闭时等待进行中的房源写库完成
     */
    @Bean(name = "propertyTaskExecutor")
    public ThreadPoolTaskExecutor propertyTaskExecutor(WorkerProperties workerProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerProperties.getConcurrency());
        executor.setMaxPoolSize(workerProperties.getConcurrency());
        executor.setQueueCapacity(workerProperties.getBatchSize());
        executor.setThreadNamePrefix("property-translate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(workerProperties.getShutdownGracePeriod());
        // 队列满时由调用线程执行，保证每个已提交的房源都有结果
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
