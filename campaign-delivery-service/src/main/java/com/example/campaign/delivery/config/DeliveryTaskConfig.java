package com.example.campaign.delivery.config;

import com.example.campaign.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class DeliveryTaskConfig {

    /**
     * Per-recipient push calls. Shared by every campaign on this worker, so it bounds the
     * total number of in-flight pushes.
     */
    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(AppProperties appProperties) {
        int concurrency = appProperties.getDelivery().getConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("push-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * One thread per campaign audience pass. The queue is short; overflow is picked up by the poll sweep.
     */
    @Bean(name = "campaignExecutor")
    public ThreadPoolTaskExecutor campaignExecutor(AppProperties appProperties) {
        int campaigns = appProperties.getDelivery().getMaxConcurrentCampaigns();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(campaigns);
        executor.setMaxPoolSize(campaigns);
        executor.setQueueCapacity(campaigns * 10);
        executor.setThreadNamePrefix("campaign-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public WebClient pushWebClient(WebClient.Builder builder, AppProperties appProperties) {
        return builder.baseUrl(appProperties.getPush().getGatewayUrl()).build();
    }
}
