package com.baskettecase.sqlgate.notify;

import com.baskettecase.sqlgate.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Chooses the notification sink and the executor that delivers to it.
 */
@Slf4j
@Configuration
public class NotificationConfig {

    @Bean
    public NotificationSink notificationSink(GatewayProperties properties, RestClient.Builder restClientBuilder) {
        GatewayProperties.Notification notification = properties.getNotification();
        String webhookUrl = notification.getSlackWebhookUrl();
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.info("No Slack webhook configured, approval requests will only be logged");
            return new LoggingNotificationSink();
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(notification.getTimeout());
        requestFactory.setReadTimeout(notification.getTimeout());

        RestClient restClient = restClientBuilder.requestFactory(requestFactory).build();
        log.info("✅ Approval requests will be posted to Slack");
        return new SlackNotificationSink(restClient, webhookUrl, notification.getMaxQueryChars());
    }

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("sqlgate-notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
