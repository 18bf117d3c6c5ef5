package com.modelguard.modelguard.alerting;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(AlertingProperties.class)
public class AlertingConfig {

    @Bean
    public NotificationPolicy notificationPolicy(AlertingProperties alertingProperties) {
        if (alertingProperties.getMaxDeliveryAttempts() < 1) {
            throw new IllegalArgumentException("alerting.max-delivery-attempts must be at least 1");
        }
        return new NotificationPolicy(alertingProperties.isNotifyOnPromotion());
    }

    @Bean
    @ConditionalOnProperty(prefix = "alerting", name = "webhook-url")
    public WebhookNotificationChannel webhookNotificationChannel(
            WebClient.Builder builder,
            AlertingProperties alertingProperties
    ) {
        WebClient webClient = builder.clone()
                .baseUrl(alertingProperties.getWebhookUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        return new WebhookNotificationChannel(webClient, alertingProperties);
    }
}
