package com.modelguard.modelguard.alerting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Posts each notification as JSON to {@code alerting.webhook-url}. Connection errors, timeouts and 5xx
 * responses are retried with backoff; anything left is a {@link NotificationDeliveryException}.
 */
public class WebhookNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationChannel.class);

    private final WebClient webClient;
    private final AlertingProperties alertingProperties;

    public WebhookNotificationChannel(WebClient webClient, AlertingProperties alertingProperties) {
        this.webClient = webClient;
        this.alertingProperties = alertingProperties;
    }

    @Override
    public String name() {
        return AlertingConstants.WEBHOOK_CHANNEL;
    }

    @Override
    public void send(NotificationMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("severity", message.severity());
        body.put("summary", message.summary());
        body.put("detailPayload", message.detailPayload());
        body.put("escalate", message.escalate());
        body.put("subjectType", message.subjectType());
        body.put("subjectId", message.subjectId());

        try {
            webClient.post()
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(Duration.ofMillis(alertingProperties.getWebhookTimeoutMs()))
                    .retryWhen(Retry.backoff(alertingProperties.getWebhookMaxRetries(),
                                    Duration.ofMillis(alertingProperties.getWebhookBackoffMs()))
                            .filter(WebhookNotificationChannel::isRetryable)
                            .doBeforeRetry(signal -> log.warn("Webhook delivery failed (retry {}): {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .onErrorMap(ex -> new NotificationDeliveryException(name(), describe(ex), ex))
                    .block();
        } catch (NotificationDeliveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new NotificationDeliveryException(name(), describe(ex), ex);
        }
    }

    private static boolean isRetryable(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return failure instanceof WebClientRequestException || failure instanceof TimeoutException;
    }

    private static String describe(Throwable failure) {
        if (failure instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }
}
