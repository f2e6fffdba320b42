package com.trustgate.steering.notify;

import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.prediction.NotifyCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Posts steering notices to a Slack incoming webhook. Fire-and-forget: a failed post is logged
 * and never reaches the scheduler. With Slack disabled every notice is logged instead.
 */
@Component
public class ChannelNotifier implements NotifyCallback {

    private static final Logger log = LoggerFactory.getLogger(ChannelNotifier.class);

    private final WebClient webClient;
    private final String webhookUrl;
    private final boolean enabled;
    private final String opsChannel;

    public ChannelNotifier(WebClient.Builder builder,
                           @Value("${notification.slack.webhook-url:}") String webhookUrl,
                           @Value("${notification.slack.enabled:false}") boolean enabled,
                           @Value("${notification.slack.ops-channel:trust-ops}") String opsChannel) {
        this.webClient  = builder.build();
        this.webhookUrl = webhookUrl;
        this.enabled    = enabled;
        this.opsChannel = opsChannel;
    }

    @Override
    public void notify(String contextRef, String message) {
        String text = String.format("`%s`%n%s", contextRef, message);
        if (!enabled || webhookUrl == null || webhookUrl.isBlank()) {
            log.info("[ChannelNotifier] NOTICE contextRef={} | {}", contextRef, message.replace('\n', ' '));
            return;
        }

        webClient.post()
            .uri(webhookUrl)
            .bodyValue(Map.of("text", text))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.debug("[ChannelNotifier] notice sent. contextRef={} status={}", contextRef, r.getStatusCode()),
                err -> log.warn("[ChannelNotifier] notice failed (non-critical). contextRef={}", contextRef, err)
            );
    }

    /** Denials go to the operations channel rather than the room that asked. */
    public void denied(DenialEvent event) {
        notify(opsChannel, String.format("DENIED `%s` for skill `%s`%nOverlap: %.2f < %.2f | Sovereignty: %.3f (min %.2f)%nFailed: %s",
            event.action(), event.skill(), event.overlap(), event.threshold(),
            event.sovereignty(), event.minSovereignty(), event.failedCategories()));
    }
}
