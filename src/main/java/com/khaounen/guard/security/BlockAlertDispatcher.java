package com.khaounen.guard.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.security.mitigation.MitigationAction;
import com.khaounen.guard.security.mitigation.MitigationNotification;
import com.khaounen.guard.security.mitigation.MitigationSyncListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Announces blocks that reached the edge over a webhook and/or SMTP.
 */
@Slf4j
public class BlockAlertDispatcher implements MitigationSyncListener {

    private final GuardAlertProperties properties;
    private final ObjectProvider<ObjectMapper> objectMapperProvider;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public BlockAlertDispatcher(
            GuardAlertProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<JavaMailSender> mailSenderProvider
    ) {
        this.properties = properties;
        this.objectMapperProvider = objectMapperProvider;
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public void onSynced(MitigationNotification notification) {
        if (properties == null || notification.action() != MitigationAction.UPSERT) {
            return;
        }
        sendWebhook(notification);
        sendSmtp(notification);
    }

    private void sendWebhook(MitigationNotification notification) {
        GuardAlertProperties.Webhook webhook = properties.getWebhook();
        if (webhook == null || !webhook.isEnabled() || webhook.getUrl() == null || webhook.getUrl().isBlank()) {
            return;
        }
        try {
            ObjectMapper mapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
            String payload = mapper.writeValueAsString(buildPayload(notification, webhook.isIncludeReason()));
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(webhook.getConnectTimeoutMs()))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(webhook.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();
            client.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (Exception ex) {
            log.warn("block webhook alert failed: {}", ex.getMessage());
        }
    }

    private void sendSmtp(MitigationNotification notification) {
        GuardAlertProperties.Smtp smtp = properties.getSmtp();
        if (smtp == null || !smtp.isEnabled()) {
            return;
        }
        JavaMailSender sender = mailSenderProvider.getIfAvailable();
        if (sender == null || smtp.getFrom() == null || smtp.getFrom().isBlank() || smtp.getTo().isEmpty()) {
            return;
        }
        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(smtp.getFrom());
            message.setTo(smtp.getTo().toArray(new String[0]));
            message.setSubject(smtp.getSubject());
            message.setText(buildMailBody(notification, smtp.isIncludeReason()));
            sender.send(message);
        } catch (Exception ex) {
            log.warn("block smtp alert failed: {}", ex.getMessage());
        }
    }

    Map<String, Object> buildPayload(MitigationNotification notification, boolean includeReason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.ofEpochMilli(notification.createdAt()).toString());
        payload.put("action", notification.action().name());
        payload.put("identity", notification.identity());
        payload.put("generation", notification.generation());
        payload.put("ttlSeconds", notification.ttl() == null ? null : notification.ttl().toSeconds());
        if (includeReason) {
            payload.put("reason", notification.reason());
        }
        return payload;
    }

    private String buildMailBody(MitigationNotification notification, boolean includeReason) {
        StringBuilder sb = new StringBuilder();
        sb.append("Abuse guard block\n");
        sb.append("timestamp: ").append(Instant.ofEpochMilli(notification.createdAt())).append('\n');
        sb.append("identity: ").append(notification.identity()).append('\n');
        sb.append("generation: ").append(notification.generation()).append('\n');
        sb.append("ttl: ").append(notification.ttl() == null ? "none" : notification.ttl()).append('\n');
        if (includeReason) {
            sb.append("reason: ").append(notification.reason()).append('\n');
        }
        return sb.toString();
    }
}
