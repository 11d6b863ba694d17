package com.khaounen.guard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.guard.security.mitigation.MitigationNotification;
import com.khaounen.guard.support.SimpleObjectProvider;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockAlertDispatcherTest {

    private static final MitigationNotification BLOCK =
            MitigationNotification.upsert("1.2.3.4", Duration.ofMinutes(60), 3, "EXTREME_RATE", 0L);

    @Test
    void payloadDescribesTheBlock() {
        BlockAlertDispatcher dispatcher = new BlockAlertDispatcher(new GuardAlertProperties(),
                new SimpleObjectProvider<>(null), new SimpleObjectProvider<>(null));

        Map<String, Object> payload = dispatcher.buildPayload(BLOCK, true);
        Map<String, Object> withoutReason = dispatcher.buildPayload(BLOCK, false);

        assertEquals("1970-01-01T00:00:00Z", payload.get("timestamp"));
        assertEquals("UPSERT", payload.get("action"));
        assertEquals("1.2.3.4", payload.get("identity"));
        assertEquals(3L, payload.get("generation"));
        assertEquals(3600L, payload.get("ttlSeconds"));
        assertEquals("EXTREME_RATE", payload.get("reason"));
        assertFalse(withoutReason.containsKey("reason"));
    }

    @Test
    void mailsBlocksButNotRemovals() {
        GuardAlertProperties properties = new GuardAlertProperties();
        properties.getSmtp().setEnabled(true);
        properties.getSmtp().setFrom("guard@example.com");
        properties.getSmtp().setTo(List.of("oncall@example.com"));
        RecordingMailSender sender = new RecordingMailSender();
        BlockAlertDispatcher dispatcher = new BlockAlertDispatcher(properties,
                new SimpleObjectProvider<>(null), new SimpleObjectProvider<JavaMailSender>(sender));

        dispatcher.onSynced(BLOCK);
        dispatcher.onSynced(MitigationNotification.remove("1.2.3.4", 4, "HOLD_EXPIRED", 0L));

        assertEquals(1, sender.sent.size());
        SimpleMailMessage message = sender.sent.get(0);
        assertEquals("Abuse guard block", message.getSubject());
        assertTrue(message.getText().contains("identity: 1.2.3.4"));
        assertTrue(message.getText().contains("reason: EXTREME_RATE"));
    }

    @Test
    void postsBlocksToTheWebhook() throws Exception {
        BlockingQueue<String> bodies = new ArrayBlockingQueue<>(4);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        try {
            GuardAlertProperties properties = new GuardAlertProperties();
            properties.getWebhook().setEnabled(true);
            properties.getWebhook().setUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/hook");
            properties.getWebhook().setIncludeReason(false);
            ObjectMapper mapper = new ObjectMapper();
            BlockAlertDispatcher dispatcher = new BlockAlertDispatcher(properties,
                    new SimpleObjectProvider<>(mapper), new SimpleObjectProvider<>(null));

            dispatcher.onSynced(BLOCK);

            String body = bodies.poll(5, TimeUnit.SECONDS);
            assertNotNull(body);
            JsonNode json = mapper.readTree(body);
            assertEquals("1.2.3.4", json.path("identity").asText());
            assertEquals(3600, json.path("ttlSeconds").asLong());
            assertNull(json.get("reason"));
        } finally {
            server.stop(0);
        }
    }

    private static final class RecordingMailSender extends JavaMailSenderImpl {
        private final List<SimpleMailMessage> sent = new CopyOnWriteArrayList<>();

        @Override
        public void send(SimpleMailMessage message) {
            sent.add(message);
        }

        @Override
        public void send(SimpleMailMessage... messages) {
            sent.addAll(List.of(messages));
        }
    }
}
