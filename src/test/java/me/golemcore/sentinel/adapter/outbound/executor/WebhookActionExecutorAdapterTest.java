package me.golemcore.sentinel.adapter.outbound.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.sentinel.domain.model.ActionResult;
import me.golemcore.sentinel.infrastructure.config.SentinelProperties;
import me.golemcore.sentinel.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookActionExecutorAdapterTest {

    private static final String WEBHOOK_URL = "http://executor.test/actions";

    private SentinelProperties properties;
    private OkHttpMockEngine engine;
    private ObjectMapper objectMapper;
    private WebhookActionExecutorAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new SentinelProperties();
        properties.getExecutor().setWebhookUrl(WEBHOOK_URL);
        engine = new OkHttpMockEngine();
        objectMapper = new ObjectMapper();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new WebhookActionExecutorAdapter(properties, client, objectMapper);
    }

    @Test
    void shouldPostToolInvocationAsJson() throws IOException {
        engine.enqueueJson(200, "{\"success\": true, \"result\": {\"pollId\": \"p-1\"}}");

        ActionResult result = adapter.execute("createTwitchPoll",
                Map.of("title", "Next game?", "duration", 120)).join();

        assertTrue(result.success());
        assertEquals(Map.of("pollId", "p-1"), result.result());
        assertNull(result.error());

        OkHttpMockEngine.Captured request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals(WEBHOOK_URL, request.url());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("createTwitchPoll", body.get("tool").asText());
        assertEquals("Next game?", body.get("parameters").get("title").asText());
        assertEquals(120, body.get("parameters").get("duration").asInt());
    }

    @Test
    void shouldMapReportedFailure() {
        engine.enqueueJson(200, "{\"success\": false, \"error\": \"user not found\"}");

        ActionResult result = adapter.execute("timeoutUser", Map.of("usernameOrDescriptor", "ghost")).join();

        assertFalse(result.success());
        assertEquals("user not found", result.error());
    }

    @Test
    void shouldTreatPlainReplyAsSuccess() {
        engine.enqueueText(200, "  clip created  ");
        engine.enqueueText(204, "");

        ActionResult text = adapter.execute("createTwitchClip", Map.of()).join();
        ActionResult empty = adapter.execute("createTwitchClip", Map.of()).join();

        assertTrue(text.success());
        assertEquals("clip created", text.result());
        assertTrue(empty.success());
        assertNull(empty.result());
    }

    @Test
    void shouldFailOnHttpError() {
        engine.enqueueText(503, "unavailable");

        ActionResult result = adapter.execute("banUser", Map.of("usernameOrDescriptor", "u1")).join();

        assertFalse(result.success());
        assertEquals("HTTP 503", result.error());
    }

    @Test
    void shouldCompleteExceptionallyOnTransportError() {
        engine.enqueueFailure(new IOException("connection refused"));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.execute("sendMessageToChat", Map.of("message", "hi")).join());

        assertInstanceOf(RuntimeException.class, ex.getCause());
        assertInstanceOf(IOException.class, ex.getCause().getCause());
    }

    @Test
    void shouldRefuseWhenUrlMissing() {
        properties.getExecutor().setWebhookUrl(" ");

        ActionResult result = adapter.execute("sendMessageToChat", Map.of("message", "hi")).join();

        assertFalse(adapter.isConfigured());
        assertFalse(result.success());
        assertEquals("Webhook URL not configured", result.error());
        assertEquals(0, engine.requestCount());
    }

    @Test
    void shouldPreferConfiguredWebhookOverDryRun() {
        ActionExecutorAdapterFactory factory = new ActionExecutorAdapterFactory(
                List.of(new DryRunActionExecutorAdapter(), adapter));
        factory.init();
        engine.enqueueJson(200, "{\"success\": true}");

        assertEquals("webhook", factory.getExecutorId());
        assertTrue(factory.execute("createTwitchClip", Map.of()).join().success());
        assertEquals(1, engine.requestCount());
    }
}
