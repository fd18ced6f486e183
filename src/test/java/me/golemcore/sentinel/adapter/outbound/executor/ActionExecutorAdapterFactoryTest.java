package me.golemcore.sentinel.adapter.outbound.executor;

import me.golemcore.sentinel.domain.model.ActionResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.anyMap;
import static org.mockito.Mockito.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActionExecutorAdapterFactoryTest {

    @Test
    void shouldFallBackToDryRunWhenNothingElseConfigured() {
        ActionExecutorAdapter webhook = mock(ActionExecutorAdapter.class);
        when(webhook.getExecutorId()).thenReturn("webhook");
        when(webhook.isConfigured()).thenReturn(false);
        ActionExecutorAdapterFactory factory = new ActionExecutorAdapterFactory(
                List.of(webhook, new DryRunActionExecutorAdapter()));

        factory.init();

        assertEquals("dry-run", factory.getExecutorId());
        ActionResult result = factory.execute("sendMessageToChat", Map.of("message", "hi")).join();
        assertTrue(result.success());
        assertEquals("dry-run", result.result());
        verify(webhook, never()).execute(anyString(), anyMap());
    }

    @Test
    void shouldRouteToConfiguredExecutor() {
        ActionExecutorAdapter webhook = mock(ActionExecutorAdapter.class);
        when(webhook.getExecutorId()).thenReturn("webhook");
        when(webhook.isConfigured()).thenReturn(true);
        when(webhook.execute(anyString(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(ActionResult.success("sent")));
        ActionExecutorAdapterFactory factory = new ActionExecutorAdapterFactory(
                List.of(new DryRunActionExecutorAdapter(), webhook));

        factory.init();

        assertEquals("webhook", factory.getExecutorId());
        assertEquals("sent", factory.execute("sendMessageToChat", Map.of()).join().result());
    }

    @Test
    void shouldFailWithoutAnyExecutor() {
        ActionExecutorAdapterFactory factory = new ActionExecutorAdapterFactory(List.of());

        factory.init();

        assertEquals("none", factory.getExecutorId());
        ActionResult result = factory.execute("banUser", Map.of()).join();
        assertFalse(result.success());
        assertEquals("No action executor registered", result.error());
    }
}
