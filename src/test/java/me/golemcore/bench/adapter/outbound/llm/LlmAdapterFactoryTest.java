package me.golemcore.bench.adapter.outbound.llm;

import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.TurnOutput;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private LlmProviderAdapter openRouter;
    private LlmProviderAdapter ark;
    private LlmAdapterFactory factory;

    @BeforeEach
    void setUp() {
        openRouter = mock(LlmProviderAdapter.class);
        when(openRouter.getProviderId()).thenReturn("openrouter");
        ark = mock(LlmProviderAdapter.class);
        when(ark.getProviderId()).thenReturn("ark");

        BenchProperties properties = new BenchProperties();
        properties.getLlm().getModelProviders().put("doubao-", "ark");
        properties.getLlm().getModelProviders().put("local/", "ollama");
        factory = new LlmAdapterFactory(properties, List.of(openRouter, ark));
        factory.init();
    }

    @Test
    void shouldRouteByModelPrefix() {
        assertEquals("ark", factory.resolveProviderId("doubao-seed-2.0-pro"));
        assertEquals("openrouter", factory.resolveProviderId("moonshotai/kimi-k2.5"));
        assertEquals("openrouter", factory.resolveProviderId(null));
    }

    @Test
    void shouldDelegateChatAndInitializeOnce() throws Exception {
        TurnOutput output = TurnOutput.builder().responseId("r").build();
        when(ark.chat(any())).thenReturn(CompletableFuture.completedFuture(output));
        LlmRequest request = LlmRequest.builder().model("doubao-seed-2.0-lite").build();

        assertSame(output, factory.chat(request).get());
        factory.chat(request).get();

        verify(ark, times(1)).initialize();
        verify(ark, times(2)).chat(request);
        verify(openRouter, never()).chat(any());
    }

    @Test
    void shouldFailFutureForUnregisteredProvider() {
        CompletableFuture<TurnOutput> future = factory.chat(LlmRequest.builder().model("local/llama").build());

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("ollama"));
    }

    @Test
    void shouldReportAvailabilityPerProvider() {
        when(ark.isAvailable()).thenReturn(true);

        assertTrue(factory.isProviderAvailable("ark"));
        assertFalse(factory.isProviderAvailable("openrouter"));
        assertTrue(factory.isAvailable());
    }
}
