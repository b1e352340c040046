package me.golemcore.bench.domain.system.toolloop;

import me.golemcore.bench.domain.model.AgentSession;
import me.golemcore.bench.domain.model.BenchmarkCase;
import me.golemcore.bench.domain.model.ConversationItem;
import me.golemcore.bench.domain.model.LlmRequest;
import me.golemcore.bench.domain.model.OutputItem;
import me.golemcore.bench.domain.model.SessionStatus;
import me.golemcore.bench.domain.model.TokenUsage;
import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.domain.model.TurnOutput;
import me.golemcore.bench.domain.service.ScoringEngine;
import me.golemcore.bench.domain.service.ToolRegistry;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.port.outbound.LlmPort;
import me.golemcore.bench.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String MODEL = "moonshotai/kimi-k2.5";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private LlmPort llmPort;
    private BenchProperties.ToolLoopProperties settings;
    private DefaultToolLoopSystem loop;
    private List<String> executionOrder;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        settings = new BenchProperties.ToolLoopProperties();
        settings.setToolTimeout(Duration.ofSeconds(5));
        loop = new DefaultToolLoopSystem(llmPort, new DefaultToolExecutor(settings, CLOCK),
                new TextToolCallExtractor(), settings, CLOCK);
        executionOrder = new ArrayList<>();
    }

    @Test
    void shouldCompleteOnTextOnlyResponse() {
        when(llmPort.chat(any())).thenReturn(respond("r1", new TokenUsage(100, 20),
                new OutputItem.ReasoningOutput("thinking"), new OutputItem.TextOutput("The answer is 42 [@v:1]")));

        AgentSession session = loop.run(request(registry()));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals("The answer is 42 [@v:1]", session.getAnswer());
        assertEquals(1, session.getRoundTrips());
        assertEquals(1, session.getTurns().size());
        assertEquals("thinking", session.getTurns().get(0).reasoning());
        assertEquals(120, session.getTotalUsage().totalTokens());
        List<ConversationItem> items = session.getConversation().getItems();
        assertEquals(ConversationItem.Type.ASSISTANT, items.get(items.size() - 1).getType());
    }

    @Test
    void shouldDispatchToolCallsSequentiallyInEmittedOrder() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", new TokenUsage(10, 5),
                        new OutputItem.TextOutput("Let me look."),
                        toolCall("c1", "web_fetch", "{\"url\":\"https://a\"}"),
                        toolCall("c2", "verifaible_cite", "{\"claim\":\"x\"}")),
                respond("r2", new TokenUsage(20, 5), new OutputItem.TextOutput("Done [@v:3]")));

        AgentSession session = loop.run(request(registry(
                recording("web_fetch", "page"), recording("verifaible_cite", "Citation created (user_seq=3)."))));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals(List.of("web_fetch", "verifaible_cite"), executionOrder);
        assertEquals(2, session.getToolCallCount());
        assertEquals(2, session.getRoundTrips());
        assertEquals(40, session.getTotalUsage().totalTokens());

        List<ConversationItem.Type> types = session.getConversation().getItems().stream()
                .map(ConversationItem::getType).toList();
        assertEquals(List.of(ConversationItem.Type.SYSTEM, ConversationItem.Type.USER,
                ConversationItem.Type.ASSISTANT, ConversationItem.Type.TOOL_CALL, ConversationItem.Type.TOOL_CALL,
                ConversationItem.Type.TOOL_RESULT, ConversationItem.Type.TOOL_RESULT,
                ConversationItem.Type.ASSISTANT), types);
        List<ConversationItem> items = session.getConversation().getItems();
        assertEquals("c1", items.get(5).getCallId());
        assertEquals("page", items.get(5).getContent());
        assertEquals("c2", items.get(6).getCallId());

        assertEquals(1, ScoringEngine.citeCalls(session.getTurns()).size());
        assertEquals("x", session.getTurns().get(0).toolCalls().get(1).arguments().get("claim"));
    }

    @Test
    void shouldPassPreviousResponseIdToNextRound() {
        when(llmPort.chat(any())).thenReturn(
                respond("resp_1", null, toolCall("c1", "web_fetch", "{}")),
                respond("resp_2", null, new OutputItem.TextOutput("done")));

        loop.run(request(registry(recording("web_fetch", "ok"))));

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        assertNull(captor.getAllValues().get(0).getPreviousResponseId());
        assertEquals("resp_1", captor.getAllValues().get(1).getPreviousResponseId());
        assertEquals(MODEL, captor.getAllValues().get(1).getModel());
        assertEquals(1, captor.getAllValues().get(0).getTools().size());
        assertEquals(Double.valueOf(0.3), captor.getAllValues().get(0).getTemperature());
    }

    @Test
    void shouldRecoverToolCallsEmbeddedInText() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", null, new OutputItem.TextOutput(
                        "<tool_call>{\"name\":\"web_fetch\",\"arguments\":{\"url\":\"https://x\"}}</tool_call>")),
                respond("r2", null, new OutputItem.TextOutput("final")));

        StubTool fetch = recording("web_fetch", "content");
        AgentSession session = loop.run(request(registry(fetch)));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals("https://x", fetch.getInvocations().get(0).get("url"));
        assertEquals("", session.getTurns().get(0).content());
        List<ConversationItem.Type> types = session.getConversation().getItems().stream()
                .map(ConversationItem::getType).toList();
        assertEquals(ConversationItem.Type.TOOL_CALL, types.get(2));
    }

    @Test
    void shouldPreferStructuredCallsOverEmbeddedText() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", null,
                        new OutputItem.TextOutput(
                                "<tool_call>{\"name\":\"analyze_page\",\"arguments\":{}}</tool_call>"),
                        toolCall("c1", "web_fetch", "{}")),
                respond("r2", null, new OutputItem.TextOutput("final")));

        loop.run(request(registry(recording("web_fetch", "a"), recording("analyze_page", "b"))));

        assertEquals(List.of("web_fetch"), executionOrder);
    }

    @Test
    void shouldStopAtRoundCapWithPlaceholderAnswer() {
        when(llmPort.chat(any())).thenAnswer(invocation -> respond(null, new TokenUsage(1, 1),
                toolCall("c1", "web_fetch", "{}")));

        AgentSession session = loop.run(request(registry(recording("web_fetch", "again"))));

        assertEquals(SessionStatus.MAX_ROUNDS_EXCEEDED, session.getStatus());
        assertEquals(30, session.getRoundTrips());
        assertEquals(AgentSession.MAX_ROUNDS_PLACEHOLDER, session.getAnswer());
        assertEquals(30, session.getTurns().size());
        verify(llmPort, times(30)).chat(any());

        BenchmarkCase testCase = BenchmarkCase.builder().id("e").category("text").answer("42").build();
        assertEquals(0, new ScoringEngine().score(testCase, session.getAnswer(), session.getTurns()).totalScore());
    }

    @Test
    void shouldReplaceReusedCallIds() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", null, toolCall("call_0", "web_fetch", "{}")),
                respond("r2", null, toolCall("call_0", "web_fetch", "{}")),
                respond("r3", null, new OutputItem.TextOutput("done")));

        AgentSession session = loop.run(request(registry(recording("web_fetch", "ok"))));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        List<String> callIds = session.getConversation().getItems().stream()
                .filter(ConversationItem::isToolCall)
                .map(ConversationItem::getCallId)
                .toList();
        assertEquals(2, callIds.size());
        assertEquals("call_0", callIds.get(0));
        assertNotEquals("call_0", callIds.get(1));
    }

    @Test
    void shouldFailSessionOnProviderError() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", new TokenUsage(5, 5), toolCall("c1", "web_fetch", "{}")),
                CompletableFuture.failedFuture(new IllegalStateException("openrouter failed after 6 attempts")));

        AgentSession session = loop.run(request(registry(recording("web_fetch", "ok"))));

        assertEquals(SessionStatus.FAILED, session.getStatus());
        assertEquals("openrouter failed after 6 attempts", session.getError());
        assertTrue(session.isFailed());
        assertEquals(10, session.getTotalUsage().totalTokens());
        assertEquals(1, session.getTurns().size());
    }

    @Test
    void shouldContinueAfterUnknownToolAndToolErrors() {
        when(llmPort.chat(any())).thenReturn(
                respond("r1", null,
                        toolCall("c1", "no_such_tool", "{}"),
                        toolCall("c2", "web_fetch", "not json")),
                respond("r2", null, new OutputItem.TextOutput("gave up")));

        AgentSession session = loop.run(request(registry(recording("web_fetch", "ok"))));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        List<ConversationItem> results = session.getConversation().getItems().stream()
                .filter(ConversationItem::isToolResult).toList();
        assertEquals("Unknown tool: no_such_tool", results.get(0).getContent());
        assertTrue(results.get(1).getContent().startsWith("Tool error: invalid arguments JSON"));
        assertTrue(executionOrder.isEmpty());
    }

    @Test
    void shouldCapRecordedResultButKeepFullConversationContent() {
        settings.setMaxRecordedResultChars(10);
        when(llmPort.chat(any())).thenReturn(
                respond("r1", null, toolCall("c1", "web_fetch", "{}")),
                respond("r2", null, new OutputItem.TextOutput("done")));

        AgentSession session = loop.run(request(registry(recording("web_fetch", "0123456789abcdef"))));

        assertEquals("0123456789" + DefaultToolLoopSystem.RECORD_TRUNCATED_MARKER,
                session.getTurns().get(0).toolCalls().get(0).result());
        assertEquals("0123456789abcdef", session.getConversation().getItems().stream()
                .filter(ConversationItem::isToolResult).findFirst().orElseThrow().getContent());
    }

    @Test
    void shouldHonourPerRequestRoundCap() {
        when(llmPort.chat(any())).thenAnswer(invocation -> respond(null, null, toolCall("c", "web_fetch", "{}")));

        AgentSession session = loop.run(LoopRequest.builder()
                .model(MODEL)
                .systemPrompt("system")
                .userMessage("question")
                .registry(registry(recording("web_fetch", "ok")))
                .maxRoundTrips(3)
                .build());

        assertEquals(SessionStatus.MAX_ROUNDS_EXCEEDED, session.getStatus());
        assertEquals(3, session.getRoundTrips());
    }

    @Test
    void shouldNotStartNextToolWhileTimedOutToolIsStillRunning() {
        settings.setToolTimeout(Duration.ofMillis(100));
        AtomicBoolean slowRunning = new AtomicBoolean();
        AtomicBoolean overlapSeen = new AtomicBoolean();
        StubTool slow = StubTool.async("analyze_page", args -> CompletableFuture.supplyAsync(() -> {
            slowRunning.set(true);
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                slowRunning.set(false);
            }
            return ToolResult.success("late");
        }));
        StubTool next = StubTool.answering("web_fetch", args -> {
            overlapSeen.set(slowRunning.get());
            return ToolResult.success("page");
        });
        when(llmPort.chat(any())).thenReturn(
                respond("r1", TokenUsage.ZERO,
                        toolCall("c1", "analyze_page", "{}"),
                        toolCall("c2", "web_fetch", "{}")),
                respond("r2", TokenUsage.ZERO, new OutputItem.TextOutput("done")));

        AgentSession session = loop.run(request(registry(slow, next)));

        assertEquals(SessionStatus.COMPLETED, session.getStatus());
        assertEquals("Tool error: timed out after 100ms", session.getTurns().get(0).toolCalls().get(0).result());
        assertEquals(1, next.getInvocations().size());
        assertFalse(overlapSeen.get());
    }

    @Test
    void shouldBoundErrorWhenExecutorItselfThrows() {
        settings.setMaxErrorChars(50);
        ToolExecutorPort failingExecutor = mock(ToolExecutorPort.class);
        when(failingExecutor.execute(any(), any())).thenThrow(new IllegalStateException("boom ".repeat(100)));
        DefaultToolLoopSystem failingLoop = new DefaultToolLoopSystem(llmPort, failingExecutor,
                new TextToolCallExtractor(), settings, CLOCK);
        when(llmPort.chat(any())).thenReturn(
                respond("r1", TokenUsage.ZERO, toolCall("c1", "web_fetch", "{}")),
                respond("r2", TokenUsage.ZERO, new OutputItem.TextOutput("done")));

        AgentSession session = failingLoop.run(request(registry(recording("web_fetch", "page"))));

        String result = session.getConversation().getItems().stream()
                .filter(ConversationItem::isToolResult)
                .findFirst().orElseThrow().getContent();
        assertEquals("Tool error: " + ("Tool execution failed: " + "boom ".repeat(100)).substring(0, 50) + "...",
                result);
    }

    private StubTool recording(String name, String output) {
        return StubTool.answering(name, args -> {
            executionOrder.add(name);
            return ToolResult.success(output);
        });
    }

    private static ToolRegistry registry(StubTool... tools) {
        return new ToolRegistry(List.of(tools));
    }

    private static LoopRequest request(ToolRegistry registry) {
        return LoopRequest.builder()
                .model(MODEL)
                .systemPrompt("system")
                .userMessage("question")
                .registry(registry)
                .build();
    }

    private static OutputItem toolCall(String id, String name, String arguments) {
        return new OutputItem.ToolCallOutput(ToolCall.builder().id(id).name(name).arguments(arguments).build());
    }

    private static CompletableFuture<TurnOutput> respond(String id, TokenUsage usage, OutputItem... items) {
        return CompletableFuture.completedFuture(TurnOutput.builder()
                .responseId(id)
                .model(MODEL)
                .status("completed")
                .items(List.of(items))
                .usage(usage)
                .build());
    }
}
