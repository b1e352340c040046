package me.golemcore.bench.domain.system.toolloop;

import me.golemcore.bench.domain.model.ToolCall;
import me.golemcore.bench.domain.model.ToolFailureKind;
import me.golemcore.bench.domain.model.ToolResult;
import me.golemcore.bench.domain.service.ToolRegistry;
import me.golemcore.bench.infrastructure.config.BenchProperties;
import me.golemcore.bench.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultToolExecutorTest {

    private BenchProperties.ToolLoopProperties settings;
    private DefaultToolExecutor executor;

    @BeforeEach
    void setUp() {
        settings = new BenchProperties.ToolLoopProperties();
        settings.setMaxToolResultChars(200);
        settings.setMaxErrorChars(40);
        settings.setToolTimeout(Duration.ofMillis(200));
        settings.setToolDrainTimeout(Duration.ofMillis(500));
        executor = new DefaultToolExecutor(settings, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"),
                ZoneOffset.UTC));
    }

    @Test
    void shouldPassParsedArgumentsToTool() {
        StubTool tool = StubTool.returning("web_fetch", "page text");

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("web_fetch", "{\"url\":\"https://a.b\"}"));

        assertEquals("page text", outcome.messageContent());
        assertEquals("https://a.b", tool.getInvocations().get(0).get("url"));
        assertFalse(outcome.synthetic());
        assertEquals("call_1", outcome.toolCallId());
    }

    @Test
    void shouldReturnSyntheticResultForUnknownTool() {
        ToolExecutionOutcome outcome = executor.execute(registry(), call("delete_everything", "{}"));

        assertTrue(outcome.synthetic());
        assertEquals("Unknown tool: delete_everything", outcome.messageContent());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, outcome.toolResult().getFailureKind());
    }

    @Test
    void shouldBoundUnknownToolMessage() {
        String name = "tool_" + "z".repeat(200);

        ToolExecutionOutcome outcome = executor.execute(registry(), call(name, "{}"));

        assertEquals(("Unknown tool: " + name).substring(0, 40) + "...", outcome.messageContent());
    }

    @Test
    void shouldRejectMalformedArgumentsWithoutCallingTool() {
        StubTool tool = StubTool.returning("web_fetch", "never");

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("web_fetch", "{\"url\": "));

        assertTrue(outcome.messageContent().startsWith("Tool error: invalid arguments JSON"));
        assertEquals("{\"url\": ", outcome.arguments().get("raw"));
        assertTrue(tool.getInvocations().isEmpty());
    }

    @Test
    void shouldConvertThrownErrorToBoundedToolError() {
        StubTool tool = StubTool.async("web_fetch",
                args -> CompletableFuture.failedFuture(new IllegalStateException("x".repeat(100))));

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("web_fetch", "{}"));

        assertEquals("Tool error: " + "x".repeat(40) + "...", outcome.messageContent());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, outcome.toolResult().getFailureKind());
    }

    @Test
    void shouldConvertSynchronousThrowToToolError() {
        StubTool tool = StubTool.async("web_fetch", args -> {
            throw new IllegalArgumentException("bad input");
        });

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("web_fetch", "{}"));

        assertEquals("Tool error: bad input", outcome.messageContent());
    }

    @Test
    void shouldTimeOutSlowTool() {
        StubTool tool = StubTool.async("analyze_page", args -> new CompletableFuture<>());

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("analyze_page", "{}"));

        assertEquals(ToolFailureKind.TIMEOUT, outcome.toolResult().getFailureKind());
        assertEquals("Tool error: timed out after 200ms", outcome.messageContent());
    }

    @Test
    void shouldWaitForTimedOutToolToStopBeforeReturning() {
        AtomicBoolean finished = new AtomicBoolean();
        StubTool tool = StubTool.async("video_transcript", args -> CompletableFuture.supplyAsync(() -> {
            try {
                Thread.sleep(350);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.set(true);
            return ToolResult.success("too late");
        }));

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("video_transcript", "{}"));

        assertEquals(ToolFailureKind.TIMEOUT, outcome.toolResult().getFailureKind());
        assertTrue(finished.get());
    }

    @Test
    void shouldKeepToolFailureKind() {
        StubTool tool = StubTool.answering("verifaible_cite",
                args -> ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "claim is required"));

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("verifaible_cite", "{}"));

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, outcome.toolResult().getFailureKind());
        assertEquals("Tool error: claim is required", outcome.messageContent());
    }

    @Test
    void shouldTruncateLongOutputWithMarker() {
        StubTool tool = StubTool.returning("web_fetch", "a".repeat(1000));

        ToolExecutionOutcome outcome = executor.execute(registry(tool), call("web_fetch", "{}"));

        assertEquals(200, outcome.messageContent().length());
        assertTrue(outcome.messageContent().contains("[OUTPUT TRUNCATED: 1000 chars total"));
    }

    @Test
    void shouldLeaveShortOutputUntouched() {
        assertEquals("short", executor.truncateToolResult("short", "web_fetch"));
        assertEquals("", executor.truncateToolResult(null, "web_fetch"));
    }

    private static ToolRegistry registry(StubTool... tools) {
        return new ToolRegistry(List.of(tools));
    }

    private static ToolCall call(String name, String arguments) {
        return ToolCall.builder().id("call_1").name(name).arguments(arguments).build();
    }
}
