package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.SessionKey;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ToolDispatchServiceTest {

    private static final String CALL_ID = "call-1";

    private RuntimeProperties properties;
    private CountingTool echo;
    private ToolDispatchService dispatcher;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getTools().setTimeoutSeconds(1);
        echo = new CountingTool("echo", params -> CompletableFuture.completedFuture(
                ToolResult.success("echo: " + params.get("text"))));
        dispatcher = newDispatcher(echo);
    }

    private ToolDispatchService newDispatcher(ToolComponent... tools) {
        return new ToolDispatchService(List.of(tools), new ToolArgumentValidator(), new ToolSafetyPolicy(),
                properties);
    }

    @Test
    void dispatch_routesToToolAndStampsCallId() {
        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "echo", Map.of("text", "hi")));

        assertTrue(result.isSuccess());
        assertEquals("echo: hi", result.getOutput());
        assertEquals(CALL_ID, result.getCallId());
        assertEquals(1, echo.calls.get());
    }

    @Test
    void dispatch_unknownToolIsValidationErrorWithoutSideEffects() {
        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "delete_everything", Map.of()));

        assertFalse(result.isSuccess());
        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("delete_everything"));
        assertTrue(result.getError().contains("echo"));
        assertEquals(CALL_ID, result.getCallId());
        assertEquals(0, echo.calls.get());
    }

    @Test
    void dispatch_toolOutsideAllowedSetIsRejected() {
        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "echo", Map.of("text", "x")),
                ToolCallContext.of(null, "sa-1"), Set.of("read_file"));

        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertEquals(0, echo.calls.get());
    }

    @Test
    void dispatch_sanitizesLeakedTokensInName() {
        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "echo<|channel|>commentary",
                Map.of("text", "hi")));

        assertTrue(result.isSuccess());
    }

    @Test
    void dispatch_missingRequiredArgumentIsValidationError() {
        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "echo", Map.of()));

        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertTrue(result.getError().contains("text"));
        assertEquals(0, echo.calls.get());
    }

    @Test
    void dispatch_disabledToolIsRejected() {
        echo.enabled = false;

        ToolResult result = dispatcher.dispatch(ToolCallRequest.of(CALL_ID, "echo", Map.of("text", "x")));

        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getErrorKind());
        assertEquals(0, echo.calls.get());
    }

    @Test
    void dispatch_hazardousExecIsRefused() {
        CountingTool exec = new CountingTool("exec", params -> CompletableFuture.completedFuture(
                ToolResult.success("ran")));
        exec.paramName = "command";
        ToolDispatchService withExec = newDispatcher(exec);

        ToolResult result = withExec.dispatch(ToolCallRequest.of(CALL_ID, "exec", Map.of("command", "rm -rf /")));

        assertEquals(ToolErrorKind.SAFETY_WARNING, result.getErrorKind());
        assertEquals(0, exec.calls.get());
    }

    @Test
    void dispatch_slowToolTimesOut() {
        CompletableFuture<ToolResult> never = new CompletableFuture<>();
        CountingTool slow = new CountingTool("slow", params -> never);
        ToolDispatchService withSlow = newDispatcher(slow);

        ToolResult result = withSlow.dispatch(ToolCallRequest.of(CALL_ID, "slow", Map.of("text", "x")));

        assertEquals(ToolErrorKind.EXECUTION_TIMEOUT, result.getErrorKind());
        assertTrue(never.isCancelled());
    }

    @Test
    void dispatch_operationExceptionKeepsItsKind() {
        CountingTool failing = new CountingTool("lookup", params -> {
            throw OperationException.notFound("job_id", "abc");
        });

        ToolResult result = newDispatcher(failing).dispatch(ToolCallRequest.of(CALL_ID, "lookup",
                Map.of("text", "x")));

        assertEquals(ToolErrorKind.JOB_NOT_FOUND, result.getErrorKind());
        assertTrue(result.getError().contains("job_id"));
    }

    @Test
    void dispatch_asyncFailureIsExecutionFailed() {
        CountingTool failing = new CountingTool("broken", params -> CompletableFuture.supplyAsync(() -> {
            throw new IllegalStateException("disk on fire");
        }));

        ToolResult result = newDispatcher(failing).dispatch(ToolCallRequest.of(CALL_ID, "broken",
                Map.of("text", "x")));

        assertEquals(ToolErrorKind.EXECUTION_FAILED, result.getErrorKind());
        assertTrue(result.getError().contains("disk on fire"));
    }

    @Test
    void dispatch_cancelledToolFutureIsExecutionFailed() {
        CountingTool cancelled = new CountingTool("flaky", params -> {
            CompletableFuture<ToolResult> future = new CompletableFuture<>();
            future.cancel(true);
            return future;
        });

        ToolResult result = newDispatcher(cancelled).dispatch(ToolCallRequest.of(CALL_ID, "flaky",
                Map.of("text", "x")));

        assertFalse(result.isSuccess());
        assertEquals(ToolErrorKind.EXECUTION_FAILED, result.getErrorKind());
        assertEquals(CALL_ID, result.getCallId());
    }

    @Test
    void dispatch_truncatesLongOutput() {
        properties.getTools().setMaxResultChars(200);
        CountingTool verbose = new CountingTool("verbose", params -> CompletableFuture.completedFuture(
                ToolResult.success("x".repeat(10_000))));

        ToolResult result = newDispatcher(verbose).dispatch(ToolCallRequest.of(CALL_ID, "verbose",
                Map.of("text", "x")));

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().length() <= 200);
        assertTrue(result.getOutput().contains("OUTPUT TRUNCATED"));
    }

    @Test
    void dispatch_bindsContextDuringExecutionOnly() {
        AtomicReference<ToolCallContext> seen = new AtomicReference<>();
        CountingTool probe = new CountingTool("probe", params -> {
            seen.set(ToolCallContextHolder.get());
            return CompletableFuture.completedFuture(ToolResult.success("ok"));
        });
        SessionKey origin = new SessionKey("cli", "direct");

        newDispatcher(probe).dispatch(ToolCallRequest.of(CALL_ID, "probe", Map.of("text", "x")),
                ToolCallContext.of(origin, ToolCallContext.ACTOR_MAIN));

        assertEquals(origin, seen.get().origin());
        assertEquals(CALL_ID, seen.get().callId());
        assertNull(ToolCallContextHolder.get());
    }

    @Test
    void getDefinitions_filtersByAllowedSet() {
        CountingTool other = new CountingTool("other", params -> CompletableFuture.completedFuture(
                ToolResult.success("")));

        assertEquals(1, newDispatcher(echo, other).getDefinitions(Set.of("other")).size());
        assertEquals(2, newDispatcher(echo, other).getDefinitions(null).size());
    }

    private static class CountingTool implements ToolComponent {

        private final String name;
        private final java.util.function.Function<Map<String, Object>, CompletableFuture<ToolResult>> body;
        private final AtomicInteger calls = new AtomicInteger();
        private boolean enabled = true;
        private String paramName = "text";

        CountingTool(String name,
                java.util.function.Function<Map<String, Object>, CompletableFuture<ToolResult>> body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description("test tool")
                    .inputSchema(Map.of(
                            "type", "object",
                            "properties", Map.of(paramName, Map.of("type", "string")),
                            "required", List.of(paramName)))
                    .build();
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            calls.incrementAndGet();
            return body.apply(parameters);
        }
    }
}
