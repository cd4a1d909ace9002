package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.config.ToolSettings;
import com.zzf.orchestrator.config.TurnConfig;
import com.zzf.orchestrator.core.plan.ExecutionMode;
import com.zzf.orchestrator.core.policy.DecisionReason;
import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.CallOrigin;
import com.zzf.orchestrator.core.protocol.CallSource;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ExecutorService executor;
    private ToolDispatcher dispatcher;
    private TurnConfig config;

    private final AtomicInteger echoCalls = new AtomicInteger();
    private final CountDownLatch cancelled = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        ToolRegistry registry = new ToolRegistry();
        registry.register(new EchoTool());
        registry.register(new SlowTool());
        registry.register(new BrokenTool());
        dispatcher = new ToolDispatcher(registry, new ArgumentCoercer(mapper), executor, mapper);

        Map<String, ToolDescriptor> enabled = new LinkedHashMap<>();
        Map<String, ToolSettings> settings = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : registry.listDescriptors()) {
            enabled.put(descriptor.getName(), descriptor);
            settings.put(descriptor.getName(), ToolSettings.builder().name(descriptor.getName()).enabled(true).build());
        }
        config = new TurnConfig(ExecutionMode.SINGLE_PASS, enabled, settings, 30, 300);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunAuthorizedCall() {
        ToolInvocationRequest request = ToolInvocationRequest.of("echo", Map.of("text", "hi", "times", "2"));

        ToolResult result = dispatcher.dispatch(request, allow(request, 5), config);

        assertTrue(result.isSuccess());
        assertEquals("hihi", result.getData().get("echo").asText());
        assertEquals(request.getCallId(), result.getCallId());
        assertTrue(result.getTookMs() >= 0);
    }

    @Test
    void shouldRefuseWithoutPassingDecision() {
        ToolInvocationRequest request = ToolInvocationRequest.of("echo", Map.of("text", "hi"));
        SecurityDecision denied = SecurityDecision.builder()
                .allowed(false)
                .reason(DecisionReason.NOT_WHITELISTED)
                .fingerprint(request.fingerprint())
                .build();

        assertEquals(ToolStatus.REFUSED, dispatcher.dispatch(request, denied, config).getStatus());
        assertEquals(ToolStatus.REFUSED, dispatcher.dispatch(request, null, config).getStatus());
        assertEquals(0, echoCalls.get());
    }

    @Test
    void shouldRefuseDecisionIssuedForAnotherRequest() {
        ToolInvocationRequest approved = ToolInvocationRequest.of("echo", Map.of("text", "safe"));
        ToolInvocationRequest other = ToolInvocationRequest.of("echo", Map.of("text", "other"));

        ToolResult result = dispatcher.dispatch(other, allow(approved, 5), config);

        assertEquals(ToolStatus.REFUSED, result.getStatus());
        assertEquals(0, echoCalls.get());
    }

    @Test
    void shouldRefuseNonStreamableToolFromStreamedPass() {
        ToolInvocationRequest request = new ToolInvocationRequest(null, "echo", Map.of("text", "hi"),
                new CallOrigin(1, true, CallSource.TAGGED_TEXT));

        ToolResult result = dispatcher.dispatch(request, allow(request, 5), config);

        assertEquals(ToolStatus.REFUSED, result.getStatus());
    }

    @Test
    void shouldRefuseToolMissingFromTurnConfig() {
        TurnConfig empty = new TurnConfig(ExecutionMode.SINGLE_PASS, Map.of(), Map.of(), 30, 300);
        ToolInvocationRequest request = ToolInvocationRequest.of("echo", Map.of("text", "hi"));

        assertEquals(ToolStatus.REFUSED, dispatcher.dispatch(request, allow(request, 5), empty).getStatus());
    }

    @Test
    void shouldReportInvalidArguments() {
        ToolInvocationRequest request = ToolInvocationRequest.of("echo", Map.of("text", "hi", "times", "many"));

        ToolResult result = dispatcher.dispatch(request, allow(request, 5), config);

        assertEquals(ToolStatus.INVALID_ARGUMENTS, result.getStatus());
        assertTrue(result.getError().contains("times"));
        assertEquals(0, echoCalls.get());
    }

    @Test
    void shouldTimeOutAndCancelHandler() throws Exception {
        ToolInvocationRequest request = ToolInvocationRequest.of("slow", Map.of());

        ToolResult result = dispatcher.dispatch(request, allow(request, 1), config);

        assertEquals(ToolStatus.TIMED_OUT, result.getStatus());
        assertEquals(1, result.extra("timeoutSeconds").asInt());
        assertTrue(cancelled.await(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldConvertHandlerFaultToError() {
        ToolInvocationRequest request = ToolInvocationRequest.of("broken", Map.of());

        ToolResult result = dispatcher.dispatch(request, allow(request, 5), config);

        assertEquals(ToolStatus.ERROR, result.getStatus());
        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("disk on fire"));
    }

    @Test
    void shouldMaskSecretsInObservations() {
        ToolResult result = ToolResult.ok("echo", mapper.createObjectNode()
                .put("password", "hunter2")
                .put("line", "api_key=abc123"));

        String observed = dispatcher.observe(result);

        assertFalse(observed.contains("hunter2"));
        assertFalse(observed.contains("abc123"));
        assertTrue(observed.contains("\"status\":\"ok\""));
    }

    private static SecurityDecision allow(ToolInvocationRequest request, int timeoutSeconds) {
        return SecurityDecision.builder()
                .allowed(true)
                .reason(DecisionReason.PERMITTED)
                .effectiveTimeout(Duration.ofSeconds(timeoutSeconds))
                .toolName(request.getToolName())
                .fingerprint(request.fingerprint())
                .build();
    }

    private final class EchoTool implements ToolHandler {
        @Override
        public ToolDescriptor descriptor() {
            return ToolDescriptor.builder()
                    .name("echo")
                    .category(ToolCategory.READ_ONLY)
                    .parameter(ParameterSpec.required("text", ParameterType.STRING, "text"))
                    .parameter(ParameterSpec.optional("times", ParameterType.INTEGER, "repeat count"))
                    .streamable(false)
                    .build();
        }

        @Override
        public ToolResult execute(ToolExecution execution) {
            echoCalls.incrementAndGet();
            Long times = execution.integer("times");
            String text = execution.string("text").repeat(times == null ? 1 : times.intValue());
            return ToolResult.ok("echo", mapper.createObjectNode().put("echo", text));
        }
    }

    private final class SlowTool implements ToolHandler {
        @Override
        public ToolDescriptor descriptor() {
            return ToolDescriptor.builder().name("slow").category(ToolCategory.READ_ONLY).parameters(List.of()).build();
        }

        @Override
        public ToolResult execute(ToolExecution execution) throws InterruptedException {
            Thread.sleep(10_000);
            return ToolResult.ok("slow", mapper.createObjectNode());
        }

        @Override
        public void cancel(String callId) {
            cancelled.countDown();
        }
    }

    private static final class BrokenTool implements ToolHandler {
        @Override
        public ToolDescriptor descriptor() {
            return ToolDescriptor.builder().name("broken").category(ToolCategory.SIDE_EFFECTING).build();
        }

        @Override
        public ToolResult execute(ToolExecution execution) {
            throw new IllegalStateException("disk on fire");
        }
    }
}
