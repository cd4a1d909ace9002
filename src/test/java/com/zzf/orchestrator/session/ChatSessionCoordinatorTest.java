package com.zzf.orchestrator.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.config.OrchestratorProperties;
import com.zzf.orchestrator.config.RegistryService;
import com.zzf.orchestrator.core.classify.OperationClassifier;
import com.zzf.orchestrator.core.classify.OperationType;
import com.zzf.orchestrator.core.plan.ExecutionMode;
import com.zzf.orchestrator.core.plan.ExecutionStrategySelector;
import com.zzf.orchestrator.core.policy.ApprovalLedger;
import com.zzf.orchestrator.core.policy.DecisionReason;
import com.zzf.orchestrator.core.policy.PolicyEngine;
import com.zzf.orchestrator.core.protocol.NativeToolCall;
import com.zzf.orchestrator.core.protocol.ProtocolNormalizer;
import com.zzf.orchestrator.core.tool.ArgumentCoercer;
import com.zzf.orchestrator.core.tool.BuiltInToolHandlers;
import com.zzf.orchestrator.core.tool.CommandExecutor;
import com.zzf.orchestrator.core.tool.ToolDescriptor;
import com.zzf.orchestrator.core.tool.ToolDispatcher;
import com.zzf.orchestrator.core.tool.ToolRegistry;
import com.zzf.orchestrator.core.tool.ToolResult;
import com.zzf.orchestrator.core.tool.ToolStatus;
import com.zzf.orchestrator.llm.ChatMessage;
import com.zzf.orchestrator.llm.InferenceClient;
import com.zzf.orchestrator.llm.InferenceResponse;
import com.zzf.orchestrator.memory.MemoryEntry;
import com.zzf.orchestrator.memory.MemoryKind;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.memory.MemorySearchQuery;
import com.zzf.orchestrator.memory.MemoryStore;
import com.zzf.orchestrator.model.InferenceException;
import com.zzf.orchestrator.shell.ShellService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatSessionCoordinatorTest {

    private static final String TOOLS = "{\"tools\":["
            + "{\"name\":\"add_memory\",\"enabled\":true},"
            + "{\"name\":\"search_memories\",\"enabled\":true},"
            + "{\"name\":\"get_memory\",\"enabled\":true},"
            + "{\"name\":\"update_memory\",\"enabled\":true},"
            + "{\"name\":\"delete_memory\",\"enabled\":true},"
            + "{\"name\":\"get_memory_stats\",\"enabled\":true},"
            + "{\"name\":\"command_exec\",\"enabled\":false,\"whitelist\":[\"ls\"]}"
            + "]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScriptedInferenceClient inference = new ScriptedInferenceClient();
    private final ExecutorService toolExecutor = Executors.newFixedThreadPool(2);
    private final ExecutorService backgroundExecutor = Executors.newSingleThreadExecutor();
    private MemoryManager memoryManager;
    private ToolRegistry toolRegistry;
    private Path toolsFile;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws Exception {
        Path memoryFile = dir.resolve("memory_registry.json");
        Files.writeString(memoryFile, "{\"memories\":[{\"name\":\"main_memory\",\"enabled\":true}]}");
        toolsFile = dir.resolve("tools_registry.json");
        Files.writeString(toolsFile, TOOLS);
        memoryManager = new MemoryManager(memoryFile, mapper);
        toolRegistry = new ToolRegistry();
        BuiltInToolHandlers.registerAll(toolRegistry, memoryManager, new CommandExecutor(new ShellService(), 4096), mapper);
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
        backgroundExecutor.shutdownNow();
    }

    @Test
    void writeTurnStreamsAnswerAndStoresMemoryInBackground() throws Exception {
        inference.streamReplies.add("Nice to meet you, Matt!");
        inference.completions.add(call("call_1", "add_memory", "{\"content\":\"User's name is Matt\",\"kind\":\"fact\"}"));
        inference.completions.add(InferenceResponse.text("Stored."));
        RecordingListener listener = new RecordingListener();

        TurnOutcome outcome = coordinator(ExecutionMode.DUAL_PASS_WRITE_ONLY, chat())
                .runTurn("s1", "Remember that my name is Matt", listener);

        assertEquals(OperationType.WRITE, outcome.getOperationType());
        assertTrue(outcome.getFirstPass().isStreamed());
        assertEquals("Nice to meet you, Matt!", outcome.getAnswer());
        assertEquals("Nice to meet you, Matt!", String.join("", listener.tokens));
        assertTrue(listener.toolResults.isEmpty());

        PassResult background = outcome.backgroundPass().orElseThrow().get(5, TimeUnit.SECONDS);
        assertEquals(1, background.getToolCalls().size());
        assertEquals(ToolStatus.OK, background.getToolCalls().get(0).getResult().getStatus());
        assertEquals("Stored.", background.getText());

        MemoryStore store = memoryManager.getDefaultStore().orElseThrow();
        List<MemoryEntry> stored = store.search(MemorySearchQuery.all());
        assertEquals(1, stored.size());
        assertEquals("User's name is Matt", stored.get(0).getContent());
        assertEquals(MemoryKind.FACT, stored.get(0).getKind());

        List<ChatMessage> backgroundContext = inference.completeRequests.get(0);
        ChatMessage last = backgroundContext.get(backgroundContext.size() - 1);
        assertEquals(ChatMessage.USER, last.getRole());
        assertEquals("Remember that my name is Matt", last.getContent());
        assertEquals(ChatMessage.SYSTEM, backgroundContext.get(0).getRole());
    }

    @Test
    void readTurnRunsOneUnstreamedPassWithTools() throws Exception {
        MemoryEntry fact = memoryManager.getDefaultStore().orElseThrow()
                .add("User's name is Matt", MemoryKind.FACT, Set.of(), 0.9, "test").getValue().orElseThrow();
        inference.completions.add(call("call_1", "search_memories", "{\"query\":\"name\"}"));
        inference.completions.add(InferenceResponse.text("Your name is Matt."));
        RecordingListener listener = new RecordingListener();

        TurnOutcome outcome = coordinator(ExecutionMode.DUAL_PASS_WRITE_ONLY, chat())
                .runTurn("s1", "What is my name?", listener);

        assertEquals(OperationType.READ, outcome.getOperationType());
        assertFalse(outcome.getFirstPass().isStreamed());
        assertTrue(outcome.backgroundPass().isEmpty());
        assertEquals("Your name is Matt.", outcome.getAnswer());
        assertEquals(List.of("Your name is Matt."), listener.tokens);
        assertEquals(0, inference.streamCalls);
        assertEquals(1, listener.toolResults.size());
        assertTrue(listener.toolResults.get(0).isSuccess());
        assertEquals(1, listener.toolResults.get(0).getData().get("count").asInt());
        assertEquals(fact.getId(), listener.toolResults.get(0).getData().get("memories").get(0).get("id").asText());

        List<ChatMessage> second = inference.completeRequests.get(1);
        ChatMessage toolMessage = second.get(second.size() - 1);
        assertEquals(ChatMessage.TOOL, toolMessage.getRole());
        assertEquals("call_1", toolMessage.getToolCallId());
    }

    @Test
    void dualPassAllFlagsReadHazard() throws Exception {
        MemoryEntry fact = memoryManager.getDefaultStore().orElseThrow()
                .add("User's name is Matt", MemoryKind.FACT, Set.of(), 0.9, "test").getValue().orElseThrow();
        inference.streamReplies.add("I am not sure.");
        inference.completions.add(call("call_1", "search_memories", "{\"query\":\"name\"}"));
        inference.completions.add(InferenceResponse.text("Your name is Matt."));

        TurnOutcome outcome = coordinator(ExecutionMode.DUAL_PASS_ALL, chat()).runTurn("s1", "What is my name?");

        assertTrue(outcome.getPlan().isReadHazard());
        assertEquals("I am not sure.", outcome.getAnswer());
        PassResult background = outcome.backgroundPass().orElseThrow().get(5, TimeUnit.SECONDS);
        assertEquals("Your name is Matt.", background.getText());
        assertEquals(1, background.getToolCalls().size());
        ToolResult search = background.getToolCalls().get(0).getResult();
        assertEquals(ToolStatus.OK, search.getStatus());
        assertEquals(1, search.getData().get("count").asInt());
        assertEquals(fact.getId(), search.getData().get("memories").get(0).get("id").asText());
        assertEquals("User's name is Matt", search.getData().get("memories").get(0).get("content").asText());
    }

    @Test
    void toolLoopStopsAtIterationLimit() {
        OrchestratorProperties.Chat chat = chat();
        chat.setMaxToolIterations(2);
        inference.repeat = call("call_x", "get_memory_stats", "{}");

        TurnOutcome outcome = coordinator(ExecutionMode.SINGLE_PASS, chat).runTurn("s1", "Hello there");

        PassResult pass = outcome.getFirstPass();
        assertTrue(pass.isTruncated());
        assertEquals(3, pass.getIterations());
        assertEquals(2, pass.getToolCalls().size());
        assertEquals(3, inference.completeRequests.size());
    }

    @Test
    void callToToolNotOfferedIsRefused() {
        inference.completions.add(call("call_1", "command_exec", "{\"command\":\"ls\"}"));
        inference.completions.add(InferenceResponse.text("I cannot run commands."));

        TurnOutcome outcome = coordinator(ExecutionMode.SINGLE_PASS, chat()).runTurn("s1", "Hello there");

        ToolCallRecord record = outcome.getFirstPass().getToolCalls().get(0);
        assertEquals(DecisionReason.TOOL_UNAVAILABLE, record.getDecision().getReason());
        assertEquals(ToolStatus.REFUSED, record.getResult().getStatus());
        assertEquals("I cannot run commands.", outcome.getAnswer());
    }

    @Test
    void retriesFailedPassBeforeAnythingWasEmitted() {
        OrchestratorProperties.Chat chat = chat();
        chat.setTurnRetries(1);
        inference.failures.add(new InferenceException("connection reset"));
        inference.completions.add(InferenceResponse.text("Hi!"));

        TurnOutcome outcome = coordinator(ExecutionMode.SINGLE_PASS, chat).runTurn("s1", "Hello there");

        assertEquals("Hi!", outcome.getAnswer());
    }

    @Test
    void doesNotRetryAfterAToolCallWasAttempted() {
        OrchestratorProperties.Chat chat = chat();
        chat.setTurnRetries(3);
        inference.completions.add(call("call_1", "add_memory", "{\"content\":\"likes tea\"}"));
        inference.failAfterScript = true;

        ChatSessionCoordinator coordinator = coordinator(ExecutionMode.SINGLE_PASS, chat);

        assertThrows(InferenceException.class, () -> coordinator.runTurn("s1", "Hello there"));
        assertEquals(2, inference.completeRequests.size());
        assertEquals(1, memoryManager.getDefaultStore().orElseThrow().size());
    }

    @Test
    void historyCarriesPreviousTurns() {
        inference.completions.add(InferenceResponse.text("Hi!"));
        inference.completions.add(InferenceResponse.text("Still here."));
        ChatSessionCoordinator coordinator = coordinator(ExecutionMode.SINGLE_PASS, chat());

        coordinator.runTurn("s1", "Hello there");
        coordinator.runTurn("s1", "Are you there");

        List<ChatMessage> second = inference.completeRequests.get(1);
        assertEquals("Hello there", second.get(second.size() - 3).getContent());
        assertEquals("Hi!", second.get(second.size() - 2).getContent());
    }

    private ChatSessionCoordinator coordinator(ExecutionMode mode, OrchestratorProperties.Chat chat) {
        OrchestratorProperties.Policy policy = new OrchestratorProperties.Policy();
        RegistryService registryService = new RegistryService(toolsFile, toolRegistry, memoryManager, mode, policy, mapper);
        ArgumentCoercer coercer = new ArgumentCoercer(mapper);
        ApprovalLedger approvals = new ApprovalLedger();
        return new ChatSessionCoordinator(
                registryService,
                new OperationClassifier(),
                new ExecutionStrategySelector(),
                new ProtocolNormalizer(mapper, true),
                new PolicyEngine(approvals, coercer),
                new ToolDispatcher(toolRegistry, coercer, toolExecutor, mapper),
                approvals,
                inference,
                new ConversationStore(50),
                backgroundExecutor,
                chat,
                "You have long-term memory tools.",
                mapper);
    }

    private static OrchestratorProperties.Chat chat() {
        return new OrchestratorProperties.Chat();
    }

    private static InferenceResponse call(String id, String tool, String arguments) {
        return InferenceResponse.builder()
                .content("")
                .toolCall(new NativeToolCall(id, tool, arguments))
                .finishReason("tool_calls")
                .build();
    }

    private static final class ScriptedInferenceClient implements InferenceClient {
        final Deque<InferenceResponse> completions = new ArrayDeque<>();
        final Deque<InferenceException> failures = new ArrayDeque<>();
        final Deque<String> streamReplies = new ArrayDeque<>();
        final List<List<ChatMessage>> completeRequests = new CopyOnWriteArrayList<>();
        InferenceResponse repeat;
        boolean failAfterScript;
        int streamCalls;

        @Override
        public synchronized InferenceResponse complete(List<ChatMessage> messages, List<ToolDescriptor> tools) {
            completeRequests.add(new ArrayList<>(messages));
            if (!failures.isEmpty()) {
                throw failures.poll();
            }
            if (!completions.isEmpty()) {
                return completions.poll();
            }
            if (repeat != null) {
                return repeat;
            }
            if (failAfterScript) {
                throw new InferenceException("stream closed");
            }
            return InferenceResponse.text("");
        }

        @Override
        public synchronized String stream(List<ChatMessage> messages, Consumer<String> onToken) {
            streamCalls++;
            String reply = streamReplies.isEmpty() ? "" : streamReplies.poll();
            for (String word : reply.split("(?<= )")) {
                onToken.accept(word);
            }
            return reply;
        }
    }

    private static final class RecordingListener implements TurnListener {
        final List<String> tokens = new CopyOnWriteArrayList<>();
        final List<ToolResult> toolResults = new CopyOnWriteArrayList<>();

        @Override
        public void onToken(String token) {
            tokens.add(token);
        }

        @Override
        public void onToolResult(ToolResult result) {
            toolResults.add(result);
        }
    }
}
