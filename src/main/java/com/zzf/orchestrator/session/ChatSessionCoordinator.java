package com.zzf.orchestrator.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.config.OrchestratorProperties;
import com.zzf.orchestrator.config.RegistryService;
import com.zzf.orchestrator.config.TurnConfig;
import com.zzf.orchestrator.core.classify.OperationClassifier;
import com.zzf.orchestrator.core.classify.OperationType;
import com.zzf.orchestrator.core.plan.ExecutionPlan;
import com.zzf.orchestrator.core.plan.ExecutionStrategySelector;
import com.zzf.orchestrator.core.plan.PassPlan;
import com.zzf.orchestrator.core.policy.ApprovalLedger;
import com.zzf.orchestrator.core.policy.DecisionReason;
import com.zzf.orchestrator.core.policy.PolicyEngine;
import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.CallOrigin;
import com.zzf.orchestrator.core.protocol.CallSource;
import com.zzf.orchestrator.core.protocol.NativeToolCall;
import com.zzf.orchestrator.core.protocol.NormalizedOutput;
import com.zzf.orchestrator.core.protocol.ProtocolNormalizer;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import com.zzf.orchestrator.core.tool.BuiltInToolHandlers;
import com.zzf.orchestrator.core.tool.ToolDescriptor;
import com.zzf.orchestrator.core.tool.ToolDispatcher;
import com.zzf.orchestrator.core.tool.ToolResult;
import com.zzf.orchestrator.core.tool.ToolStatus;
import com.zzf.orchestrator.llm.ChatMessage;
import com.zzf.orchestrator.llm.InferenceClient;
import com.zzf.orchestrator.llm.InferenceResponse;
import com.zzf.orchestrator.model.InferenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one user turn end to end: snapshot the configuration, classify, plan, then execute the
 * planned passes.
 *
 * <p>A streamed pass forwards tokens to the {@link TurnListener} and offers no tools. An
 * unstreamed pass runs the tool loop: normalize the response, authorize each call, dispatch the
 * allowed ones and feed every result back as a {@code tool} message until the model answers
 * without calls or the iteration limit is reached. The second pass of a dual-pass plan runs on the
 * background executor over the history as it was before the first pass answered; its future is
 * kept in the {@link TurnOutcome} and failures are logged.
 */
@Slf4j
public class ChatSessionCoordinator {

    private final RegistryService registryService;
    private final OperationClassifier classifier;
    private final ExecutionStrategySelector selector;
    private final ProtocolNormalizer normalizer;
    private final PolicyEngine policyEngine;
    private final ToolDispatcher dispatcher;
    private final ApprovalLedger approvals;
    private final InferenceClient inferenceClient;
    private final ConversationStore conversations;
    private final ExecutorService backgroundExecutor;
    private final OrchestratorProperties.Chat chat;
    private final String memorySystemPrompt;
    private final ObjectMapper mapper;

    public ChatSessionCoordinator(RegistryService registryService,
                                  OperationClassifier classifier,
                                  ExecutionStrategySelector selector,
                                  ProtocolNormalizer normalizer,
                                  PolicyEngine policyEngine,
                                  ToolDispatcher dispatcher,
                                  ApprovalLedger approvals,
                                  InferenceClient inferenceClient,
                                  ConversationStore conversations,
                                  ExecutorService backgroundExecutor,
                                  OrchestratorProperties.Chat chat,
                                  String memorySystemPrompt,
                                  ObjectMapper mapper) {
        this.registryService = registryService;
        this.classifier = classifier;
        this.selector = selector;
        this.normalizer = normalizer;
        this.policyEngine = policyEngine;
        this.dispatcher = dispatcher;
        this.approvals = approvals;
        this.inferenceClient = inferenceClient;
        this.conversations = conversations;
        this.backgroundExecutor = backgroundExecutor;
        this.chat = chat;
        this.memorySystemPrompt = memorySystemPrompt;
        this.mapper = mapper;
    }

    public TurnOutcome runTurn(String sessionId, String userMessage) {
        return runTurn(sessionId, userMessage, TurnListener.NONE);
    }

    public TurnOutcome runTurn(String sessionId, String userMessage, TurnListener listener) {
        TurnListener sink = listener == null ? TurnListener.NONE : listener;
        TurnConfig config = registryService.snapshot();
        OperationType operationType = classifier.classify(userMessage);
        ExecutionPlan plan = selector.plan(operationType, config.getMode(), config.hasEnabledTools());
        log.info("turn.start session={} type={} plan={}", sessionId, operationType, plan);

        List<ChatMessage> context = buildContext(sessionId, userMessage, config);
        // set once a token reached the caller or a tool call was attempted; a retry would repeat either
        AtomicBoolean emitted = new AtomicBoolean(false);
        TurnListener tracking = new EmissionTrackingListener(sink, emitted);

        PassResult first = null;
        int attempts = Math.max(0, chat.getTurnRetries()) + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                first = runPass(plan.pass(1), context, config, tracking, true);
                break;
            } catch (InferenceException e) {
                if (attempt >= attempts || emitted.get()) {
                    log.error("turn.failed session={} attempt={} emitted={}", sessionId, attempt, emitted.get(), e);
                    throw e;
                }
                log.warn("turn.retry session={} attempt={} err={}", sessionId, attempt, e.getMessage());
            }
        }
        sink.onPassComplete(first);
        conversations.append(sessionId, ChatMessage.user(userMessage), ChatMessage.assistant(first.getText()));

        CompletableFuture<PassResult> background = null;
        if (plan.isDualPass()) {
            background = scheduleSecondPass(sessionId, plan, copyOf(context), config);
        }
        return TurnOutcome.builder()
                .sessionId(sessionId)
                .operationType(operationType)
                .plan(plan)
                .firstPass(first)
                .background(background)
                .build();
    }

    private CompletableFuture<PassResult> scheduleSecondPass(String sessionId, ExecutionPlan plan, List<ChatMessage> context, TurnConfig config) {
        PassPlan second = plan.pass(2);
        CompletableFuture<PassResult> future = CompletableFuture.supplyAsync(
                () -> runPass(second, context, config, TurnListener.NONE, false), backgroundExecutor);
        future.whenComplete((result, error) -> {
            if (error != null) {
                log.error("turn.background_failed session={} pass={}", sessionId, second.getNumber(), error);
            } else {
                log.info("turn.background_done session={} pass={} calls={} truncated={}",
                        sessionId, second.getNumber(), result.getToolCalls().size(), result.isTruncated());
            }
        });
        return future;
    }

    private List<ChatMessage> buildContext(String sessionId, String userMessage, TurnConfig config) {
        List<ChatMessage> context = new ArrayList<>();
        boolean memoryTools = config.enabledToolNames().stream().anyMatch(BuiltInToolHandlers.MEMORY_TOOLS::contains);
        if (memoryTools && memorySystemPrompt != null && !memorySystemPrompt.isBlank()) {
            context.add(ChatMessage.system(memorySystemPrompt));
        }
        context.addAll(conversations.history(sessionId));
        context.add(ChatMessage.user(userMessage == null ? "" : userMessage));
        return context;
    }

    PassResult runPass(PassPlan pass, List<ChatMessage> context, TurnConfig config, TurnListener listener, boolean visible) {
        if (pass.isStreamed() && !pass.isToolsEnabled()) {
            String text = inferenceClient.stream(copyOf(context), listener::onToken);
            log.info("pass.streamed pass={} chars={}", pass.getNumber(), text.length());
            return PassResult.builder()
                    .passNumber(pass.getNumber())
                    .streamed(true)
                    .text(text)
                    .iterations(1)
                    .build();
        }
        return runToolLoop(pass, copyOf(context), config, listener, visible);
    }

    private PassResult runToolLoop(PassPlan pass, List<ChatMessage> conversation, TurnConfig config, TurnListener listener, boolean visible) {
        List<ToolDescriptor> offered = pass.isToolsEnabled() ? config.enabledDescriptors() : List.of();
        Set<String> offeredNames = new LinkedHashSet<>();
        offered.forEach(descriptor -> offeredNames.add(descriptor.getName()));
        CallOrigin origin = new CallOrigin(pass.getNumber(), pass.isStreamed(), CallSource.NATIVE);
        int maxIterations = Math.max(1, chat.getMaxToolIterations());

        PassResult.PassResultBuilder result = PassResult.builder()
                .passNumber(pass.getNumber())
                .streamed(pass.isStreamed());
        String text = "";
        int iteration = 0;
        boolean truncated = false;
        while (true) {
            iteration++;
            InferenceResponse response = inferenceClient.complete(conversation, offered);
            NormalizedOutput output = normalizer.normalize(response.getContent(), response.getToolCalls(), offeredNames, origin);
            text = output.getText();
            if (!output.hasCalls()) {
                break;
            }
            if (iteration > maxIterations) {
                truncated = true;
                log.warn("pass.max_iterations pass={} limit={} pendingCalls={}", pass.getNumber(), maxIterations, output.getRequests().size());
                break;
            }
            conversation.add(ChatMessage.assistant(output.getText(), toHistoryCalls(output.getRequests())));
            for (ToolInvocationRequest request : output.getRequests()) {
                ToolCallRecord record = handleCall(request, offeredNames, config, listener);
                result.toolCall(record);
                conversation.add(ChatMessage.tool(request.getCallId(), request.getToolName(), dispatcher.observe(record.getResult())));
            }
        }
        if (visible && !text.isEmpty()) {
            listener.onToken(text);
        }
        log.info("pass.done pass={} iterations={} truncated={}", pass.getNumber(), iteration, truncated);
        return result.text(text).iterations(iteration).truncated(truncated).build();
    }

    private ToolCallRecord handleCall(ToolInvocationRequest request, Set<String> offeredNames, TurnConfig config, TurnListener listener) {
        SecurityDecision decision;
        ToolResult toolResult;
        if (!offeredNames.contains(request.getToolName())) {
            decision = SecurityDecision.builder()
                    .allowed(false)
                    .reason(DecisionReason.TOOL_UNAVAILABLE)
                    .detail("tool was not offered in this pass")
                    .toolName(request.getToolName())
                    .fingerprint(request.fingerprint())
                    .build();
            listener.onToolCall(request, decision);
            toolResult = ToolResult.of(ToolStatus.REFUSED, request.getToolName(), "tool was not offered in this pass")
                    .withCallId(request.getCallId());
        } else {
            decision = policyEngine.authorize(request, config);
            listener.onToolCall(request, decision);
            if (decision.isAllowed()) {
                toolResult = dispatcher.dispatch(request, decision, config);
                if (decision.getReason() == DecisionReason.APPROVED) {
                    approvals.consume(decision.getFingerprint());
                }
            } else {
                if (decision.isApprovalRequired()) {
                    approvals.recordPending(request, decision);
                }
                log.info("policy.deny tool={} callId={} reason={} detail={}",
                        request.getToolName(), request.getCallId(), decision.getReason(), decision.getDetail());
                toolResult = ToolResult.of(ToolStatus.DENIED, request.getToolName(),
                                decision.getReason().wireValue() + (decision.getDetail() == null ? "" : ": " + decision.getDetail()))
                        .withCallId(request.getCallId())
                        .withExtra("reason", mapper.valueToTree(decision.getReason().wireValue()))
                        .withExtra("fingerprint", mapper.valueToTree(decision.getFingerprint()));
            }
        }
        listener.onToolResult(toolResult);
        return new ToolCallRecord(request, decision, toolResult);
    }

    private List<NativeToolCall> toHistoryCalls(List<ToolInvocationRequest> requests) {
        List<NativeToolCall> calls = new ArrayList<>();
        for (ToolInvocationRequest request : requests) {
            String arguments;
            try {
                arguments = mapper.writeValueAsString(request.getArguments());
            } catch (JsonProcessingException e) {
                log.warn("turn.encode_arguments_failed tool={} err={}", request.getToolName(), e.getMessage());
                arguments = "{}";
            }
            calls.add(new NativeToolCall(request.getCallId(), request.getToolName(), arguments));
        }
        return calls;
    }

    private static List<ChatMessage> copyOf(List<ChatMessage> messages) {
        List<ChatMessage> copy = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            copy.add(message.copy());
        }
        return copy;
    }

    private static final class EmissionTrackingListener implements TurnListener {
        private final TurnListener delegate;
        private final AtomicBoolean emitted;

        private EmissionTrackingListener(TurnListener delegate, AtomicBoolean emitted) {
            this.delegate = delegate;
            this.emitted = emitted;
        }

        @Override
        public void onToken(String token) {
            emitted.set(true);
            delegate.onToken(token);
        }

        @Override
        public void onToolCall(ToolInvocationRequest request, SecurityDecision decision) {
            emitted.set(true);
            delegate.onToolCall(request, decision);
        }

        @Override
        public void onToolResult(ToolResult result) {
            delegate.onToolResult(result);
        }

        @Override
        public void onPassComplete(PassResult result) {
            delegate.onPassComplete(result);
        }
    }
}
