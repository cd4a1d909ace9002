package com.zzf.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import com.zzf.orchestrator.core.tool.ToolResult;
import com.zzf.orchestrator.core.util.StringUtils;
import com.zzf.orchestrator.model.OrchestratorException;
import com.zzf.orchestrator.session.ChatSessionCoordinator;
import com.zzf.orchestrator.session.PassResult;
import com.zzf.orchestrator.session.TurnListener;
import com.zzf.orchestrator.session.TurnOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

@Slf4j
@RestController
public class ChatController {
    private static final long STREAM_TIMEOUT_MS = 10 * 60 * 1000L;

    private final ChatSessionCoordinator coordinator;
    private final ExecutorService streamExecutor;
    private final ObjectMapper mapper;

    public ChatController(ChatSessionCoordinator coordinator,
                          @Qualifier("streamExecutor") ExecutorService streamExecutor,
                          ObjectMapper mapper) {
        this.coordinator = coordinator;
        this.streamExecutor = streamExecutor;
        this.mapper = mapper;
    }

    @PostMapping("/api/chat")
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest req) {
        String message = req == null ? "" : req.message;
        if (StringUtils.isBlank(message)) {
            throw new OrchestratorException("INVALID_REQUEST", "message is blank");
        }
        String sessionId = resolveSessionId(req.sessionId);
        TurnOutcome outcome = coordinator.runTurn(sessionId, message);
        return ResponseEntity.ok(ChatResponse.of(outcome));
    }

    @PostMapping("/api/chat/stream")
    public SseEmitter chatStream(@RequestBody ChatRequest req) {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        streamExecutor.submit(() -> {
            try {
                if (req == null || StringUtils.isBlank(req.message)) {
                    emitter.send(SseEmitter.event().name("error").data("message is blank"));
                    emitter.complete();
                    return;
                }
                String sessionId = resolveSessionId(req.sessionId);
                TurnOutcome outcome = coordinator.runTurn(sessionId, req.message, new SseTurnListener(emitter));
                sendSse(emitter, "finish", mapper.writeValueAsString(ChatResponse.of(outcome)));
                emitter.complete();
            } catch (Exception e) {
                log.error("chat.stream.fail err={}", e.toString());
                sendSse(emitter, "error", StringUtils.firstNonBlank(e.getMessage(), e.getClass().getSimpleName()));
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    private static String resolveSessionId(String sessionId) {
        return StringUtils.isBlank(sessionId) ? "session-" + UUID.randomUUID() : sessionId.trim();
    }

    private void sendSse(SseEmitter emitter, String eventName, Object data) {
        try {
            synchronized (emitter) {
                emitter.send(SseEmitter.event().name(eventName).data(data));
            }
        } catch (IOException e) {
            log.warn("chat.stream.send_failed event={} err={}", eventName, e.toString());
        }
    }

    private final class SseTurnListener implements TurnListener {
        private final SseEmitter emitter;

        private SseTurnListener(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onToken(String token) {
            sendSse(emitter, "token", token);
        }

        @Override
        public void onToolCall(ToolInvocationRequest request, SecurityDecision decision) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tool", request.getToolName());
            payload.put("callId", request.getCallId());
            payload.put("allowed", decision.isAllowed());
            payload.put("reason", decision.getReason() == null ? null : decision.getReason().wireValue());
            sendSse(emitter, "tool_call", payload);
        }

        @Override
        public void onToolResult(ToolResult result) {
            sendSse(emitter, "tool_result", result.toJson(mapper).toString());
        }

        @Override
        public void onPassComplete(PassResult result) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("pass", result.getPassNumber());
            payload.put("iterations", result.getIterations());
            payload.put("truncated", result.isTruncated());
            sendSse(emitter, "pass_complete", payload);
        }
    }

    public static final class ChatRequest {
        public String sessionId;
        public String message;
    }

    public static final class ChatResponse {
        public final String sessionId;
        public final String operationType;
        public final String executionMode;
        public final String answer;
        public final int toolCalls;
        public final boolean truncated;
        public final boolean backgroundPassScheduled;

        private ChatResponse(String sessionId, String operationType, String executionMode, String answer,
                             int toolCalls, boolean truncated, boolean backgroundPassScheduled) {
            this.sessionId = sessionId;
            this.operationType = operationType;
            this.executionMode = executionMode;
            this.answer = answer;
            this.toolCalls = toolCalls;
            this.truncated = truncated;
            this.backgroundPassScheduled = backgroundPassScheduled;
        }

        static ChatResponse of(TurnOutcome outcome) {
            PassResult first = outcome.getFirstPass();
            return new ChatResponse(
                    outcome.getSessionId(),
                    outcome.getOperationType() == null ? null : outcome.getOperationType().name(),
                    outcome.getPlan() == null ? null : outcome.getPlan().getMode().configValue(),
                    outcome.getAnswer(),
                    first == null ? 0 : first.getToolCalls().size(),
                    first != null && first.isTruncated(),
                    outcome.backgroundPass().isPresent());
        }
    }
}
