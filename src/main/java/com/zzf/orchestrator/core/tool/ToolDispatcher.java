package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.config.TurnConfig;
import com.zzf.orchestrator.core.policy.SecurityDecision;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Runs authorized calls against their handlers with a hard deadline. Never consults the policy
 * engine; it only checks that it was handed a passing decision for the exact request.
 */
@Slf4j
public class ToolDispatcher {
    private static final Pattern SENSITIVE_KV = Pattern.compile("(?i)(password|passwd|secret|token|apikey|api_key|accesskey|secretkey)\\s*[:=]\\s*([\"']?)([^\"'\\\\\\r\\n\\s]{1,160})\\2");
    private static final Pattern SENSITIVE_JSON_KV = Pattern.compile("(?i)(\"(?:password|passwd|secret|token|apiKey|api_key|accessKey|secretKey)\"\\s*:\\s*\")([^\"]{1,160})(\")");

    private final ToolRegistry registry;
    private final ArgumentCoercer coercer;
    private final ExecutorService executor;
    private final ObjectMapper mapper;

    public ToolDispatcher(ToolRegistry registry, ArgumentCoercer coercer, ExecutorService executor, ObjectMapper mapper) {
        this.registry = registry;
        this.coercer = coercer;
        this.executor = executor;
        this.mapper = mapper;
    }

    public ToolResult dispatch(ToolInvocationRequest request, SecurityDecision decision, TurnConfig config) {
        long t0 = System.nanoTime();
        if (request == null) {
            return ToolResult.of(ToolStatus.REFUSED, "", "no request");
        }
        String tool = request.getToolName();
        String callId = request.getCallId();
        if (decision == null || !decision.isAllowed() || !decision.covers(request.fingerprint())) {
            log.warn("tool.refused tool={} callId={} reason=no_passing_decision", tool, callId);
            return finish(ToolResult.of(ToolStatus.REFUSED, tool, "no passing security decision for this request"), callId, t0);
        }
        Optional<ToolHandler> handler = registry.get(tool);
        Optional<ToolDescriptor> descriptor = config == null ? Optional.empty() : config.descriptor(tool);
        if (handler.isEmpty() || descriptor.isEmpty()) {
            log.warn("tool.refused tool={} callId={} reason=unavailable", tool, callId);
            return finish(ToolResult.of(ToolStatus.REFUSED, tool, "tool is not available in this turn"), callId, t0);
        }
        if (request.getOrigin() != null && request.getOrigin().isStreamedPass() && !descriptor.get().isStreamable()) {
            log.warn("tool.refused tool={} callId={} reason=streamed_pass", tool, callId);
            return finish(ToolResult.of(ToolStatus.REFUSED, tool, "tool may not run during a streamed pass"), callId, t0);
        }

        Map<String, Object> arguments;
        try {
            arguments = coercer.coerce(descriptor.get(), request.getArguments());
        } catch (IllegalArgumentException e) {
            log.info("tool.invalid_arguments tool={} callId={} err={}", tool, callId, e.getMessage());
            return finish(ToolResult.of(ToolStatus.INVALID_ARGUMENTS, tool, e.getMessage()), callId, t0);
        }

        Duration timeout = decision.getEffectiveTimeout() == null ? Duration.ofSeconds(30) : decision.getEffectiveTimeout();
        ToolExecution execution = ToolExecution.builder()
                .callId(callId)
                .toolName(tool)
                .arguments(arguments)
                .timeout(timeout)
                .settings(config.settings(tool))
                .build();

        log.info("tool.call tool={} callId={} timeoutSeconds={}", tool, callId, timeout.getSeconds());
        ToolHandler target = handler.get();
        Future<ToolResult> future = executor.submit(() -> target.execute(execution));
        ToolResult result;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                result = ToolResult.error(tool, "handler returned no result");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            cancelHandler(target, callId);
            log.warn("tool.timeout tool={} callId={} timeoutSeconds={}", tool, callId, timeout.getSeconds());
            result = ToolResult.of(ToolStatus.TIMED_OUT, tool, "execution exceeded " + timeout.getSeconds() + "s")
                    .withExtra("timeoutSeconds", mapper.valueToTree(timeout.getSeconds()))
                    .withHint("Raise timeout_seconds for this tool if the limit is too low.");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("tool.fail tool={} callId={} err={}", tool, callId, cause.toString());
            result = ToolResult.error(tool, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            cancelHandler(target, callId);
            result = ToolResult.error(tool, "dispatch interrupted");
        }
        result = finish(result, callId, t0);
        log.info("tool.result tool={} callId={} status={} error={}", tool, callId, result.getStatus().wireValue(), result.getError());
        return result;
    }

    /**
     * Renders a result for the conversation with sensitive values masked.
     */
    public String observe(ToolResult result) {
        return sanitizeObservation(result.toJson(mapper).toString());
    }

    private void cancelHandler(ToolHandler handler, String callId) {
        try {
            handler.cancel(callId);
        } catch (RuntimeException e) {
            log.error("tool.cancel_failed tool={} callId={}", handler.descriptor().getName(), callId, e);
        }
    }

    private static ToolResult finish(ToolResult result, String callId, long t0) {
        return result.withCallId(callId).withTookMs((System.nanoTime() - t0) / 1_000_000L);
    }

    static String sanitizeObservation(String obs) {
        if (obs == null || obs.isEmpty()) {
            return obs;
        }
        String masked = obs;
        masked = SENSITIVE_JSON_KV.matcher(masked).replaceAll("$1******$3");
        masked = SENSITIVE_KV.matcher(masked).replaceAll("$1:******");
        return masked;
    }
}
