package com.zzf.orchestrator.core.policy;

import com.zzf.orchestrator.config.ToolSettings;
import com.zzf.orchestrator.config.TurnConfig;
import com.zzf.orchestrator.core.protocol.ToolInvocationRequest;
import com.zzf.orchestrator.core.tool.ArgumentCoercer;
import com.zzf.orchestrator.core.tool.TargetKind;
import com.zzf.orchestrator.core.tool.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a tool invocation request may run.
 *
 * <p>Checks run in a fixed order and the first failure wins: tool enablement, whitelist match,
 * root containment, read-only mode, dangerous targets and approval, then the timeout ceiling.
 * A requested timeout may shorten the configured one but never extend it.
 * Any error while evaluating a request denies it. The engine holds no mutable state; the approval
 * ledger is only read here.
 */
@Slf4j
public class PolicyEngine {

    static final String TIMEOUT_ARGUMENT = "timeout";
    static final String OPERATION_ARGUMENT = "operation";
    static final String ARGUMENTS_ARGUMENT = "arguments";

    private final ApprovalLedger approvals;
    private final ArgumentCoercer coercer;
    private final WhitelistMatcher matcher = new WhitelistMatcher();
    private final DangerousTargetDetector detector = new DangerousTargetDetector();

    public PolicyEngine(ApprovalLedger approvals, ArgumentCoercer coercer) {
        this.approvals = approvals;
        this.coercer = coercer;
    }

    public SecurityDecision authorize(ToolInvocationRequest request, TurnConfig config) {
        if (request == null || config == null) {
            return SecurityDecision.builder()
                    .allowed(false)
                    .reason(DecisionReason.TOOL_UNAVAILABLE)
                    .detail("no request or configuration")
                    .build();
        }
        SecurityDecision decision;
        try {
            decision = evaluate(request, config);
        } catch (RuntimeException e) {
            log.error("policy.error tool={} callId={}", request.getToolName(), request.getCallId(), e);
            decision = deny(request, DecisionReason.NOT_WHITELISTED, "policy evaluation failed: " + e.getMessage(), false);
        }
        log.info("policy.decision tool={} callId={} allowed={} reason={} detail={}",
                request.getToolName(), request.getCallId(), decision.isAllowed(), decision.getReason(), decision.getDetail());
        return decision;
    }

    private SecurityDecision evaluate(ToolInvocationRequest request, TurnConfig config) {
        Optional<ToolDescriptor> found = config.descriptor(request.getToolName());
        if (found.isEmpty()) {
            return deny(request, DecisionReason.TOOL_UNAVAILABLE, "tool is unknown or disabled", false);
        }
        ToolDescriptor descriptor = found.get();
        ToolSettings settings = config.settings(descriptor.getName());

        DecisionReason grant = DecisionReason.PERMITTED;
        List<String> dangers = new ArrayList<>();
        if (descriptor.getTargetKind() != TargetKind.NONE) {
            Path root = TargetResolver.resolveRoot(settings.getRootDirectory());
            String target = request.argument(descriptor.getTargetArgument());
            if (target == null || target.isBlank()) {
                return deny(request, DecisionReason.NOT_WHITELISTED, "missing target argument " + descriptor.getTargetArgument(), false);
            }
            List<String> whitelist = settings.getWhitelist() == null ? List.of() : settings.getWhitelist();
            if (whitelist.isEmpty()) {
                return deny(request, DecisionReason.NOT_WHITELISTED, "whitelist is empty", false);
            }
            String failure = descriptor.getTargetKind() == TargetKind.PATH
                    ? checkPath(target, root, whitelist)
                    : checkCommand(target, root, whitelist);
            if (failure != null) {
                return deny(request, DecisionReason.NOT_WHITELISTED, failure, false);
            }
            grant = DecisionReason.WHITELISTED;

            if (descriptor.getTargetKind() == TargetKind.PATH) {
                if (isWrite(request) && !settings.isReadWrite()) {
                    return deny(request, DecisionReason.READ_ONLY, "tool is configured read-only", false);
                }
                for (String danger : detector.assessPath(TargetResolver.normalized(root, target))) {
                    addDanger(dangers, danger);
                }
                for (String danger : detector.assessPath(TargetResolver.resolveTarget(root, target))) {
                    addDanger(dangers, danger);
                }
            } else {
                dangers.addAll(detector.assessCommand(commandLine(request, target), root));
            }
        }

        boolean approvalRequired = descriptor.isRequiresApproval() || settings.isRequiresApproval() || !dangers.isEmpty();
        if (approvalRequired) {
            if (!approvals.isApproved(request.fingerprint())) {
                String detail = dangers.isEmpty() ? "tool requires approval" : String.join("; ", dangers);
                return deny(request, DecisionReason.DANGEROUS_REQUIRES_APPROVAL, detail, true);
            }
            grant = DecisionReason.APPROVED;
        }

        int max = Math.max(1, config.getMaxTimeoutSeconds());
        int configured = settings.getTimeoutSeconds() != null ? settings.getTimeoutSeconds() : config.getDefaultTimeoutSeconds();
        int effective = clamp(configured, max);
        String requestedRaw = request.argument(TIMEOUT_ARGUMENT);
        if (requestedRaw != null && !requestedRaw.isBlank()) {
            Integer requested = parseSeconds(requestedRaw);
            if (requested != null) {
                if (requested > max) {
                    return deny(request, DecisionReason.TIMEOUT_EXCEEDED,
                            "requested " + requested + "s exceeds ceiling " + max + "s", approvalRequired);
                }
                effective = Math.min(clamp(requested, max), effective);
            }
        }
        return SecurityDecision.builder()
                .allowed(true)
                .reason(grant)
                .effectiveTimeout(Duration.ofSeconds(effective))
                .detail(dangers.isEmpty() ? null : String.join("; ", dangers))
                .approvalRequired(approvalRequired)
                .toolName(descriptor.getName())
                .fingerprint(request.fingerprint())
                .build();
    }

    private String checkPath(String target, Path root, List<String> whitelist) {
        Path lexical = TargetResolver.lexical(root, target);
        if (!matcher.matchesPath(lexical, root, whitelist)) {
            return "target " + target + " matches no whitelist entry";
        }
        Path normalized = lexical.toAbsolutePath().normalize();
        if (!TargetResolver.isAbsolute(target) && !TargetResolver.isInside(root, normalized)) {
            return "target " + target + " resolves outside root " + TargetResolver.toTransportPath(root);
        }
        if (!matcher.matchesPath(normalized, root, whitelist)) {
            return "resolved target " + TargetResolver.toTransportPath(normalized) + " matches no whitelist entry";
        }
        Path real = TargetResolver.real(normalized);
        if (real.equals(normalized)) {
            return null;
        }
        if (!TargetResolver.isAbsolute(target) && !TargetResolver.isInside(root, real)) {
            return "target " + target + " links outside root to " + TargetResolver.toTransportPath(real);
        }
        if (!matcher.matchesPath(real, root, whitelist)) {
            return "linked target " + TargetResolver.toTransportPath(real) + " matches no whitelist entry";
        }
        return null;
    }

    private static void addDanger(List<String> dangers, String danger) {
        if (!dangers.contains(danger)) {
            dangers.add(danger);
        }
    }

    private String checkCommand(String command, Path root, List<String> whitelist) {
        String trimmed = command.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            return checkPath(trimmed, root, whitelist);
        }
        if (!matcher.matchesCommandName(trimmed, whitelist)) {
            return "command " + trimmed + " matches no whitelist entry";
        }
        return null;
    }

    private String commandLine(ToolInvocationRequest request, String command) {
        StringBuilder line = new StringBuilder(command.trim());
        for (String argument : coercer.parseStringList(request.argument(ARGUMENTS_ARGUMENT))) {
            line.append(' ');
            line.append(argument.contains(" ") ? "\"" + argument + "\"" : argument);
        }
        return line.toString();
    }

    private static boolean isWrite(ToolInvocationRequest request) {
        String operation = request.argument(OPERATION_ARGUMENT);
        return operation != null && "write".equalsIgnoreCase(operation.trim());
    }

    private static Integer parseSeconds(String raw) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return (int) Math.ceil(Math.min(value, Integer.MAX_VALUE));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int clamp(int seconds, int max) {
        return Math.max(1, Math.min(seconds, max));
    }

    private static SecurityDecision deny(ToolInvocationRequest request, DecisionReason reason, String detail, boolean approvalRequired) {
        return SecurityDecision.builder()
                .allowed(false)
                .reason(reason)
                .detail(detail)
                .approvalRequired(approvalRequired)
                .toolName(request.getToolName())
                .fingerprint(request.fingerprint())
                .build();
    }
}
