package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.orchestrator.core.policy.TargetResolver;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code command_exec}: runs one program with arguments inside the tool root. No shell is
 * involved, so pipes and redirections are passed through as literal arguments.
 */
@Slf4j
public class CommandExecTool implements ToolHandler {
    public static final String NAME = "command_exec";

    private final CommandExecutor executor;
    private final ObjectMapper mapper;
    private final ToolDescriptor descriptor;

    public CommandExecTool(CommandExecutor executor, ObjectMapper mapper) {
        this.executor = executor;
        this.mapper = mapper;
        this.descriptor = ToolDescriptor.builder()
                .name(NAME)
                .description("Execute a whitelisted command with arguments in the configured root directory. "
                        + "Returns exit code, stdout and stderr.")
                .parameter(ParameterSpec.required("command", ParameterType.STRING, "Program to run, e.g. 'ls' or 'git'"))
                .parameter(ParameterSpec.optional("arguments", ParameterType.STRING_LIST, "Arguments passed to the program"))
                .parameter(ParameterSpec.builder()
                        .name("timeout")
                        .type(ParameterType.INTEGER)
                        .description("Timeout in seconds; capped by the configured ceiling")
                        .minimum(1.0)
                        .build())
                .category(ToolCategory.SIDE_EFFECTING)
                .requiresApproval(false)
                .streamable(false)
                .targetKind(TargetKind.COMMAND)
                .targetArgument("command")
                .build();
    }

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ToolResult execute(ToolExecution execution) throws Exception {
        Path root = rootOf(execution);
        String command = execution.string("command").trim();
        List<String> argv = new ArrayList<>();
        if (command.contains("/") || command.contains("\\")) {
            argv.add(TargetResolver.resolveTarget(root, command).toString());
        } else {
            argv.add(command);
        }
        argv.addAll(execution.stringList("arguments"));

        long timeoutMs = execution.getTimeout().toMillis();
        log.info("command.start callId={} argv={} cwd={}", execution.getCallId(), argv, root);
        CommandExecutor.ExecutionResult run = executor.execute(execution.getCallId(), argv, root, timeoutMs);

        ObjectNode out = mapper.createObjectNode();
        out.put("command", command);
        out.set("arguments", mapper.valueToTree(argv.subList(1, argv.size())));
        out.put("exitCode", run.exitCode);
        out.put("stdout", run.stdout);
        out.put("stderr", run.stderr);
        out.put("durationMs", run.durationMs);
        if (run.timedOut) {
            return ToolResult.of(ToolStatus.TIMED_OUT, NAME, "execution exceeded " + execution.getTimeout().getSeconds() + "s")
                    .withExtra("timeoutSeconds", mapper.valueToTree(execution.getTimeout().getSeconds()))
                    .withExtra("partial", out);
        }
        ToolResult result = ToolResult.ok(NAME, out);
        return run.exitCode == 0 ? result : result.withHint("Command exited with status " + run.exitCode);
    }

    @Override
    public void cancel(String callId) {
        executor.cancel(callId);
    }

    static Path rootOf(ToolExecution execution) {
        return TargetResolver.resolveRoot(execution.getSettings() == null ? null : execution.getSettings().getRootDirectory());
    }
}
