package com.zzf.orchestrator.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.orchestrator.core.policy.TargetResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@code file_access}: read, write or list UTF-8 text files under the tool root.
 */
@Slf4j
public class FileAccessTool implements ToolHandler {
    public static final String NAME = "file_access";
    static final long MAX_FILE_BYTES = 10L * 1024 * 1024;
    private static final int MAX_LIST_ENTRIES = 1000;

    private final ObjectMapper mapper;
    private final ToolDescriptor descriptor;

    public FileAccessTool(ObjectMapper mapper) {
        this.mapper = mapper;
        this.descriptor = ToolDescriptor.builder()
                .name(NAME)
                .description("Read, write or list text files within the allowed directories. "
                        + "Writes are only possible when the tool is configured read-write.")
                .parameter(ParameterSpec.builder()
                        .name("operation")
                        .type(ParameterType.STRING)
                        .required(true)
                        .description("One of read, write, list")
                        .allowedValue("read")
                        .allowedValue("write")
                        .allowedValue("list")
                        .build())
                .parameter(ParameterSpec.required("path", ParameterType.STRING, "File or directory path, relative to the root or absolute"))
                .parameter(ParameterSpec.optional("content", ParameterType.STRING, "Text to write (write only)"))
                .category(ToolCategory.SIDE_EFFECTING)
                .requiresApproval(false)
                .streamable(false)
                .targetKind(TargetKind.PATH)
                .targetArgument("path")
                .build();
    }

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ToolResult execute(ToolExecution execution) throws IOException {
        Path root = CommandExecTool.rootOf(execution);
        Path target = TargetResolver.resolveTarget(root, execution.string("path"));
        String operation = execution.string("operation");
        switch (operation) {
            case "read":
                return read(target);
            case "write":
                return write(target, execution.string("content"));
            case "list":
                return list(target);
            default:
                return ToolResult.of(ToolStatus.INVALID_ARGUMENTS, NAME, "unknown operation '" + operation + "'");
        }
    }

    private ToolResult read(Path target) throws IOException {
        if (!Files.isRegularFile(target)) {
            return ToolResult.error(NAME, "not a regular file: " + target);
        }
        long size = Files.size(target);
        if (size > MAX_FILE_BYTES) {
            return ToolResult.error(NAME, "file too large: " + size + " bytes (limit " + MAX_FILE_BYTES + ")");
        }
        byte[] bytes = Files.readAllBytes(target);
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return ToolResult.error(NAME, "file is not UTF-8 text: " + target);
        }
        ObjectNode out = mapper.createObjectNode();
        out.put("path", target.toString());
        out.put("size", bytes.length);
        out.put("content", text);
        log.info("file.read path={} bytes={}", target, bytes.length);
        return ToolResult.ok(NAME, out);
    }

    private ToolResult write(Path target, String content) throws IOException {
        if (content == null) {
            return ToolResult.of(ToolStatus.INVALID_ARGUMENTS, NAME, "content is required for write");
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_FILE_BYTES) {
            return ToolResult.error(NAME, "content too large: " + bytes.length + " bytes (limit " + MAX_FILE_BYTES + ")");
        }
        if (Files.isDirectory(target)) {
            return ToolResult.error(NAME, "path is a directory: " + target);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, bytes);
        ObjectNode out = mapper.createObjectNode();
        out.put("path", target.toString());
        out.put("bytesWritten", bytes.length);
        log.info("file.write path={} bytes={}", target, bytes.length);
        return ToolResult.ok(NAME, out);
    }

    private ToolResult list(Path target) throws IOException {
        if (!Files.isDirectory(target)) {
            return ToolResult.error(NAME, "not a directory: " + target);
        }
        List<Path> children = new ArrayList<>();
        try (Stream<Path> stream = Files.list(target)) {
            stream.sorted(Comparator.comparing(p -> p.getFileName().toString())).forEach(children::add);
        }
        ObjectNode out = mapper.createObjectNode();
        out.put("path", target.toString());
        ArrayNode entries = out.putArray("entries");
        for (Path child : children) {
            if (entries.size() >= MAX_LIST_ENTRIES) {
                out.put("truncated", true);
                break;
            }
            ObjectNode item = entries.addObject();
            item.put("name", child.getFileName().toString());
            boolean dir = Files.isDirectory(child);
            item.put("type", dir ? "directory" : "file");
            if (!dir) {
                item.put("size", Files.size(child));
            }
        }
        out.put("count", children.size());
        return ToolResult.ok(NAME, out);
    }
}
