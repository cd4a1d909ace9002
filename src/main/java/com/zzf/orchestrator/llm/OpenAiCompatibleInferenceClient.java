package com.zzf.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.orchestrator.config.OrchestratorProperties;
import com.zzf.orchestrator.core.protocol.NativeToolCall;
import com.zzf.orchestrator.core.tool.ParameterSpec;
import com.zzf.orchestrator.core.tool.ToolDescriptor;
import com.zzf.orchestrator.core.util.StringUtils;
import com.zzf.orchestrator.model.InferenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint (llama.cpp server, vLLM,
 * OpenAI itself). Streamed responses are read as server-sent {@code data:} lines.
 */
@Slf4j
public class OpenAiCompatibleInferenceClient implements InferenceClient {

    private static final int MAX_ERROR_BODY_LENGTH = 1200;
    private static final int MAX_TOOL_DESCRIPTION_LENGTH = 1024;

    private final OrchestratorProperties.Llm settings;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public OpenAiCompatibleInferenceClient(OrchestratorProperties.Llm settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build());
    }

    OpenAiCompatibleInferenceClient(OrchestratorProperties.Llm settings, ObjectMapper objectMapper, HttpClient httpClient) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public InferenceResponse complete(List<ChatMessage> messages, List<ToolDescriptor> tools) {
        ObjectNode body = requestBody(messages, false);
        if (tools != null && !tools.isEmpty()) {
            ArrayNode toolArray = body.putArray("tools");
            for (ToolDescriptor tool : tools) {
                toolArray.add(toOpenAiTool(tool));
            }
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(body), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new InferenceException("Inference request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Inference request interrupted", e);
        }
        if (response.statusCode() != 200) {
            String errorBody = response.body() == null ? "" : response.body();
            log.error("llm.error status={} body={}", response.statusCode(), StringUtils.truncate(errorBody, MAX_ERROR_BODY_LENGTH));
            throw new InferenceException("LLM Error: " + response.statusCode() + " - " + StringUtils.truncate(errorBody, 300));
        }
        return parseCompletion(response.body());
    }

    @Override
    public String stream(List<ChatMessage> messages, Consumer<String> onToken) {
        ObjectNode body = requestBody(messages, true);
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(buildRequest(body), HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new InferenceException("Inference stream failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceException("Inference stream interrupted", e);
        }
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() != 200) {
                String errorBody = lines.collect(Collectors.joining("\n"));
                log.error("llm.error status={} body={}", response.statusCode(), StringUtils.truncate(errorBody, MAX_ERROR_BODY_LENGTH));
                throw new InferenceException("LLM Error: " + response.statusCode() + " - " + StringUtils.truncate(errorBody, 300));
            }
            return readStream(lines, onToken);
        } catch (UncheckedIOException e) {
            throw new InferenceException("Inference stream broke: " + e.getMessage(), e);
        }
    }

    InferenceResponse parseCompletion(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InferenceException("Unparseable completion response", e);
        }
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new InferenceException("Completion response has no choices");
        }
        JsonNode message = choice.path("message");
        InferenceResponse.InferenceResponseBuilder builder = InferenceResponse.builder()
                .content(message.path("content").isTextual() ? message.path("content").asText() : "")
                .finishReason(choice.path("finish_reason").asText("stop"));
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            String name = function.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            JsonNode arguments = function.path("arguments");
            String argumentsJson = arguments.isTextual() ? arguments.asText() : arguments.isMissingNode() ? "{}" : arguments.toString();
            String id = call.path("id").asText("");
            builder.toolCall(new NativeToolCall(id.isBlank() ? "call_" + UUID.randomUUID() : id, name, argumentsJson));
        }
        return builder.build();
    }

    String readStream(Stream<String> lines, Consumer<String> onToken) {
        StringBuilder full = new StringBuilder();
        Iterator<String> iterator = lines.iterator();
        while (iterator.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InferenceException("Inference stream interrupted");
            }
            String line = iterator.next();
            if (!line.startsWith("data:")) {
                continue;
            }
            String data = line.substring(5).trim();
            if ("[DONE]".equals(data)) {
                break;
            }
            if (data.isEmpty()) {
                continue;
            }
            JsonNode chunk;
            try {
                chunk = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                log.warn("llm.bad_chunk data={}", StringUtils.truncate(data, 200));
                continue;
            }
            JsonNode content = chunk.path("choices").path(0).path("delta").path("content");
            if (content.isTextual() && !content.asText().isEmpty()) {
                full.append(content.asText());
                if (onToken != null) {
                    onToken.accept(content.asText());
                }
            }
        }
        return full.toString();
    }

    ObjectNode toOpenAiTool(ToolDescriptor descriptor) {
        ObjectNode tool = objectMapper.createObjectNode();
        tool.put("type", "function");
        ObjectNode function = tool.putObject("function");
        function.put("name", descriptor.getName());
        function.put("description", StringUtils.truncate(descriptor.getDescription(), MAX_TOOL_DESCRIPTION_LENGTH));
        ObjectNode parameters = function.putObject("parameters");
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        ArrayNode required = parameters.putArray("required");
        for (ParameterSpec spec : descriptor.getParameters()) {
            ObjectNode property = properties.putObject(spec.getName());
            property.put("type", spec.getType().jsonType());
            if (spec.getDescription() != null) {
                property.put("description", spec.getDescription());
            }
            if ("array".equals(spec.getType().jsonType())) {
                property.putObject("items").put("type", "string");
            }
            if (spec.getAllowedValues() != null && !spec.getAllowedValues().isEmpty()) {
                ArrayNode values = property.putArray("enum");
                spec.getAllowedValues().forEach(values::add);
            }
            if (spec.getMinimum() != null) {
                property.put("minimum", spec.getMinimum());
            }
            if (spec.getMaximum() != null) {
                property.put("maximum", spec.getMaximum());
            }
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        return tool;
    }

    private ObjectNode requestBody(List<ChatMessage> messages, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("stream", stream);
        body.put("temperature", settings.getTemperature());
        body.put("max_tokens", settings.getMaxTokens());
        ArrayNode array = body.putArray("messages");
        for (ChatMessage message : messages) {
            array.add(toWire(message));
        }
        return body;
    }

    private ObjectNode toWire(ChatMessage message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole());
        node.put("content", message.getContent() == null ? "" : message.getContent());
        if (ChatMessage.TOOL.equals(message.getRole())) {
            node.put("tool_call_id", message.getToolCallId());
            if (message.getName() != null) {
                node.put("name", message.getName());
            }
        }
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            ArrayNode calls = node.putArray("tool_calls");
            for (NativeToolCall call : message.getToolCalls()) {
                ObjectNode item = calls.addObject();
                item.put("id", call.getId());
                item.put("type", "function");
                ObjectNode function = item.putObject("function");
                function.put("name", call.getName());
                function.put("arguments", call.getArgumentsJson() == null ? "{}" : call.getArgumentsJson());
            }
        }
        return node;
    }

    private HttpRequest buildRequest(ObjectNode body) {
        String jsonBody;
        try {
            jsonBody = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new InferenceException("Cannot encode inference request", e);
        }
        String baseUrl = settings.getBaseUrl().endsWith("/")
                ? settings.getBaseUrl().substring(0, settings.getBaseUrl().length() - 1)
                : settings.getBaseUrl();
        log.debug("llm.request url={} bytes={}", baseUrl, jsonBody.length());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(Math.max(1, settings.getRequestTimeoutSeconds())))
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + settings.getApiKey());
        }
        return builder.build();
    }
}
