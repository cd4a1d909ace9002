package com.zzf.orchestrator.llm;

import com.zzf.orchestrator.core.protocol.NativeToolCall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private String role;
    private String content;
    /** Set on tool messages: the call this message answers. */
    private String toolCallId;
    private String name;
    @Builder.Default
    private List<NativeToolCall> toolCalls = new ArrayList<>();

    public static ChatMessage system(String content) {
        return ChatMessage.builder().role(SYSTEM).content(content).build();
    }

    public static ChatMessage user(String content) {
        return ChatMessage.builder().role(USER).content(content).build();
    }

    public static ChatMessage assistant(String content) {
        return ChatMessage.builder().role(ASSISTANT).content(content).build();
    }

    public static ChatMessage assistant(String content, List<NativeToolCall> toolCalls) {
        return ChatMessage.builder().role(ASSISTANT).content(content)
                .toolCalls(toolCalls == null ? new ArrayList<>() : new ArrayList<>(toolCalls)).build();
    }

    public static ChatMessage tool(String toolCallId, String name, String content) {
        return ChatMessage.builder().role(TOOL).toolCallId(toolCallId).name(name).content(content).build();
    }

    public ChatMessage copy() {
        return ChatMessage.builder()
                .role(role)
                .content(content)
                .toolCallId(toolCallId)
                .name(name)
                .toolCalls(toolCalls == null ? new ArrayList<>() : new ArrayList<>(toolCalls))
                .build();
    }
}
