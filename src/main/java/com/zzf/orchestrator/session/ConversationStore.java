package com.zzf.orchestrator.session;

import com.zzf.orchestrator.llm.ChatMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * In-process chat history per session, bounded to the most recent messages. The number of
 * sessions is bounded too; the least recently used session is dropped first.
 */
@Slf4j
public class ConversationStore {
    public static final int DEFAULT_MAX_SESSIONS = 1000;

    private final int maxMessages;
    private final int maxSessions;
    private final Map<String, LinkedList<ChatMessage>> sessions;

    public ConversationStore(int maxMessages) {
        this(maxMessages, DEFAULT_MAX_SESSIONS);
    }

    public ConversationStore(int maxMessages, int maxSessions) {
        this.maxMessages = Math.max(2, maxMessages);
        this.maxSessions = Math.max(1, maxSessions);
        this.sessions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, LinkedList<ChatMessage>> eldest) {
                if (size() <= ConversationStore.this.maxSessions) {
                    return false;
                }
                log.info("chat.session_evicted sessionId={} maxSessions={}", eldest.getKey(), ConversationStore.this.maxSessions);
                return true;
            }
        };
    }

    public List<ChatMessage> history(String sessionId) {
        LinkedList<ChatMessage> messages;
        synchronized (sessions) {
            messages = sessions.get(sessionId);
        }
        if (messages == null) {
            return new ArrayList<>();
        }
        synchronized (messages) {
            List<ChatMessage> copy = new ArrayList<>(messages.size());
            for (ChatMessage message : messages) {
                copy.add(message.copy());
            }
            return copy;
        }
    }

    public void append(String sessionId, ChatMessage... toAppend) {
        LinkedList<ChatMessage> messages;
        synchronized (sessions) {
            messages = sessions.computeIfAbsent(sessionId, key -> new LinkedList<>());
        }
        synchronized (messages) {
            for (ChatMessage message : toAppend) {
                messages.addLast(message.copy());
            }
            while (messages.size() > maxMessages) {
                messages.removeFirst();
            }
        }
    }

    public int sessionCount() {
        synchronized (sessions) {
            return sessions.size();
        }
    }
}
