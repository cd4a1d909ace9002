package com.zzf.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code orchestrator} section of {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {
    /** single_pass, dual_pass_write_only or dual_pass_all. */
    private String executionMode = "dual_pass_write_only";
    private Tools tools = new Tools();
    private Memory memory = new Memory();
    private Policy policy = new Policy();
    private Chat chat = new Chat();
    private Llm llm = new Llm();

    @Data
    public static class Tools {
        private String registryPath = "config/tools_registry.json";
        /** Parse {@code <function=...>} calls out of plain model text. */
        private boolean taggedCallsEnabled = true;
        private int workerThreads = 4;
        private int maxOutputBytes = 1024 * 1024;
    }

    @Data
    public static class Memory {
        private String registryPath = "config/memory_registry.json";
    }

    @Data
    public static class Policy {
        private int defaultTimeoutSeconds = 30;
        private int maxTimeoutSeconds = 300;
    }

    @Data
    public static class Chat {
        private int maxToolIterations = 5;
        private int turnRetries = 0;
        private int backgroundThreads = 2;
        private int maxHistoryMessages = 50;
        private int maxSessions = 1000;
    }

    @Data
    public static class Llm {
        private String baseUrl = "http://127.0.0.1:8000/v1";
        private String apiKey = "";
        private String model = "default";
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private int requestTimeoutSeconds = 120;
    }
}
