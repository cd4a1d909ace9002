package com.zzf.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.core.classify.OperationClassifier;
import com.zzf.orchestrator.core.plan.ExecutionMode;
import com.zzf.orchestrator.core.plan.ExecutionStrategySelector;
import com.zzf.orchestrator.core.policy.ApprovalLedger;
import com.zzf.orchestrator.core.policy.PolicyEngine;
import com.zzf.orchestrator.core.protocol.ProtocolNormalizer;
import com.zzf.orchestrator.core.tool.ArgumentCoercer;
import com.zzf.orchestrator.core.tool.BuiltInToolHandlers;
import com.zzf.orchestrator.core.tool.CommandExecutor;
import com.zzf.orchestrator.core.tool.ToolDispatcher;
import com.zzf.orchestrator.core.tool.ToolRegistry;
import com.zzf.orchestrator.llm.InferenceClient;
import com.zzf.orchestrator.llm.OpenAiCompatibleInferenceClient;
import com.zzf.orchestrator.memory.MemoryManager;
import com.zzf.orchestrator.model.ConfigurationException;
import com.zzf.orchestrator.session.ChatSessionCoordinator;
import com.zzf.orchestrator.session.ConversationStore;
import com.zzf.orchestrator.shell.ShellService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    static final String MEMORY_PROMPT_RESOURCE = "prompt/memory_system_prompt.txt";

    @Bean
    public ExecutionMode executionMode(OrchestratorProperties properties) {
        return ExecutionMode.fromConfig(properties.getExecutionMode());
    }

    @Bean
    public ShellService shellService() {
        return new ShellService();
    }

    @Bean
    public CommandExecutor commandExecutor(ShellService shellService, OrchestratorProperties properties) {
        return new CommandExecutor(shellService, properties.getTools().getMaxOutputBytes());
    }

    @Bean
    public MemoryManager memoryManager(OrchestratorProperties properties, ObjectMapper objectMapper) {
        return new MemoryManager(Path.of(properties.getMemory().getRegistryPath()), objectMapper);
    }

    @Bean
    public ToolRegistry toolRegistry(MemoryManager memoryManager, CommandExecutor commandExecutor, ObjectMapper objectMapper) {
        ToolRegistry registry = new ToolRegistry();
        BuiltInToolHandlers.registerAll(registry, memoryManager, commandExecutor, objectMapper);
        return registry;
    }

    @Bean
    public RegistryService registryService(OrchestratorProperties properties,
                                           ToolRegistry toolRegistry,
                                           MemoryManager memoryManager,
                                           ExecutionMode executionMode,
                                           ObjectMapper objectMapper) {
        return new RegistryService(Path.of(properties.getTools().getRegistryPath()), toolRegistry, memoryManager,
                executionMode, properties.getPolicy(), objectMapper);
    }

    @Bean
    public ArgumentCoercer argumentCoercer(ObjectMapper objectMapper) {
        return new ArgumentCoercer(objectMapper);
    }

    @Bean
    public PolicyEngine policyEngine(ApprovalLedger approvalLedger, ArgumentCoercer argumentCoercer) {
        return new PolicyEngine(approvalLedger, argumentCoercer);
    }

    @Bean
    public ProtocolNormalizer protocolNormalizer(ObjectMapper objectMapper, OrchestratorProperties properties) {
        return new ProtocolNormalizer(objectMapper, properties.getTools().isTaggedCallsEnabled());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTools().getWorkerThreads()), namedThreads("tool-worker"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backgroundPassExecutor(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getChat().getBackgroundThreads()), namedThreads("background-pass"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExecutor() {
        return Executors.newCachedThreadPool(namedThreads("chat-stream"));
    }

    @Bean
    public ToolDispatcher toolDispatcher(ToolRegistry toolRegistry, ArgumentCoercer argumentCoercer,
                                         @Qualifier("toolExecutor") ExecutorService toolExecutor,
                                         ObjectMapper objectMapper) {
        return new ToolDispatcher(toolRegistry, argumentCoercer, toolExecutor, objectMapper);
    }

    @Bean
    public InferenceClient inferenceClient(OrchestratorProperties properties, ObjectMapper objectMapper) {
        return new OpenAiCompatibleInferenceClient(properties.getLlm(), objectMapper);
    }

    @Bean
    public ConversationStore conversationStore(OrchestratorProperties properties) {
        return new ConversationStore(properties.getChat().getMaxHistoryMessages(), properties.getChat().getMaxSessions());
    }

    @Bean
    public ChatSessionCoordinator chatSessionCoordinator(RegistryService registryService,
                                                         OperationClassifier classifier,
                                                         ExecutionStrategySelector selector,
                                                         ProtocolNormalizer normalizer,
                                                         PolicyEngine policyEngine,
                                                         ToolDispatcher dispatcher,
                                                         ApprovalLedger approvalLedger,
                                                         InferenceClient inferenceClient,
                                                         ConversationStore conversationStore,
                                                         @Qualifier("backgroundPassExecutor") ExecutorService backgroundPassExecutor,
                                                         OrchestratorProperties properties,
                                                         ObjectMapper objectMapper) {
        return new ChatSessionCoordinator(registryService, classifier, selector, normalizer, policyEngine, dispatcher,
                approvalLedger, inferenceClient, conversationStore, backgroundPassExecutor, properties.getChat(),
                loadMemoryPrompt(), objectMapper);
    }

    static String loadMemoryPrompt() {
        ClassPathResource resource = new ClassPathResource(MEMORY_PROMPT_RESOURCE);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Missing classpath resource " + MEMORY_PROMPT_RESOURCE, e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
