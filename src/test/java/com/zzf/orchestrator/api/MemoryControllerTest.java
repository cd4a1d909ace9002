package com.zzf.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.orchestrator.memory.MemoryManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MemoryControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockMvc mockMvc;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws Exception {
        Path registry = dir.resolve("memory_registry.json");
        Files.writeString(registry, "{\"memories\":[{\"name\":\"main_memory\",\"enabled\":true,\"max_entries\":1}]}");
        mockMvc = MockMvcBuilders.standaloneSetup(new MemoryController(new MemoryManager(registry, mapper)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void addGetUpdateDelete() throws Exception {
        String body = mockMvc.perform(post("/api/memory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"User's name is Matt\",\"kind\":\"fact\",\"tags\":[\"name\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.kind").value("fact"))
                .andExpect(jsonPath("$.source").value("api"))
                .andReturn().getResponse().getContentAsString();
        String id = mapper.readTree(body).get("id").asText();
        assertThat(id).startsWith("mem_");

        mockMvc.perform(get("/api/memory/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("User's name is Matt"));

        mockMvc.perform(patch("/api/memory/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"importance\":0.9}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.importance").value(0.9));

        mockMvc.perform(get("/api/memory").param("query", "matt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(delete("/api/memory/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));

        mockMvc.perform(get("/api/memory/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("not_found"));
    }

    @Test
    void capacityAndValidationErrors() throws Exception {
        mockMvc.perform(post("/api/memory").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"first\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/memory").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"second\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/memory").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\" \"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/memory").param("kind", "gossip"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/memory").param("memory", "other"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statsDescribeTheStore() throws Exception {
        mockMvc.perform(post("/api/memory").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"a\",\"kind\":\"task\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/memory/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memory_name").value("main_memory"))
                .andExpect(jsonPath("$.total_entries").value(1))
                .andExpect(jsonPath("$.entry_types.task").value(1));
    }
}
