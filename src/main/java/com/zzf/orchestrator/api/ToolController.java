package com.zzf.orchestrator.api;

import com.zzf.orchestrator.config.RegistryService;
import com.zzf.orchestrator.config.ToolView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Process-wide enable/disable overrides on top of the tool registry file.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final RegistryService registryService;

    @GetMapping
    public List<ToolView> listTools() {
        return registryService.listTools();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolView> getTool(@PathVariable String name) {
        return registryService.getTool(name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).build());
    }

    @PostMapping("/{name}/enable")
    public ResponseEntity<ToolView> enable(@PathVariable String name) {
        return respond(name, registryService.enable(name));
    }

    @PostMapping("/{name}/disable")
    public ResponseEntity<ToolView> disable(@PathVariable String name) {
        return respond(name, registryService.disable(name));
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<ToolView> reset(@PathVariable String name) {
        return respond(name, registryService.reset(name));
    }

    private ResponseEntity<ToolView> respond(String name, boolean known) {
        if (!known) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        return getTool(name);
    }
}
