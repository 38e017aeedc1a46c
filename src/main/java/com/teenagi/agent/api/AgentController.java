package com.teenagi.agent.api;

import com.teenagi.agent.core.Agent;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.model.AgentRequest;
import com.teenagi.agent.model.AgentResponse;
import com.teenagi.agent.model.CapabilityRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP front for the default agent.
 *
 * POST /api/v1/agent/respond        run one request through the tool-use loop
 * POST /api/v1/agent/capabilities   teach the agent a capability
 * GET  /api/v1/agent/capabilities
 * GET  /api/v1/agent/functions
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final Agent agent;

    @PostMapping("/respond")
    public ResponseEntity<AgentResponse> respond(@Valid @RequestBody AgentRequest request) {
        log.info("Respond request [agent={}, inputLength={}]", agent.getName(), request.getInput().length());
        return ResponseEntity.ok(agent.run(request.getInput()));
    }

    @PostMapping("/capabilities")
    public ResponseEntity<Map<String, Object>> learn(@Valid @RequestBody CapabilityRequest request) {
        if (!agent.learn(request.getStatement())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Capability statement must not be blank"));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("capabilities", agent.getCapabilities()));
    }

    @GetMapping("/capabilities")
    public ResponseEntity<List<String>> capabilities() {
        return ResponseEntity.ok(agent.getCapabilities());
    }

    @GetMapping("/functions")
    public ResponseEntity<List<Map<String, Object>>> functions() {
        List<Map<String, Object>> body = agent.getFunctions().stream()
                .map(AgentController::describe)
                .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "agent", agent.getName(),
                "provider", agent.getProvider(),
                "model", agent.getModel()));
    }

    private static Map<String, Object> describe(FunctionDescriptor descriptor) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", descriptor.getName());
        m.put("description", descriptor.getDescription());
        m.put("parameters", descriptor.toJsonSchema());
        m.put("returns", descriptor.getReturnType());
        return m;
    }
}
