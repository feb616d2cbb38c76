package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.GeneratePlanRequest;
import io.github.drompincen.planloop.protocol.api.PlanContent;
import io.github.drompincen.planloop.protocol.api.PlanVersionDto;
import io.github.drompincen.planloop.runtime.llm.ModelException;
import io.github.drompincen.planloop.runtime.planning.PlanningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanningService planningService;

    public PlanController(PlanningService planningService) {
        this.planningService = planningService;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GeneratePlanRequest request) {
        if (request == null || request.projectId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "projectId is required"));
        }
        try {
            return ResponseEntity.ok(planningService.generatePlan(
                    request.projectId(), request.userId(), request.forceRegenerate()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (ModelException e) {
            log.warn("Plan generation for project {} failed: {}", request.projectId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Plan generation failed: " + e.getMessage()));
        }
    }

    @GetMapping("/projects/{projectId}/latest")
    public ResponseEntity<PlanVersionDto> latest(@PathVariable String projectId) {
        return planningService.getLatestPlan(projectId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/projects/{projectId}/content")
    public ResponseEntity<PlanContent> content(@PathVariable String projectId) {
        return planningService.getLatestPlan(projectId)
                .map(PlanVersionDto::content)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/projects/{projectId}/versions")
    public List<PlanVersionDto> versions(@PathVariable String projectId) {
        return planningService.listVersions(projectId);
    }
}
