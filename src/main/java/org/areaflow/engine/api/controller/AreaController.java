package org.areaflow.engine.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.dto.*;
import org.areaflow.engine.domain.model.Area;
import org.areaflow.engine.service.AreaManager;
import org.areaflow.engine.service.ExecutionPassSummary;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bind, list and deactivate a user's areas; run a manual execution pass.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Slf4j
public class AreaController {

    private final AreaManager areaManager;

    @PostMapping("/users/{userId}/areas")
    public ResponseEntity<ApiResponse<BindAreaResponse>> bindArea(@PathVariable String userId,
                                                                  @Valid @RequestBody BindAreaRequest request) {
        MDC.put("userId", userId);
        try {
            Map<String, Object> config = new HashMap<>();
            config.put(Area.ACTION_SECTION, request.getActionConfig() != null ? request.getActionConfig() : Map.of());
            config.put(Area.REACTION_SECTION, request.getReactionConfig() != null ? request.getReactionConfig() : Map.of());

            UUID areaId = areaManager.bindAction(userId, request.getActionName(), request.getReactionName(), config);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.success(new BindAreaResponse(areaId)));
        } finally {
            MDC.clear();
        }
    }

    @GetMapping("/users/{userId}/areas")
    public ResponseEntity<ApiResponse<List<AreaDto>>> listAreas(@PathVariable String userId) {
        List<AreaDto> areas = areaManager.getUserAreas(userId).stream().map(AreaDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success(areas));
    }

    @DeleteMapping("/areas/{areaId}")
    public ResponseEntity<ApiResponse<DeactivateAreaResponse>> deactivateArea(
            @PathVariable UUID areaId,
            @RequestParam(value = "userId", required = false) String userId) {
        MDC.put("areaId", areaId.toString());
        if (userId != null) {
            MDC.put("userId", userId);
        }
        try {
            boolean changed = areaManager.deactivateArea(areaId, userId);
            return ResponseEntity.ok(ApiResponse.success(new DeactivateAreaResponse(areaId, changed)));
        } finally {
            MDC.clear();
        }
    }

    @PostMapping("/areas/executions")
    public ResponseEntity<ApiResponse<ExecutionPassSummary>> triggerExecution() {
        log.info("Manual execution pass requested");
        return ResponseEntity.ok(ApiResponse.success(areaManager.triggerAreaExecution()));
    }
}
