package org.areaflow.engine.api.controller;

import lombok.RequiredArgsConstructor;
import org.areaflow.engine.api.dto.ApiResponse;
import org.areaflow.engine.catalog.ActionDefinition;
import org.areaflow.engine.catalog.Placeholder;
import org.areaflow.engine.catalog.ReactionDefinition;
import org.areaflow.engine.provider.ProviderRegistry;
import org.areaflow.engine.service.AreaManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only catalog of actions, reactions and providers for the binding UI.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final AreaManager areaManager;
    private final ProviderRegistry providerRegistry;

    @GetMapping("/catalog/actions")
    public ResponseEntity<ApiResponse<List<ActionDefinition>>> listActions() {
        return ResponseEntity.ok(ApiResponse.success(areaManager.getAvailableActions()));
    }

    @GetMapping("/catalog/reactions")
    public ResponseEntity<ApiResponse<List<ReactionDefinition>>> listReactions() {
        return ResponseEntity.ok(ApiResponse.success(areaManager.getAvailableReactions()));
    }

    @GetMapping("/catalog/actions/{name}/placeholders")
    public ResponseEntity<ApiResponse<List<Placeholder>>> listPlaceholders(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(areaManager.getActionPlaceholders(name)));
    }

    @GetMapping("/providers")
    public ResponseEntity<ApiResponse<List<String>>> listProviders() {
        return ResponseEntity.ok(ApiResponse.success(providerRegistry.listProviders()));
    }
}
