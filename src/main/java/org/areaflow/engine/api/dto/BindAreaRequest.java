package org.areaflow.engine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of POST /v1/users/{userId}/areas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BindAreaRequest {

    @NotBlank(message = "actionName is required")
    private String actionName;

    @NotBlank(message = "reactionName is required")
    private String reactionName;

    private Map<String, Object> actionConfig;
    private Map<String, Object> reactionConfig;
}
