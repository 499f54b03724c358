package org.areaflow.engine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.areaflow.engine.domain.model.Area;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Area as returned to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AreaDto {

    private UUID id;
    private String userId;
    private String actionName;
    private String reactionName;
    private Map<String, Object> actionConfig;
    private Map<String, Object> reactionConfig;
    private boolean active;
    private OffsetDateTime createdAt;

    public static AreaDto from(Area area) {
        return AreaDto.builder()
                .id(area.getId())
                .userId(area.getOwnerUserId())
                .actionName(area.getActionName())
                .reactionName(area.getReactionName())
                .actionConfig(area.actionConfig())
                .reactionConfig(area.reactionConfig())
                .active(area.isActive())
                .createdAt(area.getCreatedAt())
                .build();
    }
}
