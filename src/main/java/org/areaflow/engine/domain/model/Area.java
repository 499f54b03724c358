package org.areaflow.engine.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A user's binding of one action to one reaction. Deactivated in place, never deleted,
 * so execution history keeps pointing at it.
 */
@Entity
@Table(name = "area")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Area {

    public static final String ACTION_SECTION = "action";
    public static final String REACTION_SECTION = "reaction";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_user_id", nullable = false)
    private String ownerUserId;

    @Column(name = "action_name", nullable = false)
    private String actionName;

    @Column(name = "reaction_name", nullable = false)
    private String reactionName;

    // {"action": {...}, "reaction": {...}}
    @Column(nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    public Map<String, Object> actionConfig() {
        return section(ACTION_SECTION);
    }

    public Map<String, Object> reactionConfig() {
        return section(REACTION_SECTION);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(String name) {
        Object value = config == null ? null : config.get(name);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
