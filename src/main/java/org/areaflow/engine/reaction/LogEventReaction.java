package org.areaflow.engine.reaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.catalog.ReactionDefinition;
import org.areaflow.engine.domain.model.AreaEventLog;
import org.areaflow.engine.domain.model.enums.AreaEventType;
import org.areaflow.engine.domain.repository.AreaEventLogRepository;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the trigger in the area's event log. Needs no linked account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogEventReaction implements ReactionExecutor {

    public static final String NAME = "log_event";

    private static final ReactionDefinition DEFINITION = new ReactionDefinition(
            NAME, "default", "Record the event in the area history", List.of());

    private final AreaEventLogRepository eventLogRepository;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ReactionDefinition definition() {
        return DEFINITION;
    }

    @Override
    public void execute(String userId, Map<String, Object> reactionConfig, TriggerEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", event.actionName());
        details.put("payload", event.payload());
        details.put("config", reactionConfig);

        eventLogRepository.save(AreaEventLog.builder()
                .areaId(event.areaId())
                .userId(userId)
                .eventType(AreaEventType.AREA_TRIGGERED)
                .signalId(event.signalId())
                .details(details)
                .occurredAt(OffsetDateTime.now(clock))
                .build());
        log.info("Area triggered: areaId={}, userId={}, action={}, signal={}",
                event.areaId(), userId, event.actionName(), event.signalId());
    }
}
