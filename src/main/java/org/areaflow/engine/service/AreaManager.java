package org.areaflow.engine.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.action.ActionExecutor;
import org.areaflow.engine.catalog.ActionDefinition;
import org.areaflow.engine.catalog.ActionReactionCatalog;
import org.areaflow.engine.catalog.ConfigSchemaValidator;
import org.areaflow.engine.catalog.Placeholder;
import org.areaflow.engine.catalog.ReactionDefinition;
import org.areaflow.engine.domain.model.Area;
import org.areaflow.engine.domain.repository.AreaRepository;
import org.areaflow.engine.reaction.ReactionExecutor;
import org.areaflow.engine.scheduler.PollingScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Area lifecycle: catalog queries, bind, list, deactivate, manual execution and
 * re-attaching active areas to the scheduler after a restart.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AreaManager {

    private final ActionReactionCatalog catalog;
    private final ConfigSchemaValidator configSchemaValidator;
    private final AreaRepository areaRepository;
    private final PollingScheduler pollingScheduler;
    private final AreaDispatcher areaDispatcher;
    private final Clock clock;

    public List<ActionDefinition> getAvailableActions() {
        return catalog.getActions();
    }

    public List<ReactionDefinition> getAvailableReactions() {
        return catalog.getReactions();
    }

    public List<Placeholder> getActionPlaceholders(String actionName) {
        return catalog.requireAction(actionName).definition().placeholders();
    }

    /**
     * Create an active area and start polling it. Names are resolved before the config is
     * validated; nothing is persisted when either check fails.
     *
     * @param config map with optional {@code action} and {@code reaction} sections
     */
    public UUID bindAction(String userId, String actionName, String reactionName, Map<String, Object> config) {
        ActionExecutor action = catalog.requireAction(actionName);
        ReactionExecutor reaction = catalog.requireReaction(reactionName);

        Map<String, Object> areaConfig = new HashMap<>();
        areaConfig.put(Area.ACTION_SECTION, section(config, Area.ACTION_SECTION));
        areaConfig.put(Area.REACTION_SECTION, section(config, Area.REACTION_SECTION));
        configSchemaValidator.validate(actionName, action.definition().configSchema(), section(config, Area.ACTION_SECTION));
        configSchemaValidator.validate(reactionName, reaction.definition().configSchema(), section(config, Area.REACTION_SECTION));

        Area area = areaRepository.save(Area.builder()
                .ownerUserId(userId)
                .actionName(actionName)
                .reactionName(reactionName)
                .config(areaConfig)
                .active(true)
                .createdAt(OffsetDateTime.now(clock))
                .build());
        log.info("Area bound: areaId={}, userId={}, action={}, reaction={}", area.getId(), userId, actionName, reactionName);

        pollingScheduler.start(area.getId());
        return area.getId();
    }

    public List<Area> getUserAreas(String userId) {
        return areaRepository.findByOwnerUserIdAndActiveTrueOrderByCreatedAtDesc(userId);
    }

    public boolean deactivateArea(UUID areaId) {
        return deactivateArea(areaId, null);
    }

    /**
     * Deactivate an area and stop its polling. Safe to repeat: a missing, already inactive or
     * foreign area leaves everything as it is.
     *
     * @param userId when not null, only the owner's area is deactivated
     * @return true if this call changed the area
     */
    public boolean deactivateArea(UUID areaId, String userId) {
        Optional<Area> found = areaRepository.findById(areaId);
        if (found.isEmpty()) {
            pollingScheduler.stop(areaId);
            log.debug("Deactivate ignored, no such areaId={}", areaId);
            return false;
        }
        Area area = found.get();
        if (userId != null && !userId.equals(area.getOwnerUserId())) {
            log.warn("Deactivate ignored, areaId={} is not owned by userId={}", areaId, userId);
            return false;
        }

        pollingScheduler.stop(areaId);
        if (!area.isActive()) {
            areaDispatcher.forget(areaId);
            return false;
        }
        area.setActive(false);
        area.setDeactivatedAt(OffsetDateTime.now(clock));
        areaRepository.save(area);
        areaDispatcher.forget(areaId);
        log.info("Area deactivated: areaId={}, userId={}", areaId, area.getOwnerUserId());
        return true;
    }

    /**
     * Run one detect and dispatch pass over every active area now, through the same path as the
     * timed poll loop.
     */
    public ExecutionPassSummary triggerAreaExecution() {
        List<Area> active = areaRepository.findByActiveTrue();
        Map<TickOutcome, Integer> outcomes = new EnumMap<>(TickOutcome.class);
        for (Area area : active) {
            TickOutcome outcome = areaDispatcher.runTick(area.getId());
            outcomes.merge(outcome, 1, Integer::sum);
        }
        log.info("Manual execution pass: areas={}, outcomes={}", active.size(), outcomes);
        return new ExecutionPassSummary(active.size(), outcomes);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        resumeActiveAreas();
    }

    /**
     * Re-attach every active area to the scheduler. Areas deactivated while the process was
     * down are not in the result and stay stopped.
     */
    public int resumeActiveAreas() {
        if (!pollingScheduler.isEnabled()) {
            log.info("Polling disabled, active areas not resumed");
            return 0;
        }
        int started = 0;
        for (Area area : areaRepository.findByActiveTrue()) {
            if (pollingScheduler.start(area.getId())) {
                started++;
            }
        }
        log.info("Resumed polling for {} active areas", started);
        return started;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> config, String name) {
        Object value = config == null ? null : config.get(name);
        return value instanceof Map<?, ?> map ? new HashMap<>((Map<String, Object>) map) : new HashMap<>();
    }
}
