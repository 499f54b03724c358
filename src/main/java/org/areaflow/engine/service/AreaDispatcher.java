package org.areaflow.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.action.ActionExecutor;
import org.areaflow.engine.action.Signal;
import org.areaflow.engine.api.exception.AuthenticationExhaustedException;
import org.areaflow.engine.api.exception.ReactionExecutionFailedException;
import org.areaflow.engine.catalog.ActionReactionCatalog;
import org.areaflow.engine.domain.model.Area;
import org.areaflow.engine.domain.model.AreaEventLog;
import org.areaflow.engine.domain.model.enums.AreaEventType;
import org.areaflow.engine.domain.repository.AreaEventLogRepository;
import org.areaflow.engine.domain.repository.AreaRepository;
import org.areaflow.engine.reaction.PlaceholderResolver;
import org.areaflow.engine.reaction.ReactionExecutor;
import org.areaflow.engine.reaction.TriggerEvent;
import org.areaflow.engine.scheduler.AreaTickHandler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Detect then dispatch for one area. Shared by the timed poll loop and manual execution passes,
 * serialized per area so the two never overlap on the same detection state.
 * Poll-time failures are absorbed here and reported as a {@link TickOutcome}.
 */
@Service
@Slf4j
public class AreaDispatcher implements AreaTickHandler {

    private final AreaRepository areaRepository;
    private final AreaEventLogRepository eventLogRepository;
    private final ActionReactionCatalog catalog;
    private final PlaceholderResolver placeholderResolver;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer tickTimer;

    private final ConcurrentHashMap<UUID, ReentrantLock> areaLocks = new ConcurrentHashMap<>();
    private final Set<UUID> authFailureReported = ConcurrentHashMap.newKeySet();

    public AreaDispatcher(AreaRepository areaRepository,
                          AreaEventLogRepository eventLogRepository,
                          ActionReactionCatalog catalog,
                          PlaceholderResolver placeholderResolver,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.areaRepository = areaRepository;
        this.eventLogRepository = eventLogRepository;
        this.catalog = catalog;
        this.placeholderResolver = placeholderResolver;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.tickTimer = Timer.builder("area.engine.tick.duration")
                .description("Detect and dispatch latency per area tick")
                .register(meterRegistry);
    }

    @Override
    public void onTick(UUID areaId) {
        runTick(areaId);
    }

    public TickOutcome runTick(UUID areaId) {
        ReentrantLock lock = areaLocks.computeIfAbsent(areaId, id -> new ReentrantLock());
        lock.lock();
        try {
            return tickTimer.record(() -> doRunTick(areaId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop per-area bookkeeping once an area is deactivated. Call only after the area is saved
     * inactive: waits for an in-flight tick, and any tick that runs afterwards is skipped.
     */
    public void forget(UUID areaId) {
        authFailureReported.remove(areaId);
        ReentrantLock lock = areaLocks.get(areaId);
        if (lock == null) {
            return;
        }
        lock.lock();
        try {
            areaLocks.remove(areaId, lock);
        } finally {
            lock.unlock();
        }
    }

    private TickOutcome doRunTick(UUID areaId) {
        Optional<Area> found = areaRepository.findById(areaId);
        if (found.isEmpty() || !found.get().isActive()) {
            log.debug("Skipping tick for missing or inactive areaId={}", areaId);
            return TickOutcome.SKIPPED;
        }
        Area area = found.get();

        Optional<ActionExecutor> action = catalog.findAction(area.getActionName());
        if (action.isEmpty()) {
            log.warn("Area bound to an action no longer in the catalog: areaId={}, action={}", areaId, area.getActionName());
            return TickOutcome.SKIPPED;
        }

        Signal signal;
        try {
            signal = action.get().detect(area.getOwnerUserId(), area.actionConfig());
        } catch (AuthenticationExhaustedException e) {
            countDetection(area, "auth_failed");
            reportAuthFailure(area, e);
            return TickOutcome.AUTH_FAILED;
        } catch (Exception e) {
            countDetection(area, "failed");
            log.warn("Detection failed, treated as unchanged: areaId={}, userId={}, action={}, reason={}",
                    areaId, area.getOwnerUserId(), area.getActionName(), e.getMessage());
            return TickOutcome.DETECTION_FAILED;
        }

        authFailureReported.remove(areaId);
        countDetection(area, signal.kind().name().toLowerCase());

        return switch (signal.kind()) {
            case NO_ACCOUNT -> TickOutcome.NO_ACCOUNT;
            case UNCHANGED -> TickOutcome.UNCHANGED;
            case TRIGGERED -> dispatch(area, signal);
        };
    }

    private TickOutcome dispatch(Area area, Signal signal) {
        Optional<ReactionExecutor> reaction = catalog.findReaction(area.getReactionName());
        Map<String, Object> processedConfig = placeholderResolver.resolve(area.reactionConfig(), signal.payload());
        TriggerEvent event = new TriggerEvent(area.getId(), area.getActionName(), signal.signalId(), signal.payload());

        try {
            if (reaction.isEmpty()) {
                throw new IllegalStateException("Reaction no longer in the catalog: " + area.getReactionName());
            }
            reaction.get().execute(area.getOwnerUserId(), processedConfig, event);
        } catch (Exception e) {
            ReactionExecutionFailedException failure = e instanceof ReactionExecutionFailedException rf
                    ? rf
                    : new ReactionExecutionFailedException(area.getReactionName(),
                            "Reaction " + area.getReactionName() + " failed: " + e.getMessage(), e);
            log.error("Reaction failed: areaId={}, userId={}, reaction={}, signal={}",
                    area.getId(), area.getOwnerUserId(), area.getReactionName(), signal.signalId(), failure);
            countReaction(area, "failed");
            recordHistory(area, AreaEventType.REACTION_FAILED, signal.signalId(),
                    Map.of("payload", signal.payload()), failure.getMessage());
            return TickOutcome.REACTION_FAILED;
        }

        countReaction(area, "success");
        log.info("Reaction executed: areaId={}, userId={}, action={}, reaction={}, signal={}",
                area.getId(), area.getOwnerUserId(), area.getActionName(), area.getReactionName(), signal.signalId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("payload", signal.payload());
        details.put("processedConfig", processedConfig);
        recordHistory(area, AreaEventType.AREA_EXECUTED, signal.signalId(), details, null);
        return TickOutcome.TRIGGERED;
    }

    private void reportAuthFailure(Area area, AuthenticationExhaustedException e) {
        if (!authFailureReported.add(area.getId())) {
            log.debug("Authentication still failing: areaId={}, provider={}", area.getId(), e.getProviderKey());
            return;
        }
        log.warn("Authentication exhausted, polling continues: areaId={}, userId={}, provider={}, reason={}",
                area.getId(), area.getOwnerUserId(), e.getProviderKey(), e.getMessage());
        recordHistory(area, AreaEventType.AUTH_FAILED, null, Map.of("provider", e.getProviderKey()), e.getMessage());
    }

    private void recordHistory(Area area, AreaEventType type, String signalId,
                               Map<String, Object> details, String errorMessage) {
        try {
            eventLogRepository.save(AreaEventLog.builder()
                    .areaId(area.getId())
                    .userId(area.getOwnerUserId())
                    .eventType(type)
                    .signalId(signalId)
                    .details(details)
                    .errorMessage(errorMessage)
                    .occurredAt(OffsetDateTime.now(clock))
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record {} for areaId={}: {}", type, area.getId(), e.getMessage());
        }
    }

    private void countDetection(Area area, String signal) {
        Counter.builder("area.engine.detections")
                .tag("action", area.getActionName())
                .tag("signal", signal)
                .register(meterRegistry)
                .increment();
    }

    private void countReaction(Area area, String status) {
        Counter.builder("area.engine.reactions")
                .tag("reaction", area.getReactionName())
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }
}
