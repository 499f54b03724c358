package org.areaflow.engine.scheduler;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One fixed-delay task per active area on a shared pool. Fixed delay means the next tick is
 * scheduled only after the previous one returned, so ticks of the same area never overlap;
 * an overrunning tick delays the next one instead of doubling it up.
 */
@Component
@Slf4j
public class PollingScheduler {

    private final TaskScheduler taskScheduler;
    private final AreaTickHandler tickHandler;
    private final Clock clock;
    private final Duration interval;
    private final boolean enabled;
    private final ConcurrentHashMap<UUID, ScheduledFuture<?>> running = new ConcurrentHashMap<>();

    public PollingScheduler(TaskScheduler taskScheduler,
                            AreaTickHandler tickHandler,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            @Value("${area.engine.polling.interval:10s}") Duration interval,
                            @Value("${area.engine.polling.enabled:true}") boolean enabled) {
        this.taskScheduler = taskScheduler;
        this.tickHandler = tickHandler;
        this.clock = clock;
        this.interval = interval;
        this.enabled = enabled;
        Gauge.builder("area.engine.areas.polling", running, ConcurrentHashMap::size)
                .description("Areas with a running poll task")
                .register(meterRegistry);
    }

    /**
     * Start polling an area. No-op if it is already running or polling is disabled.
     *
     * @return true if this call scheduled a new task
     */
    public boolean start(UUID areaId) {
        if (!enabled) {
            log.debug("Polling disabled, not starting areaId={}", areaId);
            return false;
        }
        boolean[] created = {false};
        running.computeIfAbsent(areaId, id -> {
            created[0] = true;
            return taskScheduler.scheduleWithFixedDelay(() -> tick(id), clock.instant().plus(interval), interval);
        });
        if (created[0]) {
            log.info("Polling started: areaId={}, interval={}", areaId, interval);
        }
        return created[0];
    }

    /**
     * Cancel the pending tick of an area. A tick already in progress is allowed to finish.
     *
     * @return true if a running task was cancelled
     */
    public boolean stop(UUID areaId) {
        ScheduledFuture<?> future = running.remove(areaId);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.info("Polling stopped: areaId={}", areaId);
        return true;
    }

    public boolean isRunning(UUID areaId) {
        return running.containsKey(areaId);
    }

    public Set<UUID> runningAreas() {
        return Set.copyOf(running.keySet());
    }

    public boolean isEnabled() {
        return enabled;
    }

    @PreDestroy
    public void stopAll() {
        running.keySet().forEach(this::stop);
    }

    void tick(UUID areaId) {
        try {
            tickHandler.onTick(areaId);
        } catch (Exception e) {
            // an escaping exception would cancel the recurring task
            log.error("Unhandled error in poll tick: areaId={}", areaId, e);
        }
    }
}
