package org.areaflow.engine.domain.repository;

import org.areaflow.engine.domain.model.AreaEventLog;
import org.areaflow.engine.domain.model.enums.AreaEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AreaEventLogRepository extends JpaRepository<AreaEventLog, UUID> {

    List<AreaEventLog> findByAreaIdOrderByOccurredAtDesc(UUID areaId);

    long countByAreaIdAndEventType(UUID areaId, AreaEventType eventType);
}
