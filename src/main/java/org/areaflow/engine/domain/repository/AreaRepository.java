package org.areaflow.engine.domain.repository;

import org.areaflow.engine.domain.model.Area;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AreaRepository extends JpaRepository<Area, UUID> {

    List<Area> findByOwnerUserIdAndActiveTrueOrderByCreatedAtDesc(String ownerUserId);

    List<Area> findByActiveTrue();

    long countByActiveTrue();
}
