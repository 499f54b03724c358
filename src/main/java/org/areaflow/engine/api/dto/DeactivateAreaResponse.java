package org.areaflow.engine.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * {@code changed} is false when the area was already inactive, missing or not the caller's.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeactivateAreaResponse {

    private UUID areaId;
    private boolean changed;
}
