package com.foodtrace.domain.lot.model.valobj;

import com.foodtrace.domain.lot.model.entity.LotEntity;

import java.util.List;

/**
 * One-level recall summary of a lot: its direct parents and children.
 */
public record ImmediateLineage(LotEntity central, List<LotEntity> parents, List<LotEntity> children) {

    public ImmediateLineage {
        parents = parents == null ? List.of() : List.copyOf(parents);
        children = children == null ? List.of() : List.copyOf(children);
    }
}
