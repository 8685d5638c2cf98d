package com.foodtrace.domain.lot.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Parent to child lot link recording material consumption. Append-only.
 */
@Data
public class GenealogyEdgeEntity {

    private Long id;
    private Long parentLotId;
    private Long childLotId;
    private BigDecimal quantityUsedKg;
    private String eventRef;
    private LocalDateTime linkedAt;

    public static GenealogyEdgeEntity link(Long parentLotId, Long childLotId, BigDecimal quantityUsedKg, String eventRef) {
        GenealogyEdgeEntity edge = new GenealogyEdgeEntity();
        edge.setParentLotId(parentLotId);
        edge.setChildLotId(childLotId);
        edge.setQuantityUsedKg(quantityUsedKg);
        edge.setEventRef(eventRef);
        edge.setLinkedAt(LocalDateTime.now());
        return edge;
    }
}
