package com.foodtrace.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * lot_genealogy row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenealogyEdgePO {

    private Long id;
    private Long parentLotId;
    private Long childLotId;
    private BigDecimal quantityUsedKg;
    private String eventRef;
    private LocalDateTime linkedAt;
}
