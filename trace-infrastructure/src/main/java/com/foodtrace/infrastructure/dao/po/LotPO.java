package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * lots row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotPO {

    private Long id;
    private String lotCode;
    private LotTypeEnum lotType;
    private LotStatusEnum status;
    private Integer stepIndex;
    private BigDecimal weightKg;
    private BigDecimal temperatureC;
    private Long productionRunId;
    private String operatorId;
    private String metadata;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
