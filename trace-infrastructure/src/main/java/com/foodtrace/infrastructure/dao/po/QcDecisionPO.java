package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.QcDecisionEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * qc_decisions row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QcDecisionPO {

    private Long id;
    private Long lotId;
    private Long qcGateId;
    private String operatorId;
    private QcDecisionEnum decision;
    private String notes;
    private BigDecimal temperatureC;
    private String signature;
    private LocalDateTime decidedAt;
}
