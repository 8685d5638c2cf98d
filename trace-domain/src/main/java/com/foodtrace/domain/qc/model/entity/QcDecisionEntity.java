package com.foodtrace.domain.qc.model.entity;

import com.foodtrace.types.enums.QcDecisionEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Recorded QC outcome for a lot. Append-only.
 */
@Data
public class QcDecisionEntity {

    private Long id;
    private Long lotId;

    /**
     * Null for ad-hoc inspections outside a registered gate.
     */
    private Long qcGateId;

    private String operatorId;
    private QcDecisionEnum decision;
    private String notes;
    private BigDecimal temperatureC;
    private String signature;
    private LocalDateTime decidedAt;
}
