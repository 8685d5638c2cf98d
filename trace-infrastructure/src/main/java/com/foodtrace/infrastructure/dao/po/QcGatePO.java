package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.QcGateTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * qc_gates row. {@code checklist} is a jsonb array.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QcGatePO {

    private Long id;
    private Integer gateNumber;
    private String name;
    private QcGateTypeEnum gateType;
    private Boolean ccp;
    private String checklist;
    private LocalDateTime createdAt;
}
