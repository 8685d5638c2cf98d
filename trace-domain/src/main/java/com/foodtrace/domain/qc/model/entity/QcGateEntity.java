package com.foodtrace.domain.qc.model.entity;

import com.foodtrace.types.enums.QcGateTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Registered QC checkpoint.
 */
@Data
public class QcGateEntity {

    private Long id;
    private Integer gateNumber;
    private String name;
    private QcGateTypeEnum gateType;

    /**
     * Critical control point.
     */
    private Boolean ccp;

    private List<String> checklist;
    private LocalDateTime createdAt;

    /**
     * BLOCKING gates and CCPs stop run progression on a non-PASS decision.
     */
    public boolean isBlocking() {
        return gateType == QcGateTypeEnum.BLOCKING || Boolean.TRUE.equals(ccp);
    }

    public void validate() {
        if (gateNumber == null || gateNumber < 1) {
            throw new IllegalStateException("Gate number must be greater than 0");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Gate name cannot be empty");
        }
        if (gateType == null) {
            throw new IllegalStateException("Gate type cannot be null");
        }
    }
}
