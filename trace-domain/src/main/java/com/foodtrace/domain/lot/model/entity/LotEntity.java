package com.foodtrace.domain.lot.model.entity;

import com.foodtrace.domain.lot.service.LotTransitionPolicy;
import com.foodtrace.types.common.Constants;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import com.foodtrace.types.exception.IllegalTransitionException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Lot: one traceable unit of material.
 * <p>
 * Status has no setter. New lots start CREATED through {@link #create} and stored lots come back
 * through {@link #restore}; afterwards {@link #transitionTo(LotStatusEnum)} is the only way to
 * change it.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class LotEntity {

    private static final String ENTITY = "Lot";

    private Long id;
    private String lotCode;
    private LotTypeEnum lotType;

    @Setter(AccessLevel.NONE)
    private LotStatusEnum status;

    private Integer stepIndex;
    private BigDecimal weightKg;
    private BigDecimal temperatureC;
    private Long productionRunId;
    private String operatorId;
    private Map<String, Object> metadata;

    /**
     * Optimistic lock version.
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static LotEntity create(String lotCode, LotTypeEnum lotType, BigDecimal weightKg, BigDecimal temperatureC,
                                   Long productionRunId, Integer stepIndex, String operatorId,
                                   Map<String, Object> metadata) {
        if (StringUtils.isBlank(lotCode)) {
            throw new IllegalArgumentException("Lot code cannot be blank");
        }
        if (lotType == null) {
            throw new IllegalArgumentException("Lot type cannot be null");
        }
        checkRange("weightKg", weightKg, Constants.LOT_WEIGHT_MIN_KG, Constants.LOT_WEIGHT_MAX_KG);
        checkRange("temperatureC", temperatureC, Constants.LOT_TEMPERATURE_MIN_C, Constants.LOT_TEMPERATURE_MAX_C);
        if (stepIndex != null && stepIndex < 0) {
            throw new IllegalArgumentException("Step index cannot be negative: " + stepIndex);
        }
        LocalDateTime now = LocalDateTime.now();
        LotEntity lot = restore(LotStatusEnum.CREATED, 0);
        lot.setLotCode(lotCode.trim());
        lot.setLotType(lotType);
        lot.setStepIndex(stepIndex == null ? 0 : stepIndex);
        lot.setWeightKg(weightKg);
        lot.setTemperatureC(temperatureC);
        lot.setProductionRunId(productionRunId);
        lot.setOperatorId(operatorId);
        lot.setMetadata(metadata);
        lot.setCreatedAt(now);
        lot.setUpdatedAt(now);
        return lot;
    }

    /**
     * Rebuilds a lot already stored with the given status and version. The remaining fields are set
     * by the caller.
     */
    public static LotEntity restore(LotStatusEnum status, Integer version) {
        if (status == null) {
            throw new IllegalArgumentException("Stored lot status cannot be null");
        }
        LotEntity lot = new LotEntity();
        lot.status = status;
        lot.version = version;
        return lot;
    }

    public void validate() {
        if (lotCode == null || lotCode.trim().isEmpty()) {
            throw new IllegalStateException("Lot code cannot be empty");
        }
        if (lotType == null) {
            throw new IllegalStateException("Lot type cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * Applies a status change allowed by {@link LotTransitionPolicy}.
     *
     * @throws IllegalTransitionException when the move is not in the transition table
     */
    public void transitionTo(LotStatusEnum target) {
        if (!LotTransitionPolicy.isAllowed(status, target)) {
            throw new IllegalTransitionException(ENTITY, status, target);
        }
        this.status = target;
        this.updatedAt = LocalDateTime.now();
    }

    public void incrementVersion() {
        this.version = version == null ? 1 : version + 1;
    }

    private static void checkRange(String field, BigDecimal value, double min, double max) {
        if (value == null) {
            return;
        }
        if (value.compareTo(BigDecimal.valueOf(min)) < 0 || value.compareTo(BigDecimal.valueOf(max)) > 0) {
            throw new IllegalArgumentException(field + " must be within [" + min + ", " + max + "]: " + value);
        }
    }
}
