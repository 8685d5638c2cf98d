package com.foodtrace.test.domain;

import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.service.LotTransitionPolicy;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import com.foodtrace.types.exception.IllegalTransitionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.foodtrace.types.enums.LotStatusEnum.CONSUMED;
import static com.foodtrace.types.enums.LotStatusEnum.CREATED;
import static com.foodtrace.types.enums.LotStatusEnum.FINISHED;
import static com.foodtrace.types.enums.LotStatusEnum.HOLD;
import static com.foodtrace.types.enums.LotStatusEnum.QUARANTINE;
import static com.foodtrace.types.enums.LotStatusEnum.REJECTED;
import static com.foodtrace.types.enums.LotStatusEnum.RELEASED;

public class LotTransitionPolicyTest {

    private static final Map<LotStatusEnum, Set<LotStatusEnum>> EXPECTED = new EnumMap<>(LotStatusEnum.class);

    static {
        EXPECTED.put(CREATED, EnumSet.of(QUARANTINE, HOLD));
        EXPECTED.put(QUARANTINE, EnumSet.of(RELEASED, REJECTED, HOLD));
        EXPECTED.put(RELEASED, EnumSet.of(CONSUMED, HOLD, REJECTED));
        EXPECTED.put(HOLD, EnumSet.of(RELEASED, REJECTED));
        EXPECTED.put(CONSUMED, EnumSet.of(FINISHED));
        EXPECTED.put(REJECTED, EnumSet.noneOf(LotStatusEnum.class));
        EXPECTED.put(FINISHED, EnumSet.noneOf(LotStatusEnum.class));
    }

    @Test
    public void shouldMatchTransitionTableForEveryPair() {
        for (LotStatusEnum from : LotStatusEnum.values()) {
            for (LotStatusEnum to : LotStatusEnum.values()) {
                Assertions.assertEquals(EXPECTED.get(from).contains(to), LotTransitionPolicy.isAllowed(from, to),
                        from + " -> " + to);
            }
        }
    }

    @Test
    public void shouldEnforceTableThroughEntityForEveryPair() {
        for (LotStatusEnum from : LotStatusEnum.values()) {
            for (LotStatusEnum to : LotStatusEnum.values()) {
                LotEntity lot = lotIn(from);
                if (EXPECTED.get(from).contains(to)) {
                    lot.transitionTo(to);
                    Assertions.assertEquals(to, lot.getStatus(), from + " -> " + to);
                } else {
                    IllegalTransitionException ex = Assertions.assertThrows(IllegalTransitionException.class,
                            () -> lot.transitionTo(to), from + " -> " + to);
                    Assertions.assertEquals(from.name(), ex.getFrom());
                    Assertions.assertEquals(to.name(), ex.getTo());
                    Assertions.assertEquals(from, lot.getStatus());
                }
            }
        }
    }

    @Test
    public void shouldOnlyChangeStatusThroughFactoriesAndTransitions() {
        Assertions.assertEquals(0, LotEntity.class.getConstructors().length);
        for (Method method : LotEntity.class.getMethods()) {
            Assertions.assertNotEquals("setStatus", method.getName());
            Assertions.assertNotEquals("builder", method.getName());
        }
        Assertions.assertThrows(IllegalArgumentException.class, () -> LotEntity.restore(null, 3));

        LotEntity stored = LotEntity.restore(HOLD, 3);
        Assertions.assertEquals(HOLD, stored.getStatus());
        Assertions.assertEquals(3, stored.getVersion());
    }

    @Test
    public void shouldTreatRejectedAndFinishedAsTerminal() {
        Assertions.assertTrue(LotTransitionPolicy.isTerminal(REJECTED));
        Assertions.assertTrue(LotTransitionPolicy.isTerminal(FINISHED));
        Assertions.assertFalse(LotTransitionPolicy.isTerminal(CONSUMED));
    }

    @Test
    public void shouldRejectOutOfRangeWeightAndTemperature() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> LotEntity.create("RAW-9", LotTypeEnum.RAW,
                new BigDecimal("10000.5"), null, null, null, "op", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> LotEntity.create("RAW-9", LotTypeEnum.RAW,
                BigDecimal.TEN, new BigDecimal("-51"), null, null, "op", null));
        Assertions.assertEquals(CREATED, LotEntity.create("RAW-9", LotTypeEnum.RAW, new BigDecimal("10000"),
                new BigDecimal("-50"), null, null, "op", null).getStatus());
    }

    private LotEntity lotIn(LotStatusEnum status) {
        LotEntity lot = LotEntity.restore(status, 0);
        lot.setId(1L);
        lot.setLotCode("LOT-" + status);
        lot.setLotType(LotTypeEnum.MIX);
        return lot;
    }
}
