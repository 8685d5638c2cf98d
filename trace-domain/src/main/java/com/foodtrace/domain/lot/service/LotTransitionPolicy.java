package com.foodtrace.domain.lot.service;

import com.foodtrace.types.enums.LotStatusEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal lot status transitions.
 * <pre>
 * CREATED    -> QUARANTINE, HOLD
 * QUARANTINE -> RELEASED, REJECTED, HOLD
 * RELEASED   -> CONSUMED, HOLD, REJECTED
 * HOLD       -> RELEASED, REJECTED
 * CONSUMED   -> FINISHED
 * REJECTED, FINISHED are terminal
 * </pre>
 */
public final class LotTransitionPolicy {

    private static final Map<LotStatusEnum, Set<LotStatusEnum>> TRANSITIONS = new EnumMap<>(LotStatusEnum.class);

    static {
        TRANSITIONS.put(LotStatusEnum.CREATED, EnumSet.of(LotStatusEnum.QUARANTINE, LotStatusEnum.HOLD));
        TRANSITIONS.put(LotStatusEnum.QUARANTINE,
                EnumSet.of(LotStatusEnum.RELEASED, LotStatusEnum.REJECTED, LotStatusEnum.HOLD));
        TRANSITIONS.put(LotStatusEnum.RELEASED,
                EnumSet.of(LotStatusEnum.CONSUMED, LotStatusEnum.HOLD, LotStatusEnum.REJECTED));
        TRANSITIONS.put(LotStatusEnum.HOLD, EnumSet.of(LotStatusEnum.RELEASED, LotStatusEnum.REJECTED));
        TRANSITIONS.put(LotStatusEnum.CONSUMED, EnumSet.of(LotStatusEnum.FINISHED));
        TRANSITIONS.put(LotStatusEnum.REJECTED, EnumSet.noneOf(LotStatusEnum.class));
        TRANSITIONS.put(LotStatusEnum.FINISHED, EnumSet.noneOf(LotStatusEnum.class));
    }

    private LotTransitionPolicy() {
    }

    public static boolean isAllowed(LotStatusEnum from, LotStatusEnum to) {
        if (from == null || to == null) {
            return false;
        }
        return TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public static Set<LotStatusEnum> allowedTargets(LotStatusEnum from) {
        if (from == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, EnumSet.noneOf(LotStatusEnum.class)));
    }

    public static boolean isTerminal(LotStatusEnum status) {
        return allowedTargets(status).isEmpty();
    }
}
