package com.formatengine.printing;

import java.util.Arrays;
import java.util.BitSet;

import com.formatengine.ir.WriterInfo;

/**
 * Resolved condition values and frozen info positions for one pass, indexed by graph id.
 */
final class ResolutionCache {
    private Boolean[] conditionValues = new Boolean[64];
    private final BitSet evaluatedConditions = new BitSet();
    private WriterInfo[] infos = new WriterInfo[64];

    boolean isConditionEvaluated(int id) {
        return evaluatedConditions.get(id);
    }

    /**
     * The cached value, {@code null} when not evaluated or evaluated as unresolved.
     */
    Boolean getCondition(int id) {
        return id < conditionValues.length ? conditionValues[id] : null;
    }

    void putCondition(int id, Boolean value) {
        if (id >= conditionValues.length) {
            conditionValues = Arrays.copyOf(conditionValues, _grow(conditionValues.length, id));
        }
        conditionValues[id] = value;
        evaluatedConditions.set(id);
    }

    WriterInfo getInfo(int id) {
        return id < infos.length ? infos[id] : null;
    }

    void putInfo(int id, WriterInfo info) {
        if (id >= infos.length) {
            infos = Arrays.copyOf(infos, _grow(infos.length, id));
        }
        infos[id] = info;
    }

    int getEvaluatedConditionCount() {
        return evaluatedConditions.cardinality();
    }

    private static int _grow(int length, int id) {
        return Math.max(length * 2, id + 1);
    }
}
