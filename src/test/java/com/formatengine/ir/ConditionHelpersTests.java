package com.formatengine.ir;

import org.junit.jupiter.api.Test;

import java.util.IdentityHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionHelpersTests {

    private static final class FakeContext implements ResolveConditionContext {
        private final Map<Info, WriterInfo> infos = new IdentityHashMap<>();
        private WriterInfo current = new WriterInfo(0, 0, 0, 0, 4, false);

        @Override
        public Boolean getResolvedCondition(Condition condition) {
            return null;
        }

        @Override
        public WriterInfo getResolvedInfo(Info info) {
            return infos.get(info);
        }

        @Override
        public WriterInfo getWriterInfo() {
            return current;
        }

        @Override
        public boolean isForcingNoNewLines() {
            return false;
        }
    }

    private final Info start = new Info("start");
    private final Info end = new Info("end");

    @Test
    void unresolvedInfosGiveNull() {
        FakeContext context = new FakeContext();

        assertNull(ConditionHelpers.isMultipleLines(context, start, end));
        assertNull(ConditionHelpers.isHanging(context, start, null));
        assertNull(ConditionHelpers.areInfosNotEqual(context, start, end));
        assertNull(ConditionHelpers.isOnSameLine(context, start));
        assertFalse(context.getResolvedCondition(Condition.builder("c").resolver(c -> true).build(), false));
    }

    @Test
    void comparesResolvedInfos() {
        FakeContext context = new FakeContext();
        context.infos.put(start, new WriterInfo(0, 4, 0, 0, 4, false));
        context.infos.put(end, new WriterInfo(2, 4, 1, 1, 4, false));

        assertTrue(ConditionHelpers.isMultipleLines(context, start, end));
        assertTrue(ConditionHelpers.isHanging(context, start, end));
        assertTrue(ConditionHelpers.areInfosNotEqual(context, start, end));
        assertFalse(ConditionHelpers.areInfosEqual(context, start, end));
    }

    @Test
    void comparesWithCurrentPosition() {
        FakeContext context = new FakeContext();
        context.infos.put(start, new WriterInfo(3, 7, 0, 0, 4, false));
        context.current = new WriterInfo(3, 7, 0, 0, 4, false);

        assertTrue(ConditionHelpers.isAtSamePosition(context, start));
        assertTrue(ConditionHelpers.isOnSameLine(context, start));
        assertFalse(ConditionHelpers.isOnDifferentLine(context, start));
        assertFalse(ConditionHelpers.isHanging(context, start, null));
    }
}
