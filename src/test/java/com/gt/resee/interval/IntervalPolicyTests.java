package com.gt.resee.interval;

import com.gt.resee.model.SubscriptionTier;
import com.gt.resee.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IntervalPolicyTests {

    private IntervalPolicy intervalPolicy;

    @BeforeEach
    public void setup() {
        intervalPolicy = TestUtils.getTestIntervalPolicy();
    }

    @Test
    public void testIntervals_NonEmptyAndStrictlyIncreasing() {
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            List<Integer> intervals = intervalPolicy.intervals(tier);

            assertFalse(intervals.isEmpty(), "No intervals for " + tier);
            assertTrue(intervals.get(0) > 0);
            for (int i = 1; i < intervals.size(); i++) {
                assertTrue(intervals.get(i) > intervals.get(i - 1), "Intervals for " + tier + " not increasing at " + i);
            }
        }
    }

    @Test
    public void testIntervals() {
        assertEquals(List.of(1, 3, 7), intervalPolicy.intervals(SubscriptionTier.FREE));
        assertEquals(List.of(1, 3, 7, 14, 30, 60, 90), intervalPolicy.intervals(SubscriptionTier.BASIC));
        assertEquals(List.of(1, 3, 7, 14, 30, 60, 120, 180), intervalPolicy.intervals(SubscriptionTier.PRO));
    }

    @Test
    public void testIntervals_NullTierUsesFree() {
        assertEquals(intervalPolicy.intervals(SubscriptionTier.FREE), intervalPolicy.intervals(null));
    }

    @Test
    public void testIntervalAt() {
        assertEquals(1, intervalPolicy.intervalAt(SubscriptionTier.FREE, 0));
        assertEquals(3, intervalPolicy.intervalAt(SubscriptionTier.FREE, 1));
        assertEquals(7, intervalPolicy.intervalAt(SubscriptionTier.FREE, 2));
        assertEquals(120, intervalPolicy.intervalAt(SubscriptionTier.PRO, 6));
    }

    @Test
    public void testIntervalAt_SaturatesPastLastInterval() {
        assertEquals(7, intervalPolicy.intervalAt(SubscriptionTier.FREE, 3));
        assertEquals(7, intervalPolicy.intervalAt(SubscriptionTier.FREE, 500));
        assertEquals(90, intervalPolicy.intervalAt(SubscriptionTier.BASIC, Integer.MAX_VALUE));
        assertEquals(1, intervalPolicy.intervalAt(SubscriptionTier.BASIC, -1));
    }

    @Test
    public void testMaxIndex() {
        assertEquals(2, intervalPolicy.maxIndex(SubscriptionTier.FREE));
        assertEquals(6, intervalPolicy.maxIndex(SubscriptionTier.BASIC));
        assertEquals(7, intervalPolicy.maxIndex(SubscriptionTier.PRO));
    }

    @Test
    public void testEffectiveIndex() {
        assertEquals(2, intervalPolicy.effectiveIndex(SubscriptionTier.FREE, 5));
        assertEquals(5, intervalPolicy.effectiveIndex(SubscriptionTier.BASIC, 5));
        assertEquals(0, intervalPolicy.effectiveIndex(SubscriptionTier.PRO, 0));
    }

    @Test
    public void testConstructor_RejectsNonIncreasingIntervals() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalPolicy(Map.of(
                SubscriptionTier.FREE, new int[] {1, 3, 3},
                SubscriptionTier.BASIC, TestUtils.BASIC_INTERVALS,
                SubscriptionTier.PRO, TestUtils.PRO_INTERVALS)));
    }

    @Test
    public void testConstructor_RejectsNonPositiveIntervals() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalPolicy(Map.of(
                SubscriptionTier.FREE, new int[] {0, 3},
                SubscriptionTier.BASIC, TestUtils.BASIC_INTERVALS,
                SubscriptionTier.PRO, TestUtils.PRO_INTERVALS)));
    }

    @Test
    public void testConstructor_RejectsMissingTier() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalPolicy(Map.of(
                SubscriptionTier.FREE, TestUtils.FREE_INTERVALS,
                SubscriptionTier.PRO, TestUtils.PRO_INTERVALS)));
    }

    @Test
    public void testConstructor_RejectsEmptyTable() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalPolicy(Map.of(
                SubscriptionTier.FREE, new int[0],
                SubscriptionTier.BASIC, TestUtils.BASIC_INTERVALS,
                SubscriptionTier.PRO, TestUtils.PRO_INTERVALS)));
    }
}
