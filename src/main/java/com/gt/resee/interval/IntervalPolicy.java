package com.gt.resee.interval;

import com.gt.resee.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tier to interval table lookup. Each tier owns an ordered, strictly increasing list of day offsets; a schedule's
 * interval index points into that list.
 * <p>
 * Lookups saturate: an index past the end of a tier's table resolves to the table's last (longest) interval.
 */
@Component
public class IntervalPolicy {

    private static final Logger log = LoggerFactory.getLogger(IntervalPolicy.class);

    private final Map<SubscriptionTier, List<Integer>> intervalsByTier;

    @Autowired
    public IntervalPolicy(@Value("${resee.intervals.free:1,3,7}") int[] freeIntervals,
                          @Value("${resee.intervals.basic:1,3,7,14,30,60,90}") int[] basicIntervals,
                          @Value("${resee.intervals.pro:1,3,7,14,30,60,120,180}") int[] proIntervals) {
        this(Map.of(SubscriptionTier.FREE, freeIntervals,
                    SubscriptionTier.BASIC, basicIntervals,
                    SubscriptionTier.PRO, proIntervals));
    }

    public IntervalPolicy(Map<SubscriptionTier, int[]> intervalTables) {
        Map<SubscriptionTier, List<Integer>> tables = new EnumMap<>(SubscriptionTier.class);

        for (SubscriptionTier tier : SubscriptionTier.values()) {
            int[] intervals = intervalTables.get(tier);
            validateIntervals(tier, intervals);

            tables.put(tier, Arrays.stream(intervals).boxed().toList());
            log.info("Review intervals for {}: {}", tier, tables.get(tier));
        }

        this.intervalsByTier = tables;
    }

    public List<Integer> intervals(SubscriptionTier tier) {
        return intervalsByTier.get(tierOrFree(tier));
    }

    public int intervalAt(SubscriptionTier tier, int index) {
        List<Integer> intervals = intervals(tier);

        return intervals.get(Math.max(0, Math.min(index, intervals.size() - 1)));
    }

    public int maxIndex(SubscriptionTier tier) {
        return intervals(tier).size() - 1;
    }

    // The index used for scheduling when a stored index may exceed what the tier allows
    public int effectiveIndex(SubscriptionTier tier, int rawIndex) {
        return Math.max(0, Math.min(rawIndex, maxIndex(tier)));
    }

    private static SubscriptionTier tierOrFree(SubscriptionTier tier) {
        return tier == null ? SubscriptionTier.FREE : tier;
    }

    private static void validateIntervals(SubscriptionTier tier, int[] intervals) {
        if (intervals == null || intervals.length == 0) {
            throw new IllegalArgumentException("No review intervals configured for tier " + tier);
        }

        int previous = 0;
        for (int interval : intervals) {
            if (interval <= previous) {
                throw new IllegalArgumentException("Review intervals for tier " + tier + " must be positive and strictly increasing: " + Arrays.toString(intervals));
            }
            previous = interval;
        }
    }
}
