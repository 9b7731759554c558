package com.gt.resee.util;

import com.gt.resee.model.SubscriptionTier;
import com.gt.resee.schedule.LearnerTierDao;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLearnerTierDao implements LearnerTierDao {

    private final Map<String, SubscriptionTier> tiers = new ConcurrentHashMap<>();

    @Override
    public Optional<SubscriptionTier> loadTier(String learnerId) {
        return Optional.ofNullable(tiers.get(learnerId));
    }

    @Override
    public void saveTier(String learnerId, SubscriptionTier tier, Instant updatedAt) {
        tiers.put(learnerId, tier);
    }
}
