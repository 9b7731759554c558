package com.gt.resee.schedule;

import com.gt.resee.model.SubscriptionTier;

import java.time.Instant;
import java.util.Optional;

public interface LearnerTierDao {

    Optional<SubscriptionTier> loadTier(String learnerId);

    void saveTier(String learnerId, SubscriptionTier tier, Instant updatedAt);
}
