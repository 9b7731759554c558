package com.gt.resee.events;

import com.gt.resee.model.SubscriptionTier;

public record LearnerTierChangedEvent(String learnerId, SubscriptionTier oldTier, SubscriptionTier newTier) { }
