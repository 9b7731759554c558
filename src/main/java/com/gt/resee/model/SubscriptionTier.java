package com.gt.resee.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.gt.resee.serialization.SubscriptionTierDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@JsonDeserialize(using = SubscriptionTierDeserializer.class)
public enum SubscriptionTier {
    FREE,
    BASIC,
    PRO;

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTier.class);

    // Billing may send labels this engine has no interval table for. Those learners are scheduled as FREE.
    public static SubscriptionTier fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return FREE;
        }

        for (SubscriptionTier tier : values()) {
            if (tier.name().equalsIgnoreCase(label.trim())) {
                return tier;
            }
        }

        log.warn("Unknown subscription tier {}, scheduling as {}", label, FREE);
        return FREE;
    }
}
