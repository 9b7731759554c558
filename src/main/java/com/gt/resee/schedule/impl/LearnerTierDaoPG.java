package com.gt.resee.schedule.impl;

import com.gt.resee.model.SubscriptionTier;
import com.gt.resee.schedule.LearnerTierDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public class LearnerTierDaoPG implements LearnerTierDao {

    private static final String LOAD_TIER_SQL =
            "SELECT tier FROM learner_tier WHERE learner_id = :learnerId";

    private static final String SAVE_TIER_SQL =
            "INSERT INTO learner_tier (learner_id, tier, updated_at) " +
            "VALUES (:learnerId, :tier, :updatedAt) " +
            "ON CONFLICT (learner_id) DO UPDATE " +
            "SET tier = :tier, updated_at = :updatedAt";

    private final NamedParameterJdbcTemplate template;

    public LearnerTierDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Optional<SubscriptionTier> loadTier(String learnerId) {
        return template.query(LOAD_TIER_SQL, Map.of("learnerId", learnerId),
                        (rs, rowNum) -> SubscriptionTier.fromLabel(rs.getString("tier")))
                .stream()
                .findFirst();
    }

    @Override
    public void saveTier(String learnerId, SubscriptionTier tier, Instant updatedAt) {
        template.update(SAVE_TIER_SQL, Map.of(
                "learnerId", learnerId,
                "tier", tier.name(),
                "updatedAt", Timestamp.from(updatedAt)));
    }
}
