package com.gt.resee.history.impl;

import com.gt.resee.exception.DaoException;
import com.gt.resee.history.ReviewHistoryDao;
import com.gt.resee.model.ReviewHistory;
import com.gt.resee.model.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ReviewHistoryDaoPG implements ReviewHistoryDao {

    private static final Logger log = LoggerFactory.getLogger(ReviewHistoryDaoPG.class);

    private static final String HISTORY_COLUMNS =
            "id, learner_id, content_id, result, time_spent_sec, notes, ai_score, ai_feedback, reviewed_at ";

    private static final String CREATE_REVIEW_HISTORY_SQL =
            "INSERT INTO review_history " +
                    "(id, learner_id, content_id, result, time_spent_sec, notes, ai_score, ai_feedback, reviewed_at) " +
                    "VALUES (:id, :learnerId, :contentId, :result, :timeSpentSec, :notes, :aiScore, :aiFeedback, :reviewedAt)";

    private static final String LOAD_REVIEW_HISTORY_SQL =
            "SELECT " + HISTORY_COLUMNS +
            "FROM review_history " +
            "WHERE id = :id";

    private static final String ENRICH_REVIEW_HISTORY_SQL =
            "UPDATE review_history " +
            "SET ai_score = :aiScore, ai_feedback = :aiFeedback " +
            "WHERE id = :id AND ai_score IS NULL AND ai_feedback IS NULL";

    private static final String LOAD_HISTORY_FOR_LEARNER_SQL =
            "SELECT " + HISTORY_COLUMNS +
            "FROM review_history " +
            "WHERE learner_id = :learnerId AND reviewed_at >= :since " +
            "ORDER BY reviewed_at DESC";

    private static final String LOAD_HISTORY_FOR_CONTENT_SQL =
            "SELECT " + HISTORY_COLUMNS +
            "FROM review_history " +
            "WHERE learner_id = :learnerId AND content_id = :contentId " +
            "ORDER BY reviewed_at DESC";

    private static final String COUNT_RESULTS_FOR_LEARNER_SQL =
            "SELECT result, COUNT(*) AS result_cnt " +
            "FROM review_history " +
            "WHERE learner_id = :learnerId AND reviewed_at >= :since " +
            "GROUP BY result";

    private final NamedParameterJdbcTemplate template;

    public ReviewHistoryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void createReviewHistory(ReviewHistory reviewHistory) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", reviewHistory.id());
        params.addValue("learnerId", reviewHistory.learnerId());
        params.addValue("contentId", reviewHistory.contentId());
        params.addValue("result", reviewHistory.result().getLabel());
        params.addValue("timeSpentSec", reviewHistory.timeSpentSeconds());
        params.addValue("notes", reviewHistory.notes());
        params.addValue("aiScore", reviewHistory.aiScore());
        params.addValue("aiFeedback", reviewHistory.aiFeedback());
        params.addValue("reviewedAt", Timestamp.from(reviewHistory.reviewedAt()));

        template.update(CREATE_REVIEW_HISTORY_SQL, params);
    }

    @Override
    public Optional<ReviewHistory> loadReviewHistory(String historyId) {
        return template.query(LOAD_REVIEW_HISTORY_SQL, Map.of("id", historyId), ReviewHistoryDaoPG::getReviewHistoryFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public int enrichReviewHistory(String historyId, Double aiScore, String aiFeedback) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", historyId);
        params.addValue("aiScore", aiScore);
        params.addValue("aiFeedback", aiFeedback);

        return template.update(ENRICH_REVIEW_HISTORY_SQL, params);
    }

    @Override
    public List<ReviewHistory> loadHistoryForLearner(String learnerId, Instant since) {
        return template.query(LOAD_HISTORY_FOR_LEARNER_SQL, Map.of("learnerId", learnerId, "since", Timestamp.from(since)),
                ReviewHistoryDaoPG::getReviewHistoryFromResultSet);
    }

    @Override
    public List<ReviewHistory> loadHistoryForContent(String learnerId, String contentId) {
        return template.query(LOAD_HISTORY_FOR_CONTENT_SQL, Map.of("learnerId", learnerId, "contentId", contentId),
                ReviewHistoryDaoPG::getReviewHistoryFromResultSet);
    }

    @Override
    public Map<ReviewResult, Integer> countResultsForLearner(String learnerId, Instant since) {
        return template.query(COUNT_RESULTS_FOR_LEARNER_SQL, Map.of("learnerId", learnerId, "since", Timestamp.from(since)), (rs) -> {
            Map<ReviewResult, Integer> resultCounts = new EnumMap<>(ReviewResult.class);

            while (rs.next()) {
                resultCounts.put(toReviewResult(rs.getString("result")), rs.getInt("result_cnt"));
            }

            return resultCounts;
        });
    }

    private static ReviewHistory getReviewHistoryFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        int timeSpentSec = rs.getInt("time_spent_sec");
        Integer timeSpent = rs.wasNull() ? null : timeSpentSec;
        double aiScoreValue = rs.getDouble("ai_score");
        Double aiScore = rs.wasNull() ? null : aiScoreValue;

        return new ReviewHistory(
                rs.getString("id"),
                rs.getString("learner_id"),
                rs.getString("content_id"),
                toReviewResult(rs.getString("result")),
                timeSpent,
                rs.getString("notes"),
                aiScore,
                rs.getString("ai_feedback"),
                rs.getTimestamp("reviewed_at").toInstant());
    }

    private static ReviewResult toReviewResult(String label) {
        try {
            return ReviewResult.fromLabel(label);
        } catch (IllegalArgumentException ex) {
            String errMsg = "Stored review history has unreadable result " + label;

            log.error(errMsg, ex);
            throw new DaoException(errMsg, ex);
        }
    }
}
