package com.gt.resee.history;

import com.gt.resee.exception.ReviewHistoryNotFoundException;
import com.gt.resee.history.model.ReviewSuccessSummary;
import com.gt.resee.model.ReviewHistory;
import com.gt.resee.model.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

// Append-only log of completed reviews. Records are never deleted; the AI evaluation fields may be filled in once.
@Component
public class ReviewHistoryLedger {

    private static final Logger log = LoggerFactory.getLogger(ReviewHistoryLedger.class);

    private static final double MAX_AI_SCORE = 100;

    private final ReviewHistoryDao reviewHistoryDao;
    private final Clock clock;
    private final int maxTimeSpentSec;
    private final int maxNotesLength;

    @Autowired
    public ReviewHistoryLedger(ReviewHistoryDao reviewHistoryDao,
                               Clock clock,
                               @Value("${resee.history.maxTimeSpentSec:86400}") int maxTimeSpentSec,
                               @Value("${resee.history.maxNotesLength:1000}") int maxNotesLength) {
        this.reviewHistoryDao = reviewHistoryDao;
        this.clock = clock;

        this.maxTimeSpentSec = maxTimeSpentSec;
        this.maxNotesLength = maxNotesLength;
    }

    public String record(String learnerId, String contentId, ReviewResult result, Integer timeSpentSeconds,
                         String notes, Double aiScore, String aiFeedback) {
        validateReview(result, timeSpentSeconds, notes, aiScore);

        String historyId = UUID.randomUUID().toString();
        reviewHistoryDao.createReviewHistory(new ReviewHistory(
                historyId,
                learnerId,
                contentId,
                result,
                timeSpentSeconds,
                notes == null ? "" : notes,
                aiScore,
                aiFeedback,
                Instant.now(clock)));

        log.info("Recorded {} review {} for learner {} content {}", result.getLabel(), historyId, learnerId, contentId);

        return historyId;
    }

    public void enrich(String historyId, Double aiScore, String aiFeedback) {
        if (aiScore == null && aiFeedback == null) {
            throw new IllegalArgumentException("AI score or AI feedback is required to enrich review " + historyId);
        }
        validateAiScore(aiScore);

        if (reviewHistoryDao.enrichReviewHistory(historyId, aiScore, aiFeedback) > 0) {
            log.info("Added AI evaluation to review {}", historyId);
            return;
        }

        if (reviewHistoryDao.loadReviewHistory(historyId).isEmpty()) {
            String errMsg = "Review history " + historyId + " does not exist";

            log.error(errMsg);
            throw new ReviewHistoryNotFoundException(errMsg);
        }

        String errMsg = "Review history " + historyId + " already has an AI evaluation";
        log.error(errMsg);
        throw new IllegalStateException(errMsg);
    }

    public List<ReviewHistory> historyForLearner(String learnerId, Instant since) {
        return reviewHistoryDao.loadHistoryForLearner(learnerId, since);
    }

    public List<ReviewHistory> historyForContent(String learnerId, String contentId) {
        return reviewHistoryDao.loadHistoryForContent(learnerId, contentId);
    }

    public ReviewSuccessSummary successSummary(String learnerId, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Summary window must be at least one day");
        }

        Instant since = Instant.now(clock).minus(Duration.ofDays(days));
        Map<ReviewResult, Integer> resultCounts = new EnumMap<>(ReviewResult.class);
        for (ReviewResult result : ReviewResult.values()) {
            resultCounts.put(result, 0);
        }
        resultCounts.putAll(reviewHistoryDao.countResultsForLearner(learnerId, since));

        int totalReviews = resultCounts.values().stream().mapToInt(Integer::intValue).sum();
        double successRate = totalReviews == 0
                ? 0
                : Math.round(resultCounts.get(ReviewResult.Remembered) * 1000.0 / totalReviews) / 10.0;

        return new ReviewSuccessSummary(successRate, totalReviews, Collections.unmodifiableMap(resultCounts));
    }

    public void validateReview(ReviewResult result, Integer timeSpentSeconds, String notes, Double aiScore) {
        if (result == null) {
            throw new IllegalArgumentException("Review result is required");
        }
        if (timeSpentSeconds != null && (timeSpentSeconds < 0 || timeSpentSeconds > maxTimeSpentSec)) {
            throw new IllegalArgumentException("Time spent must be between 0 and " + maxTimeSpentSec + " seconds, was " + timeSpentSeconds);
        }
        if (notes != null && notes.length() > maxNotesLength) {
            throw new IllegalArgumentException("Review notes cannot exceed " + maxNotesLength + " characters");
        }
        validateAiScore(aiScore);
    }

    private static void validateAiScore(Double aiScore) {
        if (aiScore != null && (aiScore.isNaN() || aiScore < 0 || aiScore > MAX_AI_SCORE)) {
            throw new IllegalArgumentException("AI score must be between 0 and " + MAX_AI_SCORE + ", was " + aiScore);
        }
    }
}
