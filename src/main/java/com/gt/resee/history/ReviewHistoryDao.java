package com.gt.resee.history;

import com.gt.resee.model.ReviewHistory;
import com.gt.resee.model.ReviewResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ReviewHistoryDao {

    void createReviewHistory(ReviewHistory reviewHistory);

    Optional<ReviewHistory> loadReviewHistory(String historyId);

    // Only updates a record that has no AI evaluation yet. Returns the number of rows changed.
    int enrichReviewHistory(String historyId, Double aiScore, String aiFeedback);

    List<ReviewHistory> loadHistoryForLearner(String learnerId, Instant since);

    List<ReviewHistory> loadHistoryForContent(String learnerId, String contentId);

    Map<ReviewResult, Integer> countResultsForLearner(String learnerId, Instant since);
}
