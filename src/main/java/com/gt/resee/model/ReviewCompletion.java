package com.gt.resee.model;

// observedIntervalIndex is the interval index the learner was shown when the review was presented. When set,
// the schedule only moves if it still holds that index; otherwise the review is logged without advancing again.
public record ReviewCompletion(String learnerId,
                               String contentId,
                               ReviewResult result,
                               Integer timeSpentSeconds,
                               String notes,
                               Double aiScore,
                               String aiFeedback,
                               Integer observedIntervalIndex) {

    public static ReviewCompletion of(String learnerId, String contentId, ReviewResult result) {
        return new ReviewCompletion(learnerId, contentId, result, null, null, null, null, null);
    }
}
