package com.gt.resee.model;

import java.time.Instant;

public record ReviewHistory(String id,
                            String learnerId,
                            String contentId,
                            ReviewResult result,
                            Integer timeSpentSeconds,
                            String notes,
                            Double aiScore,
                            String aiFeedback,
                            Instant reviewedAt) {

    public boolean isEnriched() {
        return aiScore != null || aiFeedback != null;
    }
}
