package com.gt.resee.model;

import java.time.Instant;
import java.time.LocalDate;

// intervalIndex is the raw position along the tier's interval table. It may sit above the current tier's
// maximum after a downgrade; IntervalPolicy.effectiveIndex gives the position actually used for scheduling.
public record ReviewSchedule(String id,
                             String learnerId,
                             String contentId,
                             int intervalIndex,
                             LocalDate nextReviewDate,
                             boolean active,
                             boolean initialReviewCompleted,
                             Instant createdAt,
                             Instant updatedAt) { }
