package com.gt.resee.model;

public record CompletedReview(ReviewSchedule schedule,
                              String historyId,
                              boolean scheduleUpdated) { }
