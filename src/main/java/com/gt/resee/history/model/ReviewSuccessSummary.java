package com.gt.resee.history.model;

import com.gt.resee.model.ReviewResult;

import java.util.Map;

public record ReviewSuccessSummary(double successRate,
                                   int totalReviews,
                                   Map<ReviewResult, Integer> resultCounts) { }
