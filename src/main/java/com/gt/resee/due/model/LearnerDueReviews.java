package com.gt.resee.due.model;

import com.gt.resee.model.ReviewSchedule;

import java.time.LocalDate;
import java.util.List;

public record LearnerDueReviews(String learnerId,
                                LocalDate dueDate,
                                List<ReviewSchedule> schedules) { }
