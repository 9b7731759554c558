package com.gt.resee.schedule;

import com.gt.resee.model.ReviewSchedule;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ScheduleDao {

    // Returns false, leaving the stored schedule untouched, if the (learner, content) pair already has one
    boolean createSchedule(ReviewSchedule schedule);

    Optional<ReviewSchedule> loadSchedule(String learnerId, String contentId);

    // Row locked until the surrounding transaction ends
    Optional<ReviewSchedule> loadScheduleForUpdate(String learnerId, String contentId);

    List<ReviewSchedule> loadActiveSchedulesForLearnerForUpdate(String learnerId);

    int updateSchedule(ReviewSchedule schedule);

    int updateSchedulesBatch(List<ReviewSchedule> schedules);

    int deactivateSchedule(String learnerId, String contentId, Instant updatedAt);

    List<ReviewSchedule> loadDueSchedules(String learnerId, LocalDate asOf);

    int countDueSchedules(String learnerId, LocalDate asOf);

    int countOverdueSchedules(String learnerId, LocalDate asOf);

    List<ReviewSchedule> loadSchedulesDueOn(LocalDate date);
}
