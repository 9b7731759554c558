package com.gt.resee.schedule;

import com.gt.resee.due.DueReviewQueryService;
import com.gt.resee.exception.ScheduleNotFoundException;
import com.gt.resee.history.ReviewHistoryLedger;
import com.gt.resee.interval.IntervalPolicy;
import com.gt.resee.model.CompletedReview;
import com.gt.resee.model.ReviewCompletion;
import com.gt.resee.model.ReviewSchedule;
import com.gt.resee.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Review schedule state machine. One schedule exists per (learner, content) pair; its interval index moves along
 * the learner's tier interval table as reviews are completed.
 * <ul>
 *     <li>remembered: advance one step, saturating at the tier's last interval</li>
 *     <li>partial: keep the index and wait the current interval again</li>
 *     <li>forgot: back to index 0, due again tomorrow</li>
 * </ul>
 * The stored index is never reduced by a tier downgrade. Scheduling always uses
 * {@link IntervalPolicy#effectiveIndex}, so progress earned on a higher tier comes back on re-upgrade.
 */
@Component
public class ScheduleEngine {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEngine.class);

    static final int RESET_DELAY_DAYS = 1;

    private final IntervalPolicy intervalPolicy;
    private final ScheduleDao scheduleDao;
    private final LearnerTierDao learnerTierDao;
    private final ReviewHistoryLedger reviewHistoryLedger;
    private final DueReviewQueryService dueReviewQueryService;
    private final ScheduleLockManager scheduleLockManager;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    @Autowired
    public ScheduleEngine(IntervalPolicy intervalPolicy,
                          ScheduleDao scheduleDao,
                          LearnerTierDao learnerTierDao,
                          ReviewHistoryLedger reviewHistoryLedger,
                          DueReviewQueryService dueReviewQueryService,
                          ScheduleLockManager scheduleLockManager,
                          TransactionOperations transactionOperations,
                          Clock clock) {
        this.intervalPolicy = intervalPolicy;
        this.scheduleDao = scheduleDao;
        this.learnerTierDao = learnerTierDao;
        this.reviewHistoryLedger = reviewHistoryLedger;
        this.dueReviewQueryService = dueReviewQueryService;
        this.scheduleLockManager = scheduleLockManager;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
    }

    // Returns false when the pair already had a schedule
    public boolean createInitialSchedule(String learnerId, String contentId) {
        verifyIds(learnerId, contentId);

        if (scheduleDao.loadSchedule(learnerId, contentId).isPresent()) {
            log.debug("Schedule already exists for learner {} content {}", learnerId, contentId);
            return false;
        }

        Instant now = Instant.now(clock);
        ReviewSchedule schedule = new ReviewSchedule(
                UUID.randomUUID().toString(),
                learnerId,
                contentId,
                0,
                LocalDate.now(clock),
                true,
                false,
                now,
                now);

        if (!scheduleDao.createSchedule(schedule)) {
            log.info("Schedule for learner {} content {} was created concurrently", learnerId, contentId);
            return false;
        }

        dueReviewQueryService.invalidateLearner(learnerId);
        log.info("Created schedule {} for learner {} content {}", schedule.id(), learnerId, contentId);

        return true;
    }

    public CompletedReview completeReview(ReviewCompletion completion) {
        verifyIds(completion.learnerId(), completion.contentId());
        reviewHistoryLedger.validateReview(completion.result(), completion.timeSpentSeconds(), completion.notes(), completion.aiScore());

        CompletedReview completedReview = scheduleLockManager.withPairLock(completion.learnerId(), completion.contentId(),
                () -> transactionOperations.execute(status -> applyReview(completion)));

        dueReviewQueryService.invalidateLearner(completion.learnerId());

        return completedReview;
    }

    // Returns false when there was no active schedule to deactivate
    public boolean deactivateSchedule(String learnerId, String contentId) {
        verifyIds(learnerId, contentId);

        int deactivatedCnt = scheduleLockManager.withPairLock(learnerId, contentId,
                () -> scheduleDao.deactivateSchedule(learnerId, contentId, Instant.now(clock)));

        if (deactivatedCnt > 0) {
            dueReviewQueryService.invalidateLearner(learnerId);
            log.info("Deactivated schedule for learner {} content {}", learnerId, contentId);
        }

        return deactivatedCnt > 0;
    }

    public int reconcileOnTierChange(String learnerId, SubscriptionTier oldTier, SubscriptionTier newTier) {
        SubscriptionTier targetTier = newTier == null ? SubscriptionTier.FREE : newTier;

        Integer adjustedCnt = scheduleLockManager.withLearnerLock(learnerId,
                () -> transactionOperations.execute(status -> clampSchedulesToTier(learnerId, targetTier)));

        dueReviewQueryService.invalidateLearner(learnerId);
        log.info("Tier change {} -> {} for learner {}: {} schedules adjusted", oldTier, targetTier, learnerId, adjustedCnt);

        return adjustedCnt == null ? 0 : adjustedCnt;
    }

    public Optional<ReviewSchedule> getSchedule(String learnerId, String contentId) {
        return scheduleDao.loadSchedule(learnerId, contentId);
    }

    public SubscriptionTier getTier(String learnerId) {
        return learnerTierDao.loadTier(learnerId).orElse(SubscriptionTier.FREE);
    }

    private CompletedReview applyReview(ReviewCompletion completion) {
        ReviewSchedule schedule = scheduleDao.loadScheduleForUpdate(completion.learnerId(), completion.contentId())
                .filter(ReviewSchedule::active)
                .orElseThrow(() -> scheduleNotFound(completion));

        boolean staleSubmission = completion.observedIntervalIndex() != null
                && completion.observedIntervalIndex() != schedule.intervalIndex();

        ReviewSchedule updatedSchedule = schedule;
        if (staleSubmission) {
            log.info("Review for learner {} content {} was made against interval index {} but the schedule is at {}, logging without rescheduling",
                    completion.learnerId(), completion.contentId(), completion.observedIntervalIndex(), schedule.intervalIndex());
        } else {
            updatedSchedule = nextSchedule(schedule, completion, getTier(completion.learnerId()));
            scheduleDao.updateSchedule(updatedSchedule);
        }

        String historyId = reviewHistoryLedger.record(
                completion.learnerId(),
                completion.contentId(),
                completion.result(),
                completion.timeSpentSeconds(),
                completion.notes(),
                completion.aiScore(),
                completion.aiFeedback());

        log.info("Review {} for learner {} content {}: interval index {} -> {}, next review {}",
                completion.result().getLabel(), completion.learnerId(), completion.contentId(),
                schedule.intervalIndex(), updatedSchedule.intervalIndex(), updatedSchedule.nextReviewDate());

        return new CompletedReview(updatedSchedule, historyId, !staleSubmission);
    }

    private ReviewSchedule nextSchedule(ReviewSchedule schedule, ReviewCompletion completion, SubscriptionTier tier) {
        LocalDate today = LocalDate.now(clock);
        int intervalIndex = schedule.intervalIndex();
        boolean initialReviewCompleted = schedule.initialReviewCompleted();
        LocalDate nextReviewDate;

        switch (completion.result()) {
            case Remembered -> {
                if (intervalIndex < intervalPolicy.maxIndex(tier)) {
                    intervalIndex++;
                }
                nextReviewDate = today.plusDays(intervalPolicy.intervalAt(tier, intervalPolicy.effectiveIndex(tier, intervalIndex)));
                initialReviewCompleted = true;
            }
            case Forgot -> {
                intervalIndex = 0;
                nextReviewDate = today.plusDays(RESET_DELAY_DAYS);
            }
            case Partial -> nextReviewDate = today.plusDays(intervalPolicy.intervalAt(tier, intervalPolicy.effectiveIndex(tier, intervalIndex)));
            default -> throw new IllegalArgumentException("Unsupported review result " + completion.result());
        }

        return new ReviewSchedule(
                schedule.id(),
                schedule.learnerId(),
                schedule.contentId(),
                intervalIndex,
                nextReviewDate,
                schedule.active(),
                initialReviewCompleted,
                schedule.createdAt(),
                Instant.now(clock));
    }

    private int clampSchedulesToTier(String learnerId, SubscriptionTier tier) {
        LocalDate today = LocalDate.now(clock);
        Instant now = Instant.now(clock);
        learnerTierDao.saveTier(learnerId, tier, now);

        int maxIndex = intervalPolicy.maxIndex(tier);
        LocalDate latestAllowedReview = today.plusDays(intervalPolicy.intervalAt(tier, maxIndex));

        List<ReviewSchedule> adjustedSchedules = new ArrayList<>();
        for (ReviewSchedule schedule : scheduleDao.loadActiveSchedulesForLearnerForUpdate(learnerId)) {
            if (schedule.intervalIndex() > maxIndex && schedule.nextReviewDate().isAfter(latestAllowedReview)) {
                adjustedSchedules.add(new ReviewSchedule(
                        schedule.id(),
                        schedule.learnerId(),
                        schedule.contentId(),
                        schedule.intervalIndex(),
                        latestAllowedReview,
                        schedule.active(),
                        schedule.initialReviewCompleted(),
                        schedule.createdAt(),
                        now));
            }
        }

        scheduleDao.updateSchedulesBatch(adjustedSchedules);

        return adjustedSchedules.size();
    }

    private ScheduleNotFoundException scheduleNotFound(ReviewCompletion completion) {
        String errMsg = "No active review schedule for learner " + completion.learnerId() + " and content " + completion.contentId();

        log.error(errMsg);
        return new ScheduleNotFoundException(errMsg);
    }

    private static void verifyIds(String learnerId, String contentId) {
        if (learnerId == null || learnerId.isBlank() || contentId == null || contentId.isBlank()) {
            throw new IllegalArgumentException("Learner id and content id are required");
        }
    }
}
