package com.gt.resee.due;

import com.gt.resee.conf.CachingConfig;
import com.gt.resee.due.model.LearnerDueReviews;
import com.gt.resee.model.ReviewSchedule;
import com.gt.resee.schedule.ScheduleDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read side over the schedule store: what is due for a learner, and the daily feed polled by the
 * notification service. Never returns deactivated schedules.
 * <p>
 * Due counts are cached per learner. The schedule engine calls {@link #invalidateLearner} after every mutation.
 * Each invalidation bumps the learner's generation; a count read under an older generation never outlives it in
 * the cache.
 */
@Component
public class DueReviewQueryService {

    private static final Logger log = LoggerFactory.getLogger(DueReviewQueryService.class);

    private static final Comparator<ReviewSchedule> OLDEST_DUE_FIRST =
            Comparator.comparing(ReviewSchedule::nextReviewDate)
                    .thenComparing(ReviewSchedule::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ScheduleDao scheduleDao;
    private final CacheManager cacheManager;
    private final Clock clock;

    private final ConcurrentMap<String, AtomicLong> generations = new ConcurrentHashMap<>();

    @Autowired
    public DueReviewQueryService(ScheduleDao scheduleDao, CacheManager cacheManager, Clock clock) {
        this.scheduleDao = scheduleDao;
        this.cacheManager = cacheManager;
        this.clock = clock;
    }

    public List<ReviewSchedule> dueForLearner(String learnerId) {
        return dueForLearner(learnerId, LocalDate.now(clock));
    }

    public List<ReviewSchedule> dueForLearner(String learnerId, LocalDate asOf) {
        return scheduleDao.loadDueSchedules(learnerId, asOf)
                .stream()
                .filter(schedule -> schedule.active() && !schedule.nextReviewDate().isAfter(asOf))
                .sorted(OLDEST_DUE_FIRST)
                .toList();
    }

    public int countDue(String learnerId, LocalDate asOf) {
        Cache cache = cacheManager.getCache(CachingConfig.DUE_COUNTS);
        DueCount cached = cache == null ? null : cache.get(learnerId, DueCount.class);

        if (cached != null && cached.asOf().equals(asOf)) {
            return cached.count();
        }

        AtomicLong generation = generationOf(learnerId);
        long readGeneration = generation.get();
        int count = scheduleDao.countDueSchedules(learnerId, asOf);

        if (cache != null) {
            cache.put(learnerId, new DueCount(asOf, count));

            // A mutation landed while counting; its eviction may have run before the put above
            if (generation.get() != readGeneration) {
                cache.evict(learnerId);
            }
        }

        return count;
    }

    public int countOverdue(String learnerId, LocalDate asOf) {
        return scheduleDao.countOverdueSchedules(learnerId, asOf);
    }

    public List<LearnerDueReviews> dueFeedForDate(LocalDate date) {
        Map<String, List<ReviewSchedule>> schedulesByLearner = new LinkedHashMap<>();

        for (ReviewSchedule schedule : scheduleDao.loadSchedulesDueOn(date)) {
            if (schedule.active() && schedule.nextReviewDate().equals(date)) {
                schedulesByLearner.computeIfAbsent(schedule.learnerId(), learnerId -> new ArrayList<>()).add(schedule);
            }
        }

        log.info("Due feed for {}: {} learners", date, schedulesByLearner.size());

        return schedulesByLearner.entrySet()
                .stream()
                .map(entry -> new LearnerDueReviews(entry.getKey(), date, List.copyOf(entry.getValue())))
                .toList();
    }

    public void invalidateLearner(String learnerId) {
        generationOf(learnerId).incrementAndGet();

        Cache cache = cacheManager.getCache(CachingConfig.DUE_COUNTS);

        if (cache != null) {
            cache.evict(learnerId);
        }
    }

    private AtomicLong generationOf(String learnerId) {
        return generations.computeIfAbsent(learnerId, id -> new AtomicLong());
    }

    private record DueCount(LocalDate asOf, int count) { }
}
