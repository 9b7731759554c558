package com.gt.resee.schedule.impl;

import com.gt.resee.model.ReviewSchedule;
import com.gt.resee.schedule.ScheduleDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ScheduleDaoPG implements ScheduleDao {

    private static final String SCHEDULE_COLUMNS =
            "id, learner_id, content_id, interval_index, next_review_date, is_active, initial_review_completed, created_at, updated_at ";

    private static final String CREATE_SCHEDULE_SQL =
            "INSERT INTO review_schedule " +
                    "(id, learner_id, content_id, interval_index, next_review_date, is_active, initial_review_completed, created_at, updated_at) " +
                    "VALUES (:id, :learnerId, :contentId, :intervalIndex, :nextReviewDate, :active, :initialReviewCompleted, :createdAt, :updatedAt) " +
                    "ON CONFLICT (learner_id, content_id) DO NOTHING";

    private static final String LOAD_SCHEDULE_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE learner_id = :learnerId AND content_id = :contentId";

    private static final String LOAD_SCHEDULE_FOR_UPDATE_SQL = LOAD_SCHEDULE_SQL + " FOR UPDATE";

    private static final String LOAD_ACTIVE_SCHEDULES_FOR_LEARNER_FOR_UPDATE_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE learner_id = :learnerId AND is_active IS TRUE " +
            "ORDER BY content_id " +
            "FOR UPDATE";

    private static final String UPDATE_SCHEDULE_SQL =
            "UPDATE review_schedule " +
            "SET interval_index = :intervalIndex, next_review_date = :nextReviewDate, is_active = :active, " +
            "    initial_review_completed = :initialReviewCompleted, updated_at = :updatedAt " +
            "WHERE id = :id";

    private static final String DEACTIVATE_SCHEDULE_SQL =
            "UPDATE review_schedule " +
            "SET is_active = false, updated_at = :updatedAt " +
            "WHERE learner_id = :learnerId AND content_id = :contentId AND is_active IS TRUE";

    private static final String LOAD_DUE_SCHEDULES_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE learner_id = :learnerId AND is_active IS TRUE AND next_review_date <= :asOf " +
            "ORDER BY next_review_date ASC, created_at ASC";

    private static final String COUNT_DUE_SCHEDULES_SQL =
            "SELECT COUNT(*) FROM review_schedule " +
            "WHERE learner_id = :learnerId AND is_active IS TRUE AND next_review_date <= :asOf";

    private static final String COUNT_OVERDUE_SCHEDULES_SQL =
            "SELECT COUNT(*) FROM review_schedule " +
            "WHERE learner_id = :learnerId AND is_active IS TRUE AND next_review_date < :asOf";

    private static final String LOAD_SCHEDULES_DUE_ON_SQL =
            "SELECT " + SCHEDULE_COLUMNS +
            "FROM review_schedule " +
            "WHERE is_active IS TRUE AND next_review_date = :date " +
            "ORDER BY learner_id, created_at";

    private final NamedParameterJdbcTemplate template;

    public ScheduleDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public boolean createSchedule(ReviewSchedule schedule) {
        return template.update(CREATE_SCHEDULE_SQL, toParams(schedule)) > 0;
    }

    @Override
    public Optional<ReviewSchedule> loadSchedule(String learnerId, String contentId) {
        return template.query(LOAD_SCHEDULE_SQL, Map.of("learnerId", learnerId, "contentId", contentId),
                        ScheduleDaoPG::getScheduleFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ReviewSchedule> loadScheduleForUpdate(String learnerId, String contentId) {
        return template.query(LOAD_SCHEDULE_FOR_UPDATE_SQL, Map.of("learnerId", learnerId, "contentId", contentId),
                        ScheduleDaoPG::getScheduleFromResultSet)
                .stream()
                .findFirst();
    }

    @Override
    public List<ReviewSchedule> loadActiveSchedulesForLearnerForUpdate(String learnerId) {
        return template.query(LOAD_ACTIVE_SCHEDULES_FOR_LEARNER_FOR_UPDATE_SQL, Map.of("learnerId", learnerId),
                ScheduleDaoPG::getScheduleFromResultSet);
    }

    @Override
    public int updateSchedule(ReviewSchedule schedule) {
        return template.update(UPDATE_SCHEDULE_SQL, toParams(schedule));
    }

    @Override
    public int updateSchedulesBatch(List<ReviewSchedule> schedules) {
        if (schedules.isEmpty()) {
            return 0;
        }

        SqlParameterSource[] paramsArray = schedules.stream()
                .map(ScheduleDaoPG::toParams)
                .toArray(SqlParameterSource[]::new);

        int[] rowCnts = template.batchUpdate(UPDATE_SCHEDULE_SQL, paramsArray);
        return Arrays.stream(rowCnts).map(rowCnt -> Math.max(rowCnt, 0)).sum();
    }

    @Override
    public int deactivateSchedule(String learnerId, String contentId, Instant updatedAt) {
        return template.update(DEACTIVATE_SCHEDULE_SQL, Map.of(
                "learnerId", learnerId,
                "contentId", contentId,
                "updatedAt", Timestamp.from(updatedAt)));
    }

    @Override
    public List<ReviewSchedule> loadDueSchedules(String learnerId, LocalDate asOf) {
        return template.query(LOAD_DUE_SCHEDULES_SQL, Map.of("learnerId", learnerId, "asOf", Date.valueOf(asOf)),
                ScheduleDaoPG::getScheduleFromResultSet);
    }

    @Override
    public int countDueSchedules(String learnerId, LocalDate asOf) {
        Integer cnt = template.queryForObject(COUNT_DUE_SCHEDULES_SQL, Map.of("learnerId", learnerId, "asOf", Date.valueOf(asOf)), Integer.class);
        return cnt == null ? 0 : cnt;
    }

    @Override
    public int countOverdueSchedules(String learnerId, LocalDate asOf) {
        Integer cnt = template.queryForObject(COUNT_OVERDUE_SCHEDULES_SQL, Map.of("learnerId", learnerId, "asOf", Date.valueOf(asOf)), Integer.class);
        return cnt == null ? 0 : cnt;
    }

    @Override
    public List<ReviewSchedule> loadSchedulesDueOn(LocalDate date) {
        return template.query(LOAD_SCHEDULES_DUE_ON_SQL, Map.of("date", Date.valueOf(date)),
                ScheduleDaoPG::getScheduleFromResultSet);
    }

    private static MapSqlParameterSource toParams(ReviewSchedule schedule) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", schedule.id());
        params.addValue("learnerId", schedule.learnerId());
        params.addValue("contentId", schedule.contentId());
        params.addValue("intervalIndex", schedule.intervalIndex());
        params.addValue("nextReviewDate", Date.valueOf(schedule.nextReviewDate()));
        params.addValue("active", schedule.active());
        params.addValue("initialReviewCompleted", schedule.initialReviewCompleted());
        params.addValue("createdAt", toTimestamp(schedule.createdAt()));
        params.addValue("updatedAt", toTimestamp(schedule.updatedAt()));

        return params;
    }

    private static ReviewSchedule getScheduleFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewSchedule(
                rs.getString("id"),
                rs.getString("learner_id"),
                rs.getString("content_id"),
                rs.getInt("interval_index"),
                rs.getDate("next_review_date").toLocalDate(),
                rs.getBoolean("is_active"),
                rs.getBoolean("initial_review_completed"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
