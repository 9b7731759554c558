package com.gt.resee.schedule.impl;

import com.gt.resee.model.ReviewSchedule;
import com.gt.resee.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static com.gt.resee.util.TestUtils.TEST_TODAY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ScheduleDaoPGTests {

    @Mock private NamedParameterJdbcTemplate template;

    private ScheduleDaoPG scheduleDao;

    @BeforeEach
    public void setup() {
        scheduleDao = new ScheduleDaoPG(template);
    }

    @Test
    public void testCreateSchedule() {
        ReviewSchedule schedule = TestUtils.buildSchedule("learner-1", "content-1", 0, TEST_TODAY, true);
        when(template.update(anyString(), any(SqlParameterSource.class))).thenReturn(1);

        assertTrue(scheduleDao.createSchedule(schedule));

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<SqlParameterSource> paramsCaptor = ArgumentCaptor.forClass(SqlParameterSource.class);
        verify(template).update(sqlCaptor.capture(), paramsCaptor.capture());

        assertTrue(sqlCaptor.getValue().contains("ON CONFLICT (learner_id, content_id) DO NOTHING"));
        assertEquals(schedule.id(), paramsCaptor.getValue().getValue("id"));
        assertEquals(0, paramsCaptor.getValue().getValue("intervalIndex"));
    }

    @Test
    public void testCreateSchedule_ExistingPairLeavesNoError() {
        when(template.update(anyString(), any(SqlParameterSource.class))).thenReturn(0);

        assertFalse(scheduleDao.createSchedule(TestUtils.buildSchedule("learner-1", "content-1", 0, TEST_TODAY, true)));
    }
}
