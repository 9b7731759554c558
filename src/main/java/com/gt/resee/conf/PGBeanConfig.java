package com.gt.resee.conf;

import com.gt.resee.history.ReviewHistoryDao;
import com.gt.resee.history.impl.ReviewHistoryDaoPG;
import com.gt.resee.schedule.LearnerTierDao;
import com.gt.resee.schedule.ScheduleDao;
import com.gt.resee.schedule.impl.LearnerTierDaoPG;
import com.gt.resee.schedule.impl.ScheduleDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${resee.datasource.postgres.url}") String url,
                                    @Value("${resee.datasource.postgres.username}") String username,
                                    @Value("${resee.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate getTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);

        return transactionTemplate;
    }

    @Bean
    public ScheduleDao getScheduleDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ScheduleDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public LearnerTierDao getLearnerTierDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new LearnerTierDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public ReviewHistoryDao getReviewHistoryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewHistoryDaoPG(namedParameterJdbcTemplate);
    }
}
