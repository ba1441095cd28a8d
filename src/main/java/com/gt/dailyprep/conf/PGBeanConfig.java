package com.gt.dailyprep.conf;

import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.problem.impl.ProblemDaoPG;
import com.gt.dailyprep.review.AttemptDao;
import com.gt.dailyprep.review.impl.AttemptDaoPG;
import com.gt.dailyprep.selection.DailySelectionDao;
import com.gt.dailyprep.selection.impl.DailySelectionDaoPG;
import com.gt.dailyprep.topic.TopicDao;
import com.gt.dailyprep.topic.impl.TopicDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${dailyprep.datasource.postgres.url}") String url,
                                    @Value("${dailyprep.datasource.postgres.username}") String username,
                                    @Value("${dailyprep.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ProblemDao getProblemDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ProblemDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public AttemptDao getAttemptDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new AttemptDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public DailySelectionDao getDailySelectionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DailySelectionDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public TopicDao getTopicDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new TopicDaoPG(namedParameterJdbcTemplate);
    }
}
