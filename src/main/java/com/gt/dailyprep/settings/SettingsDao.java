package com.gt.dailyprep.settings;

import com.gt.dailyprep.exception.DaoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SettingsDao {

    private static final Logger log = LoggerFactory.getLogger(SettingsDao.class);

    private static final int SETTINGS_ROW_ID = 1;

    private NamedParameterJdbcTemplate template;

    @Autowired
    public SettingsDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    private static final String GET_DAILY_PROBLEM_COUNT =
            "SELECT daily_problem_count " +
            "FROM settings " +
            "WHERE id = :id";

    private static final String UPDATE_DAILY_PROBLEM_COUNT =
            "UPDATE settings " +
            "SET daily_problem_count = :dailyProblemCount " +
            "WHERE id = :id";

    public int getDailyProblemCount() {
        List<Integer> counts = template.queryForList(GET_DAILY_PROBLEM_COUNT, Map.of("id", SETTINGS_ROW_ID), Integer.class);

        if (counts.isEmpty() || counts.get(0) == null) {
            log.error("Settings row {} is missing", SETTINGS_ROW_ID);
            throw new DaoException("Settings not found");
        }

        return counts.get(0);
    }

    public void saveDailyProblemCount(int dailyProblemCount) {
        int updated = template.update(UPDATE_DAILY_PROBLEM_COUNT, Map.of("id", SETTINGS_ROW_ID, "dailyProblemCount", dailyProblemCount));

        if (updated != 1) {
            log.error("Settings row {} is missing", SETTINGS_ROW_ID);
            throw new DaoException("Settings not found");
        }
    }
}
