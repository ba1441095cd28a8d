package com.gt.dailyprep.review.impl;

import com.gt.dailyprep.exception.DaoException;
import com.gt.dailyprep.model.Attempt;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.review.AttemptDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class AttemptDaoPG implements AttemptDao {

    private static final String CREATE_ATTEMPT_SQL =
            "INSERT INTO attempts (problem_id, outcome, attempt_instant) " +
            "VALUES (:problemId, :outcome, :attemptInstant)";

    private static final String LOAD_ATTEMPTS_SQL =
            "SELECT id, problem_id, outcome, attempt_instant " +
            "FROM attempts " +
            "WHERE problem_id = :problemId " +
            "ORDER BY attempt_instant DESC, id DESC";

    private static final String COUNT_ATTEMPTS_SQL =
            "SELECT COUNT(*) FROM attempts WHERE problem_id = :problemId";

    private final NamedParameterJdbcTemplate template;

    public AttemptDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Attempt createAttempt(long problemId, MasteryState outcome, Instant attemptInstant) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("problemId", problemId);
        params.addValue("outcome", outcome.name());
        params.addValue("attemptInstant", Timestamp.from(attemptInstant));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        template.update(CREATE_ATTEMPT_SQL, params, keyHolder, new String[] { "id" });

        Number id = keyHolder.getKey();
        if (id == null) {
            throw new DaoException("No id generated for attempt on problem " + problemId);
        }

        return new Attempt(id.longValue(), problemId, outcome, attemptInstant);
    }

    @Override
    public List<Attempt> loadAttempts(long problemId) {
        return template.query(LOAD_ATTEMPTS_SQL, Map.of("problemId", problemId), AttemptDaoPG::getAttemptFromResultSet);
    }

    @Override
    public int countAttempts(long problemId) {
        Integer count = template.queryForObject(COUNT_ATTEMPTS_SQL, Map.of("problemId", problemId), Integer.class);

        return count == null ? 0 : count;
    }

    private static Attempt getAttemptFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        String outcome = rs.getString("outcome");

        try {
            return new Attempt(
                    rs.getLong("id"),
                    rs.getLong("problem_id"),
                    MasteryState.valueOf(outcome),
                    rs.getTimestamp("attempt_instant").toInstant());
        } catch (IllegalArgumentException ex) {
            throw new DaoException("Unexpected outcome stored for attempt: " + outcome, ex);
        }
    }
}
