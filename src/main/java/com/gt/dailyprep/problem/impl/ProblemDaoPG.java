package com.gt.dailyprep.problem.impl;

import com.gt.dailyprep.exception.DaoException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.problem.ProblemDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

public class ProblemDaoPG implements ProblemDao {

    private static final Logger log = LoggerFactory.getLogger(ProblemDaoPG.class);

    private static final String PROBLEM_COLUMNS = "p.id, p.name, p.link, p.mastery_state, p.key_insight, p.last_reviewed, p.review_count, p.create_instant";

    private static final String NOT_SELECTED_ON_DATE =
            "p.id NOT IN (SELECT problem_id FROM daily_selections WHERE selected_date = :selectionDate) ";

    private static final String CREATE_PROBLEM_SQL =
            "INSERT INTO problems (name, link, mastery_state, key_insight, last_reviewed) " +
            "VALUES (:name, :link, :masteryState, :keyInsight, :lastReviewed)";

    private static final String LOAD_PROBLEMS_SQL =
            "SELECT " + PROBLEM_COLUMNS + " FROM problems p WHERE p.id IN (:ids) ORDER BY p.id";

    private static final String LOAD_ALL_PROBLEMS_SQL =
            "SELECT " + PROBLEM_COLUMNS + " FROM problems p ORDER BY p.create_instant DESC, p.id DESC";

    private static final String LOAD_PROBLEM_SUMMARIES_SQL_PREFIX =
            "SELECT " + PROBLEM_COLUMNS + ", " +
                    "(SELECT COUNT(*) FROM attempts a WHERE a.problem_id = p.id) AS attempt_count " +
            "FROM problems p " +
            "WHERE 1 = 1 ";
    private static final String LOAD_PROBLEM_SUMMARIES_SQL_STATE_FILTER =
            "AND p.mastery_state = :masteryState ";
    private static final String LOAD_PROBLEM_SUMMARIES_SQL_SEARCH_FILTER =
            "AND LOWER(p.name) LIKE :search ESCAPE '\\' ";
    private static final String LOAD_PROBLEM_SUMMARIES_SQL_ORDER =
            "ORDER BY p.create_instant DESC, p.id DESC";

    private static final String FIND_PROBLEM_ID_BY_LINK_SQL =
            "SELECT id FROM problems WHERE link = :link";

    private static final String LOAD_ALL_LINKS_SQL =
            "SELECT link FROM problems";

    private static final String UPDATE_PROBLEM_SQL_PREFIX = "UPDATE problems SET ";
    private static final String UPDATE_PROBLEM_SQL_SUFFIX = " WHERE id = :id";

    private static final String APPLY_REVIEW_OUTCOME_SQL =
            "UPDATE problems " +
            "SET mastery_state = :masteryState, last_reviewed = :reviewDate, review_count = review_count + 1 " +
            "WHERE id = :id";

    // attempts, selections and topic links are removed by the foreign key cascades
    private static final String DELETE_PROBLEM_SQL =
            "DELETE FROM problems WHERE id = :id";

    private static final String LOAD_ELIGIBLE_NEW_SQL =
            "SELECT " + PROBLEM_COLUMNS + " " +
            "FROM problems p " +
            "WHERE p.mastery_state = 'New' AND " + NOT_SELECTED_ON_DATE +
            "ORDER BY p.id";

    private static final String LOAD_ELIGIBLE_REVIEW_SQL =
            "SELECT " + PROBLEM_COLUMNS + " " +
            "FROM problems p " +
            "WHERE ((p.mastery_state = 'Low' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :lowCutoff)) " +
                "OR (p.mastery_state = 'Mid' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :midCutoff))) " +
            "AND " + NOT_SELECTED_ON_DATE +
            "ORDER BY p.id";

    private static final String LOAD_ELIGIBLE_MASTERED_SQL =
            "SELECT " + PROBLEM_COLUMNS + " " +
            "FROM problems p " +
            "WHERE p.mastery_state = 'High' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :highCutoff) " +
            "AND " + NOT_SELECTED_ON_DATE +
            "ORDER BY p.id";

    private static final String COUNT_READY_FOR_REVIEW_SQL =
            "SELECT COUNT(*) " +
            "FROM problems p " +
            "WHERE (p.mastery_state = 'Low' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :lowCutoff)) " +
                "OR (p.mastery_state = 'Mid' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :midCutoff)) " +
                "OR (p.mastery_state = 'High' AND (p.last_reviewed IS NULL OR p.last_reviewed <= :highCutoff))";

    private static final String COUNT_PROBLEMS_SQL =
            "SELECT COUNT(*) FROM problems";

    private static final String COUNT_PROBLEMS_IN_STATE_SQL =
            "SELECT COUNT(*) FROM problems WHERE mastery_state = :masteryState";

    private final NamedParameterJdbcTemplate template;

    public ProblemDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Problem createProblem(NewProblem newProblem) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("name", newProblem.name());
        params.addValue("link", newProblem.link());
        params.addValue("masteryState", (newProblem.masteryState() == null ? MasteryState.New : newProblem.masteryState()).name());
        params.addValue("keyInsight", newProblem.keyInsight());
        params.addValue("lastReviewed", toDate(newProblem.lastReviewed()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        template.update(CREATE_PROBLEM_SQL, params, keyHolder, new String[] { "id" });

        Number id = keyHolder.getKey();
        if (id == null) {
            throw new DaoException("No id generated for problem " + newProblem.link());
        }

        return loadProblem(id.longValue());
    }

    @Override
    public Problem loadProblem(long id) {
        List<Problem> problems = loadProblems(List.of(id));

        return problems.isEmpty() ? null : problems.get(0);
    }

    @Override
    public List<Problem> loadProblems(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_PROBLEMS_SQL, Map.of("ids", ids), ProblemDaoPG::getProblemFromResultSet);
    }

    @Override
    public List<Problem> loadAllProblems() {
        return template.query(LOAD_ALL_PROBLEMS_SQL, ProblemDaoPG::getProblemFromResultSet);
    }

    @Override
    public List<ProblemSummary> loadProblemSummaries(ProblemFilterOptions filterOptions) {
        StringBuilder sql = new StringBuilder(LOAD_PROBLEM_SUMMARIES_SQL_PREFIX);
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (filterOptions.masteryState() != null) {
            sql.append(LOAD_PROBLEM_SUMMARIES_SQL_STATE_FILTER);
            params.addValue("masteryState", filterOptions.masteryState().name());
        }

        if (filterOptions.search() != null && !filterOptions.search().isBlank()) {
            sql.append(LOAD_PROBLEM_SUMMARIES_SQL_SEARCH_FILTER);
            params.addValue("search", "%" + escapeLikePattern(filterOptions.search().trim().toLowerCase()) + "%");
        }

        sql.append(LOAD_PROBLEM_SUMMARIES_SQL_ORDER);

        return template.query(sql.toString(), params,
                (rs, rowNum) -> new ProblemSummary(getProblemFromResultSet(rs, rowNum), rs.getInt("attempt_count")));
    }

    @Override
    public Long findProblemIdByLink(String link) {
        List<Long> ids = template.queryForList(FIND_PROBLEM_ID_BY_LINK_SQL, Map.of("link", link), Long.class);

        return ids.isEmpty() ? null : ids.get(0);
    }

    @Override
    public List<String> loadAllLinks() {
        return template.queryForList(LOAD_ALL_LINKS_SQL, Map.of(), String.class);
    }

    @Override
    public int updateProblem(long id, ProblemUpdate problemUpdate) {
        if (problemUpdate.isEmpty()) {
            return 0;
        }

        MapSqlParameterSource params = new MapSqlParameterSource("id", id);
        List<String> assignments = new ArrayList<>();

        for (Map.Entry<ProblemField, Object> entry : problemUpdate.values().entrySet()) {
            String column = entry.getKey().getColumn();

            assignments.add(column + " = :" + column);
            params.addValue(column, toColumnValue(entry.getValue()));
        }

        return template.update(UPDATE_PROBLEM_SQL_PREFIX + String.join(", ", assignments) + UPDATE_PROBLEM_SQL_SUFFIX, params);
    }

    @Override
    public int applyReviewOutcome(long id, MasteryState nextState, LocalDate reviewDate) {
        return template.update(APPLY_REVIEW_OUTCOME_SQL, Map.of(
                "id", id,
                "masteryState", nextState.name(),
                "reviewDate", toDate(reviewDate)));
    }

    @Override
    public int deleteProblem(long id) {
        return template.update(DELETE_PROBLEM_SQL, Map.of("id", id));
    }

    @Override
    public List<Problem> loadEligibleNew(LocalDate selectionDate) {
        return template.query(LOAD_ELIGIBLE_NEW_SQL, Map.of("selectionDate", toDate(selectionDate)), ProblemDaoPG::getProblemFromResultSet);
    }

    @Override
    public List<Problem> loadEligibleReview(LocalDate selectionDate, LocalDate lowCutoff, LocalDate midCutoff) {
        return template.query(LOAD_ELIGIBLE_REVIEW_SQL, Map.of(
                        "selectionDate", toDate(selectionDate),
                        "lowCutoff", toDate(lowCutoff),
                        "midCutoff", toDate(midCutoff)),
                ProblemDaoPG::getProblemFromResultSet);
    }

    @Override
    public List<Problem> loadEligibleMastered(LocalDate selectionDate, LocalDate highCutoff) {
        return template.query(LOAD_ELIGIBLE_MASTERED_SQL, Map.of(
                        "selectionDate", toDate(selectionDate),
                        "highCutoff", toDate(highCutoff)),
                ProblemDaoPG::getProblemFromResultSet);
    }

    @Override
    public int countReadyForReview(LocalDate lowCutoff, LocalDate midCutoff, LocalDate highCutoff) {
        Integer count = template.queryForObject(COUNT_READY_FOR_REVIEW_SQL, Map.of(
                "lowCutoff", toDate(lowCutoff),
                "midCutoff", toDate(midCutoff),
                "highCutoff", toDate(highCutoff)), Integer.class);

        return count == null ? 0 : count;
    }

    @Override
    public int countProblems() {
        Integer count = template.queryForObject(COUNT_PROBLEMS_SQL, Map.of(), Integer.class);

        return count == null ? 0 : count;
    }

    @Override
    public int countProblemsInState(MasteryState masteryState) {
        Integer count = template.queryForObject(COUNT_PROBLEMS_IN_STATE_SQL, Map.of("masteryState", masteryState.name()), Integer.class);

        return count == null ? 0 : count;
    }

    static String escapeLikePattern(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static Object toColumnValue(Object value) {
        if (value instanceof MasteryState masteryState) {
            return masteryState.name();
        } else if (value instanceof LocalDate localDate) {
            return toDate(localDate);
        }

        return value;
    }

    // Shared by DAOs that join problems; expects the columns listed in PROBLEM_COLUMNS without the prefix
    public static Problem getProblemFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Problem(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("link"),
                toMasteryState(rs.getString("mastery_state")),
                rs.getString("key_insight"),
                toLocalDate(rs.getDate("last_reviewed")),
                rs.getInt("review_count"),
                toInstant(rs.getTimestamp("create_instant")));
    }

    private static MasteryState toMasteryState(String value) {
        try {
            return MasteryState.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException ex) {
            String errMsg = "Unexpected mastery state stored for problem: " + value;

            log.error(errMsg);
            throw new DaoException(errMsg, ex);
        }
    }

    private static Date toDate(LocalDate localDate) {
        return localDate == null ? null : Date.valueOf(localDate);
    }

    private static LocalDate toLocalDate(Date date) {
        return date == null ? null : date.toLocalDate();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
