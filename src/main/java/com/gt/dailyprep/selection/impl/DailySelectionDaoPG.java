package com.gt.dailyprep.selection.impl;

import com.gt.dailyprep.model.*;
import com.gt.dailyprep.problem.impl.ProblemDaoPG;
import com.gt.dailyprep.selection.DailySelectionDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class DailySelectionDaoPG implements DailySelectionDao {

    private static final String LOAD_SELECTED_PROBLEMS_SQL =
            "SELECT ds.id AS selection_id, ds.completed, " +
                    "p.id, p.name, p.link, p.mastery_state, p.key_insight, p.last_reviewed, p.review_count, p.create_instant " +
            "FROM daily_selections ds " +
            "JOIN problems p ON p.id = ds.problem_id " +
            "WHERE ds.selected_date = :selectedDate " +
            "ORDER BY ds.id";

    private static final String LOAD_SELECTION_SQL =
            "SELECT id, problem_id, selected_date, completed " +
            "FROM daily_selections " +
            "WHERE problem_id = :problemId AND selected_date = :selectedDate";

    private static final String CREATE_SELECTION_SQL =
            "INSERT INTO daily_selections (problem_id, selected_date, completed) " +
            "VALUES (:problemId, :selectedDate, FALSE)";

    private static final String DELETE_SELECTIONS_FOR_DATE_SQL =
            "DELETE FROM daily_selections WHERE selected_date = :selectedDate";

    private static final String DELETE_SELECTION_SQL =
            "DELETE FROM daily_selections WHERE id = :selectionId";

    private static final String MARK_SELECTION_COMPLETE_SQL =
            "UPDATE daily_selections SET completed = TRUE WHERE id = :selectionId";

    private static final String LOAD_SELECTION_DAY_STATUSES_SQL =
            "SELECT selected_date, COUNT(*) AS total, " +
                    "SUM(CASE WHEN completed THEN 1 ELSE 0 END) AS completed_count " +
            "FROM daily_selections " +
            "GROUP BY selected_date " +
            "ORDER BY selected_date DESC";

    private final NamedParameterJdbcTemplate template;

    public DailySelectionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public List<SelectedProblem> loadSelectedProblems(LocalDate selectedDate) {
        return template.query(LOAD_SELECTED_PROBLEMS_SQL, Map.of("selectedDate", Date.valueOf(selectedDate)),
                (rs, rowNum) -> new SelectedProblem(
                        rs.getLong("selection_id"),
                        rs.getBoolean("completed"),
                        ProblemDaoPG.getProblemFromResultSet(rs, rowNum)));
    }

    @Override
    public DailySelection loadSelection(long problemId, LocalDate selectedDate) {
        List<DailySelection> selections = template.query(LOAD_SELECTION_SQL,
                Map.of("problemId", problemId, "selectedDate", Date.valueOf(selectedDate)),
                (rs, rowNum) -> new DailySelection(
                        rs.getLong("id"),
                        rs.getLong("problem_id"),
                        rs.getDate("selected_date").toLocalDate(),
                        rs.getBoolean("completed")));

        return selections.isEmpty() ? null : selections.get(0);
    }

    @Override
    public void createSelections(LocalDate selectedDate, Collection<Long> problemIds) {
        if (problemIds.isEmpty()) {
            return;
        }

        int index = 0;
        SqlParameterSource[] sources = new SqlParameterSource[problemIds.size()];
        for (Long problemId : problemIds) {
            MapSqlParameterSource source = new MapSqlParameterSource();
            source.addValue("problemId", problemId);
            source.addValue("selectedDate", Date.valueOf(selectedDate));

            sources[index++] = source;
        }

        template.batchUpdate(CREATE_SELECTION_SQL, sources);
    }

    @Override
    public int deleteSelectionsForDate(LocalDate selectedDate) {
        return template.update(DELETE_SELECTIONS_FOR_DATE_SQL, Map.of("selectedDate", Date.valueOf(selectedDate)));
    }

    @Override
    public int deleteSelection(long selectionId) {
        return template.update(DELETE_SELECTION_SQL, Map.of("selectionId", selectionId));
    }

    @Override
    public int markSelectionComplete(long selectionId) {
        return template.update(MARK_SELECTION_COMPLETE_SQL, Map.of("selectionId", selectionId));
    }

    @Override
    public List<SelectionDayStatus> loadSelectionDayStatuses() {
        return template.query(LOAD_SELECTION_DAY_STATUSES_SQL, (rs, rowNum) -> new SelectionDayStatus(
                rs.getDate("selected_date").toLocalDate(),
                rs.getInt("total"),
                rs.getInt("completed_count")));
    }
}
