package com.gt.dailyprep.selection;

import com.gt.dailyprep.model.DailySelection;
import com.gt.dailyprep.model.SelectedProblem;
import com.gt.dailyprep.model.SelectionDayStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface DailySelectionDao {

    List<SelectedProblem> loadSelectedProblems(LocalDate selectedDate);

    DailySelection loadSelection(long problemId, LocalDate selectedDate);

    void createSelections(LocalDate selectedDate, Collection<Long> problemIds);

    int deleteSelectionsForDate(LocalDate selectedDate);

    int deleteSelection(long selectionId);

    int markSelectionComplete(long selectionId);

    // Dates with at least one selection, most recent first
    List<SelectionDayStatus> loadSelectionDayStatuses();
}
