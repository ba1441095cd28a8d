package com.gt.dailyprep.stats;

import com.gt.dailyprep.model.DashboardStats;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.model.SelectionDayStatus;
import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.selection.DailySelectionDao;
import com.gt.dailyprep.selection.EligibilityClassifier;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class StatsService {

    private final ProblemDao problemDao;
    private final DailySelectionDao dailySelectionDao;

    public StatsService(ProblemDao problemDao, DailySelectionDao dailySelectionDao) {
        this.problemDao = problemDao;
        this.dailySelectionDao = dailySelectionDao;
    }

    public DashboardStats getStats(LocalDate today) {
        return new DashboardStats(
                problemDao.countProblems(),
                problemDao.countProblemsInState(MasteryState.High),
                currentStreak(today),
                readyForReviewCount(today));
    }

    public int currentStreak(LocalDate today) {
        return countStreak(dailySelectionDao.loadSelectionDayStatuses(), today);
    }

    // Counts every due Low, Mid and High problem, whether or not it is already selected today
    public int readyForReviewCount(LocalDate today) {
        return problemDao.countReadyForReview(
                EligibilityClassifier.reviewCutoff(MasteryState.Low, today),
                EligibilityClassifier.reviewCutoff(MasteryState.Mid, today),
                EligibilityClassifier.reviewCutoff(MasteryState.High, today));
    }

    /**
     * Counts fully completed days ending at today. Walks the selection dates newest first, stopping at the first gap
     * in the calendar or the first day with an incomplete selection. Today must itself be complete for any day to count.
     */
    static int countStreak(List<SelectionDayStatus> dayStatusesNewestFirst, LocalDate today) {
        int streak = 0;
        LocalDate expectedDate = today;

        for (SelectionDayStatus dayStatus : dayStatusesNewestFirst) {
            if (!dayStatus.selectedDate().equals(expectedDate) || !dayStatus.allCompleted()) {
                break;
            }

            streak++;
            expectedDate = expectedDate.minusDays(1);
        }

        return streak;
    }
}
