package com.gt.dailyprep.stats;

import com.gt.dailyprep.model.DashboardStats;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.model.SelectionDayStatus;
import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.selection.DailySelectionDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.List;

import static com.gt.dailyprep.util.TestUtils.TODAY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class StatsServiceTests {

    private StatsService statsService;

    @Mock private ProblemDao problemDao;
    @Mock private DailySelectionDao dailySelectionDao;

    @BeforeEach
    public void setup() {
        statsService = new StatsService(problemDao, dailySelectionDao);
    }

    @Test
    public void testCurrentStreak_ThreeCompleteDays() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY, 5, 5),
                new SelectionDayStatus(TODAY.minusDays(1), 5, 5),
                new SelectionDayStatus(TODAY.minusDays(2), 3, 3)));

        assertEquals(3, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_PartialDayBreaksChain() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY, 5, 5),
                new SelectionDayStatus(TODAY.minusDays(1), 5, 4),
                new SelectionDayStatus(TODAY.minusDays(2), 5, 5)));

        assertEquals(1, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_NoSelections() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of());

        assertEquals(0, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_TodayIncomplete() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY, 5, 2),
                new SelectionDayStatus(TODAY.minusDays(1), 5, 5)));

        assertEquals(0, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_NoSelectionToday() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY.minusDays(1), 5, 5),
                new SelectionDayStatus(TODAY.minusDays(2), 5, 5)));

        assertEquals(0, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_GapEndsStreak() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY, 3, 3),
                new SelectionDayStatus(TODAY.minusDays(1), 3, 3),
                new SelectionDayStatus(TODAY.minusDays(3), 3, 3)));

        assertEquals(2, statsService.currentStreak(TODAY));
    }

    @Test
    public void testCurrentStreak_FutureSelectionEndsWalk() {
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(
                new SelectionDayStatus(TODAY.plusDays(1), 3, 0),
                new SelectionDayStatus(TODAY, 3, 3)));

        assertEquals(0, statsService.currentStreak(TODAY));
    }

    @Test
    public void testGetStats() {
        when(problemDao.countProblems()).thenReturn(12);
        when(problemDao.countProblemsInState(MasteryState.High)).thenReturn(3);
        when(problemDao.countReadyForReview(TODAY.minusDays(3), TODAY.minusDays(7), TODAY.minusDays(14))).thenReturn(7);
        when(dailySelectionDao.loadSelectionDayStatuses()).thenReturn(List.of(new SelectionDayStatus(TODAY, 5, 5)));

        assertEquals(new DashboardStats(12, 3, 1, 7), statsService.getStats(TODAY));
    }
}
