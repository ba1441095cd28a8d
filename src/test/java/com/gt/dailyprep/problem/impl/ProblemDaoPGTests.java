package com.gt.dailyprep.problem.impl;

import com.gt.dailyprep.exception.DaoException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.review.impl.AttemptDaoPG;
import com.gt.dailyprep.selection.EligibilityClassifier;
import com.gt.dailyprep.selection.impl.DailySelectionDaoPG;
import com.gt.dailyprep.topic.impl.TopicDaoPG;
import com.gt.dailyprep.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.gt.dailyprep.util.TestUtils.TODAY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ProblemDaoPGTests {

    private NamedParameterJdbcTemplate template;
    private ProblemDaoPG problemDao;
    private DailySelectionDaoPG dailySelectionDao;
    private EligibilityClassifier eligibilityClassifier;

    private int problemCounter = 0;

    @BeforeEach
    public void setup() {
        template = new NamedParameterJdbcTemplate(TestUtils.createTestDataSource());
        problemDao = new ProblemDaoPG(template);
        dailySelectionDao = new DailySelectionDaoPG(template);
        eligibilityClassifier = new EligibilityClassifier(problemDao);
    }

    @Test
    public void testCreateAndLoadProblem() {
        Problem created = problemDao.createProblem(new NewProblem("Two Sum", "https://leetcode.com/problems/two-sum/",
                MasteryState.Low, "Hash the complement", LocalDate.of(2024, 1, 2)));

        Problem loaded = problemDao.loadProblem(created.id());

        assertEquals(created, loaded);
        assertEquals("Two Sum", loaded.name());
        assertEquals(MasteryState.Low, loaded.masteryState());
        assertEquals("Hash the complement", loaded.keyInsight());
        assertEquals(LocalDate.of(2024, 1, 2), loaded.lastReviewed());
        assertEquals(0, loaded.reviewCount());
        assertNotNull(loaded.createInstant());
    }

    @Test
    public void testCreateProblem_DefaultsToNew() {
        Problem created = problemDao.createProblem(new NewProblem("Two Sum", "https://leetcode.com/problems/two-sum/", null, null, null));

        assertEquals(MasteryState.New, created.masteryState());
        assertNull(created.lastReviewed());
    }

    @Test
    public void testLoadProblem_Unknown() {
        assertNull(problemDao.loadProblem(12345));
        assertTrue(problemDao.loadProblems(List.of()).isEmpty());
    }

    @Test
    public void testFindProblemIdByLinkAndLoadAllLinks() {
        Problem problem = createProblem(MasteryState.New, null);

        assertEquals(problem.id(), problemDao.findProblemIdByLink(problem.link()));
        assertNull(problemDao.findProblemIdByLink("https://leetcode.com/problems/unknown"));
        assertEquals(List.of(problem.link()), problemDao.loadAllLinks());
    }

    @Test
    public void testUpdateProblem() {
        Problem problem = createProblem(MasteryState.Low, TODAY);

        int updated = problemDao.updateProblem(problem.id(), ProblemUpdate.builder()
                .set(ProblemField.Name, "Renamed")
                .set(ProblemField.State, MasteryState.High)
                .set(ProblemField.LastReviewed, null)
                .set(ProblemField.KeyInsight, "insight")
                .build());

        Problem loaded = problemDao.loadProblem(problem.id());
        assertEquals(1, updated);
        assertEquals("Renamed", loaded.name());
        assertEquals(problem.link(), loaded.link());
        assertEquals(MasteryState.High, loaded.masteryState());
        assertNull(loaded.lastReviewed());
        assertEquals("insight", loaded.keyInsight());
    }

    @Test
    public void testApplyReviewOutcome() {
        Problem problem = createProblem(MasteryState.Low, null);

        problemDao.applyReviewOutcome(problem.id(), MasteryState.Mid, TODAY);
        problemDao.applyReviewOutcome(problem.id(), MasteryState.High, TODAY);

        Problem loaded = problemDao.loadProblem(problem.id());
        assertEquals(MasteryState.High, loaded.masteryState());
        assertEquals(TODAY, loaded.lastReviewed());
        assertEquals(2, loaded.reviewCount());
    }

    @Test
    public void testDeleteProblem_Cascades() {
        Problem problem = createProblem(MasteryState.New, null);
        AttemptDaoPG attemptDao = new AttemptDaoPG(template);
        TopicDaoPG topicDao = new TopicDaoPG(template);

        attemptDao.createAttempt(problem.id(), MasteryState.Low, Instant.now());
        dailySelectionDao.createSelections(TODAY, List.of(problem.id()));
        Topic topic = topicDao.findTopicByName("Graph");
        topicDao.setProblemTopics(problem.id(), List.of(topic.id()));

        assertEquals(1, problemDao.deleteProblem(problem.id()));

        assertNull(problemDao.loadProblem(problem.id()));
        assertEquals(0, attemptDao.countAttempts(problem.id()));
        assertNull(dailySelectionDao.loadSelection(problem.id(), TODAY));
        assertTrue(topicDao.loadTopicsForProblems(List.of(problem.id())).isEmpty());
        assertNotNull(topicDao.findTopicByName("Graph"));
        assertEquals(0, problemDao.deleteProblem(problem.id()));
    }

    @Test
    public void testLoadProblemSummaries() {
        Problem twoSum = problemDao.createProblem(new NewProblem("Two Sum", "https://leetcode.com/problems/two-sum", MasteryState.New, null, null));
        Problem threeSum = problemDao.createProblem(new NewProblem("3Sum", "https://leetcode.com/problems/3sum", MasteryState.Low, null, null));
        problemDao.createProblem(new NewProblem("100%_Done", "https://leetcode.com/problems/done", MasteryState.Low, null, null));
        new AttemptDaoPG(template).createAttempt(threeSum.id(), MasteryState.Low, Instant.now());

        List<ProblemSummary> all = problemDao.loadProblemSummaries(ProblemFilterOptions.NO_FILTERS);
        assertEquals(3, all.size());
        assertEquals("100%_Done", all.get(0).problem().name());

        List<ProblemSummary> sums = problemDao.loadProblemSummaries(new ProblemFilterOptions(null, "SUM"));
        assertEquals(List.of(threeSum.id(), twoSum.id()), sums.stream().map(summary -> summary.problem().id()).toList());
        assertEquals(1, sums.get(0).attemptCount());
        assertEquals(0, sums.get(1).attemptCount());

        List<ProblemSummary> lowSums = problemDao.loadProblemSummaries(new ProblemFilterOptions(MasteryState.Low, "sum"));
        assertEquals(1, lowSums.size());
        assertEquals(threeSum.id(), lowSums.get(0).problem().id());

        // Wildcards in the search are matched literally
        assertEquals(1, problemDao.loadProblemSummaries(new ProblemFilterOptions(null, "%_")).size());
        assertTrue(problemDao.loadProblemSummaries(new ProblemFilterOptions(null, "two_sum")).isEmpty());
    }

    @Test
    public void testEligiblePools() {
        Problem newProblem = createProblem(MasteryState.New, TODAY);
        Problem dueLow = createProblem(MasteryState.Low, TODAY.minusDays(3));
        createProblem(MasteryState.Low, TODAY.minusDays(2));
        Problem neverReviewedMid = createProblem(MasteryState.Mid, null);
        createProblem(MasteryState.Mid, TODAY.minusDays(6));
        Problem dueHigh = createProblem(MasteryState.High, TODAY.minusDays(14));
        createProblem(MasteryState.High, TODAY.minusDays(13));

        Map<EligibilityPool, List<Problem>> pools = eligibilityClassifier.loadPools(TODAY);

        assertEquals(List.of(newProblem.id()), ids(pools.get(EligibilityPool.New)));
        assertEquals(List.of(dueLow.id(), neverReviewedMid.id()), ids(pools.get(EligibilityPool.Review)));
        assertEquals(List.of(dueHigh.id()), ids(pools.get(EligibilityPool.Mastered)));
    }

    @Test
    public void testEligiblePools_ExcludeTodaySelection() {
        Problem newProblem = createProblem(MasteryState.New, null);
        Problem lowProblem = createProblem(MasteryState.Low, null);
        Problem highProblem = createProblem(MasteryState.High, null);

        dailySelectionDao.createSelections(TODAY, List.of(newProblem.id(), lowProblem.id(), highProblem.id()));

        Map<EligibilityPool, List<Problem>> todayPools = eligibilityClassifier.loadPools(TODAY);
        assertTrue(todayPools.get(EligibilityPool.New).isEmpty());
        assertTrue(todayPools.get(EligibilityPool.Review).isEmpty());
        assertTrue(todayPools.get(EligibilityPool.Mastered).isEmpty());

        Map<EligibilityPool, List<Problem>> tomorrowPools = eligibilityClassifier.loadPools(TODAY.plusDays(1));
        assertEquals(List.of(newProblem.id()), ids(tomorrowPools.get(EligibilityPool.New)));
        assertEquals(List.of(lowProblem.id()), ids(tomorrowPools.get(EligibilityPool.Review)));
        assertEquals(List.of(highProblem.id()), ids(tomorrowPools.get(EligibilityPool.Mastered)));

        dailySelectionDao.deleteSelectionsForDate(TODAY);

        Map<EligibilityPool, List<Problem>> clearedPools = eligibilityClassifier.loadPools(TODAY);
        assertEquals(List.of(newProblem.id()), ids(clearedPools.get(EligibilityPool.New)));
        assertEquals(List.of(lowProblem.id()), ids(clearedPools.get(EligibilityPool.Review)));
        assertEquals(List.of(highProblem.id()), ids(clearedPools.get(EligibilityPool.Mastered)));
    }

    @Test
    public void testCountReadyForReview() {
        createProblem(MasteryState.Low, null);
        createProblem(MasteryState.Low, TODAY.minusDays(3));
        createProblem(MasteryState.Low, TODAY.minusDays(5));
        createProblem(MasteryState.Low, TODAY.minusDays(2));
        createProblem(MasteryState.Mid, null);
        createProblem(MasteryState.Mid, TODAY.minusDays(7));
        createProblem(MasteryState.Mid, TODAY.minusDays(6));
        createProblem(MasteryState.High, null);
        createProblem(MasteryState.High, TODAY.minusDays(14));
        createProblem(MasteryState.High, TODAY.minusDays(13));
        createProblem(MasteryState.New, null);
        createProblem(MasteryState.New, TODAY.minusDays(30));

        // Selected problems still count
        dailySelectionDao.createSelections(TODAY, List.of(problemDao.findProblemIdByLink(link(1))));

        int readyForReview = problemDao.countReadyForReview(
                EligibilityClassifier.reviewCutoff(MasteryState.Low, TODAY),
                EligibilityClassifier.reviewCutoff(MasteryState.Mid, TODAY),
                EligibilityClassifier.reviewCutoff(MasteryState.High, TODAY));

        assertEquals(7, readyForReview);
        assertEquals(12, problemDao.countProblems());
        assertEquals(3, problemDao.countProblemsInState(MasteryState.High));
    }

    @Test
    public void testGetProblemFromResultSet_UnknownState() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getLong("id")).thenReturn(1L);
        when(rs.getString("mastery_state")).thenReturn("Purple");

        assertThrows(DaoException.class, () -> ProblemDaoPG.getProblemFromResultSet(rs, 0));
    }

    private Problem createProblem(MasteryState masteryState, LocalDate lastReviewed) {
        problemCounter++;

        return problemDao.createProblem(new NewProblem("Problem " + problemCounter, link(problemCounter), masteryState, null, lastReviewed));
    }

    private static String link(int problemNumber) {
        return "https://leetcode.com/problems/problem-" + problemNumber;
    }

    private static List<Long> ids(List<Problem> problems) {
        return problems.stream().map(Problem::id).toList();
    }
}
