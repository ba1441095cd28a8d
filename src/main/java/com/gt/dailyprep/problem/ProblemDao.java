package com.gt.dailyprep.problem;

import com.gt.dailyprep.model.*;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface ProblemDao {

    Problem createProblem(NewProblem newProblem);

    Problem loadProblem(long id);

    List<Problem> loadProblems(Collection<Long> ids);

    List<Problem> loadAllProblems();

    List<ProblemSummary> loadProblemSummaries(ProblemFilterOptions filterOptions);

    Long findProblemIdByLink(String link);

    List<String> loadAllLinks();

    int updateProblem(long id, ProblemUpdate problemUpdate);

    int applyReviewOutcome(long id, MasteryState nextState, LocalDate reviewDate);

    int deleteProblem(long id);

    List<Problem> loadEligibleNew(LocalDate selectionDate);

    List<Problem> loadEligibleReview(LocalDate selectionDate, LocalDate lowCutoff, LocalDate midCutoff);

    List<Problem> loadEligibleMastered(LocalDate selectionDate, LocalDate highCutoff);

    int countReadyForReview(LocalDate lowCutoff, LocalDate midCutoff, LocalDate highCutoff);

    int countProblems();

    int countProblemsInState(MasteryState masteryState);
}
