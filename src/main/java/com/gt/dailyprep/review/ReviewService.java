package com.gt.dailyprep.review;

import com.gt.dailyprep.exception.ProblemNotFoundException;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.problem.ProblemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Records review outcomes. Daily completions and manual reviews both go through {@link #applyOutcome}, which moves the
 * problem to its next mastery state, stamps the review date, bumps the review count and appends an attempt.
 */
@Component
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ProblemDao problemDao;
    private final AttemptDao attemptDao;
    private final Clock clock;

    public ReviewService(ProblemDao problemDao, AttemptDao attemptDao, Clock clock) {
        this.problemDao = problemDao;
        this.attemptDao = attemptDao;
        this.clock = clock;
    }

    public static void validateOutcome(MasteryState outcome) {
        if (!MasteryState.isValidOutcome(outcome)) {
            throw new ValidationException("Color must be one of: orange, yellow, green");
        }
    }

    // Callers are expected to run this inside their own transaction
    public Problem applyOutcome(Problem problem, MasteryState outcome, LocalDate reviewDate) {
        validateOutcome(outcome);

        MasteryState nextState = problem.masteryState().next(outcome);
        problemDao.applyReviewOutcome(problem.id(), nextState, reviewDate);
        attemptDao.createAttempt(problem.id(), outcome, Instant.now(clock));

        log.info("Problem {} reviewed as {}, moved from {} to {}", problem.id(), outcome, problem.masteryState(), nextState);

        return problemDao.loadProblem(problem.id());
    }

    @Transactional
    public Problem manualReview(long problemId, MasteryState outcome, Optional<String> keyInsight, LocalDate today) {
        validateOutcome(outcome);
        String insight = keyInsight.map(ProblemService::validateKeyInsight).orElse(null);

        Problem problem = problemDao.loadProblem(problemId);
        if (problem == null) {
            throw new ProblemNotFoundException("Problem " + problemId + " not found");
        }

        // A blank insight clears the stored one
        if (keyInsight.isPresent()) {
            problemDao.updateProblem(problemId, ProblemUpdate.builder().set(ProblemField.KeyInsight, insight).build());
        }

        return applyOutcome(problem, outcome, today);
    }
}
