package com.gt.dailyprep.selection;

import com.gt.dailyprep.exception.ProblemNotFoundException;
import com.gt.dailyprep.exception.SelectionExhaustedException;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.review.ReviewService;
import com.gt.dailyprep.settings.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.*;

@Component
public class DailySelectionService {

    private static final Logger log = LoggerFactory.getLogger(DailySelectionService.class);

    private final DailySelectionDao dailySelectionDao;
    private final ProblemDao problemDao;
    private final EligibilityClassifier eligibilityClassifier;
    private final QuotaAllocator quotaAllocator;
    private final DiversitySampler diversitySampler;
    private final ReviewService reviewService;
    private final SettingsService settingsService;
    private final Random random;

    public DailySelectionService(DailySelectionDao dailySelectionDao,
                                 ProblemDao problemDao,
                                 EligibilityClassifier eligibilityClassifier,
                                 QuotaAllocator quotaAllocator,
                                 DiversitySampler diversitySampler,
                                 ReviewService reviewService,
                                 SettingsService settingsService,
                                 Random random) {
        this.dailySelectionDao = dailySelectionDao;
        this.problemDao = problemDao;
        this.eligibilityClassifier = eligibilityClassifier;
        this.quotaAllocator = quotaAllocator;
        this.diversitySampler = diversitySampler;
        this.reviewService = reviewService;
        this.settingsService = settingsService;
        this.random = random;
    }

    @Transactional
    public List<SelectedProblem> getOrCreateTodaySelection(LocalDate today) {
        List<SelectedProblem> existingSelection = dailySelectionDao.loadSelectedProblems(today);
        if (!existingSelection.isEmpty()) {
            return existingSelection;
        }

        return generateSelection(today);
    }

    @Transactional
    public List<SelectedProblem> refresh(LocalDate today) {
        int deleted = dailySelectionDao.deleteSelectionsForDate(today);
        log.info("Cleared {} selections for {} before regenerating", deleted, today);

        return generateSelection(today);
    }

    @Transactional
    public SelectedProblem recordCompletion(long problemId, MasteryState outcome, LocalDate today) {
        ReviewService.validateOutcome(outcome);

        Problem problem = loadProblem(problemId);
        // A completed entry may be rated again; the transition is applied to the current state each time
        DailySelection selection = loadTodaySelection(problemId, today);

        Problem updatedProblem = reviewService.applyOutcome(problem, outcome, today);
        dailySelectionDao.markSelectionComplete(selection.id());

        log.info("Completed problem {} for {} with outcome {}", problemId, today, outcome);

        return new SelectedProblem(selection.id(), true, updatedProblem);
    }

    @Transactional
    public SelectedProblem replace(long problemId, LocalDate today) {
        loadProblem(problemId);
        DailySelection selection = loadTodaySelection(problemId, today);
        if (selection.completed()) {
            throw new ValidationException("Cannot replace completed problem " + problemId);
        }

        Problem replacement = selectSingleProblem(today);
        if (replacement == null) {
            log.warn("No eligible replacement for problem {} on {}", problemId, today);
            throw new SelectionExhaustedException("No eligible problems available for replacement");
        }

        dailySelectionDao.deleteSelection(selection.id());
        dailySelectionDao.createSelections(today, List.of(replacement.id()));

        DailySelection newSelection = dailySelectionDao.loadSelection(replacement.id(), today);
        log.info("Replaced problem {} with problem {} for {}", problemId, replacement.id(), today);

        return new SelectedProblem(newSelection.id(), newSelection.completed(), replacement);
    }

    // One random problem from the first non-empty pool, in New, Review, Mastered order
    Problem selectSingleProblem(LocalDate today) {
        for (EligibilityPool pool : EligibilityPool.values()) {
            List<Problem> candidates = eligibilityClassifier.loadPool(pool, today);

            if (!candidates.isEmpty()) {
                return candidates.get(random.nextInt(candidates.size()));
            }
        }

        return null;
    }

    private List<SelectedProblem> generateSelection(LocalDate today) {
        int dailyProblemCount = settingsService.getDailyProblemCount();

        Map<EligibilityPool, List<Problem>> pools = eligibilityClassifier.loadPools(today);
        Map<EligibilityPool, Integer> poolSizes = new EnumMap<>(EligibilityPool.class);
        pools.forEach((pool, problems) -> poolSizes.put(pool, problems.size()));

        QuotaAllocator.Quota quota = quotaAllocator.allocate(dailyProblemCount, poolSizes);

        List<Long> selectedIds = new ArrayList<>();
        for (EligibilityPool pool : EligibilityPool.values()) {
            for (Problem problem : diversitySampler.sample(pools.getOrDefault(pool, List.of()), quota.count(pool))) {
                selectedIds.add(problem.id());
            }
        }

        dailySelectionDao.createSelections(today, selectedIds);
        log.info("Generated {} of {} problems for {} (new {}, review {}, mastered {})",
                selectedIds.size(), dailyProblemCount, today, quota.newCount(), quota.reviewCount(), quota.masteredCount());

        return dailySelectionDao.loadSelectedProblems(today);
    }

    private Problem loadProblem(long problemId) {
        Problem problem = problemDao.loadProblem(problemId);
        if (problem == null) {
            throw new ProblemNotFoundException("Problem " + problemId + " not found");
        }

        return problem;
    }

    private DailySelection loadTodaySelection(long problemId, LocalDate today) {
        DailySelection selection = dailySelectionDao.loadSelection(problemId, today);
        if (selection == null) {
            throw new ProblemNotFoundException("Problem " + problemId + " is not in today's selection");
        }

        return selection;
    }
}
