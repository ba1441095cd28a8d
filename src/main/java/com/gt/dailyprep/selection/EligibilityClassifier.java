package com.gt.dailyprep.selection;

import com.gt.dailyprep.model.EligibilityPool;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.model.Problem;
import com.gt.dailyprep.problem.ProblemDao;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the catalogue into the New, Review and Mastered pools for a date. Problems already selected on that date are
 * never part of any pool. Each pool is ordered by problem id; shuffling is left to the sampler.
 */
@Component
public class EligibilityClassifier {

    public static final int LOW_REVIEW_AGE_DAYS = 3;
    public static final int MID_REVIEW_AGE_DAYS = 7;
    public static final int HIGH_REVIEW_AGE_DAYS = 14;

    private final ProblemDao problemDao;

    public EligibilityClassifier(ProblemDao problemDao) {
        this.problemDao = problemDao;
    }

    public List<Problem> loadPool(EligibilityPool pool, LocalDate today) {
        switch (pool) {
            case New:
                return problemDao.loadEligibleNew(today);
            case Review:
                return problemDao.loadEligibleReview(today, reviewCutoff(MasteryState.Low, today), reviewCutoff(MasteryState.Mid, today));
            case Mastered:
            default:
                return problemDao.loadEligibleMastered(today, reviewCutoff(MasteryState.High, today));
        }
    }

    public Map<EligibilityPool, List<Problem>> loadPools(LocalDate today) {
        Map<EligibilityPool, List<Problem>> pools = new EnumMap<>(EligibilityPool.class);

        for (EligibilityPool pool : EligibilityPool.values()) {
            pools.put(pool, loadPool(pool, today));
        }

        return pools;
    }

    // Latest last_reviewed date at which a problem in the given state is due again on the given day
    public static LocalDate reviewCutoff(MasteryState masteryState, LocalDate today) {
        return today.minusDays(reviewAgeDays(masteryState));
    }

    public static int reviewAgeDays(MasteryState masteryState) {
        switch (masteryState) {
            case Low:
                return LOW_REVIEW_AGE_DAYS;
            case Mid:
                return MID_REVIEW_AGE_DAYS;
            case High:
                return HIGH_REVIEW_AGE_DAYS;
            case New:
            default:
                return 0;
        }
    }
}
