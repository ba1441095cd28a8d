package com.gt.dailyprep.selection;

import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.EligibilityPool;
import com.gt.dailyprep.settings.SettingsService;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a daily problem count into per-pool counts. The target split is half new problems, forty percent review and
 * a tenth mastered, rounded up for new and review and down (but at least one) for mastered, then trimmed back to the
 * requested count. Targets are capped at what each pool can supply and any shortfall is handed out again in pool
 * priority order.
 */
@Component
public class QuotaAllocator {

    public Quota targetQuota(int dailyProblemCount) {
        if (!SettingsService.isValidDailyProblemCount(dailyProblemCount)) {
            throw new ValidationException("Daily problem count must be between " + SettingsService.MIN_DAILY_PROBLEM_COUNT
                    + " and " + SettingsService.MAX_DAILY_PROBLEM_COUNT + ", was " + dailyProblemCount);
        }

        // ceil(n * 0.5), ceil(n * 0.4) and floor(n * 0.1) in integer arithmetic
        int targetNew = (dailyProblemCount * 5 + 9) / 10;
        int targetReview = (dailyProblemCount * 4 + 9) / 10;
        int targetMastered = Math.max(1, dailyProblemCount / 10);

        int excess = targetNew + targetReview + targetMastered - dailyProblemCount;
        if (excess > 0) {
            int reduction = Math.min(excess, targetMastered);
            targetMastered -= reduction;
            excess -= reduction;
        }
        if (excess > 0 && targetReview > 0) {
            targetReview -= 1;
        }

        return new Quota(targetNew, targetReview, targetMastered);
    }

    public Quota allocate(int dailyProblemCount, Map<EligibilityPool, Integer> poolSizes) {
        Quota target = targetQuota(dailyProblemCount);

        Map<EligibilityPool, Integer> allocated = new EnumMap<>(EligibilityPool.class);
        int total = 0;
        for (EligibilityPool pool : EligibilityPool.values()) {
            int count = Math.min(target.count(pool), poolSize(poolSizes, pool));

            allocated.put(pool, count);
            total += count;
        }

        int shortfall = dailyProblemCount - total;
        for (EligibilityPool pool : EligibilityPool.values()) {
            if (shortfall <= 0) {
                break;
            }

            int extra = Math.min(shortfall, poolSize(poolSizes, pool) - allocated.get(pool));
            if (extra > 0) {
                allocated.put(pool, allocated.get(pool) + extra);
                shortfall -= extra;
            }
        }

        return new Quota(allocated.get(EligibilityPool.New), allocated.get(EligibilityPool.Review), allocated.get(EligibilityPool.Mastered));
    }

    private static int poolSize(Map<EligibilityPool, Integer> poolSizes, EligibilityPool pool) {
        Integer size = poolSizes.get(pool);

        return size == null ? 0 : Math.max(0, size);
    }

    public record Quota(int newCount, int reviewCount, int masteredCount) {
        public int count(EligibilityPool pool) {
            switch (pool) {
                case New:
                    return newCount;
                case Review:
                    return reviewCount;
                case Mastered:
                default:
                    return masteredCount;
            }
        }

        public int total() {
            return newCount + reviewCount + masteredCount;
        }
    }
}
