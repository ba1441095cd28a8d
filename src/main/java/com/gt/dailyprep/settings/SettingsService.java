package com.gt.dailyprep.settings;

import com.gt.dailyprep.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    public static final int MIN_DAILY_PROBLEM_COUNT = 3;
    public static final int MAX_DAILY_PROBLEM_COUNT = 10;

    private final SettingsDao settingsDao;

    public SettingsService(SettingsDao settingsDao) {
        this.settingsDao = settingsDao;
    }

    public int getDailyProblemCount() {
        return settingsDao.getDailyProblemCount();
    }

    public int setDailyProblemCount(int dailyProblemCount) {
        if (!isValidDailyProblemCount(dailyProblemCount)) {
            log.warn("Rejected daily problem count {}", dailyProblemCount);
            throw new ValidationException("Daily problem count must be between " + MIN_DAILY_PROBLEM_COUNT + " and " + MAX_DAILY_PROBLEM_COUNT);
        }

        settingsDao.saveDailyProblemCount(dailyProblemCount);
        log.info("Daily problem count set to {}", dailyProblemCount);

        return dailyProblemCount;
    }

    public static boolean isValidDailyProblemCount(int dailyProblemCount) {
        return dailyProblemCount >= MIN_DAILY_PROBLEM_COUNT && dailyProblemCount <= MAX_DAILY_PROBLEM_COUNT;
    }
}
