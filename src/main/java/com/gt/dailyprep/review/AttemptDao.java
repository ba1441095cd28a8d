package com.gt.dailyprep.review;

import com.gt.dailyprep.model.Attempt;
import com.gt.dailyprep.model.MasteryState;

import java.time.Instant;
import java.util.List;

public interface AttemptDao {

    Attempt createAttempt(long problemId, MasteryState outcome, Instant attemptInstant);

    List<Attempt> loadAttempts(long problemId);

    int countAttempts(long problemId);
}
