package com.gt.dailyprep.model;

import java.time.Instant;

public record Attempt(long id, long problemId, MasteryState outcome, Instant attemptInstant) { }
