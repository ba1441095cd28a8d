package com.gt.dailyprep.model;

public record ProblemSummary(Problem problem, int attemptCount) { }
