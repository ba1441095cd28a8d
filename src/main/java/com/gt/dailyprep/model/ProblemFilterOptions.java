package com.gt.dailyprep.model;

public record ProblemFilterOptions(MasteryState masteryState, String search) {

    public static final ProblemFilterOptions NO_FILTERS = new ProblemFilterOptions(null, "");
}
