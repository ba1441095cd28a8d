package com.gt.dailyprep.model;

public record SelectedProblem(long selectionId, boolean completed, Problem problem) { }
