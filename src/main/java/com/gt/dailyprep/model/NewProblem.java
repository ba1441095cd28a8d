package com.gt.dailyprep.model;

import java.time.LocalDate;

public record NewProblem(String name, String link, MasteryState masteryState, String keyInsight, LocalDate lastReviewed) { }
