package com.gt.dailyprep.model;

public record DashboardStats(int totalProblems, int masteredProblems, int currentStreak, int readyForReview) { }
