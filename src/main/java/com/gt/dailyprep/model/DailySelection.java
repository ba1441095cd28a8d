package com.gt.dailyprep.model;

import java.time.LocalDate;

public record DailySelection(long id, long problemId, LocalDate selectedDate, boolean completed) { }
