package com.gt.dailyprep.model;

import java.time.LocalDate;

public record SelectionDayStatus(LocalDate selectedDate, int total, int completed) {

    public boolean allCompleted() {
        return total > 0 && total == completed;
    }
}
