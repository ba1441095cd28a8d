package com.gt.dailyprep.model;

import java.time.LocalDate;

// Columns of the problems table that may be written through a ProblemUpdate
public enum ProblemField {
    Name("name", String.class, false),
    Link("link", String.class, false),
    State("mastery_state", MasteryState.class, false),
    KeyInsight("key_insight", String.class, true),
    LastReviewed("last_reviewed", LocalDate.class, true);

    private final String column;
    private final Class<?> valueType;
    private final boolean nullable;

    ProblemField(String column, Class<?> valueType, boolean nullable) {
        this.column = column;
        this.valueType = valueType;
        this.nullable = nullable;
    }

    public String getColumn() {
        return column;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    public boolean isNullable() {
        return nullable;
    }
}
