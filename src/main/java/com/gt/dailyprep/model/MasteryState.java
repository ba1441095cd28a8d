package com.gt.dailyprep.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.dailyprep.serialization.MasteryStateDeserializer;
import com.gt.dailyprep.serialization.MasteryStateSerializer;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

// Progression is New -> Low -> Mid -> High. Clients see the states by color.
@JsonSerialize(using = MasteryStateSerializer.class)
@JsonDeserialize(using = MasteryStateDeserializer.class)
public enum MasteryState {
    New("gray"),
    Low("orange"),
    Mid("yellow"),
    High("green");

    private final String color;

    MasteryState(String color) {
        this.color = color;
    }

    private static final Map<String, MasteryState> stateByColor = Arrays.stream(MasteryState.values()).collect(Collectors.toMap(state -> state.color, state -> state));

    public String getColor() {
        return color;
    }

    public static MasteryState fromColor(String color) {
        return color == null ? null : stateByColor.get(color.trim().toLowerCase());
    }

    public static boolean isValidOutcome(MasteryState outcome) {
        return outcome != null && outcome != New;
    }

    /**
     * Returns the state a problem moves to after the given outcome is recorded.
     * <p>
     * From Mid, a Low outcome advances to High exactly like a High outcome; only a repeated Mid holds the state.
     * This is the rule applied for both daily completions and manual reviews.
     */
    public MasteryState next(MasteryState outcome) {
        if (!isValidOutcome(outcome)) {
            throw new IllegalArgumentException("Invalid outcome " + outcome);
        }

        switch (this) {
            case New:
                return outcome;
            case Low:
                return outcome;
            case Mid:
                return outcome == Mid ? Mid : High;
            case High:
            default:
                return High;
        }
    }
}
