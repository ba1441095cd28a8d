package com.gt.dailyprep.model;

import java.util.Collections;
import java.util.List;

public record ProblemDetails(Problem problem, List<Topic> topics, List<Attempt> attempts) {

    public ProblemDetails {
        topics = Collections.unmodifiableList(topics);
        attempts = Collections.unmodifiableList(attempts);
    }
}
