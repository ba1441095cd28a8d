package com.gt.dailyprep.model;

import java.time.Instant;

public record Topic(long id, String name, Instant createInstant) { }
