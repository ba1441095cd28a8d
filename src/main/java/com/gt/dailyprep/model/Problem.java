package com.gt.dailyprep.model;

import java.time.Instant;
import java.time.LocalDate;

public record Problem(long id,
                      String name,
                      String link,
                      MasteryState masteryState,
                      String keyInsight,
                      LocalDate lastReviewed,
                      int reviewCount,
                      Instant createInstant) { }
