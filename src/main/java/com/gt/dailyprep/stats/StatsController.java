package com.gt.dailyprep.stats;

import com.gt.dailyprep.model.DashboardStats;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/rest/stats")
public class StatsController {

    private final StatsService statsService;
    private final Clock clock;

    public StatsController(StatsService statsService, Clock clock) {
        this.statsService = statsService;
        this.clock = clock;
    }

    @GetMapping(produces = "application/json")
    public DashboardStats getStats() {
        return statsService.getStats(LocalDate.now(clock));
    }
}
