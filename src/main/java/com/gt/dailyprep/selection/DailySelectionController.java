package com.gt.dailyprep.selection;

import com.gt.dailyprep.model.EligibilityPool;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.model.Problem;
import com.gt.dailyprep.model.SelectedProblem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/daily")
public class DailySelectionController {

    private final DailySelectionService dailySelectionService;
    private final EligibilityClassifier eligibilityClassifier;
    private final Clock clock;

    @Autowired
    public DailySelectionController(DailySelectionService dailySelectionService,
                                    EligibilityClassifier eligibilityClassifier,
                                    Clock clock) {
        this.dailySelectionService = dailySelectionService;
        this.eligibilityClassifier = eligibilityClassifier;
        this.clock = clock;
    }

    @GetMapping(produces = "application/json")
    public DailySelectionResponse getTodaySelection() {
        return new DailySelectionResponse(dailySelectionService.getOrCreateTodaySelection(LocalDate.now(clock)));
    }

    @PostMapping(value = "/refresh", produces = "application/json")
    public DailySelectionResponse refreshTodaySelection() {
        return new DailySelectionResponse(dailySelectionService.refresh(LocalDate.now(clock)));
    }

    @PostMapping(value = "/{problemId}/complete", produces = "application/json")
    public SelectedProblemResponse completeProblem(@PathVariable("problemId") long problemId,
                                                   @RequestBody CompleteProblemRequest request) {
        return new SelectedProblemResponse(dailySelectionService.recordCompletion(problemId, request.colorResult(), LocalDate.now(clock)));
    }

    @PostMapping(value = "/{problemId}/replace", produces = "application/json")
    public SelectedProblemResponse replaceProblem(@PathVariable("problemId") long problemId) {
        return new SelectedProblemResponse(dailySelectionService.replace(problemId, LocalDate.now(clock)));
    }

    @GetMapping(value = "/pools", produces = "application/json")
    public Map<EligibilityPool, List<Problem>> getEligiblePools() {
        return eligibilityClassifier.loadPools(LocalDate.now(clock));
    }

    private record CompleteProblemRequest(MasteryState colorResult) { }
    private record DailySelectionResponse(List<SelectedProblem> problems) { }
    private record SelectedProblemResponse(SelectedProblem problem) { }
}
