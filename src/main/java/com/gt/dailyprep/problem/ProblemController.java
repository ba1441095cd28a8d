package com.gt.dailyprep.problem;

import com.fasterxml.jackson.databind.JsonNode;
import com.gt.dailyprep.csv.ProblemCsvService;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.review.ReviewService;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.io.StringReader;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

@RestController
@RequestMapping("/rest/problems")
public class ProblemController {

    private final ProblemService problemService;
    private final ReviewService reviewService;
    private final ProblemCsvService problemCsvService;
    private final Clock clock;

    @Autowired
    public ProblemController(ProblemService problemService,
                             ReviewService reviewService,
                             ProblemCsvService problemCsvService,
                             Clock clock) {
        this.problemService = problemService;
        this.reviewService = reviewService;
        this.problemCsvService = problemCsvService;
        this.clock = clock;
    }

    @GetMapping(produces = "application/json")
    public List<ProblemSummary> getProblems(@RequestParam(value = "color") Optional<String> color,
                                            @RequestParam(value = "search") Optional<String> search) {
        MasteryState masteryState = null;
        if (color.isPresent() && !color.get().isBlank()) {
            masteryState = MasteryState.fromColor(color.get());
            if (masteryState == null) {
                throw new ValidationException("Color must be one of: gray, orange, yellow, green");
            }
        }

        return problemService.getProblems(new ProblemFilterOptions(masteryState, search.orElse("")));
    }

    @PostMapping(produces = "application/json")
    public Problem createProblem(@RequestBody NewProblem newProblem, HttpServletResponse response) {
        Problem problem = problemService.createProblem(newProblem);
        response.setStatus(HttpServletResponse.SC_CREATED);

        return problem;
    }

    @GetMapping(value = "/{problemId}", produces = "application/json")
    public ProblemDetails getProblem(@PathVariable("problemId") long problemId) {
        return problemService.getProblem(problemId);
    }

    @PatchMapping(value = "/{problemId}", produces = "application/json")
    public Problem updateProblem(@PathVariable("problemId") long problemId, @RequestBody JsonNode patch) {
        return problemService.updateProblem(problemId, toProblemUpdate(patch));
    }

    @DeleteMapping(value = "/{problemId}")
    public void deleteProblem(@PathVariable("problemId") long problemId, HttpServletResponse response) {
        problemService.deleteProblem(problemId);
        response.setStatus(HttpServletResponse.SC_NO_CONTENT);
    }

    @PostMapping(value = "/{problemId}/review", produces = "application/json")
    public Problem reviewProblem(@PathVariable("problemId") long problemId, @RequestBody ReviewProblemRequest request) {
        return reviewService.manualReview(problemId, request.colorResult(), Optional.ofNullable(request.keyInsight()), LocalDate.now(clock));
    }

    @PutMapping(value = "/{problemId}/topics", produces = "application/json")
    public ProblemDetails setProblemTopics(@PathVariable("problemId") long problemId, @RequestBody SetProblemTopicsRequest request) {
        return problemService.setProblemTopics(problemId, request.topicIds() == null ? List.of() : request.topicIds());
    }

    @PostMapping(value = "/import", consumes = { "text/csv", "text/plain" }, produces = "application/json")
    public ImportResult importProblems(@RequestBody String csvContent) {
        return problemCsvService.importProblems(new StringReader(csvContent));
    }

    @GetMapping(value = "/export")
    public void exportProblems(HttpServletResponse response) throws IOException {
        String fileName = "leetcode-problems-" + LocalDate.now(clock) + ".csv";

        response.setContentType("text/csv");
        response.setCharacterEncoding("UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=\"" + fileName + "\"");

        problemCsvService.exportProblems(response.getWriter());
    }

    // Fields missing from the patch are left alone; an explicit null clears the optional ones
    static ProblemUpdate toProblemUpdate(JsonNode patch) {
        if (patch == null || !patch.isObject()) {
            throw new ValidationException("Request body must be a JSON object");
        }

        try {
            ProblemUpdate.Builder builder = ProblemUpdate.builder();

            if (patch.has("name")) {
                builder.set(ProblemField.Name, textValue(patch, "name"));
            }
            if (patch.has("link")) {
                builder.set(ProblemField.Link, textValue(patch, "link"));
            }
            if (patch.has("masteryState")) {
                MasteryState masteryState = MasteryState.fromColor(textValue(patch, "masteryState"));
                if (masteryState == null) {
                    throw new ValidationException("Color must be one of: gray, orange, yellow, green");
                }
                builder.set(ProblemField.State, masteryState);
            }
            if (patch.has("keyInsight")) {
                builder.set(ProblemField.KeyInsight, textValue(patch, "keyInsight"));
            }
            if (patch.has("lastReviewed")) {
                String lastReviewed = textValue(patch, "lastReviewed");
                builder.set(ProblemField.LastReviewed, lastReviewed == null ? null : LocalDate.parse(lastReviewed));
            }

            return builder.build();
        } catch (DateTimeParseException ex) {
            throw new ValidationException("lastReviewed must be in ISO format (YYYY-MM-DD)");
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage());
        }
    }

    private static String textValue(JsonNode patch, String fieldName) {
        JsonNode value = patch.get(fieldName);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ValidationException(fieldName + " must be a string");
        }

        return value.asText();
    }

    private record ReviewProblemRequest(MasteryState colorResult, String keyInsight) { }
    private record SetProblemTopicsRequest(List<Long> topicIds) { }
}
