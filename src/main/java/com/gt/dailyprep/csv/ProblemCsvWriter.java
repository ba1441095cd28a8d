package com.gt.dailyprep.csv;

import com.gt.dailyprep.model.Problem;
import com.gt.dailyprep.model.Topic;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class ProblemCsvWriter {

    private static final String[] EXPORT_HEADERS = {
            ProblemCsvParser.PROBLEM_COLUMN,
            ProblemCsvParser.LINK_COLUMN,
            ProblemCsvParser.COLOR_COLUMN,
            ProblemCsvParser.LAST_REVIEWED_COLUMN,
            ProblemCsvParser.KEY_INSIGHT_COLUMN,
            ProblemCsvParser.TOPICS_COLUMN
    };

    public void write(List<Problem> problems, Map<Long, List<Topic>> topicsByProblem, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(EXPORT_HEADERS).build());

        for (Problem problem : problems) {
            String topicNames = topicsByProblem.getOrDefault(problem.id(), List.of()).stream()
                    .map(Topic::name)
                    .collect(Collectors.joining(", "));

            printer.printRecord(
                    ProblemCsvParser.sanitizeField(problem.name()),
                    ProblemCsvParser.sanitizeField(problem.link()),
                    problem.masteryState().getColor(),
                    problem.lastReviewed() == null ? "" : problem.lastReviewed().toString(),
                    ProblemCsvParser.sanitizeField(problem.keyInsight()),
                    ProblemCsvParser.sanitizeField(topicNames));
        }

        printer.flush();
    }
}
