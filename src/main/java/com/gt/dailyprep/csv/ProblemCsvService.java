package com.gt.dailyprep.csv;

import com.gt.dailyprep.model.*;
import com.gt.dailyprep.problem.ProblemDao;
import com.gt.dailyprep.problem.ProblemService;
import com.gt.dailyprep.topic.TopicDao;
import com.gt.dailyprep.topic.TopicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.*;

@Component
public class ProblemCsvService {

    private static final Logger log = LoggerFactory.getLogger(ProblemCsvService.class);

    private final ProblemCsvParser problemCsvParser;
    private final ProblemCsvWriter problemCsvWriter;
    private final ProblemDao problemDao;
    private final TopicDao topicDao;
    private final TopicService topicService;

    public ProblemCsvService(ProblemCsvParser problemCsvParser,
                             ProblemCsvWriter problemCsvWriter,
                             ProblemDao problemDao,
                             TopicDao topicDao,
                             TopicService topicService) {
        this.problemCsvParser = problemCsvParser;
        this.problemCsvWriter = problemCsvWriter;
        this.problemDao = problemDao;
        this.topicDao = topicDao;
        this.topicService = topicService;
    }

    // Rows whose link is already stored, ignoring case and a trailing slash, count as duplicates and are skipped
    @Transactional
    public ImportResult importProblems(Reader reader) {
        ProblemCsvParser.ParseResult parseResult = problemCsvParser.parse(reader);

        Set<String> existingLinks = new HashSet<>();
        problemDao.loadAllLinks().forEach(link -> existingLinks.add(ProblemService.normalizeLink(link)));

        int imported = 0;
        int duplicates = 0;
        Map<String, Long> topicIdsByName = new HashMap<>();

        for (ProblemCsvParser.ParsedProblem parsedProblem : parseResult.problems()) {
            String normalizedLink = ProblemService.normalizeLink(parsedProblem.link());
            if (!existingLinks.add(normalizedLink)) {
                duplicates++;
                continue;
            }

            Problem problem = problemDao.createProblem(new NewProblem(
                    parsedProblem.name(),
                    parsedProblem.link(),
                    parsedProblem.masteryState(),
                    parsedProblem.keyInsight(),
                    parsedProblem.lastReviewed()));

            if (!parsedProblem.topicNames().isEmpty()) {
                List<Long> topicIds = new ArrayList<>();
                for (String topicName : parsedProblem.topicNames()) {
                    topicIds.add(topicIdsByName.computeIfAbsent(topicName.toLowerCase(),
                            key -> topicService.findOrCreateTopic(topicName).id()));
                }

                topicDao.setProblemTopics(problem.id(), topicIds);
            }

            imported++;
        }

        log.info("Imported {} problems, skipped {} duplicates and {} invalid rows", imported, duplicates, parseResult.errors().size());

        return new ImportResult(imported, duplicates, parseResult.errors());
    }

    public void exportProblems(Writer writer) throws IOException {
        List<Problem> problems = problemDao.loadAllProblems();
        Map<Long, List<Topic>> topicsByProblem = topicDao.loadTopicsForProblems(problems.stream().map(Problem::id).toList());

        problemCsvWriter.write(problems, topicsByProblem, writer);
    }
}
