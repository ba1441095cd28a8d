package com.gt.dailyprep.problem;

import com.gt.dailyprep.exception.DuplicateEntryException;
import com.gt.dailyprep.exception.ProblemNotFoundException;
import com.gt.dailyprep.exception.ValidationException;
import com.gt.dailyprep.model.*;
import com.gt.dailyprep.review.AttemptDao;
import com.gt.dailyprep.topic.TopicDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

@Component
public class ProblemService {

    private static final Logger log = LoggerFactory.getLogger(ProblemService.class);

    public static final int MAX_NAME_LENGTH = 500;
    public static final int MAX_LINK_LENGTH = 2048;
    public static final int MAX_KEY_INSIGHT_LENGTH = 5000;

    private final ProblemDao problemDao;
    private final AttemptDao attemptDao;
    private final TopicDao topicDao;

    public ProblemService(ProblemDao problemDao, AttemptDao attemptDao, TopicDao topicDao) {
        this.problemDao = problemDao;
        this.attemptDao = attemptDao;
        this.topicDao = topicDao;
    }

    public Problem createProblem(NewProblem newProblem) {
        String name = validateName(newProblem.name());
        String link = validateLink(newProblem.link());
        String keyInsight = validateKeyInsight(newProblem.keyInsight());
        MasteryState masteryState = newProblem.masteryState() == null ? MasteryState.New : newProblem.masteryState();

        if (problemDao.findProblemIdByLink(link) != null) {
            throw new DuplicateEntryException("A problem with this link already exists");
        }

        Problem problem = problemDao.createProblem(new NewProblem(name, link, masteryState, keyInsight, newProblem.lastReviewed()));
        log.info("Created problem {} ({})", problem.id(), problem.link());

        return problem;
    }

    public ProblemDetails getProblem(long problemId) {
        Problem problem = loadProblem(problemId);

        return new ProblemDetails(
                problem,
                topicDao.loadTopicsForProblems(List.of(problemId)).getOrDefault(problemId, List.of()),
                attemptDao.loadAttempts(problemId));
    }

    public List<ProblemSummary> getProblems(ProblemFilterOptions filterOptions) {
        return problemDao.loadProblemSummaries(filterOptions == null ? ProblemFilterOptions.NO_FILTERS : filterOptions);
    }

    @Transactional
    public Problem updateProblem(long problemId, ProblemUpdate problemUpdate) {
        if (problemUpdate.isEmpty()) {
            throw new ValidationException("At least one field must be provided for update");
        }

        loadProblem(problemId);
        ProblemUpdate validatedUpdate = validateUpdate(problemUpdate);

        if (validatedUpdate.contains(ProblemField.Link)) {
            Long existingId = problemDao.findProblemIdByLink((String) validatedUpdate.get(ProblemField.Link));
            if (existingId != null && existingId != problemId) {
                throw new DuplicateEntryException("A problem with this link already exists");
            }
        }

        problemDao.updateProblem(problemId, validatedUpdate);
        log.info("Updated problem {} with {}", problemId, validatedUpdate.values().keySet());

        return problemDao.loadProblem(problemId);
    }

    @Transactional
    public void deleteProblem(long problemId) {
        if (problemDao.deleteProblem(problemId) == 0) {
            throw new ProblemNotFoundException("Problem " + problemId + " not found");
        }

        log.info("Deleted problem {} with its attempts, selections and topic links", problemId);
    }

    @Transactional
    public ProblemDetails setProblemTopics(long problemId, Collection<Long> topicIds) {
        loadProblem(problemId);

        Set<Long> distinctTopicIds = new LinkedHashSet<>(topicIds);
        if (topicDao.loadTopics(distinctTopicIds).size() != distinctTopicIds.size()) {
            throw new ValidationException("One or more topic ids are invalid");
        }

        topicDao.setProblemTopics(problemId, distinctTopicIds);

        return getProblem(problemId);
    }

    private Problem loadProblem(long problemId) {
        Problem problem = problemDao.loadProblem(problemId);
        if (problem == null) {
            throw new ProblemNotFoundException("Problem " + problemId + " not found");
        }

        return problem;
    }

    private static ProblemUpdate validateUpdate(ProblemUpdate problemUpdate) {
        ProblemUpdate.Builder builder = ProblemUpdate.builder();

        for (Map.Entry<ProblemField, Object> entry : problemUpdate.values().entrySet()) {
            Object value = entry.getValue();

            switch (entry.getKey()) {
                case Name:
                    builder.set(ProblemField.Name, validateName((String) value));
                    break;
                case Link:
                    builder.set(ProblemField.Link, validateLink((String) value));
                    break;
                case KeyInsight:
                    builder.set(ProblemField.KeyInsight, validateKeyInsight((String) value));
                    break;
                default:
                    builder.set(entry.getKey(), value);
            }
        }

        return builder.build();
    }

    public static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name cannot be empty");
        }

        String trimmedName = name.trim();
        if (trimmedName.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Name exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }

        return trimmedName;
    }

    public static String validateLink(String link) {
        if (link == null || link.isBlank()) {
            throw new ValidationException("Link cannot be empty");
        }

        String trimmedLink = link.trim();
        if (trimmedLink.length() > MAX_LINK_LENGTH) {
            throw new ValidationException("URL exceeds maximum length of " + MAX_LINK_LENGTH + " characters");
        }

        URI uri;
        try {
            uri = new URI(trimmedLink);
        } catch (URISyntaxException ex) {
            throw new ValidationException("Link must be a valid URL");
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new ValidationException("Link must be a valid HTTP or HTTPS URL");
        }

        return trimmedLink;
    }

    // Blank insights are stored as null
    public static String validateKeyInsight(String keyInsight) {
        if (keyInsight == null || keyInsight.isBlank()) {
            return null;
        }
        if (keyInsight.length() > MAX_KEY_INSIGHT_LENGTH) {
            throw new ValidationException("Key insight exceeds maximum length of " + MAX_KEY_INSIGHT_LENGTH + " characters");
        }

        return keyInsight;
    }

    // Links compare case-insensitively and ignore a trailing slash when checking for duplicates on import
    public static String normalizeLink(String link) {
        String normalized = link.trim().toLowerCase();

        return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }
}
