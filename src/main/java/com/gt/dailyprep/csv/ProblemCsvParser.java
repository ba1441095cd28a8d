package com.gt.dailyprep.csv;

import com.gt.dailyprep.model.ImportError;
import com.gt.dailyprep.model.MasteryState;
import com.gt.dailyprep.problem.ProblemService;
import com.gt.dailyprep.topic.TopicService;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Reads problems from CSV with the columns Problem, Link, Color, LastReviewed, KeyInsight and Topics. Header names are
 * matched case-insensitively and any column but Problem and Link may be left out. Each row is validated on its own;
 * a bad row is reported and skipped without affecting the others.
 */
@Component
public class ProblemCsvParser {

    private static final Logger log = LoggerFactory.getLogger(ProblemCsvParser.class);

    public static final String PROBLEM_COLUMN = "Problem";
    public static final String LINK_COLUMN = "Link";
    public static final String COLOR_COLUMN = "Color";
    public static final String LAST_REVIEWED_COLUMN = "LastReviewed";
    public static final String KEY_INSIGHT_COLUMN = "KeyInsight";
    public static final String TOPICS_COLUMN = "Topics";

    private static final Pattern ISO_DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TOPIC_SEPARATOR_PATTERN = Pattern.compile("[,;]");

    private static final CSVFormat IMPORT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setAllowMissingColumnNames(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    public ParseResult parse(Reader reader) {
        List<ParsedProblem> problems = new ArrayList<>();
        List<ImportError> errors = new ArrayList<>();
        Set<String> seenLinks = new HashSet<>();

        try (CSVParser parser = IMPORT_FORMAT.parse(reader)) {
            int rowNumber = 1;

            for (CSVRecord record : parser) {
                rowNumber++;

                try {
                    ParsedProblem problem = parseRecord(record, seenLinks);

                    seenLinks.add(ProblemService.normalizeLink(problem.link()));
                    problems.add(problem);
                } catch (RowException ex) {
                    errors.add(new ImportError(rowNumber, ex.getMessage()));
                }
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            log.warn("Failed to parse CSV import", ex);
            return new ParseResult(List.of(), List.of(new ImportError(0, "Failed to parse CSV: " + ex.getMessage())));
        }

        return new ParseResult(problems, errors);
    }

    private static ParsedProblem parseRecord(CSVRecord record, Set<String> seenLinks) {
        String name = sanitizeField(value(record, PROBLEM_COLUMN));
        String link = sanitizeField(value(record, LINK_COLUMN));
        String colorValue = value(record, COLOR_COLUMN);
        String lastReviewedValue = value(record, LAST_REVIEWED_COLUMN);
        String keyInsight = sanitizeField(value(record, KEY_INSIGHT_COLUMN));
        String topicsValue = value(record, TOPICS_COLUMN);

        if (name.isEmpty()) {
            throw new RowException("Problem name is required");
        }
        if (link.isEmpty()) {
            throw new RowException("Link is required");
        }
        if (name.length() > ProblemService.MAX_NAME_LENGTH) {
            throw new RowException("Problem name exceeds maximum length of " + ProblemService.MAX_NAME_LENGTH + " characters");
        }
        if (link.length() > ProblemService.MAX_LINK_LENGTH) {
            throw new RowException("URL exceeds maximum length of " + ProblemService.MAX_LINK_LENGTH + " characters");
        }
        if (keyInsight.length() > ProblemService.MAX_KEY_INSIGHT_LENGTH) {
            throw new RowException("Key insight exceeds maximum length of " + ProblemService.MAX_KEY_INSIGHT_LENGTH + " characters");
        }
        if (!isHttpUrl(link)) {
            throw new RowException("Invalid URL format. Must be http:// or https://");
        }
        if (seenLinks.contains(ProblemService.normalizeLink(link))) {
            throw new RowException("Duplicate link: " + link);
        }

        MasteryState masteryState = MasteryState.New;
        if (!colorValue.isEmpty()) {
            masteryState = MasteryState.fromColor(colorValue);
            if (masteryState == null) {
                throw new RowException("Invalid color: " + colorValue + ". Must be one of: gray, orange, yellow, green");
            }
        }

        LocalDate lastReviewed = null;
        if (!lastReviewedValue.isEmpty()) {
            lastReviewed = parseDate(lastReviewedValue);
        }

        return new ParsedProblem(name, link, masteryState, lastReviewed, keyInsight.isEmpty() ? null : keyInsight, parseTopicNames(topicsValue));
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            return "";
        }

        String value = record.get(column);
        return value == null ? "" : value.trim();
    }

    // Prefix values a spreadsheet would evaluate as a formula
    static String sanitizeField(String value) {
        if (value == null || value.isEmpty()) {
            return value == null ? "" : value;
        }

        char first = value.charAt(0);
        if (first == '=' || first == '+' || first == '-' || first == '@' || first == '\t' || first == '\r') {
            return "'" + value;
        }

        return value;
    }

    private static boolean isHttpUrl(String link) {
        try {
            URI uri = new URI(link);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();

            return (scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null;
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private static LocalDate parseDate(String value) {
        if (!ISO_DATE_PATTERN.matcher(value).matches()) {
            throw new RowException("Invalid date format: " + value + ". Expected YYYY-MM-DD");
        }

        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new RowException("Invalid date format: " + value + ". Expected YYYY-MM-DD");
        }
    }

    private static List<String> parseTopicNames(String value) {
        if (value.isEmpty()) {
            return List.of();
        }

        Set<String> topicNames = new LinkedHashSet<>();
        for (String topicName : TOPIC_SEPARATOR_PATTERN.split(value)) {
            String trimmedName = topicName.trim();

            if (trimmedName.length() > TopicService.MAX_TOPIC_NAME_LENGTH) {
                throw new RowException("Topic name must be " + TopicService.MAX_TOPIC_NAME_LENGTH + " characters or less");
            }
            if (!trimmedName.isEmpty()) {
                topicNames.add(trimmedName);
            }
        }

        return List.copyOf(topicNames);
    }

    public record ParsedProblem(String name,
                                String link,
                                MasteryState masteryState,
                                LocalDate lastReviewed,
                                String keyInsight,
                                List<String> topicNames) { }

    public record ParseResult(List<ParsedProblem> problems, List<ImportError> errors) { }

    private static class RowException extends RuntimeException {
        RowException(String msg) {
            super(msg);
        }
    }
}
