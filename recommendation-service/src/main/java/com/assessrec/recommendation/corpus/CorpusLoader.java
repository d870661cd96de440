package com.assessrec.recommendation.corpus;

import com.assessrec.recommendation.model.AssessmentRecord;
import com.assessrec.recommendation.model.TestType;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads assessment records from a CSV file with a header row.
 */
public class CorpusLoader {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);
    private static final List<String> REQUIRED_COLUMNS = List.of("name", "url", "test_type", "duration_mins");

    private final CsvMapper csvMapper = new CsvMapper();

    public List<AssessmentRecord> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new CorpusConfigurationException("corpus file not found: " + describe(resource));
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<AssessmentRecord> records = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int unknownTypes = 0;

        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                     .with(schema)
                     .readValues(in)) {
            int rowNumber = 0;
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                rowNumber++;
                if (rowNumber == 1) {
                    requireColumns(row);
                }
                AssessmentRecord record = toRecord(row, rowNumber);
                if (!seenUrls.add(record.getUrl())) {
                    log.warn("corpus row={} skipped: duplicate url={}", rowNumber, record.getUrl());
                    continue;
                }
                if (record.getTestType() == TestType.OTHER) {
                    unknownTypes++;
                }
                records.add(record);
            }
        } catch (CorpusConfigurationException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new CorpusConfigurationException("failed to read corpus " + describe(resource) + ": " + ex.getMessage(), ex);
        }

        if (records.isEmpty()) {
            throw new CorpusConfigurationException("corpus " + describe(resource) + " has no records");
        }
        if (unknownTypes > 0) {
            log.warn("corpus has {} records with an unknown test_type", unknownTypes);
        }
        log.info("corpus loaded source={} records={}", describe(resource), records.size());
        return records;
    }

    private static void requireColumns(Map<String, String> firstRow) {
        for (String column : REQUIRED_COLUMNS) {
            if (!firstRow.containsKey(column)) {
                throw new CorpusConfigurationException("corpus is missing required column '" + column + "'");
            }
        }
    }

    private static AssessmentRecord toRecord(Map<String, String> row, int rowNumber) {
        String url = trimToEmpty(row.get("url"));
        if (url.isEmpty()) {
            throw new CorpusConfigurationException("corpus row " + rowNumber + " has no url");
        }
        String id = trimToEmpty(row.get("id"));
        return new AssessmentRecord(
                id.isEmpty() ? String.valueOf(rowNumber) : id,
                trimToEmpty(row.get("name")),
                url,
                TestType.fromCode(row.get("test_type")),
                parseDuration(row.get("duration_mins"), rowNumber),
                parseSkills(row.get("skills")),
                trimToEmpty(row.get("description")),
                isYes(row.get("adaptive_support")),
                isYes(row.get("remote_support"))
        );
    }

    private static int parseDuration(String raw, int rowNumber) {
        String value = trimToEmpty(raw);
        int minutes;
        try {
            minutes = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            try {
                // spreadsheet exports write whole minutes as "30.0"
                minutes = (int) Double.parseDouble(value);
            } catch (NumberFormatException nested) {
                throw new CorpusConfigurationException(
                        "corpus row " + rowNumber + " has a non-numeric duration '" + value + "'", nested);
            }
        }
        if (minutes < 0) {
            throw new CorpusConfigurationException("corpus row " + rowNumber + " has a negative duration");
        }
        return minutes;
    }

    private static List<String> parseSkills(String raw) {
        String value = trimToEmpty(raw);
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static boolean isYes(String raw) {
        return "yes".equalsIgnoreCase(trimToEmpty(raw));
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String describe(Resource resource) {
        return resource == null ? "<none>" : resource.getDescription();
    }
}
