package com.quantbacktest.symphony.accuracy;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Parses the ground-truth allocation table submitted with a backtest.
 *
 * <p>Expected layout: {@code Date,Day Traded,<TICKER>,<TICKER>...}, where each ticker cell holds a
 * percentage such as {@code 50.0%}, or {@code -} / blank when the ticker was not held.
 */
@Slf4j
public class GroundTruthCsvLoader {

    private static final String DATE_COLUMN = "Date";
    private static final String DAY_TRADED_COLUMN = "Day Traded";

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    public GroundTruth parse(String csvContent) {
        try {
            return load(new StringReader(csvContent));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private GroundTruth load(Reader source) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        String header = reader.readLine();
        if (header == null || header.isBlank()) {
            return GroundTruth.empty();
        }

        String[] columns = split(header);
        int dateIndex = -1;
        for (int i = 0; i < columns.length; i++) {
            if (DATE_COLUMN.equalsIgnoreCase(columns[i])) {
                dateIndex = i;
                break;
            }
        }
        if (dateIndex < 0) {
            throw new IllegalArgumentException("Ground truth header has no Date column: " + header);
        }

        Map<LocalDate, Set<String>> selections = new TreeMap<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String[] cells = split(line);
            LocalDate date;
            try {
                date = parseDate(cells[dateIndex]);
            } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
                log.warn("Skipping ground truth line {}: {}", lineNumber, e.getMessage());
                continue;
            }

            Set<String> held = new LinkedHashSet<>();
            for (int i = 0; i < columns.length && i < cells.length; i++) {
                if (i == dateIndex || DAY_TRADED_COLUMN.equalsIgnoreCase(columns[i]) || columns[i].isEmpty()) {
                    continue;
                }
                if (allocation(cells[i]) > 0) {
                    held.add(columns[i]);
                }
            }
            selections.put(date, held);
        }
        return GroundTruth.of(selections);
    }

    /**
     * Parses {@code "50.0%"} as 50.0; {@code "-"}, blanks and unparseable cells count as not held.
     */
    static double allocation(String cell) {
        String value = cell.trim().replace("%", "");
        if (value.isEmpty() || "-".equals(value)) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Unreadable allocation cell '{}'", cell);
            return 0.0;
        }
    }

    private static String[] split(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim().replace("\"", "");
        }
        return parts;
    }

    private static LocalDate parseDate(String value) {
        // pandas writes timestamps as "2024-01-02 00:00:00"
        String datePart = value.trim().split(" ")[0];
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(datePart, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date {} does not match {}", datePart, formatter);
            }
        }
        throw new IllegalArgumentException("Unable to parse date: " + value);
    }
}
