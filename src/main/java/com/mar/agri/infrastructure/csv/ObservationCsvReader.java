package com.mar.agri.infrastructure.csv;

import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import com.mar.agri.domain.model.MarketObservation;

/**
 * Reads the market price table (Agmarknet column layout) into observations.
 * Rows with an unparseable date or a missing/non-positive modal price are skipped.
 */
@Slf4j
public class ObservationCsvReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreSurroundingSpaces(true)
        .build();

    private final List<DateTimeFormatter> dateFormats;

    public ObservationCsvReader(List<String> datePatterns) {
        this.dateFormats = datePatterns.stream().map(DateTimeFormatter::ofPattern).toList();
    }

    public List<MarketObservation> read(Path path) throws IOException {
        try (Reader in = Files.newBufferedReader(path)) {
            return read(in);
        }
    }

    public List<MarketObservation> read(Reader in) throws IOException {
        List<MarketObservation> out = new ArrayList<>();
        int skipped = 0;
        try (CSVParser parser = FORMAT.parse(in)) {
            for (CSVRecord row : parser) {
                MarketObservation obs = toObservation(row);
                if (obs == null) {
                    skipped++;
                    continue;
                }
                out.add(obs);
            }
        }
        if (skipped > 0) {
            log.warn("DATA | skipped {} malformed rows", skipped);
        }
        return out;
    }

    private MarketObservation toObservation(CSVRecord row) {
        String commodity = text(row, "Commodity");
        LocalDate date = parseDate(text(row, "Arrival_Date"));
        Double modal = number(row, "Modal_Price");
        if (commodity == null || date == null || modal == null || modal <= 0) {
            return null;
        }
        return new MarketObservation(
            commodity,
            text(row, "State"),
            text(row, "District"),
            text(row, "Market"),
            text(row, "Variety"),
            text(row, "Grade"),
            date,
            number(row, "Min_Price"),
            number(row, "Max_Price"),
            modal
        );
    }

    LocalDate parseDate(String value) {
        if (value == null) return null;
        for (DateTimeFormatter f : dateFormats) {
            try {
                return LocalDate.parse(value, f);
            } catch (DateTimeParseException e) {
                log.trace("date '{}' does not match {}", value, f);
            }
        }
        return null;
    }

    private static String text(CSVRecord row, String column) {
        if (!row.isSet(column)) return null;
        String v = row.get(column);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static Double number(CSVRecord row, String column) {
        String v = text(row, column);
        if (v == null) return null;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            log.trace("{} '{}' is not a number", column, v);
            return null;
        }
    }
}
