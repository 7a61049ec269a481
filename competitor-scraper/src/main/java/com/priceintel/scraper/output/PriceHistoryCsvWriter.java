package com.priceintel.scraper.output;

import com.opencsv.CSVWriter;
import com.priceintel.scraper.config.ScraperProperties;
import com.priceintel.scraper.model.PriceHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Appends price changes to one CSV file per UTC day.
 *
 * Output path pattern: {outputDir}/price_history_{yyyy-MM-dd}.csv
 * The header is written once, when the day's file is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriceHistoryCsvWriter {

    private final ScraperProperties properties;
    private final Clock clock;

    static final String[] HEADERS = {
            "link_id", "price", "currency", "availability", "recorded_at"
    };

    public synchronized void write(PriceHistoryEntry entry) {
        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve(fileNameFor(LocalDate.now(clock)));
        boolean newFile = !Files.exists(outputPath);

        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(entry));
            log.debug("Appended price change for link {} to {}", entry.getLinkId(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    static String fileNameFor(LocalDate day) {
        return String.format("price_history_%s.csv", day);
    }

    private String[] toRow(PriceHistoryEntry e) {
        return new String[]{
                str(e.getLinkId()),
                e.getPrice() == null ? "" : e.getPrice().toPlainString(),
                str(e.getCurrency()),
                String.valueOf(e.isAvailability()),
                str(e.getRecordedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
