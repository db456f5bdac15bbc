package com.sectracker.resolver.lookup.registry;

import com.sectracker.resolver.lookup.ProviderUnavailableException;
import com.sectracker.resolver.lookup.model.RegistryEntry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline ticker directory read from a CSV with a {@code ticker}, {@code title} (or {@code company_name})
 * and {@code cik} header.
 */
public class CsvTickerDirectoryProvider implements TickerDirectoryProvider {
    private static final Logger log = LoggerFactory.getLogger(CsvTickerDirectoryProvider.class);
    static final String PROVIDER = "ticker-directory-file";

    private final Path csvPath;

    public CsvTickerDirectoryProvider(Path csvPath) {
        this.csvPath = csvPath;
    }

    @Override
    public List<RegistryEntry> loadEntries() {
        List<RegistryEntry> entries = new ArrayList<>();
        int skipped = 0;
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String ticker = getColumn(record, "ticker", "symbol");
                String title = getColumn(record, "title", "company_name", "name");
                if (ticker == null || title == null) {
                    skipped++;
                    log.debug("csv row {} missing ticker/title", record.getRecordNumber());
                    continue;
                }
                entries.add(new RegistryEntry(ticker, title, RegistryEntry.padIdentifier(getColumn(record, "cik", "cik_str"))));
            }
        } catch (IOException e) {
            throw new ProviderUnavailableException(PROVIDER, "failed to read ticker CSV at " + csvPath + ": " + e.getMessage(), e);
        }
        log.info("Ticker CSV loaded. path={}, entries={}, skipped={}", csvPath, entries.size(), skipped);
        return entries;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
