package com.sectracker.resolver.lookup.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.ProviderUnavailableException;
import com.sectracker.resolver.lookup.http.PoliteHttpClient;
import com.sectracker.resolver.lookup.model.HttpFetchResult;
import com.sectracker.resolver.lookup.model.RegistryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the SEC {@code company_tickers.json} listing: an object keyed by row index whose values
 * carry {@code cik_str}, {@code ticker} and {@code title}.
 */
public class SecTickerDirectoryClient implements TickerDirectoryProvider {
    private static final Logger log = LoggerFactory.getLogger(SecTickerDirectoryClient.class);
    static final String PROVIDER = "sec-ticker-directory";

    private final LookupProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SecTickerDirectoryClient(LookupProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RegistryEntry> loadEntries() {
        String url = properties.getRegistry().getSecCompanyTickersUrl();
        if (url == null || url.isBlank()) {
            throw new ProviderUnavailableException(PROVIDER, "sec company tickers URL is blank");
        }
        HttpFetchResult fetch = httpClient.get(url, "application/json,*/*;q=0.8");
        if (!fetch.isSuccessful() || !fetch.hasBody()) {
            log.warn("SEC ticker directory fetch failed: status={}, errorCode={}", fetch.statusCode(), fetch.errorCode());
            throw ProviderUnavailableException.fromFetch(PROVIDER, fetch);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(PROVIDER, "failed to parse SEC tickers JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProviderUnavailableException(PROVIDER, "SEC tickers payload was not a JSON object");
        }

        List<RegistryEntry> entries = new ArrayList<>(root.size());
        int skipped = 0;
        for (Map.Entry<String, JsonNode> row : iterable(root.fields())) {
            JsonNode value = row.getValue();
            String ticker = blankToNull(value.path("ticker").asText(null));
            String title = blankToNull(value.path("title").asText(null));
            if (ticker == null || title == null) {
                skipped++;
                log.debug("SEC record {} missing ticker/title", row.getKey());
                continue;
            }
            entries.add(new RegistryEntry(ticker, title, RegistryEntry.padIdentifier(value.path("cik_str").asText(null))));
        }
        log.info("SEC ticker directory fetched. entries={}, skipped={}, durationMs={}",
            entries.size(), skipped, fetch.duration().toMillis());
        return entries;
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private <T> Iterable<T> iterable(Iterator<T> iterator) {
        return () -> iterator;
    }
}
