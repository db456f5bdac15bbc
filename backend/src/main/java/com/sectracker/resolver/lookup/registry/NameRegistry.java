package com.sectracker.resolver.lookup.registry;

import com.sectracker.resolver.lookup.model.RegistryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory index over the ticker directory. The directory is loaded on first use, exactly once per
 * instance; concurrent first callers block on the load and then share the same immutable index.
 * A failed load is not cached, so the next caller tries again.
 */
@Component
public class NameRegistry {
    private static final Logger log = LoggerFactory.getLogger(NameRegistry.class);

    private final TickerDirectoryProvider provider;
    private final Object loadLock = new Object();
    private volatile Index index;

    public NameRegistry(TickerDirectoryProvider provider) {
        this.provider = provider;
    }

    public Optional<RegistryEntry> resolveTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(index().byTicker().get(ticker.trim().toUpperCase(Locale.ROOT)));
    }

    public String identifierFor(String ticker) {
        return resolveTicker(ticker).map(RegistryEntry::identifier).orElse(null);
    }

    /**
     * Normalized legal names in order of first appearance in the directory.
     */
    public List<String> allNames() {
        return index().names();
    }

    public List<RegistryEntry> entriesForName(String normalizedName) {
        List<RegistryEntry> entries = index().byName().get(normalizedName);
        return entries == null ? List.of() : entries;
    }

    public int size() {
        return index().byTicker().size();
    }

    public boolean isLoaded() {
        return index != null;
    }

    private Index index() {
        Index current = index;
        if (current != null) {
            return current;
        }
        synchronized (loadLock) {
            if (index == null) {
                long startedAt = System.nanoTime();
                index = buildIndex(provider.loadEntries());
                log.info(
                    "Name registry loaded. tickers={}, names={}, durationMs={}",
                    index.byTicker().size(),
                    index.names().size(),
                    (System.nanoTime() - startedAt) / 1_000_000
                );
            }
            return index;
        }
    }

    private Index buildIndex(List<RegistryEntry> entries) {
        Map<String, RegistryEntry> byTicker = new HashMap<>();
        Map<String, List<RegistryEntry>> byName = new LinkedHashMap<>();
        int duplicateTickers = 0;
        for (RegistryEntry entry : entries) {
            if (byTicker.putIfAbsent(entry.ticker(), entry) != null) {
                duplicateTickers++;
                continue;
            }
            String name = NameNormalizer.normalize(entry.legalName());
            if (name.isEmpty()) {
                continue;
            }
            byName.computeIfAbsent(name, ignored -> new ArrayList<>()).add(entry);
        }
        if (duplicateTickers > 0) {
            log.debug("Ignored {} duplicate ticker rows", duplicateTickers);
        }
        Map<String, List<RegistryEntry>> frozen = new LinkedHashMap<>();
        byName.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
        return new Index(
            Collections.unmodifiableMap(byTicker),
            Collections.unmodifiableMap(frozen),
            List.copyOf(frozen.keySet())
        );
    }

    private record Index(
        Map<String, RegistryEntry> byTicker,
        Map<String, List<RegistryEntry>> byName,
        List<String> names
    ) {
    }
}
