package com.sectracker.resolver.lookup.match;

import com.sectracker.resolver.lookup.model.MatchCandidate;
import com.sectracker.resolver.lookup.model.RegistryEntry;
import com.sectracker.resolver.lookup.registry.NameNormalizer;
import com.sectracker.resolver.lookup.registry.NameRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class FuzzyMatcher {
    private final NameRegistry registry;
    private final TokenSetSimilarity similarity = new TokenSetSimilarity();

    public FuzzyMatcher(NameRegistry registry) {
        this.registry = registry;
    }

    /**
     * Scores {@code query} against every registry name and returns the best {@code limit} names,
     * expanded to one candidate per ticker (share classes of one name share its score).
     * A query typed as an uppercase ticker symbol that is listed is returned first with score 1.0;
     * lowercase words go through name scoring only.
     * Names scoring zero are never returned; equal scores keep registry order.
     */
    public List<MatchCandidate> match(String query, int limit) {
        String normalized = NameNormalizer.normalize(query);
        if (normalized.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<MatchCandidate> candidates = new ArrayList<>();
        Set<String> seenTickers = new HashSet<>();
        tickerTokenMatch(query).ifPresent(entry -> {
            candidates.add(MatchCandidate.of(entry, 1.0));
            seenTickers.add(entry.ticker());
        });

        for (ScoredName scored : topNames(normalized, limit)) {
            for (RegistryEntry entry : registry.entriesForName(scored.name())) {
                if (seenTickers.add(entry.ticker())) {
                    candidates.add(MatchCandidate.of(entry, scored.score()));
                }
            }
        }
        return List.copyOf(candidates);
    }

    private Optional<RegistryEntry> tickerTokenMatch(String rawQuery) {
        return NameNormalizer.tickerToken(rawQuery).flatMap(registry::resolveTicker);
    }

    private List<ScoredName> topNames(String normalizedQuery, int limit) {
        List<ScoredName> scored = new ArrayList<>();
        for (String name : registry.allNames()) {
            double score = similarity.compute(normalizedQuery, name);
            if (score > 0.0) {
                scored.add(new ScoredName(name, score));
            }
        }
        // List.sort is stable, so ties stay in registry order
        scored.sort(Comparator.comparingDouble(ScoredName::score).reversed());
        return scored.size() <= limit ? scored : scored.subList(0, limit);
    }

    private record ScoredName(String name, double score) {
    }
}
