package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.lookup.match.FuzzyMatcher;
import com.sectracker.resolver.lookup.model.LookupMethod;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.MatchCandidate;
import com.sectracker.resolver.lookup.model.SearchResultEntry;
import com.sectracker.resolver.lookup.registry.NameRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves free-text company queries to tickers. Stages run in order (direct match, knowledge graph,
 * generative model, best-effort fallback) and the first one to produce a result wins.
 */
@Service
public class TickerLookupService {
    private static final Logger log = LoggerFactory.getLogger(TickerLookupService.class);

    private final List<ResolutionStage> stages;
    private final FuzzyMatcher matcher;
    private final NameRegistry registry;

    public TickerLookupService(
        DirectMatchStage directMatchStage,
        KnowledgeGraphStage knowledgeGraphStage,
        GenerativeStage generativeStage,
        FallbackStage fallbackStage,
        FuzzyMatcher matcher,
        NameRegistry registry
    ) {
        this.stages = List.of(directMatchStage, knowledgeGraphStage, generativeStage, fallbackStage);
        this.matcher = matcher;
        this.registry = registry;
    }

    public LookupResult lookup(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return LookupResult.unresolved(trimmed);
        }

        long startedAt = System.nanoTime();
        ResolutionContext context = new ResolutionContext(trimmed);
        for (ResolutionStage stage : stages) {
            Optional<LookupResult> result = stage.attempt(context);
            if (result.isPresent()) {
                LookupResult resolved = result.get();
                log.info(
                    "Resolved '{}' -> {} via {} (confidence={}, durationMs={})",
                    trimmed,
                    resolved.ticker(),
                    stage.name(),
                    String.format("%.3f", resolved.confidence()),
                    (System.nanoTime() - startedAt) / 1_000_000
                );
                return resolved;
            }
            log.debug("Stage {} found nothing for '{}'", stage.name(), trimmed);
        }
        log.info("Unresolved '{}' (durationMs={})", trimmed, (System.nanoTime() - startedAt) / 1_000_000);
        return LookupResult.unresolved(trimmed);
    }

    /**
     * Ranked candidates for a query. A knowledge-graph or generative resolution leads the list,
     * followed by direct fuzzy candidates; each ticker appears at most once.
     */
    public List<SearchResultEntry> search(String query, int limit) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<SearchResultEntry> results = new ArrayList<>();
        Set<String> seenTickers = new HashSet<>();

        LookupResult resolved = lookup(trimmed);
        if (resolved.isResolved()
            && (resolved.method() == LookupMethod.KNOWLEDGE_GRAPH || resolved.method() == LookupMethod.GENERATIVE)) {
            results.add(SearchResultEntry.resolved(resolved, registry.identifierFor(resolved.ticker())));
            seenTickers.add(resolved.ticker());
        }

        for (MatchCandidate candidate : matcher.match(trimmed, limit)) {
            if (results.size() >= limit) {
                break;
            }
            if (seenTickers.add(candidate.ticker())) {
                results.add(SearchResultEntry.direct(candidate));
            }
        }
        return List.copyOf(results);
    }
}
