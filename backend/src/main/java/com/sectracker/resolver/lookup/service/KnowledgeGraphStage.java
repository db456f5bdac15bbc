package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.graph.KnowledgeGraphService;
import com.sectracker.resolver.lookup.match.FuzzyMatcher;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.MatchCandidate;
import com.sectracker.resolver.lookup.model.OwnershipChain;
import com.sectracker.resolver.lookup.model.SubsidiaryLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves brands and subsidiaries through their public parent. The parent label is verified against
 * the registry; when it scores too low, labels further down the chain are tried from the root end.
 */
@Component
public class KnowledgeGraphStage implements ResolutionStage {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphStage.class);

    private final LookupProperties properties;
    private final KnowledgeGraphService graphService;
    private final FuzzyMatcher matcher;

    public KnowledgeGraphStage(LookupProperties properties, KnowledgeGraphService graphService, FuzzyMatcher matcher) {
        this.properties = properties;
        this.graphService = graphService;
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return "knowledge_graph";
    }

    @Override
    public Optional<LookupResult> attempt(ResolutionContext context) {
        Optional<SubsidiaryLookup> subsidiary = graphService.lookupSubsidiary(context.getQuery());
        if (subsidiary.isEmpty()) {
            return Optional.empty();
        }
        LookupProperties.Matching matching = properties.getMatching();
        SubsidiaryLookup found = subsidiary.get();
        OwnershipChain chain = found.chain();

        MatchCandidate best = first(matcher.match(found.publicParentLabel(), matching.getVerifyLimit()));
        if ((best == null || best.score() < matching.getGraphThreshold()) && chain.hasIntermediateNodes()) {
            List<String> labels = chain.labels();
            for (int i = labels.size() - 2; i >= 0; i--) {
                MatchCandidate retry = first(matcher.match(labels.get(i), 1));
                if (retry != null && (best == null || retry.score() > best.score())) {
                    best = retry;
                }
            }
        }

        if (best == null || best.score() < matching.getGraphThreshold()) {
            log.debug("Parent '{}' of '{}' not verified in registry (best={})",
                found.publicParentLabel(), context.getQuery(), best == null ? 0.0 : best.score());
            return Optional.empty();
        }
        return Optional.of(LookupResult.knowledgeGraph(context.getQuery(), best, matching.getGraphConfidence(), chain));
    }

    private static MatchCandidate first(List<MatchCandidate> candidates) {
        return candidates.isEmpty() ? null : candidates.get(0);
    }
}
