package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.match.FuzzyMatcher;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.MatchCandidate;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class DirectMatchStage implements ResolutionStage {
    private final LookupProperties properties;
    private final FuzzyMatcher matcher;

    public DirectMatchStage(LookupProperties properties, FuzzyMatcher matcher) {
        this.properties = properties;
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public Optional<LookupResult> attempt(ResolutionContext context) {
        LookupProperties.Matching matching = properties.getMatching();
        context.setDirectCandidates(matcher.match(context.getQuery(), matching.getDirectLimit()));
        Optional<MatchCandidate> best = context.bestDirectCandidate();
        if (best.isPresent() && best.get().score() >= matching.getDirectThreshold()) {
            return Optional.of(LookupResult.direct(context.getQuery(), best.get()));
        }
        return Optional.empty();
    }
}
