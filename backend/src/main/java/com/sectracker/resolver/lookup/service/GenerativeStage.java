package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.generative.GenerativeIdentifier;
import com.sectracker.resolver.lookup.match.FuzzyMatcher;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.MatchCandidate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class GenerativeStage implements ResolutionStage {
    private final LookupProperties properties;
    private final GenerativeIdentifier identifier;
    private final FuzzyMatcher matcher;

    public GenerativeStage(LookupProperties properties, GenerativeIdentifier identifier, FuzzyMatcher matcher) {
        this.properties = properties;
        this.identifier = identifier;
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return "generative";
    }

    @Override
    public Optional<LookupResult> attempt(ResolutionContext context) {
        Optional<String> suggested = identifier.identify(context.getQuery());
        if (suggested.isEmpty()) {
            return Optional.empty();
        }
        LookupProperties.Matching matching = properties.getMatching();
        List<MatchCandidate> candidates = matcher.match(suggested.get(), matching.getVerifyLimit());
        if (candidates.isEmpty() || candidates.get(0).score() < matching.getGraphThreshold()) {
            return Optional.empty();
        }
        return Optional.of(LookupResult.generative(context.getQuery(), candidates.get(0), matching.getGenerativeConfidence()));
    }
}
