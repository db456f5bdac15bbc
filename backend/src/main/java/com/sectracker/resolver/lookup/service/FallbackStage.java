package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.model.LookupResult;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last resort: the best direct candidate, provided it clears the fallback floor.
 */
@Component
public class FallbackStage implements ResolutionStage {
    private final LookupProperties properties;

    public FallbackStage(LookupProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return "fallback";
    }

    @Override
    public Optional<LookupResult> attempt(ResolutionContext context) {
        double floor = properties.getMatching().getFallbackMinScore();
        return context.bestDirectCandidate()
            .filter(candidate -> candidate.score() >= floor)
            .map(candidate -> LookupResult.fallback(context.getQuery(), candidate));
    }
}
