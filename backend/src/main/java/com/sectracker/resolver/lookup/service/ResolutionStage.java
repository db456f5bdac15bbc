package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.lookup.model.LookupResult;

import java.util.Optional;

/**
 * One step of the resolution cascade. Returns empty to hand the query to the next stage.
 */
public interface ResolutionStage {

    String name();

    Optional<LookupResult> attempt(ResolutionContext context);
}
