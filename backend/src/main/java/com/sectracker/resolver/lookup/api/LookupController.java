package com.sectracker.resolver.lookup.api;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.model.LookupResult;
import com.sectracker.resolver.lookup.model.RegistryEntry;
import com.sectracker.resolver.lookup.model.SearchResultEntry;
import com.sectracker.resolver.lookup.registry.NameRegistry;
import com.sectracker.resolver.lookup.service.TickerLookupService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class LookupController {
    private final TickerLookupService lookupService;
    private final NameRegistry registry;
    private final LookupProperties properties;

    public LookupController(TickerLookupService lookupService, NameRegistry registry, LookupProperties properties) {
        this.lookupService = lookupService;
        this.registry = registry;
        this.properties = properties;
    }

    @GetMapping("/lookup")
    public LookupResult lookup(@RequestParam(name = "q", required = false, defaultValue = "") String query) {
        return lookupService.lookup(query);
    }

    @GetMapping("/search")
    public List<SearchResultEntry> search(
        @RequestParam(name = "q", required = false, defaultValue = "") String query,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        int requested = limit == null ? properties.getApi().getDefaultSearchLimit() : limit;
        if (requested < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be >= 1");
        }
        return lookupService.search(query, Math.min(requested, properties.getApi().getMaxSearchLimit()));
    }

    @GetMapping("/registry/{ticker}")
    public RegistryEntry registryEntry(@PathVariable("ticker") String ticker) {
        return registry.resolveTicker(ticker)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "unknown ticker: " + ticker));
    }
}
