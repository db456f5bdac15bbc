package com.sectracker.resolver.lookup.service;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.ProviderUnavailableException;
import com.sectracker.resolver.lookup.model.LookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

@Component
public class LookupCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(LookupCliRunner.class);

    private final LookupProperties properties;
    private final TickerLookupService lookupService;
    private final ExecutorService lookupExecutor;
    private final ConfigurableApplicationContext applicationContext;

    public LookupCliRunner(
        LookupProperties properties,
        TickerLookupService lookupService,
        @Qualifier("lookupExecutor") ExecutorService lookupExecutor,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.lookupService = lookupService;
        this.lookupExecutor = lookupExecutor;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<LookupResult> results = resolveAll(parseQueries(properties.getCli().getQueries()));
        int resolved = (int) results.stream().filter(LookupResult::isResolved).count();
        log.info("Lookup run completed: queries={}, resolved={}", results.size(), resolved);

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    List<LookupResult> resolveAll(List<String> queries) {
        List<Future<LookupResult>> futures = new ArrayList<>();
        for (String query : queries) {
            futures.add(lookupExecutor.submit(() -> lookupService.lookup(query)));
        }

        List<LookupResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String query = queries.get(i);
            try {
                LookupResult result = futures.get(i).get();
                results.add(result);
                log.info(
                    "Result '{}': ticker={}, company={}, method={}, confidence={}, chain={}",
                    query,
                    result.ticker(),
                    result.companyName(),
                    result.method().wireName(),
                    String.format("%.3f", result.confidence()),
                    result.chain() == null ? List.of() : result.chain().labels()
                );
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Lookup run interrupted at '{}'", query);
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ProviderUnavailableException unavailable) {
                    log.warn("Lookup '{}' failed: provider {} unavailable: {}", query, unavailable.getProvider(), unavailable.getMessage());
                } else {
                    log.error("Lookup '{}' failed", query, cause);
                }
            }
        }
        return results;
    }

    static List<String> parseQueries(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
