package com.sectracker.resolver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sectracker.resolver.lookup.generative.CompletionProvider;
import com.sectracker.resolver.lookup.generative.LangChainCompletionProvider;
import com.sectracker.resolver.lookup.generative.NoOpCompletionProvider;
import com.sectracker.resolver.lookup.http.PoliteHttpClient;
import com.sectracker.resolver.lookup.registry.CsvTickerDirectoryProvider;
import com.sectracker.resolver.lookup.registry.SecTickerDirectoryClient;
import com.sectracker.resolver.lookup.registry.TickerDirectoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class LookupConfig {
    private static final Logger log = LoggerFactory.getLogger(LookupConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(LookupProperties properties) {
        int size = Math.max(4, properties.getCli().getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "lookupExecutor", destroyMethod = "shutdown")
    public ExecutorService lookupExecutor(LookupProperties properties) {
        return Executors.newFixedThreadPool(properties.getCli().getConcurrency());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public TickerDirectoryProvider tickerDirectoryProvider(
        LookupProperties properties,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        String source = properties.getRegistry().getSource();
        String normalized = source == null ? "sec" : source.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("file")) {
            Path csvPath = resolvePath(properties.getRegistry().getCsvPath());
            log.info("Ticker directory source=file path={}", csvPath);
            return new CsvTickerDirectoryProvider(csvPath);
        }
        if (!normalized.equals("sec")) {
            log.warn("Unsupported ticker directory source '{}', defaulting to sec", source);
        }
        return new SecTickerDirectoryClient(properties, httpClient, objectMapper);
    }

    @Bean
    public CompletionProvider completionProvider(LookupProperties properties) {
        LookupProperties.Generative generative = properties.getGenerative();
        if (!generative.isConfigured()) {
            log.info("Generative fallback disabled (enabled={}, apiKeyPresent={})",
                generative.isEnabled(),
                generative.getApiKey() != null && !generative.getApiKey().isBlank());
            return new NoOpCompletionProvider();
        }
        return new LangChainCompletionProvider(generative);
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
