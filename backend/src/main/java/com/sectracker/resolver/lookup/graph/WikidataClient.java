package com.sectracker.resolver.lookup.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.ProviderUnavailableException;
import com.sectracker.resolver.lookup.http.PoliteHttpClient;
import com.sectracker.resolver.lookup.model.GraphEntity;
import com.sectracker.resolver.lookup.model.GraphSearchHit;
import com.sectracker.resolver.lookup.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class WikidataClient implements KnowledgeGraphProvider {
    private static final Logger log = LoggerFactory.getLogger(WikidataClient.class);
    static final String PROVIDER = "wikidata";
    private static final String JSON_ACCEPT = "application/json";
    private static final String UNKNOWN_LABEL = "Unknown";

    static final String P_OWNED_BY = "P127";
    static final String P_PARENT_ORG = "P749";
    static final String P_STOCK_EXCHANGE = "P414";
    static final String P_TICKER = "P249";
    static final String P_ISIN = "P946";

    private final LookupProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WikidataClient(LookupProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<GraphSearchHit> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        LookupProperties.Graph graph = properties.getGraph();
        String url = graph.getApiUrl()
            + "?action=wbsearchentities"
            + "&search=" + encode(query.trim())
            + "&language=" + encode(graph.getLanguage())
            + "&type=item"
            + "&format=json"
            + "&limit=" + Math.max(1, limit);
        HttpFetchResult fetch = httpClient.get(url, JSON_ACCEPT);
        if (!fetch.isSuccessful() || !fetch.hasBody()) {
            log.warn("Wikidata search failed: status={}, errorCode={}", fetch.statusCode(), fetch.errorCode());
            throw ProviderUnavailableException.fromFetch(PROVIDER, fetch);
        }

        JsonNode root = parse(fetch.body());
        List<GraphSearchHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("search")) {
            String id = item.path("id").asText(null);
            if (id == null || id.isBlank()) {
                continue;
            }
            hits.add(new GraphSearchHit(
                id,
                item.path("label").asText(""),
                item.path("description").asText("")
            ));
        }
        log.debug("Wikidata search '{}' returned {} hits", query, hits.size());
        return hits;
    }

    @Override
    public Optional<GraphEntity> fetchEntity(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String url = properties.getGraph().getEntityUrl() + "/" + encode(id.trim()) + ".json";
        HttpFetchResult fetch = httpClient.get(url, JSON_ACCEPT);
        if (fetch.isNotFound()) {
            return Optional.empty();
        }
        if (!fetch.isSuccessful() || !fetch.hasBody()) {
            log.warn("Wikidata entity fetch failed: id={}, status={}, errorCode={}", id, fetch.statusCode(), fetch.errorCode());
            throw ProviderUnavailableException.fromFetch(PROVIDER, fetch);
        }

        JsonNode entities = parse(fetch.body()).path("entities");
        JsonNode entity = entities.path(id);
        if (entity.isMissingNode() && entities.size() == 1) {
            // redirected ids come back keyed by their target
            entity = entities.elements().next();
        }
        if (entity.isMissingNode() || !entity.isObject() || entity.has("missing")) {
            return Optional.empty();
        }

        String entityId = entity.path("id").asText(id);
        List<String> exchanges = claimIds(entity, P_STOCK_EXCHANGE);
        String ticker = claimString(entity, P_TICKER);
        if (ticker == null) {
            ticker = qualifierString(entity, P_STOCK_EXCHANGE, P_TICKER);
        }
        return Optional.of(new GraphEntity(
            entityId,
            label(entity),
            claimIds(entity, P_OWNED_BY),
            claimIds(entity, P_PARENT_ORG),
            !exchanges.isEmpty(),
            ticker,
            claimString(entity, P_ISIN)
        ));
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(PROVIDER, "failed to parse Wikidata response: " + e.getOriginalMessage(), e);
        }
    }

    private String label(JsonNode entity) {
        String language = properties.getGraph().getLanguage();
        String value = entity.path("labels").path(language).path("value").asText(null);
        return value == null || value.isBlank() ? UNKNOWN_LABEL : value;
    }

    private List<String> claimIds(JsonNode entity, String property) {
        List<String> ids = new ArrayList<>();
        for (JsonNode claim : entity.path("claims").path(property)) {
            JsonNode value = claim.path("mainsnak").path("datavalue").path("value");
            String id = value.isObject() ? value.path("id").asText(null) : null;
            if (id != null && !id.isBlank()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private String claimString(JsonNode entity, String property) {
        for (JsonNode claim : entity.path("claims").path(property)) {
            JsonNode value = claim.path("mainsnak").path("datavalue").path("value");
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private String qualifierString(JsonNode entity, String property, String qualifier) {
        for (JsonNode claim : entity.path("claims").path(property)) {
            for (JsonNode snak : claim.path("qualifiers").path(qualifier)) {
                JsonNode value = snak.path("datavalue").path("value");
                if (value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        return null;
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
