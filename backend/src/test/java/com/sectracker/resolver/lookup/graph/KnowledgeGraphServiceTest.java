package com.sectracker.resolver.lookup.graph;

import com.sectracker.resolver.config.LookupProperties;
import com.sectracker.resolver.lookup.model.GraphEntity;
import com.sectracker.resolver.lookup.model.GraphSearchHit;
import com.sectracker.resolver.lookup.model.PublicParent;
import com.sectracker.resolver.lookup.model.SubsidiaryLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeGraphServiceTest {
    private InMemoryGraph graph;
    private KnowledgeGraphService service;

    @BeforeEach
    void setUp() {
        graph = new InMemoryGraph();
        service = new KnowledgeGraphService(new LookupProperties(), graph);
    }

    @Test
    void walksFromSubsidiaryToPublicParent() {
        graph.put(entity("Q1049511", "WhatsApp", List.of("Q380"), List.of(), false));
        graph.put(entity("Q380", "Meta Platforms", List.of(), List.of(), true));
        graph.hits.put("WhatsApp", List.of(new GraphSearchHit("Q1049511", "WhatsApp", "messaging service")));

        SubsidiaryLookup lookup = service.lookupSubsidiary("WhatsApp").orElseThrow();

        assertThat(lookup.publicParentLabel()).isEqualTo("Meta Platforms");
        assertThat(lookup.chain().labels()).containsExactly("WhatsApp", "Meta Platforms");
        assertThat(lookup.matchedEntity().id()).isEqualTo("Q1049511");
    }

    @Test
    void publiclyTradedStartIsItsOwnParent() {
        graph.put(entity("Q380", "Meta Platforms", List.of(), List.of(), true));

        PublicParent parent = service.findPublicParent("Q380").orElseThrow();

        assertThat(parent.chain().labels()).containsExactly("Meta Platforms");
    }

    @Test
    void cycleEndsWithoutResult() {
        graph.put(entity("QA", "A", List.of("QB"), List.of(), false));
        graph.put(entity("QB", "B", List.of("QA"), List.of(), false));

        assertThat(service.findPublicParent("QA")).isEmpty();
        assertThat(graph.fetches).containsExactly("QA", "QB");
    }

    @Test
    void walkIsBoundedByMaxDepth() {
        for (int i = 0; i < 10; i++) {
            graph.put(entity("Q" + i, "Level " + i, List.of("Q" + (i + 1)), List.of(), false));
        }
        graph.put(entity("Q10", "Listed Root", List.of(), List.of(), true));

        assertThat(service.findPublicParent("Q0", 5)).isEmpty();
        assertThat(graph.fetches).hasSize(5);

        graph.fetches.clear();
        assertThat(service.findPublicParent("Q6", 5)).get()
            .satisfies(parent -> assertThat(parent.chain().size()).isEqualTo(5));
    }

    @Test
    void ownedByIsPreferredOverParentOrganization() {
        graph.put(entity("Q1", "Brand", List.of("Q2"), List.of("Q3"), false));
        graph.put(entity("Q2", "Owner", List.of(), List.of(), true));
        graph.put(entity("Q3", "Parent Org", List.of(), List.of(), true));

        PublicParent parent = service.findPublicParent("Q1").orElseThrow();

        assertThat(parent.entity().label()).isEqualTo("Owner");
    }

    @Test
    void missingEntityAndDeadEndYieldNothing() {
        graph.put(entity("Q1", "Orphan", List.of(), List.of(), false));

        assertThat(service.findPublicParent("Q404")).isEmpty();
        assertThat(service.findPublicParent("Q1")).isEmpty();
    }

    @Test
    void traversalIsIdempotent() {
        graph.put(entity("Q1", "Instagram", List.of(), List.of("Q380"), false));
        graph.put(entity("Q380", "Meta Platforms", List.of(), List.of(), true));

        Optional<PublicParent> first = service.findPublicParent("Q1");
        Optional<PublicParent> second = service.findPublicParent("Q1");

        assertThat(first).isEqualTo(second);
    }

    @Test
    void fallsThroughToNextSearchHit() {
        graph.put(entity("Q1", "Dead End", List.of(), List.of(), false));
        graph.put(entity("Q2", "Brand", List.of("Q3"), List.of(), false));
        graph.put(entity("Q3", "Listed Parent", List.of(), List.of(), true));
        graph.hits.put("Brand", List.of(
            new GraphSearchHit("Q1", "Dead End", ""),
            new GraphSearchHit("Q2", "Brand", "")
        ));

        SubsidiaryLookup lookup = service.lookupSubsidiary("Brand").orElseThrow();

        assertThat(lookup.matchedEntity().id()).isEqualTo("Q2");
        assertThat(lookup.publicParentLabel()).isEqualTo("Listed Parent");
    }

    @Test
    void searchDelegatesWithLimit() {
        graph.hits.put("Meta", List.of(
            new GraphSearchHit("Q380", "Meta Platforms", "technology company"),
            new GraphSearchHit("Q2", "Meta", "prefix"),
            new GraphSearchHit("Q3", "Metaverse", "concept")
        ));

        assertThat(service.search("Meta", 2)).extracting(GraphSearchHit::id).containsExactly("Q380", "Q2");
    }

    @Test
    void noSearchHitsMeansNoLookup() {
        assertThat(service.lookupSubsidiary("Nothing Here")).isEmpty();
    }

    private static GraphEntity entity(String id, String label, List<String> ownedBy, List<String> parents, boolean traded) {
        return new GraphEntity(id, label, ownedBy, parents, traded, null, null);
    }

    private static class InMemoryGraph implements KnowledgeGraphProvider {
        private final Map<String, GraphEntity> entities = new HashMap<>();
        private final Map<String, List<GraphSearchHit>> hits = new HashMap<>();
        private final List<String> fetches = new ArrayList<>();

        void put(GraphEntity entity) {
            entities.put(entity.id(), entity);
        }

        @Override
        public List<GraphSearchHit> search(String query, int limit) {
            List<GraphSearchHit> found = hits.getOrDefault(query, List.of());
            return found.size() <= limit ? found : found.subList(0, limit);
        }

        @Override
        public Optional<GraphEntity> fetchEntity(String id) {
            fetches.add(id);
            return Optional.ofNullable(entities.get(id));
        }
    }
}
