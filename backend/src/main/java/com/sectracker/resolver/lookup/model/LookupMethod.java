package com.sectracker.resolver.lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LookupMethod {
    DIRECT("direct"),
    KNOWLEDGE_GRAPH("knowledge_graph"),
    GENERATIVE("generative"),
    FALLBACK("fallback");

    private final String wireName;

    LookupMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
