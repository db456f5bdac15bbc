package com.sectracker.resolver.lookup.model;

public record GraphSearchHit(String id, String label, String description) {
}
