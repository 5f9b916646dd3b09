package com.purchasingpower.codegraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which strategy produced (or last reinforced) a retrieval result.
 */
public enum SearchType {
    SUMMARY,
    CODE,
    GRAPH,
    HYBRID,
    RELATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
