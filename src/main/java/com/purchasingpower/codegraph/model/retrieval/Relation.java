package com.purchasingpower.codegraph.model.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Position of an enrichment result relative to the ranked node it was found from.
 */
public enum Relation {
    CHILD,
    PARENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
