package com.purchasingpower.codegraph.model;

/**
 * External collaborators whose calls are logged through
 * {@link com.purchasingpower.codegraph.util.ExternalCallLogger}.
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    OLLAMA("🔵", "Ollama");

    private final String emoji;
    private final String displayName;

    ServiceType(String emoji, String displayName) {
        this.emoji = emoji;
        this.displayName = displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }
}
