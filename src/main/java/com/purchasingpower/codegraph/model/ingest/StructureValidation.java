package com.purchasingpower.codegraph.model.ingest;

/**
 * Connectivity counts for a repository's hierarchy.
 *
 * @param connected distinct nodes reachable from the repository via CHILD
 * @param orphaned  tracked-type nodes reachable from no repository at all
 */
public record StructureValidation(long connected, long orphaned) {

    public boolean hasOrphans() {
        return orphaned > 0;
    }
}
