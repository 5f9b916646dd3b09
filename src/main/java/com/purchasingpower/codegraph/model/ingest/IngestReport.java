package com.purchasingpower.codegraph.model.ingest;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of ingesting one file's parse tree.
 *
 * <p>Ingestion is best-effort: a failed node does not stop its siblings or its children.
 * Whatever did not make it into a connected hierarchy is listed here.
 */
@Getter
@ToString
public class IngestReport {

    private final String fileName;
    private boolean fileNodeCreated;
    private int persistedNodes;
    private int linkedEdges;
    private final List<SkippedNode> skipped = new ArrayList<>();
    private final List<String> unlinked = new ArrayList<>();
    private final List<String> linkFailures = new ArrayList<>();

    public IngestReport(String fileName) {
        this.fileName = fileName;
    }

    public void recordPersisted(boolean isFileNode) {
        persistedNodes++;
        if (isFileNode) {
            fileNodeCreated = true;
        }
    }

    public void recordLinked() {
        linkedEdges++;
    }

    public void recordSkipped(String name, String type, SkipReason reason, String detail) {
        skipped.add(new SkippedNode(name, type, reason, detail));
    }

    /**
     * A node that was persisted but has no persisted parent to hang from.
     */
    public void recordUnlinked(String name) {
        unlinked.add(name);
    }

    public void recordLinkFailure(String parentName, String childName) {
        linkFailures.add(parentName + " -> " + childName);
    }

    public List<SkippedNode> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public List<String> getUnlinked() {
        return Collections.unmodifiableList(unlinked);
    }

    public List<String> getLinkFailures() {
        return Collections.unmodifiableList(linkFailures);
    }

    public boolean isClean() {
        return fileNodeCreated && skipped.isEmpty() && unlinked.isEmpty() && linkFailures.isEmpty();
    }

    public enum SkipReason {
        UNKNOWN_TYPE,
        PERSISTENCE_FAILURE
    }

    public record SkippedNode(String name, String type, SkipReason reason, String detail) {
    }
}
