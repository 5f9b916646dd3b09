package com.purchasingpower.codegraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.model.graph.CodeNode;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.graph.ParsedFile;
import com.purchasingpower.codegraph.model.graph.ParsedNode;
import com.purchasingpower.codegraph.model.graph.RepositoryNode;
import com.purchasingpower.codegraph.model.ingest.IngestReport;
import com.purchasingpower.codegraph.model.ingest.IngestReport.SkipReason;
import com.purchasingpower.codegraph.model.ingest.IngestionResult;
import com.purchasingpower.codegraph.model.ingest.StructureValidation;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import com.purchasingpower.codegraph.storage.CodeGraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Graph ingestion over a {@link CodeGraphStore}.
 *
 * <p>The tree walk is iterative: each stack entry carries the store id of its already
 * persisted parent, so a child is only ever linked after its parent exists. Children are
 * pushed in reverse so they come off the stack in extractor order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphIngestionServiceImpl implements GraphIngestionService {

    private final CodeGraphStore graphStore;

    @Override
    public RepositoryNode createRepository(String name) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Repository name is required");

        RepositoryNode repository = graphStore.mergeRepository(name.trim());
        log.info("📁 Repository node ready: {}", repository.getName());
        return repository;
    }

    @Override
    public IngestReport ingest(RepositoryNode repository, ParsedFile file) {
        Preconditions.checkNotNull(repository, "repository");
        Preconditions.checkNotNull(file, "file");

        ParsedNode root = file.toFileNode();
        IngestReport report = new IngestReport(root.getName());

        Deque<PendingNode> stack = new ArrayDeque<>();
        stack.push(new PendingNode(root, repository.getId(), repository.getName(), 0));

        while (!stack.isEmpty()) {
            PendingNode pending = stack.pop();
            ParsedNode data = pending.data();

            Optional<NodeKind> kind = NodeKind.fromExtractorType(data.getType());
            if (kind.isEmpty()) {
                log.warn("⚠️ Skipping unknown node type '{}' ({}) at depth {} in {}",
                        data.getType(), data.getName(), pending.depth(), report.getFileName());
                report.recordSkipped(data.getName(), data.getType(), SkipReason.UNKNOWN_TYPE,
                        "unknown type " + data.getType());
                continue;
            }

            String nodeId = persist(kind.get(), data, report, pending.depth());

            if (nodeId != null) {
                link(pending, nodeId, data.getName(), report);
            }

            List<ParsedNode> children = data.getChildren() != null ? data.getChildren() : List.of();
            for (int i = children.size() - 1; i >= 0; i--) {
                ParsedNode child = children.get(i);
                if (child != null) {
                    stack.push(new PendingNode(child, nodeId, data.getName(), pending.depth() + 1));
                }
            }
        }

        if (!report.isFileNodeCreated()) {
            log.error("❌ File node creation failed for {}", report.getFileName());
        } else if (report.isClean()) {
            log.info("📂 Ingested {}: {} nodes linked under {}",
                    report.getFileName(), report.getPersistedNodes(), repository.getName());
        } else {
            log.warn("⚠️ Ingested {} with problems: {} skipped, {} unlinked, {} link failures",
                    report.getFileName(), report.getSkipped().size(),
                    report.getUnlinked().size(), report.getLinkFailures().size());
        }
        return report;
    }

    private String persist(NodeKind kind, ParsedNode data, IngestReport report, int depth) {
        if (data.getName() == null || data.getName().isBlank()) {
            log.error("❌ Cannot save {} node without a name at depth {} in {}",
                    kind.getTypeName(), depth, report.getFileName());
            report.recordSkipped(data.getName(), data.getType(), SkipReason.PERSISTENCE_FAILURE, "missing name");
            return null;
        }

        int lineno = switch (kind) {
            case FILE -> 0;
            case CLASS, FUNCTION -> data.getLineno();
        };
        boolean async = switch (kind) {
            case FUNCTION -> NodeKind.isAsyncType(data.getType());
            case FILE, CLASS -> false;
        };

        CodeNode node = CodeNode.builder()
                .kind(kind)
                .name(data.getName())
                .lineno(lineno)
                .code(data.getCode() != null ? data.getCode() : "")
                .parameters(data.getParameters() != null ? new ArrayList<>(data.getParameters()) : new ArrayList<>())
                .async(async)
                .parentSourceIdentifier(data.getParent())
                .childrenSourceIdentifiers(data.childNames())
                .build();

        try {
            String id = graphStore.createNode(node);
            report.recordPersisted(kind == NodeKind.FILE);
            log.debug("{}💾 Saved {} node: {}", "  ".repeat(depth), kind.getTypeName(), node.getName());
            return id;
        } catch (RuntimeException e) {
            log.error("❌ Error saving {} node {}: {}", kind.getTypeName(), node.getName(), e.getMessage());
            report.recordSkipped(node.getName(), data.getType(), SkipReason.PERSISTENCE_FAILURE, e.getMessage());
            return null;
        }
    }

    private void link(PendingNode pending, String nodeId, String name, IngestReport report) {
        if (pending.parentId() == null) {
            log.warn("⚠️ Node {} has no persisted parent ({} failed); left unattached",
                    name, pending.parentName());
            report.recordUnlinked(name);
            return;
        }

        try {
            graphStore.createChildEdge(pending.parentId(), nodeId);
            report.recordLinked();
            log.debug("{}🔗 Connected {} → {}", "  ".repeat(pending.depth()), pending.parentName(), name);
        } catch (RuntimeException e) {
            log.error("❌ Could not connect {} → {}: {}", pending.parentName(), name, e.getMessage());
            report.recordLinkFailure(pending.parentName(), name);
        }
    }

    @Override
    public IngestionResult ingestAll(String repositoryName, List<ParsedFile> files) {
        RepositoryNode repository = createRepository(repositoryName);
        List<ParsedFile> safeFiles = files != null ? files : List.of();

        log.info("Starting graph ingestion for repo: {} ({} files)", repository.getName(), safeFiles.size());

        List<IngestReport> reports = new ArrayList<>();
        for (ParsedFile file : safeFiles) {
            if (file != null) {
                reports.add(ingest(repository, file));
            }
        }

        long clean = reports.stream().filter(IngestReport::isClean).count();
        log.info("✅ Graph ingestion complete for {}: {}/{} files clean", repository.getName(), clean, reports.size());

        Optional<StructureValidation> validation = validateStructure(repository.getName());
        if (validation.isEmpty()) {
            log.warn("⚠️ Could not validate structure of {} after ingestion", repository.getName());
        }
        return new IngestionResult(reports, validation);
    }

    @Override
    public Optional<StructureValidation> validateStructure(String repositoryName) {
        if (repositoryName == null || repositoryName.isBlank()) {
            log.error("❌ Cannot validate: repository name not given");
            return Optional.empty();
        }

        try {
            long connected = graphStore.countReachable(repositoryName);
            long orphaned = graphStore.countOrphaned();
            StructureValidation validation = new StructureValidation(connected, orphaned);

            log.info("✅ Repository validation for {}: {} nodes connected, {} orphaned",
                    repositoryName, connected, orphaned);
            if (validation.hasOrphans()) {
                log.warn("⚠️ Found {} orphaned nodes not connected to any repository", orphaned);
            }
            return Optional.of(validation);

        } catch (RuntimeException e) {
            log.error("❌ Structure validation failed for {}: {}", repositoryName, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public long deleteRepository(String repositoryName) {
        Preconditions.checkArgument(repositoryName != null && !repositoryName.isBlank(), "Repository name is required");

        long removed = graphStore.deleteRepository(repositoryName);
        if (removed == 0) {
            log.info("Repository {} not found; nothing deleted", repositoryName);
        } else {
            log.info("🗑️ Deleted repository {} ({} nodes)", repositoryName, removed);
        }
        return removed;
    }

    @Override
    public List<RepositoryNode> listRepositories() {
        return graphStore.findRepositories();
    }

    /**
     * A tree node waiting to be persisted. {@code parentId} is null when the parent failed.
     */
    private record PendingNode(ParsedNode data, String parentId, String parentName, int depth) {
    }
}
