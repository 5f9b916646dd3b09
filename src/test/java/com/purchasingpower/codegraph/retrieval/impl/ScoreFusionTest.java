package com.purchasingpower.codegraph.retrieval.impl;

import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.retrieval.NodeKey;
import com.purchasingpower.codegraph.model.retrieval.Relation;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Score fusion")
class ScoreFusionTest {

    @Test
    @DisplayName("Keyword hit on a semantic result is boosted, capped at 1.0 and marked hybrid")
    void keywordReinforcement_capsAtOne() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(result(NodeKind.FUNCTION, "foo", 0.9, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(result(NodeKind.FUNCTION, "foo", 1.0, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(fusion.ranked(5)).singleElement().satisfies(node -> {
            assertThat(node.getScore()).isEqualTo(1.0);
            assertThat(node.getSearchType()).isEqualTo(SearchType.HYBRID);
        });
    }

    @Test
    @DisplayName("New keyword and code results enter with their own weights")
    void newResults_areWeighted() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(result(NodeKind.CLASS, "Parser", 0.55, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(result(NodeKind.FUNCTION, "parse", 1.0, SearchType.GRAPH)), 0.6, 0.3);
        fusion.reinforce(List.of(
                result(NodeKind.FUNCTION, "tokenize", 0.5, SearchType.CODE),
                result(NodeKind.CLASS, "Parser", 0.5, SearchType.CODE)), 0.4, 0.2);

        List<RetrievedNode> ranked = fusion.ranked(10);

        assertThat(ranked).extracting(RetrievedNode::getName).containsExactly("Parser", "parse", "tokenize");
        assertThat(ranked.get(0).getScore()).isCloseTo(0.65, within(1e-9));
        assertThat(ranked.get(0).getSearchType()).isEqualTo(SearchType.HYBRID);
        assertThat(ranked.get(1).getScore()).isCloseTo(0.6, within(1e-9));
        assertThat(ranked.get(1).getSearchType()).isEqualTo(SearchType.GRAPH);
        assertThat(ranked.get(2).getScore()).isCloseTo(0.2, within(1e-9));
        assertThat(ranked.get(2).getSearchType()).isEqualTo(SearchType.CODE);
    }

    @Test
    @DisplayName("Seven disjoint candidates are truncated to k")
    void disjointCandidates_truncatedToK() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(
                result(NodeKind.FUNCTION, "a", 0.95, SearchType.SUMMARY),
                result(NodeKind.FUNCTION, "b", 0.85, SearchType.SUMMARY),
                result(NodeKind.CLASS, "C", 0.75, SearchType.SUMMARY),
                result(NodeKind.FILE, "d.py", 0.65, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(
                result(NodeKind.FUNCTION, "e", 1.0, SearchType.GRAPH),
                result(NodeKind.FUNCTION, "f", 0.5, SearchType.GRAPH),
                result(NodeKind.CLASS, "G", 0.5, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(fusion.size()).isEqualTo(7);
        List<RetrievedNode> ranked = fusion.ranked(5);
        assertThat(ranked).hasSize(5);
        assertThat(ranked).extracting(RetrievedNode::getName).containsExactly("a", "b", "C", "d.py", "e");
    }

    @Test
    @DisplayName("Same name under different kinds stays separate")
    void keyIncludesKind() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(result(NodeKind.CLASS, "Config", 0.8, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(result(NodeKind.FUNCTION, "Config", 0.8, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(fusion.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Duplicates within one strategy count once")
    void duplicatesWithinStrategy_countOnce() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(result(NodeKind.FUNCTION, "foo", 0.5, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(
                result(NodeKind.FUNCTION, "foo", 1.0, SearchType.GRAPH),
                result(NodeKind.FUNCTION, "foo", 1.0, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(fusion.ranked(5).get(0).getScore()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Inputs are not mutated by fusion")
    void inputsAreCopied() {
        RetrievedNode semantic = result(NodeKind.FUNCTION, "foo", 0.9, SearchType.SUMMARY);
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(semantic), 1.0);
        fusion.reinforce(List.of(result(NodeKind.FUNCTION, "foo", 1.0, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(semantic.getScore()).isEqualTo(0.9);
        assertThat(semantic.getSearchType()).isEqualTo(SearchType.SUMMARY);
    }

    @Test
    @DisplayName("Final assembly keeps the first entry per key, sorts and truncates")
    void assemble_deduplicatesAndTruncates() {
        List<RetrievedNode> enriched = List.of(
                result(NodeKind.CLASS, "Foo", 0.7, SearchType.SUMMARY),
                result(NodeKind.FUNCTION, "bar", 0.8, SearchType.RELATED),
                result(NodeKind.FUNCTION, "baz", 0.6, SearchType.GRAPH),
                result(NodeKind.FUNCTION, "bar", 0.6, SearchType.GRAPH));

        List<RetrievedNode> results = ScoreFusion.assemble(enriched, 2);

        assertThat(results).extracting(RetrievedNode::key).containsExactly(
                new NodeKey(NodeKind.FUNCTION, "bar"), new NodeKey(NodeKind.CLASS, "Foo"));
        assertThat(results.get(0).getSearchType()).isEqualTo(SearchType.RELATED);
    }

    @Test
    @DisplayName("A fused result wins over a later, higher-scored neighbour copy of itself")
    void assemble_fusedEntryBeatsNeighbourCopy() {
        RetrievedNode neighbourCopy = result(NodeKind.CLASS, "Worker", 0.7, SearchType.RELATED);
        neighbourCopy.setRelation(Relation.PARENT);
        List<RetrievedNode> enriched = List.of(
                result(NodeKind.CLASS, "Worker", 0.5, SearchType.SUMMARY),
                result(NodeKind.FUNCTION, "helper", 0.45, SearchType.SUMMARY),
                neighbourCopy);

        List<RetrievedNode> results = ScoreFusion.assemble(enriched, 5);

        assertThat(results).extracting(RetrievedNode::getName).containsExactly("Worker", "helper");
        assertThat(results.get(0).getScore()).isEqualTo(0.5);
        assertThat(results.get(0).getSearchType()).isEqualTo(SearchType.SUMMARY);
        assertThat(results.get(0).getRelation()).isNull();
    }

    @Test
    @DisplayName("Scores stay within [0, 1]")
    void scoresAreBounded() {
        ScoreFusion fusion = new ScoreFusion();

        fusion.add(List.of(result(NodeKind.FUNCTION, "hot", 1.4, SearchType.SUMMARY),
                result(NodeKind.FUNCTION, "cold", -0.2, SearchType.SUMMARY)), 1.0);
        fusion.reinforce(List.of(result(NodeKind.FUNCTION, "hot", 1.0, SearchType.GRAPH)), 0.6, 0.3);

        assertThat(fusion.ranked(5)).allSatisfy(node -> assertThat(node.getScore()).isBetween(0.0, 1.0));
    }

    private static RetrievedNode result(NodeKind kind, String name, double score, SearchType searchType) {
        return RetrievedNode.builder()
                .type(kind)
                .name(name)
                .summary("")
                .code("")
                .score(score)
                .searchType(searchType)
                .build();
    }
}
