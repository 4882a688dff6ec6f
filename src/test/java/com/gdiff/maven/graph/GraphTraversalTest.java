package com.gdiff.maven.graph;

import static com.gdiff.maven.graph.GraphFixtures.document;
import static com.gdiff.maven.graph.GraphFixtures.group;
import static com.gdiff.maven.graph.GraphFixtures.leaf;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GraphTraversalTest {

    private final GraphDocument document = document(
            group("n0", "A", NodeClass.SPECIES,
                    group("n0::n0", "b", NodeClass.COMPONENT, leaf("n0::n0::n0", "0", NodeClass.STATE)),
                    leaf("n0::n1", "c", NodeClass.COMPONENT)),
            leaf("n1", "B", NodeClass.SPECIES));

    @Test
    void preorder_visitsInDocumentOrder() {
        List<String> paths = new ArrayList<>();
        for (GraphTraversal.Visit visit : GraphTraversal.preorder(document)) {
            paths.add(visit.getPath().toString());
        }
        assertThat(paths).containsExactly("A", "A/b", "A/b/0", "A/c", "B");
    }

    @Test
    void preorder_reportsEnclosingNode() {
        List<String> parents = new ArrayList<>();
        for (GraphTraversal.Visit visit : GraphTraversal.preorder(document)) {
            parents.add(visit.getParent() == null ? "-" : visit.getParent().getLabel());
        }
        assertThat(parents).containsExactly("-", "A", "b", "A", "-");
    }

    @Test
    void preorder_isRestartable() {
        GraphTraversal traversal = GraphTraversal.preorder(document);
        int first = 0;
        for (GraphTraversal.Visit ignored : traversal) {
            first++;
        }
        int second = 0;
        for (GraphTraversal.Visit ignored : traversal) {
            second++;
        }
        assertThat(first).isEqualTo(5).isEqualTo(second).isEqualTo(document.nodeCount());
    }

    @Test
    void preorder_handlesDeepNesting() {
        GraphNode node = leaf(deepId(5000), "leaf", NodeClass.STATE);
        for (int depth = 4999; depth >= 1; depth--) {
            node = group(deepId(depth), "level" + depth, NodeClass.COMPONENT, node);
        }
        int count = 0;
        for (GraphTraversal.Visit ignored : GraphTraversal.preorder(document(node))) {
            count++;
        }
        assertThat(count).isEqualTo(5000);
    }

    @Test
    void iterator_failsWhenExhausted() {
        Iterator<GraphTraversal.Visit> iterator = GraphTraversal.preorder(document(leaf("n0", "A", NodeClass.SPECIES))).iterator();
        iterator.next();
        assertThat(iterator.hasNext()).isFalse();
        Assertions.assertThrows(NoSuchElementException.class, iterator::next);
    }

    private static String deepId(int depth) {
        return "level-" + depth;
    }
}
