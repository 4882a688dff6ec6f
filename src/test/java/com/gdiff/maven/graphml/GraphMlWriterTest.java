package com.gdiff.maven.graphml;

import static com.gdiff.maven.graph.GraphFixtures.document;
import static com.gdiff.maven.graph.GraphFixtures.group;
import static com.gdiff.maven.graph.GraphFixtures.leaf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.gdiff.maven.diff.DiffResult;
import com.gdiff.maven.diff.GraphDiffer;
import com.gdiff.maven.diff.GraphMerger;
import com.gdiff.maven.diff.Palette;
import com.gdiff.maven.diff.Provenance;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphEdge;
import com.gdiff.maven.graph.GraphFixtures;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.GraphTraversal;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.MalformedDocumentException;
import com.gdiff.maven.graph.NodeClass;
import com.gdiff.maven.graph.NodeId;
import com.gdiff.maven.graph.PathResolver;

class GraphMlWriterTest {

    private final GraphMlWriter writer = new GraphMlWriter();
    private Path testBaseDir;

    @BeforeEach
    void setUp() throws Exception {
        testBaseDir = Path.of("target/test-output", getClass().getSimpleName(),
                String.valueOf(System.currentTimeMillis()));
        Files.createDirectories(testBaseDir);
    }

    @Test
    void toXml_writesYedRealizers() {
        String xml = writer.toXml(document(
                group("n0", "A", NodeClass.SPECIES, leaf("n0::n0", "b", NodeClass.COMPONENT))));

        assertThat(xml).contains("y:ProxyAutoBoundsNode")
                .contains("y:GroupNode")
                .contains("y:ShapeNode")
                .contains("yfiles.foldertype=\"group\"")
                .contains("attr.name=\"gdiff.nodeClass\"")
                .contains("id=\"n0:\"")
                .contains("fontSize=\"12\"");
    }

    @Test
    void write_readsBackPaintedDocument() throws Exception {
        GraphDocument modelA = GraphFixtures.load("model_a.graphml");
        GraphDocument modelB = GraphFixtures.load("model_b.graphml");
        GraphDocument painted = new GraphDiffer().diff(modelA, modelB, Palette.defaults()).getDocument();
        Path file = testBaseDir.resolve("out/painted.graphml");

        writer.write(painted, file);
        // painted colors are not classification colors; the class travels in its own data entry
        GraphDocument reread = new GraphMlReader().read(file);

        assertThat(describe(reread)).isEqualTo(describe(painted));
        assertThat(reread.getRoot().getEdges()).isEqualTo(painted.getRoot().getEdges());
        assertThat(PathResolver.find(reread, LabelPath.of("A", "b")).orElseThrow().getSubgraph().getId())
                .isEqualTo("n0::n0:");
    }

    @Test
    void write_rejectsEdgeToUnknownNode() {
        GraphDocument broken = document(List.of(new GraphEdge("e0", "n0", "n9")), leaf("n0", "A", NodeClass.SPECIES));

        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> writer.write(broken, testBaseDir.resolve("broken.graphml")));
        assertThat(e.getMessage()).contains("n9");
        assertThat(Files.exists(testBaseDir.resolve("broken.graphml"))).isFalse();
    }

    @Test
    void validateEdges_rejectsEdgeLeavingItsGraph() {
        GraphDocument document = document(
                group("n0", "A", NodeClass.SPECIES, leaf("n0::n0", "b", NodeClass.COMPONENT)),
                leaf("n1", "B", NodeClass.SPECIES));
        GraphDocument nestedEdge = document.withRoot(document.getRoot().withNodes(List.of(
                document.getRoot().getNodes().get(0).withSubgraph(document.getRoot().getNodes().get(0).getSubgraph()
                        .withEdges(List.of(new GraphEdge("e0", "n0::n0", "n1")))),
                document.getRoot().getNodes().get(1))));

        assertThrows(MalformedDocumentException.class, () -> GraphMlWriter.validateEdges(nestedEdge));
    }

    @Test
    void write_roundTripsDeeplyNestedUnion() throws Exception {
        int depth = 2000;
        GraphDocument source = chain(depth, "end");
        GraphDocument other = chain(depth, "other-end");
        Palette palette = Palette.defaults();

        DiffResult union = new GraphMerger().merge(new GraphDiffer().diff(source, other, palette), other, palette);
        Path file = testBaseDir.resolve("deep.graphml");
        writer.write(union.getDocument(), file);
        GraphDocument reread = new GraphMlReader().read(file);

        assertThat(reread.nodeCount()).isEqualTo(depth + 1);
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < depth - 1; i++) {
            labels.add("L" + i);
        }
        labels.add("other-end");
        NodeId inserted = PathResolver.find(reread, LabelPath.of(labels)).orElseThrow().getId();
        assertThat(inserted.depth()).isEqualTo(depth);
        assertThat(inserted.lastIndex()).isEqualTo(1);
        assertThat(union.getProvenance().get(LabelPath.of(labels))).isEqualTo(Provenance.OTHER_ONLY);
    }

    /**
     * A single path of {@code depth} nodes with hierarchical identifiers, built bottom-up.
     */
    private static GraphDocument chain(int depth, String lastLabel) {
        List<NodeId> ids = new ArrayList<>();
        ids.add(NodeId.root(0));
        for (int i = 1; i < depth; i++) {
            ids.add(ids.get(i - 1).child(0));
        }
        GraphNode node = leaf(ids.get(depth - 1).getValue(), lastLabel, NodeClass.COMPONENT);
        for (int i = depth - 2; i >= 0; i--) {
            node = group(ids.get(i).getValue(), "L" + i, NodeClass.SPECIES, node);
        }
        return document(node);
    }

    private static List<String> describe(GraphDocument document) {
        List<String> lines = new ArrayList<>();
        for (GraphTraversal.Visit visit : GraphTraversal.preorder(document)) {
            lines.add(visit.getPath() + " " + visit.getNode().getId() + " " + visit.getNode().getNodeClass()
                    + " " + visit.getNode().getStyle());
        }
        return lines;
    }
}
