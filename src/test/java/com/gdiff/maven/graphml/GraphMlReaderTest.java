package com.gdiff.maven.graphml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphEdge;
import com.gdiff.maven.graph.GraphFixtures;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.MalformedDocumentException;
import com.gdiff.maven.graph.NodeClass;
import com.gdiff.maven.graph.PathResolver;
import com.gdiff.maven.graph.UnknownColorClassException;

class GraphMlReaderTest {

    private static final String HEADER = "<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\" "
            + "xmlns:y=\"http://www.yworks.com/xml/graphml\">";

    private final GraphMlReader reader = new GraphMlReader();

    @Test
    void read_buildsCompoundGraph() throws Exception {
        GraphDocument document = GraphFixtures.load("model_a.graphml");

        assertThat(document.getRoot().getId()).isEqualTo("G");
        assertThat(document.getRoot().getNodes()).extracting(GraphNode::getLabel).containsExactly("A", "B");
        assertThat(document.nodeCount()).isEqualTo(7);

        GraphNode a = document.getRoot().getNodes().get(0);
        assertThat(a.getSubgraph().getId()).isEqualTo("n0:");
        assertThat(a.getChildren()).extracting(node -> node.getId().getValue()).containsExactly("n0::n0", "n0::n1");
        assertThat(document.getRoot().getEdges()).containsExactly(new GraphEdge("e0", "n0::n0", "n1::n0"));
    }

    @Test
    void read_classifiesByFillColor() throws Exception {
        GraphDocument document = GraphFixtures.load("model_a.graphml");

        assertThat(PathResolver.find(document, LabelPath.of("A")).orElseThrow().getNodeClass()).isEqualTo(NodeClass.SPECIES);
        assertThat(PathResolver.find(document, LabelPath.of("A", "b")).orElseThrow().getNodeClass()).isEqualTo(NodeClass.COMPONENT);
        GraphNode state = PathResolver.find(document, LabelPath.of("A", "b", "0")).orElseThrow();
        assertThat(state.getNodeClass()).isEqualTo(NodeClass.STATE);
        assertThat(state.getStyle().getFontSize()).isEqualTo(12);
        assertThat(state.hasSubgraph()).isFalse();
    }

    @Test
    void read_prefersExplicitNodeClass() throws Exception {
        String xml = HEADER
                + "<key attr.name=\"gdiff.nodeClass\" attr.type=\"string\" for=\"node\" id=\"k1\"/>"
                + "<graph id=\"G\"><node id=\"n0\"><data key=\"k1\">state</data>"
                + "<data key=\"d6\"><y:ShapeNode><y:Fill color=\"#123456\"/><y:NodeLabel> s </y:NodeLabel></y:ShapeNode></data>"
                + "</node></graph></graphml>";

        GraphNode node = read(xml).getRoot().getNodes().get(0);

        assertThat(node.getNodeClass()).isEqualTo(NodeClass.STATE);
        assertThat(node.getLabel()).isEqualTo("s");
    }

    @Test
    void read_rejectsUnknownColor() {
        String xml = HEADER + "<graph id=\"G\"><node id=\"n0\"><data key=\"d6\"><y:ShapeNode>"
                + "<y:Fill color=\"#ABCDEF\"/><y:NodeLabel>X</y:NodeLabel></y:ShapeNode></data></node></graph></graphml>";

        UnknownColorClassException e = assertThrows(UnknownColorClassException.class, () -> read(xml));
        assertThat(e.getColor()).isEqualTo("#ABCDEF");
        assertThat(e.getLabelPath()).isEqualTo(LabelPath.of("X"));
    }

    @Test
    void read_matchesColorsCaseInsensitively() throws Exception {
        String xml = HEADER + "<graph id=\"G\"><node id=\"n0\"><data key=\"d6\"><y:ShapeNode>"
                + "<y:Fill color=\"#ffcc00\"/><y:NodeLabel>X</y:NodeLabel></y:ShapeNode></data></node></graph></graphml>";

        assertThat(read(xml).getRoot().getNodes().get(0).getNodeClass()).isEqualTo(NodeClass.STATE);
    }

    @Test
    void read_rejectsNodeWithoutProperties() {
        String xml = HEADER + "<graph id=\"G\"><node id=\"n0\"><data key=\"d6\"/></node></graph></graphml>";

        MalformedDocumentException e = assertThrows(MalformedDocumentException.class, () -> read(xml));
        assertThat(e.getMessage()).contains("Can't find properties for node n0");
    }

    @Test
    void read_rejectsNodeWithoutFill() {
        String xml = HEADER + "<graph id=\"G\"><node id=\"n0\"><data key=\"d6\"><y:ShapeNode>"
                + "<y:NodeLabel>X</y:NodeLabel></y:ShapeNode></data></node></graph></graphml>";

        assertThrows(MalformedDocumentException.class, () -> read(xml));
    }

    @Test
    void read_rejectsNonNumericFontSize() {
        String xml = HEADER + "<graph id=\"G\"><node id=\"n0\"><data key=\"d6\"><y:ShapeNode>"
                + "<y:Fill color=\"#D2D2D2\"/><y:NodeLabel fontSize=\"big\">X</y:NodeLabel></y:ShapeNode></data></node></graph></graphml>";

        assertThrows(MalformedDocumentException.class, () -> read(xml));
    }

    @Test
    void read_rejectsBrokenXml() {
        assertThrows(MalformedDocumentException.class, () -> read(HEADER + "<graph id=\"G\">"));
    }

    @Test
    void read_rejectsOtherDocumentTypes() {
        assertThrows(MalformedDocumentException.class, () -> read("<svg/>"));
    }

    private GraphDocument read(String xml) throws IOException {
        return reader.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline.graphml");
    }
}
