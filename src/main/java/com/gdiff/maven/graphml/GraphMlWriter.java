package com.gdiff.maven.graphml;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import com.gdiff.maven.graph.Graph;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphEdge;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.GraphTraversal;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.MalformedDocumentException;

/**
 * Writes {@link GraphDocument}s as yEd-loadable GraphML.
 * <p>
 * Group nodes are written as {@code y:ProxyAutoBoundsNode} realizers, leaves as {@code y:ShapeNode}.
 * Each node also carries its class as a {@code gdiff.nodeClass} data entry so the document can be
 * read back without relying on fill colors.
 */
public class GraphMlWriter {

    private static final String SHAPE_TYPE = "roundrectangle";

    public void write(GraphDocument document, Path path) throws IOException {
        validateEdges(document);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            transform(document, out);
        }
    }

    public void write(GraphDocument document, OutputStream out) throws IOException {
        validateEdges(document);
        transform(document, out);
    }

    private void transform(GraphDocument document, OutputStream out) throws IOException {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance()
                    .createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            writeDocument(new Out(xml), document);
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write GraphML", e);
        }
    }

    public String toXml(GraphDocument document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(document, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Checks that every edge joins nodes inside the graph that declares it, at that level or below.
     *
     * @throws MalformedDocumentException naming the first edge that points elsewhere
     */
    public static void validateEdges(GraphDocument document) {
        Deque<Level> levels = new ArrayDeque<>();
        levels.push(new Level(document.getRoot(), LabelPath.root()));
        while (!levels.isEmpty()) {
            Level level = levels.pop();
            if (!level.graph.getEdges().isEmpty()) {
                Set<String> ids = new HashSet<>();
                for (GraphTraversal.Visit visit : GraphTraversal.preorder(level.graph, level.path)) {
                    ids.add(visit.getNode().getId().getValue());
                }
                for (GraphEdge edge : level.graph.getEdges()) {
                    if (!ids.contains(edge.getSource()) || !ids.contains(edge.getTarget())) {
                        String missing = ids.contains(edge.getSource()) ? edge.getTarget() : edge.getSource();
                        throw new MalformedDocumentException("Edge " + edge.getId() + " references node " + missing
                                + " which is not part of its graph", level.path);
                    }
                }
            }
            for (GraphNode node : level.graph.getNodes()) {
                if (node.hasSubgraph()) {
                    levels.push(new Level(node.getSubgraph(), level.path.append(node.getLabel())));
                }
            }
        }
    }

    private static void writeDocument(Out out, GraphDocument document) throws XMLStreamException {
        out.start("graphml");
        out.xml.writeDefaultNamespace(GraphMl.GRAPHML_NS);
        out.xml.writeNamespace(GraphMl.YWORKS_PREFIX, GraphMl.YWORKS_NS);

        key(out, "node", GraphMl.NODE_GRAPHICS_KEY, "nodegraphics");
        key(out, "edge", GraphMl.EDGE_GRAPHICS_KEY, "edgegraphics");
        out.empty("key");
        out.xml.writeAttribute("attr.name", GraphMl.NODE_CLASS_ATTRIBUTE);
        out.xml.writeAttribute("attr.type", "string");
        out.xml.writeAttribute("for", "node");
        out.xml.writeAttribute("id", GraphMl.NODE_CLASS_KEY);

        Graph root = document.getRoot();
        startGraph(out, root.getId() != null ? root.getId() : "G");

        // each graph element stays open until its nodes are written, nested graphs inside their node
        Deque<Pending> pending = new ArrayDeque<>();
        pending.push(new Pending(root));
        while (!pending.isEmpty()) {
            Pending current = pending.peek();
            if (current.next < current.graph.getNodes().size()) {
                GraphNode node = current.graph.getNodes().get(current.next++);
                startNode(out, node);
                if (node.hasSubgraph()) {
                    Graph subgraph = node.getSubgraph();
                    startGraph(out, subgraph.getId() != null ? subgraph.getId() : node.getId() + ":");
                    pending.push(new Pending(subgraph));
                } else {
                    out.end();
                }
                continue;
            }
            for (GraphEdge edge : current.graph.getEdges()) {
                edge(out, edge);
            }
            out.end();
            pending.pop();
            if (!pending.isEmpty()) {
                out.end(); // node owning the graph just closed
            }
        }
        out.end();
        out.newline(0);
    }

    /**
     * Opens the node element and writes its data entries, leaving it open for a nested graph.
     */
    private static void startNode(Out out, GraphNode node) throws XMLStreamException {
        out.start("node");
        out.xml.writeAttribute("id", node.getId().getValue());
        if (node.hasSubgraph()) {
            out.xml.writeAttribute("yfiles.foldertype", "group");
        }

        out.start("data");
        out.xml.writeAttribute("key", GraphMl.NODE_CLASS_KEY);
        out.xml.writeCharacters(node.getNodeClass().key());
        out.endInline();

        out.start("data");
        out.xml.writeAttribute("key", GraphMl.NODE_GRAPHICS_KEY);
        if (node.hasSubgraph()) {
            out.startY("ProxyAutoBoundsNode");
            out.startY("Realizers");
            out.xml.writeAttribute("active", "0");
            out.startY("GroupNode");
        } else {
            out.startY("ShapeNode");
        }

        out.emptyY("Fill");
        out.xml.writeAttribute("color", node.getStyle().getFillColor());
        out.xml.writeAttribute("transparent", "false");

        out.startY("NodeLabel");
        out.xml.writeAttribute("fontSize", Integer.toString(node.getStyle().getFontSize()));
        if (node.hasSubgraph()) {
            out.xml.writeAttribute("modelName", "internal");
            out.xml.writeAttribute("modelPosition", "t");
        }
        out.xml.writeCharacters(node.getLabel());
        out.endInline();

        out.emptyY("Shape");
        out.xml.writeAttribute("type", SHAPE_TYPE);

        if (node.hasSubgraph()) {
            out.end(); // GroupNode
            out.end(); // Realizers
        }
        out.end(); // ShapeNode or ProxyAutoBoundsNode
        out.end(); // data
    }

    private static void edge(Out out, GraphEdge edge) throws XMLStreamException {
        out.start("edge");
        if (edge.getId() != null) {
            out.xml.writeAttribute("id", edge.getId());
        }
        out.xml.writeAttribute("source", edge.getSource());
        out.xml.writeAttribute("target", edge.getTarget());
        out.start("data");
        out.xml.writeAttribute("key", GraphMl.EDGE_GRAPHICS_KEY);
        out.startY("PolyLineEdge");
        out.emptyY("Arrows");
        out.xml.writeAttribute("source", "none");
        out.xml.writeAttribute("target", "none");
        out.end();
        out.end();
        out.end();
    }

    private static void startGraph(Out out, String id) throws XMLStreamException {
        out.start("graph");
        out.xml.writeAttribute("edgedefault", "directed");
        out.xml.writeAttribute("id", id);
    }

    private static void key(Out out, String target, String id, String yfilesType) throws XMLStreamException {
        out.empty("key");
        out.xml.writeAttribute("for", target);
        out.xml.writeAttribute("id", id);
        out.xml.writeAttribute("yfiles.type", yfilesType);
    }

    /**
     * Stream writer that indents by element depth. Indentation stops growing past {@link #MAX_INDENT}
     * levels so deeply nested documents stay linear in size.
     */
    private static final class Out {
        private static final int MAX_INDENT = 32;

        final XMLStreamWriter xml;
        private int depth;

        Out(XMLStreamWriter xml) {
            this.xml = xml;
        }

        void start(String name) throws XMLStreamException {
            newline(depth++);
            xml.writeStartElement(name);
        }

        void startY(String localName) throws XMLStreamException {
            newline(depth++);
            xml.writeStartElement(GraphMl.YWORKS_PREFIX, localName, GraphMl.YWORKS_NS);
        }

        void empty(String name) throws XMLStreamException {
            newline(depth);
            xml.writeEmptyElement(name);
        }

        void emptyY(String localName) throws XMLStreamException {
            newline(depth);
            xml.writeEmptyElement(GraphMl.YWORKS_PREFIX, localName, GraphMl.YWORKS_NS);
        }

        void end() throws XMLStreamException {
            newline(--depth);
            xml.writeEndElement();
        }

        /**
         * Closes an element holding text, on the same line as the text.
         */
        void endInline() throws XMLStreamException {
            depth--;
            xml.writeEndElement();
        }

        void newline(int level) throws XMLStreamException {
            xml.writeCharacters("\n");
            xml.writeCharacters(" ".repeat(2 * Math.min(level, MAX_INDENT)));
        }
    }

    private static final class Level {
        final Graph graph;
        final LabelPath path;

        Level(Graph graph, LabelPath path) {
            this.graph = graph;
            this.path = path;
        }
    }

    private static final class Pending {
        final Graph graph;
        int next;

        Pending(Graph graph) {
            this.graph = graph;
        }
    }
}
